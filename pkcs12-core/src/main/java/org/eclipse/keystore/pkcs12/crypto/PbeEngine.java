/*******************************************************************************
 * Copyright (c) 2024 Contributors to the Eclipse Foundation.
 *
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v2.0
 * and Eclipse Distribution License v1.0 which accompany this distribution.
 *
 * The Eclipse Public License is available at
 *    http://www.eclipse.org/legal/epl-v20.html
 * and the Eclipse Distribution License is available at
 *    http://www.eclipse.org/org/documents/edl-v10.html.
 *
 * Contributors:
 *    Eclipse Keystore contributors - initial implementation
 *******************************************************************************/
package org.eclipse.keystore.pkcs12.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.AlgorithmParameterSpec;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.RC2ParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.util.Bytes;
import org.eclipse.keystore.pkcs12.Pkcs12Config;
import org.eclipse.keystore.pkcs12.Pkcs12DecryptionException;
import org.eclipse.keystore.pkcs12.Pkcs12Exception;
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.model.AlgorithmIdentifier;
import org.eclipse.keystore.pkcs12.model.PbeParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password based encryption engine of PKCS#12.
 * 
 * Derives key and IV using {@link Pkcs12KeyDerivation} and en- or decrypts
 * using the JCE cipher of the {@link PbeAlgorithm}. The PKCS#7 padding of
 * the block ciphers is applied and checked by this engine.
 */
public class PbeEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(PbeEngine.class);

	private final SecureRandom random;
	/**
	 * Maximum iteration count for decryption.
	 */
	private final int maxIterations;
	/**
	 * Iteration count for encryption.
	 */
	private final int iterations;
	/**
	 * Salt length for encryption.
	 */
	private final int saltLength;

	/**
	 * Create engine.
	 * 
	 * @param config configuration. Uses {@link Pkcs12Config#MAX_ITERATION_COUNT},
	 *            {@link Pkcs12Config#ENCODE_ITERATION_COUNT}, and
	 *            {@link Pkcs12Config#ENCODE_SALT_LENGTH}.
	 * @param random random for salts
	 */
	public PbeEngine(Configuration config, SecureRandom random) {
		if (random == null) {
			throw new NullPointerException("random must not be null!");
		}
		this.random = random;
		this.maxIterations = config.get(Pkcs12Config.MAX_ITERATION_COUNT);
		this.iterations = config.get(Pkcs12Config.ENCODE_ITERATION_COUNT);
		this.saltLength = config.get(Pkcs12Config.ENCODE_SALT_LENGTH);
	}

	/**
	 * Create fresh parameters for encryption.
	 * 
	 * @return parameters with random salt
	 */
	public PbeParameters createParameters() {
		return new PbeParameters(Bytes.createBytes(random, saltLength), iterations);
	}

	/**
	 * Decrypt with the algorithm identifier of the container.
	 * 
	 * @param algorithm algorithm identifier with PBE parameters
	 * @param password password. {@code null} for an absent password.
	 * @param ciphertext ciphertext
	 * @return plaintext
	 * @throws Pkcs12UnsupportedException if the algorithm is not supported or
	 *             the iteration count exceeds the maximum
	 * @throws Pkcs12DecryptionException if the padding is invalid
	 * @throws Pkcs12Exception if the parameters are malformed
	 */
	public byte[] decrypt(AlgorithmIdentifier algorithm, char[] password, byte[] ciphertext) throws Pkcs12Exception {
		PbeAlgorithm pbe = PbeAlgorithm.fromOid(algorithm.getOid());
		if (pbe == null) {
			if (Pkcs12Oids.PBES2.equals(algorithm.getOid())) {
				throw new Pkcs12UnsupportedException("PBES2 encryption not supported!");
			}
			throw new Pkcs12UnsupportedException("Encryption algorithm " + algorithm.getOid() + " not supported!");
		}
		PbeParameters parameters = PbeParameters.fromDer(algorithm.getParameters());
		return decrypt(pbe, parameters, password, ciphertext);
	}

	/**
	 * Decrypt.
	 * 
	 * @param algorithm encryption algorithm
	 * @param parameters salt and iteration count
	 * @param password password. {@code null} for an absent password.
	 * @param ciphertext ciphertext
	 * @return plaintext
	 * @throws Pkcs12UnsupportedException if the iteration count exceeds the
	 *             maximum, or the cipher is not available
	 * @throws Pkcs12DecryptionException if the padding is invalid
	 */
	public byte[] decrypt(PbeAlgorithm algorithm, PbeParameters parameters, char[] password, byte[] ciphertext)
			throws Pkcs12UnsupportedException, Pkcs12DecryptionException {
		checkIterations(parameters.getIterations());
		int blockSize = algorithm.getBlockSize();
		if (blockSize > 0 && (ciphertext.length == 0 || ciphertext.length % blockSize != 0)) {
			throw new Pkcs12DecryptionException(
					"Ciphertext length " + ciphertext.length + " doesn't match block size " + blockSize + "!");
		}
		LOGGER.debug("decrypt {} bytes with {}, {}", ciphertext.length, algorithm, parameters);
		byte[] plaintext = crypt(Cipher.DECRYPT_MODE, algorithm, parameters, password, ciphertext);
		if (blockSize > 0) {
			int length = unpad(plaintext, blockSize);
			if (length < 0) {
				Bytes.clear(plaintext);
				throw new Pkcs12DecryptionException("Invalid padding, wrong password?");
			}
			byte[] unpadded = new byte[length];
			System.arraycopy(plaintext, 0, unpadded, 0, length);
			Bytes.clear(plaintext);
			plaintext = unpadded;
		}
		return plaintext;
	}

	/**
	 * Encrypt.
	 * 
	 * @param algorithm encryption algorithm
	 * @param parameters salt and iteration count
	 * @param password password. {@code null} for an absent password.
	 * @param plaintext plaintext
	 * @return ciphertext
	 * @throws Pkcs12UnsupportedException if the cipher is not available
	 * @see #createParameters()
	 */
	public byte[] encrypt(PbeAlgorithm algorithm, PbeParameters parameters, char[] password, byte[] plaintext)
			throws Pkcs12UnsupportedException {
		int blockSize = algorithm.getBlockSize();
		byte[] input = plaintext;
		if (blockSize > 0) {
			int pad = blockSize - plaintext.length % blockSize;
			input = new byte[plaintext.length + pad];
			System.arraycopy(plaintext, 0, input, 0, plaintext.length);
			for (int index = plaintext.length; index < input.length; ++index) {
				input[index] = (byte) pad;
			}
		}
		try {
			return crypt(Cipher.ENCRYPT_MODE, algorithm, parameters, password, input);
		} finally {
			if (input != plaintext) {
				Bytes.clear(input);
			}
		}
	}

	private byte[] crypt(int mode, PbeAlgorithm algorithm, PbeParameters parameters, char[] password,
			byte[] input) throws Pkcs12UnsupportedException {
		byte[] key = null;
		byte[] iv = null;
		try {
			key = Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, password, parameters.getSalt(),
					parameters.getIterations(), Pkcs12KeyDerivation.KEY_MATERIAL, algorithm.getKeyLength());
			if (algorithm == PbeAlgorithm.PBE_SHA1_2DES) {
				// k1 k2 k1
				byte[] expanded = new byte[24];
				System.arraycopy(key, 0, expanded, 0, 16);
				System.arraycopy(key, 0, expanded, 16, 8);
				Bytes.clear(key);
				key = expanded;
			}
			Cipher cipher = Cipher.getInstance(algorithm.getTransformation());
			SecretKeySpec keySpec = new SecretKeySpec(key, algorithm.getKeyAlgorithm());
			if (algorithm.isStreamCipher()) {
				cipher.init(mode, keySpec);
			} else {
				iv = Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, password, parameters.getSalt(),
						parameters.getIterations(), Pkcs12KeyDerivation.IV_MATERIAL, algorithm.getBlockSize());
				AlgorithmParameterSpec spec;
				if (algorithm.getEffectiveKeyBits() > 0) {
					spec = new RC2ParameterSpec(algorithm.getEffectiveKeyBits(), iv);
				} else {
					spec = new IvParameterSpec(iv);
				}
				cipher.init(mode, keySpec, spec);
			}
			return cipher.doFinal(input);
		} catch (GeneralSecurityException ex) {
			throw new Pkcs12UnsupportedException(
					"Cipher " + algorithm.getTransformation() + " not available: " + ex.getMessage(), ex);
		} finally {
			Bytes.clear(key);
			Bytes.clear(iv);
		}
	}

	/**
	 * Check PKCS#7 padding.
	 * 
	 * All bytes of the last block are processed, independent of the padding
	 * value.
	 * 
	 * @param plaintext padded plaintext. At least one block.
	 * @param blockSize block size
	 * @return length of plaintext without padding, or {@code -1}, if the
	 *         padding is invalid.
	 */
	static int unpad(byte[] plaintext, int blockSize) {
		int length = plaintext.length;
		int pad = plaintext[length - 1] & 0xff;
		int invalid = (pad == 0 || pad > blockSize) ? 1 : 0;
		for (int index = 1; index <= blockSize; ++index) {
			int mask = index <= pad ? 0xff : 0;
			invalid |= ((plaintext[length - index] & 0xff) ^ pad) & mask;
		}
		return invalid == 0 ? length - pad : -1;
	}

	private void checkIterations(int iterationCount) throws Pkcs12UnsupportedException {
		if (iterationCount < 1 || iterationCount > maxIterations) {
			throw new Pkcs12UnsupportedException(
					"Iteration count " + iterationCount + " exceeds supported range [1.." + maxIterations + "]!");
		}
	}
}
