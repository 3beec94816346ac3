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
import java.security.MessageDigest;

import org.eclipse.keystore.elements.util.Bytes;

/**
 * Key derivation of PKCS#12.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7292#appendix-B" target="_blank">RFC 7292, Appendix B</a>
 */
public final class Pkcs12KeyDerivation {

	/**
	 * Purpose id for encryption keys.
	 */
	public static final int KEY_MATERIAL = 1;
	/**
	 * Purpose id for initialization vectors.
	 */
	public static final int IV_MATERIAL = 2;
	/**
	 * Purpose id for MAC keys.
	 */
	public static final int MAC_MATERIAL = 3;

	private Pkcs12KeyDerivation() {
	}

	/**
	 * Convert password into BMPString bytes with trailing 0x0000.
	 * 
	 * @param password password. {@code null} for an absent password.
	 * @return password bytes. Empty for an absent password, two 0 bytes for an
	 *         empty password.
	 */
	public static byte[] passwordToBytes(char[] password) {
		if (password == null) {
			return Bytes.EMPTY;
		}
		byte[] bytes = new byte[(password.length + 1) * 2];
		for (int index = 0; index < password.length; ++index) {
			bytes[index * 2] = (byte) (password[index] >>> 8);
			bytes[index * 2 + 1] = (byte) password[index];
		}
		return bytes;
	}

	/**
	 * Derive key material.
	 * 
	 * @param digest digest algorithm
	 * @param password password. {@code null} for an absent password.
	 * @param salt salt
	 * @param iterations iteration count. At least 1.
	 * @param purpose purpose id, {@link #KEY_MATERIAL}, {@link #IV_MATERIAL},
	 *            or {@link #MAC_MATERIAL}.
	 * @param length number of bytes to derive
	 * @return derived bytes
	 * @throws GeneralSecurityException if the digest is not available
	 * @throws IllegalArgumentException if iterations or length is less than 1
	 */
	public static byte[] derive(DigestAlgorithm digest, char[] password, byte[] salt, int iterations, int purpose,
			int length) throws GeneralSecurityException {
		if (iterations < 1) {
			throw new IllegalArgumentException("iterations " + iterations + " must be at least 1!");
		}
		if (length < 1) {
			throw new IllegalArgumentException("length " + length + " must be at least 1!");
		}
		byte[] passwordBytes = passwordToBytes(password);
		try {
			return derive(digest, passwordBytes, salt, iterations, purpose, length);
		} finally {
			Bytes.clear(passwordBytes);
		}
	}

	private static byte[] derive(DigestAlgorithm digest, byte[] password, byte[] salt, int iterations,
			int purpose, int length) throws GeneralSecurityException {
		MessageDigest md = digest.createMessageDigest();
		int u = digest.getOutputLength();
		int v = digest.getBlockSize();

		byte[] diversifier = new byte[v];
		for (int index = 0; index < v; ++index) {
			diversifier[index] = (byte) purpose;
		}
		byte[] saltBlock = new byte[v * ((salt.length + v - 1) / v)];
		Bytes.fillRepeated(salt, saltBlock);
		byte[] passwordBlock = new byte[v * ((password.length + v - 1) / v)];
		Bytes.fillRepeated(password, passwordBlock);
		byte[] input = Bytes.concatenate(saltBlock, passwordBlock);
		Bytes.clear(passwordBlock);

		byte[] result = new byte[length];
		byte[] expansion = new byte[v];
		int rounds = (length + u - 1) / u;
		try {
			for (int round = 0; round < rounds; ++round) {
				md.update(diversifier);
				md.update(input);
				byte[] a = md.digest();
				for (int iteration = 1; iteration < iterations; ++iteration) {
					a = md.digest(a);
				}
				int offset = round * u;
				System.arraycopy(a, 0, result, offset, Math.min(u, length - offset));
				if (round + 1 < rounds) {
					Bytes.fillRepeated(a, expansion);
					for (int block = 0; block < input.length; block += v) {
						addPlusOne(input, block, expansion);
					}
				}
				Bytes.clear(a);
			}
		} finally {
			Bytes.clear(input);
			Bytes.clear(expansion);
		}
		return result;
	}

	/**
	 * Add expansion and 1 to a block of the input, modulo 2^(8v).
	 * 
	 * @param input input
	 * @param offset offset of the block
	 * @param expansion expansion of the block size
	 */
	private static void addPlusOne(byte[] input, int offset, byte[] expansion) {
		int carry = 1;
		for (int index = expansion.length - 1; index >= 0; --index) {
			carry += (input[offset + index] & 0xff) + (expansion[index] & 0xff);
			input[offset + index] = (byte) carry;
			carry >>>= 8;
		}
	}
}
