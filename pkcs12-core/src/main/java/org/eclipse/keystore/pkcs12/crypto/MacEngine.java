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
import java.security.SecureRandom;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.Bytes;
import org.eclipse.keystore.pkcs12.Pkcs12Config;
import org.eclipse.keystore.pkcs12.Pkcs12IntegrityException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.model.AlgorithmIdentifier;
import org.eclipse.keystore.pkcs12.model.MacData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MAC engine of PKCS#12.
 * 
 * The MAC key is derived using {@link Pkcs12KeyDerivation} with purpose
 * {@link Pkcs12KeyDerivation#MAC_MATERIAL} and the length of the digest. The
 * HMAC is calculated over the octets of the authenticated safe.
 */
public class MacEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(MacEngine.class);

	private final SecureRandom random;
	private final int maxIterations;
	private final DigestAlgorithm algorithm;
	private final int iterations;
	private final int saltLength;

	/**
	 * Create engine.
	 * 
	 * @param config configuration. Uses {@link Pkcs12Config#MAX_ITERATION_COUNT},
	 *            {@link Pkcs12Config#MAC_ALGORITHM},
	 *            {@link Pkcs12Config#ENCODE_MAC_ITERATION_COUNT}, and
	 *            {@link Pkcs12Config#ENCODE_SALT_LENGTH}.
	 * @param random random for salts
	 */
	public MacEngine(Configuration config, SecureRandom random) {
		if (random == null) {
			throw new NullPointerException("random must not be null!");
		}
		this.random = random;
		this.maxIterations = config.get(Pkcs12Config.MAX_ITERATION_COUNT);
		this.algorithm = config.get(Pkcs12Config.MAC_ALGORITHM);
		this.iterations = config.get(Pkcs12Config.ENCODE_MAC_ITERATION_COUNT);
		this.saltLength = config.get(Pkcs12Config.ENCODE_SALT_LENGTH);
	}

	/**
	 * Verify MAC.
	 * 
	 * If the password is empty and the verification fails, the verification
	 * is retried with an absent password. Some producers use the absent
	 * password, if no password is provided.
	 * 
	 * @param macData MAC data of the container
	 * @param password password. {@code null} for an absent password.
	 * @param authSafe octets of the authenticated safe
	 * @return password variant, which verified the MAC. Either the provided
	 *         password, or {@code null}, if the absent password matches.
	 * @throws Pkcs12UnsupportedException if the digest algorithm is not
	 *             supported or the iteration count exceeds the maximum
	 * @throws Pkcs12IntegrityException if the MAC doesn't match
	 */
	public char[] verify(MacData macData, char[] password, byte[] authSafe)
			throws Pkcs12UnsupportedException, Pkcs12IntegrityException {
		String oid = macData.getDigestAlgorithm().getOid();
		DigestAlgorithm digest = DigestAlgorithm.fromOid(oid);
		if (digest == null) {
			throw new Pkcs12UnsupportedException("MAC digest algorithm " + oid + " not supported!");
		}
		int iterationCount = macData.getIterations();
		if (iterationCount < 1 || iterationCount > maxIterations) {
			throw new Pkcs12UnsupportedException(
					"MAC iteration count " + iterationCount + " exceeds supported range [1.." + maxIterations + "]!");
		}
		if (matches(digest, macData, password, authSafe)) {
			LOGGER.debug("MAC {} verified", digest);
			return password;
		}
		if (password != null && password.length == 0 && matches(digest, macData, null, authSafe)) {
			LOGGER.warn("MAC verified with absent password instead of the empty one.");
			return null;
		}
		throw new Pkcs12IntegrityException("MAC verification failed, wrong password or tampered container!");
	}

	/**
	 * Create MAC data with a fresh salt.
	 * 
	 * @param password password. {@code null} for an absent password.
	 * @param authSafe octets of the authenticated safe
	 * @return MAC data
	 * @throws Pkcs12UnsupportedException if the HMAC is not available
	 */
	public MacData create(char[] password, byte[] authSafe) throws Pkcs12UnsupportedException {
		byte[] salt = Bytes.createBytes(random, saltLength);
		byte[] mac = calculate(algorithm, password, salt, iterations, authSafe);
		AlgorithmIdentifier digestAlgorithm = new AlgorithmIdentifier(algorithm.getOid(), Asn1DerEncoder.nullEntity());
		return new MacData(digestAlgorithm, mac, salt, iterations);
	}

	/**
	 * Calculate MAC.
	 * 
	 * @param digest digest algorithm
	 * @param password password. {@code null} for an absent password.
	 * @param salt MAC salt
	 * @param iterationCount iteration count
	 * @param data data to calculate the MAC for
	 * @return MAC
	 * @throws Pkcs12UnsupportedException if the HMAC is not available
	 */
	public static byte[] calculate(DigestAlgorithm digest, char[] password, byte[] salt, int iterationCount,
			byte[] data) throws Pkcs12UnsupportedException {
		byte[] key = null;
		try {
			key = Pkcs12KeyDerivation.derive(digest, password, salt, iterationCount,
					Pkcs12KeyDerivation.MAC_MATERIAL, digest.getOutputLength());
			Mac mac = digest.createMac();
			mac.init(new SecretKeySpec(key, digest.getMacName()));
			return mac.doFinal(data);
		} catch (GeneralSecurityException ex) {
			throw new Pkcs12UnsupportedException(digest.getMacName() + " not available: " + ex.getMessage(), ex);
		} finally {
			Bytes.clear(key);
		}
	}

	private static boolean matches(DigestAlgorithm digest, MacData macData, char[] password, byte[] authSafe)
			throws Pkcs12UnsupportedException {
		byte[] mac = calculate(digest, password, macData.getSalt(), macData.getIterations(), authSafe);
		return MessageDigest.isEqual(mac, macData.getDigest());
	}
}
