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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Mac;

/**
 * Digest algorithms for key derivation and MAC.
 */
public enum DigestAlgorithm {

	SHA1("SHA-1", "HmacSHA1", "1.3.14.3.2.26", 20, 64),
	SHA224("SHA-224", "HmacSHA224", "2.16.840.1.101.3.4.2.4", 28, 64),
	SHA256("SHA-256", "HmacSHA256", "2.16.840.1.101.3.4.2.1", 32, 64),
	SHA384("SHA-384", "HmacSHA384", "2.16.840.1.101.3.4.2.2", 48, 128),
	SHA512("SHA-512", "HmacSHA512", "2.16.840.1.101.3.4.2.3", 64, 128);

	private final String digestName;
	private final String macName;
	private final String oid;
	private final int outputLength;
	private final int blockSize;

	private DigestAlgorithm(String digestName, String macName, String oid, int outputLength, int blockSize) {
		this.digestName = digestName;
		this.macName = macName;
		this.oid = oid;
		this.outputLength = outputLength;
		this.blockSize = blockSize;
	}

	/**
	 * Get JCE name of message digest.
	 * 
	 * @return name of message digest, e.g. "SHA-1"
	 */
	public String getDigestName() {
		return digestName;
	}

	/**
	 * Get JCE name of HMAC.
	 * 
	 * @return name of HMAC, e.g. "HmacSHA1"
	 */
	public String getMacName() {
		return macName;
	}

	public String getOid() {
		return oid;
	}

	/**
	 * Get length of digest output in bytes.
	 * 
	 * @return length of digest
	 */
	public int getOutputLength() {
		return outputLength;
	}

	/**
	 * Get block size of the digest in bytes.
	 * 
	 * Used as "v" of the PKCS#12 key derivation.
	 * 
	 * @return block size
	 */
	public int getBlockSize() {
		return blockSize;
	}

	public MessageDigest createMessageDigest() throws NoSuchAlgorithmException {
		return MessageDigest.getInstance(digestName);
	}

	public Mac createMac() throws NoSuchAlgorithmException {
		return Mac.getInstance(macName);
	}

	/**
	 * Get digest algorithm by oid.
	 * 
	 * @param oid oid of digest algorithm
	 * @return digest algorithm, or {@code null}, if not supported.
	 */
	public static DigestAlgorithm fromOid(String oid) {
		for (DigestAlgorithm algorithm : values()) {
			if (algorithm.oid.equals(oid)) {
				return algorithm;
			}
		}
		return null;
	}
}
