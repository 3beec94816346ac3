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

/**
 * Password based encryption suites of PKCS#12.
 * 
 * All suites use SHA-1 for the key derivation.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7292#appendix-C" target="_blank">RFC 7292, Appendix C</a>
 */
public enum PbeAlgorithm {

	/**
	 * pbeWithSHAAnd128BitRC4.
	 */
	PBE_SHA1_RC4_128("1.2.840.113549.1.12.1.1", "ARCFOUR", "ARCFOUR", 16, 0, 0),
	/**
	 * pbeWithSHAAnd40BitRC4.
	 */
	PBE_SHA1_RC4_40("1.2.840.113549.1.12.1.2", "ARCFOUR", "ARCFOUR", 5, 0, 0),
	/**
	 * pbeWithSHAAnd3-KeyTripleDES-CBC.
	 */
	PBE_SHA1_3DES("1.2.840.113549.1.12.1.3", "DESede/CBC/NoPadding", "DESede", 24, 8, 0),
	/**
	 * pbeWithSHAAnd2-KeyTripleDES-CBC. The derived 16 bytes key is expanded to
	 * k1 k2 k1.
	 */
	PBE_SHA1_2DES("1.2.840.113549.1.12.1.4", "DESede/CBC/NoPadding", "DESede", 16, 8, 0),
	/**
	 * pbeWithSHAAnd128BitRC2-CBC.
	 */
	PBE_SHA1_RC2_128("1.2.840.113549.1.12.1.5", "RC2/CBC/NoPadding", "RC2", 16, 8, 128),
	/**
	 * pbeWithSHAAnd40BitRC2-CBC.
	 */
	PBE_SHA1_RC2_40("1.2.840.113549.1.12.1.6", "RC2/CBC/NoPadding", "RC2", 5, 8, 40);

	private final String oid;
	private final String transformation;
	private final String keyAlgorithm;
	private final int keyLength;
	private final int blockSize;
	private final int effectiveKeyBits;

	private PbeAlgorithm(String oid, String transformation, String keyAlgorithm, int keyLength, int blockSize,
			int effectiveKeyBits) {
		this.oid = oid;
		this.transformation = transformation;
		this.keyAlgorithm = keyAlgorithm;
		this.keyLength = keyLength;
		this.blockSize = blockSize;
		this.effectiveKeyBits = effectiveKeyBits;
	}

	public String getOid() {
		return oid;
	}

	/**
	 * Get JCE transformation.
	 * 
	 * Block ciphers are used without padding, the padding is applied and
	 * checked by {@link PbeEngine}.
	 * 
	 * @return transformation
	 */
	public String getTransformation() {
		return transformation;
	}

	public String getKeyAlgorithm() {
		return keyAlgorithm;
	}

	/**
	 * Get length of derived key in bytes.
	 * 
	 * @return key length
	 */
	public int getKeyLength() {
		return keyLength;
	}

	/**
	 * Get block size. Equals the length of the IV.
	 * 
	 * @return block size in bytes, {@code 0} for stream ciphers.
	 */
	public int getBlockSize() {
		return blockSize;
	}

	/**
	 * Get RC2 effective key bits.
	 * 
	 * @return effective key bits, {@code 0} for other ciphers.
	 */
	public int getEffectiveKeyBits() {
		return effectiveKeyBits;
	}

	public boolean isStreamCipher() {
		return blockSize == 0;
	}

	/**
	 * Get algorithm by oid.
	 * 
	 * @param oid oid of algorithm
	 * @return algorithm, or {@code null}, if not supported.
	 */
	public static PbeAlgorithm fromOid(String oid) {
		for (PbeAlgorithm algorithm : values()) {
			if (algorithm.oid.equals(oid)) {
				return algorithm;
			}
		}
		return null;
	}
}
