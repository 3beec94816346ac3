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
package org.eclipse.keystore.pkcs12.model;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.crypto.DigestAlgorithm;

/**
 * MAC data of a PFX.
 * 
 * <pre>
 * MacData ::= SEQUENCE {
 *    mac         DigestInfo,
 *    macSalt     OCTET STRING,
 *    iterations  INTEGER DEFAULT 1
 * }
 * DigestInfo ::= SEQUENCE {
 *    digestAlgorithm  AlgorithmIdentifier,
 *    digest           OCTET STRING
 * }
 * </pre>
 */
public final class MacData {

	private final AlgorithmIdentifier digestAlgorithm;
	private final byte[] digest;
	private final byte[] salt;
	private final int iterations;

	public MacData(AlgorithmIdentifier digestAlgorithm, byte[] digest, byte[] salt, int iterations) {
		this.digestAlgorithm = digestAlgorithm;
		this.digest = digest;
		this.salt = salt;
		this.iterations = iterations;
	}

	public AlgorithmIdentifier getDigestAlgorithm() {
		return digestAlgorithm;
	}

	public byte[] getDigest() {
		return digest;
	}

	public byte[] getSalt() {
		return salt;
	}

	public int getIterations() {
		return iterations;
	}

	public byte[] toByteArray() {
		byte[] digestInfo = Asn1DerEncoder.sequence(digestAlgorithm.toByteArray(),
				Asn1DerEncoder.octetString(digest));
		if (iterations == 1) {
			// DEFAULT value is omitted in DER
			return Asn1DerEncoder.sequence(digestInfo, Asn1DerEncoder.octetString(salt));
		}
		return Asn1DerEncoder.sequence(digestInfo, Asn1DerEncoder.octetString(salt),
				Asn1DerEncoder.integer(iterations));
	}

	/**
	 * Read MAC data.
	 * 
	 * @param reader reader with DER encoded MAC data
	 * @return MAC data
	 * @throws Pkcs12StructureException if the MAC data is malformed, or the
	 *             length of the digest doesn't match the digest algorithm.
	 */
	public static MacData fromReader(ByteReader reader) throws Pkcs12StructureException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			ByteReader digestInfo = Asn1DerDecoder.readSequence(sequence);
			AlgorithmIdentifier digestAlgorithm = AlgorithmIdentifier.fromReader(digestInfo);
			byte[] digest = Asn1DerDecoder.readOctetString(digestInfo);
			byte[] salt = Asn1DerDecoder.readOctetString(sequence);
			int iterations = 1;
			if (Asn1DerDecoder.peekTag(sequence) == Asn1DerDecoder.TAG_INTEGER) {
				iterations = Asn1DerDecoder.readInteger(sequence);
			}
			DigestAlgorithm algorithm = DigestAlgorithm.fromOid(digestAlgorithm.getOid());
			if (algorithm != null && algorithm.getOutputLength() != digest.length) {
				throw new Pkcs12StructureException("MacData digest has " + digest.length + " bytes, "
						+ algorithm.getDigestName() + " requires " + algorithm.getOutputLength() + " bytes!");
			}
			return new MacData(digestAlgorithm, digest, salt, iterations);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("MacData", ex);
		}
	}
}
