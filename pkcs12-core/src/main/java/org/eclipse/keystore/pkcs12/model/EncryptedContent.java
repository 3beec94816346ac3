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
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;

/**
 * Encrypted data of PKCS#7.
 * 
 * <pre>
 * EncryptedData ::= SEQUENCE {
 *    version               INTEGER,
 *    encryptedContentInfo  EncryptedContentInfo
 * }
 * EncryptedContentInfo ::= SEQUENCE {
 *    contentType                 OBJECT IDENTIFIER,
 *    contentEncryptionAlgorithm  AlgorithmIdentifier,
 *    encryptedContent            [0] IMPLICIT OCTET STRING OPTIONAL
 * }
 * </pre>
 * 
 * Only the content type data is supported. The encrypted content is accepted
 * in primitive and constructed encoding.
 */
public final class EncryptedContent {

	private final int version;
	private final AlgorithmIdentifier algorithm;
	private final byte[] ciphertext;

	public EncryptedContent(AlgorithmIdentifier algorithm, byte[] ciphertext) {
		this(0, algorithm, ciphertext);
	}

	public EncryptedContent(int version, AlgorithmIdentifier algorithm, byte[] ciphertext) {
		this.version = version;
		this.algorithm = algorithm;
		this.ciphertext = ciphertext;
	}

	public int getVersion() {
		return version;
	}

	public AlgorithmIdentifier getAlgorithm() {
		return algorithm;
	}

	public byte[] getCiphertext() {
		return ciphertext;
	}

	public byte[] toByteArray() {
		byte[] encryptedContentInfo = Asn1DerEncoder.sequence(Asn1DerEncoder.oid(Pkcs12Oids.DATA),
				algorithm.toByteArray(), Asn1DerEncoder.implicitOctets(0, ciphertext));
		return Asn1DerEncoder.sequence(Asn1DerEncoder.integer(version), encryptedContentInfo);
	}

	/**
	 * Read encrypted data.
	 * 
	 * @param reader reader with DER encoded encrypted data
	 * @return encrypted content
	 * @throws Pkcs12StructureException if the encrypted data is malformed
	 * @throws Pkcs12UnsupportedException if the content type is not data
	 */
	public static EncryptedContent fromReader(ByteReader reader)
			throws Pkcs12StructureException, Pkcs12UnsupportedException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			int version = Asn1DerDecoder.readInteger(sequence);
			ByteReader info = Asn1DerDecoder.readSequence(sequence);
			String contentType = Asn1DerDecoder.readOidString(info);
			if (!Pkcs12Oids.DATA.equals(contentType)) {
				throw new Pkcs12UnsupportedException("Encrypted content type " + contentType + " not supported!");
			}
			AlgorithmIdentifier algorithm = AlgorithmIdentifier.fromReader(info);
			if (!info.bytesAvailable()) {
				throw new Pkcs12StructureException("Missing encrypted content!");
			}
			byte[] ciphertext = Asn1DerDecoder.readImplicitOctets(info, 0);
			return new EncryptedContent(version, algorithm, ciphertext);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("EncryptedData", ex);
		}
	}
}
