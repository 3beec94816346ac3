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

/**
 * Encrypted private key info of PKCS#8.
 * 
 * <pre>
 * EncryptedPrivateKeyInfo ::= SEQUENCE {
 *    encryptionAlgorithm  AlgorithmIdentifier,
 *    encryptedData        OCTET STRING
 * }
 * </pre>
 */
public final class EncryptedPrivateKeyInfo {

	private final AlgorithmIdentifier algorithm;
	private final byte[] encryptedData;

	public EncryptedPrivateKeyInfo(AlgorithmIdentifier algorithm, byte[] encryptedData) {
		this.algorithm = algorithm;
		this.encryptedData = encryptedData;
	}

	public AlgorithmIdentifier getAlgorithm() {
		return algorithm;
	}

	public byte[] getEncryptedData() {
		return encryptedData;
	}

	public byte[] toByteArray() {
		return Asn1DerEncoder.sequence(algorithm.toByteArray(), Asn1DerEncoder.octetString(encryptedData));
	}

	public static EncryptedPrivateKeyInfo fromDer(byte[] der) throws Pkcs12StructureException {
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			AlgorithmIdentifier algorithm = AlgorithmIdentifier.fromReader(sequence);
			byte[] encryptedData = Asn1DerDecoder.readOctetString(sequence);
			sequence.assertFinished("EncryptedPrivateKeyInfo");
			reader.assertFinished("EncryptedPrivateKeyInfo");
			return new EncryptedPrivateKeyInfo(algorithm, encryptedData);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("EncryptedPrivateKeyInfo", ex);
		}
	}
}
