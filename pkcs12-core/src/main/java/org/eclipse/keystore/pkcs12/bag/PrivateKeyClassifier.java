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
package org.eclipse.keystore.pkcs12.bag;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.EntryType;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;

/**
 * Classify DER encoded private keys.
 * 
 * <pre>
 * PrivateKeyInfo ::= SEQUENCE {
 *    version             INTEGER (0 or 1),
 *    privateKeyAlgorithm AlgorithmIdentifier,
 *    ...
 * }
 * RSAPrivateKey ::= SEQUENCE {
 *    version             INTEGER (0),
 *    modulus             INTEGER,
 *    ...
 * }
 * ECPrivateKey ::= SEQUENCE {
 *    version             INTEGER (1),
 *    privateKey          OCTET STRING,
 *    ...
 * }
 * </pre>
 */
public final class PrivateKeyClassifier {

	private PrivateKeyClassifier() {
	}

	/**
	 * Classify private key.
	 * 
	 * Only the header of the key is inspected.
	 * 
	 * @param der DER encoded private key
	 * @return type of private key
	 * @throws Pkcs12StructureException if the key doesn't match any of the
	 *             supported formats
	 */
	public static EntryType classify(byte[] der) throws Pkcs12StructureException {
		int version;
		int tag;
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			reader.assertFinished("private key");
			version = Asn1DerDecoder.readInteger(sequence);
			tag = Asn1DerDecoder.peekTag(sequence);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("private key", ex);
		}
		if (tag == Asn1DerDecoder.TAG_SEQUENCE && (version == 0 || version == 1)) {
			return EntryType.PRIVATE_KEY_PKCS8;
		} else if (tag == Asn1DerDecoder.TAG_INTEGER && version == 0) {
			return EntryType.PRIVATE_KEY_LEGACY;
		} else if (tag == Asn1DerDecoder.TAG_OCTET_STRING && version == 1) {
			return EntryType.EC_PRIVATE_KEY;
		}
		throw new Pkcs12StructureException(
				"Unknown private key format, version " + version + ", tag " + String.format("0x%02x", tag) + "!");
	}
}
