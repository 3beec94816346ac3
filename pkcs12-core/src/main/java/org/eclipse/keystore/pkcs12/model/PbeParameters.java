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
import org.eclipse.keystore.elements.util.StringUtil;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;

/**
 * Parameters of the PKCS#12 password based encryption.
 * 
 * <pre>
 * pkcs-12PbeParams ::= SEQUENCE {
 *    salt        OCTET STRING,
 *    iterations  INTEGER
 * }
 * </pre>
 */
public final class PbeParameters {

	private final byte[] salt;
	private final int iterations;

	public PbeParameters(byte[] salt, int iterations) {
		if (salt == null) {
			throw new NullPointerException("salt must not be null!");
		}
		this.salt = salt;
		this.iterations = iterations;
	}

	public byte[] getSalt() {
		return salt;
	}

	public int getIterations() {
		return iterations;
	}

	public byte[] toByteArray() {
		return Asn1DerEncoder.sequence(Asn1DerEncoder.octetString(salt), Asn1DerEncoder.integer(iterations));
	}

	@Override
	public String toString() {
		return "salt " + StringUtil.byteArray2Hex(salt) + ", " + iterations + " iterations";
	}

	/**
	 * Decode parameters.
	 * 
	 * @param der DER encoded parameters
	 * @return parameters
	 * @throws Pkcs12StructureException if the parameters are missing or
	 *             malformed
	 */
	public static PbeParameters fromDer(byte[] der) throws Pkcs12StructureException {
		if (der == null) {
			throw new Pkcs12StructureException("Missing PBE parameters!");
		}
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			byte[] salt = Asn1DerDecoder.readOctetString(sequence);
			int iterations = Asn1DerDecoder.readInteger(sequence);
			reader.assertFinished("PBE parameters");
			return new PbeParameters(salt, iterations);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("PBE parameters", ex);
		}
	}
}
