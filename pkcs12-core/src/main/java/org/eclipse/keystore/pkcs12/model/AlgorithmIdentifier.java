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

import java.util.Arrays;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;

/**
 * Algorithm identifier.
 * 
 * <pre>
 * AlgorithmIdentifier ::= SEQUENCE {
 *    algorithm   OBJECT IDENTIFIER,
 *    parameters  ANY DEFINED BY algorithm OPTIONAL
 * }
 * </pre>
 */
public final class AlgorithmIdentifier {

	private final String oid;
	/**
	 * DER encoded parameters. {@code null}, if absent.
	 */
	private final byte[] parameters;

	public AlgorithmIdentifier(String oid, byte[] parameters) {
		if (oid == null) {
			throw new NullPointerException("OID must not be null!");
		}
		this.oid = oid;
		this.parameters = parameters;
	}

	public String getOid() {
		return oid;
	}

	/**
	 * Get DER encoded parameters.
	 * 
	 * @return parameters, or {@code null}, if absent.
	 */
	public byte[] getParameters() {
		return parameters;
	}

	public byte[] toByteArray() {
		if (parameters == null) {
			return Asn1DerEncoder.sequence(Asn1DerEncoder.oid(oid));
		}
		return Asn1DerEncoder.sequence(Asn1DerEncoder.oid(oid), parameters);
	}

	@Override
	public String toString() {
		return oid;
	}

	@Override
	public int hashCode() {
		return oid.hashCode() * 31 + Arrays.hashCode(parameters);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		AlgorithmIdentifier other = (AlgorithmIdentifier) obj;
		return oid.equals(other.oid) && Arrays.equals(parameters, other.parameters);
	}

	/**
	 * Read algorithm identifier.
	 * 
	 * @param reader reader with the DER encoded algorithm identifier
	 * @return algorithm identifier
	 * @throws Pkcs12StructureException if the algorithm identifier is
	 *             malformed
	 */
	public static AlgorithmIdentifier fromReader(ByteReader reader) throws Pkcs12StructureException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			String oid = Asn1DerDecoder.readOidString(sequence);
			byte[] parameters = null;
			if (sequence.bytesAvailable()) {
				parameters = Asn1DerDecoder.readEntity(sequence);
			}
			sequence.assertFinished("AlgorithmIdentifier");
			return new AlgorithmIdentifier(oid, parameters);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("AlgorithmIdentifier", ex);
		}
	}
}
