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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;

/**
 * Attribute of a safe bag.
 * 
 * <pre>
 * PKCS12Attribute ::= SEQUENCE {
 *    attrId      OBJECT IDENTIFIER,
 *    attrValues  SET OF ANY
 * }
 * </pre>
 */
public final class BagAttribute {

	private final String oid;
	/**
	 * DER encoded values.
	 */
	private final List<byte[]> values;

	public BagAttribute(String oid, List<byte[]> values) {
		if (oid == null) {
			throw new NullPointerException("OID must not be null!");
		}
		this.oid = oid;
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	public String getOid() {
		return oid;
	}

	/**
	 * Get DER encoded values.
	 * 
	 * @return list of values
	 */
	public List<byte[]> getValues() {
		return values;
	}

	public byte[] toByteArray() {
		return Asn1DerEncoder.sequence(Asn1DerEncoder.oid(oid), Asn1DerEncoder.setOf(values));
	}

	@Override
	public String toString() {
		return oid + " (" + values.size() + " values)";
	}

	public static BagAttribute fromReader(ByteReader reader) throws Pkcs12StructureException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			String oid = Asn1DerDecoder.readOidString(sequence);
			ByteReader set = Asn1DerDecoder.readSet(sequence);
			List<byte[]> values = new ArrayList<>();
			while (set.bytesAvailable()) {
				values.add(Asn1DerDecoder.readEntity(set));
			}
			return new BagAttribute(oid, values);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("Attribute", ex);
		}
	}
}
