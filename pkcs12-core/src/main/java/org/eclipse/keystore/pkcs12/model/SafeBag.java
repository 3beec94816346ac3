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
 * Safe bag.
 * 
 * <pre>
 * SafeBag ::= SEQUENCE {
 *    bagId          OBJECT IDENTIFIER,
 *    bagValue       [0] EXPLICIT ANY DEFINED BY bagId,
 *    bagAttributes  SET OF PKCS12Attribute OPTIONAL
 * }
 * SafeContents ::= SEQUENCE OF SafeBag
 * </pre>
 * 
 * The bag value is kept DER encoded, the interpretation is left to the bag
 * codec.
 */
public final class SafeBag {

	private final String bagId;
	private final byte[] bagValue;
	private final List<BagAttribute> attributes;

	public SafeBag(String bagId, byte[] bagValue, List<BagAttribute> attributes) {
		if (bagId == null) {
			throw new NullPointerException("bag id must not be null!");
		}
		if (bagValue == null) {
			throw new NullPointerException("bag value must not be null!");
		}
		this.bagId = bagId;
		this.bagValue = bagValue;
		this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
	}

	public String getBagId() {
		return bagId;
	}

	/**
	 * Get DER encoded bag value.
	 * 
	 * @return bag value
	 */
	public byte[] getBagValue() {
		return bagValue;
	}

	public List<BagAttribute> getAttributes() {
		return attributes;
	}

	public byte[] toByteArray() {
		byte[] id = Asn1DerEncoder.oid(bagId);
		byte[] value = Asn1DerEncoder.contextSpecific(0, bagValue);
		if (attributes.isEmpty()) {
			return Asn1DerEncoder.sequence(id, value);
		}
		List<byte[]> encoded = new ArrayList<>(attributes.size());
		for (BagAttribute attribute : attributes) {
			encoded.add(attribute.toByteArray());
		}
		return Asn1DerEncoder.sequence(id, value, Asn1DerEncoder.setOf(encoded));
	}

	@Override
	public String toString() {
		return "SafeBag " + bagId + ", " + bagValue.length + " bytes, " + attributes.size() + " attributes";
	}

	public static SafeBag fromReader(ByteReader reader) throws Pkcs12StructureException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			String bagId = Asn1DerDecoder.readOidString(sequence);
			ByteReader value = Asn1DerDecoder.readContextSpecific(sequence, 0);
			byte[] bagValue = Asn1DerDecoder.readEntity(value);
			value.assertFinished("SafeBag value");
			List<BagAttribute> attributes = new ArrayList<>();
			if (Asn1DerDecoder.peekTag(sequence) == Asn1DerDecoder.TAG_SET) {
				ByteReader set = Asn1DerDecoder.readSet(sequence);
				while (set.bytesAvailable()) {
					attributes.add(BagAttribute.fromReader(set));
				}
			}
			return new SafeBag(bagId, bagValue, attributes);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("SafeBag", ex);
		}
	}

	/**
	 * Decode safe contents.
	 * 
	 * @param der DER encoded safe contents
	 * @return list of safe bags, in order of the safe contents
	 * @throws Pkcs12StructureException if the safe contents are malformed
	 */
	public static List<SafeBag> fromSafeContents(byte[] der) throws Pkcs12StructureException {
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			reader.assertFinished("SafeContents");
			List<SafeBag> bags = new ArrayList<>();
			while (sequence.bytesAvailable()) {
				bags.add(fromReader(sequence));
			}
			return bags;
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("SafeContents", ex);
		}
	}

	/**
	 * Encode safe contents.
	 * 
	 * @param bags list of safe bags
	 * @return DER encoded safe contents
	 */
	public static byte[] toSafeContents(List<SafeBag> bags) {
		List<byte[]> encoded = new ArrayList<>(bags.size());
		for (SafeBag bag : bags) {
			encoded.add(bag.toByteArray());
		}
		return Asn1DerEncoder.sequence(encoded);
	}
}
