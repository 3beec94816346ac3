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
package org.eclipse.keystore.pkcs12;

import java.util.Arrays;

import org.eclipse.keystore.elements.util.StringUtil;

/**
 * Plaintext record of a PKCS#12 container.
 * 
 * The type id is the secret type id of a {@link EntryType#SECRET}, or the bag
 * id of an {@link EntryType#OPAQUE} entry. For an opaque entry, the payload
 * is the DER encoded bag value. A secret, which value is not an OCTET STRING,
 * keeps the DER encoded secret value as payload, see {@link #isEncodedValue()}.
 */
public final class Pkcs12Entry {

	private final EntryType type;
	private final BagAttributes attributes;
	private final byte[] payload;
	private final String typeId;
	private final boolean encodedValue;

	/**
	 * Create entry.
	 * 
	 * @param type type of entry. Neither {@link EntryType#SECRET} nor
	 *            {@link EntryType#OPAQUE}.
	 * @param attributes attributes. May be {@code null} for no attributes.
	 * @param payload payload
	 * @throws NullPointerException if type or payload is {@code null}
	 * @throws IllegalArgumentException if type is {@link EntryType#OPAQUE}
	 */
	public Pkcs12Entry(EntryType type, BagAttributes attributes, byte[] payload) {
		this(type, attributes, payload, null);
	}

	/**
	 * Create entry.
	 * 
	 * @param type type of entry
	 * @param attributes attributes. May be {@code null} for no attributes.
	 * @param payload payload
	 * @param typeId secret type id, or bag id. For {@link EntryType#SECRET}
	 *            {@code null} defaults to the secret bag id.
	 * @throws NullPointerException if type or payload is {@code null}
	 * @throws IllegalArgumentException if type is {@link EntryType#OPAQUE} and
	 *             no bag id is provided
	 */
	public Pkcs12Entry(EntryType type, BagAttributes attributes, byte[] payload, String typeId) {
		this(type, attributes, payload, typeId, false);
	}

	/**
	 * Create entry.
	 * 
	 * @param type type of entry
	 * @param attributes attributes. May be {@code null} for no attributes.
	 * @param payload payload
	 * @param typeId secret type id, or bag id. For {@link EntryType#SECRET}
	 *            {@code null} defaults to the secret bag id.
	 * @param encodedValue {@code true}, if the payload of a
	 *            {@link EntryType#SECRET} is the DER encoded secret value,
	 *            {@code false}, if the payload are the octets of an OCTET
	 *            STRING.
	 * @throws NullPointerException if type or payload is {@code null}
	 * @throws IllegalArgumentException if type is {@link EntryType#OPAQUE} and
	 *             no bag id is provided, or encodedValue is used for other
	 *             types than {@link EntryType#SECRET}
	 */
	public Pkcs12Entry(EntryType type, BagAttributes attributes, byte[] payload, String typeId,
			boolean encodedValue) {
		if (type == null) {
			throw new NullPointerException("type must not be null!");
		}
		if (payload == null) {
			throw new NullPointerException("payload must not be null!");
		}
		if (type == EntryType.OPAQUE && typeId == null) {
			throw new IllegalArgumentException("opaque entry requires bag id!");
		}
		if (encodedValue && type != EntryType.SECRET) {
			throw new IllegalArgumentException("encoded value requires secret entry!");
		}
		if (type == EntryType.SECRET && typeId == null) {
			typeId = Pkcs12Oids.SECRET_BAG;
		}
		this.type = type;
		this.attributes = attributes == null ? BagAttributes.EMPTY : attributes;
		this.payload = Arrays.copyOf(payload, payload.length);
		this.typeId = typeId;
		this.encodedValue = encodedValue;
	}

	public EntryType getType() {
		return type;
	}

	public BagAttributes getAttributes() {
		return attributes;
	}

	public byte[] getPayload() {
		return Arrays.copyOf(payload, payload.length);
	}

	/**
	 * Get type id.
	 * 
	 * @return secret type id, bag id for opaque entries, or {@code null}.
	 */
	public String getTypeId() {
		return typeId;
	}

	/**
	 * Check, if the payload is the DER encoded secret value.
	 * 
	 * @return {@code true}, if the secret value is not an OCTET STRING and the
	 *         payload contains the complete DER entity, {@code false},
	 *         otherwise.
	 */
	public boolean isEncodedValue() {
		return encodedValue;
	}

	public String getFriendlyName() {
		return attributes.getFriendlyName();
	}

	public byte[] getLocalKeyId() {
		return attributes.getLocalKeyId();
	}

	@Override
	public int hashCode() {
		int result = type.hashCode();
		result = result * 31 + attributes.hashCode();
		return result * 31 + Arrays.hashCode(payload);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Pkcs12Entry other = (Pkcs12Entry) obj;
		return type == other.type && attributes.equals(other.attributes) && Arrays.equals(payload, other.payload)
				&& encodedValue == other.encodedValue && (typeId == null ? other.typeId == null : typeId.equals(other.typeId));
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(type.name());
		if (typeId != null) {
			builder.append(" (").append(typeId).append(")");
		}
		if (encodedValue) {
			builder.append(", DER");
		}
		builder.append(", ").append(payload.length).append(" bytes");
		if (!attributes.isEmpty()) {
			builder.append(", ").append(attributes);
		}
		builder.append(", ").append(StringUtil.byteArray2HexString(payload, StringUtil.NO_SEPARATOR, 8));
		return builder.toString();
	}
}
