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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.elements.util.StringUtil;
import org.eclipse.keystore.pkcs12.model.BagAttribute;

/**
 * Attributes of a record.
 * 
 * The friendly name and the local key id are decoded, all other attributes
 * are kept as they are. If the friendly name or local key id attribute has
 * more than one value, the first value is decoded and the complete attribute
 * is kept in {@link #getOthers()}.
 */
public final class BagAttributes {

	/**
	 * Empty attributes.
	 */
	public static final BagAttributes EMPTY = new BagAttributes(null, null);

	private final String friendlyName;
	private final byte[] localKeyId;
	private final List<BagAttribute> others;

	/**
	 * Create attributes.
	 * 
	 * @param friendlyName friendly name. May be {@code null}.
	 * @param localKeyId local key id. May be {@code null}.
	 */
	public BagAttributes(String friendlyName, byte[] localKeyId) {
		this(friendlyName, localKeyId, Collections.<BagAttribute> emptyList());
	}

	/**
	 * Create attributes.
	 * 
	 * @param friendlyName friendly name. May be {@code null}.
	 * @param localKeyId local key id. May be {@code null}.
	 * @param others other attributes
	 */
	public BagAttributes(String friendlyName, byte[] localKeyId, List<BagAttribute> others) {
		this.friendlyName = friendlyName;
		this.localKeyId = localKeyId == null ? null : Arrays.copyOf(localKeyId, localKeyId.length);
		this.others = Collections.unmodifiableList(new ArrayList<>(others));
	}

	public String getFriendlyName() {
		return friendlyName;
	}

	public byte[] getLocalKeyId() {
		return localKeyId == null ? null : Arrays.copyOf(localKeyId, localKeyId.length);
	}

	/**
	 * Get other attributes.
	 * 
	 * @return list of attributes other than friendly name and local key id.
	 */
	public List<BagAttribute> getOthers() {
		return others;
	}

	public boolean isEmpty() {
		return friendlyName == null && localKeyId == null && others.isEmpty();
	}

	/**
	 * Convert into attributes of a safe bag.
	 * 
	 * @return list of attributes
	 */
	public List<BagAttribute> toAttributes() {
		List<BagAttribute> attributes = new ArrayList<>();
		if (friendlyName != null) {
			byte[] value = Asn1DerEncoder.bmpString(friendlyName);
			if (!containsOther(Pkcs12Oids.FRIENDLY_NAME, value)) {
				attributes.add(new BagAttribute(Pkcs12Oids.FRIENDLY_NAME, Collections.singletonList(value)));
			}
		}
		if (localKeyId != null) {
			byte[] value = Asn1DerEncoder.octetString(localKeyId);
			if (!containsOther(Pkcs12Oids.LOCAL_KEY_ID, value)) {
				attributes.add(new BagAttribute(Pkcs12Oids.LOCAL_KEY_ID, Collections.singletonList(value)));
			}
		}
		attributes.addAll(others);
		return attributes;
	}

	/**
	 * Check, if other attributes contain the value.
	 * 
	 * @param oid oid of attribute
	 * @param value encoded value
	 * @return {@code true}, if an other attribute with that oid contains the
	 *         value, {@code false}, otherwise.
	 */
	private boolean containsOther(String oid, byte[] value) {
		for (BagAttribute attribute : others) {
			if (oid.equals(attribute.getOid())) {
				for (byte[] other : attribute.getValues()) {
					if (Arrays.equals(value, other)) {
						return true;
					}
				}
			}
		}
		return false;
	}

	/**
	 * Create from attributes of a safe bag.
	 * 
	 * @param attributes list of attributes
	 * @return attributes of a record
	 * @throws Pkcs12StructureException if friendly name or local key id is
	 *             malformed
	 */
	public static BagAttributes fromAttributes(List<BagAttribute> attributes) throws Pkcs12StructureException {
		if (attributes.isEmpty()) {
			return EMPTY;
		}
		String friendlyName = null;
		byte[] localKeyId = null;
		List<BagAttribute> others = new ArrayList<>();
		try {
			for (BagAttribute attribute : attributes) {
				if (Pkcs12Oids.FRIENDLY_NAME.equals(attribute.getOid()) && friendlyName == null) {
					friendlyName = Asn1DerDecoder.readBmpString(firstValue(attribute));
					if (attribute.getValues().size() > 1) {
						others.add(attribute);
					}
				} else if (Pkcs12Oids.LOCAL_KEY_ID.equals(attribute.getOid()) && localKeyId == null) {
					localKeyId = Asn1DerDecoder.readOctetString(firstValue(attribute));
					if (attribute.getValues().size() > 1) {
						others.add(attribute);
					}
				} else {
					others.add(attribute);
				}
			}
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("Attribute", ex);
		}
		return new BagAttributes(friendlyName, localKeyId, others);
	}

	private static ByteReader firstValue(BagAttribute attribute) {
		List<byte[]> values = attribute.getValues();
		if (values.isEmpty()) {
			throw new IllegalArgumentException("attribute " + attribute.getOid() + " requires a value!");
		}
		return new ByteReader(values.get(0), false);
	}

	@Override
	public int hashCode() {
		int result = friendlyName == null ? 0 : friendlyName.hashCode();
		result = result * 31 + Arrays.hashCode(localKeyId);
		return result * 31 + others.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		BagAttributes other = (BagAttributes) obj;
		if (friendlyName == null ? other.friendlyName != null : !friendlyName.equals(other.friendlyName)) {
			return false;
		}
		if (!Arrays.equals(localKeyId, other.localKeyId)) {
			return false;
		}
		if (others.size() != other.others.size()) {
			return false;
		}
		for (int index = 0; index < others.size(); ++index) {
			BagAttribute attribute1 = others.get(index);
			BagAttribute attribute2 = other.others.get(index);
			if (!attribute1.getOid().equals(attribute2.getOid())
					|| attribute1.getValues().size() != attribute2.getValues().size()) {
				return false;
			}
			for (int value = 0; value < attribute1.getValues().size(); ++value) {
				if (!Arrays.equals(attribute1.getValues().get(value), attribute2.getValues().get(value))) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		if (friendlyName != null) {
			builder.append("friendlyName: ").append(friendlyName);
		}
		if (localKeyId != null) {
			if (builder.length() > 0) {
				builder.append(", ");
			}
			builder.append("localKeyId: ").append(StringUtil.byteArray2Hex(localKeyId));
		}
		if (!others.isEmpty()) {
			if (builder.length() > 0) {
				builder.append(", ");
			}
			builder.append(others);
		}
		return builder.toString();
	}
}
