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
package org.eclipse.keystore.elements.util;

import java.nio.charset.StandardCharsets;

/**
 * ASN.1 DER decoder.
 * 
 * Supports the subset of ASN.1 DER required by password protected containers:
 * SEQUENCE, SET, OBJECT IDENTIFIER, INTEGER, OCTET STRING, BMPString, NULL and
 * context specific entities. Only definite lengths and single byte tags are
 * supported.
 * 
 * All read functions throw a {@link IllegalArgumentException}, if the
 * provided bytes don't contain the expected entity. In that case, the reader
 * is reset to the start of the entity, if the tag doesn't match.
 */
public class Asn1DerDecoder {

	/**
	 * Maximum supported length of entities.
	 */
	private static final int MAX_DEFAULT_LENGTH = 0x1000000;
	/**
	 * Maximum length of OID.
	 */
	private static final int MAX_OID_LENGTH = 0x40;
	/**
	 * Maximum length of INTEGER. Only int values are supported.
	 */
	private static final int MAX_INTEGER_LENGTH = 0x10;
	/**
	 * Tag for ASN.1 INTEGER.
	 */
	public static final int TAG_INTEGER = 0x02;
	/**
	 * Tag for ASN.1 OCTET STRING.
	 */
	public static final int TAG_OCTET_STRING = 0x04;
	/**
	 * Tag for ASN.1 NULL.
	 */
	public static final int TAG_NULL = 0x05;
	/**
	 * Tag for ASN.1 OBJECT IDENTIFIER.
	 */
	public static final int TAG_OID = 0x06;
	/**
	 * Tag for ASN.1 BMPString.
	 */
	public static final int TAG_BMP_STRING = 0x1E;
	/**
	 * Tag for ASN.1 SEQUENCE.
	 */
	public static final int TAG_SEQUENCE = 0x30;
	/**
	 * Tag for ASN.1 SET.
	 */
	public static final int TAG_SET = 0x31;
	/**
	 * Bit for constructed tags.
	 */
	public static final int TAG_CONSTRUCTED = 0x20;
	/**
	 * Class bits for context specific tags.
	 */
	public static final int TAG_CONTEXT_SPECIFIC = 0x80;
	/**
	 * Tag number indicating a high tag number form, which is not supported.
	 */
	private static final int TAG_HIGH_NUMBER = 0x1F;

	private static final EntityDefinition SEQUENCE = new EntityDefinition(TAG_SEQUENCE, MAX_DEFAULT_LENGTH, "SEQUENCE");
	private static final EntityDefinition SET = new EntityDefinition(TAG_SET, MAX_DEFAULT_LENGTH, "SET");
	private static final EntityDefinition OCTET_STRING = new EntityDefinition(TAG_OCTET_STRING, MAX_DEFAULT_LENGTH,
			"OCTET STRING");
	private static final EntityDefinition BMP_STRING = new EntityDefinition(TAG_BMP_STRING, MAX_DEFAULT_LENGTH,
			"BMP STRING");
	private static final EntityDefinition NULL = new EntityDefinition(TAG_NULL, 0, "NULL");
	private static final OidEntityDefinition OID = new OidEntityDefinition();
	private static final IntegerEntityDefinition INTEGER = new IntegerEntityDefinition();
	private static final EntityDefinition ANY = new AnyEntityDefinition();

	/**
	 * Peek the tag of the next entity.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return tag of the next entity, or {@code -1}, if no bytes are left.
	 */
	public static int peekTag(final ByteReader reader) {
		if (!reader.bytesAvailable()) {
			return -1;
		}
		reader.mark();
		int tag = reader.read();
		reader.reset();
		return tag;
	}

	/**
	 * Read entity of ASN.1 SEQUENCE into byte array.
	 * 
	 * Returns entity, including tag and length.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return byte array containing the SEQUENCE entity.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             SEQUENCE.
	 */
	public static byte[] readSequenceEntity(final ByteReader reader) {
		return SEQUENCE.readEntity(reader);
	}

	/**
	 * Create a reader for the value of a ASN.1 SEQUENCE.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return range reader for the SEQUENCE value.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             SEQUENCE.
	 */
	public static ByteReader readSequence(final ByteReader reader) {
		return SEQUENCE.createRangeReader(reader, false);
	}

	/**
	 * Create a reader for the value of a ASN.1 SET.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return range reader for the SET value.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             SET.
	 */
	public static ByteReader readSet(final ByteReader reader) {
		return SET.createRangeReader(reader, false);
	}

	/**
	 * Read value of ASN.1 OID into string.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return oid as string, e.g. "1.2.840.113549.1.12.10.1.3"
	 * @throws IllegalArgumentException if oid is invalid.
	 */
	public static String readOidString(final ByteReader reader) {
		byte[] oid = OID.readValue(reader);
		return OID.toString(oid);
	}

	/**
	 * Read value of ASN.1 INTEGER into int.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return int value
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             INTEGER, or the value exceeds the int range.
	 */
	public static int readInteger(final ByteReader reader) {
		byte[] integer = INTEGER.readValue(reader);
		return INTEGER.toInteger(integer);
	}

	/**
	 * Read value of ASN.1 OCTET STRING into byte array.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return byte array containing the OCTET STRING value.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             OCTET STRING.
	 */
	public static byte[] readOctetString(final ByteReader reader) {
		return OCTET_STRING.readValue(reader);
	}

	/**
	 * Read value of ASN.1 BMPString into string.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return string value
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             BMPString, or the value has an odd length.
	 */
	public static String readBmpString(final ByteReader reader) {
		byte[] value = BMP_STRING.readValue(reader);
		if ((value.length & 1) != 0) {
			throw new IllegalArgumentException("BMP STRING with odd length " + value.length + "!");
		}
		return new String(value, StandardCharsets.UTF_16BE);
	}

	/**
	 * Read ASN.1 NULL.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             NULL.
	 */
	public static void readNull(final ByteReader reader) {
		NULL.readValue(reader);
	}

	/**
	 * Create a reader for the value of an explicit tagged, context specific
	 * entity.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @param number context specific tag number (0 to 30)
	 * @return range reader for the value.
	 * @throws IllegalArgumentException if provided bytes doesn't contain the
	 *             context specific entity.
	 */
	public static ByteReader readContextSpecific(final ByteReader reader, int number) {
		int tag = TAG_CONTEXT_SPECIFIC | TAG_CONSTRUCTED | number;
		EntityDefinition definition = new EntityDefinition(tag, MAX_DEFAULT_LENGTH, "[" + number + "]");
		return definition.createRangeReader(reader, false);
	}

	/**
	 * Read the octets of an implicit tagged, context specific OCTET STRING.
	 * 
	 * Supports the primitive encoding and the constructed encoding, where the
	 * value is split into nested OCTET STRINGs.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @param number context specific tag number (0 to 30)
	 * @return byte array containing the octets.
	 * @throws IllegalArgumentException if provided bytes doesn't contain the
	 *             context specific entity.
	 */
	public static byte[] readImplicitOctets(final ByteReader reader, int number) {
		int tag = TAG_CONTEXT_SPECIFIC | number;
		if (peekTag(reader) == tag) {
			EntityDefinition definition = new EntityDefinition(tag, MAX_DEFAULT_LENGTH, "[" + number + "] IMPLICIT");
			return definition.readValue(reader);
		}
		ByteReader parts = readContextSpecific(reader, number);
		ByteWriter writer = new ByteWriter();
		while (parts.bytesAvailable()) {
			writer.writeBytes(readOctetString(parts));
		}
		return writer.toByteArray();
	}

	/**
	 * Read an entity with any tag into byte array.
	 * 
	 * Returns entity, including tag and length.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @return byte array containing the entity.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             valid entity.
	 */
	public static byte[] readEntity(final ByteReader reader) {
		return ANY.readEntity(reader);
	}

	/**
	 * Skip an entity with any tag.
	 * 
	 * @param reader reader containing the bytes to read.
	 * @throws IllegalArgumentException if provided bytes doesn't contain a
	 *             valid entity.
	 */
	public static void skipEntity(final ByteReader reader) {
		int length = ANY.readLength(reader, false);
		reader.skip(length);
	}

	/**
	 * ASN.1 entity definition.
	 */
	private static class EntityDefinition {

		/**
		 * Header length of an entity. Tag and length bytes.
		 */
		private static final int HEADER_LENGTH = 2;
		/**
		 * Expected tag.
		 */
		private final int expectedTag;
		/**
		 * Maximum supported length.
		 */
		private final int maxLength;
		/**
		 * Entity description for error handling.
		 */
		protected final String description;

		/**
		 * Create specific entity description.
		 * 
		 * @param expectedTag expected tag for this entity.
		 * @param maxLength maximum length for this entity.
		 * @param description description for error handling
		 */
		public EntityDefinition(int expectedTag, int maxLength, String description) {
			this.expectedTag = expectedTag;
			this.maxLength = maxLength;
			this.description = description;
		}

		/**
		 * Check read tag.
		 * 
		 * @param tag read tag
		 * @return {@code true}, if matching the {@link #expectedTag},
		 *         {@code false}, otherwise.
		 */
		public boolean checkTag(int tag) {
			return tag == expectedTag;
		}

		/**
		 * Read entity including tag and length into byte array.
		 * 
		 * @param reader reader containing the bytes to read.
		 * @return byte array containing the entity.
		 * @throws IllegalArgumentException if provided bytes doesn't contain
		 *             this valid entity.
		 */
		public byte[] readEntity(ByteReader reader) {
			return read(reader, true);
		}

		/**
		 * Read value excluding tag and length into byte array.
		 * 
		 * @param reader reader containing the bytes to read.
		 * @return byte array containing the value.
		 * @throws IllegalArgumentException if provided bytes doesn't contain
		 *             this valid entity.
		 */
		public byte[] readValue(ByteReader reader) {
			return read(reader, false);
		}

		/**
		 * Read value or entity.
		 * 
		 * @param reader reader containing the bytes to read.
		 * @param entity {@code true} to return the entity including the tag and
		 *            length, {@code false} to return the value excluding the
		 *            tag and length
		 * @return byte array containing the value or entity.
		 * @throws IllegalArgumentException if provided bytes doesn't contain
		 *             this valid entity.
		 */
		public byte[] read(ByteReader reader, boolean entity) {
			int length = readLength(reader, entity);
			return reader.readBytes(length);
		}

		/**
		 * Create a range reader for value or entity.
		 * 
		 * @param reader reader containing the bytes to read.
		 * @param entity {@code true} to return the entity including the tag and
		 *            length, {@code false} to return the value excluding the
		 *            tag and length
		 * @return range reader for the value or entity.
		 * @throws IllegalArgumentException if provided bytes doesn't contain
		 *             this valid entity.
		 */
		public ByteReader createRangeReader(ByteReader reader, boolean entity) {
			int length = readLength(reader, entity);
			return reader.createRangeReader(length);
		}

		/**
		 * Read length value or entity.
		 * 
		 * @param reader reader containing the bytes to read.
		 * @param entity {@code true} to return the entity including the tag and
		 *            length, {@code false} to return the value excluding the
		 *            tag and length
		 * @return length of the value or entity.
		 * @throws IllegalArgumentException if provided bytes doesn't contain
		 *             this valid entity.
		 */
		public int readLength(ByteReader reader, boolean entity) {
			int leftBytes = reader.available();
			if (leftBytes < HEADER_LENGTH) {
				throw new IllegalArgumentException(String.format("Not enough bytes for %s! Required %d, available %d.",
						description, HEADER_LENGTH, leftBytes));
			}
			// mark reader, if the entity must be returned, or the tag doesn't
			// match
			reader.mark();
			// check tag
			int tag = reader.read();
			if (!checkTag(tag)) {
				reader.reset();
				throw new IllegalArgumentException(
						String.format("No %s, found %02x instead of %02x!", description, tag, expectedTag));
			}
			// read length
			int length = reader.read();
			int entityLength = length + HEADER_LENGTH;
			if (length == 0x80) {
				reader.reset();
				throw new IllegalArgumentException(
						String.format("%s with indefinite length not supported!", description));
			} else if (length > 127) {
				// multi bytes length
				length &= 0x7f;
				if (length > 4) {
					reader.reset();
					throw new IllegalArgumentException(
							String.format("%s length-size %d too long!", description, length));
				}
				leftBytes = reader.available();
				if (length > leftBytes) {
					reader.reset();
					throw new IllegalArgumentException(
							String.format("%s length %d exceeds available bytes %d!", description, length, leftBytes));
				}
				byte[] lengthBytes = reader.readBytes(length);
				// decode multi bytes length
				long longLength = 0;
				for (int index = 0; index < lengthBytes.length; ++index) {
					longLength <<= 8;
					longLength += (lengthBytes[index] & 0xff);
				}
				if (longLength > maxLength) {
					reader.reset();
					throw new IllegalArgumentException(String.format("%s length %d too large! (supported maximum %d)",
							description, longLength, maxLength));
				}
				length = (int) longLength;
				entityLength = length + HEADER_LENGTH + lengthBytes.length;
			}
			if (length > maxLength) {
				reader.reset();
				throw new IllegalArgumentException(String.format("%s length %d too large! (supported maximum %d)",
						description, length, maxLength));
			}
			leftBytes = reader.available();
			if (length > leftBytes) {
				reader.reset();
				throw new IllegalArgumentException(
						String.format("%s length %d exceeds available bytes %d!", description, length, leftBytes));
			}
			if (entity) {
				reader.reset();
				length = entityLength;
			}
			return length;
		}
	}

	private static class AnyEntityDefinition extends EntityDefinition {

		public AnyEntityDefinition() {
			super(-1, MAX_DEFAULT_LENGTH, "ENTITY");
		}

		@Override
		public boolean checkTag(int tag) {
			return (tag & TAG_HIGH_NUMBER) != TAG_HIGH_NUMBER;
		}
	}

	private static class OidEntityDefinition extends EntityDefinition {

		public OidEntityDefinition() {
			super(TAG_OID, MAX_OID_LENGTH, "OID");
		}

		/**
		 * Convert oid into string representation.
		 * 
		 * @param oid oid as byte array
		 * @return oid as string
		 * @throws IllegalArgumentException if oid is invalid.
		 */
		public String toString(byte[] oid) {
			if (oid.length == 0) {
				throw new IllegalArgumentException("Empty OID!");
			}
			StringBuilder result = new StringBuilder();
			long value = 0;
			boolean first = true;
			for (int index = 0; index < oid.length; ++index) {
				int bValue = oid[index] & 0xff;
				if (value == 0 && bValue == 0x80) {
					throw new IllegalArgumentException("Invalid OID 0x" + StringUtil.byteArray2Hex(oid));
				}
				value = (value << 7) | (bValue & 0x7f);
				if (value > Integer.MAX_VALUE) {
					throw new IllegalArgumentException("OID 0x" + StringUtil.byteArray2Hex(oid) + " arc too large!");
				}
				if ((bValue & 0x80) == 0) {
					if (first) {
						// first sub-identifier encodes the two first arcs
						long arc = Math.min(value / 40, 2);
						result.append(arc).append('.').append(value - arc * 40);
						first = false;
					} else {
						result.append('.').append(value);
					}
					value = 0;
				} else if (index == oid.length - 1) {
					throw new IllegalArgumentException("Invalid OID 0x" + StringUtil.byteArray2Hex(oid));
				}
			}
			return result.toString();
		}
	}

	private static class IntegerEntityDefinition extends EntityDefinition {

		public IntegerEntityDefinition() {
			super(TAG_INTEGER, MAX_INTEGER_LENGTH, "INTEGER");
		}

		/**
		 * Convert integer byte array into int.
		 * 
		 * @param integerByteArray integer as byte array
		 * @return int
		 */
		public int toInteger(byte[] integerByteArray) {
			if (integerByteArray == null) {
				throw new NullPointerException("INTEGER byte array must not be null!");
			}
			if (integerByteArray.length == 0) {
				throw new IllegalArgumentException("INTEGER byte array must not be empty!");
			}
			if (integerByteArray.length > 4) {
				throw new IllegalArgumentException("INTEGER byte array " + integerByteArray.length
						+ " bytes is too large for int (max. 4 bytes)!");
			}
			byte sign = integerByteArray[0];
			int result = sign;
			for (int index = 1; index < integerByteArray.length; ++index) {
				result <<= Byte.SIZE;
				result |= (integerByteArray[index] & 0xff);
			}
			if (sign >= 0 ^ result >= 0) {
				throw new IllegalArgumentException("INTEGER byte array value overflow!");
			}
			return result;
		}
	}
}
