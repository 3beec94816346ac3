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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * ASN.1 DER encoder.
 * 
 * Counterpart of {@link Asn1DerDecoder}. Each function returns the complete
 * entity, including tag and length.
 */
public class Asn1DerEncoder {

	/**
	 * DER order of SET OF elements. Compares the encodings as unsigned octet
	 * strings, shorter encodings are padded with trailing zeros.
	 */
	private static final Comparator<byte[]> DER_ORDER = new Comparator<byte[]>() {

		@Override
		public int compare(byte[] o1, byte[] o2) {
			int length = Math.min(o1.length, o2.length);
			for (int index = 0; index < length; ++index) {
				int diff = (o1[index] & 0xff) - (o2[index] & 0xff);
				if (diff != 0) {
					return diff;
				}
			}
			return o1.length - o2.length;
		}
	};

	/**
	 * Encode entity.
	 * 
	 * @param tag tag of entity
	 * @param values encoded values, concatenated as value of the entity.
	 * @return encoded entity
	 */
	public static byte[] entity(int tag, byte[]... values) {
		return entity(tag, Arrays.asList(values));
	}

	/**
	 * Encode entity.
	 * 
	 * @param tag tag of entity
	 * @param values encoded values, concatenated as value of the entity.
	 * @return encoded entity
	 */
	public static byte[] entity(int tag, List<byte[]> values) {
		int length = 0;
		for (byte[] value : values) {
			length += value.length;
		}
		ByteWriter writer = new ByteWriter(length + 6, false);
		writer.writeByte((byte) tag);
		writeLength(writer, length);
		for (byte[] value : values) {
			writer.writeBytes(value);
		}
		return writer.toByteArray();
	}

	/**
	 * Encode SEQUENCE.
	 * 
	 * @param elements encoded elements
	 * @return encoded SEQUENCE
	 */
	public static byte[] sequence(byte[]... elements) {
		return entity(Asn1DerDecoder.TAG_SEQUENCE, elements);
	}

	/**
	 * Encode SEQUENCE.
	 * 
	 * @param elements encoded elements
	 * @return encoded SEQUENCE
	 */
	public static byte[] sequence(List<byte[]> elements) {
		return entity(Asn1DerDecoder.TAG_SEQUENCE, elements);
	}

	/**
	 * Encode SET OF.
	 * 
	 * Sorts the elements in DER order.
	 * 
	 * @param elements encoded elements
	 * @return encoded SET
	 */
	public static byte[] setOf(List<byte[]> elements) {
		List<byte[]> sorted = new ArrayList<>(elements);
		Collections.sort(sorted, DER_ORDER);
		return entity(Asn1DerDecoder.TAG_SET, sorted);
	}

	/**
	 * Encode OBJECT IDENTIFIER.
	 * 
	 * @param oid oid as string, e.g. "1.2.840.113549.1.7.1"
	 * @return encoded OBJECT IDENTIFIER
	 * @throws IllegalArgumentException if the oid is invalid
	 */
	public static byte[] oid(String oid) {
		String[] arcs = oid.split("\\.");
		if (arcs.length < 2) {
			throw new IllegalArgumentException("OID '" + oid + "' requires at least 2 arcs!");
		}
		long[] values = new long[arcs.length - 1];
		try {
			long first = Long.parseLong(arcs[0]);
			long second = Long.parseLong(arcs[1]);
			if (first > 2 || (first < 2 && second >= 40) || first < 0 || second < 0) {
				throw new IllegalArgumentException("OID '" + oid + "' has invalid first arcs!");
			}
			values[0] = first * 40 + second;
			for (int index = 2; index < arcs.length; ++index) {
				values[index - 1] = Long.parseLong(arcs[index]);
				if (values[index - 1] < 0) {
					throw new IllegalArgumentException("OID '" + oid + "' has negative arc!");
				}
			}
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("OID '" + oid + "' is invalid!", ex);
		}
		ByteWriter writer = new ByteWriter();
		for (long value : values) {
			int shift = 0;
			while ((value >>> (shift + 7)) != 0) {
				shift += 7;
			}
			while (shift > 0) {
				writer.writeByte((byte) (0x80 | ((value >>> shift) & 0x7f)));
				shift -= 7;
			}
			writer.writeByte((byte) (value & 0x7f));
		}
		return entity(Asn1DerDecoder.TAG_OID, writer.toByteArray());
	}

	/**
	 * Encode INTEGER.
	 * 
	 * @param value int value
	 * @return encoded INTEGER, using the minimal number of bytes.
	 */
	public static byte[] integer(int value) {
		int length = 4;
		// strip redundant leading sign bytes
		while (length > 1) {
			int top = value >> ((length - 1) * Byte.SIZE - 1);
			if (top != 0 && top != -1) {
				break;
			}
			--length;
		}
		byte[] bytes = new byte[length];
		for (int index = 0; index < length; ++index) {
			bytes[index] = (byte) (value >> ((length - 1 - index) * Byte.SIZE));
		}
		return entity(Asn1DerDecoder.TAG_INTEGER, bytes);
	}

	/**
	 * Encode OCTET STRING.
	 * 
	 * @param value octets
	 * @return encoded OCTET STRING
	 */
	public static byte[] octetString(byte[] value) {
		return entity(Asn1DerDecoder.TAG_OCTET_STRING, value);
	}

	/**
	 * Encode BMPString.
	 * 
	 * @param value string value
	 * @return encoded BMPString
	 */
	public static byte[] bmpString(String value) {
		return entity(Asn1DerDecoder.TAG_BMP_STRING, value.getBytes(StandardCharsets.UTF_16BE));
	}

	/**
	 * Encode NULL.
	 * 
	 * @return encoded NULL
	 */
	public static byte[] nullEntity() {
		return new byte[] { Asn1DerDecoder.TAG_NULL, 0 };
	}

	/**
	 * Encode explicit tagged, context specific entity.
	 * 
	 * @param number context specific tag number (0 to 30)
	 * @param elements encoded elements
	 * @return encoded context specific entity
	 */
	public static byte[] contextSpecific(int number, byte[]... elements) {
		return entity(Asn1DerDecoder.TAG_CONTEXT_SPECIFIC | Asn1DerDecoder.TAG_CONSTRUCTED | number, elements);
	}

	/**
	 * Encode implicit tagged, context specific primitive entity.
	 * 
	 * @param number context specific tag number (0 to 30)
	 * @param value octets
	 * @return encoded context specific entity
	 */
	public static byte[] implicitOctets(int number, byte[] value) {
		return entity(Asn1DerDecoder.TAG_CONTEXT_SPECIFIC | number, value);
	}

	/**
	 * Write DER length.
	 * 
	 * @param writer writer to write the length
	 * @param length length to write
	 */
	private static void writeLength(ByteWriter writer, int length) {
		if (length < 0x80) {
			writer.writeByte((byte) length);
		} else {
			int bytes = 1;
			while (bytes < 4 && (length >>> (bytes * Byte.SIZE)) != 0) {
				++bytes;
			}
			writer.writeByte((byte) (0x80 | bytes));
			for (int index = bytes - 1; index >= 0; --index) {
				writer.writeByte((byte) (length >>> (index * Byte.SIZE)));
			}
		}
	}
}
