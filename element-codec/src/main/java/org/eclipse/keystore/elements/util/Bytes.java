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

import java.util.Arrays;
import java.util.Random;

/**
 * Byte array as value.
 * 
 * Used for binary attributes, which must be compared by content, e.g. the
 * local key id correlating a certificate with its private key.
 */
public class Bytes {

	/**
	 * Empty byte array.
	 */
	public static final byte[] EMPTY = new byte[0];
	/**
	 * bytes.
	 */
	private final byte[] bytes;
	/**
	 * Pre-calculated hash.
	 * 
	 * @see #hashCode()
	 */
	private final int hash;
	/**
	 * Bytes as String.
	 * 
	 * Cache result of {@link #getAsString()}.
	 */
	private String asString;

	/**
	 * Create bytes array.
	 * 
	 * @param bytes bytes. Copied.
	 * @throws NullPointerException if bytes is {@code null}
	 */
	public Bytes(byte[] bytes) {
		this(bytes, Integer.MAX_VALUE, true);
	}

	/**
	 * Create bytes array.
	 * 
	 * @param bytes bytes
	 * @param maxLength maximum length of bytes
	 * @param copy {@code true} to copy bytes, {@code false} to use the
	 *            provided bytes
	 * @throws NullPointerException if bytes is {@code null}
	 * @throws IllegalArgumentException if bytes length is larger than
	 *             maxLength
	 */
	public Bytes(byte[] bytes, int maxLength, boolean copy) {
		if (bytes == null) {
			throw new NullPointerException("bytes must not be null");
		} else if (bytes.length > maxLength) {
			throw new IllegalArgumentException("bytes length must be between 0 and " + maxLength + " inclusive");
		}
		this.bytes = copy ? Arrays.copyOf(bytes, bytes.length) : bytes;
		this.hash = Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return new StringBuilder("BYTES=").append(getAsString()).toString();
	}

	@Override
	public final int hashCode() {
		return hash;
	}

	@Override
	public final boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Bytes other = (Bytes) obj;
		if (hash != other.hash)
			return false;
		return Arrays.equals(bytes, other.bytes);
	}

	/**
	 * Get bytes array.
	 * 
	 * @return bytes array. Not Copied!
	 */
	public final byte[] getBytes() {
		return bytes;
	}

	/**
	 * Get bytes as (hexadecimal) string.
	 * 
	 * @return bytes as (hexadecimal) string
	 */
	public final String getAsString() {
		if (asString == null) {
			asString = StringUtil.byteArray2Hex(bytes);
		}
		return asString;
	}

	/**
	 * Check, if bytes are empty.
	 * 
	 * @return {@code true}, if bytes are empty, {@code false}, otherwise
	 */
	public final boolean isEmpty() {
		return bytes.length == 0;
	}

	/**
	 * Return number of bytes.
	 * 
	 * @return number of bytes.
	 */
	public final int length() {
		return bytes.length;
	}

	/**
	 * Create byte array initialized with random bytes.
	 * 
	 * @param generator random generator
	 * @param size number of bytes
	 * @return byte array initialized with random bytes
	 * @see Random#nextBytes(byte[])
	 */
	public static byte[] createBytes(Random generator, int size) {
		byte[] byteArray = new byte[size];
		generator.nextBytes(byteArray);
		return byteArray;
	}

	/**
	 * Concatenates two byte arrays.
	 * 
	 * @param a the first array.
	 * @param b the second array.
	 * @return the concatenated array.
	 */
	public static byte[] concatenate(byte[] a, byte[] b) {
		int lengthA = a.length;
		int lengthB = b.length;

		byte[] concat = new byte[lengthA + lengthB];

		System.arraycopy(a, 0, concat, 0, lengthA);
		System.arraycopy(b, 0, concat, lengthA, lengthB);

		return concat;
	}

	/**
	 * Fill the destination with the source repeated.
	 * 
	 * The last copy of the source is truncated, if the destination length is
	 * not a multiple of the source length.
	 * 
	 * @param source source. Must not be empty, if destination is not empty.
	 * @param destination destination to fill
	 * @throws IllegalArgumentException if source is empty and destination is
	 *             not empty
	 */
	public static void fillRepeated(byte[] source, byte[] destination) {
		if (destination.length > 0 && source.length == 0) {
			throw new IllegalArgumentException("source must not be empty!");
		}
		for (int index = 0; index < destination.length; index += source.length) {
			System.arraycopy(source, 0, destination, index, Math.min(source.length, destination.length - index));
		}
	}

	/**
	 * Clear provided byte array.
	 * 
	 * Fill it with 0s.
	 * 
	 * @param data byte array to be cleared. May be {@code null}.
	 */
	public static void clear(byte[] data) {
		if (data != null) {
			Arrays.fill(data, (byte) 0);
		}
	}
}
