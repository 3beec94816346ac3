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

/**
 * Writer for byte arrays.
 * 
 * Collects the encoding of DER entities. If secure close is enabled, the
 * internal buffer is cleared, when it is enlarged, reset or closed. Use that
 * for plain key material.
 */
public final class ByteWriter {

	private static final int DEFAULT_ARRAY_SIZE = 64;
	private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE >> 1;

	private byte[] buffer;
	private int count;

	private final boolean secureClose;

	/**
	 * Creates a new empty writer.
	 */
	public ByteWriter() {
		this(DEFAULT_ARRAY_SIZE, false);
	}

	/**
	 * Creates a new empty writer with provided {@link #close()} behaviour.
	 * 
	 * @param secureClose {@code true}, clear internal buffer on
	 *            {@link #close()}, {@code false}, don't clear internal buffer.
	 */
	public ByteWriter(boolean secureClose) {
		this(DEFAULT_ARRAY_SIZE, secureClose);
	}

	/**
	 * Creates a new empty writer with provided initial size.
	 * 
	 * @param size initial size
	 * @param secureClose {@code true}, clear internal buffer on
	 *            {@link #close()}, {@code false}, don't clear internal buffer.
	 */
	public ByteWriter(int size, boolean secureClose) {
		this.buffer = new byte[size];
		this.secureClose = secureClose;
	}

	/**
	 * Writes a byte.
	 * 
	 * @param b byte to write
	 */
	public void writeByte(final byte b) {
		ensureBufferSize(1);
		buffer[count++] = b;
	}

	/**
	 * Writes a byte array.
	 * 
	 * @param bytes byte array to write. May be {@code null}.
	 */
	public void writeBytes(final byte[] bytes) {
		if (bytes != null) {
			writeBytes(bytes, 0, bytes.length);
		}
	}

	/**
	 * Writes a range of a byte array.
	 * 
	 * @param bytes byte array to write. May be {@code null}.
	 * @param offset offset of the range
	 * @param length length of the range
	 */
	public void writeBytes(final byte[] bytes, int offset, int length) {
		if (bytes != null && length > 0) {
			ensureBufferSize(length);
			System.arraycopy(bytes, offset, buffer, count, length);
			count += length;
		}
	}

	/**
	 * Write content of provided writer.
	 * 
	 * @param data writer to write
	 */
	public void write(ByteWriter data) {
		writeBytes(data.buffer, 0, data.count);
	}

	/**
	 * Returns a byte array containing the sequence of bytes written.
	 * 
	 * Resets this writer.
	 * 
	 * @return The byte array containing the written bytes.
	 */
	public byte[] toByteArray() {
		byte[] byteArray;
		if (buffer.length == count) {
			byteArray = buffer;
			buffer = Bytes.EMPTY;
		} else {
			byteArray = Arrays.copyOf(buffer, count);
			if (secureClose) {
				Arrays.fill(buffer, 0, count, (byte) 0);
			}
		}
		count = 0;
		return byteArray;
	}

	/**
	 * Current size of written data.
	 * 
	 * @return number of currently written bytes.
	 */
	public int size() {
		return count;
	}

	/**
	 * Reset writer. If {@link #ByteWriter(boolean)} secure close is enabled,
	 * clear the related byte array before releasing it.
	 */
	public void reset() {
		if (secureClose) {
			Arrays.fill(buffer, 0, count, (byte) 0);
		}
		count = 0;
	}

	/**
	 * Close writer, release resources. If {@link #ByteWriter(boolean)} secure
	 * close is enabled, clear the related byte array before releasing it.
	 */
	public void close() {
		reset();
		buffer = Bytes.EMPTY;
	}

	private void ensureBufferSize(int add) {
		int size = count + add;
		if (size > buffer.length) {
			setBufferSize(calculateBufferSize(size));
		}
	}

	private void setBufferSize(int size) {
		byte[] newBuffer = new byte[size];
		System.arraycopy(buffer, 0, newBuffer, 0, count);
		if (secureClose) {
			Arrays.fill(buffer, 0, count, (byte) 0);
		}
		buffer = newBuffer;
	}

	private int calculateBufferSize(int size) {
		if (size > MAX_ARRAY_SIZE) {
			throw new IllegalArgumentException("size " + size + " exceeds maximum " + MAX_ARRAY_SIZE + "!");
		}
		int newSize = Math.max(buffer.length, DEFAULT_ARRAY_SIZE);
		while (newSize < size) {
			newSize = Math.min(newSize << 1, MAX_ARRAY_SIZE);
		}
		return newSize;
	}

	@Override
	public String toString() {
		if (count == 0) {
			return "--";
		}
		return StringUtil.byteArray2HexString(buffer, StringUtil.NO_SEPARATOR, count);
	}
}
