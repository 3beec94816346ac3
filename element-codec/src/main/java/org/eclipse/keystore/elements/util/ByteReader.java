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
 * Reader for byte arrays.
 * 
 * Reads DER encoded data byte by byte. A range reader shares the array of its
 * parent reader, but is limited to the range, which enables reading nested
 * structures without copying.
 * 
 * Reading beyond the available bytes always results in a
 * {@link IllegalArgumentException}, never in an out of bounds access.
 */
public final class ByteReader {

	/**
	 * Directly used array.
	 */
	private final byte[] buffer;
	/**
	 * Start offset within the {@link #buffer}.
	 */
	private final int offset;
	/**
	 * End offset (exclusive) within the {@link #buffer}.
	 */
	private final int limit;
	/**
	 * Current read position.
	 */
	private int position;
	/**
	 * Copy of {@link #position}, when {@link #mark()} is called.
	 */
	private int markPosition;

	/**
	 * Creates a new reader for an copied array of bytes.
	 * 
	 * @param byteArray The byte array to read from.
	 * @throws NullPointerException if byte array is {@code null}
	 */
	public ByteReader(final byte[] byteArray) {
		this(byteArray, true);
	}

	/**
	 * Creates a new reader for an array of bytes.
	 * 
	 * @param byteArray The byte array to read from.
	 * @param copy {@code true} to copy the array, {@code false} to us it
	 *            directly.
	 * @throws NullPointerException if byte array is {@code null}
	 */
	public ByteReader(final byte[] byteArray, boolean copy) {
		this(copy ? Arrays.copyOf(byteArray, byteArray.length) : byteArray, 0, byteArray.length);
	}

	/**
	 * Creates a new reader for a range within an array of bytes.
	 * 
	 * The array is used directly and is not copied.
	 * 
	 * @param byteArray The byte array to read from.
	 * @param offset starting offset of the range.
	 * @param length length of the range.
	 * @throws NullPointerException if byte array is {@code null}
	 * @throws IllegalArgumentException if the range exceeds the array
	 */
	public ByteReader(final byte[] byteArray, int offset, int length) {
		if (byteArray == null) {
			throw new NullPointerException("byte array must not be null!");
		}
		if (offset < 0 || length < 0 || offset > byteArray.length - length) {
			throw new IllegalArgumentException(
					"range " + offset + "+" + length + " exceeds array length " + byteArray.length + "!");
		}
		this.buffer = byteArray;
		this.offset = offset;
		this.limit = offset + length;
		this.position = offset;
		this.markPosition = offset;
	}

	/**
	 * Mark current position to be reseted afterwards.
	 * 
	 * @see #reset()
	 */
	public void mark() {
		markPosition = position;
	}

	/**
	 * Reset reader to last mark.
	 * 
	 * @see #mark()
	 */
	public void reset() {
		position = markPosition;
	}

	/**
	 * Reads the next byte.
	 * 
	 * @return the next byte
	 * @throws IllegalArgumentException if no byte is available
	 */
	public byte readNextByte() {
		if (position >= limit) {
			throw new IllegalArgumentException("requested 1 byte exceeds available 0 bytes.");
		}
		return buffer[position++];
	}

	/**
	 * Reads the next byte as unsigned value.
	 * 
	 * @return the next byte as unsigned value (0 to 255)
	 * @throws IllegalArgumentException if no byte is available
	 */
	public int read() {
		return readNextByte() & 0xff;
	}

	/**
	 * Reads a sequence of bytes.
	 * 
	 * @param count The number of bytes to read. If value is negative, read
	 *            left bytes.
	 * @return The sequence of bytes.
	 * @throws IllegalArgumentException if count exceeds the available bytes
	 */
	public byte[] readBytes(final int count) {
		int available = available();
		int bytesToRead = count;

		// for negative count values, read all bytes left
		if (bytesToRead < 0) {
			bytesToRead = available;
		} else if (bytesToRead > available) {
			throw new IllegalArgumentException(
					"requested " + count + " bytes exceeds available " + available + " bytes.");
		}
		byte[] bytes = Arrays.copyOfRange(buffer, position, position + bytesToRead);
		position += bytesToRead;
		return bytes;
	}

	/**
	 * Reads the complete sequence of bytes left.
	 * 
	 * @return The sequence of bytes left.
	 */
	public byte[] readBytesLeft() {
		return readBytes(-1);
	}

	/**
	 * Skip bytes.
	 * 
	 * @param count number of bytes to skip
	 * @throws IllegalArgumentException if count exceeds the available bytes
	 */
	public void skip(int count) {
		int available = available();
		if (count < 0 || count > available) {
			throw new IllegalArgumentException(
					"requested " + count + " bytes exceeds available " + available + " bytes.");
		}
		position += count;
	}

	/**
	 * Create reader for range.
	 * 
	 * The range is consumed from this reader and shared with the returned
	 * reader.
	 * 
	 * @param count number of bytes for the range
	 * @return reader containing the range
	 * @throws IllegalArgumentException if provided count exceeds available
	 *             bytes
	 */
	public ByteReader createRangeReader(int count) {
		int start = position;
		skip(count);
		return new ByteReader(buffer, start, count);
	}

	/**
	 * Get the bytes consumed since the provided position.
	 * 
	 * Used to preserve the exact encoding of an already read entity.
	 * 
	 * @param start start position, as returned by {@link #position()}.
	 * @return copy of the consumed bytes
	 * @throws IllegalArgumentException if start is not within the consumed
	 *             range
	 */
	public byte[] consumedSince(int start) {
		if (start < offset || start > position) {
			throw new IllegalArgumentException("start " + start + " not within consumed range!");
		}
		return Arrays.copyOfRange(buffer, start, position);
	}

	/**
	 * Get current read position.
	 * 
	 * @return current read position.
	 * @see #consumedSince(int)
	 */
	public int position() {
		return position;
	}

	/**
	 * Assert, that all data is read.
	 * 
	 * @param message message to include in {@link IllegalArgumentException}
	 *            message.
	 * @throws IllegalArgumentException if bytes are left unread
	 */
	public void assertFinished(String message) {
		int left = available();
		if (left > 0) {
			throw new IllegalArgumentException(message + " not finished! " + left + " bytes left.");
		}
	}

	/**
	 * Checks if there are any more bytes available.
	 * 
	 * @return {@code true}, if there are bytes left to read, {@code false},
	 *         otherwise.
	 */
	public boolean bytesAvailable() {
		return position < limit;
	}

	/**
	 * Checks whether a given number of bytes can be read.
	 * 
	 * @param expectedBytes the number of bytes.
	 * @return {@code true} if the remaining number of bytes in the buffer is at
	 *         least <em>expectedBytes</em>. {@code false}, otherwise.
	 */
	public boolean bytesAvailable(final int expectedBytes) {
		return available() >= expectedBytes;
	}

	/**
	 * Get number of available bytes.
	 * 
	 * @return number of available bytes
	 */
	public int available() {
		return limit - position;
	}
}
