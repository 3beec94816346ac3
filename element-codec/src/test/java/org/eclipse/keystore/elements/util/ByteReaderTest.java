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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;

import org.eclipse.keystore.elements.category.Small;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.ExpectedException;

/**
 * Verifies behavior of {@link ByteReader} and {@link ByteWriter}.
 */
@Category(Small.class)
public class ByteReaderTest {

	@Rule
	public ExpectedException exception = ExpectedExceptionWrapper.none();

	@Test
	public void testReadBytes() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2, 3, 4 });
		assertThat(reader.read(), is(1));
		assertArrayEquals(new byte[] { 2, 3 }, reader.readBytes(2));
		assertThat(reader.available(), is(1));
		assertArrayEquals(new byte[] { 4 }, reader.readBytesLeft());
		assertThat(reader.bytesAvailable(), is(false));
	}

	@Test
	public void testReadUnsigned() {
		ByteReader reader = new ByteReader(new byte[] { (byte) 0xff });
		assertThat(reader.read(), is(255));
	}

	@Test
	public void testReadBeyondEnd() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2 });
		exception.expect(IllegalArgumentException.class);
		exception.expectMessage("exceeds available 2 bytes");
		reader.readBytes(3);
	}

	@Test
	public void testMarkAndReset() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2, 3 });
		reader.read();
		reader.mark();
		reader.read();
		reader.reset();
		assertThat(reader.read(), is(2));
	}

	@Test
	public void testRangeReader() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2, 3, 4, 5 });
		reader.read();
		ByteReader range = reader.createRangeReader(3);
		assertThat(reader.read(), is(5));
		assertThat(range.available(), is(3));
		assertArrayEquals(new byte[] { 2, 3, 4 }, range.readBytesLeft());
	}

	@Test
	public void testConsumedSince() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2, 3, 4, 5 });
		ByteReader range = reader.createRangeReader(4);
		range.read();
		int start = range.position();
		range.skip(2);
		assertArrayEquals(new byte[] { 2, 3 }, range.consumedSince(start));
	}

	@Test
	public void testAssertFinished() {
		ByteReader reader = new ByteReader(new byte[] { 1, 2 });
		reader.read();
		exception.expect(IllegalArgumentException.class);
		exception.expectMessage("Test not finished! 1 bytes left.");
		reader.assertFinished("Test");
	}

	@Test
	public void testCopy() {
		byte[] data = { 1, 2 };
		ByteReader reader = new ByteReader(data);
		data[0] = 9;
		assertThat(reader.read(), is(1));
	}

	@Test
	public void testWriter() {
		ByteWriter writer = new ByteWriter(true);
		writer.writeByte((byte) 1);
		writer.writeBytes(new byte[] { 2, 3 });
		writer.writeBytes(null);
		writer.writeBytes(new byte[] { 0, 4, 0 }, 1, 1);
		assertThat(writer.size(), is(4));
		assertThat(writer.toString(), is("01020304"));
		assertArrayEquals(new byte[] { 1, 2, 3, 4 }, writer.toByteArray());
		assertThat(writer.size(), is(0));
	}

	@Test
	public void testWriterGrows() {
		ByteWriter writer = new ByteWriter(2, false);
		byte[] data = new byte[1000];
		data[999] = 7;
		writer.writeBytes(data);
		ByteWriter other = new ByteWriter();
		other.write(writer);
		byte[] result = other.toByteArray();
		assertThat(result.length, is(1000));
		assertThat(result[999], is((byte) 7));
	}
}
