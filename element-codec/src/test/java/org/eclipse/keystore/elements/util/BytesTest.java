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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;

import java.util.Random;

import org.eclipse.keystore.elements.category.Small;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Verifies behavior of {@link Bytes}.
 */
@Category(Small.class)
public class BytesTest {

	@Test
	public void testEquals() {
		Bytes bytes1 = new Bytes(new byte[] { 1, 2, 3 });
		Bytes bytes2 = new Bytes(new byte[] { 1, 2, 3 });
		Bytes bytes3 = new Bytes(new byte[] { 1, 2, 4 });
		assertThat(bytes1, is(bytes2));
		assertThat(bytes1.hashCode(), is(bytes2.hashCode()));
		assertThat(bytes1, is(not(bytes3)));
		assertThat(bytes1.getAsString(), is("010203"));
		assertThat(bytes1.length(), is(3));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMaxLength() {
		new Bytes(new byte[4], 3, false);
	}

	@Test
	public void testConcatenate() {
		assertArrayEquals(new byte[] { 1, 2, 3 }, Bytes.concatenate(new byte[] { 1 }, new byte[] { 2, 3 }));
	}

	@Test
	public void testFillRepeated() {
		byte[] destination = new byte[7];
		Bytes.fillRepeated(new byte[] { 1, 2, 3 }, destination);
		assertArrayEquals(new byte[] { 1, 2, 3, 1, 2, 3, 1 }, destination);
	}

	@Test
	public void testFillRepeatedEmptyDestination() {
		Bytes.fillRepeated(Bytes.EMPTY, Bytes.EMPTY);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFillRepeatedEmptySource() {
		Bytes.fillRepeated(Bytes.EMPTY, new byte[2]);
	}

	@Test
	public void testClear() {
		byte[] data = Bytes.createBytes(new Random(1), 16);
		Bytes.clear(data);
		assertArrayEquals(new byte[16], data);
		Bytes.clear(null);
	}
}
