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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.keystore.elements.category.Small;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Verifies behavior of {@link Asn1DerEncoder}.
 */
@Category(Small.class)
public class Asn1DerEncoderTest {

	@Test
	public void testOid() {
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.oid("1.2.840.113549.1.12.10.1.2")),
				is("060B2A864886F70D010C0A0102"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.oid("1.3.14.3.2.26")), is("06052B0E03021A"));
	}

	@Test
	public void testOidDecodesToSameString() {
		String[] oids = { "1.2.840.113549.1.9.22.1", "2.16.840.1.101.3.4.2.3", "2.999.1" };
		for (String oid : oids) {
			ByteReader reader = new ByteReader(Asn1DerEncoder.oid(oid));
			assertThat(Asn1DerDecoder.readOidString(reader), is(oid));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidOid() {
		Asn1DerEncoder.oid("1.40.2");
	}

	@Test
	public void testIntegerMinimalEncoding() {
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(0)), is("020100"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(3)), is("020103"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(128)), is("02020080"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(2048)), is("02020800"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(-1)), is("0201FF"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.integer(-129)), is("0202FF7F"));
	}

	@Test
	public void testLongLength() {
		byte[] octetString = Asn1DerEncoder.octetString(new byte[0x10000]);
		assertThat(StringUtil.byteArray2Hex(octetString).substring(0, 10), is("0483010000"));
	}

	@Test
	public void testSetOfIsSorted() {
		List<byte[]> elements = new ArrayList<>();
		elements.add(Asn1DerEncoder.integer(5));
		elements.add(Asn1DerEncoder.octetString(new byte[] { 1 }));
		elements.add(Asn1DerEncoder.integer(1));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.setOf(elements)), is("3109020101020105040101"));
	}

	@Test
	public void testContextSpecific() {
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.contextSpecific(0, Asn1DerEncoder.nullEntity())),
				is("A0020500"));
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.implicitOctets(0, new byte[] { 7 })), is("800107"));
	}

	@Test
	public void testBmpString() {
		assertThat(StringUtil.byteArray2Hex(Asn1DerEncoder.bmpString("ab")), is("1E0400610062"));
	}
}
