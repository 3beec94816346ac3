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
package org.eclipse.keystore.pkcs12.bag;

import static org.eclipse.keystore.elements.util.Asn1DerEncoder.contextSpecific;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.integer;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.nullEntity;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.octetString;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.oid;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.sequence;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.util.ExpectedExceptionWrapper;
import org.eclipse.keystore.pkcs12.BagAttributes;
import org.eclipse.keystore.pkcs12.EntryType;
import org.eclipse.keystore.pkcs12.Pkcs12Config;
import org.eclipse.keystore.pkcs12.Pkcs12Entry;
import org.eclipse.keystore.pkcs12.Pkcs12Exception;
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12TestUtil;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.crypto.PbeEngine;
import org.eclipse.keystore.pkcs12.model.BagAttribute;
import org.eclipse.keystore.pkcs12.model.SafeBag;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.ExpectedException;

@Category(Small.class)
public class BagCodecTest {

	private static final char[] PASSWORD = "secret".toCharArray();
	private static final byte[] PKCS8_KEY = sequence(integer(0), sequence(oid("1.2.840.10045.2.1"), nullEntity()),
			octetString(new byte[] { 4, 5, 6 }));
	private static final byte[] CERTIFICATE = sequence(sequence(integer(2), integer(4711)));
	private static final BagAttributes ATTRIBUTES = new BagAttributes("test-1", "Time 1".getBytes());

	@Rule
	public ExpectedException exception = ExpectedExceptionWrapper.none();

	private Configuration config;
	private BagCodec codec;

	@Before
	public void setup() {
		config = Pkcs12TestUtil.createConfiguration();
		config.set(Pkcs12Config.ENCODE_ITERATION_COUNT, 10);
		codec = new BagCodec(config, new PbeEngine(config, new SecureRandom()));
	}

	@Test
	public void testShroudedKey() throws Pkcs12Exception {
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.PRIVATE_KEY_PKCS8, ATTRIBUTES, PKCS8_KEY);
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(bag.getBagId(), is(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG));
		assertThat(bag.getAttributes().size(), is(2));
		assertThat(decode(bag, PASSWORD), is(entry));
	}

	@Test
	public void testKeyBag() throws Pkcs12Exception {
		byte[] key = sequence(integer(1), octetString(new byte[32]));
		SafeBag bag = new SafeBag(Pkcs12Oids.KEY_BAG, key, Collections.<BagAttribute> emptyList());
		Pkcs12Entry entry = decode(bag, null);
		assertThat(entry.getType(), is(EntryType.EC_PRIVATE_KEY));
		assertArrayEquals(key, entry.getPayload());
	}

	@Test
	public void testCertificate() throws Pkcs12Exception {
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.CERTIFICATE, ATTRIBUTES, CERTIFICATE);
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(bag.getBagId(), is(Pkcs12Oids.CERT_BAG));
		assertArrayEquals(sequence(oid(Pkcs12Oids.X509_CERTIFICATE), contextSpecific(0, octetString(CERTIFICATE))),
				bag.getBagValue());
		assertThat(decode(bag, PASSWORD), is(entry));
	}

	@Test
	public void testCrl() throws Pkcs12Exception {
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.CRL, null, CERTIFICATE);
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(bag.getBagId(), is(Pkcs12Oids.CRL_BAG));
		assertThat(bag.getAttributes().isEmpty(), is(true));
		assertThat(decode(bag, PASSWORD), is(entry));
	}

	@Test
	public void testUnknownCertificateType() throws Pkcs12Exception {
		// sdsiCertificate
		byte[] value = sequence(oid("1.2.840.113549.1.9.22.2"), contextSpecific(0, octetString(CERTIFICATE)));
		SafeBag bag = new SafeBag(Pkcs12Oids.CERT_BAG, value, Collections.<BagAttribute> emptyList());

		exception.expect(Pkcs12UnsupportedException.class);
		exception.expectMessage(containsString("1.2.840.113549.1.9.22.2"));
		decode(bag, PASSWORD);
	}

	@Test
	public void testUnknownCrlType() throws Pkcs12Exception {
		byte[] value = sequence(oid("1.2.3.4"), contextSpecific(0, octetString(CERTIFICATE)));
		SafeBag bag = new SafeBag(Pkcs12Oids.CRL_BAG, value, Collections.<BagAttribute> emptyList());

		exception.expect(Pkcs12UnsupportedException.class);
		decode(bag, PASSWORD);
	}

	@Test
	public void testMalformedCertBag() throws Pkcs12Exception {
		SafeBag bag = new SafeBag(Pkcs12Oids.CERT_BAG, integer(5), Collections.<BagAttribute> emptyList());

		exception.expect(Pkcs12StructureException.class);
		exception.expectMessage(containsString("CertBag"));
		decode(bag, PASSWORD);
	}

	@Test
	public void testSecret() throws Pkcs12Exception {
		byte[] secret = "my secret".getBytes();
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.SECRET, ATTRIBUTES, secret);
		assertThat(entry.getTypeId(), is(Pkcs12Oids.SECRET_BAG));
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(bag.getBagId(), is(Pkcs12Oids.SECRET_BAG));
		assertThat(decode(bag, PASSWORD), is(entry));
	}

	@Test
	public void testShroudedSecret() throws Pkcs12Exception {
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.SECRET, ATTRIBUTES, PKCS8_KEY,
				Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG);
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(Arrays.equals(bag.getBagValue(), sequence(oid(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG),
				contextSpecific(0, octetString(PKCS8_KEY)))), is(false));
		assertThat(decode(bag, PASSWORD), is(entry));
	}

	@Test
	public void testShroudedSecretNotDecrypted() throws Pkcs12Exception {
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.SECRET, ATTRIBUTES, PKCS8_KEY,
				Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG);
		SafeBag bag = codec.encode(entry, PASSWORD);
		config.set(Pkcs12Config.DECRYPT_SHROUDED_SECRETS, false);
		codec = new BagCodec(config, new PbeEngine(config, new SecureRandom()));
		Pkcs12Entry secret = decode(bag, PASSWORD);
		assertThat(secret.getType(), is(EntryType.SECRET));
		assertThat(secret.getTypeId(), is(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG));
		assertThat(secret, is(not(entry)));
	}

	@Test
	public void testSecretWithDerValue() throws Pkcs12Exception {
		byte[] secret = sequence(integer(7));
		byte[] value = sequence(oid("1.2.3.4"), contextSpecific(0, secret));
		SafeBag bag = new SafeBag(Pkcs12Oids.SECRET_BAG, value, ATTRIBUTES.toAttributes());
		Pkcs12Entry entry = decode(bag, PASSWORD);
		assertThat(entry.getType(), is(EntryType.SECRET));
		assertThat(entry.getTypeId(), is("1.2.3.4"));
		assertThat(entry.isEncodedValue(), is(true));
		assertArrayEquals(secret, entry.getPayload());

		SafeBag encoded = codec.encode(entry, PASSWORD);
		assertArrayEquals(bag.toByteArray(), encoded.toByteArray());
	}

	@Test
	public void testShroudedSecretWithDerValueIsNotDecrypted() throws Pkcs12Exception {
		byte[] secret = sequence(integer(7));
		byte[] value = sequence(oid(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG), contextSpecific(0, secret));
		SafeBag bag = new SafeBag(Pkcs12Oids.SECRET_BAG, value, Collections.<BagAttribute> emptyList());
		Pkcs12Entry entry = decode(bag, PASSWORD);
		assertThat(entry.isEncodedValue(), is(true));
		assertArrayEquals(secret, entry.getPayload());
		assertArrayEquals(value, codec.encode(entry, PASSWORD).getBagValue());
	}

	@Test
	public void testSecretWithoutValue() throws Pkcs12Exception {
		byte[] value = sequence(oid("1.2.3.4"), contextSpecific(0));
		SafeBag bag = new SafeBag(Pkcs12Oids.SECRET_BAG, value, Collections.<BagAttribute> emptyList());

		exception.expect(Pkcs12StructureException.class);
		exception.expectMessage(containsString("SecretBag"));
		decode(bag, PASSWORD);
	}

	@Test
	public void testOpaquePassThrough() throws Pkcs12Exception {
		byte[] value = sequence(integer(7), octetString(new byte[] { 1, 2 }));
		List<BagAttribute> attributes = ATTRIBUTES.toAttributes();
		SafeBag bag = new SafeBag("1.2.3.4.5", value, attributes);
		Pkcs12Entry entry = decode(bag, PASSWORD);
		assertThat(entry.getType(), is(EntryType.OPAQUE));
		assertThat(entry.getTypeId(), is("1.2.3.4.5"));
		assertThat(entry.getFriendlyName(), is("test-1"));
		assertArrayEquals(value, entry.getPayload());

		SafeBag encoded = codec.encode(entry, PASSWORD);
		assertArrayEquals(bag.toByteArray(), encoded.toByteArray());
	}

	@Test
	public void testUnknownAttributeIsPreserved() throws Pkcs12Exception {
		List<BagAttribute> attributes = new ArrayList<>(ATTRIBUTES.toAttributes());
		attributes.add(new BagAttribute("1.2.3.4", Collections.singletonList(integer(1))));
		Pkcs12Entry entry = new Pkcs12Entry(EntryType.CERTIFICATE,
				new BagAttributes("test-1", "Time 1".getBytes(), attributes.subList(2, 3)), CERTIFICATE);
		SafeBag bag = codec.encode(entry, PASSWORD);
		assertThat(bag.getAttributes().size(), is(3));
		Pkcs12Entry decoded = decode(bag, PASSWORD);
		assertThat(decoded.getAttributes().getOthers().size(), is(1));
		assertThat(decoded.getAttributes().getOthers().get(0).getOid(), is("1.2.3.4"));
		assertThat(decoded, is(entry));
	}

	@Test
	public void testNestedSafeContents() throws Pkcs12Exception {
		SafeBag cert = codec.encode(new Pkcs12Entry(EntryType.CERTIFICATE, ATTRIBUTES, CERTIFICATE), PASSWORD);
		SafeBag key = codec.encode(new Pkcs12Entry(EntryType.PRIVATE_KEY_PKCS8, ATTRIBUTES, PKCS8_KEY), PASSWORD);
		SafeBag inner = new SafeBag(Pkcs12Oids.SAFE_CONTENTS_BAG, SafeBag.toSafeContents(Arrays.asList(cert)),
				Collections.<BagAttribute> emptyList());
		SafeBag outer = new SafeBag(Pkcs12Oids.SAFE_CONTENTS_BAG, SafeBag.toSafeContents(Arrays.asList(inner, key)),
				Collections.<BagAttribute> emptyList());

		List<Pkcs12Entry> entries = new ArrayList<>();
		codec.decode(Arrays.asList(outer), PASSWORD, entries);
		assertThat(entries.size(), is(2));
		assertThat(entries.get(0).getType(), is(EntryType.CERTIFICATE));
		assertThat(entries.get(1).getType(), is(EntryType.PRIVATE_KEY_PKCS8));
	}

	@Test
	public void testNestingTooDeep() throws Pkcs12Exception {
		config.set(Pkcs12Config.MAX_NESTING_DEPTH, 2);
		codec = new BagCodec(config, new PbeEngine(config, new SecureRandom()));
		SafeBag bag = codec.encode(new Pkcs12Entry(EntryType.CERTIFICATE, ATTRIBUTES, CERTIFICATE), PASSWORD);
		for (int depth = 0; depth < 2; ++depth) {
			bag = new SafeBag(Pkcs12Oids.SAFE_CONTENTS_BAG, SafeBag.toSafeContents(Arrays.asList(bag)),
					Collections.<BagAttribute> emptyList());
		}

		exception.expect(Pkcs12StructureException.class);
		exception.expectMessage(containsString("nested"));
		decode(bag, PASSWORD);
	}

	private Pkcs12Entry decode(SafeBag bag, char[] password) throws Pkcs12Exception {
		List<Pkcs12Entry> entries = new ArrayList<>();
		codec.decode(Arrays.asList(bag), password, entries);
		assertThat(entries.size(), is(1));
		return entries.get(0);
	}
}
