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

import static org.eclipse.keystore.elements.util.Asn1DerEncoder.integer;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.nullEntity;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.octetString;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.oid;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.sequence;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.pkcs12.EntryType;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class PrivateKeyClassifierTest {

	private static final byte[] RSA_ALGORITHM = sequence(oid("1.2.840.113549.1.1.1"), nullEntity());

	@Test
	public void testPkcs8() throws Pkcs12StructureException {
		byte[] key = sequence(integer(0), RSA_ALGORITHM, octetString(new byte[] { 1, 2, 3 }));
		assertThat(PrivateKeyClassifier.classify(key), is(EntryType.PRIVATE_KEY_PKCS8));
	}

	@Test
	public void testOneAsymmetricKey() throws Pkcs12StructureException {
		byte[] key = sequence(integer(1), RSA_ALGORITHM, octetString(new byte[] { 1, 2, 3 }));
		assertThat(PrivateKeyClassifier.classify(key), is(EntryType.PRIVATE_KEY_PKCS8));
	}

	@Test
	public void testRsaPrivateKey() throws Pkcs12StructureException {
		byte[] key = sequence(integer(0), integer(3233), integer(17), integer(2753));
		assertThat(PrivateKeyClassifier.classify(key), is(EntryType.PRIVATE_KEY_LEGACY));
	}

	@Test
	public void testEcPrivateKey() throws Pkcs12StructureException {
		byte[] key = sequence(integer(1), octetString(new byte[32]));
		assertThat(PrivateKeyClassifier.classify(key), is(EntryType.EC_PRIVATE_KEY));
	}

	@Test(expected = Pkcs12StructureException.class)
	public void testUnknownVersion() throws Pkcs12StructureException {
		PrivateKeyClassifier.classify(sequence(integer(2), octetString(new byte[32])));
	}

	@Test(expected = Pkcs12StructureException.class)
	public void testEcPrivateKeyWithWrongVersion() throws Pkcs12StructureException {
		PrivateKeyClassifier.classify(sequence(integer(0), octetString(new byte[32])));
	}

	@Test(expected = Pkcs12StructureException.class)
	public void testNoSequence() throws Pkcs12StructureException {
		PrivateKeyClassifier.classify(octetString(new byte[32]));
	}

	@Test(expected = Pkcs12StructureException.class)
	public void testTruncated() throws Pkcs12StructureException {
		byte[] key = sequence(integer(0), integer(3233), integer(17));
		byte[] truncated = new byte[key.length - 2];
		System.arraycopy(key, 0, truncated, 0, truncated.length);
		PrivateKeyClassifier.classify(truncated);
	}
}
