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
package org.eclipse.keystore.pkcs12.model;

import static org.eclipse.keystore.elements.util.Asn1DerEncoder.contextSpecific;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.integer;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.octetString;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.oid;
import static org.eclipse.keystore.elements.util.Asn1DerEncoder.sequence;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;

import java.util.Arrays;
import java.util.List;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.elements.util.ExpectedExceptionWrapper;
import org.eclipse.keystore.pkcs12.Pkcs12Exception;
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.crypto.PbeAlgorithm;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.ExpectedException;

/**
 * Verifies the structural layers of the container.
 */
@Category(Small.class)
public class ContentInfoTest {

	private static final byte[] PBE_PARAMETERS = new PbeParameters(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 }, 2048)
			.toByteArray();
	private static final AlgorithmIdentifier ALGORITHM = new AlgorithmIdentifier(
			PbeAlgorithm.PBE_SHA1_RC2_40.getOid(), PBE_PARAMETERS);

	@Rule
	public ExpectedException exception = ExpectedExceptionWrapper.none();

	@Test
	public void testAuthenticatedSafe() throws Pkcs12Exception {
		ContentInfo data = ContentInfo.data(new byte[] { 0x30, 0x00 });
		ContentInfo encrypted = ContentInfo.encrypted(new EncryptedContent(ALGORITHM, new byte[16]));
		byte[] der = ContentInfo.toAuthenticatedSafe(Arrays.asList(data, encrypted));

		List<ContentInfo> contentInfos = ContentInfo.fromAuthenticatedSafe(der);
		assertThat(contentInfos.size(), is(2));
		assertThat(contentInfos.get(0).isEncrypted(), is(false));
		assertThat(contentInfos.get(0).getContentType(), is(Pkcs12Oids.DATA));
		assertArrayEquals(new byte[] { 0x30, 0x00 }, contentInfos.get(0).getData());
		assertThat(contentInfos.get(1).isEncrypted(), is(true));
		assertThat(contentInfos.get(1).getContentType(), is(Pkcs12Oids.ENCRYPTED_DATA));
		EncryptedContent content = contentInfos.get(1).getEncryptedContent();
		assertThat(content.getAlgorithm(), is(ALGORITHM));
		assertArrayEquals(new byte[16], content.getCiphertext());

		PbeParameters parameters = PbeParameters.fromDer(content.getAlgorithm().getParameters());
		assertThat(parameters.getIterations(), is(2048));
		assertArrayEquals(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 }, parameters.getSalt());
	}

	@Test
	public void testConstructedCiphertext() throws Pkcs12Exception {
		byte[] info = sequence(oid(Pkcs12Oids.DATA), ALGORITHM.toByteArray(),
				contextSpecific(0, octetString(new byte[] { 1, 2, 3 }), octetString(new byte[] { 4, 5 })));
		byte[] encryptedData = sequence(integer(0), info);
		EncryptedContent content = EncryptedContent.fromReader(new ByteReader(encryptedData));
		assertArrayEquals(new byte[] { 1, 2, 3, 4, 5 }, content.getCiphertext());
	}

	@Test
	public void testEncryptedContentOtherThanData() throws Pkcs12Exception {
		byte[] info = sequence(oid(Pkcs12Oids.ENVELOPED_DATA), ALGORITHM.toByteArray());

		exception.expect(Pkcs12UnsupportedException.class);
		EncryptedContent.fromReader(new ByteReader(sequence(integer(0), info)));
	}

	@Test
	public void testMissingCiphertext() throws Pkcs12Exception {
		byte[] info = sequence(oid(Pkcs12Oids.DATA), ALGORITHM.toByteArray());

		exception.expect(Pkcs12StructureException.class);
		EncryptedContent.fromReader(new ByteReader(sequence(integer(0), info)));
	}

	@Test
	public void testTrailingBytes() throws Pkcs12Exception {
		byte[] der = ContentInfo.toAuthenticatedSafe(Arrays.asList(ContentInfo.data(new byte[] { 0x30, 0x00 })));
		byte[] trailing = Arrays.copyOf(der, der.length + 1);

		exception.expect(Pkcs12StructureException.class);
		exception.expectMessage(containsString("AuthenticatedSafe"));
		ContentInfo.fromAuthenticatedSafe(trailing);
	}

	@Test
	public void testMacDataDefaultIterations() throws Pkcs12Exception {
		AlgorithmIdentifier sha1 = new AlgorithmIdentifier("1.3.14.3.2.26", null);
		MacData macData = new MacData(sha1, new byte[20], new byte[8], 1);
		byte[] der = macData.toByteArray();
		MacData decoded = MacData.fromReader(new ByteReader(der));
		assertThat(decoded.getIterations(), is(1));
		assertThat(decoded.getDigestAlgorithm().getParameters(), is(nullValue()));
	}

	@Test
	public void testMacDataWrongDigestLength() throws Pkcs12Exception {
		AlgorithmIdentifier sha1 = new AlgorithmIdentifier("1.3.14.3.2.26", null);
		byte[] der = new MacData(sha1, new byte[16], new byte[8], 2048).toByteArray();

		exception.expect(Pkcs12StructureException.class);
		exception.expectMessage(containsString("16"));
		MacData.fromReader(new ByteReader(der));
	}

	@Test
	public void testMissingPbeParameters() throws Pkcs12Exception {
		exception.expect(Pkcs12StructureException.class);
		PbeParameters.fromDer(null);
	}
}
