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
package org.eclipse.keystore.pkcs12.crypto;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;

import java.io.IOException;
import java.security.SecureRandom;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.rule.LoggingRule;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.elements.util.ExpectedExceptionWrapper;
import org.eclipse.keystore.elements.util.StringUtil;
import org.eclipse.keystore.pkcs12.Pkcs12Config;
import org.eclipse.keystore.pkcs12.Pkcs12Exception;
import org.eclipse.keystore.pkcs12.Pkcs12IntegrityException;
import org.eclipse.keystore.pkcs12.Pkcs12TestUtil;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.model.AlgorithmIdentifier;
import org.eclipse.keystore.pkcs12.model.MacData;
import org.eclipse.keystore.pkcs12.model.Pfx;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.ExpectedException;

@Category(Small.class)
public class MacEngineTest {

	private static final byte[] DATA = "authenticated safe".getBytes();
	private static final char[] PASSWORD = "secret".toCharArray();

	@Rule
	public LoggingRule logging = new LoggingRule();

	@Rule
	public ExpectedException exception = ExpectedExceptionWrapper.none();

	private Configuration config;
	private MacEngine engine;

	@Before
	public void setup() {
		config = Pkcs12TestUtil.createConfiguration();
		config.set(Pkcs12Config.ENCODE_MAC_ITERATION_COUNT, 100);
		engine = new MacEngine(config, new SecureRandom());
	}

	@Test
	public void testVerifyKeystore() throws IOException, Pkcs12Exception {
		Pfx pfx = Pfx.fromDer(Pkcs12TestUtil.loadKeystore());
		MacData macData = pfx.getMacData();
		assertThat(macData.getIterations(), is(100000));
		assertThat(StringUtil.byteArray2Hex(macData.getDigest()), is("DDE39F3FCE670E0F2EF9DCE4370CDAC7464F5B22"));
		char[] password = engine.verify(macData, Pkcs12TestUtil.PASSWORD, pfx.getAuthSafe().getData());
		assertArrayEquals(Pkcs12TestUtil.PASSWORD, password);
	}

	@Test
	public void testCreateAndVerify() throws Pkcs12Exception {
		for (DigestAlgorithm digest : DigestAlgorithm.values()) {
			config.set(Pkcs12Config.MAC_ALGORITHM, digest);
			engine = new MacEngine(config, new SecureRandom());
			MacData macData = engine.create(PASSWORD, DATA);
			assertThat(macData.getDigestAlgorithm().getOid(), is(digest.getOid()));
			assertThat(macData.getDigest().length, is(digest.getOutputLength()));
			assertThat(macData.getIterations(), is(100));
			MacData decoded = MacData.fromReader(new ByteReader(macData.toByteArray()));
			assertArrayEquals(PASSWORD, engine.verify(decoded, PASSWORD, DATA));
		}
	}

	@Test
	public void testWrongPassword() throws Pkcs12Exception {
		MacData macData = engine.create(PASSWORD, DATA);

		exception.expect(Pkcs12IntegrityException.class);
		engine.verify(macData, "wrong".toCharArray(), DATA);
	}

	@Test
	public void testTamperedData() throws Pkcs12Exception {
		MacData macData = engine.create(PASSWORD, DATA);
		byte[] tampered = DATA.clone();
		tampered[0] ^= 1;

		exception.expect(Pkcs12IntegrityException.class);
		engine.verify(macData, PASSWORD, tampered);
	}

	@Test
	public void testEmptyPasswordFallsBackToAbsentPassword() throws Pkcs12Exception {
		logging.setLoggingLevel("ERROR", MacEngine.class);
		MacData macData = engine.create(null, DATA);
		assertThat(engine.verify(macData, new char[0], DATA), is(nullValue()));
		assertThat(engine.verify(macData, null, DATA), is(nullValue()));
	}

	@Test
	public void testAbsentPasswordDoesNotMatchEmptyPassword() throws Pkcs12Exception {
		MacData macData = engine.create(new char[0], DATA);

		exception.expect(Pkcs12IntegrityException.class);
		engine.verify(macData, null, DATA);
	}

	@Test
	public void testUnknownDigest() throws Pkcs12Exception {
		MacData macData = engine.create(PASSWORD, DATA);
		AlgorithmIdentifier md5 = new AlgorithmIdentifier("1.2.840.113549.2.5", Asn1DerEncoder.nullEntity());
		MacData unknown = new MacData(md5, macData.getDigest(), macData.getSalt(), macData.getIterations());

		exception.expect(Pkcs12UnsupportedException.class);
		exception.expectMessage(containsString("1.2.840.113549.2.5"));
		engine.verify(unknown, PASSWORD, DATA);
	}

	@Test
	public void testIterationCountExceedsMaximum() throws Pkcs12Exception {
		MacData macData = engine.create(PASSWORD, DATA);
		config.set(Pkcs12Config.MAX_ITERATION_COUNT, 99);
		engine = new MacEngine(config, new SecureRandom());

		exception.expect(Pkcs12UnsupportedException.class);
		engine.verify(macData, PASSWORD, DATA);
	}
}
