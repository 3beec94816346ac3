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
package org.eclipse.keystore.pkcs12;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.rule.LoggingRule;
import org.eclipse.keystore.pkcs12.Pkcs12Config.MacPolicy;
import org.eclipse.keystore.pkcs12.crypto.DigestAlgorithm;
import org.eclipse.keystore.pkcs12.crypto.PbeAlgorithm;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class Pkcs12ConfigTest {

	@Rule
	public LoggingRule logging = new LoggingRule();

	@Test
	public void testDefaults() {
		Configuration config = Pkcs12TestUtil.createConfiguration();
		assertThat(config.get(Pkcs12Config.MAX_ITERATION_COUNT), is(Pkcs12Config.DEFAULT_MAX_ITERATION_COUNT));
		assertThat(config.get(Pkcs12Config.MAX_NESTING_DEPTH), is(8));
		assertThat(config.get(Pkcs12Config.MAC_POLICY), is(MacPolicy.STRICT));
		assertThat(config.get(Pkcs12Config.REQUIRE_MAC), is(false));
		assertThat(config.get(Pkcs12Config.MAC_ALGORITHM), is(DigestAlgorithm.SHA1));
		assertThat(config.get(Pkcs12Config.KEY_ENCRYPTION), is(PbeAlgorithm.PBE_SHA1_3DES));
		assertThat(config.get(Pkcs12Config.CERTIFICATE_ENCRYPTION), is(PbeAlgorithm.PBE_SHA1_RC2_40));
		assertThat(config.get(Pkcs12Config.ENCRYPT_CERTIFICATES), is(true));
		assertThat(config.get(Pkcs12Config.DECRYPT_SHROUDED_SECRETS), is(true));
	}

	@Test
	public void testLoad() throws IOException {
		logging.setLoggingLevel("ERROR", Configuration.class);
		String properties = "PKCS12.MAC_POLICY=WARN\n" + "PKCS12.MAX_ITERATION_COUNT=5000\n"
				+ "PKCS12.KEY_ENCRYPTION=PBE_SHA1_RC2_128\n" + "PKCS12.ENCODE_SALT_LENGTH=4\n";
		Configuration config = Pkcs12TestUtil.createConfiguration();
		config.load(new ByteArrayInputStream(properties.getBytes(StandardCharsets.ISO_8859_1)));
		assertThat(config.get(Pkcs12Config.MAC_POLICY), is(MacPolicy.WARN));
		assertThat(config.get(Pkcs12Config.MAX_ITERATION_COUNT), is(5000));
		assertThat(config.get(Pkcs12Config.KEY_ENCRYPTION), is(PbeAlgorithm.PBE_SHA1_RC2_128));
		// out of range, default is used
		assertThat(config.get(Pkcs12Config.ENCODE_SALT_LENGTH), is(Pkcs12Config.DEFAULT_ENCODE_SALT_LENGTH));
	}

	@Test
	public void testStore() {
		Configuration config = Pkcs12TestUtil.createConfiguration();
		config.set(Pkcs12Config.MAC_ALGORITHM, DigestAlgorithm.SHA256);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		config.store(out, "PKCS12", "test");
		String text = new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
		assertThat(text, containsString("PKCS12.MAC_ALGORITHM=SHA256"));
		assertThat(text, containsString("PKCS12.MAC_POLICY=STRICT"));
	}
}
