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
package org.eclipse.keystore.elements.config;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.config.Configuration.ModuleDefinitionsProvider;
import org.eclipse.keystore.elements.rule.LoggingRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(Small.class)
public class ConfigurationTest {

	private static final String MODULE = "TEST.";

	enum Mode {
		ON, OFF
	}

	static final IntegerDefinition COUNT = new IntegerDefinition(MODULE + "COUNT", "Test count.", 10, 1,
			100);
	static final BooleanDefinition FLAG = new BooleanDefinition(MODULE + "FLAG", "Test flag.", false);
	static final EnumDefinition<Mode> MODE = new EnumDefinition<>(MODULE + "MODE", "Test mode.", Mode.ON,
			Mode.values());

	private static final ModuleDefinitionsProvider DEFINITIONS = new ModuleDefinitionsProvider() {

		@Override
		public String getModule() {
			return MODULE;
		}

		@Override
		public void applyDefinitions(Configuration config) {
			config.set(COUNT, 10);
			config.set(FLAG, false);
			config.set(MODE, Mode.ON);
			DefinitionUtils.verify(ConfigurationTest.class, config);
		}
	};

	@Rule
	public LoggingRule logging = new LoggingRule();

	@Test
	public void testDefaults() {
		Configuration config = new Configuration(DEFINITIONS);
		assertThat(config.get(COUNT), is(10));
		assertThat(config.get(FLAG), is(false));
		assertThat(config.get(MODE), is(Mode.ON));
	}

	@Test
	public void testSetAndCopy() {
		Configuration config = new Configuration(DEFINITIONS);
		config.set(COUNT, 20).set(MODE, Mode.OFF);
		Configuration copy = new Configuration(config);
		assertThat(copy.get(COUNT), is(20));
		assertThat(copy.get(MODE), is(Mode.OFF));
		assertThat(copy.getAsText(MODE), is("OFF"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSetOutOfRange() {
		Configuration config = new Configuration(DEFINITIONS);
		config.set(COUNT, 200);
	}

	@Test
	public void testSetFromText() {
		Configuration config = new Configuration(DEFINITIONS);
		config.setFromText(FLAG, "true");
		assertThat(config.get(FLAG), is(true));
	}

	@Test
	public void testStoreAndLoad() throws IOException {
		Configuration config = new Configuration(DEFINITIONS);
		config.set(COUNT, 42);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		config.store(out, "Test", null);
		String properties = new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
		assertThat(properties, containsString("# Test count."));
		assertThat(properties, containsString("TEST.COUNT=42"));
		assertThat(properties, containsString("[ON, OFF]"));

		Configuration loaded = new Configuration(DEFINITIONS);
		loaded.load(new ByteArrayInputStream(out.toByteArray()));
		assertThat(loaded.get(COUNT), is(42));
	}

	@Test
	public void testLoadIgnoresInvalidValues() throws IOException {
		logging.setLoggingLevel("ERROR", Configuration.class);
		String properties = "TEST.COUNT=1000\nTEST.MODE=MAYBE\nTEST.UNKNOWN=1\nTEST.FLAG=true\n";
		Configuration config = new Configuration(DEFINITIONS);
		config.load(new ByteArrayInputStream(properties.getBytes(StandardCharsets.ISO_8859_1)));
		assertThat(config.get(COUNT), is(10));
		assertThat(config.get(MODE), is(Mode.ON));
		assertThat(config.get(FLAG), is(true));
	}
}
