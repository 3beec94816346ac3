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

import org.eclipse.keystore.elements.config.BooleanDefinition;
import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.config.Configuration.ModuleDefinitionsProvider;
import org.eclipse.keystore.elements.config.DefinitionUtils;
import org.eclipse.keystore.elements.config.EnumDefinition;
import org.eclipse.keystore.elements.config.IntegerDefinition;
import org.eclipse.keystore.pkcs12.crypto.DigestAlgorithm;
import org.eclipse.keystore.pkcs12.crypto.PbeAlgorithm;

/**
 * Configuration definitions for PKCS#12.
 */
public final class Pkcs12Config {

	public static final String MODULE = "PKCS12.";

	/**
	 * Policy for a failing MAC verification.
	 */
	public enum MacPolicy {
		/**
		 * A failing MAC fails the decoding.
		 */
		STRICT,
		/**
		 * A failing MAC is logged and reported as warning of the decoding
		 * result. The records are returned anyway.
		 * 
		 * Enables to read containers of producers, which encode the MAC not
		 * according RFC 7292. An attacker is then able to create
		 * unauthenticated containers, which are decoded as well.
		 */
		WARN
	}

	/**
	 * Default maximum iteration count.
	 */
	public static final int DEFAULT_MAX_ITERATION_COUNT = 2000000;
	/**
	 * Default iteration count for encoding.
	 */
	public static final int DEFAULT_ENCODE_ITERATION_COUNT = 2048;
	/**
	 * Default salt length for encoding.
	 */
	public static final int DEFAULT_ENCODE_SALT_LENGTH = 8;

	/**
	 * Maximum iteration count accepted for key derivation.
	 * 
	 * Iteration counts are provided by the container and must be bounded to
	 * limit the CPU usage.
	 */
	public static final IntegerDefinition MAX_ITERATION_COUNT = new IntegerDefinition(
			MODULE + "MAX_ITERATION_COUNT", "Maximum iteration count for key derivation.",
			DEFAULT_MAX_ITERATION_COUNT, 1);
	/**
	 * Maximum nesting depth of safe contents bags.
	 */
	public static final IntegerDefinition MAX_NESTING_DEPTH = new IntegerDefinition(MODULE + "MAX_NESTING_DEPTH",
			"Maximum nesting depth of safe contents bags.", 8, 1);
	public static final EnumDefinition<MacPolicy> MAC_POLICY = new EnumDefinition<>(MODULE + "MAC_POLICY",
			"Policy for a failing MAC verification.", MacPolicy.STRICT, MacPolicy.values());
	/**
	 * Fail, if a container has no MAC. Otherwise a missing MAC is reported as
	 * warning.
	 */
	public static final BooleanDefinition REQUIRE_MAC = new BooleanDefinition(MODULE + "REQUIRE_MAC",
			"Require MAC for decoding.", false);
	public static final EnumDefinition<DigestAlgorithm> MAC_ALGORITHM = new EnumDefinition<>(
			MODULE + "MAC_ALGORITHM", "Digest algorithm of MAC for encoding.", DigestAlgorithm.SHA1,
			DigestAlgorithm.values());
	public static final IntegerDefinition ENCODE_ITERATION_COUNT = new IntegerDefinition(
			MODULE + "ENCODE_ITERATION_COUNT", "Iteration count of encryption for encoding.",
			DEFAULT_ENCODE_ITERATION_COUNT, 1);
	public static final IntegerDefinition ENCODE_MAC_ITERATION_COUNT = new IntegerDefinition(
			MODULE + "ENCODE_MAC_ITERATION_COUNT", "Iteration count of MAC for encoding.",
			DEFAULT_ENCODE_ITERATION_COUNT, 1);
	public static final IntegerDefinition ENCODE_SALT_LENGTH = new IntegerDefinition(MODULE + "ENCODE_SALT_LENGTH",
			"Salt length in bytes for encoding.", DEFAULT_ENCODE_SALT_LENGTH, 8, 64);
	/**
	 * Encryption of private keys for encoding.
	 */
	public static final EnumDefinition<PbeAlgorithm> KEY_ENCRYPTION = new EnumDefinition<>(
			MODULE + "KEY_ENCRYPTION", "Encryption of private keys for encoding.", PbeAlgorithm.PBE_SHA1_3DES,
			PbeAlgorithm.values());
	/**
	 * Encryption of certificates and CRLs for encoding.
	 * 
	 * @see #ENCRYPT_CERTIFICATES
	 */
	public static final EnumDefinition<PbeAlgorithm> CERTIFICATE_ENCRYPTION = new EnumDefinition<>(
			MODULE + "CERTIFICATE_ENCRYPTION", "Encryption of certificates for encoding.",
			PbeAlgorithm.PBE_SHA1_RC2_40, PbeAlgorithm.values());
	public static final BooleanDefinition ENCRYPT_CERTIFICATES = new BooleanDefinition(
			MODULE + "ENCRYPT_CERTIFICATES", "Encrypt certificates for encoding.", true);
	/**
	 * Decrypt secrets of type pkcs8ShroudedKeyBag, as used by keytool for
	 * secret keys.
	 */
	public static final BooleanDefinition DECRYPT_SHROUDED_SECRETS = new BooleanDefinition(
			MODULE + "DECRYPT_SHROUDED_SECRETS", "Decrypt shrouded secrets.", true);

	public static final ModuleDefinitionsProvider DEFINITIONS = new ModuleDefinitionsProvider() {

		@Override
		public String getModule() {
			return MODULE;
		}

		@Override
		public void applyDefinitions(Configuration config) {
			config.set(MAX_ITERATION_COUNT, DEFAULT_MAX_ITERATION_COUNT);
			config.set(MAX_NESTING_DEPTH, 8);
			config.set(MAC_POLICY, MacPolicy.STRICT);
			config.set(REQUIRE_MAC, false);
			config.set(MAC_ALGORITHM, DigestAlgorithm.SHA1);
			config.set(ENCODE_ITERATION_COUNT, DEFAULT_ENCODE_ITERATION_COUNT);
			config.set(ENCODE_MAC_ITERATION_COUNT, DEFAULT_ENCODE_ITERATION_COUNT);
			config.set(ENCODE_SALT_LENGTH, DEFAULT_ENCODE_SALT_LENGTH);
			config.set(KEY_ENCRYPTION, PbeAlgorithm.PBE_SHA1_3DES);
			config.set(CERTIFICATE_ENCRYPTION, PbeAlgorithm.PBE_SHA1_RC2_40);
			config.set(ENCRYPT_CERTIFICATES, true);
			config.set(DECRYPT_SHROUDED_SECRETS, true);

			DefinitionUtils.verify(Pkcs12Config.class, config);
		}
	};

	static {
		Configuration.addDefaultModule(DEFINITIONS);
	}

	/**
	 * Register definitions of this module to the default definitions.
	 */
	public static void register() {
		// empty, registered by the static initializer
	}

	private Pkcs12Config() {
	}
}
