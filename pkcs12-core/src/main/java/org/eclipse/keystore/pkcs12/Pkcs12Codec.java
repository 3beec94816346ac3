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

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.pkcs12.Pkcs12Config.MacPolicy;
import org.eclipse.keystore.pkcs12.bag.BagCodec;
import org.eclipse.keystore.pkcs12.crypto.MacEngine;
import org.eclipse.keystore.pkcs12.crypto.PbeAlgorithm;
import org.eclipse.keystore.pkcs12.crypto.PbeEngine;
import org.eclipse.keystore.pkcs12.model.AlgorithmIdentifier;
import org.eclipse.keystore.pkcs12.model.ContentInfo;
import org.eclipse.keystore.pkcs12.model.EncryptedContent;
import org.eclipse.keystore.pkcs12.model.MacData;
import org.eclipse.keystore.pkcs12.model.PbeParameters;
import org.eclipse.keystore.pkcs12.model.Pfx;
import org.eclipse.keystore.pkcs12.model.SafeBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PKCS#12 container codec.
 * 
 * Decodes a container into an ordered list of plaintext entries, and encodes
 * entries into a container.
 * 
 * The codec holds no state per call and may be shared between threads.
 * 
 * <pre>
 * Configuration config = new Configuration(Pkcs12Config.DEFINITIONS);
 * Pkcs12Codec codec = new Pkcs12Codec(config);
 * Pkcs12Content content = codec.decode(der, "changeit".toCharArray());
 * for (Pkcs12Entry entry : content.getEntries(EntryType.CERTIFICATE)) {
 *    ...
 * }
 * </pre>
 * 
 * Passwords are provided as {@code char[]}. An empty array is the empty
 * password, {@code null} is the absent password.
 */
public class Pkcs12Codec {

	private static final Logger LOGGER = LoggerFactory.getLogger(Pkcs12Codec.class);

	private final PbeEngine pbeEngine;
	private final MacEngine macEngine;
	private final BagCodec bagCodec;
	private final MacPolicy macPolicy;
	private final boolean requireMac;
	private final PbeAlgorithm certificateEncryption;
	private final boolean encryptCertificates;

	/**
	 * Create codec.
	 * 
	 * @param config configuration with {@link Pkcs12Config} definitions
	 */
	public Pkcs12Codec(Configuration config) {
		this(config, new SecureRandom());
	}

	/**
	 * Create codec.
	 * 
	 * @param config configuration with {@link Pkcs12Config} definitions
	 * @param random random for salts
	 */
	public Pkcs12Codec(Configuration config, SecureRandom random) {
		if (config == null) {
			throw new NullPointerException("config must not be null!");
		}
		this.pbeEngine = new PbeEngine(config, random);
		this.macEngine = new MacEngine(config, random);
		this.bagCodec = new BagCodec(config, pbeEngine);
		this.macPolicy = config.get(Pkcs12Config.MAC_POLICY);
		this.requireMac = config.get(Pkcs12Config.REQUIRE_MAC);
		this.certificateEncryption = config.get(Pkcs12Config.CERTIFICATE_ENCRYPTION);
		this.encryptCertificates = config.get(Pkcs12Config.ENCRYPT_CERTIFICATES);
	}

	/**
	 * Decode container.
	 * 
	 * With {@link MacPolicy#STRICT} the MAC is verified before any content
	 * is decrypted. A wrong password and a tampered container therefore both
	 * fail with {@link Pkcs12IntegrityException}. Callers, which need to
	 * distinguish a wrong password from a tampered container, must use
	 * {@link MacPolicy#WARN}. A wrong password then fails the decryption with
	 * {@link Pkcs12DecryptionException}, while a tampered, but decryptable
	 * container is returned with {@link Pkcs12Content#isAuthenticated()}
	 * {@code false}.
	 * 
	 * @param der DER encoded container
	 * @param password password. {@code null} for an absent password.
	 * @return content with all entries in order of the container
	 * @throws Pkcs12StructureException if the container is malformed
	 * @throws Pkcs12UnsupportedException if the container uses unsupported
	 *             algorithms or types
	 * @throws Pkcs12IntegrityException if the MAC verification fails with
	 *             {@link MacPolicy#STRICT}, or the MAC is missing but
	 *             required
	 * @throws Pkcs12DecryptionException if encrypted content could not be
	 *             decrypted
	 */
	public Pkcs12Content decode(byte[] der, char[] password) throws Pkcs12Exception {
		Pfx pfx = Pfx.fromDer(der);
		byte[] authSafe = pfx.getAuthSafe().getData();
		List<String> warnings = new ArrayList<>();
		boolean authenticated = false;
		MacData macData = pfx.getMacData();
		if (macData == null) {
			if (requireMac) {
				throw new Pkcs12IntegrityException("Missing MAC!");
			}
			LOGGER.warn("Container without MAC, content is not authenticated!");
			warnings.add("Missing MAC, content is not authenticated.");
		} else {
			try {
				password = macEngine.verify(macData, password, authSafe);
				authenticated = true;
			} catch (Pkcs12IntegrityException ex) {
				if (macPolicy == MacPolicy.STRICT) {
					throw ex;
				}
				LOGGER.warn("{} Continue without authentication.", ex.getMessage());
				warnings.add(ex.getMessage());
			}
		}
		List<ContentInfo> contentInfos = ContentInfo.fromAuthenticatedSafe(authSafe);
		LOGGER.debug("decode {} content infos", contentInfos.size());
		List<Pkcs12Entry> entries = new ArrayList<>();
		for (ContentInfo contentInfo : contentInfos) {
			byte[] safeContents;
			if (contentInfo.isEncrypted()) {
				EncryptedContent encryptedContent = contentInfo.getEncryptedContent();
				safeContents = pbeEngine.decrypt(encryptedContent.getAlgorithm(), password,
						encryptedContent.getCiphertext());
			} else {
				safeContents = contentInfo.getData();
			}
			bagCodec.decode(SafeBag.fromSafeContents(safeContents), password, entries);
		}
		LOGGER.debug("decoded {} entries", entries.size());
		return new Pkcs12Content(entries, warnings, authenticated);
	}

	/**
	 * Encode entries into a container.
	 * 
	 * Consecutive private keys, secrets, and opaque entries are placed in a
	 * plain content info, with the private keys shrouded. Consecutive
	 * certificates and CRLs are placed in an encrypted content info, if
	 * {@link Pkcs12Config#ENCRYPT_CERTIFICATES} is enabled. The order of the
	 * entries is preserved.
	 * 
	 * @param entries entries to encode
	 * @param password password. {@code null} for an absent password.
	 * @return DER encoded container
	 * @throws Pkcs12UnsupportedException if a cipher or HMAC is not available
	 */
	public byte[] encode(List<Pkcs12Entry> entries, char[] password) throws Pkcs12UnsupportedException {
		List<ContentInfo> contentInfos = new ArrayList<>();
		List<SafeBag> bags = new ArrayList<>();
		Boolean certificates = null;
		for (Pkcs12Entry entry : entries) {
			boolean certificate = isCertificateContent(entry);
			if (certificates != null && certificates != certificate) {
				contentInfos.add(createContentInfo(bags, certificates, password));
				bags.clear();
			}
			certificates = certificate;
			bags.add(bagCodec.encode(entry, password));
		}
		if (certificates != null) {
			contentInfos.add(createContentInfo(bags, certificates, password));
		}
		LOGGER.debug("encoded {} entries into {} content infos", entries.size(), contentInfos.size());
		byte[] authSafe = ContentInfo.toAuthenticatedSafe(contentInfos);
		MacData macData = macEngine.create(password, authSafe);
		return new Pfx(ContentInfo.data(authSafe), macData).toByteArray();
	}

	private ContentInfo createContentInfo(List<SafeBag> bags, boolean certificates, char[] password)
			throws Pkcs12UnsupportedException {
		byte[] safeContents = SafeBag.toSafeContents(bags);
		if (certificates && encryptCertificates) {
			PbeParameters parameters = pbeEngine.createParameters();
			byte[] ciphertext = pbeEngine.encrypt(certificateEncryption, parameters, password, safeContents);
			AlgorithmIdentifier algorithm = new AlgorithmIdentifier(certificateEncryption.getOid(),
					parameters.toByteArray());
			return ContentInfo.encrypted(new EncryptedContent(algorithm, ciphertext));
		}
		return ContentInfo.data(safeContents);
	}

	private static boolean isCertificateContent(Pkcs12Entry entry) {
		return entry.getType() == EntryType.CERTIFICATE || entry.getType() == EntryType.CRL;
	}
}
