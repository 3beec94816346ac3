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

import java.util.List;

import org.eclipse.keystore.elements.config.Configuration;
import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.BagAttributes;
import org.eclipse.keystore.pkcs12.EntryType;
import org.eclipse.keystore.pkcs12.Pkcs12Config;
import org.eclipse.keystore.pkcs12.Pkcs12Entry;
import org.eclipse.keystore.pkcs12.Pkcs12Exception;
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;
import org.eclipse.keystore.pkcs12.crypto.PbeAlgorithm;
import org.eclipse.keystore.pkcs12.crypto.PbeEngine;
import org.eclipse.keystore.pkcs12.model.AlgorithmIdentifier;
import org.eclipse.keystore.pkcs12.model.BagAttribute;
import org.eclipse.keystore.pkcs12.model.EncryptedPrivateKeyInfo;
import org.eclipse.keystore.pkcs12.model.PbeParameters;
import org.eclipse.keystore.pkcs12.model.SafeBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for safe bags.
 * 
 * Converts safe bags into plaintext entries and back.
 * 
 * <pre>
 * CertBag ::= SEQUENCE {
 *    certId    OBJECT IDENTIFIER,
 *    certValue [0] EXPLICIT OCTET STRING
 * }
 * CRLBag ::= SEQUENCE {
 *    crlId     OBJECT IDENTIFIER,
 *    crlValue  [0] EXPLICIT OCTET STRING
 * }
 * SecretBag ::= SEQUENCE {
 *    secretTypeId   OBJECT IDENTIFIER,
 *    secretValue    [0] EXPLICIT OCTET STRING
 * }
 * </pre>
 * 
 * Bags of unknown type are passed through as {@link EntryType#OPAQUE}.
 */
public class BagCodec {

	private static final Logger LOGGER = LoggerFactory.getLogger(BagCodec.class);

	private final PbeEngine pbeEngine;
	private final int maxNestingDepth;
	private final PbeAlgorithm keyEncryption;
	private final boolean decryptShroudedSecrets;

	/**
	 * Create bag codec.
	 * 
	 * @param config configuration. Uses
	 *            {@link Pkcs12Config#MAX_NESTING_DEPTH},
	 *            {@link Pkcs12Config#KEY_ENCRYPTION}, and
	 *            {@link Pkcs12Config#DECRYPT_SHROUDED_SECRETS}.
	 * @param pbeEngine engine to en- and decrypt shrouded keys
	 */
	public BagCodec(Configuration config, PbeEngine pbeEngine) {
		if (pbeEngine == null) {
			throw new NullPointerException("PBE engine must not be null!");
		}
		this.pbeEngine = pbeEngine;
		this.maxNestingDepth = config.get(Pkcs12Config.MAX_NESTING_DEPTH);
		this.keyEncryption = config.get(Pkcs12Config.KEY_ENCRYPTION);
		this.decryptShroudedSecrets = config.get(Pkcs12Config.DECRYPT_SHROUDED_SECRETS);
	}

	/**
	 * Decode safe bags.
	 * 
	 * Nested safe contents are flattened.
	 * 
	 * @param bags safe bags
	 * @param password password. {@code null} for an absent password.
	 * @param entries list to add the decoded entries in order of the bags
	 * @throws Pkcs12StructureException if a bag is malformed, or the safe
	 *             contents are nested too deep
	 * @throws Pkcs12UnsupportedException if a bag uses unsupported
	 *             algorithms or types
	 * @throws org.eclipse.keystore.pkcs12.Pkcs12DecryptionException if a
	 *             shrouded key could not be decrypted
	 */
	public void decode(List<SafeBag> bags, char[] password, List<Pkcs12Entry> entries) throws Pkcs12Exception {
		decode(bags, password, entries, 1);
	}

	private void decode(List<SafeBag> bags, char[] password, List<Pkcs12Entry> entries, int depth)
			throws Pkcs12Exception {
		if (depth > maxNestingDepth) {
			throw new Pkcs12StructureException("Safe contents nested deeper than " + maxNestingDepth + "!");
		}
		for (SafeBag bag : bags) {
			BagType type = BagType.fromOid(bag.getBagId());
			LOGGER.debug("decode {} ({}), depth {}", type, bag, depth);
			if (type == BagType.SAFE_CONTENTS) {
				if (!bag.getAttributes().isEmpty()) {
					LOGGER.debug("ignore {} attributes of nested safe contents", bag.getAttributes().size());
				}
				decode(SafeBag.fromSafeContents(bag.getBagValue()), password, entries, depth + 1);
			} else {
				BagAttributes attributes = BagAttributes.fromAttributes(bag.getAttributes());
				entries.add(decode(type, bag, attributes, password));
			}
		}
	}

	private Pkcs12Entry decode(BagType type, SafeBag bag, BagAttributes attributes, char[] password)
			throws Pkcs12Exception {
		if (type == null) {
			LOGGER.debug("pass through unknown bag {}", bag.getBagId());
			return new Pkcs12Entry(EntryType.OPAQUE, attributes, bag.getBagValue(), bag.getBagId());
		}
		switch (type) {
		case KEY: {
			byte[] key = bag.getBagValue();
			return new Pkcs12Entry(PrivateKeyClassifier.classify(key), attributes, key);
		}
		case PKCS8_SHROUDED_KEY: {
			byte[] key = decrypt(bag.getBagValue(), password);
			return new Pkcs12Entry(PrivateKeyClassifier.classify(key), attributes, key);
		}
		case CERT:
			return new Pkcs12Entry(EntryType.CERTIFICATE, attributes,
					readTypedValue(bag, Pkcs12Oids.X509_CERTIFICATE, "CertBag"));
		case CRL:
			return new Pkcs12Entry(EntryType.CRL, attributes, readTypedValue(bag, Pkcs12Oids.X509_CRL, "CRLBag"));
		case SECRET:
			return decodeSecret(bag, attributes, password);
		default:
			throw new Pkcs12UnsupportedException("Bag " + type + " not supported!");
		}
	}

	private Pkcs12Entry decodeSecret(SafeBag bag, BagAttributes attributes, char[] password)
			throws Pkcs12Exception {
		String secretTypeId;
		byte[] secret;
		boolean encodedValue;
		try {
			ByteReader reader = new ByteReader(bag.getBagValue(), false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			secretTypeId = Asn1DerDecoder.readOidString(sequence);
			ByteReader value = Asn1DerDecoder.readContextSpecific(sequence, 0);
			// secretValue is ANY DEFINED BY secretTypeId
			encodedValue = Asn1DerDecoder.peekTag(value) != Asn1DerDecoder.TAG_OCTET_STRING;
			if (encodedValue) {
				secret = Asn1DerDecoder.readEntity(value);
			} else {
				secret = Asn1DerDecoder.readOctetString(value);
			}
			value.assertFinished("SecretBag value");
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("SecretBag", ex);
		}
		if (encodedValue) {
			LOGGER.debug("secret {} is not an OCTET STRING, keep DER value", secretTypeId);
		} else if (decryptShroudedSecrets && Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG.equals(secretTypeId)) {
			LOGGER.debug("decrypt shrouded secret");
			secret = decrypt(secret, password);
		}
		return new Pkcs12Entry(EntryType.SECRET, attributes, secret, secretTypeId, encodedValue);
	}

	/**
	 * Read value of cert or CRL bag.
	 * 
	 * @param bag bag
	 * @param expectedType OID of the only supported value type
	 * @param layer name of the bag for error messages
	 * @return octets of the value
	 * @throws Pkcs12StructureException if the bag is malformed
	 * @throws Pkcs12UnsupportedException if the value type is not supported
	 */
	private static byte[] readTypedValue(SafeBag bag, String expectedType, String layer)
			throws Pkcs12StructureException, Pkcs12UnsupportedException {
		try {
			ByteReader reader = new ByteReader(bag.getBagValue(), false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			String typeId = Asn1DerDecoder.readOidString(sequence);
			if (!expectedType.equals(typeId)) {
				throw new Pkcs12UnsupportedException(layer + " type " + typeId + " not supported!");
			}
			ByteReader value = Asn1DerDecoder.readContextSpecific(sequence, 0);
			byte[] octets = Asn1DerDecoder.readOctetString(value);
			value.assertFinished(layer + " value");
			return octets;
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid(layer, ex);
		}
	}

	private byte[] decrypt(byte[] encryptedPrivateKeyInfo, char[] password) throws Pkcs12Exception {
		EncryptedPrivateKeyInfo info = EncryptedPrivateKeyInfo.fromDer(encryptedPrivateKeyInfo);
		return pbeEngine.decrypt(info.getAlgorithm(), password, info.getEncryptedData());
	}

	private byte[] encrypt(byte[] privateKeyInfo, char[] password) throws Pkcs12UnsupportedException {
		PbeParameters parameters = pbeEngine.createParameters();
		byte[] encrypted = pbeEngine.encrypt(keyEncryption, parameters, password, privateKeyInfo);
		AlgorithmIdentifier algorithm = new AlgorithmIdentifier(keyEncryption.getOid(), parameters.toByteArray());
		return new EncryptedPrivateKeyInfo(algorithm, encrypted).toByteArray();
	}

	/**
	 * Encode entry into safe bag.
	 * 
	 * Private keys are shrouded using {@link Pkcs12Config#KEY_ENCRYPTION}.
	 * 
	 * @param entry entry to encode
	 * @param password password. {@code null} for an absent password.
	 * @return safe bag
	 * @throws Pkcs12UnsupportedException if the cipher is not available
	 */
	public SafeBag encode(Pkcs12Entry entry, char[] password) throws Pkcs12UnsupportedException {
		List<BagAttribute> attributes = entry.getAttributes().toAttributes();
		byte[] payload = entry.getPayload();
		LOGGER.debug("encode {}", entry);
		switch (entry.getType()) {
		case PRIVATE_KEY_PKCS8:
		case PRIVATE_KEY_LEGACY:
		case EC_PRIVATE_KEY:
			return new SafeBag(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG, encrypt(payload, password), attributes);
		case CERTIFICATE:
			return new SafeBag(Pkcs12Oids.CERT_BAG, typedValue(Pkcs12Oids.X509_CERTIFICATE, payload), attributes);
		case CRL:
			return new SafeBag(Pkcs12Oids.CRL_BAG, typedValue(Pkcs12Oids.X509_CRL, payload), attributes);
		case SECRET:
			if (entry.isEncodedValue()) {
				return new SafeBag(Pkcs12Oids.SECRET_BAG, Asn1DerEncoder.sequence(Asn1DerEncoder.oid(entry.getTypeId()),
						Asn1DerEncoder.contextSpecific(0, payload)), attributes);
			}
			if (decryptShroudedSecrets && Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG.equals(entry.getTypeId())) {
				payload = encrypt(payload, password);
			}
			return new SafeBag(Pkcs12Oids.SECRET_BAG, typedValue(entry.getTypeId(), payload), attributes);
		case OPAQUE:
			return new SafeBag(entry.getTypeId(), payload, attributes);
		default:
			throw new Pkcs12UnsupportedException("Entry " + entry.getType() + " not supported!");
		}
	}

	private static byte[] typedValue(String typeId, byte[] value) {
		return Asn1DerEncoder.sequence(Asn1DerEncoder.oid(typeId),
				Asn1DerEncoder.contextSpecific(0, Asn1DerEncoder.octetString(value)));
	}
}
