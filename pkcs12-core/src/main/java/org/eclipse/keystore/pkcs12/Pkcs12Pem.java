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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.keystore.elements.util.PemReader;
import org.eclipse.keystore.elements.util.PemWriter;
import org.eclipse.keystore.elements.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Export entries as PEM blocks and read them back.
 * 
 * The friendly name and local key id are written as "friendlyName" and
 * "localKeyId" (hexadecimal) headers.
 */
public final class Pkcs12Pem {

	private static final Logger LOGGER = LoggerFactory.getLogger(Pkcs12Pem.class);

	public static final String FRIENDLY_NAME_HEADER = "friendlyName";
	public static final String LOCAL_KEY_ID_HEADER = "localKeyId";

	private Pkcs12Pem() {
	}

	/**
	 * Get PEM block type of entry.
	 * 
	 * @param type type of entry
	 * @return block type
	 * @throws IllegalArgumentException if the type has no PEM representation
	 */
	public static String getBlockType(EntryType type) {
		switch (type) {
		case CERTIFICATE:
			return "CERTIFICATE";
		case PRIVATE_KEY_PKCS8:
			return "PRIVATE KEY";
		case PRIVATE_KEY_LEGACY:
			return "RSA PRIVATE KEY";
		case EC_PRIVATE_KEY:
			return "EC PRIVATE KEY";
		case CRL:
			return "X509 CRL";
		case SECRET:
			return "SECRET BAG";
		default:
			throw new IllegalArgumentException(type + " can't be exported as PEM!");
		}
	}

	/**
	 * Get entry type of PEM block type.
	 * 
	 * @param blockType block type
	 * @return entry type, or {@code null}, if the block type is not supported.
	 */
	public static EntryType getEntryType(String blockType) {
		for (EntryType type : EntryType.values()) {
			if (type != EntryType.OPAQUE && getBlockType(type).equals(blockType)) {
				return type;
			}
		}
		return null;
	}

	/**
	 * Write entries as PEM blocks.
	 * 
	 * @param writer writer to write to
	 * @param entries entries to write
	 * @throws IOException if an i/o error occurred
	 * @throws IllegalArgumentException if an entry has no PEM representation
	 */
	public static void write(Writer writer, List<Pkcs12Entry> entries) throws IOException {
		PemWriter pem = new PemWriter(writer);
		for (Pkcs12Entry entry : entries) {
			String blockType = getBlockType(entry.getType());
			Map<String, String> headers = new LinkedHashMap<>();
			BagAttributes attributes = entry.getAttributes();
			if (attributes.getFriendlyName() != null) {
				headers.put(FRIENDLY_NAME_HEADER, attributes.getFriendlyName());
			}
			if (attributes.getLocalKeyId() != null) {
				headers.put(LOCAL_KEY_ID_HEADER, StringUtil.byteArray2Hex(attributes.getLocalKeyId()));
			}
			pem.writeBlock(blockType, headers, entry.getPayload());
		}
		pem.flush();
	}

	/**
	 * Export entries as PEM.
	 * 
	 * @param entries entries to export
	 * @return PEM text
	 * @throws IllegalArgumentException if an entry has no PEM representation
	 */
	public static String toPem(List<Pkcs12Entry> entries) {
		StringWriter writer = new StringWriter();
		try {
			write(writer, entries);
		} catch (IOException ex) {
			// StringWriter doesn't throw
			throw new IllegalStateException(ex);
		}
		return writer.toString();
	}

	/**
	 * Export entry as PEM.
	 * 
	 * @param entry entry to export
	 * @return PEM text
	 * @throws IllegalArgumentException if the entry has no PEM representation
	 */
	public static String toPem(Pkcs12Entry entry) {
		return toPem(Collections.singletonList(entry));
	}

	/**
	 * Read entries from PEM blocks.
	 * 
	 * Blocks with unsupported types are skipped. A "SECRET BAG" gets the
	 * default secret type id.
	 * 
	 * @param reader reader to read from
	 * @return list of entries in block order
	 * @throws IOException if an i/o error occurred, a block is not terminated,
	 *             or contains invalid base64 or an invalid local key id
	 */
	public static List<Pkcs12Entry> read(Reader reader) throws IOException {
		List<Pkcs12Entry> entries = new ArrayList<>();
		PemReader pem = new PemReader(reader);
		try {
			String blockType;
			while ((blockType = pem.readNextBegin()) != null) {
				byte[] data;
				try {
					data = pem.readToEnd();
				} catch (IllegalArgumentException ex) {
					throw new IOException("Invalid " + blockType + ": " + ex.getMessage(), ex);
				}
				if (data == null) {
					throw new IOException("Missing END of " + blockType + "!");
				}
				EntryType type = getEntryType(blockType);
				if (type == null) {
					LOGGER.warn("{} not supported!", blockType);
					continue;
				}
				entries.add(new Pkcs12Entry(type, readAttributes(pem.getHeaders()), data));
			}
		} finally {
			pem.close();
		}
		return entries;
	}

	/**
	 * Read entries from PEM text.
	 * 
	 * @param text PEM text
	 * @return list of entries in block order
	 * @throws IllegalArgumentException if a block is not terminated, or
	 *             contains invalid base64 or an invalid local key id
	 * @see #read(Reader)
	 */
	public static List<Pkcs12Entry> fromPem(String text) {
		try {
			return read(new StringReader(text));
		} catch (IOException ex) {
			throw new IllegalArgumentException(ex.getMessage(), ex);
		}
	}

	private static BagAttributes readAttributes(Map<String, String> headers) throws IOException {
		String friendlyName = headers.get(FRIENDLY_NAME_HEADER);
		String localKeyId = headers.get(LOCAL_KEY_ID_HEADER);
		if (friendlyName == null && localKeyId == null) {
			return BagAttributes.EMPTY;
		}
		try {
			return new BagAttributes(friendlyName, StringUtil.hex2ByteArray(localKeyId));
		} catch (IllegalArgumentException ex) {
			throw new IOException("Invalid " + LOCAL_KEY_ID_HEADER + ": " + ex.getMessage(), ex);
		}
	}
}
