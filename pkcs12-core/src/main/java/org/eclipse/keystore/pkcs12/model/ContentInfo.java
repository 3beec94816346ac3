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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.Pkcs12Oids;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;

/**
 * Content info of PKCS#7.
 * 
 * <pre>
 * ContentInfo ::= SEQUENCE {
 *    contentType  OBJECT IDENTIFIER,
 *    content      [0] EXPLICIT ANY DEFINED BY contentType OPTIONAL
 * }
 * </pre>
 * 
 * Supports the content types data and encryptedData.
 */
public final class ContentInfo {

	private final String contentType;
	/**
	 * Octets of content type data.
	 */
	private final byte[] data;
	/**
	 * Content of type encryptedData.
	 */
	private final EncryptedContent encryptedContent;

	private ContentInfo(String contentType, byte[] data, EncryptedContent encryptedContent) {
		this.contentType = contentType;
		this.data = data;
		this.encryptedContent = encryptedContent;
	}

	/**
	 * Create content info of type data.
	 * 
	 * @param data octets
	 * @return content info
	 */
	public static ContentInfo data(byte[] data) {
		return new ContentInfo(Pkcs12Oids.DATA, data, null);
	}

	/**
	 * Create content info of type encryptedData.
	 * 
	 * @param encryptedContent encrypted content
	 * @return content info
	 */
	public static ContentInfo encrypted(EncryptedContent encryptedContent) {
		return new ContentInfo(Pkcs12Oids.ENCRYPTED_DATA, null, encryptedContent);
	}

	public String getContentType() {
		return contentType;
	}

	public boolean isEncrypted() {
		return encryptedContent != null;
	}

	/**
	 * Get octets of content type data.
	 * 
	 * @return octets, or {@code null}, if the content is encrypted.
	 */
	public byte[] getData() {
		return data;
	}

	/**
	 * Get encrypted content.
	 * 
	 * @return encrypted content, or {@code null}, if the content type is data.
	 */
	public EncryptedContent getEncryptedContent() {
		return encryptedContent;
	}

	public byte[] toByteArray() {
		byte[] content;
		if (encryptedContent != null) {
			content = encryptedContent.toByteArray();
		} else {
			content = Asn1DerEncoder.octetString(data);
		}
		return Asn1DerEncoder.sequence(Asn1DerEncoder.oid(contentType), Asn1DerEncoder.contextSpecific(0, content));
	}

	/**
	 * Read content info.
	 * 
	 * @param reader reader with DER encoded content info
	 * @return content info
	 * @throws Pkcs12StructureException if the content info is malformed
	 * @throws Pkcs12UnsupportedException if the content type is not supported
	 */
	public static ContentInfo fromReader(ByteReader reader)
			throws Pkcs12StructureException, Pkcs12UnsupportedException {
		try {
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			String contentType = Asn1DerDecoder.readOidString(sequence);
			if (!sequence.bytesAvailable()) {
				throw new Pkcs12StructureException("ContentInfo " + contentType + " without content!");
			}
			ByteReader content = Asn1DerDecoder.readContextSpecific(sequence, 0);
			if (Pkcs12Oids.DATA.equals(contentType)) {
				byte[] data = Asn1DerDecoder.readOctetString(content);
				content.assertFinished("ContentInfo data");
				return data(data);
			} else if (Pkcs12Oids.ENCRYPTED_DATA.equals(contentType)) {
				EncryptedContent encryptedContent = EncryptedContent.fromReader(content);
				return encrypted(encryptedContent);
			} else {
				throw new Pkcs12UnsupportedException("Content type " + contentType + " not supported!");
			}
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("ContentInfo", ex);
		}
	}

	/**
	 * Decode authenticated safe.
	 * 
	 * <pre>
	 * AuthenticatedSafe ::= SEQUENCE OF ContentInfo
	 * </pre>
	 * 
	 * @param der DER encoded authenticated safe
	 * @return list of content infos, in order of the authenticated safe
	 * @throws Pkcs12StructureException if the authenticated safe is malformed
	 * @throws Pkcs12UnsupportedException if a content type is not supported
	 */
	public static List<ContentInfo> fromAuthenticatedSafe(byte[] der)
			throws Pkcs12StructureException, Pkcs12UnsupportedException {
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			reader.assertFinished("AuthenticatedSafe");
			List<ContentInfo> contentInfos = new ArrayList<>();
			while (sequence.bytesAvailable()) {
				contentInfos.add(fromReader(sequence));
			}
			return contentInfos;
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("AuthenticatedSafe", ex);
		}
	}

	/**
	 * Encode authenticated safe.
	 * 
	 * @param contentInfos list of content infos
	 * @return DER encoded authenticated safe
	 */
	public static byte[] toAuthenticatedSafe(List<ContentInfo> contentInfos) {
		List<byte[]> encoded = new ArrayList<>(contentInfos.size());
		for (ContentInfo contentInfo : contentInfos) {
			encoded.add(contentInfo.toByteArray());
		}
		return Asn1DerEncoder.sequence(encoded);
	}
}
