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

import org.eclipse.keystore.elements.util.Asn1DerDecoder;
import org.eclipse.keystore.elements.util.Asn1DerEncoder;
import org.eclipse.keystore.elements.util.ByteReader;
import org.eclipse.keystore.pkcs12.Pkcs12StructureException;
import org.eclipse.keystore.pkcs12.Pkcs12UnsupportedException;

/**
 * PFX, the outer structure of a PKCS#12 container.
 * 
 * <pre>
 * PFX ::= SEQUENCE {
 *    version   INTEGER {v3(3)}(v3,...),
 *    authSafe  ContentInfo,
 *    macData   MacData OPTIONAL
 * }
 * </pre>
 */
public final class Pfx {

	/**
	 * Supported version.
	 */
	public static final int VERSION = 3;

	private final ContentInfo authSafe;
	private final MacData macData;

	public Pfx(ContentInfo authSafe, MacData macData) {
		this.authSafe = authSafe;
		this.macData = macData;
	}

	/**
	 * Get authenticated safe content info.
	 * 
	 * @return content info of type data
	 */
	public ContentInfo getAuthSafe() {
		return authSafe;
	}

	/**
	 * Get MAC data.
	 * 
	 * @return MAC data, or {@code null}, if the container is not
	 *         authenticated.
	 */
	public MacData getMacData() {
		return macData;
	}

	public byte[] toByteArray() {
		if (macData == null) {
			return Asn1DerEncoder.sequence(Asn1DerEncoder.integer(VERSION), authSafe.toByteArray());
		}
		return Asn1DerEncoder.sequence(Asn1DerEncoder.integer(VERSION), authSafe.toByteArray(),
				macData.toByteArray());
	}

	/**
	 * Decode PFX.
	 * 
	 * @param der DER encoded PFX
	 * @return PFX
	 * @throws Pkcs12StructureException if the PFX is malformed, has an other
	 *             version than {@link #VERSION}, or the authenticated safe is
	 *             not of type data.
	 * @throws Pkcs12UnsupportedException if the authenticated safe content
	 *             type is not supported
	 */
	public static Pfx fromDer(byte[] der) throws Pkcs12StructureException, Pkcs12UnsupportedException {
		if (der == null || der.length == 0) {
			throw new Pkcs12StructureException("Empty PFX!");
		}
		try {
			ByteReader reader = new ByteReader(der, false);
			ByteReader sequence = Asn1DerDecoder.readSequence(reader);
			reader.assertFinished("PFX");
			int version = Asn1DerDecoder.readInteger(sequence);
			if (version != VERSION) {
				throw new Pkcs12StructureException("PFX version " + version + " not supported!");
			}
			ContentInfo authSafe = ContentInfo.fromReader(sequence);
			if (authSafe.isEncrypted()) {
				throw new Pkcs12StructureException("PFX authSafe must be of type data!");
			}
			MacData macData = null;
			if (sequence.bytesAvailable()) {
				macData = MacData.fromReader(sequence);
			}
			return new Pfx(authSafe, macData);
		} catch (IllegalArgumentException ex) {
			throw Pkcs12StructureException.invalid("PFX", ex);
		}
	}
}
