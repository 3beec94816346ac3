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

import org.eclipse.keystore.pkcs12.Pkcs12Oids;

/**
 * Safe bag types of RFC 7292, appendix D.
 */
public enum BagType {

	KEY(Pkcs12Oids.KEY_BAG),
	PKCS8_SHROUDED_KEY(Pkcs12Oids.PKCS8_SHROUDED_KEY_BAG),
	CERT(Pkcs12Oids.CERT_BAG),
	CRL(Pkcs12Oids.CRL_BAG),
	SECRET(Pkcs12Oids.SECRET_BAG),
	SAFE_CONTENTS(Pkcs12Oids.SAFE_CONTENTS_BAG);

	private final String oid;

	private BagType(String oid) {
		this.oid = oid;
	}

	public String getOid() {
		return oid;
	}

	/**
	 * Get bag type by OID.
	 * 
	 * @param oid OID of bag
	 * @return bag type, or {@code null}, if not known.
	 */
	public static BagType fromOid(String oid) {
		for (BagType type : values()) {
			if (type.oid.equals(oid)) {
				return type;
			}
		}
		return null;
	}
}
