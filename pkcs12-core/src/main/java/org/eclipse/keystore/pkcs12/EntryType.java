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

/**
 * Type of a decoded record.
 */
public enum EntryType {

	/**
	 * DER encoded X.509 certificate.
	 */
	CERTIFICATE,
	/**
	 * DER encoded PKCS#8 PrivateKeyInfo.
	 */
	PRIVATE_KEY_PKCS8,
	/**
	 * DER encoded private key in legacy format, e.g. PKCS#1 RSAPrivateKey.
	 */
	PRIVATE_KEY_LEGACY,
	/**
	 * DER encoded ECPrivateKey (RFC 5915).
	 */
	EC_PRIVATE_KEY,
	/**
	 * Secret value of a secret bag.
	 */
	SECRET,
	/**
	 * DER encoded X.509 CRL.
	 */
	CRL,
	/**
	 * Bag of unknown type, passed through as is.
	 */
	OPAQUE;

	/**
	 * Check, if type is a private key.
	 * 
	 * @return {@code true}, for private keys, {@code false}, otherwise.
	 */
	public boolean isPrivateKey() {
		return this == PRIVATE_KEY_PKCS8 || this == PRIVATE_KEY_LEGACY || this == EC_PRIVATE_KEY;
	}
}
