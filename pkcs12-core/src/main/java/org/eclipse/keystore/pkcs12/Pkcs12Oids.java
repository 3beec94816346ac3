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
 * Object identifiers used by PKCS#12 containers.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7292" target="_blank">RFC 7292</a>
 */
public final class Pkcs12Oids {

	/**
	 * PKCS#7 data.
	 */
	public static final String DATA = "1.2.840.113549.1.7.1";
	/**
	 * PKCS#7 encryptedData.
	 */
	public static final String ENCRYPTED_DATA = "1.2.840.113549.1.7.6";
	/**
	 * PKCS#7 envelopedData. Not supported.
	 */
	public static final String ENVELOPED_DATA = "1.2.840.113549.1.7.3";

	public static final String FRIENDLY_NAME = "1.2.840.113549.1.9.20";
	public static final String LOCAL_KEY_ID = "1.2.840.113549.1.9.21";

	public static final String X509_CERTIFICATE = "1.2.840.113549.1.9.22.1";
	public static final String X509_CRL = "1.2.840.113549.1.9.23.1";

	public static final String KEY_BAG = "1.2.840.113549.1.12.10.1.1";
	public static final String PKCS8_SHROUDED_KEY_BAG = "1.2.840.113549.1.12.10.1.2";
	public static final String CERT_BAG = "1.2.840.113549.1.12.10.1.3";
	public static final String CRL_BAG = "1.2.840.113549.1.12.10.1.4";
	public static final String SECRET_BAG = "1.2.840.113549.1.12.10.1.5";
	public static final String SAFE_CONTENTS_BAG = "1.2.840.113549.1.12.10.1.6";

	/**
	 * PKCS#5 v2 password based encryption scheme. Not supported.
	 */
	public static final String PBES2 = "1.2.840.113549.1.5.13";

	private Pkcs12Oids() {
	}
}
