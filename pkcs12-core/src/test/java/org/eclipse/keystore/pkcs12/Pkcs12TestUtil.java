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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import org.eclipse.keystore.elements.config.Configuration;

/**
 * Test keystore and configuration.
 * 
 * The keystore was created by keytool and contains a RSA and a EC key pair
 * with certificates, an AES secret key and a trusted certificate.
 */
public class Pkcs12TestUtil {

	public static final String KEYSTORE = "keystore.p12";
	public static final char[] PASSWORD = "changeit".toCharArray();

	public static byte[] loadKeystore() throws IOException {
		InputStream in = Pkcs12TestUtil.class.getClassLoader().getResourceAsStream(KEYSTORE);
		if (in == null) {
			throw new IOException("Missing resource " + KEYSTORE + "!");
		}
		try {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			int length;
			while ((length = in.read(buffer)) > 0) {
				out.write(buffer, 0, length);
			}
			return out.toByteArray();
		} finally {
			in.close();
		}
	}

	public static Configuration createConfiguration() {
		return new Configuration(Pkcs12Config.DEFINITIONS);
	}
}
