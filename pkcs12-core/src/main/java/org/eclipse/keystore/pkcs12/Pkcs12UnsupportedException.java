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
 * Exception indicating an algorithm, content type or certificate type, which
 * is not supported.
 * 
 * Fails the whole call.
 */
public class Pkcs12UnsupportedException extends Pkcs12Exception {

	private static final long serialVersionUID = 1L;

	public Pkcs12UnsupportedException(String message) {
		super(message);
	}

	public Pkcs12UnsupportedException(String message, Throwable cause) {
		super(message, cause);
	}
}
