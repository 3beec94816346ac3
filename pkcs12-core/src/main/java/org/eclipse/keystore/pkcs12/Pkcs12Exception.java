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
 * Exception indicating a failure decoding or encoding a PKCS#12 container.
 * 
 * Decoding either yields all records of a container or fails with one of the
 * sub-classes of this exception.
 */
public class Pkcs12Exception extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Create new instance with message.
	 *
	 * @param message message
	 */
	public Pkcs12Exception(String message) {
		super(message);
	}

	/**
	 * Create new instance with message and cause.
	 *
	 * @param message message
	 * @param cause cause
	 */
	public Pkcs12Exception(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		if (msg == null) {
			msg = getClass().getSimpleName();
		}
		return msg;
	}
}
