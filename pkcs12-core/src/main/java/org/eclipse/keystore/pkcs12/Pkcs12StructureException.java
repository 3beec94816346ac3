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
 * Exception indicating malformed input.
 * 
 * Reported for missing or mistyped required fields, invalid lengths, a wrong
 * container version, or a digest length not matching the digest algorithm.
 * The message names the failing layer.
 */
public class Pkcs12StructureException extends Pkcs12Exception {

	private static final long serialVersionUID = 1L;

	public Pkcs12StructureException(String message) {
		super(message);
	}

	public Pkcs12StructureException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Create a structure exception for a failing layer.
	 * 
	 * @param layer name of the failing layer, e.g. "PFX" or "SafeBag".
	 * @param cause failure of the DER decoder
	 * @return structure exception
	 */
	public static Pkcs12StructureException invalid(String layer, IllegalArgumentException cause) {
		return new Pkcs12StructureException("Invalid " + layer + ": " + cause.getMessage(), cause);
	}
}
