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
package org.eclipse.keystore.elements.util;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Writer for PEM blocks.
 * 
 * Writes RFC 7468 blocks with optional RFC 1421 style headers. Base64 lines
 * are wrapped at 64 characters.
 * 
 * @see PemReader
 */
public class PemWriter {

	/**
	 * Maximum number of base64 characters per line.
	 */
	private static final int LINE_LENGTH = 64;

	private final Writer writer;

	/**
	 * Create PEM writer.
	 * 
	 * @param writer writer to write the blocks to
	 */
	public PemWriter(Writer writer) {
		this.writer = writer;
	}

	/**
	 * Write PEM block.
	 * 
	 * @param tag tag of block, e.g. "CERTIFICATE"
	 * @param headers headers of block. May be {@code null} or empty.
	 * @param data data of block
	 * @throws IOException if an i/o error occurred
	 */
	public void writeBlock(String tag, Map<String, String> headers, byte[] data) throws IOException {
		writer.write("-----BEGIN ");
		writer.write(tag);
		writer.write("-----\n");
		if (headers != null && !headers.isEmpty()) {
			for (Map.Entry<String, String> header : headers.entrySet()) {
				writer.write(header.getKey());
				writer.write(": ");
				writer.write(header.getValue());
				writer.write('\n');
			}
			writer.write('\n');
		}
		String base64 = StringUtil.byteArrayToBase64(data);
		for (int index = 0; index < base64.length(); index += LINE_LENGTH) {
			writer.write(base64, index, Math.min(LINE_LENGTH, base64.length() - index));
			writer.write('\n');
		}
		writer.write("-----END ");
		writer.write(tag);
		writer.write("-----\n");
	}

	/**
	 * Flush writer.
	 * 
	 * @throws IOException if an i/o error occurred
	 */
	public void flush() throws IOException {
		writer.flush();
	}
}
