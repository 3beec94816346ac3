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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader for PEM files.
 * 
 * Supports RFC 1421 style headers ahead of the base64 data.
 * 
 * @see PemWriter
 */
public class PemReader {

	/**
	 * The logger.
	 */
	private static final Logger LOGGER = LoggerFactory.getLogger(PemReader.class);

	/**
	 * Pattern for begin tag.
	 */
	private static final Pattern BEGIN_PATTERN = Pattern.compile("^\\-+BEGIN\\s+([\\w\\s]+)\\-+$");

	/**
	 * Pattern for end tag.
	 */
	private static final Pattern END_PATTERN = Pattern.compile("^\\-+END\\s+([\\w\\s]+)\\-+$");

	/**
	 * Pattern for header.
	 */
	private static final Pattern HEADER_PATTERN = Pattern.compile("^([\\w\\-]+):\\s*(.*)$");

	/**
	 * Buffered reader.
	 */
	private final BufferedReader reader;
	/**
	 * Current tag.
	 * 
	 * Set by {@link #readNextBegin()}.
	 */
	private String tag;
	/**
	 * Headers of current block.
	 * 
	 * Set by {@link #readToEnd()}.
	 */
	private Map<String, String> headers = Collections.emptyMap();

	/**
	 * Create PEM reader from {@link InputStream}.
	 * 
	 * @param in input stream
	 */
	public PemReader(InputStream in) {
		reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
	}

	/**
	 * Create PEM reader from {@link Reader}.
	 * 
	 * @param in reader
	 */
	public PemReader(Reader in) {
		reader = new BufferedReader(in);
	}

	/**
	 * Close reader.
	 * 
	 * @throws IOException if an i/o error occurred
	 */
	public void close() throws IOException {
		reader.close();
	}

	/**
	 * Read to next begin pattern.
	 * 
	 * @return begin tag, or {@code null}, if no further block is available.
	 * @throws IOException if an i/o error occurred
	 */
	public String readNextBegin() throws IOException {
		String line;
		tag = null;
		headers = Collections.emptyMap();
		while ((line = reader.readLine()) != null) {
			Matcher matcher = BEGIN_PATTERN.matcher(line);
			if (matcher.matches()) {
				tag = matcher.group(1);
				LOGGER.debug("Found Begin of {}", tag);
				break;
			}
		}
		return tag;
	}

	/**
	 * Read to end pattern.
	 * 
	 * @return bytes of read section. {@code null}, if end pattern not found.
	 * @throws IOException if an i/o error occurred
	 * @throws IllegalArgumentException if the base64 data is invalid
	 */
	public byte[] readToEnd() throws IOException {
		String line;
		StringBuilder buffer = new StringBuilder();
		Map<String, String> blockHeaders = new LinkedHashMap<>();

		while ((line = reader.readLine()) != null) {
			Matcher matcher = END_PATTERN.matcher(line);
			if (matcher.matches()) {
				String end = matcher.group(1);
				if (end.equals(tag)) {
					byte[] decode = StringUtil.base64ToByteArray(buffer.toString());
					headers = Collections.unmodifiableMap(blockHeaders);
					LOGGER.debug("Found End of {}", tag);
					return decode;
				} else {
					LOGGER.warn("Found End of {}, but expected {}!", end, tag);
					break;
				}
			}
			if (buffer.length() == 0) {
				Matcher header = HEADER_PATTERN.matcher(line);
				if (header.matches()) {
					blockHeaders.put(header.group(1), header.group(2));
					continue;
				}
			}
			buffer.append(line.trim());
		}
		tag = null;
		return null;
	}

	/**
	 * Get headers of the last block read by {@link #readToEnd()}.
	 * 
	 * @return map of headers. Empty, if the block has no headers.
	 */
	public Map<String, String> getHeaders() {
		return headers;
	}
}
