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
package org.eclipse.keystore.elements.config;

import org.eclipse.keystore.elements.util.StringUtil;

/**
 * Encoding for java properties file.
 */
public class PropertiesUtility {

	private static final String QUOTED = "=:#!\\";
	private static final String SUBSTITUTED = "\t\n\r\f";
	private static final String SUBSTITUTES = "tnrf";
	private static final int MAX_COMMENT_LINE_LENGTH = 64;

	private static final char[] HEX_DIGIT = "0123456789ABCDEF".toCharArray();

	/**
	 * Normalize string value for properties files.
	 * 
	 * @param value string value
	 * @param escapeSpace {@code true}, to escape spaces' {@code ' '} by
	 *            {@code "\\ "}, {@code false}, to keep them.
	 * @return normalized string
	 */
	public static String normalize(String value, boolean escapeSpace) {
		int length = value.length();
		StringBuilder builder = new StringBuilder(length);
		for (int index = 0; index < length; index++) {
			char aChar = value.charAt(index);
			if ((aChar == ' ' && escapeSpace) || QUOTED.indexOf(aChar) >= 0) {
				builder.append('\\').append(aChar);
				continue;
			}
			int substituteIndex = SUBSTITUTED.indexOf(aChar);
			if (substituteIndex >= 0) {
				builder.append('\\').append(SUBSTITUTES.charAt(substituteIndex));
			} else if ((aChar < 32) || (aChar >= 128)) {
				appendUnicode(aChar, builder);
			} else {
				builder.append(aChar);
			}
		}
		return builder.toString();
	}

	/**
	 * Normalize comments for properties files.
	 * 
	 * Prepend "# " to each line and split lines on whitespace, if they exceed
	 * 64 characters.
	 * 
	 * @param comments comments. May be {@code null}.
	 * @return normalized comment
	 */
	public static String normalizeComments(String comments) {
		if (comments == null) {
			return "#";
		}
		int length = comments.length();
		StringBuilder builder = new StringBuilder(length + 2);
		builder.append("# ");
		int lineLength = 0;
		for (int index = 0; index < length; index++) {
			char aChar = comments.charAt(index);
			if (aChar == '\r' && index + 1 < length && comments.charAt(index + 1) == '\n') {
				continue;
			}
			if (aChar == '\n' || aChar == '\r'
					|| (lineLength > MAX_COMMENT_LINE_LENGTH && Character.isWhitespace(aChar))) {
				lineLength = 0;
				builder.append(StringUtil.lineSeparator()).append("# ");
			} else if ((aChar < 32) || (aChar >= 128)) {
				lineLength += 6;
				appendUnicode(aChar, builder);
			} else {
				++lineLength;
				builder.append(aChar);
			}
		}
		return builder.toString();
	}

	/**
	 * Append character encoded using a hexadecimal unicode.
	 * 
	 * Format: {@code \\uhhhh}
	 * 
	 * @param c character to encode
	 * @param builder builder to append the character encoded as unicode.
	 */
	private static void appendUnicode(char c, StringBuilder builder) {
		builder.append('\\').append('u');
		builder.append(HEX_DIGIT[(c >> 12) & 0xf]);
		builder.append(HEX_DIGIT[(c >> 8) & 0xf]);
		builder.append(HEX_DIGIT[(c >> 4) & 0xf]);
		builder.append(HEX_DIGIT[c & 0xf]);
	}
}
