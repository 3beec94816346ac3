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

import java.util.Base64;

/**
 * Hexadecimal and base64 conversion of byte arrays.
 */
public class StringUtil {

	/**
	 * No separator between the bytes of a hexadecimal string.
	 * 
	 * @see #byteArray2HexString(byte[], char, int)
	 */
	public static final char NO_SEPARATOR = 0;

	private final static char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

	/**
	 * Return line separator of the platform.
	 * 
	 * @return line separator
	 */
	public static String lineSeparator() {
		return System.lineSeparator();
	}

	/**
	 * Convert hexadecimal String into decoded byte array.
	 * 
	 * @param hex hexadecimal string. e.g. "4130010A"
	 * @return byte array with decoded hexadecimal input parameter.
	 *         {@code null}, if {@code null} is provided.
	 * @throws IllegalArgumentException if the parameter length is odd or
	 *             contains non hexadecimal characters.
	 * @see #byteArray2Hex(byte[])
	 */
	public static byte[] hex2ByteArray(String hex) {
		if (hex == null) {
			return null;
		}
		if ((hex.length() & 1) != 0) {
			throw new IllegalArgumentException("'" + hex + "' has odd length!");
		}
		byte[] result = new byte[hex.length() / 2];
		for (int index = 0; index < result.length; ++index) {
			int high = hexDigit(hex, index * 2);
			int low = hexDigit(hex, index * 2 + 1);
			result[index] = (byte) ((high << 4) | low);
		}
		return result;
	}

	private static int hexDigit(String hex, int position) {
		int digit = Character.digit(hex.charAt(position), 16);
		if (digit < 0) {
			throw new IllegalArgumentException("'" + hex + "' digit " + position + " is not hexadecimal!");
		}
		return digit;
	}

	/**
	 * Byte array to hexadecimal string without separator.
	 * 
	 * @param byteArray byte array to be converted to string.
	 * @return hexadecimal string, e.g "0142A3". {@code null}, if the provided
	 *         byte array is {@code null}. {@code ""}, if provided byte array is
	 *         empty.
	 * @see #hex2ByteArray(String)
	 */
	public static String byteArray2Hex(byte[] byteArray) {
		if (byteArray == null) {
			return null;
		}
		return byteArray.length == 0 ? "" : byteArray2HexString(byteArray, NO_SEPARATOR, 0);
	}

	/**
	 * Byte array to hexadecimal display string without separator.
	 * 
	 * @param byteArray byte array to be converted to string
	 * @return hexadecimal string, "--", if byte array is {@code null} or empty.
	 */
	public static String byteArray2HexString(byte[] byteArray) {
		return byteArray2HexString(byteArray, NO_SEPARATOR, 0);
	}

	/**
	 * Byte array to hexadecimal display string.
	 * 
	 * @param byteArray byte array to be converted to string
	 * @param sep separator. If {@link #NO_SEPARATOR}, then no separator is used
	 *            between the bytes.
	 * @param max maximum bytes to be converted. 0 to convert all bytes.
	 * @return hexadecimal string, e.g "01:45:A4", if ':' is used as separator.
	 *         "--", if byte array is {@code null} or empty.
	 */
	public static String byteArray2HexString(byte[] byteArray, char sep, int max) {
		if (byteArray == null || byteArray.length == 0) {
			return "--";
		}
		int length = max == 0 ? byteArray.length : Math.min(max, byteArray.length);
		StringBuilder builder = new StringBuilder(length * 3);
		for (int index = 0; index < length; index++) {
			if (index > 0 && sep != NO_SEPARATOR) {
				builder.append(sep);
			}
			builder.append(HEX_DIGITS[(byteArray[index] >> 4) & 0x0F]);
			builder.append(HEX_DIGITS[byteArray[index] & 0x0F]);
		}
		return builder.toString();
	}

	/**
	 * Decode base64 string into byte array.
	 * 
	 * Whitespace is ignored and missing padding is added.
	 * 
	 * @param base64 base64 string
	 * @return byte array.
	 * @throws IllegalArgumentException if the string is not valid base64.
	 */
	public static byte[] base64ToByteArray(String base64) {
		StringBuilder text = new StringBuilder(base64.replaceAll("\\s", ""));
		switch (text.length() % 4) {
		case 1:
			throw new IllegalArgumentException("'" + text + "' invalid base64!");
		case 2:
			text.append("==");
			break;
		case 3:
			text.append('=');
			break;
		default:
			break;
		}
		return Base64.getDecoder().decode(text.toString());
	}

	/**
	 * Encode byte array into base64 string.
	 * 
	 * @param bytes byte array
	 * @return base64 string
	 */
	public static String byteArrayToBase64(byte[] bytes) {
		return Base64.getEncoder().encodeToString(bytes);
	}
}
