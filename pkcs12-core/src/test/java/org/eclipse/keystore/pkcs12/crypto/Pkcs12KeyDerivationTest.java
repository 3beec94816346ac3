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
package org.eclipse.keystore.pkcs12.crypto;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.security.GeneralSecurityException;

import org.eclipse.keystore.elements.category.Small;
import org.eclipse.keystore.elements.util.StringUtil;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Known answer tests for the PKCS#12 key derivation, RFC 7292, appendix B.
 */
@Category(Small.class)
public class Pkcs12KeyDerivationTest {

	@Test
	public void testKeyMaterialSmeg() throws GeneralSecurityException {
		assertDerive("smeg", "0A58CF64530D823F", 1, Pkcs12KeyDerivation.KEY_MATERIAL, 24,
				"8AAAE6297B6CB04642AB5B077851284EB7128F1A2A7FBCA3");
	}

	@Test
	public void testIvMaterialSmeg() throws GeneralSecurityException {
		assertDerive("smeg", "0A58CF64530D823F", 1, Pkcs12KeyDerivation.IV_MATERIAL, 8, "79993DFE048D3B76");
	}

	@Test
	public void testKeyMaterialQueeg() throws GeneralSecurityException {
		assertDerive("queeg", "05DEC959ACFF72F7", 1000, Pkcs12KeyDerivation.KEY_MATERIAL, 24,
				"ED2034E36328830FF09DF1E1A07DD357185DAC0D4F9EB3D4");
	}

	@Test
	public void testIvMaterialQueeg() throws GeneralSecurityException {
		assertDerive("queeg", "05DEC959ACFF72F7", 1000, Pkcs12KeyDerivation.IV_MATERIAL, 8, "11DEDAD7758D4860");
	}

	@Test
	public void testMacMaterial() throws GeneralSecurityException {
		assertDerive("queeg", "3D83C0E4546AC140", 1, Pkcs12KeyDerivation.MAC_MATERIAL, 20,
				"E7C474E965F2BA6D5FB0107DCEB00E54D967CC7A");
	}

	@Test
	public void testLongerThanOneDigest() throws GeneralSecurityException {
		assertDerive("changeit", "0102030405060708", 1, Pkcs12KeyDerivation.KEY_MATERIAL, 40,
				"3414CB5DCC759EC8116A0C9B0C081F813126EE3BA3CE9A1C82C81510206368C1139065554A2C5220");
	}

	@Test
	public void testEmptyAndAbsentPasswordDiffer() throws GeneralSecurityException {
		byte[] salt = StringUtil.hex2ByteArray("0102030405060708");
		byte[] empty = Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, new char[0], salt, 2048,
				Pkcs12KeyDerivation.KEY_MATERIAL, 5);
		byte[] absent = Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, null, salt, 2048,
				Pkcs12KeyDerivation.KEY_MATERIAL, 5);
		assertThat(StringUtil.byteArray2Hex(empty), is("D9E86745C0"));
		assertThat(StringUtil.byteArray2Hex(absent), is("3CDBB28C9A"));
	}

	@Test
	public void testPasswordToBytes() {
		assertThat(StringUtil.byteArray2Hex(Pkcs12KeyDerivation.passwordToBytes("ab".toCharArray())),
				is("006100620000"));
		assertThat(StringUtil.byteArray2Hex(Pkcs12KeyDerivation.passwordToBytes(new char[0])), is("0000"));
		assertThat(Pkcs12KeyDerivation.passwordToBytes(null).length, is(0));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroIterations() throws GeneralSecurityException {
		Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, "test".toCharArray(), new byte[8], 0,
				Pkcs12KeyDerivation.KEY_MATERIAL, 8);
	}

	private static void assertDerive(String password, String salt, int iterations, int purpose, int length,
			String expected) throws GeneralSecurityException {
		byte[] result = Pkcs12KeyDerivation.derive(DigestAlgorithm.SHA1, password.toCharArray(),
				StringUtil.hex2ByteArray(salt), iterations, purpose, length);
		assertThat(StringUtil.byteArray2Hex(result), is(expected));
	}
}
