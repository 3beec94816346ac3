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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of decoding a PKCS#12 container.
 * 
 * Contains all records in order of the container.
 */
public final class Pkcs12Content {

	private final List<Pkcs12Entry> entries;
	private final List<String> warnings;
	private final boolean authenticated;

	public Pkcs12Content(List<Pkcs12Entry> entries, List<String> warnings, boolean authenticated) {
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
		this.authenticated = authenticated;
	}

	public List<Pkcs12Entry> getEntries() {
		return entries;
	}

	/**
	 * Get entries of type.
	 * 
	 * @param type type of entries
	 * @return list of entries of the provided type, in order of the container.
	 */
	public List<Pkcs12Entry> getEntries(EntryType type) {
		List<Pkcs12Entry> result = new ArrayList<>();
		for (Pkcs12Entry entry : entries) {
			if (entry.getType() == type) {
				result.add(entry);
			}
		}
		return result;
	}

	/**
	 * Get warnings.
	 * 
	 * Reports a missing MAC, or a failed MAC verification with
	 * {@link Pkcs12Config.MacPolicy#WARN}.
	 * 
	 * @return list of warnings. Empty, if the container is authenticated.
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Check, if the MAC of the container is verified.
	 * 
	 * @return {@code true}, if verified, {@code false}, if the MAC is missing
	 *         or failed.
	 */
	public boolean isAuthenticated() {
		return authenticated;
	}

	@Override
	public String toString() {
		return entries.size() + " entries, " + (authenticated ? "authenticated" : "not authenticated");
	}
}
