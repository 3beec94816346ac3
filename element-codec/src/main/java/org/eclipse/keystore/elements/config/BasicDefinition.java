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

/**
 * Basic definitions.
 * 
 * Used without additional units.
 *
 * @param <T> value type
 * @see Configuration#get(BasicDefinition)
 * @see Configuration#set(BasicDefinition, Object)
 */
public abstract class BasicDefinition<T> extends DocumentedDefinition<T> {

	/**
	 * Creates basic definition with default value.
	 * 
	 * @param key key for properties. Must be global unique.
	 * @param documentation documentation for properties.
	 * @param valueType value type.
	 * @param defaultValue default value returned instead of {@code null}.
	 * @throws NullPointerException if key is {@code null}
	 */
	protected BasicDefinition(String key, String documentation, Class<T> valueType, T defaultValue) {
		super(key, documentation, valueType, defaultValue);
	}
}
