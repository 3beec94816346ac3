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

import java.util.Arrays;
import java.util.List;

/**
 * Enumeration definition.
 *
 * @param <E> enumeration type
 */
public class EnumDefinition<E extends Enum<?>> extends BasicDefinition<E> {

	private final List<E> values;
	private final String valuesDocumentation;

	/**
	 * Creates enumeration definition.
	 * 
	 * @param key key for properties. Must be global unique.
	 * @param documentation documentation for properties.
	 * @param defaultValue default value.
	 * @param values set of supported values.
	 * @throws NullPointerException if key or values is {@code null}
	 * @throws IllegalArgumentException if values are empty, a value is
	 *             {@code null}, or the default value is not contained in the
	 *             values
	 */
	public EnumDefinition(String key, String documentation, E defaultValue, E[] values) {
		super(key, documentation, DefinitionUtils.getClass(values), defaultValue);
		for (E in : values) {
			if (in == null) {
				throw new IllegalArgumentException("Enum set must not contain null!");
			}
		}
		this.values = Arrays.asList(Arrays.copyOf(values, values.length));
		this.valuesDocumentation = DefinitionUtils.toNames(this.values, true);
		if (defaultValue != null) {
			isAssignableFrom(defaultValue);
		}
	}

	@Override
	public String writeValue(E value) {
		return value.name();
	}

	@Override
	public String getDocumentation() {
		return super.getDocumentation() + "\n" + valuesDocumentation + ".";
	}

	@Override
	protected boolean isAssignableFrom(Object value) {
		if (values.contains(value)) {
			return true;
		}
		if (super.isAssignableFrom(value)) {
			throw new IllegalArgumentException(value + " is not in " + valuesDocumentation);
		}
		return false;
	}

	@Override
	protected E parseValue(String value) throws ValueException {
		E result = DefinitionUtils.toValue(value, values);
		if (result == null) {
			throw new ValueException(value + " is not in " + valuesDocumentation);
		}
		return result;
	}
}
