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
 * Definition of configuration value.
 *
 * @param <T> type of configuration value
 */
public abstract class DocumentedDefinition<T> {

	/**
	 * Lookup key.
	 */
	private final String key;
	/**
	 * Type of value.
	 */
	private final Class<T> valueType;
	/**
	 * Documentation for properties.
	 */
	private final String documentation;
	/**
	 * Default value.
	 */
	private final T defaultValue;

	/**
	 * Creates definition with default value.
	 * 
	 * If the configuration value is mainly used with primitive types (e.g.
	 * `int`), {@code null} causes a {@link NullPointerException} on access. To
	 * prevent that, the default value is returned instead of a {@code null}.
	 * 
	 * @param key key for properties. Must be global unique.
	 * @param documentation documentation for properties.
	 * @param valueType value type.
	 * @param defaultValue default value returned instead of {@code null}.
	 * @throws NullPointerException if key or value type is {@code null}
	 * @throws IllegalArgumentException if key is empty
	 */
	DocumentedDefinition(String key, String documentation, Class<T> valueType, T defaultValue) {
		if (key == null) {
			throw new NullPointerException("Key must not be null!");
		}
		if (valueType == null) {
			throw new NullPointerException("Value Type must not be null!");
		}
		if (key.isEmpty()) {
			throw new IllegalArgumentException("Key must not be empty!");
		}
		this.key = key;
		this.valueType = valueType;
		this.documentation = documentation;
		this.defaultValue = defaultValue;
	}

	/**
	 * Gets the value type.
	 * 
	 * @return value type
	 */
	public final Class<T> getValueType() {
		return valueType;
	}

	/**
	 * Gets key for properties.
	 * 
	 * @return key for properties.
	 */
	public final String getKey() {
		return key;
	}

	/**
	 * Gets type name for diagnose messages.
	 * 
	 * @return type name
	 */
	public String getTypeName() {
		return getValueType().getSimpleName();
	}

	/**
	 * Write typed value in textual presentation.
	 * 
	 * @param value value as type
	 * @return value in textual presentation
	 * @throws NullPointerException if value is {@code null}.
	 */
	public abstract String writeValue(T value);

	/**
	 * Gets documentation for properties.
	 * 
	 * @return documentation for properties
	 */
	public String getDocumentation() {
		return documentation;
	}

	/**
	 * Gets the default-value.
	 * 
	 * @return default-value, intended to be returned by
	 *         {@link Configuration#get(BasicDefinition)} instead of
	 *         {@code null}.
	 */
	public T getDefaultValue() {
		return defaultValue;
	}

	/**
	 * Reads textual presentation to type.
	 * 
	 * Trims the value before passing none-empty values to
	 * {@link #parseValue(String)}.
	 * 
	 * @param value value in textual presentation.
	 * @return value as type
	 * @throws NullPointerException if value is {@code null}
	 * @throws IllegalArgumentException if value is empty or could not parsed.
	 */
	public T readValue(String value) {
		String errorMessage = null;
		if (value == null) {
			errorMessage = String.format("Key '%s': textual value must not be null!", getKey());
			throw new NullPointerException(errorMessage);
		}
		value = value.trim();
		if (value.isEmpty()) {
			errorMessage = String.format("Key '%s': textual value must not be empty!", getKey());
			throw new IllegalArgumentException(errorMessage);
		}
		try {
			T result = parseValue(value);
			return checkValue(result);
		} catch (NumberFormatException e) {
			errorMessage = String.format("Key '%s': value '%s' is no %s", getKey(), value, getTypeName());
		} catch (ValueException e) {
			errorMessage = String.format("Key '%s': %s", getKey(), e.getMessage());
		} catch (IllegalArgumentException e) {
			errorMessage = String.format("Key '%s': value '%s' %s", getKey(), value, e.getMessage());
		}
		throw new IllegalArgumentException(errorMessage);
	}

	/**
	 * Check, if value is valid.
	 * 
	 * @param value value to check
	 * @return the value to store.
	 * @throws ValueException if the value is not valid, e.g. out of the
	 *             intended range.
	 */
	public T checkValue(T value) throws ValueException {
		return value;
	}

	/**
	 * Check, if value is assignable to the definition's type.
	 * 
	 * @param value value to be checked.
	 * @return {@code true}, if value is assignable, {@code false} otherwise.
	 * @throws IllegalArgumentException if value doesn't match any specific
	 *             constraints and the error message contains the details.
	 */
	protected boolean isAssignableFrom(Object value) {
		return getValueType().isInstance(value);
	}

	/**
	 * Parser textual presentation to type.
	 * 
	 * @param value value in textual presentation.
	 * @return value as type
	 * @throws NullPointerException if value is {@code null}.
	 * @throws IllegalArgumentException if the textual value doesn't fit.
	 * @throws ValueException if the textual value doesn't fit and details of
	 *             the failure are available.
	 */
	protected abstract T parseValue(String value) throws ValueException;

	@SuppressWarnings("unchecked")
	protected String write(Object value) {
		return writeValue((T) value);
	}

	@Override
	public String toString() {
		return key;
	}
}
