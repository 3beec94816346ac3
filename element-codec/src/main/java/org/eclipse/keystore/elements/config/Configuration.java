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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.eclipse.keystore.elements.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The configuration of the keystore components.
 * 
 * The configuration is used via 3 interfaces:
 * <ul>
 * <li>The modules consume their configuration values using the get
 * functions.</li>
 * <li>The configuration values of the used modules are presented in a
 * properties file in order to enable a end-user to provide values according the
 * specific usage.</li>
 * <li>The applications may use the set functions in order to provide
 * application specific values.</li>
 * </ul>
 * 
 * Example part of a properties file:
 * 
 * <pre>
 * <code>
 * # Keystore Properties file
 * # Mon Oct 19 10:21:43 CEST 2026
 * #
 * # Policy for a failing MAC verification.
 * # [STRICT, WARN].
 * # Default: STRICT
 * PKCS12.MAC_POLICY=STRICT
 * ...
 * </code>
 * </pre>
 * 
 * Modules register their {@link ModuleDefinitionsProvider} using
 * {@link #addDefaultModule(ModuleDefinitionsProvider)}. When creating a new
 * {@link Configuration}, all registered {@link ModuleDefinitionsProvider} are
 * applied and will fill the map of {@link DocumentedDefinition}s and values.
 * 
 * <pre>
 * <code>
 * Configuration config = new Configuration()
 *    .set(Pkcs12Config.MAC_POLICY, MacPolicy.WARN)
 *    .set(Pkcs12Config.MAX_ITERATION_COUNT, 100_000);
 * </code>
 * </pre>
 * 
 * If both, a properties file and the setter-API, provides values for one
 * configuration topic, the value which is applied last wins.
 */
public final class Configuration {

	/**
	 * Handler for (custom) setup of configuration
	 * {@link DocumentedDefinition}s.
	 */
	public interface DefinitionsProvider {

		/**
		 * Apply definitions.
		 * 
		 * Use {@link Configuration#set(BasicDefinition, Object)} to apply the
		 * definitions.
		 * 
		 * @param config configuration to be apply the definitions.
		 */
		void applyDefinitions(Configuration config);
	}

	/**
	 * Handler for setup of configuration {@link DocumentedDefinition}s of a
	 * module.
	 */
	public interface ModuleDefinitionsProvider extends DefinitionsProvider {

		/**
		 * Get module name.
		 * 
		 * The module name is also used as prefix of the keys of the module's
		 * definitions.
		 * 
		 * @return module name
		 */
		String getModule();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

	/**
	 * The map of registered default modules.
	 */
	private static final ConcurrentMap<String, DefinitionsProvider> DEFAULT_MODULES = new ConcurrentHashMap<>();

	/**
	 * Modules.
	 */
	private final ConcurrentMap<String, DefinitionsProvider> modules;
	/**
	 * Definitions by key.
	 */
	private final ConcurrentMap<String, DocumentedDefinition<?>> definitions = new ConcurrentHashMap<>();
	/**
	 * The typed values.
	 */
	private final Map<String, Object> values = new HashMap<>();

	/**
	 * Add definitions provider for module.
	 * 
	 * @param modules available modules to add the module
	 * @param definitionsProvider definitions provider of module
	 * @return {@code true}, if module is added, {@code false}, if modules was
	 *         already added.
	 * @throws NullPointerException if any parameter is {@code null}
	 * @throws IllegalArgumentException if the module name is {@code null} or
	 *             empty or a different definitions provider is already
	 *             registered with that module name.
	 */
	private static boolean addModule(ConcurrentMap<String, DefinitionsProvider> modules,
			ModuleDefinitionsProvider definitionsProvider) {
		if (definitionsProvider == null) {
			throw new NullPointerException("DefinitionsProvider must not be null!");
		}
		String module = definitionsProvider.getModule();
		if (module == null) {
			throw new IllegalArgumentException("DefinitionsProvider's module must not be null!");
		}
		if (module.isEmpty()) {
			throw new IllegalArgumentException("DefinitionsProvider's module name must not be empty!");
		}
		DefinitionsProvider previous = modules.putIfAbsent(module, definitionsProvider);
		if (previous != null && previous != definitionsProvider) {
			throw new IllegalArgumentException("Module " + module + " already registered with different provider!");
		}
		return previous == null;
	}

	/**
	 * Add definitions provider for module.
	 * 
	 * @param definitionsProvider definitions provider of module
	 * @throws NullPointerException if any parameter is {@code null}
	 * @throws IllegalArgumentException if the module name is {@code null} or
	 *             empty or a different definitions provider is already
	 *             registered with that module name.
	 */
	public static void addDefaultModule(ModuleDefinitionsProvider definitionsProvider) {
		if (addModule(DEFAULT_MODULES, definitionsProvider)) {
			LOGGER.info("defaults added {}", definitionsProvider.getModule());
		}
	}

	/**
	 * Instantiates a new configuration and sets the value definitions using the
	 * registered module's {@link ModuleDefinitionsProvider}s.
	 * 
	 * @see #addDefaultModule(ModuleDefinitionsProvider)
	 */
	public Configuration() {
		this.modules = DEFAULT_MODULES;
		applyModules();
	}

	/**
	 * Instantiates a new configuration and sets the values from the provided
	 * configuration.
	 * 
	 * @param config configuration to copy
	 */
	public Configuration(Configuration config) {
		this.modules = DEFAULT_MODULES == config.modules ? DEFAULT_MODULES
				: new ConcurrentHashMap<String, DefinitionsProvider>(config.modules);
		this.definitions.putAll(config.definitions);
		this.values.putAll(config.values);
	}

	/**
	 * Instantiates a new configuration and sets the value definitions using the
	 * provided {@link ModuleDefinitionsProvider}s.
	 * 
	 * @param providers module definitions provider
	 */
	public Configuration(ModuleDefinitionsProvider... providers) {
		this.modules = new ConcurrentHashMap<>();
		for (ModuleDefinitionsProvider provider : providers) {
			if (addModule(modules, provider)) {
				LOGGER.trace("added {}", provider.getModule());
			}
		}
		applyModules();
	}

	/**
	 * Apply module's definitions.
	 * 
	 * Add default values and definitions.
	 */
	private void applyModules() {
		for (DefinitionsProvider handler : modules.values()) {
			handler.applyDefinitions(this);
		}
	}

	/**
	 * Loads properties from a input stream.
	 * 
	 * Unknown or invalid values are ignored and the
	 * {@link DocumentedDefinition#getDefaultValue()} will be used instead.
	 * 
	 * @param inStream the input stream
	 * @throws NullPointerException if the inStream is {@code null}.
	 * @throws IOException if an error occurred when reading from the input
	 *             stream
	 * @throws IllegalStateException if configuration has no definitions.
	 */
	public void load(final InputStream inStream) throws IOException {
		if (inStream == null) {
			throw new NullPointerException("input stream must not be null");
		}
		Properties properties = new Properties();
		properties.load(inStream);
		add(properties);
	}

	/**
	 * Add properties.
	 * 
	 * Applies conversion defined by that {@link DocumentedDefinition}s to the
	 * textual values. Unknown or invalid values are ignored and the
	 * {@link DocumentedDefinition#getDefaultValue()} will be used instead.
	 * 
	 * @param properties properties to convert and add
	 * @throws NullPointerException if properties is {@code null}.
	 * @throws IllegalStateException if configuration has no definitions.
	 */
	public void add(Properties properties) {
		if (properties == null) {
			throw new NullPointerException("properties must not be null!");
		}
		if (definitions.isEmpty()) {
			throw new IllegalStateException("Configuration contains no definitions!");
		}
		for (String key : properties.stringPropertyNames()) {
			DocumentedDefinition<?> definition = definitions.get(key);
			if (definition == null) {
				LOGGER.warn("Ignore {}, no configuration definition available!", key);
			} else {
				LOGGER.debug("Load {}", key);
				String text = properties.getProperty(key);
				Object value = loadValue(definition, text);
				values.put(key, value);
			}
		}
	}

	/**
	 * Load value from text.
	 * 
	 * @param definition value's definition
	 * @param text textual value
	 * @return value, or {@code null}, if textual value is empty or could not be
	 *         read.
	 */
	private Object loadValue(DocumentedDefinition<?> definition, String text) {
		Object value = null;
		if (text != null) {
			text = text.trim();
			if (!text.isEmpty()) {
				try {
					value = definition.readValue(text);
				} catch (RuntimeException ex) {
					LOGGER.warn("{}", ex.getMessage());
					value = null;
				}
			}
		}
		return value;
	}

	/**
	 * Stores the configuration to a stream using a given header.
	 * 
	 * The values of the registered modules are written sorted by their keys.
	 * Each value is preceded by its documentation and default value.
	 * 
	 * @param out stream to store
	 * @param header header to use
	 * @param resourceName resource name of store for logging, if available. May
	 *            be {@code null}, if not.
	 * @throws NullPointerException if out stream or header is {@code null}
	 * @throws IllegalStateException if configuration has no definitions.
	 */
	public void store(OutputStream out, String header, String resourceName) {
		if (out == null) {
			throw new NullPointerException("output stream must not be null!");
		}
		if (header == null) {
			throw new NullPointerException("header must not be null!");
		}
		if (resourceName != null) {
			LOGGER.info("writing properties to {}", resourceName);
		}
		if (definitions.isEmpty()) {
			throw new IllegalStateException("Configuration contains no definitions!");
		}
		List<String> keys = new ArrayList<>(definitions.keySet());
		Collections.sort(keys);
		try {
			Writer writer = new OutputStreamWriter(out, StandardCharsets.ISO_8859_1);
			writer.write(PropertiesUtility.normalizeComments(header));
			writer.write(StringUtil.lineSeparator());
			writer.write(PropertiesUtility.normalizeComments(new Date().toString()));
			writer.write(StringUtil.lineSeparator());
			writer.write("#");
			writer.write(StringUtil.lineSeparator());
			for (String key : keys) {
				writeProperty(key, writer);
			}
			writer.flush();
		} catch (IOException e) {
			if (resourceName != null) {
				LOGGER.warn("cannot write properties to {}: {}", resourceName, e.getMessage());
			} else {
				LOGGER.warn("cannot write properties: {}", e.getMessage());
			}
		}
	}

	/**
	 * Write single property.
	 * 
	 * If {@link DocumentedDefinition} contains a
	 * {@link DocumentedDefinition#getDocumentation()}, then first write that
	 * documentation as comment.
	 * 
	 * @param key key of definition.
	 * @param writer writer to write property
	 * @throws IOException if an i/o-error occurred
	 */
	private void writeProperty(String key, Writer writer) throws IOException {
		DocumentedDefinition<?> definition = definitions.get(key);
		StringBuilder documentation = new StringBuilder();
		String docu = definition.getDocumentation();
		if (docu != null) {
			documentation.append(docu);
		}
		Object defaultValue = definition.getDefaultValue();
		if (defaultValue != null) {
			if (documentation.length() > 0) {
				documentation.append('\n');
			}
			documentation.append("Default: ").append(definition.write(defaultValue));
		}
		if (documentation.length() > 0) {
			writer.write(PropertiesUtility.normalizeComments(documentation.toString()));
			writer.write(StringUtil.lineSeparator());
		}
		writer.write(PropertiesUtility.normalize(key, true));
		writer.write('=');
		Object value = values.get(key);
		if (value != null) {
			writer.write(PropertiesUtility.normalize(definition.write(value), false));
		}
		writer.write(StringUtil.lineSeparator());
	}

	/**
	 * Check, if definitions is already available.
	 * 
	 * Definitions are automatically added by their first use with one of the
	 * setter. This checks, if the definition has been added before calling
	 * this method.
	 * 
	 * @param <T> value type
	 * @param definition definition to check
	 * @return {@code true}, if available, {@code false}, if not.
	 * @throws NullPointerException if definition is {@code null}
	 */
	public <T> boolean hasDefinition(DocumentedDefinition<T> definition) {
		if (definition == null) {
			throw new NullPointerException("definition must not be null");
		}
		return definitions.get(definition.getKey()) != null;
	}

	/**
	 * Associates the specified textual value with the specified definition.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @param value the textual value
	 * @return the configuration for chaining
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition, or the
	 *             value is not valid.
	 */
	public <T> Configuration setFromText(DocumentedDefinition<T> definition, String value) {
		setInternal(definition, null, value);
		return this;
	}

	/**
	 * Get the textual configuration value of the definition.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @return the configuration value of the definition
	 */
	public <T> String getAsText(DocumentedDefinition<T> definition) {
		T value = getInternal(definition);
		return value == null ? null : definition.writeValue(value);
	}

	/**
	 * Associates the specified value with the specified definition.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @param value the value
	 * @return the configuration for chaining
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition, or the
	 *             value is not valid.
	 */
	public <T> Configuration set(BasicDefinition<T> definition, T value) {
		setInternal(definition, value, null);
		return this;
	}

	/**
	 * Gets the associated value.
	 * 
	 * @param <T> value type
	 * @param definition the value definition
	 * @return the value
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition.
	 */
	public <T> T get(BasicDefinition<T> definition) {
		return getInternal(definition);
	}

	/**
	 * Gets the associated value.
	 * 
	 * @param <T> type of the value
	 * @param definition definition of the value.
	 * @return the associated value. if {@code null}, return the
	 *         {@link DocumentedDefinition#getDefaultValue()} instead.
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition.
	 */
	@SuppressWarnings("unchecked")
	private <T> T getInternal(DocumentedDefinition<T> definition) {
		if (definition == null) {
			throw new NullPointerException("definition must not be null");
		}
		DocumentedDefinition<?> def = definitions.get(definition.getKey());
		if (def != null && def != definition) {
			throw new IllegalArgumentException("Definition " + definition + " doesn't match " + def);
		}
		T value = (T) values.get(definition.getKey());
		if (value == null) {
			return definition.getDefaultValue();
		} else {
			return value;
		}
	}

	/**
	 * Associates the specified value with the specified definition.
	 * 
	 * @param <T> type of the value
	 * @param definition definition of the value.
	 * @param value value to associate. May be {@code null}.
	 * @param text value as text to associate. May be {@code null}. If provided
	 *            and the typed value is missing, parse the text to get a typed
	 *            value.
	 * @throws NullPointerException if the definition is {@code null}
	 * @throws IllegalArgumentException if a different definition is already
	 *             available for the key of the provided definition, or the
	 *             value is not valid.
	 */
	private <T> void setInternal(DocumentedDefinition<T> definition, T value, String text) {
		if (definition == null) {
			throw new NullPointerException("definition must not be null");
		}
		DocumentedDefinition<?> def = definitions.putIfAbsent(definition.getKey(), definition);
		if (def != null && def != definition) {
			throw new IllegalArgumentException("Definition " + definition + " doesn't match " + def);
		}
		if (value == null && text != null) {
			value = definition.readValue(text);
		} else {
			if (value != null && !definition.isAssignableFrom(value)) {
				throw new IllegalArgumentException(
						value.getClass().getSimpleName() + " is not a " + definition.getTypeName());
			}
			try {
				value = definition.checkValue(value);
			} catch (ValueException ex) {
				throw new IllegalArgumentException(ex.getMessage());
			}
		}
		values.put(definition.getKey(), value);
	}
}
