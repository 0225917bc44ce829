/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rallypoint.util;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file and converts its values to {@link String}, {@link Integer}, {@link Long}, {@link Boolean},
 * {@link Path} or {@link Duration} (given in seconds).
 */
@ThreadSafe
public final class PropertiesFileReader {
	@NonNull
	private final Map<@NonNull String, @NonNull String> properties;

	/**
	 * Reads properties from a file on disk.
	 *
	 * @param propertiesFile the file to read
	 * @return the reader
	 * @throws IllegalArgumentException if the file is missing, not a regular file or malformed
	 */
	@NonNull
	public static PropertiesFileReader fromPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			return new PropertiesFileReader(loadProperties(inputStream));
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}
	}

	/**
	 * Reads properties from a classpath resource.
	 *
	 * @param resourceName the resource name, e.g. {@code rallypoint.properties}
	 * @return the reader
	 * @throws IllegalArgumentException if the resource is missing or malformed
	 */
	@NonNull
	public static PropertiesFileReader fromClasspathResource(@NonNull String resourceName) {
		requireNonNull(resourceName);

		InputStream resourceInputStream = PropertiesFileReader.class.getClassLoader().getResourceAsStream(resourceName);

		if (resourceInputStream == null)
			throw new IllegalArgumentException(format("Unable to find properties resource '%s' on the classpath", resourceName));

		try (InputStream inputStream = resourceInputStream) {
			return new PropertiesFileReader(loadProperties(inputStream));
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties resource '%s'", resourceName), e);
		}
	}

	private PropertiesFileReader(@NonNull Map<@NonNull String, @NonNull String> properties) {
		requireNonNull(properties);
		this.properties = Collections.unmodifiableMap(new HashMap<>(properties));
	}

	/**
	 * The converted value for a required key.
	 *
	 * @throws IllegalStateException    if there is no non-blank value for {@code key}
	 * @throws IllegalArgumentException if the value cannot be converted to {@code type}
	 */
	@NonNull
	public <T> T valueFor(@NonNull String key,
												@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		return optionalValueFor(key, type).orElseThrow(() ->
				new IllegalStateException(format("No properties file value was found for key '%s'", key)));
	}

	/**
	 * The converted value for an optional key; blank values read as absent.
	 *
	 * @throws IllegalArgumentException if the value cannot be converted to {@code type}
	 */
	@NonNull
	public <T> Optional<T> optionalValueFor(@NonNull String key,
																					@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		String value = trimAggressivelyToNull(getProperties().get(key));

		if (value == null)
			return Optional.empty();

		return Optional.of(type.cast(convert(key, value, type)));
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getProperties() {
		return this.properties;
	}

	@NonNull
	private static Object convert(@NonNull String key,
																@NonNull String value,
																@NonNull Class<?> type) {
		try {
			if (type == String.class)
				return value;
			if (type == Integer.class)
				return Integer.valueOf(value);
			if (type == Long.class)
				return Long.valueOf(value);
			if (type == Path.class)
				return Paths.get(value);
			if (type == Duration.class)
				return Duration.ofSeconds(Long.parseLong(value));
			if (type == Boolean.class) {
				if ("true".equalsIgnoreCase(value))
					return Boolean.TRUE;
				if ("false".equalsIgnoreCase(value))
					return Boolean.FALSE;

				throw new IllegalArgumentException(format("'%s' is not a boolean", value));
			}
		} catch (RuntimeException e) {
			throw new IllegalArgumentException(format("Unable to convert properties file value '%s' for key '%s' to %s",
					value, key, type.getSimpleName()), e);
		}

		throw new IllegalArgumentException(format("Not sure how to convert properties file value '%s' for key '%s' to requested type %s",
				value, key, type.getName()));
	}

	@NonNull
	private static Map<@NonNull String, @NonNull String> loadProperties(@Nullable InputStream inputStream) throws IOException {
		requireNonNull(inputStream);

		Properties properties = new Properties();

		try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}

		Map<String, String> propertiesMap = new HashMap<>();

		for (String propertyName : properties.stringPropertyNames())
			propertiesMap.put(propertyName, properties.getProperty(propertyName));

		return propertiesMap;
	}
}
