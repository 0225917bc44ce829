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

package com.rallypoint;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Contract for generating connection identifiers.
 * <p>
 * Implementations must be threadsafe and must never return the same identifier twice within a process.
 */
@FunctionalInterface
public interface IdGenerator {
	/**
	 * Generates an identifier.
	 *
	 * @return the identifier
	 */
	@NonNull
	String generateId();

	/**
	 * Acquires a threadsafe {@link IdGenerator} with a best-effort local IP prefix.
	 *
	 * @return an {@code IdGenerator} with default settings
	 */
	@NonNull
	static IdGenerator withDefaults() {
		return DefaultIdGenerator.withDefaults();
	}

	/**
	 * Acquires a threadsafe {@link IdGenerator} with the given prefix.
	 *
	 * @param prefix string to prepend to generated identifiers, or {@code null} for the host-based default
	 * @return an {@code IdGenerator} configured with the given prefix
	 */
	@NonNull
	static IdGenerator withPrefix(@Nullable String prefix) {
		return DefaultIdGenerator.withPrefix(prefix);
	}
}
