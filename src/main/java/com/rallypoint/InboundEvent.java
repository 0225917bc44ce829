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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A named event sent by a client, with its decoded JSON payload.
 * <p>
 * The payload is whatever the client sent: a {@link Map} for JSON objects, a {@link String}, a {@link Number},
 * a {@link Boolean}, a {@link java.util.List} or {@code null}.  Typed accessors are lenient: a number sent as a
 * string is still readable via {@link #getPayloadAsLong()}, and a value of the wrong shape reads as
 * {@link Optional#empty()}.
 */
@ThreadSafe
public final class InboundEvent {
	@NonNull
	private final String name;
	@Nullable
	private final Object payload;

	@NonNull
	public static InboundEvent with(@NonNull String name,
																	@Nullable Object payload) {
		requireNonNull(name);
		return new InboundEvent(name, payload);
	}

	private InboundEvent(@NonNull String name,
											 @Nullable Object payload) {
		requireNonNull(name);

		this.name = name;
		this.payload = payload;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, payload=%s}", getClass().getSimpleName(), getName(), this.payload);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof InboundEvent inboundEvent))
			return false;

		return Objects.equals(getName(), inboundEvent.getName())
				&& Objects.equals(getPayload(), inboundEvent.getPayload());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getPayload());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Optional<Object> getPayload() {
		return Optional.ofNullable(this.payload);
	}

	/**
	 * The payload as a string.  Numbers are rendered with {@link Object#toString()}; blank strings read as empty.
	 *
	 * @return the string payload, or {@link Optional#empty()} if the payload is absent or not scalar
	 */
	@NonNull
	public Optional<String> getPayloadAsString() {
		return asString(this.payload);
	}

	@NonNull
	public Optional<Long> getPayloadAsLong() {
		return asLong(this.payload);
	}

	@NonNull
	public Optional<String> getString(@NonNull String key) {
		requireNonNull(key);
		return asString(valueForKey(key));
	}

	@NonNull
	public Optional<Integer> getInteger(@NonNull String key) {
		requireNonNull(key);
		return asLong(valueForKey(key))
				.filter(value -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
				.map(Long::intValue);
	}

	@NonNull
	public Optional<Long> getLong(@NonNull String key) {
		requireNonNull(key);
		return asLong(valueForKey(key));
	}

	@NonNull
	public Optional<Boolean> getBoolean(@NonNull String key) {
		requireNonNull(key);

		Object value = valueForKey(key);

		if (value instanceof Boolean booleanValue)
			return Optional.of(booleanValue);

		if (value instanceof String stringValue) {
			if ("true".equalsIgnoreCase(stringValue.trim()))
				return Optional.of(true);
			if ("false".equalsIgnoreCase(stringValue.trim()))
				return Optional.of(false);
		}

		return Optional.empty();
	}

	@Nullable
	private Object valueForKey(@NonNull String key) {
		requireNonNull(key);

		if (this.payload instanceof Map<?, ?> map)
			return map.get(key);

		return null;
	}

	@NonNull
	private static Optional<String> asString(@Nullable Object value) {
		if (value instanceof String stringValue)
			return Optional.ofNullable(trimAggressivelyToNull(stringValue));

		if (value instanceof Number || value instanceof Boolean)
			return Optional.of(value.toString());

		return Optional.empty();
	}

	@NonNull
	private static Optional<Long> asLong(@Nullable Object value) {
		if (value instanceof Number numberValue) {
			double doubleValue = numberValue.doubleValue();

			if (doubleValue != Math.rint(doubleValue))
				return Optional.empty();

			return Optional.of(numberValue.longValue());
		}

		if (value instanceof String stringValue) {
			String trimmed = trimAggressivelyToNull(stringValue);

			if (trimmed == null)
				return Optional.empty();

			try {
				return Optional.of(Long.valueOf(trimmed));
			} catch (NumberFormatException ignored) {
				return Optional.empty();
			}
		}

		return Optional.empty();
	}
}
