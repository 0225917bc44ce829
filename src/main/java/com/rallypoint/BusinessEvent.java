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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An application-originated fact, such as {@code post.created}, fanned out to every plugin that handles business events.
 * <p>
 * Instances can be acquired via the {@link #withType(String)} builder factory method.
 */
@ThreadSafe
public final class BusinessEvent {
	@NonNull
	private final String type;
	@NonNull
	private final Map<@NonNull String, @Nullable Object> payload;
	@Nullable
	private final String sourceModule;
	@NonNull
	private final Instant timestamp;

	/**
	 * Acquires a builder for {@link BusinessEvent} instances.
	 *
	 * @param type the event type, e.g. {@code post.created}
	 * @return the builder
	 */
	@NonNull
	public static Builder withType(@NonNull String type) {
		requireNonNull(type);
		return new Builder(type);
	}

	protected BusinessEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		String type = trimAggressivelyToNull(builder.type);

		if (type == null)
			throw new IllegalArgumentException("Business event type must not be blank");

		this.type = type;
		this.payload = builder.payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
		this.sourceModule = trimAggressivelyToNull(builder.sourceModule);
		this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, sourceModule=%s, timestamp=%s, payload=%s}", getClass().getSimpleName(),
				getType(), getSourceModule().orElse(null), getTimestamp(), getPayload());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BusinessEvent businessEvent))
			return false;

		return Objects.equals(getType(), businessEvent.getType())
				&& Objects.equals(getPayload(), businessEvent.getPayload())
				&& Objects.equals(getSourceModule(), businessEvent.getSourceModule())
				&& Objects.equals(getTimestamp(), businessEvent.getTimestamp());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getPayload(), getSourceModule(), getTimestamp());
	}

	@NonNull
	public String getType() {
		return this.type;
	}

	@NonNull
	public Map<@NonNull String, @Nullable Object> getPayload() {
		return this.payload;
	}

	@NonNull
	public Optional<Object> getPayloadValue(@NonNull String key) {
		requireNonNull(key);
		return Optional.ofNullable(getPayload().get(key));
	}

	@NonNull
	public Optional<String> getSourceModule() {
		return Optional.ofNullable(this.sourceModule);
	}

	@NonNull
	public Instant getTimestamp() {
		return this.timestamp;
	}

	/**
	 * Builder used to construct instances of {@link BusinessEvent} via {@link BusinessEvent#withType(String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private String type;
		@Nullable
		private Map<@NonNull String, @Nullable Object> payload;
		@Nullable
		private String sourceModule;
		@Nullable
		private Instant timestamp;

		protected Builder(@NonNull String type) {
			requireNonNull(type);
			this.type = type;
		}

		@NonNull
		public Builder type(@NonNull String type) {
			requireNonNull(type);
			this.type = type;
			return this;
		}

		@NonNull
		public Builder payload(@Nullable Map<@NonNull String, @Nullable Object> payload) {
			this.payload = payload;
			return this;
		}

		@NonNull
		public Builder sourceModule(@Nullable String sourceModule) {
			this.sourceModule = sourceModule;
			return this;
		}

		@NonNull
		public Builder timestamp(@Nullable Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		@NonNull
		public BusinessEvent build() {
			return new BusinessEvent(this);
		}
	}
}
