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
import java.util.Objects;
import java.util.Optional;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The authenticated identity attached to a connection.
 * <p>
 * Instances can be acquired via the {@link #withUserId(Long)} builder factory method.
 */
@ThreadSafe
public final class Principal {
	@NonNull
	public static final String DEFAULT_ROLE;
	@NonNull
	public static final String ADMIN_ROLE;

	static {
		DEFAULT_ROLE = "user";
		ADMIN_ROLE = "admin";
	}

	@NonNull
	private final Long userId;
	@NonNull
	private final String role;
	@Nullable
	private final String name;

	/**
	 * Acquires a builder for {@link Principal} instances.
	 *
	 * @param userId the authenticated user's identifier
	 * @return the builder
	 */
	@NonNull
	public static Builder withUserId(@NonNull Long userId) {
		requireNonNull(userId);
		return new Builder(userId);
	}

	protected Principal(@NonNull Builder builder) {
		requireNonNull(builder);

		this.userId = builder.userId;

		String role = trimAggressivelyToNull(builder.role);
		this.role = role == null ? DEFAULT_ROLE : role;
		this.name = trimAggressivelyToNull(builder.name);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{userId=%s, role=%s, name=%s}", getClass().getSimpleName(), getUserId(), getRole(), getName().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Principal principal))
			return false;

		return Objects.equals(getUserId(), principal.getUserId())
				&& Objects.equals(getRole(), principal.getRole())
				&& Objects.equals(getName(), principal.getName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getUserId(), getRole(), getName());
	}

	@NonNull
	public Long getUserId() {
		return this.userId;
	}

	/**
	 * The role claim, {@code "user"} if none was supplied.
	 *
	 * @return the role
	 */
	@NonNull
	public String getRole() {
		return this.role;
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	@NonNull
	public Boolean isAdmin() {
		return ADMIN_ROLE.equals(getRole());
	}

	/**
	 * Builder used to construct instances of {@link Principal}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Long userId;
		@Nullable
		private String role;
		@Nullable
		private String name;

		protected Builder(@NonNull Long userId) {
			requireNonNull(userId);
			this.userId = userId;
		}

		@NonNull
		public Builder role(@Nullable String role) {
			this.role = role;
			return this;
		}

		@NonNull
		public Builder name(@Nullable String name) {
			this.name = name;
			return this;
		}

		@NonNull
		public Principal build() {
			return new Principal(this);
		}
	}
}
