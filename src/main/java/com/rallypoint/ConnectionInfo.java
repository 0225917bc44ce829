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
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable point-in-time projection of a registered connection.
 */
@ThreadSafe
public final class ConnectionInfo {
	@NonNull
	private final String id;
	@Nullable
	private final Principal principal;
	@NonNull
	private final Set<@NonNull String> joinedRooms;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final Instant lastActivityAt;

	ConnectionInfo(@NonNull String id,
								 @Nullable Principal principal,
								 @NonNull Set<@NonNull String> joinedRooms,
								 @NonNull Instant createdAt,
								 @NonNull Instant lastActivityAt) {
		requireNonNull(id);
		requireNonNull(joinedRooms);
		requireNonNull(createdAt);
		requireNonNull(lastActivityAt);

		this.id = id;
		this.principal = principal;
		this.joinedRooms = Collections.unmodifiableSet(new LinkedHashSet<>(joinedRooms));
		this.createdAt = createdAt;
		this.lastActivityAt = lastActivityAt;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, principal=%s, joinedRooms=%s}", getClass().getSimpleName(),
				getId(), getPrincipal().orElse(null), getJoinedRooms());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ConnectionInfo connectionInfo))
			return false;

		return Objects.equals(getId(), connectionInfo.getId())
				&& Objects.equals(getPrincipal(), connectionInfo.getPrincipal())
				&& Objects.equals(getJoinedRooms(), connectionInfo.getJoinedRooms())
				&& Objects.equals(getCreatedAt(), connectionInfo.getCreatedAt())
				&& Objects.equals(getLastActivityAt(), connectionInfo.getLastActivityAt());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getPrincipal(), getJoinedRooms(), getCreatedAt(), getLastActivityAt());
	}

	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public Optional<Principal> getPrincipal() {
		return Optional.ofNullable(this.principal);
	}

	@NonNull
	public Optional<Long> getUserId() {
		return getPrincipal().map(Principal::getUserId);
	}

	@NonNull
	public Boolean isAuthenticated() {
		return this.principal != null;
	}

	/**
	 * Rooms this connection had joined, in join order.
	 *
	 * @return the joined room identifiers
	 */
	@NonNull
	public Set<@NonNull String> getJoinedRooms() {
		return this.joinedRooms;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	public Instant getLastActivityAt() {
		return this.lastActivityAt;
	}
}
