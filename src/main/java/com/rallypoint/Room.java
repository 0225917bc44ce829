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
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Point-in-time projection of a named broadcast group.
 * <p>
 * Member user IDs and the connection count are computed when the projection is taken; rooms themselves are never
 * deleted, so a room whose members have all left reports zero connections.
 */
@ThreadSafe
public final class Room {
	@NonNull
	private final String id;
	@NonNull
	private final RoomKind roomKind;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final Set<@NonNull Long> memberUserIds;
	@NonNull
	private final Integer connectionCount;

	Room(@NonNull String id,
			 @NonNull RoomKind roomKind,
			 @NonNull Instant createdAt,
			 @NonNull Set<@NonNull Long> memberUserIds,
			 @NonNull Integer connectionCount) {
		requireNonNull(id);
		requireNonNull(roomKind);
		requireNonNull(createdAt);
		requireNonNull(memberUserIds);
		requireNonNull(connectionCount);

		this.id = id;
		this.roomKind = roomKind;
		this.createdAt = createdAt;
		this.memberUserIds = Collections.unmodifiableSet(new LinkedHashSet<>(memberUserIds));
		this.connectionCount = connectionCount;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, roomKind=%s, memberUserIds=%s, connectionCount=%s}", getClass().getSimpleName(),
				getId(), getRoomKind(), getMemberUserIds(), getConnectionCount());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Room room))
			return false;

		return Objects.equals(getId(), room.getId())
				&& Objects.equals(getRoomKind(), room.getRoomKind())
				&& Objects.equals(getCreatedAt(), room.getCreatedAt())
				&& Objects.equals(getMemberUserIds(), room.getMemberUserIds())
				&& Objects.equals(getConnectionCount(), room.getConnectionCount());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getRoomKind(), getCreatedAt(), getMemberUserIds(), getConnectionCount());
	}

	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public RoomKind getRoomKind() {
		return this.roomKind;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	/**
	 * Distinct user IDs of authenticated connections currently in the room.
	 *
	 * @return the member user IDs
	 */
	@NonNull
	public Set<@NonNull Long> getMemberUserIds() {
		return this.memberUserIds;
	}

	@NonNull
	public Integer getConnectionCount() {
		return this.connectionCount;
	}
}
