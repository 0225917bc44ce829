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

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Room membership index, keyed by room identifier.
 * <p>
 * Every access must happen while holding the owning {@link ConnectionRegistry}'s lock, which is how connection
 * records and room membership stay in agreement.
 */
@NotThreadSafe
final class RoomDirectory {
	@NonNull
	private final Map<@NonNull String, @NonNull RoomRecord> roomRecordsByRoomId;

	RoomDirectory() {
		this.roomRecordsByRoomId = new LinkedHashMap<>();
	}

	/**
	 * Adds the connection to the room, creating the room on first join.
	 *
	 * @return {@code true} if membership changed
	 */
	@NonNull
	Boolean join(@NonNull String connectionId,
							 @NonNull String roomId,
							 @NonNull Instant now) {
		requireNonNull(connectionId);
		requireNonNull(roomId);
		requireNonNull(now);

		RoomRecord roomRecord = getRoomRecordsByRoomId().computeIfAbsent(roomId,
				(ignored) -> new RoomRecord(RoomKind.fromRoomId(roomId), now));

		return roomRecord.getConnectionIds().add(connectionId);
	}

	/**
	 * Removes the connection from the room.  The room record itself is retained.
	 *
	 * @return {@code true} if membership changed
	 */
	@NonNull
	Boolean leave(@NonNull String connectionId,
								@NonNull String roomId) {
		requireNonNull(connectionId);
		requireNonNull(roomId);

		RoomRecord roomRecord = getRoomRecordsByRoomId().get(roomId);

		if (roomRecord == null)
			return false;

		return roomRecord.getConnectionIds().remove(connectionId);
	}

	@NonNull
	Set<@NonNull String> connectionIdsInRoom(@NonNull String roomId) {
		requireNonNull(roomId);

		RoomRecord roomRecord = getRoomRecordsByRoomId().get(roomId);
		return roomRecord == null ? Set.of() : Collections.unmodifiableSet(roomRecord.getConnectionIds());
	}

	@NonNull
	Optional<RoomRecord> roomRecord(@NonNull String roomId) {
		requireNonNull(roomId);
		return Optional.ofNullable(getRoomRecordsByRoomId().get(roomId));
	}

	@NonNull
	List<@NonNull String> roomIds() {
		return new ArrayList<>(getRoomRecordsByRoomId().keySet());
	}

	@NonNull
	private Map<@NonNull String, @NonNull RoomRecord> getRoomRecordsByRoomId() {
		return this.roomRecordsByRoomId;
	}

	@NotThreadSafe
	static final class RoomRecord {
		@NonNull
		private final RoomKind roomKind;
		@NonNull
		private final Instant createdAt;
		@NonNull
		private final Set<@NonNull String> connectionIds;

		RoomRecord(@NonNull RoomKind roomKind,
							 @NonNull Instant createdAt) {
			requireNonNull(roomKind);
			requireNonNull(createdAt);

			this.roomKind = roomKind;
			this.createdAt = createdAt;
			this.connectionIds = new LinkedHashSet<>();
		}

		@NonNull
		RoomKind getRoomKind() {
			return this.roomKind;
		}

		@NonNull
		Instant getCreatedAt() {
			return this.createdAt;
		}

		@NonNull
		Set<@NonNull String> getConnectionIds() {
			return this.connectionIds;
		}
	}
}
