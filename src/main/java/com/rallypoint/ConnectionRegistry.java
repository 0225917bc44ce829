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

import com.rallypoint.RoomDirectory.RoomRecord;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Authoritative record of live connections, their principals and their room memberships.
 * <p>
 * Connection records, the per-user index and the {@link RoomDirectory} are all guarded by a single lock, so
 * "connection C lists room R" holds exactly when "room R contains connection C".  No I/O and no listener callbacks
 * happen while the lock is held; recipient lists are copied out and delivered by the caller.
 * <p>
 * Unknown connection identifiers never cause exceptions: operations on them return {@code false} or
 * {@link Optional#empty()}.
 */
@ThreadSafe
public final class ConnectionRegistry {
	@NonNull
	private final Clock clock;
	@NonNull
	private final PresenceListener presenceListener;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<@NonNull String, @NonNull ConnectionRecord> connectionRecordsById;
	@NonNull
	private final Map<@NonNull Long, @NonNull Set<@NonNull String>> connectionIdsByUserId;
	@NonNull
	private final RoomDirectory roomDirectory;

	/**
	 * Acquires a registry with a UTC system clock, no presence listener and the default lifecycle observer.
	 *
	 * @return a {@code ConnectionRegistry} with default settings
	 */
	@NonNull
	public static ConnectionRegistry withDefaults() {
		return withClock(Clock.systemUTC()).build();
	}

	/**
	 * Acquires a builder for {@link ConnectionRegistry} instances.
	 *
	 * @param clock source of {@code createdAt}/{@code lastActivityAt} timestamps
	 * @return the builder
	 */
	@NonNull
	public static Builder withClock(@NonNull Clock clock) {
		requireNonNull(clock);
		return new Builder(clock);
	}

	protected ConnectionRegistry(@NonNull Builder builder) {
		requireNonNull(builder);

		this.clock = builder.clock;
		this.presenceListener = builder.presenceListener != null ? builder.presenceListener : new PresenceListener() {};
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.lock = new ReentrantLock();
		this.connectionRecordsById = new LinkedHashMap<>();
		this.connectionIdsByUserId = new LinkedHashMap<>();
		this.roomDirectory = new RoomDirectory();
	}

	/**
	 * Registers a live connection.
	 * <p>
	 * If this is the principal's first live connection, {@link PresenceListener#userDidConnect(Principal)} is
	 * invoked after the registry lock is released.
	 *
	 * @param connection the connection to register
	 * @param principal  the connection's principal, or {@code null} if anonymous
	 * @return {@code false} if a connection with the same identifier is already registered
	 */
	@NonNull
	public Boolean register(@NonNull Connection connection,
													@Nullable Principal principal) {
		requireNonNull(connection);

		boolean firstConnectionForUser = false;

		getLock().lock();

		try {
			if (getConnectionRecordsById().containsKey(connection.getId()))
				return false;

			Instant now = getClock().instant();
			getConnectionRecordsById().put(connection.getId(), new ConnectionRecord(connection, principal, now));

			if (principal != null) {
				Set<String> connectionIds = getConnectionIdsByUserId().computeIfAbsent(principal.getUserId(), (ignored) -> new LinkedHashSet<>());
				firstConnectionForUser = connectionIds.isEmpty();
				connectionIds.add(connection.getId());
			}
		} finally {
			getLock().unlock();
		}

		if (firstConnectionForUser)
			notifyPresenceListener(principal, true);

		return true;
	}

	/**
	 * Removes a connection, leaving every room it joined.  Idempotent.
	 * <p>
	 * If this was the principal's last live connection, {@link PresenceListener#userDidDisconnect(Principal)} is
	 * invoked exactly once, after the registry lock is released.
	 *
	 * @param connectionId identifier of the connection to remove
	 * @return the removed connection's final state, or {@link Optional#empty()} if it was not registered
	 */
	@NonNull
	public Optional<ConnectionInfo> unregister(@NonNull String connectionId) {
		requireNonNull(connectionId);

		ConnectionInfo connectionInfo;
		Principal departedPrincipal = null;

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().remove(connectionId);

			if (connectionRecord == null)
				return Optional.empty();

			for (String roomId : connectionRecord.getJoinedRooms())
				getRoomDirectory().leave(connectionId, roomId);

			Principal principal = connectionRecord.getPrincipal().orElse(null);

			if (principal != null) {
				Set<String> connectionIds = getConnectionIdsByUserId().get(principal.getUserId());

				if (connectionIds != null) {
					connectionIds.remove(connectionId);

					if (connectionIds.isEmpty()) {
						getConnectionIdsByUserId().remove(principal.getUserId());
						departedPrincipal = principal;
					}
				}
			}

			connectionInfo = connectionRecord.toConnectionInfo();
		} finally {
			getLock().unlock();
		}

		if (departedPrincipal != null)
			notifyPresenceListener(departedPrincipal, false);

		return Optional.of(connectionInfo);
	}

	/**
	 * Updates a connection's last-activity timestamp.
	 *
	 * @param connectionId the connection identifier
	 * @return {@code false} if the connection is not registered
	 */
	@NonNull
	public Boolean touch(@NonNull String connectionId) {
		requireNonNull(connectionId);

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);

			if (connectionRecord == null)
				return false;

			connectionRecord.setLastActivityAt(getClock().instant());
			return true;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Adds a registered connection to a room, creating the room on first join.
	 *
	 * @param connectionId the connection identifier
	 * @param roomId       the room identifier
	 * @return {@code true} if membership changed; {@code false} if already a member or the connection is unknown
	 */
	@NonNull
	public Boolean join(@NonNull String connectionId,
											@NonNull String roomId) {
		requireNonNull(connectionId);
		requireNonNull(roomId);

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);

			if (connectionRecord == null)
				return false;

			boolean joined = getRoomDirectory().join(connectionId, roomId, getClock().instant());

			if (joined)
				connectionRecord.getJoinedRooms().add(roomId);

			return joined;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Removes a registered connection from a room.
	 *
	 * @param connectionId the connection identifier
	 * @param roomId       the room identifier
	 * @return {@code true} if membership changed
	 */
	@NonNull
	public Boolean leave(@NonNull String connectionId,
											 @NonNull String roomId) {
		requireNonNull(connectionId);
		requireNonNull(roomId);

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);

			if (connectionRecord == null)
				return false;

			boolean left = getRoomDirectory().leave(connectionId, roomId);

			if (left)
				connectionRecord.getJoinedRooms().remove(roomId);

			return left;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Integer countConnections() {
		getLock().lock();

		try {
			return getConnectionRecordsById().size();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Number of distinct authenticated users with at least one live connection.
	 *
	 * @return the user count
	 */
	@NonNull
	public Integer countUsers() {
		getLock().lock();

		try {
			return getConnectionIdsByUserId().size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public List<@NonNull ConnectionInfo> connectionsForUser(@NonNull Long userId) {
		requireNonNull(userId);

		getLock().lock();

		try {
			Set<String> connectionIds = getConnectionIdsByUserId().get(userId);

			if (connectionIds == null)
				return List.of();

			List<ConnectionInfo> connectionInfos = new ArrayList<>(connectionIds.size());

			for (String connectionId : connectionIds)
				connectionInfos.add(getConnectionRecordsById().get(connectionId).toConnectionInfo());

			return connectionInfos;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<ConnectionInfo> connectionInfo(@NonNull String connectionId) {
		requireNonNull(connectionId);

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);
			return connectionRecord == null ? Optional.empty() : Optional.of(connectionRecord.toConnectionInfo());
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Point-in-time projections of every live connection, in registration order.
	 *
	 * @return the snapshot
	 */
	@NonNull
	public List<@NonNull ConnectionInfo> snapshot() {
		getLock().lock();

		try {
			List<ConnectionInfo> connectionInfos = new ArrayList<>(getConnectionRecordsById().size());

			for (ConnectionRecord connectionRecord : getConnectionRecordsById().values())
				connectionInfos.add(connectionRecord.toConnectionInfo());

			return connectionInfos;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Projection of a room, recomputed at call time.
	 *
	 * @param roomId the room identifier
	 * @return the room, or {@link Optional#empty()} if nobody has ever joined it
	 */
	@NonNull
	public Optional<Room> roomInfo(@NonNull String roomId) {
		requireNonNull(roomId);

		getLock().lock();

		try {
			return toRoom(roomId);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Projections of every room ever joined, in creation order.
	 *
	 * @return the rooms
	 */
	@NonNull
	public List<@NonNull Room> rooms() {
		getLock().lock();

		try {
			List<Room> rooms = new ArrayList<>();

			for (String roomId : getRoomDirectory().roomIds())
				toRoom(roomId).ifPresent(rooms::add);

			return rooms;
		} finally {
			getLock().unlock();
		}
	}

	// Recipient lookups for broadcasting.  Each returns a copy taken under the lock.

	@NonNull
	Optional<Connection> connection(@NonNull String connectionId) {
		requireNonNull(connectionId);

		getLock().lock();

		try {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);
			return connectionRecord == null ? Optional.empty() : Optional.of(connectionRecord.getConnection());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	List<@NonNull Connection> connectionsInRoom(@NonNull String roomId) {
		requireNonNull(roomId);

		getLock().lock();

		try {
			Set<String> connectionIds = getRoomDirectory().connectionIdsInRoom(roomId);
			List<Connection> connections = new ArrayList<>(connectionIds.size());

			for (String connectionId : connectionIds) {
				ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);

				if (connectionRecord != null)
					connections.add(connectionRecord.getConnection());
			}

			return connections;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	List<@NonNull Connection> connectionsForUserId(@NonNull Long userId) {
		requireNonNull(userId);

		getLock().lock();

		try {
			Set<String> connectionIds = getConnectionIdsByUserId().get(userId);

			if (connectionIds == null)
				return List.of();

			List<Connection> connections = new ArrayList<>(connectionIds.size());

			for (String connectionId : connectionIds)
				connections.add(getConnectionRecordsById().get(connectionId).getConnection());

			return connections;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	List<@NonNull Connection> allConnections() {
		getLock().lock();

		try {
			List<Connection> connections = new ArrayList<>(getConnectionRecordsById().size());

			for (ConnectionRecord connectionRecord : getConnectionRecordsById().values())
				connections.add(connectionRecord.getConnection());

			return connections;
		} finally {
			getLock().unlock();
		}
	}

	// Caller must hold the lock
	@NonNull
	private Optional<Room> toRoom(@NonNull String roomId) {
		requireNonNull(roomId);

		RoomRecord roomRecord = getRoomDirectory().roomRecord(roomId).orElse(null);

		if (roomRecord == null)
			return Optional.empty();

		Set<Long> memberUserIds = new LinkedHashSet<>();

		for (String connectionId : roomRecord.getConnectionIds()) {
			ConnectionRecord connectionRecord = getConnectionRecordsById().get(connectionId);

			if (connectionRecord != null)
				connectionRecord.getPrincipal().ifPresent(principal -> memberUserIds.add(principal.getUserId()));
		}

		return Optional.of(new Room(roomId, roomRecord.getRoomKind(), roomRecord.getCreatedAt(), memberUserIds,
				roomRecord.getConnectionIds().size()));
	}

	protected void notifyPresenceListener(@NonNull Principal principal,
																				boolean connected) {
		requireNonNull(principal);

		try {
			if (connected)
				getPresenceListener().userDidConnect(principal);
			else
				getPresenceListener().userDidDisconnect(principal);
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.PRESENCE_LISTENER_FAILED,
							format("An exception occurred while invoking %s::%s", PresenceListener.class.getSimpleName(),
									connected ? "userDidConnect" : "userDidDisconnect"))
					.throwable(throwable)
					.build());
		}
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private PresenceListener getPresenceListener() {
		return this.presenceListener;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Map<@NonNull String, @NonNull ConnectionRecord> getConnectionRecordsById() {
		return this.connectionRecordsById;
	}

	@NonNull
	private Map<@NonNull Long, @NonNull Set<@NonNull String>> getConnectionIdsByUserId() {
		return this.connectionIdsByUserId;
	}

	@NonNull
	private RoomDirectory getRoomDirectory() {
		return this.roomDirectory;
	}

	/**
	 * Mutable per-connection state, only touched while holding the registry lock.
	 */
	@NotThreadSafe
	private static final class ConnectionRecord {
		@NonNull
		private final Connection connection;
		@Nullable
		private final Principal principal;
		@NonNull
		private final Set<@NonNull String> joinedRooms;
		@NonNull
		private final Instant createdAt;
		@NonNull
		private Instant lastActivityAt;

		ConnectionRecord(@NonNull Connection connection,
										 @Nullable Principal principal,
										 @NonNull Instant createdAt) {
			requireNonNull(connection);
			requireNonNull(createdAt);

			this.connection = connection;
			this.principal = principal;
			this.joinedRooms = new LinkedHashSet<>();
			this.createdAt = createdAt;
			this.lastActivityAt = createdAt;
		}

		@NonNull
		ConnectionInfo toConnectionInfo() {
			return new ConnectionInfo(getConnection().getId(), this.principal, getJoinedRooms(), getCreatedAt(), getLastActivityAt());
		}

		@NonNull
		Connection getConnection() {
			return this.connection;
		}

		@NonNull
		Optional<Principal> getPrincipal() {
			return Optional.ofNullable(this.principal);
		}

		@NonNull
		Set<@NonNull String> getJoinedRooms() {
			return this.joinedRooms;
		}

		@NonNull
		Instant getCreatedAt() {
			return this.createdAt;
		}

		@NonNull
		Instant getLastActivityAt() {
			return this.lastActivityAt;
		}

		void setLastActivityAt(@NonNull Instant lastActivityAt) {
			requireNonNull(lastActivityAt);
			this.lastActivityAt = lastActivityAt;
		}
	}

	/**
	 * Builder used to construct instances of {@link ConnectionRegistry}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Clock clock;
		@Nullable
		private PresenceListener presenceListener;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder(@NonNull Clock clock) {
			requireNonNull(clock);
			this.clock = clock;
		}

		@NonNull
		public Builder presenceListener(@Nullable PresenceListener presenceListener) {
			this.presenceListener = presenceListener;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public ConnectionRegistry build() {
			return new ConnectionRegistry(this);
		}
	}
}
