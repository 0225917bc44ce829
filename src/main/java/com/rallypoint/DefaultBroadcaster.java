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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Broadcaster} backed by a {@link ConnectionRegistry}.
 */
@ThreadSafe
public final class DefaultBroadcaster implements Broadcaster {
	@NonNull
	private static final String NOTIFICATION_EVENT;

	static {
		NOTIFICATION_EVENT = "notification";
	}

	@NonNull
	private final ConnectionRegistry connectionRegistry;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	public DefaultBroadcaster(@NonNull ConnectionRegistry connectionRegistry,
														@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(connectionRegistry);
		requireNonNull(lifecycleObserver);

		this.connectionRegistry = connectionRegistry;
		this.lifecycleObserver = lifecycleObserver;
	}

	@NonNull
	@Override
	public Boolean broadcastToConnection(@NonNull String connectionId,
																			 @NonNull String event,
																			 @Nullable Object payload) {
		requireNonNull(connectionId);
		requireNonNull(event);

		Connection connection = getConnectionRegistry().connection(connectionId).orElse(null);

		if (connection == null)
			return false;

		return deliver(List.of(connection), event, payload) == 1;
	}

	@NonNull
	@Override
	public Integer broadcastToRoom(@NonNull String roomId,
																 @NonNull String event,
																 @Nullable Object payload) {
		requireNonNull(roomId);
		requireNonNull(event);

		return deliver(getConnectionRegistry().connectionsInRoom(roomId), event, payload);
	}

	@NonNull
	@Override
	public Integer broadcastToRoomExcept(@NonNull String roomId,
																			 @NonNull String excludedConnectionId,
																			 @NonNull String event,
																			 @Nullable Object payload) {
		requireNonNull(roomId);
		requireNonNull(excludedConnectionId);
		requireNonNull(event);

		List<Connection> connections = getConnectionRegistry().connectionsInRoom(roomId).stream()
				.filter(connection -> !connection.getId().equals(excludedConnectionId))
				.toList();

		return deliver(connections, event, payload);
	}

	@NonNull
	@Override
	public Integer broadcastToUser(@NonNull Long userId,
																 @NonNull String event,
																 @Nullable Object payload) {
		requireNonNull(userId);
		requireNonNull(event);

		return deliver(getConnectionRegistry().connectionsForUserId(userId), event, payload);
	}

	@NonNull
	@Override
	public Integer broadcastToAll(@NonNull String event,
																@Nullable Object payload) {
		requireNonNull(event);
		return deliver(getConnectionRegistry().allConnections(), event, payload);
	}

	@NonNull
	@Override
	public Integer sendNotificationToUser(@NonNull Long userId,
																				@NonNull String message,
																				@NonNull NotificationType notificationType) {
		return broadcastToUser(userId, NOTIFICATION_EVENT, notificationPayload(message, notificationType));
	}

	@NonNull
	@Override
	public Integer sendNotificationToRoom(@NonNull String roomId,
																				@NonNull String message,
																				@NonNull NotificationType notificationType) {
		return broadcastToRoom(roomId, NOTIFICATION_EVENT, notificationPayload(message, notificationType));
	}

	@NonNull
	@Override
	public Integer sendNotificationToAll(@NonNull String message,
																			 @NonNull NotificationType notificationType) {
		return broadcastToAll(NOTIFICATION_EVENT, notificationPayload(message, notificationType));
	}

	@NonNull
	@Override
	public Boolean joinRoom(@NonNull String connectionId,
													@NonNull String roomId) {
		return getConnectionRegistry().join(connectionId, roomId);
	}

	@NonNull
	@Override
	public Boolean leaveRoom(@NonNull String connectionId,
													 @NonNull String roomId) {
		return getConnectionRegistry().leave(connectionId, roomId);
	}

	@NonNull
	@Override
	public Optional<Room> roomInfo(@NonNull String roomId) {
		return getConnectionRegistry().roomInfo(roomId);
	}

	@NonNull
	@Override
	public Integer countConnections() {
		return getConnectionRegistry().countConnections();
	}

	@NonNull
	static Map<String, Object> notificationPayload(@NonNull String message,
																								 @NonNull NotificationType notificationType) {
		requireNonNull(message);
		requireNonNull(notificationType);

		Map<String, Object> payload = new LinkedHashMap<>(2);
		payload.put("message", message);
		payload.put("type", notificationType.getWireValue());
		return payload;
	}

	// Runs outside the registry lock
	@NonNull
	protected Integer deliver(@NonNull List<@NonNull Connection> connections,
														@NonNull String event,
														@Nullable Object payload) {
		requireNonNull(connections);
		requireNonNull(event);

		int delivered = 0;

		for (Connection connection : connections) {
			try {
				connection.emit(event, payload);
				++delivered;
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.CONNECTION_DELIVERY_FAILED,
								format("Unable to deliver '%s' event to connection %s", event, connection.getId()))
						.connectionId(connection.getId())
						.throwable(e)
						.build());
			}
		}

		return delivered;
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private ConnectionRegistry getConnectionRegistry() {
		return this.connectionRegistry;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
