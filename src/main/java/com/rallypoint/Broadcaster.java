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

import java.util.Optional;

/**
 * Fan-out facade over the {@link ConnectionRegistry}: the only surface plugins need for delivering events
 * and managing room membership.
 * <p>
 * Recipient sets are computed atomically; delivery happens afterward and is best-effort.  Targeting a room, user or
 * connection with no live recipients is a silent no-op.  Each method returns the number of connections the event
 * was handed to.
 * <p>
 * Implementations must be threadsafe.
 */
public interface Broadcaster {
	/**
	 * Delivers an event to a single connection.
	 *
	 * @return {@code true} if the connection was live
	 */
	@NonNull
	Boolean broadcastToConnection(@NonNull String connectionId,
																@NonNull String event,
																@Nullable Object payload);

	@NonNull
	Integer broadcastToRoom(@NonNull String roomId,
													@NonNull String event,
													@Nullable Object payload);

	/**
	 * Delivers an event to every member of a room except one connection, typically the sender.
	 */
	@NonNull
	Integer broadcastToRoomExcept(@NonNull String roomId,
																@NonNull String excludedConnectionId,
																@NonNull String event,
																@Nullable Object payload);

	/**
	 * Delivers an event to every live connection of a user.
	 */
	@NonNull
	Integer broadcastToUser(@NonNull Long userId,
													@NonNull String event,
													@Nullable Object payload);

	@NonNull
	Integer broadcastToAll(@NonNull String event,
												 @Nullable Object payload);

	/**
	 * Sends a {@code notification{message, type}} event to every live connection of a user.
	 */
	@NonNull
	Integer sendNotificationToUser(@NonNull Long userId,
																 @NonNull String message,
																 @NonNull NotificationType notificationType);

	@NonNull
	Integer sendNotificationToRoom(@NonNull String roomId,
																 @NonNull String message,
																 @NonNull NotificationType notificationType);

	@NonNull
	Integer sendNotificationToAll(@NonNull String message,
																@NonNull NotificationType notificationType);

	@NonNull
	Boolean joinRoom(@NonNull String connectionId,
									 @NonNull String roomId);

	@NonNull
	Boolean leaveRoom(@NonNull String connectionId,
										@NonNull String roomId);

	@NonNull
	Optional<Room> roomInfo(@NonNull String roomId);

	@NonNull
	Integer countConnections();
}
