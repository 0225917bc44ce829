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


package com.rallypoint.plugin;

import com.rallypoint.Broadcaster;
import com.rallypoint.InboundEvent;
import com.rallypoint.NotificationType;
import com.rallypoint.Plugin;
import com.rallypoint.PluginConnection;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Room membership and liveness: {@code joinRoom}, {@code leaveRoom} and {@code ping}.
 * <p>
 * Room events take the room identifier either as a bare string payload or as {@code {"roomId": "..."}}.
 * A {@code ping} is answered with a {@code pong} notification.
 */
@ThreadSafe
public final class CorePlugin implements Plugin {
	@NonNull
	public static final String NAME;

	static {
		NAME = "core";
	}

	@NonNull
	@Override
	public String getName() {
		return NAME;
	}

	@NonNull
	@Override
	public String getVersion() {
		return "1.0.0";
	}

	@NonNull
	@Override
	public Set<@NonNull String> getInboundEventNames() {
		return Set.of("joinRoom", "leaveRoom", "ping");
	}

	@NonNull
	@Override
	public Set<@NonNull String> getOutboundEventNames() {
		return Set.of("notification", "connectionCount", "userJoined", "userLeft");
	}

	@Override
	public void setupEventHandlers(@NonNull PluginConnection pluginConnection,
																 @NonNull Broadcaster broadcaster) {
		requireNonNull(pluginConnection);
		requireNonNull(broadcaster);

		pluginConnection.on("joinRoom", (inboundEvent) ->
				roomId(inboundEvent).ifPresent(roomId -> broadcaster.joinRoom(pluginConnection.getId(), roomId)));

		pluginConnection.on("leaveRoom", (inboundEvent) ->
				roomId(inboundEvent).ifPresent(roomId -> broadcaster.leaveRoom(pluginConnection.getId(), roomId)));

		pluginConnection.on("ping", (inboundEvent) -> {
			Map<String, Object> pong = new LinkedHashMap<>(2);
			pong.put("message", "pong");
			pong.put("type", NotificationType.INFO.getWireValue());
			pluginConnection.emit("notification", pong);
		});
	}

	@NonNull
	private static Optional<String> roomId(@NonNull InboundEvent inboundEvent) {
		requireNonNull(inboundEvent);

		Optional<String> roomId = inboundEvent.getPayloadAsString();
		return roomId.isPresent() ? roomId : inboundEvent.getString("roomId");
	}
}
