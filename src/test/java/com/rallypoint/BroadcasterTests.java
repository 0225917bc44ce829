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

import com.rallypoint.TestSupport.RecordingLifecycleObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

@ThreadSafe
public class BroadcasterTests {
	private RecordingLifecycleObserver lifecycleObserver;
	private ConnectionRegistry connectionRegistry;
	private Broadcaster broadcaster;

	@BeforeEach
	public void setUp() {
		this.lifecycleObserver = new RecordingLifecycleObserver();
		this.connectionRegistry = ConnectionRegistry.withDefaults();
		this.broadcaster = new DefaultBroadcaster(this.connectionRegistry, this.lifecycleObserver);
	}

	@Test
	public void roomBroadcastReachesExactlyRoomMembers() {
		RecordingConnection c1 = register("c1", null);
		RecordingConnection c2 = register("c2", null);
		RecordingConnection outsider = register("c3", null);

		this.broadcaster.joinRoom("c1", "post:1");
		this.broadcaster.joinRoom("c2", "post:1");
		this.broadcaster.joinRoom("c3", "post:2");

		Integer delivered = this.broadcaster.broadcastToRoom("post:1", "postUpdated", Map.of("postId", 1));

		Assertions.assertEquals(2, delivered);
		Assertions.assertEquals(List.of("postUpdated"), c1.emittedEventNames());
		Assertions.assertEquals(List.of("postUpdated"), c2.emittedEventNames());
		Assertions.assertEquals(List.of(), outsider.emittedEventNames());
	}

	@Test
	public void broadcastToUnknownTargetsIsANoOp() {
		Assertions.assertEquals(0, this.broadcaster.broadcastToRoom("nobody-here", "event", null));
		Assertions.assertEquals(0, this.broadcaster.broadcastToUser(404L, "event", null));
		Assertions.assertFalse(this.broadcaster.broadcastToConnection("ghost", "event", null));
		Assertions.assertEquals(0, this.broadcaster.broadcastToAll("event", null));
	}

	@Test
	public void roomBroadcastCanExcludeSender() {
		RecordingConnection sender = register("sender", null);
		RecordingConnection listener = register("listener", null);

		this.broadcaster.joinRoom("sender", "post:9");
		this.broadcaster.joinRoom("listener", "post:9");

		Assertions.assertEquals(1, this.broadcaster.broadcastToRoomExcept("post:9", "sender", "typing", Map.of("isTyping", true)));
		Assertions.assertEquals(List.of(), sender.emittedEventNames());
		Assertions.assertEquals(List.of("typing"), listener.emittedEventNames());
	}

	@Test
	public void userBroadcastReachesEveryConnectionOfThatUser() {
		Principal principal = Principal.withUserId(11L).build();
		RecordingConnection laptop = register("laptop", principal);
		RecordingConnection phone = register("phone", principal);
		RecordingConnection someoneElse = register("other", Principal.withUserId(12L).build());

		Assertions.assertEquals(2, this.broadcaster.sendNotificationToUser(11L, "Saved", NotificationType.SUCCESS));

		Map<String, Object> payload = laptop.emittedEventsNamed("notification").get(0).payloadAsMap();
		Assertions.assertEquals("Saved", payload.get("message"));
		Assertions.assertEquals("success", payload.get("type"));
		Assertions.assertEquals(1, phone.emittedEventsNamed("notification").size());
		Assertions.assertEquals(List.of(), someoneElse.emittedEventNames());
	}

	@Test
	public void ordersAreKeptPerRecipient() {
		RecordingConnection connection = register("c1", null);
		this.broadcaster.joinRoom("c1", "general");

		this.broadcaster.broadcastToRoom("general", "first", null);
		this.broadcaster.broadcastToAll("second", null);
		this.broadcaster.broadcastToConnection("c1", "third", null);

		Assertions.assertEquals(List.of("first", "second", "third"), connection.emittedEventNames());
	}

	@Test
	public void failedDeliveryDoesNotStopOtherRecipients() {
		Connection broken = new Connection() {
			@Override
			public String getId() {
				return "broken";
			}

			@Override
			public void emit(String event, Object payload) {
				throw new IllegalStateException("Socket is gone");
			}

			@Override
			public void close() {}
		};

		this.connectionRegistry.register(broken, null);
		RecordingConnection healthy = register("healthy", null);

		Assertions.assertEquals(1, this.broadcaster.sendNotificationToAll("Maintenance at noon", NotificationType.WARNING));
		Assertions.assertEquals(1, healthy.emittedEventsNamed("notification").size());

		List<LogEvent> failures = this.lifecycleObserver.logEventsOfType(LogEventType.CONNECTION_DELIVERY_FAILED);
		Assertions.assertEquals(1, failures.size());
		Assertions.assertEquals("broken", failures.get(0).getConnectionId().orElse(null));
	}

	private RecordingConnection register(String connectionId, Principal principal) {
		RecordingConnection connection = new RecordingConnection(connectionId);
		this.connectionRegistry.register(connection, principal);
		return connection;
	}
}
