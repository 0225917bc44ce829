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

import com.rallypoint.BusinessEvent;
import com.rallypoint.ConnectionEventDispatcher;
import com.rallypoint.ConnectionRegistry;
import com.rallypoint.DefaultBroadcaster;
import com.rallypoint.InboundEvent;
import com.rallypoint.PluginRegistry;
import com.rallypoint.Principal;
import com.rallypoint.RealtimeHub;
import com.rallypoint.RecordingConnection;
import com.rallypoint.TestSupport.RecordingLifecycleObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

@ThreadSafe
public class PostPluginTests {
	private ConnectionRegistry connectionRegistry;
	private DefaultBroadcaster broadcaster;
	private PluginRegistry pluginRegistry;

	@BeforeEach
	public void setUp() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		this.connectionRegistry = ConnectionRegistry.withDefaults();
		this.broadcaster = new DefaultBroadcaster(this.connectionRegistry, lifecycleObserver);
		this.pluginRegistry = PluginRegistry.withLifecycleObserver(lifecycleObserver);
		this.pluginRegistry.registerPlugin(new PostPlugin());
	}

	@Test
	public void subscriptionFollowsThePostRoom() {
		RecordingConnection connection = new RecordingConnection("c1");
		ConnectionEventDispatcher dispatcher = connect(connection, null);

		dispatcher.dispatch(InboundEvent.with("subscribeToPost", 5));
		dispatcher.dispatch(InboundEvent.with("subscribeToPost", Map.of("postId", "6")));

		Assertions.assertEquals(1, this.connectionRegistry.roomInfo("post:5").orElseThrow().getConnectionCount());
		Assertions.assertEquals(1, this.connectionRegistry.roomInfo("post:6").orElseThrow().getConnectionCount());

		dispatcher.dispatch(InboundEvent.with("unsubscribeFromPost", Map.of("postId", 5)));

		Assertions.assertEquals(0, this.connectionRegistry.roomInfo("post:5").orElseThrow().getConnectionCount());
		Assertions.assertEquals(1, this.connectionRegistry.roomInfo("post:6").orElseThrow().getConnectionCount());
	}

	@Test
	public void malformedPostIdentifiersAreIgnored() {
		ConnectionEventDispatcher dispatcher = connect(new RecordingConnection("c1"), null);

		dispatcher.dispatch(InboundEvent.with("subscribeToPost", "not-a-number"));
		dispatcher.dispatch(InboundEvent.with("subscribeToPost", null));

		Assertions.assertEquals(0, this.connectionRegistry.rooms().size());
	}

	@Test
	public void typingIsRelayedToOtherFollowers() {
		RecordingConnection alice = new RecordingConnection("alice");
		RecordingConnection bob = new RecordingConnection("bob");
		RecordingConnection bystander = new RecordingConnection("bystander");

		ConnectionEventDispatcher aliceDispatcher = connect(alice, Principal.withUserId(1L).name("Alice").build());
		ConnectionEventDispatcher bobDispatcher = connect(bob, Principal.withUserId(2L).name("Bob").build());
		connect(bystander, null);

		aliceDispatcher.dispatch(InboundEvent.with("subscribeToPost", 5));
		bobDispatcher.dispatch(InboundEvent.with("subscribeToPost", 5));

		aliceDispatcher.dispatch(InboundEvent.with("typing", Map.of("postId", 5, "isTyping", true)));

		Assertions.assertEquals(List.of(), alice.emittedEventNames(), "The typist does not hear themselves");
		Assertions.assertEquals(List.of(), bystander.emittedEventNames());
		Assertions.assertEquals(Map.of("postId", 5L, "isTyping", true, "userId", 1L, "userName", "Alice"),
				bob.emittedEventsNamed("typing").get(0).payload());
	}

	@Test
	public void typingDefaultsToNotTyping() {
		RecordingConnection bob = new RecordingConnection("bob");
		ConnectionEventDispatcher aliceDispatcher = connect(new RecordingConnection("alice"), Principal.withUserId(1L).name("Alice").build());
		connect(bob, null);
		this.connectionRegistry.join("bob", PostPlugin.roomIdForPost(5L));

		aliceDispatcher.dispatch(InboundEvent.with("typing", Map.of("postId", 5)));

		Assertions.assertEquals(false, bob.emittedEventsNamed("typing").get(0).payloadAsMap().get("isTyping"));
	}

	@Test
	public void anonymousAndUnnamedTypingIsIgnored() {
		RecordingConnection listener = new RecordingConnection("listener");
		connect(listener, null);
		this.connectionRegistry.join("listener", PostPlugin.roomIdForPost(5L));

		connect(new RecordingConnection("anonymous"), null)
				.dispatch(InboundEvent.with("typing", Map.of("postId", 5, "isTyping", true)));
		connect(new RecordingConnection("unnamed"), Principal.withUserId(3L).build())
				.dispatch(InboundEvent.with("typing", Map.of("postId", 5, "isTyping", true)));

		Assertions.assertEquals(List.of(), listener.emittedEventNames());
	}

	@Test
	public void creationIsAnnouncedInTheDefaultRoomOnly() {
		RecordingConnection lobby = new RecordingConnection("lobby");
		RecordingConnection follower = new RecordingConnection("follower");

		connect(lobby, null);
		connect(follower, null);
		this.connectionRegistry.join("lobby", RealtimeHub.DEFAULT_ROOM_ID);
		this.connectionRegistry.join("follower", PostPlugin.roomIdForPost(5L));

		Map<String, Object> post = Map.of("postId", 5, "title", "Hello", "authorName", "Alice");
		this.pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType(PostPlugin.POST_CREATED_BUSINESS_EVENT).payload(post).build(), this.broadcaster);

		Assertions.assertEquals(Map.of("post", post, "author", "Alice"), lobby.emittedEventsNamed("postCreated").get(0).payload());
		Assertions.assertEquals(List.of(), follower.emittedEventNames());
	}

	@Test
	public void updatesAndDeletionsReachFollowers() {
		RecordingConnection lobby = new RecordingConnection("lobby");
		RecordingConnection follower = new RecordingConnection("follower");

		connect(lobby, null);
		connect(follower, null);
		this.connectionRegistry.join("lobby", RealtimeHub.DEFAULT_ROOM_ID);
		this.connectionRegistry.join("follower", PostPlugin.roomIdForPost(5L));

		this.pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType(PostPlugin.POST_UPDATED_BUSINESS_EVENT)
				.payload(Map.of("postId", "5", "authorName", "Alice"))
				.build(), this.broadcaster);
		this.pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType(PostPlugin.POST_DELETED_BUSINESS_EVENT)
				.payload(Map.of("postId", 5, "authorName", "Alice"))
				.build(), this.broadcaster);

		Assertions.assertEquals(List.of("postUpdated", "postDeleted"), lobby.emittedEventNames());
		Assertions.assertEquals(List.of("postUpdated", "postDeleted"), follower.emittedEventNames());
		Assertions.assertEquals(Map.of("postId", 5, "author", "Alice"), follower.emittedEventsNamed("postDeleted").get(0).payload());
	}

	@Test
	public void unrelatedBusinessEventsAreIgnored() {
		RecordingConnection lobby = new RecordingConnection("lobby");
		connect(lobby, null);
		this.connectionRegistry.join("lobby", RealtimeHub.DEFAULT_ROOM_ID);

		this.pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType("comment.created").payload(Map.of("postId", 5)).build(), this.broadcaster);

		Assertions.assertEquals(List.of(), lobby.emittedEventNames());
	}

	@Test
	public void announcementRoomIsConfigurable() {
		PluginRegistry pluginRegistry = PluginRegistry.withDefaults();
		pluginRegistry.registerPlugin(new PostPlugin("newsroom"));

		RecordingConnection reporter = new RecordingConnection("reporter");
		this.connectionRegistry.register(reporter, null);
		this.connectionRegistry.join("reporter", "newsroom");

		pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType(PostPlugin.POST_CREATED_BUSINESS_EVENT)
				.payload(Map.of("postId", 8))
				.build(), this.broadcaster);

		Assertions.assertEquals(List.of("postCreated"), reporter.emittedEventNames());
		Assertions.assertEquals("post:8", PostPlugin.roomIdForPost(8L));
	}

	private ConnectionEventDispatcher connect(RecordingConnection connection, Principal principal) {
		this.connectionRegistry.register(connection, principal);
		return this.pluginRegistry.attachToConnection(connection, principal, this.broadcaster);
	}
}
