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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

@ThreadSafe
public class PluginRegistryTests {
	private RecordingLifecycleObserver lifecycleObserver;
	private PluginRegistry pluginRegistry;
	private Broadcaster broadcaster;

	@BeforeEach
	public void setUp() {
		this.lifecycleObserver = new RecordingLifecycleObserver();
		this.pluginRegistry = PluginRegistry.withLifecycleObserver(this.lifecycleObserver);
		this.broadcaster = new DefaultBroadcaster(ConnectionRegistry.withDefaults(), this.lifecycleObserver);
	}

	@Test
	public void duplicateNamesAreIgnored() {
		Assertions.assertTrue(this.pluginRegistry.registerPlugin(new TestPlugin("chat", Set.of("say"), Set.of("said"))));
		Assertions.assertFalse(this.pluginRegistry.registerPlugin(new TestPlugin("chat", Set.of("shout"), Set.of())));

		Assertions.assertEquals(1, this.pluginRegistry.getPlugins().size());
		Assertions.assertEquals(Set.of("say"), this.pluginRegistry.getPlugin("chat").orElseThrow().getInboundEventNames());
		Assertions.assertEquals(1, this.lifecycleObserver.logEventsOfType(LogEventType.PLUGIN_DUPLICATE_REGISTRATION).size());
	}

	@Test
	public void businessEventFailureDoesNotStopOtherPlugins() {
		List<String> handled = new CopyOnWriteArrayList<>();

		TestPlugin failing = new TestPlugin("failing", Set.of(), Set.of());
		failing.businessEventHandler = (businessEvent, broadcaster) -> {
			throw new IllegalStateException("Database is down");
		};

		TestPlugin working = new TestPlugin("working", Set.of(), Set.of());
		working.businessEventHandler = (businessEvent, broadcaster) -> handled.add(businessEvent.getType());

		this.pluginRegistry.registerPlugin(failing);
		this.pluginRegistry.registerPlugin(working);

		this.pluginRegistry.dispatchBusinessEvent(BusinessEvent.withType("post.created").payload(Map.of("postId", 1)).build(), this.broadcaster);

		Assertions.assertEquals(List.of("post.created"), handled);

		List<LogEvent> failures = this.lifecycleObserver.logEventsOfType(LogEventType.PLUGIN_BUSINESS_EVENT_FAILED);
		Assertions.assertEquals(1, failures.size());
		Assertions.assertEquals("failing", failures.get(0).getPluginName().orElse(null));
	}

	@Test
	public void inboundEventsReachEveryPluginThatDeclaredThem() {
		List<String> received = new CopyOnWriteArrayList<>();

		TestPlugin first = new TestPlugin("first", Set.of("shared"), Set.of());
		first.setup = (pluginConnection, broadcaster) -> pluginConnection.on("shared", (inboundEvent) -> received.add("first"));

		TestPlugin second = new TestPlugin("second", Set.of("shared"), Set.of());
		second.setup = (pluginConnection, broadcaster) -> pluginConnection.on("shared", (inboundEvent) -> {
			throw new IllegalArgumentException("Bad payload");
		});

		TestPlugin third = new TestPlugin("third", Set.of("shared"), Set.of());
		third.setup = (pluginConnection, broadcaster) -> pluginConnection.on("shared", (inboundEvent) -> received.add("third"));

		this.pluginRegistry.registerPlugin(first);
		this.pluginRegistry.registerPlugin(second);
		this.pluginRegistry.registerPlugin(third);

		ConnectionEventDispatcher dispatcher = this.pluginRegistry.attachToConnection(new RecordingConnection("c1"), null, this.broadcaster);

		Assertions.assertTrue(dispatcher.dispatch(InboundEvent.with("shared", null)));
		Assertions.assertFalse(dispatcher.dispatch(InboundEvent.with("unknown", null)));
		Assertions.assertEquals(List.of("first", "third"), received);
		Assertions.assertEquals(1, this.lifecycleObserver.logEventsOfType(LogEventType.PLUGIN_EVENT_HANDLER_FAILED).size());
	}

	@Test
	public void handlersForUndeclaredEventsAreRejected() {
		TestPlugin sneaky = new TestPlugin("sneaky", Set.of("declared"), Set.of());
		sneaky.setup = (pluginConnection, broadcaster) -> {
			pluginConnection.on("declared", (inboundEvent) -> {});
			pluginConnection.on("undeclared", (inboundEvent) -> {});
		};

		this.pluginRegistry.registerPlugin(sneaky);

		ConnectionEventDispatcher dispatcher = this.pluginRegistry.attachToConnection(new RecordingConnection("c1"), null, this.broadcaster);

		Assertions.assertEquals(Set.of("declared"), dispatcher.getHandledEventNames());
		Assertions.assertEquals(1, this.lifecycleObserver.logEventsOfType(LogEventType.PLUGIN_SETUP_FAILED).size());
	}

	@Test
	public void pluginConnectionExposesPrincipalAndEmitsToConnection() {
		RecordingConnection connection = new RecordingConnection("c1");
		Principal principal = Principal.withUserId(3L).role(Principal.ADMIN_ROLE).build();

		TestPlugin echo = new TestPlugin("echo", Set.of("echo"), Set.of("echoed"));
		echo.setup = (pluginConnection, broadcaster) -> pluginConnection.on("echo", (inboundEvent) ->
				pluginConnection.emit("echoed", Map.of("userId", pluginConnection.getPrincipal().orElseThrow().getUserId())));

		this.pluginRegistry.registerPlugin(echo);
		this.pluginRegistry.attachToConnection(connection, principal, this.broadcaster).dispatch(InboundEvent.with("echo", null));

		Assertions.assertEquals(Map.of("userId", 3L), connection.emittedEventsNamed("echoed").get(0).payload());
	}

	@Test
	public void vocabularyMergesDeclaredNames() {
		this.pluginRegistry.registerPlugin(new TestPlugin("a", Set.of("ping"), Set.of("notification")));
		this.pluginRegistry.registerPlugin(new TestPlugin("b", Set.of("typing", "ping"), Set.of("typing")));

		EventVocabulary eventVocabulary = this.pluginRegistry.getEventVocabulary();

		Assertions.assertEquals(Set.of("ping", "typing"), eventVocabulary.getInboundEventNames());
		Assertions.assertEquals(Set.of("notification", "typing"), eventVocabulary.getOutboundEventNames());
	}

	@Test
	public void cleanupRunsForEveryPluginDespiteFailures() {
		List<String> cleanedUp = new CopyOnWriteArrayList<>();

		TestPlugin failing = new TestPlugin("failing", Set.of(), Set.of());
		failing.cleanupAction = () -> {
			throw new IllegalStateException("Already closed");
		};

		TestPlugin working = new TestPlugin("working", Set.of(), Set.of());
		working.cleanupAction = () -> cleanedUp.add("working");

		this.pluginRegistry.registerPlugin(failing);
		this.pluginRegistry.registerPlugin(working);
		this.pluginRegistry.cleanup();

		Assertions.assertEquals(List.of("working"), cleanedUp);
		Assertions.assertEquals(1, this.lifecycleObserver.logEventsOfType(LogEventType.PLUGIN_CLEANUP_FAILED).size());
		Assertions.assertEquals(List.of(), this.pluginRegistry.getPlugins());
	}

	private static final class TestPlugin implements Plugin {
		private final String name;
		private final Set<String> inboundEventNames;
		private final Set<String> outboundEventNames;
		private BiConsumer<PluginConnection, Broadcaster> setup = (pluginConnection, broadcaster) -> {};
		private BusinessEventHandler businessEventHandler;
		private Runnable cleanupAction = () -> {};

		private TestPlugin(String name, Set<String> inboundEventNames, Set<String> outboundEventNames) {
			this.name = name;
			this.inboundEventNames = inboundEventNames;
			this.outboundEventNames = outboundEventNames;
		}

		@Override
		public String getName() {
			return this.name;
		}

		@Override
		public String getVersion() {
			return "0.0.1";
		}

		@Override
		public Set<String> getInboundEventNames() {
			return this.inboundEventNames;
		}

		@Override
		public Set<String> getOutboundEventNames() {
			return this.outboundEventNames;
		}

		@Override
		public void setupEventHandlers(PluginConnection pluginConnection, Broadcaster broadcaster) {
			this.setup.accept(pluginConnection, broadcaster);
		}

		@Override
		public Optional<BusinessEventHandler> getBusinessEventHandler() {
			return Optional.ofNullable(this.businessEventHandler);
		}

		@Override
		public void cleanup() {
			this.cleanupAction.run();
		}
	}
}
