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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-connection table of inbound event handlers contributed by plugins.
 * <p>
 * Several plugins may handle the same event name; they run in registration order, and a failure in one does not
 * prevent the others from running.
 */
@ThreadSafe
public final class ConnectionEventDispatcher {
	@NonNull
	private final Connection connection;
	@Nullable
	private final Principal principal;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull RegisteredHandler>> registeredHandlersByEventName;

	ConnectionEventDispatcher(@NonNull Connection connection,
														@Nullable Principal principal,
														@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(connection);
		requireNonNull(lifecycleObserver);

		this.connection = connection;
		this.principal = principal;
		this.lifecycleObserver = lifecycleObserver;
		this.registeredHandlersByEventName = new ConcurrentHashMap<>();
	}

	/**
	 * Vends the view of this connection handed to one plugin during setup.
	 *
	 * @param plugin the plugin being set up
	 * @return a connection view that only accepts the plugin's declared inbound event names
	 */
	@NonNull
	PluginConnection viewForPlugin(@NonNull Plugin plugin) {
		requireNonNull(plugin);
		return new PluginScopedConnection(plugin);
	}

	/**
	 * Runs every handler registered for the event's name.
	 *
	 * @param inboundEvent the event to dispatch
	 * @return {@code false} if no handler is registered for the event's name
	 */
	@NonNull
	public Boolean dispatch(@NonNull InboundEvent inboundEvent) {
		requireNonNull(inboundEvent);

		List<RegisteredHandler> registeredHandlers = getRegisteredHandlersByEventName().get(inboundEvent.getName());

		if (registeredHandlers == null || registeredHandlers.isEmpty())
			return false;

		for (RegisteredHandler registeredHandler : registeredHandlers) {
			try {
				registeredHandler.inboundEventHandler().handleInboundEvent(inboundEvent);
			} catch (Throwable throwable) {
				safelyLog(LogEvent.with(LogEventType.PLUGIN_EVENT_HANDLER_FAILED,
								format("Plugin '%s' failed to handle '%s' event", registeredHandler.pluginName(), inboundEvent.getName()))
						.connectionId(getConnection().getId())
						.pluginName(registeredHandler.pluginName())
						.throwable(throwable)
						.build());
			}
		}

		return true;
	}

	@NonNull
	public Set<@NonNull String> getHandledEventNames() {
		return new TreeSet<>(getRegisteredHandlersByEventName().keySet());
	}

	@NonNull
	public String getConnectionId() {
		return getConnection().getId();
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
	private Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private Optional<Principal> getPrincipal() {
		return Optional.ofNullable(this.principal);
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private Map<@NonNull String, @NonNull List<@NonNull RegisteredHandler>> getRegisteredHandlersByEventName() {
		return this.registeredHandlersByEventName;
	}

	private record RegisteredHandler(@NonNull String pluginName,
																	 @NonNull InboundEventHandler inboundEventHandler) {
		private RegisteredHandler {
			requireNonNull(pluginName);
			requireNonNull(inboundEventHandler);
		}
	}

	@ThreadSafe
	private final class PluginScopedConnection implements PluginConnection {
		@NonNull
		private final Plugin plugin;

		private PluginScopedConnection(@NonNull Plugin plugin) {
			requireNonNull(plugin);
			this.plugin = plugin;
		}

		@NonNull
		@Override
		public String getId() {
			return getConnection().getId();
		}

		@NonNull
		@Override
		public Optional<Principal> getPrincipal() {
			return ConnectionEventDispatcher.this.getPrincipal();
		}

		@Override
		public void on(@NonNull String inboundEventName,
									 @NonNull InboundEventHandler inboundEventHandler) {
			requireNonNull(inboundEventName);
			requireNonNull(inboundEventHandler);

			if (!this.plugin.getInboundEventNames().contains(inboundEventName))
				throw new IllegalArgumentException(format("Plugin '%s' did not declare inbound event '%s'. Declared inbound events are %s",
						this.plugin.getName(), inboundEventName, new TreeSet<>(this.plugin.getInboundEventNames())));

			getRegisteredHandlersByEventName()
					.computeIfAbsent(inboundEventName, (ignored) -> new CopyOnWriteArrayList<>())
					.add(new RegisteredHandler(this.plugin.getName(), inboundEventHandler));
		}

		@Override
		public void emit(@NonNull String event,
										 @Nullable Object payload) {
			requireNonNull(event);
			getConnection().emit(event, payload);
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{id=%s, plugin=%s}", getClass().getSimpleName(), getId(), this.plugin.getName());
		}
	}
}
