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

import com.rallypoint.plugin.CorePlugin;
import com.rallypoint.plugin.TerminalPlugin;
import com.rallypoint.terminal.TerminalManager;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Glues the transport to the connection registry, broadcaster, plugin registry and terminal manager.
 * <p>
 * For each new connection the hub resolves the principal, registers the connection, acknowledges it with a
 * {@code connected} event, joins it to the default room, attaches every plugin and finally broadcasts the new
 * connection count.  Inbound events are routed to the handlers plugins registered for that connection.
 * <p>
 * {@link CorePlugin} and {@link TerminalPlugin} are always registered first; application plugins follow in the order
 * they were supplied.
 */
@ThreadSafe
public final class RealtimeHub implements RealtimeServer.ConnectionHandler {
	@NonNull
	public static final String DEFAULT_ROOM_ID;
	@NonNull
	public static final String CONNECTED_EVENT;
	@NonNull
	public static final String CONNECTION_COUNT_EVENT;
	@NonNull
	public static final String USER_JOINED_EVENT;
	@NonNull
	public static final String USER_LEFT_EVENT;

	static {
		DEFAULT_ROOM_ID = "general";
		CONNECTED_EVENT = "connected";
		CONNECTION_COUNT_EVENT = "connectionCount";
		USER_JOINED_EVENT = "userJoined";
		USER_LEFT_EVENT = "userLeft";
	}

	@NonNull
	private final PrincipalResolver principalResolver;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final TerminalManager terminalManager;
	@NonNull
	private final Clock clock;
	@NonNull
	private final String defaultRoomId;
	@NonNull
	private final ConnectionRegistry connectionRegistry;
	@NonNull
	private final Broadcaster broadcaster;
	@NonNull
	private final PluginRegistry pluginRegistry;
	@NonNull
	private final Map<@NonNull String, @NonNull ConnectionEventDispatcher> connectionEventDispatchersByConnectionId;

	/**
	 * Acquires a builder for {@link RealtimeHub} instances.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected RealtimeHub(@NonNull Builder builder) {
		requireNonNull(builder);

		this.principalResolver = builder.principalResolver != null ? builder.principalResolver : PrincipalResolver.anonymousOnly();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.terminalManager = builder.terminalManager != null ? builder.terminalManager : TerminalManager.withDefaults()
				.lifecycleObserver(this.lifecycleObserver)
				.build();

		String defaultRoomId = trimAggressivelyToNull(builder.defaultRoomId);
		this.defaultRoomId = defaultRoomId != null ? defaultRoomId : DEFAULT_ROOM_ID;

		this.connectionEventDispatchersByConnectionId = new ConcurrentHashMap<>();
		this.connectionRegistry = ConnectionRegistry.withClock(this.clock)
				.presenceListener(new PresenceBroadcaster())
				.lifecycleObserver(this.lifecycleObserver)
				.build();
		this.broadcaster = new DefaultBroadcaster(this.connectionRegistry, this.lifecycleObserver);
		this.pluginRegistry = PluginRegistry.withLifecycleObserver(this.lifecycleObserver);

		this.pluginRegistry.registerPlugin(new CorePlugin());
		this.pluginRegistry.registerPlugin(new TerminalPlugin(this.terminalManager));

		if (builder.plugins != null)
			for (Plugin plugin : builder.plugins)
				this.pluginRegistry.registerPlugin(plugin);
	}

	@Override
	public void didConnect(@NonNull Connection connection,
												 @Nullable String credential) {
		requireNonNull(connection);

		Principal principal = null;

		try {
			principal = getPrincipalResolver().resolvePrincipal(credential).orElse(null);
		} catch (PrincipalResolutionException | RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.PRINCIPAL_RESOLUTION_FAILED,
							format("Unable to resolve principal for connection %s; continuing anonymously", connection.getId()))
					.connectionId(connection.getId())
					.throwable(e)
					.build());
		}

		if (!getConnectionRegistry().register(connection, principal)) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_REJECTED,
							format("A connection with ID %s is already registered", connection.getId()))
					.connectionId(connection.getId())
					.build());
			connection.close();
			return;
		}

		Map<String, Object> connectedPayload = new LinkedHashMap<>(2);
		connectedPayload.put("connectionId", connection.getId());
		connectedPayload.put("authenticated", principal != null);
		connection.emit(CONNECTED_EVENT, connectedPayload);

		getConnectionRegistry().join(connection.getId(), getDefaultRoomId());

		ConnectionEventDispatcher connectionEventDispatcher = getPluginRegistry().attachToConnection(connection, principal, getBroadcaster());
		getConnectionEventDispatchersByConnectionId().put(connection.getId(), connectionEventDispatcher);

		ConnectionInfo connectionInfo = getConnectionRegistry().connectionInfo(connection.getId()).orElse(null);

		if (connectionInfo != null) {
			try {
				getLifecycleObserver().didEstablishConnection(connectionInfo);
			} catch (Throwable throwable) {
				logLifecycleObserverFailure("didEstablishConnection", throwable);
			}
		}

		broadcastConnectionCount();
	}

	@Override
	public void didReceiveEvent(@NonNull Connection connection,
															@NonNull InboundEvent inboundEvent) {
		requireNonNull(connection);
		requireNonNull(inboundEvent);

		ConnectionEventDispatcher connectionEventDispatcher = getConnectionEventDispatchersByConnectionId().get(connection.getId());

		// Rejected at registration, or already disconnected
		if (connectionEventDispatcher == null)
			return;

		getConnectionRegistry().touch(connection.getId());

		if (!connectionEventDispatcher.dispatch(inboundEvent))
			safelyLog(LogEvent.with(LogEventType.INBOUND_EVENT_UNHANDLED,
							format("No handler is registered for event '%s'", inboundEvent.getName()))
					.connectionId(connection.getId())
					.build());
	}

	@Override
	public void didDisconnect(@NonNull Connection connection) {
		requireNonNull(connection);

		if (getConnectionEventDispatchersByConnectionId().remove(connection.getId()) == null)
			return;

		ConnectionInfo connectionInfo = getConnectionRegistry().unregister(connection.getId()).orElse(null);

		if (connectionInfo == null)
			return;

		try {
			getLifecycleObserver().didTerminateConnection(connectionInfo);
		} catch (Throwable throwable) {
			logLifecycleObserverFailure("didTerminateConnection", throwable);
		}

		broadcastConnectionCount();
	}

	/**
	 * Injects an application-originated event, for example "a post was created", into the plugin system.
	 *
	 * @param businessEvent the event
	 */
	public void dispatchBusinessEvent(@NonNull BusinessEvent businessEvent) {
		requireNonNull(businessEvent);
		getPluginRegistry().dispatchBusinessEvent(businessEvent, getBroadcaster());
	}

	/**
	 * Registers an application plugin.  Connections established before registration do not see its handlers.
	 *
	 * @param plugin the plugin
	 * @return {@code false} if a plugin with the same name is already registered
	 */
	@NonNull
	public Boolean registerPlugin(@NonNull Plugin plugin) {
		requireNonNull(plugin);
		return getPluginRegistry().registerPlugin(plugin);
	}

	@NonNull
	public Integer sendNotificationToUser(@NonNull Long userId,
																				@NonNull String message,
																				@NonNull NotificationType notificationType) {
		return getBroadcaster().sendNotificationToUser(userId, message, notificationType);
	}

	@NonNull
	public Integer sendNotificationToRoom(@NonNull String roomId,
																				@NonNull String message,
																				@NonNull NotificationType notificationType) {
		return getBroadcaster().sendNotificationToRoom(roomId, message, notificationType);
	}

	@NonNull
	public Integer sendNotificationToAll(@NonNull String message,
																			 @NonNull NotificationType notificationType) {
		return getBroadcaster().sendNotificationToAll(message, notificationType);
	}

	@NonNull
	public List<@NonNull ConnectionInfo> snapshot() {
		return getConnectionRegistry().snapshot();
	}

	@NonNull
	public List<@NonNull Room> rooms() {
		return getConnectionRegistry().rooms();
	}

	@NonNull
	public Optional<Room> roomInfo(@NonNull String roomId) {
		requireNonNull(roomId);
		return getConnectionRegistry().roomInfo(roomId);
	}

	@NonNull
	public RealtimeStatistics statistics() {
		return new RealtimeStatistics(
				getConnectionRegistry().countConnections(),
				getConnectionRegistry().countUsers(),
				getConnectionRegistry().rooms().size(),
				getTerminalManager().countSessions(),
				getPluginRegistry().getPlugins().size(),
				getTerminalManager().isPtyAvailable(),
				getClock().instant());
	}

	/**
	 * Runs every plugin's cleanup and destroys every terminal session.
	 */
	public void shutdown() {
		getPluginRegistry().cleanup();
		getTerminalManager().close();
	}

	@NonNull
	public ConnectionRegistry getConnectionRegistry() {
		return this.connectionRegistry;
	}

	@NonNull
	public Broadcaster getBroadcaster() {
		return this.broadcaster;
	}

	@NonNull
	public PluginRegistry getPluginRegistry() {
		return this.pluginRegistry;
	}

	@NonNull
	public TerminalManager getTerminalManager() {
		return this.terminalManager;
	}

	@NonNull
	public String getDefaultRoomId() {
		return this.defaultRoomId;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	protected void broadcastConnectionCount() {
		Map<String, Object> payload = new LinkedHashMap<>(1);
		payload.put("count", getConnectionRegistry().countConnections());
		getBroadcaster().broadcastToAll(CONNECTION_COUNT_EVENT, payload);
	}

	protected void logLifecycleObserverFailure(@NonNull String methodName,
																						 @NonNull Throwable throwable) {
		requireNonNull(methodName);
		requireNonNull(throwable);

		safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
						format("An exception occurred while invoking %s::%s", LifecycleObserver.class.getSimpleName(), methodName))
				.throwable(throwable)
				.build());
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
	private PrincipalResolver getPrincipalResolver() {
		return this.principalResolver;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Map<@NonNull String, @NonNull ConnectionEventDispatcher> getConnectionEventDispatchersByConnectionId() {
		return this.connectionEventDispatchersByConnectionId;
	}

	// Announces named users in the default room as they come and go
	@ThreadSafe
	private final class PresenceBroadcaster implements PresenceListener {
		@Override
		public void userDidConnect(@NonNull Principal principal) {
			requireNonNull(principal);

			if (principal.getName().isPresent())
				getBroadcaster().broadcastToRoom(getDefaultRoomId(), USER_JOINED_EVENT, presencePayload(principal));
		}

		@Override
		public void userDidDisconnect(@NonNull Principal principal) {
			requireNonNull(principal);

			if (principal.getName().isPresent())
				getBroadcaster().broadcastToRoom(getDefaultRoomId(), USER_LEFT_EVENT, presencePayload(principal));
		}

		@NonNull
		private Map<String, Object> presencePayload(@NonNull Principal principal) {
			Map<String, Object> payload = new LinkedHashMap<>(2);
			payload.put("userId", principal.getUserId());
			payload.put("name", principal.getName().orElse(null));
			return payload;
		}
	}

	/**
	 * Builder used to construct instances of {@link RealtimeHub}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private PrincipalResolver principalResolver;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private TerminalManager terminalManager;
		@Nullable
		private Clock clock;
		@Nullable
		private String defaultRoomId;
		@Nullable
		private List<@NonNull Plugin> plugins;

		protected Builder() {
			// Only vended by RealtimeHub
		}

		@NonNull
		public Builder principalResolver(@Nullable PrincipalResolver principalResolver) {
			this.principalResolver = principalResolver;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder terminalManager(@Nullable TerminalManager terminalManager) {
			this.terminalManager = terminalManager;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public Builder defaultRoomId(@Nullable String defaultRoomId) {
			this.defaultRoomId = defaultRoomId;
			return this;
		}

		@NonNull
		public Builder plugins(@Nullable List<@NonNull Plugin> plugins) {
			this.plugins = plugins == null ? null : new ArrayList<>(plugins);
			return this;
		}

		@NonNull
		public RealtimeHub build() {
			return new RealtimeHub(this);
		}
	}
}
