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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Holds the registered {@link Plugin}s and fans connections and business events out to them.
 * <p>
 * Every plugin callback is isolated: an exception from one plugin is logged via {@link LifecycleObserver} and never
 * reaches the caller or the other plugins.
 */
@ThreadSafe
public final class PluginRegistry {
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<@NonNull String, @NonNull Plugin> pluginsByName;

	@NonNull
	public static PluginRegistry withDefaults() {
		return withLifecycleObserver(LifecycleObserver.defaultInstance());
	}

	@NonNull
	public static PluginRegistry withLifecycleObserver(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);
		return new PluginRegistry(lifecycleObserver);
	}

	private PluginRegistry(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);

		this.lifecycleObserver = lifecycleObserver;
		this.lock = new ReentrantLock();
		this.pluginsByName = new LinkedHashMap<>();
	}

	/**
	 * Registers a plugin.
	 *
	 * @param plugin the plugin to register
	 * @return {@code false} if a plugin with the same name is already registered
	 */
	@NonNull
	public Boolean registerPlugin(@NonNull Plugin plugin) {
		requireNonNull(plugin);

		String pluginName = requireNonNull(plugin.getName());
		boolean registered;

		getLock().lock();

		try {
			registered = getPluginsByName().putIfAbsent(pluginName, plugin) == null;
		} finally {
			getLock().unlock();
		}

		if (!registered)
			safelyLog(LogEvent.with(LogEventType.PLUGIN_DUPLICATE_REGISTRATION,
							format("A plugin named '%s' is already registered; ignoring %s", pluginName, plugin.getClass().getName()))
					.pluginName(pluginName)
					.build());

		return registered;
	}

	/**
	 * Lets every plugin wire its inbound event handlers onto a new connection.
	 * <p>
	 * A plugin that throws during setup is logged and skipped; handlers it registered before throwing stay registered.
	 *
	 * @param connection  the new connection
	 * @param principal   the connection's principal, or {@code null} if anonymous
	 * @param broadcaster fan-out facade handed to each plugin
	 * @return the connection's handler table
	 */
	@NonNull
	public ConnectionEventDispatcher attachToConnection(@NonNull Connection connection,
																											@Nullable Principal principal,
																											@NonNull Broadcaster broadcaster) {
		requireNonNull(connection);
		requireNonNull(broadcaster);

		ConnectionEventDispatcher connectionEventDispatcher = new ConnectionEventDispatcher(connection, principal, getLifecycleObserver());

		for (Plugin plugin : getPlugins()) {
			try {
				plugin.setupEventHandlers(connectionEventDispatcher.viewForPlugin(plugin), broadcaster);
			} catch (Throwable throwable) {
				safelyLog(LogEvent.with(LogEventType.PLUGIN_SETUP_FAILED,
								format("Plugin '%s' failed to set up event handlers for connection %s", plugin.getName(), connection.getId()))
						.connectionId(connection.getId())
						.pluginName(plugin.getName())
						.throwable(throwable)
						.build());
			}
		}

		return connectionEventDispatcher;
	}

	/**
	 * Hands a business event to every plugin with a {@link BusinessEventHandler}, one after another.
	 *
	 * @param businessEvent the event
	 * @param broadcaster   fan-out facade handed to each handler
	 */
	public void dispatchBusinessEvent(@NonNull BusinessEvent businessEvent,
																		@NonNull Broadcaster broadcaster) {
		requireNonNull(businessEvent);
		requireNonNull(broadcaster);

		for (Plugin plugin : getPlugins()) {
			BusinessEventHandler businessEventHandler;

			try {
				businessEventHandler = plugin.getBusinessEventHandler().orElse(null);
			} catch (Throwable throwable) {
				logBusinessEventFailure(plugin, businessEvent, throwable);
				continue;
			}

			if (businessEventHandler == null)
				continue;

			try {
				businessEventHandler.handleBusinessEvent(businessEvent, broadcaster);
			} catch (Throwable throwable) {
				logBusinessEventFailure(plugin, businessEvent, throwable);
			}
		}
	}

	/**
	 * Runs every plugin's {@link Plugin#cleanup()} and then forgets all plugins.
	 */
	public void cleanup() {
		List<Plugin> plugins;

		getLock().lock();

		try {
			plugins = new ArrayList<>(getPluginsByName().values());
			getPluginsByName().clear();
		} finally {
			getLock().unlock();
		}

		for (Plugin plugin : plugins) {
			try {
				plugin.cleanup();
			} catch (Throwable throwable) {
				safelyLog(LogEvent.with(LogEventType.PLUGIN_CLEANUP_FAILED, format("Plugin '%s' failed to clean up", plugin.getName()))
						.pluginName(plugin.getName())
						.throwable(throwable)
						.build());
			}
		}
	}

	/**
	 * Registered plugins, in registration order.
	 *
	 * @return the plugins
	 */
	@NonNull
	public List<@NonNull Plugin> getPlugins() {
		getLock().lock();

		try {
			return new ArrayList<>(getPluginsByName().values());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<Plugin> getPlugin(@NonNull String name) {
		requireNonNull(name);

		getLock().lock();

		try {
			return Optional.ofNullable(getPluginsByName().get(name));
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public EventVocabulary getEventVocabulary() {
		TreeSet<String> inboundEventNames = new TreeSet<>();
		TreeSet<String> outboundEventNames = new TreeSet<>();

		for (Plugin plugin : getPlugins()) {
			inboundEventNames.addAll(plugin.getInboundEventNames());
			outboundEventNames.addAll(plugin.getOutboundEventNames());
		}

		return new EventVocabulary(inboundEventNames, outboundEventNames);
	}

	protected void logBusinessEventFailure(@NonNull Plugin plugin,
																				 @NonNull BusinessEvent businessEvent,
																				 @NonNull Throwable throwable) {
		requireNonNull(plugin);
		requireNonNull(businessEvent);
		requireNonNull(throwable);

		safelyLog(LogEvent.with(LogEventType.PLUGIN_BUSINESS_EVENT_FAILED,
						format("Plugin '%s' failed to handle business event '%s'", plugin.getName(), businessEvent.getType()))
				.pluginName(plugin.getName())
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
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Map<@NonNull String, @NonNull Plugin> getPluginsByName() {
		return this.pluginsByName;
	}
}
