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

import java.util.Optional;
import java.util.Set;

/**
 * A named bundle of client event handlers and, optionally, a business event handler.
 * <p>
 * A plugin declares up front the inbound events it handles and the outbound events it emits.
 * {@link PluginConnection#on(String, InboundEventHandler)} refuses inbound names the plugin did not declare.
 * <p>
 * Plugins are registered once with a {@link PluginRegistry} and are shared across all connections, so implementations
 * must be threadsafe.
 */
public interface Plugin {
	/**
	 * Unique name of this plugin; a second plugin with the same name is rejected at registration.
	 *
	 * @return the plugin name
	 */
	@NonNull
	String getName();

	@NonNull
	String getVersion();

	@NonNull
	Set<@NonNull String> getInboundEventNames();

	@NonNull
	Set<@NonNull String> getOutboundEventNames();

	/**
	 * Called once per new connection to wire up this plugin's inbound event handlers.
	 *
	 * @param pluginConnection the new connection, as seen by this plugin
	 * @param broadcaster      fan-out facade
	 */
	void setupEventHandlers(@NonNull PluginConnection pluginConnection,
													@NonNull Broadcaster broadcaster);

	/**
	 * Handler for application-originated events, if this plugin reacts to any.
	 *
	 * @return the business event handler, or {@link Optional#empty()} if none
	 */
	@NonNull
	default Optional<BusinessEventHandler> getBusinessEventHandler() {
		return Optional.empty();
	}

	/**
	 * Called when the application shuts down.
	 */
	default void cleanup() throws Exception {
		// No-op by default
	}
}
