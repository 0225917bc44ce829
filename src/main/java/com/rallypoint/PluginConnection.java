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
 * A single connection as seen by one {@link Plugin} during {@link Plugin#setupEventHandlers(PluginConnection, Broadcaster)}.
 */
public interface PluginConnection {
	@NonNull
	String getId();

	@NonNull
	Optional<Principal> getPrincipal();

	/**
	 * Registers a handler for a named client event on this connection.
	 *
	 * @param inboundEventName    the event name, which must be one of the plugin's declared inbound event names
	 * @param inboundEventHandler the handler
	 * @throws IllegalArgumentException if the plugin did not declare {@code inboundEventName}
	 */
	void on(@NonNull String inboundEventName,
					@NonNull InboundEventHandler inboundEventHandler);

	/**
	 * Delivers an event to this connection only.
	 */
	void emit(@NonNull String event,
						@Nullable Object payload);
}
