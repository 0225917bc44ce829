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

import com.rallypoint.terminal.PtyLauncher;

/**
 * Kinds of {@link LogEvent} instances that Rallypoint can produce.
 */
public enum LogEventType {
	/**
	 * Indicates a handshake credential could not be turned into a {@link Principal}; the connection proceeds anonymously.
	 */
	PRINCIPAL_RESOLUTION_FAILED,
	/**
	 * Indicates a client sent a frame that could not be decoded.  The frame is skipped and the connection stays open.
	 */
	ILLEGAL_FRAME,
	/**
	 * Indicates an outbound payload could not be encoded and was dropped.
	 */
	FRAME_ENCODING_FAILED,
	/**
	 * Indicates a connection's write queue was full; the connection is closed.
	 */
	CONNECTION_BACKPRESSURE,
	/**
	 * Indicates a connection was refused because the concurrent connection limit was reached.
	 */
	CONNECTION_REJECTED,
	/**
	 * Indicates an outbound event could not be handed to a recipient connection.
	 */
	CONNECTION_DELIVERY_FAILED,
	/**
	 * Indicates an inbound event arrived for which no plugin registered a handler.
	 */
	INBOUND_EVENT_UNHANDLED,
	/**
	 * Indicates a second plugin with an already-registered name was offered to the {@link PluginRegistry}.
	 */
	PLUGIN_DUPLICATE_REGISTRATION,
	/**
	 * Indicates {@link Plugin#setupEventHandlers(PluginConnection, Broadcaster)} threw an exception.
	 */
	PLUGIN_SETUP_FAILED,
	/**
	 * Indicates an {@link InboundEventHandler} contributed by a plugin threw an exception.
	 */
	PLUGIN_EVENT_HANDLER_FAILED,
	/**
	 * Indicates a {@link BusinessEventHandler} contributed by a plugin threw an exception.
	 */
	PLUGIN_BUSINESS_EVENT_FAILED,
	/**
	 * Indicates {@link Plugin#cleanup()} threw an exception.
	 */
	PLUGIN_CLEANUP_FAILED,
	/**
	 * Indicates a {@link PresenceListener} callback threw an exception.
	 */
	PRESENCE_LISTENER_FAILED,
	/**
	 * Indicates a real pseudo-terminal could not be spawned via {@link PtyLauncher}; a simulated shell is used instead.
	 */
	TERMINAL_PTY_UNAVAILABLE,
	/**
	 * Indicates reading output from a real pseudo-terminal failed.
	 */
	TERMINAL_OUTPUT_READ_FAILED,
	/**
	 * Indicates writing input to a real pseudo-terminal failed.
	 */
	TERMINAL_INPUT_WRITE_FAILED,
	/**
	 * Indicates resizing a real pseudo-terminal failed.
	 */
	TERMINAL_RESIZE_FAILED,
	/**
	 * Indicates a terminal output listener threw an exception.
	 */
	TERMINAL_OUTPUT_LISTENER_FAILED,
	/**
	 * Indicates the periodic idle-terminal sweep failed.
	 */
	TERMINAL_SWEEP_FAILED,
	/**
	 * Indicates a terminal's process could not be killed while the session was being destroyed.
	 */
	TERMINAL_DESTROY_FAILED,
	/**
	 * Indicates an unexpected error occurred in the realtime server's internals.
	 */
	REALTIME_SERVER_INTERNAL_ERROR,
	/**
	 * Indicates a {@link LifecycleObserver} callback threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED
}
