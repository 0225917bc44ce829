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

import com.rallypoint.terminal.TerminalInfo;
import org.jspecify.annotations.NonNull;

/**
 * Read-only hook methods for observing system, connection and terminal session lifecycle events.
 * <p>
 * Rallypoint catches exceptions thrown by these methods and surfaces them separately via {@link #didReceiveLogEvent(LogEvent)}.
 * <p>
 * A standard threadsafe implementation, which writes log events through SLF4J, can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface LifecycleObserver {
	/**
	 * Called before a {@link Rallypoint} instance starts.
	 */
	default void willStartRallypoint(@NonNull Rallypoint rallypoint) {
		// No-op by default
	}

	/**
	 * Called after a {@link Rallypoint} instance starts.
	 */
	default void didStartRallypoint(@NonNull Rallypoint rallypoint) {
		// No-op by default
	}

	/**
	 * Called before a {@link Rallypoint} instance stops.
	 */
	default void willStopRallypoint(@NonNull Rallypoint rallypoint) {
		// No-op by default
	}

	/**
	 * Called after a {@link Rallypoint} instance stops.
	 */
	default void didStopRallypoint(@NonNull Rallypoint rallypoint) {
		// No-op by default
	}

	/**
	 * Called after a connection has been registered and has joined the default room.
	 */
	default void didEstablishConnection(@NonNull ConnectionInfo connectionInfo) {
		// No-op by default
	}

	/**
	 * Called after a connection has been unregistered.
	 */
	default void didTerminateConnection(@NonNull ConnectionInfo connectionInfo) {
		// No-op by default
	}

	/**
	 * Called after a terminal session has been created, whether real or simulated.
	 */
	default void didCreateTerminalSession(@NonNull TerminalInfo terminalInfo) {
		// No-op by default
	}

	/**
	 * Called after a terminal session has been destroyed, either explicitly, by the idle sweep or by process exit.
	 */
	default void didDestroyTerminalSession(@NonNull TerminalInfo terminalInfo) {
		// No-op by default
	}

	/**
	 * Called when Rallypoint has something worth logging.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		// No-op by default
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance which logs via SLF4J.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
