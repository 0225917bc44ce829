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

/**
 * Notified by {@link ConnectionRegistry} when a user transitions between "no live connections" and "at least one".
 * <p>
 * Callbacks are invoked after the registry lock has been released, on the thread that registered or unregistered
 * the connection.
 */
public interface PresenceListener {
	/**
	 * Called when a user's first live connection is registered.
	 */
	default void userDidConnect(@NonNull Principal principal) {
		// No-op by default
	}

	/**
	 * Called exactly once when a user's last live connection is unregistered.
	 */
	default void userDidDisconnect(@NonNull Principal principal) {
		// No-op by default
	}
}
