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

/**
 * Transport-facing handle for a single live client connection.
 * <p>
 * Implementations must be threadsafe: {@link #emit(String, Object)} is called from whichever thread issues a broadcast,
 * and must not block on network I/O.
 */
public interface Connection {
	/**
	 * Server-assigned identifier, unique among live connections.
	 *
	 * @return the connection identifier
	 */
	@NonNull
	String getId();

	/**
	 * Enqueues a named event for delivery to the client.  Delivery is best-effort.
	 *
	 * @param event   the event name
	 * @param payload the JSON-encodable payload, or {@code null}
	 */
	void emit(@NonNull String event,
						@Nullable Object payload);

	/**
	 * Closes the connection.  Idempotent.
	 */
	void close();
}
