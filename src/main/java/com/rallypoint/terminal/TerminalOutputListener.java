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

package com.rallypoint.terminal;

import org.jspecify.annotations.NonNull;

/**
 * Receives output produced by a terminal session.
 * <p>
 * For real pseudo-terminals, callbacks arrive on the session's reader thread.  For simulated sessions, output is
 * delivered synchronously on the thread that called {@link TerminalManager#write(String, String)}.
 */
@FunctionalInterface
public interface TerminalOutputListener {
	void didReceiveOutput(@NonNull String terminalId,
												@NonNull String data);

	/**
	 * Called once when a real process exits, after the exit notice has been delivered as output.
	 */
	default void didExit(@NonNull String terminalId,
											 @NonNull Integer exitCode) {
		// No-op by default
	}
}
