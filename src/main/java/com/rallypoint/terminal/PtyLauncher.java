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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Spawns shells attached to real pseudo-terminals.
 * <p>
 * {@link TerminalManager} probes {@link #isAvailable()} once at construction.  If the probe fails, or any later
 * {@link #launch(String, int, int, Path, Map)} call throws, sessions fall back to the built-in simulator.
 */
public interface PtyLauncher {
	/**
	 * Whether this launcher can spawn pseudo-terminals on the current platform.
	 *
	 * @return {@code true} if available
	 */
	boolean isAvailable();

	@NonNull
	PseudoTerminal launch(@NonNull String shell,
												int columns,
												int rows,
												@NonNull Path workingDirectory,
												@NonNull Map<@NonNull String, @NonNull String> environment) throws IOException;

	/**
	 * Acquires a launcher backed by pty4j.
	 *
	 * @return a {@code PtyLauncher} with default settings
	 */
	@NonNull
	static PtyLauncher withDefaults() {
		return DefaultPtyLauncher.defaultInstance();
	}

	/**
	 * Acquires a launcher that is never available, which forces every session onto the simulator.
	 *
	 * @return an unavailable {@code PtyLauncher}
	 */
	@NonNull
	static PtyLauncher unavailable() {
		return new PtyLauncher() {
			@Override
			public boolean isAvailable() {
				return false;
			}

			@NonNull
			@Override
			public PseudoTerminal launch(@NonNull String shell,
																	 int columns,
																	 int rows,
																	 @NonNull Path workingDirectory,
																	 @NonNull Map<@NonNull String, @NonNull String> environment) throws IOException {
				throw new IOException("Pseudo-terminals are not available");
			}
		};
	}
}
