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
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * A running shell attached to a pseudo-terminal, as launched by a {@link PtyLauncher}.
 */
public interface PseudoTerminal {
	/**
	 * Stream of bytes the shell writes to the terminal.
	 */
	@NonNull
	InputStream getInputStream();

	/**
	 * Stream of bytes typed into the terminal.
	 */
	@NonNull
	OutputStream getOutputStream();

	void resize(int columns,
							int rows) throws IOException;

	/**
	 * Blocks until the process exits.
	 *
	 * @return the exit code
	 */
	int waitFor() throws InterruptedException;

	boolean isAlive();

	/**
	 * Kills the process.  Idempotent.
	 */
	void destroy();

	@NonNull
	Optional<Long> getPid();
}
