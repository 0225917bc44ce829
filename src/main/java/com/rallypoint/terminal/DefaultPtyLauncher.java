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

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * {@link PtyLauncher} backed by pty4j.
 */
@ThreadSafe
final class DefaultPtyLauncher implements PtyLauncher {
	@NonNull
	private static final DefaultPtyLauncher DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultPtyLauncher();
	}

	@NonNull
	static DefaultPtyLauncher defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultPtyLauncher() {
		// Use defaultInstance()
	}

	@Override
	public boolean isAvailable() {
		try {
			Class.forName("com.pty4j.PtyProcessBuilder");
			return true;
		} catch (ClassNotFoundException | LinkageError e) {
			return false;
		}
	}

	@NonNull
	@Override
	public PseudoTerminal launch(@NonNull String shell,
															 int columns,
															 int rows,
															 @NonNull Path workingDirectory,
															 @NonNull Map<@NonNull String, @NonNull String> environment) throws IOException {
		requireNonNull(shell);
		requireNonNull(workingDirectory);
		requireNonNull(environment);

		Map<String, String> processEnvironment = new LinkedHashMap<>(environment);
		processEnvironment.putIfAbsent("TERM", "xterm-color");

		PtyProcess ptyProcess;

		try {
			ptyProcess = new PtyProcessBuilder(new String[]{shell})
					.setEnvironment(processEnvironment)
					.setDirectory(workingDirectory.toString())
					.setInitialColumns(columns)
					.setInitialRows(rows)
					.setConsole(false)
					.start();
		} catch (RuntimeException | LinkageError e) {
			// Native library loading problems surface as unchecked errors
			throw new IOException("Unable to spawn pseudo-terminal", e);
		}

		return new Pty4jPseudoTerminal(ptyProcess);
	}

	@ThreadSafe
	private static final class Pty4jPseudoTerminal implements PseudoTerminal {
		@NonNull
		private final PtyProcess ptyProcess;

		private Pty4jPseudoTerminal(@NonNull PtyProcess ptyProcess) {
			requireNonNull(ptyProcess);
			this.ptyProcess = ptyProcess;
		}

		@NonNull
		@Override
		public InputStream getInputStream() {
			return this.ptyProcess.getInputStream();
		}

		@NonNull
		@Override
		public OutputStream getOutputStream() {
			return this.ptyProcess.getOutputStream();
		}

		@Override
		public void resize(int columns,
											 int rows) throws IOException {
			try {
				this.ptyProcess.setWinSize(new WinSize(columns, rows));
			} catch (RuntimeException e) {
				throw new IOException("Unable to resize pseudo-terminal", e);
			}
		}

		@Override
		public int waitFor() throws InterruptedException {
			return this.ptyProcess.waitFor();
		}

		@Override
		public boolean isAlive() {
			return this.ptyProcess.isAlive();
		}

		@Override
		public void destroy() {
			this.ptyProcess.destroy();
		}

		@NonNull
		@Override
		public Optional<Long> getPid() {
			try {
				return Optional.of(this.ptyProcess.pid());
			} catch (UnsupportedOperationException e) {
				return Optional.empty();
			}
		}
	}
}
