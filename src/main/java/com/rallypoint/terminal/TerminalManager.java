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

import com.rallypoint.LifecycleObserver;
import com.rallypoint.LogEvent;
import com.rallypoint.LogEventType;
import com.rallypoint.Utilities;
import com.rallypoint.terminal.TerminalBacking.PtyBacking;
import com.rallypoint.terminal.TerminalBacking.SimulatedBacking;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns every terminal session in the process: creation, input, resizing, teardown and idle sweeping.
 * <p>
 * Each session is backed either by a real pseudo-terminal from the configured {@link PtyLauncher} or by a
 * {@link SimulatedShell}.  The choice is made once, at creation: if the launcher is unavailable or spawning fails for
 * any reason, the session silently runs on the simulator.
 * <p>
 * The session table is guarded by a single lock.  Process spawning, process teardown, stream I/O and listener
 * callbacks all happen outside it.
 */
@ThreadSafe
public final class TerminalManager implements AutoCloseable {
	@NonNull
	public static final Duration DEFAULT_MAXIMUM_IDLE_DURATION;
	@NonNull
	private static final String EXIT_NOTICE_FORMAT;
	@NonNull
	private static final Integer TERMINAL_ID_BYTE_COUNT;

	static {
		DEFAULT_MAXIMUM_IDLE_DURATION = Duration.ofMinutes(30);
		EXIT_NOTICE_FORMAT = "\r\n[Process completed with exit code %d]\r\n";
		TERMINAL_ID_BYTE_COUNT = 16;
	}

	@NonNull
	private final PtyLauncher ptyLauncher;
	@NonNull
	private final Boolean ptyAvailable;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Path homeDirectory;
	@NonNull
	private final Map<@NonNull String, @NonNull String> environment;
	@NonNull
	private final String defaultShell;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final SecureRandom secureRandom;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<@NonNull String, @NonNull TerminalSession> terminalSessionsById;
	@NonNull
	private final ExecutorService outputReaderExecutorService;

	/**
	 * Acquires a builder for {@link TerminalManager} instances, seeded from the current process environment.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected TerminalManager(@NonNull Builder builder) {
		requireNonNull(builder);

		this.environment = builder.environment != null ? Map.copyOf(builder.environment) : Map.copyOf(System.getenv());
		this.ptyLauncher = builder.ptyLauncher != null ? builder.ptyLauncher : PtyLauncher.withDefaults();
		this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
		this.homeDirectory = builder.homeDirectory != null ? builder.homeDirectory : defaultHomeDirectory(this.environment);
		this.defaultShell = builder.defaultShell != null ? builder.defaultShell : defaultShell(this.environment);
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.secureRandom = new SecureRandom();
		this.lock = new ReentrantLock();
		this.terminalSessionsById = new LinkedHashMap<>();

		AtomicLong threadCounter = new AtomicLong(1L);
		ThreadFactory threadFactory = (runnable) -> {
			Thread thread = new Thread(runnable, format("terminal-output-reader-%d", threadCounter.getAndIncrement()));
			thread.setDaemon(true);
			return thread;
		};

		this.outputReaderExecutorService = Executors.newCachedThreadPool(threadFactory);

		boolean ptyAvailable;

		try {
			ptyAvailable = this.ptyLauncher.isAvailable();
		} catch (RuntimeException | LinkageError e) {
			ptyAvailable = false;
		}

		this.ptyAvailable = ptyAvailable;
	}

	/**
	 * Creates a terminal session.
	 *
	 * @param terminalCreateOptions geometry, shell, owner and output listener
	 * @return the new session
	 */
	@NonNull
	public TerminalInfo create(@NonNull TerminalCreateOptions terminalCreateOptions) {
		requireNonNull(terminalCreateOptions);

		String terminalId = generateTerminalId();
		String shell = terminalCreateOptions.getShell().orElse(getDefaultShell());
		int columns = terminalCreateOptions.getColumns();
		int rows = terminalCreateOptions.getRows();

		TerminalBacking terminalBacking = null;

		if (isPtyAvailable()) {
			try {
				terminalBacking = new PtyBacking(getPtyLauncher().launch(shell, columns, rows, getHomeDirectory(), getEnvironment()));
			} catch (IOException | RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.TERMINAL_PTY_UNAVAILABLE,
								format("Unable to spawn '%s' in a pseudo-terminal; falling back to simulated terminal", shell))
						.terminalId(terminalId)
						.throwable(e)
						.build());
			}
		}

		if (terminalBacking == null)
			terminalBacking = new SimulatedBacking(new SimulatedShell(getHomeDirectory(), getEnvironment(), getClock()));

		TerminalSession terminalSession = new TerminalSession(terminalId,
				terminalCreateOptions.getOwnerUserId().orElse(null),
				terminalCreateOptions.getOwnerName().orElse(null),
				shell, columns, rows, terminalBacking,
				terminalCreateOptions.getOutputListener().orElse(null),
				getClock().instant());

		TerminalInfo terminalInfo;

		getLock().lock();

		try {
			getTerminalSessionsById().put(terminalId, terminalSession);
			terminalInfo = terminalSession.toTerminalInfo();
		} finally {
			getLock().unlock();
		}

		if (terminalBacking instanceof PtyBacking ptyBacking)
			startOutputReader(terminalSession, ptyBacking.pseudoTerminal());

		try {
			getLifecycleObserver().didCreateTerminalSession(terminalInfo);
		} catch (Throwable throwable) {
			logLifecycleObserverFailure("didCreateTerminalSession", throwable);
		}

		return terminalInfo;
	}

	/**
	 * Sends input to a session.
	 * <p>
	 * Real sessions receive the raw bytes; their output arrives later through the session's output listener.
	 * Simulated sessions process the input immediately and deliver any output to the listener before this method returns.
	 *
	 * @param terminalId the session identifier
	 * @param input      raw input, e.g. keystrokes
	 * @return {@code false} if the session does not exist or the input could not be written
	 */
	@NonNull
	public Boolean write(@NonNull String terminalId,
											 @NonNull String input) {
		requireNonNull(terminalId);
		requireNonNull(input);

		TerminalSession terminalSession;

		getLock().lock();

		try {
			terminalSession = getTerminalSessionsById().get(terminalId);

			if (terminalSession == null)
				return false;

			terminalSession.setLastActivityAt(getClock().instant());
		} finally {
			getLock().unlock();
		}

		TerminalBacking terminalBacking = terminalSession.getTerminalBacking();

		if (terminalBacking instanceof SimulatedBacking simulatedBacking) {
			SimulatedShell simulatedShell = simulatedBacking.simulatedShell();
			String output;

			synchronized (simulatedShell) {
				output = simulatedShell.handleInput(input);
			}

			if (output.length() > 0)
				deliverOutput(terminalSession, output);

			return true;
		}

		PseudoTerminal pseudoTerminal = ((PtyBacking) terminalBacking).pseudoTerminal();

		try {
			OutputStream outputStream = pseudoTerminal.getOutputStream();

			synchronized (outputStream) {
				outputStream.write(input.getBytes(StandardCharsets.UTF_8));
				outputStream.flush();
			}

			return true;
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.TERMINAL_INPUT_WRITE_FAILED, format("Unable to write input to terminal %s", terminalId))
					.terminalId(terminalId)
					.throwable(e)
					.build());
			return false;
		}
	}

	/**
	 * Changes a session's geometry.  A failed resize of a real pseudo-terminal is logged; the new geometry is kept.
	 *
	 * @param terminalId the session identifier
	 * @param columns    new column count, must be positive
	 * @param rows       new row count, must be positive
	 * @return {@code false} if the session does not exist or the geometry is not positive
	 */
	@NonNull
	public Boolean resize(@NonNull String terminalId,
												@NonNull Integer columns,
												@NonNull Integer rows) {
		requireNonNull(terminalId);
		requireNonNull(columns);
		requireNonNull(rows);

		if (columns <= 0 || rows <= 0)
			return false;

		TerminalSession terminalSession;

		getLock().lock();

		try {
			terminalSession = getTerminalSessionsById().get(terminalId);

			if (terminalSession == null)
				return false;

			terminalSession.setGeometry(columns, rows);
			terminalSession.setLastActivityAt(getClock().instant());
		} finally {
			getLock().unlock();
		}

		if (terminalSession.getTerminalBacking() instanceof PtyBacking ptyBacking) {
			try {
				ptyBacking.pseudoTerminal().resize(columns, rows);
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.TERMINAL_RESIZE_FAILED, format("Unable to resize terminal %s", terminalId))
						.terminalId(terminalId)
						.throwable(e)
						.build());
			}
		}

		return true;
	}

	/**
	 * Stops a session and forgets it.  Idempotent.
	 *
	 * @param terminalId the session identifier
	 * @return {@code false} if no such session exists
	 */
	@NonNull
	public Boolean destroy(@NonNull String terminalId) {
		requireNonNull(terminalId);
		return destroy(terminalId, TerminalStatus.STOPPED);
	}

	/**
	 * Destroys every session whose last activity is strictly older than {@code maximumIdleDuration}.
	 * A session idle for exactly {@code maximumIdleDuration} is kept.
	 *
	 * @param maximumIdleDuration idle threshold
	 * @return the number of sessions destroyed
	 */
	@NonNull
	public Integer sweepIdle(@NonNull Duration maximumIdleDuration) {
		requireNonNull(maximumIdleDuration);

		Instant now = getClock().instant();
		List<String> idleTerminalIds = new ArrayList<>();

		getLock().lock();

		try {
			for (TerminalSession terminalSession : getTerminalSessionsById().values())
				if (Duration.between(terminalSession.getLastActivityAt(), now).compareTo(maximumIdleDuration) > 0)
					idleTerminalIds.add(terminalSession.getId());
		} finally {
			getLock().unlock();
		}

		int destroyedCount = 0;

		for (String idleTerminalId : idleTerminalIds)
			if (destroy(idleTerminalId))
				++destroyedCount;

		return destroyedCount;
	}

	@NonNull
	public Optional<TerminalInfo> get(@NonNull String terminalId) {
		requireNonNull(terminalId);

		getLock().lock();

		try {
			TerminalSession terminalSession = getTerminalSessionsById().get(terminalId);
			return terminalSession == null ? Optional.empty() : Optional.of(terminalSession.toTerminalInfo());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public List<@NonNull TerminalInfo> forUser(@NonNull Long userId) {
		requireNonNull(userId);

		getLock().lock();

		try {
			List<TerminalInfo> terminalInfos = new ArrayList<>();

			for (TerminalSession terminalSession : getTerminalSessionsById().values())
				if (userId.equals(terminalSession.getOwnerUserId().orElse(null)))
					terminalInfos.add(terminalSession.toTerminalInfo());

			return terminalInfos;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public List<@NonNull TerminalInfo> all() {
		getLock().lock();

		try {
			List<TerminalInfo> terminalInfos = new ArrayList<>(getTerminalSessionsById().size());

			for (TerminalSession terminalSession : getTerminalSessionsById().values())
				terminalInfos.add(terminalSession.toTerminalInfo());

			return terminalInfos;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Integer countSessions() {
		getLock().lock();

		try {
			return getTerminalSessionsById().size();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The banner and first prompt for a simulated session.  Real sessions print their own.
	 *
	 * @param terminalId the session identifier
	 * @return the welcome text, or {@link Optional#empty()} if the session does not exist or is not simulated
	 */
	@NonNull
	public Optional<String> welcomeMessage(@NonNull String terminalId) {
		requireNonNull(terminalId);

		TerminalSession terminalSession;

		getLock().lock();

		try {
			terminalSession = getTerminalSessionsById().get(terminalId);
		} finally {
			getLock().unlock();
		}

		if (terminalSession != null && terminalSession.getTerminalBacking() instanceof SimulatedBacking simulatedBacking) {
			SimulatedShell simulatedShell = simulatedBacking.simulatedShell();

			synchronized (simulatedShell) {
				return Optional.of(simulatedShell.welcomeMessage());
			}
		}

		return Optional.empty();
	}

	/**
	 * Destroys every session.
	 *
	 * @return the number of sessions destroyed
	 */
	@NonNull
	public Integer destroyAll() {
		List<String> terminalIds;

		getLock().lock();

		try {
			terminalIds = new ArrayList<>(getTerminalSessionsById().keySet());
		} finally {
			getLock().unlock();
		}

		int destroyedCount = 0;

		for (String terminalId : terminalIds)
			if (destroy(terminalId))
				++destroyedCount;

		return destroyedCount;
	}

	@Override
	public void close() {
		destroyAll();
		getOutputReaderExecutorService().shutdownNow();
	}

	@NonNull
	public Boolean isPtyAvailable() {
		return this.ptyAvailable;
	}

	@NonNull
	protected Boolean destroy(@NonNull String terminalId,
														@NonNull TerminalStatus finalStatus) {
		requireNonNull(terminalId);
		requireNonNull(finalStatus);

		TerminalSession terminalSession;
		TerminalInfo terminalInfo;

		getLock().lock();

		try {
			terminalSession = getTerminalSessionsById().remove(terminalId);

			if (terminalSession == null)
				return false;

			terminalSession.setStatus(finalStatus);
			terminalInfo = terminalSession.toTerminalInfo();
		} finally {
			getLock().unlock();
		}

		if (terminalSession.getTerminalBacking() instanceof PtyBacking ptyBacking) {
			try {
				ptyBacking.pseudoTerminal().destroy();
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.TERMINAL_DESTROY_FAILED, format("Unable to kill process for terminal %s", terminalId))
						.terminalId(terminalId)
						.throwable(e)
						.build());
			}
		}

		try {
			getLifecycleObserver().didDestroyTerminalSession(terminalInfo);
		} catch (Throwable throwable) {
			logLifecycleObserverFailure("didDestroyTerminalSession", throwable);
		}

		return true;
	}

	protected void startOutputReader(@NonNull TerminalSession terminalSession,
																	 @NonNull PseudoTerminal pseudoTerminal) {
		requireNonNull(terminalSession);
		requireNonNull(pseudoTerminal);

		getOutputReaderExecutorService().submit(() -> readOutput(terminalSession, pseudoTerminal));
	}

	// Runs on a terminal-output-reader thread until the process's output stream closes
	protected void readOutput(@NonNull TerminalSession terminalSession,
														@NonNull PseudoTerminal pseudoTerminal) {
		requireNonNull(terminalSession);
		requireNonNull(pseudoTerminal);

		String terminalId = terminalSession.getId();
		char[] buffer = new char[8192];

		try (Reader reader = new InputStreamReader(pseudoTerminal.getInputStream(), StandardCharsets.UTF_8)) {
			int charactersRead;

			while ((charactersRead = reader.read(buffer)) != -1) {
				if (charactersRead == 0)
					continue;

				touch(terminalId);
				deliverOutput(terminalSession, new String(buffer, 0, charactersRead));
			}
		} catch (IOException e) {
			// Reading fails once the process is killed; only report it for sessions that are still live
			if (isLive(terminalId)) {
				safelyLog(LogEvent.with(LogEventType.TERMINAL_OUTPUT_READ_FAILED, format("Unable to read output from terminal %s", terminalId))
						.terminalId(terminalId)
						.throwable(e)
						.build());

				destroy(terminalId, TerminalStatus.ERROR);
				return;
			}
		}

		if (!isLive(terminalId))
			return;

		int exitCode;

		try {
			exitCode = pseudoTerminal.waitFor();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return;
		}

		deliverOutput(terminalSession, format(EXIT_NOTICE_FORMAT, exitCode));

		TerminalOutputListener outputListener = terminalSession.getOutputListener().orElse(null);

		if (outputListener != null) {
			try {
				outputListener.didExit(terminalId, exitCode);
			} catch (Throwable throwable) {
				safelyLog(LogEvent.with(LogEventType.TERMINAL_OUTPUT_LISTENER_FAILED, format("Terminal output listener failed on exit of terminal %s", terminalId))
						.terminalId(terminalId)
						.throwable(throwable)
						.build());
			}
		}

		destroy(terminalId, TerminalStatus.STOPPED);
	}

	protected void deliverOutput(@NonNull TerminalSession terminalSession,
															 @NonNull String output) {
		requireNonNull(terminalSession);
		requireNonNull(output);

		TerminalOutputListener outputListener = terminalSession.getOutputListener().orElse(null);

		if (outputListener == null)
			return;

		try {
			outputListener.didReceiveOutput(terminalSession.getId(), output);
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.TERMINAL_OUTPUT_LISTENER_FAILED, format("Terminal output listener failed for terminal %s", terminalSession.getId()))
					.terminalId(terminalSession.getId())
					.throwable(throwable)
					.build());
		}
	}

	@NonNull
	protected String generateTerminalId() {
		byte[] bytes = new byte[TERMINAL_ID_BYTE_COUNT];

		getLock().lock();

		try {
			while (true) {
				getSecureRandom().nextBytes(bytes);
				String terminalId = Utilities.toHexString(bytes);

				// Only live sessions are checked; retired identifiers may in principle be redrawn
				if (!getTerminalSessionsById().containsKey(terminalId))
					return terminalId;
			}
		} finally {
			getLock().unlock();
		}
	}

	protected void touch(@NonNull String terminalId) {
		requireNonNull(terminalId);

		getLock().lock();

		try {
			TerminalSession terminalSession = getTerminalSessionsById().get(terminalId);

			if (terminalSession != null)
				terminalSession.setLastActivityAt(getClock().instant());
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	protected Boolean isLive(@NonNull String terminalId) {
		requireNonNull(terminalId);

		getLock().lock();

		try {
			return getTerminalSessionsById().containsKey(terminalId);
		} finally {
			getLock().unlock();
		}
	}

	protected void logLifecycleObserverFailure(@NonNull String methodName,
																						 @NonNull Throwable throwable) {
		requireNonNull(methodName);
		requireNonNull(throwable);

		safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
						format("An exception occurred while invoking %s::%s", LifecycleObserver.class.getSimpleName(), methodName))
				.throwable(throwable)
				.build());
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	static String defaultShell(@NonNull Map<@NonNull String, @NonNull String> environment) {
		requireNonNull(environment);

		boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

		if (windows) {
			String comspec = trimAggressivelyToNull(environment.get("COMSPEC"));
			return comspec == null ? "powershell.exe" : comspec;
		}

		String shell = trimAggressivelyToNull(environment.get("SHELL"));
		return shell == null ? "/bin/bash" : shell;
	}

	@NonNull
	static Path defaultHomeDirectory(@NonNull Map<@NonNull String, @NonNull String> environment) {
		requireNonNull(environment);

		String home = trimAggressivelyToNull(environment.get("HOME"));

		if (home == null)
			home = System.getProperty("user.home", ".");

		return Paths.get(home);
	}

	@NonNull
	private PtyLauncher getPtyLauncher() {
		return this.ptyLauncher;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Path getHomeDirectory() {
		return this.homeDirectory;
	}

	@NonNull
	private Map<@NonNull String, @NonNull String> getEnvironment() {
		return this.environment;
	}

	@NonNull
	private String getDefaultShell() {
		return this.defaultShell;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private SecureRandom getSecureRandom() {
		return this.secureRandom;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Map<@NonNull String, @NonNull TerminalSession> getTerminalSessionsById() {
		return this.terminalSessionsById;
	}

	@NonNull
	private ExecutorService getOutputReaderExecutorService() {
		return this.outputReaderExecutorService;
	}

	/**
	 * Builder used to construct instances of {@link TerminalManager}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private PtyLauncher ptyLauncher;
		@Nullable
		private Clock clock;
		@Nullable
		private Path homeDirectory;
		@Nullable
		private Map<@NonNull String, @NonNull String> environment;
		@Nullable
		private String defaultShell;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder() {
			// Only vended by TerminalManager
		}

		@NonNull
		public Builder ptyLauncher(@Nullable PtyLauncher ptyLauncher) {
			this.ptyLauncher = ptyLauncher;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public Builder homeDirectory(@Nullable Path homeDirectory) {
			this.homeDirectory = homeDirectory;
			return this;
		}

		@NonNull
		public Builder environment(@Nullable Map<@NonNull String, @NonNull String> environment) {
			this.environment = environment;
			return this;
		}

		@NonNull
		public Builder defaultShell(@Nullable String defaultShell) {
			this.defaultShell = defaultShell;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public TerminalManager build() {
			return new TerminalManager(this);
		}
	}
}
