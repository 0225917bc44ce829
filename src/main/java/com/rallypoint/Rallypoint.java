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

import com.rallypoint.terminal.TerminalManager;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Rallypoint's main class - manage a {@link RealtimeServer} using a {@link RallypointConfig}.
 * <p>
 * A Rallypoint instance owns one {@link RealtimeHub} for its whole life.  {@link #start()} and {@link #stop()} control
 * the transport and the idle terminal sweep; {@link #close()} additionally cleans up plugins and destroys every terminal
 * session, after which the instance should be discarded.
 * <p>
 * Sample usage:
 * <pre>{@code try (Rallypoint rallypoint = Rallypoint.withConfig(RallypointConfig.withRealtimeServer(
 *     RealtimeServer.withPort(8081).build()).build())) {
 *   rallypoint.start();
 *   rallypoint.awaitShutdown();
 * }}</pre>
 */
@ThreadSafe
public final class Rallypoint implements AutoCloseable {
	@NonNull
	private final RallypointConfig rallypointConfig;
	@NonNull
	private final RealtimeHub realtimeHub;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;
	@Nullable
	private ScheduledExecutorService terminalSweepExecutorService;
	private boolean closed;

	/**
	 * Acquires a Rallypoint instance with the given configuration.
	 *
	 * @param rallypointConfig configuration that drives the Rallypoint system
	 * @return a Rallypoint instance
	 */
	@NonNull
	public static Rallypoint withConfig(@NonNull RallypointConfig rallypointConfig) {
		requireNonNull(rallypointConfig);
		return new Rallypoint(rallypointConfig);
	}

	private Rallypoint(@NonNull RallypointConfig rallypointConfig) {
		requireNonNull(rallypointConfig);

		this.rallypointConfig = rallypointConfig;
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		LifecycleObserver lifecycleObserver = rallypointConfig.getLifecycleObserver();
		TerminalManager terminalManager = rallypointConfig.getTerminalManager().orElseGet(() -> TerminalManager.withDefaults()
				.lifecycleObserver(lifecycleObserver)
				.build());

		this.realtimeHub = RealtimeHub.withDefaults()
				.principalResolver(rallypointConfig.getPrincipalResolver())
				.lifecycleObserver(lifecycleObserver)
				.terminalManager(terminalManager)
				.plugins(rallypointConfig.getPlugins())
				.defaultRoomId(rallypointConfig.getDefaultRoomId().orElse(null))
				.clock(rallypointConfig.getClock())
				.build();

		rallypointConfig.getRealtimeServer().initialize(lifecycleObserver, this.realtimeHub);
	}

	/**
	 * Starts the realtime server and the idle terminal sweep.
	 * <p>
	 * If already started, this is a no-op.
	 */
	public void start() {
		getLock().lock();

		try {
			if (this.closed)
				throw new IllegalStateException(format("This %s instance has been closed", getClass().getSimpleName()));

			if (isStarted())
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			LifecycleObserver lifecycleObserver = getRallypointConfig().getLifecycleObserver();

			lifecycleObserver.willStartRallypoint(this);

			getRallypointConfig().getRealtimeServer().start();

			long sweepIntervalMillis = getRallypointConfig().getTerminalSweepInterval().toMillis();
			ScheduledExecutorService terminalSweepExecutorService = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "terminal-idle-sweep");
				thread.setDaemon(true);
				return thread;
			});

			terminalSweepExecutorService.scheduleAtFixedRate(this::sweepIdleTerminals, sweepIntervalMillis, sweepIntervalMillis, TimeUnit.MILLISECONDS);
			this.terminalSweepExecutorService = terminalSweepExecutorService;

			lifecycleObserver.didStartRallypoint(this);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops the realtime server and the idle terminal sweep.  Terminal sessions survive.
	 * <p>
	 * If already stopped, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (isStarted()) {
				LifecycleObserver lifecycleObserver = getRallypointConfig().getLifecycleObserver();

				lifecycleObserver.willStopRallypoint(this);

				ScheduledExecutorService terminalSweepExecutorService = this.terminalSweepExecutorService;
				this.terminalSweepExecutorService = null;

				if (terminalSweepExecutorService != null)
					terminalSweepExecutorService.shutdownNow();

				getRallypointConfig().getRealtimeServer().stop();

				lifecycleObserver.didStopRallypoint(this);
			}
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until JVM shutdown or until {@link #stop()} is invoked.
	 *
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(() -> {
			try {
				close();
			} catch (Throwable ignored) {
				// Nothing to do
			}
		}, "rallypoint-shutdown-hook");

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException ignored) {
				// JVM shutting down
			}
		}
	}

	/**
	 * Stops, then runs plugin cleanup and destroys every terminal session.
	 */
	@Override
	public void close() {
		getLock().lock();

		try {
			stop();

			if (!this.closed) {
				this.closed = true;
				getRealtimeHub().shutdown();
			}
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getRallypointConfig().getRealtimeServer().isStarted();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public RealtimeHub getRealtimeHub() {
		return this.realtimeHub;
	}

	@NonNull
	public RallypointConfig getRallypointConfig() {
		return this.rallypointConfig;
	}

	protected void sweepIdleTerminals() {
		try {
			getRealtimeHub().getTerminalManager().sweepIdle(getRallypointConfig().getTerminalIdleTimeout());
		} catch (Throwable throwable) {
			try {
				getRallypointConfig().getLifecycleObserver().didReceiveLogEvent(
						LogEvent.with(LogEventType.TERMINAL_SWEEP_FAILED, "Idle terminal sweep failed").throwable(throwable).build());
			} catch (Throwable loggingThrowable) {
				loggingThrowable.printStackTrace(System.err);
			}
		}
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}
}
