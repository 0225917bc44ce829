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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Defines how a Rallypoint instance is configured.
 * <p>
 * Instances can be acquired via the {@link #withRealtimeServer(RealtimeServer)} builder factory method.
 */
@ThreadSafe
public final class RallypointConfig {
	@NonNull
	public static final Duration DEFAULT_TERMINAL_IDLE_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_TERMINAL_SWEEP_INTERVAL;

	static {
		DEFAULT_TERMINAL_IDLE_TIMEOUT = TerminalManager.DEFAULT_MAXIMUM_IDLE_DURATION;
		DEFAULT_TERMINAL_SWEEP_INTERVAL = Duration.ofMinutes(5);
	}

	@NonNull
	private final RealtimeServer realtimeServer;
	@NonNull
	private final PrincipalResolver principalResolver;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@Nullable
	private final TerminalManager terminalManager;
	@NonNull
	private final List<@NonNull Plugin> plugins;
	@Nullable
	private final String defaultRoomId;
	@NonNull
	private final Duration terminalIdleTimeout;
	@NonNull
	private final Duration terminalSweepInterval;
	@NonNull
	private final Clock clock;

	/**
	 * Vends a configuration builder for the given realtime server.
	 *
	 * @param realtimeServer the transport that accepts client connections
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder withRealtimeServer(@NonNull RealtimeServer realtimeServer) {
		requireNonNull(realtimeServer);
		return new Builder(realtimeServer);
	}

	protected RallypointConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.realtimeServer = builder.realtimeServer;
		this.principalResolver = builder.principalResolver != null ? builder.principalResolver : PrincipalResolver.anonymousOnly();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.terminalManager = builder.terminalManager;
		this.plugins = builder.plugins != null ? Collections.unmodifiableList(new ArrayList<>(builder.plugins)) : List.of();
		this.defaultRoomId = builder.defaultRoomId;
		this.terminalIdleTimeout = builder.terminalIdleTimeout != null ? builder.terminalIdleTimeout : DEFAULT_TERMINAL_IDLE_TIMEOUT;
		this.terminalSweepInterval = builder.terminalSweepInterval != null ? builder.terminalSweepInterval : DEFAULT_TERMINAL_SWEEP_INTERVAL;
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

		if (this.terminalIdleTimeout.isNegative() || this.terminalIdleTimeout.isZero())
			throw new IllegalArgumentException("Terminal idle timeout must be > 0");

		if (this.terminalSweepInterval.isNegative() || this.terminalSweepInterval.isZero())
			throw new IllegalArgumentException("Terminal sweep interval must be > 0");
	}

	@NonNull
	public RealtimeServer getRealtimeServer() {
		return this.realtimeServer;
	}

	@NonNull
	public PrincipalResolver getPrincipalResolver() {
		return this.principalResolver;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * The terminal manager to use; if absent, one is created from the platform defaults.
	 *
	 * @return the terminal manager, if one was configured
	 */
	@NonNull
	public Optional<TerminalManager> getTerminalManager() {
		return Optional.ofNullable(this.terminalManager);
	}

	@NonNull
	public List<@NonNull Plugin> getPlugins() {
		return this.plugins;
	}

	@NonNull
	public Optional<String> getDefaultRoomId() {
		return Optional.ofNullable(this.defaultRoomId);
	}

	/**
	 * Terminal sessions idle for longer than this are destroyed by the periodic sweep.
	 *
	 * @return the idle timeout
	 */
	@NonNull
	public Duration getTerminalIdleTimeout() {
		return this.terminalIdleTimeout;
	}

	@NonNull
	public Duration getTerminalSweepInterval() {
		return this.terminalSweepInterval;
	}

	@NonNull
	public Clock getClock() {
		return this.clock;
	}

	/**
	 * Builder used to construct instances of {@link RallypointConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private RealtimeServer realtimeServer;
		@Nullable
		private PrincipalResolver principalResolver;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private TerminalManager terminalManager;
		@Nullable
		private List<@NonNull Plugin> plugins;
		@Nullable
		private String defaultRoomId;
		@Nullable
		private Duration terminalIdleTimeout;
		@Nullable
		private Duration terminalSweepInterval;
		@Nullable
		private Clock clock;

		protected Builder(@NonNull RealtimeServer realtimeServer) {
			requireNonNull(realtimeServer);
			this.realtimeServer = realtimeServer;
		}

		@NonNull
		public Builder realtimeServer(@NonNull RealtimeServer realtimeServer) {
			requireNonNull(realtimeServer);
			this.realtimeServer = realtimeServer;
			return this;
		}

		@NonNull
		public Builder principalResolver(@Nullable PrincipalResolver principalResolver) {
			this.principalResolver = principalResolver;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder terminalManager(@Nullable TerminalManager terminalManager) {
			this.terminalManager = terminalManager;
			return this;
		}

		@NonNull
		public Builder plugins(@Nullable List<@NonNull Plugin> plugins) {
			this.plugins = plugins;
			return this;
		}

		@NonNull
		public Builder defaultRoomId(@Nullable String defaultRoomId) {
			this.defaultRoomId = defaultRoomId;
			return this;
		}

		@NonNull
		public Builder terminalIdleTimeout(@Nullable Duration terminalIdleTimeout) {
			this.terminalIdleTimeout = terminalIdleTimeout;
			return this;
		}

		@NonNull
		public Builder terminalSweepInterval(@Nullable Duration terminalSweepInterval) {
			this.terminalSweepInterval = terminalSweepInterval;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public RallypointConfig build() {
			return new RallypointConfig(this);
		}
	}
}
