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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * {@link LifecycleObserver} which writes to SLF4J.
 * <p>
 * Log event types that indicate a failure are logged at {@code ERROR}, recoverable conditions at {@code WARN}.
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@NonNull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultLifecycleObserver();
	}

	@NonNull
	private final Logger logger;

	@NonNull
	public static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultLifecycleObserver() {
		this.logger = LoggerFactory.getLogger("com.rallypoint.Rallypoint");
	}

	@Override
	public void didStartRallypoint(@NonNull Rallypoint rallypoint) {
		requireNonNull(rallypoint);
		getLogger().info("Rallypoint started.");
	}

	@Override
	public void didStopRallypoint(@NonNull Rallypoint rallypoint) {
		requireNonNull(rallypoint);
		getLogger().info("Rallypoint stopped.");
	}

	@Override
	public void didEstablishConnection(@NonNull ConnectionInfo connectionInfo) {
		requireNonNull(connectionInfo);
		getLogger().debug("Connection {} established (user ID {})", connectionInfo.getId(), connectionInfo.getUserId().orElse(null));
	}

	@Override
	public void didTerminateConnection(@NonNull ConnectionInfo connectionInfo) {
		requireNonNull(connectionInfo);
		getLogger().debug("Connection {} terminated (user ID {})", connectionInfo.getId(), connectionInfo.getUserId().orElse(null));
	}

	@Override
	public void didCreateTerminalSession(@NonNull TerminalInfo terminalInfo) {
		requireNonNull(terminalInfo);
		getLogger().info("Terminal session {} created ({}, {}x{})", terminalInfo.getId(),
				terminalInfo.isSimulated() ? "simulated" : terminalInfo.getShell(), terminalInfo.getColumns(), terminalInfo.getRows());
	}

	@Override
	public void didDestroyTerminalSession(@NonNull TerminalInfo terminalInfo) {
		requireNonNull(terminalInfo);
		getLogger().info("Terminal session {} destroyed", terminalInfo.getId());
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		String message = logEvent.getMessage();
		Throwable throwable = logEvent.getThrowable().orElse(null);

		switch (logEvent.getLogEventType()) {
			case ILLEGAL_FRAME, INBOUND_EVENT_UNHANDLED, PRINCIPAL_RESOLUTION_FAILED, TERMINAL_PTY_UNAVAILABLE,
					 PLUGIN_DUPLICATE_REGISTRATION, CONNECTION_BACKPRESSURE, CONNECTION_REJECTED -> getLogger().warn(message, throwable);
			default -> getLogger().error(message, throwable);
		}
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
