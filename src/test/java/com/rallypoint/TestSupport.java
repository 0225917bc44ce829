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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

public final class TestSupport {
	private TestSupport() {}

	public static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	public static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	/**
	 * Reads one LF-terminated line, or {@code null} at end of stream.
	 */
	public static String readLine(InputStream in) throws IOException {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		int b;
		while ((b = in.read()) != -1) {
			if (b == '\n')
				return bos.toString(StandardCharsets.UTF_8);
			bos.write(b);
		}
		return bos.size() == 0 ? null : bos.toString(StandardCharsets.UTF_8);
	}

	public static void writeLine(Socket socket, String line) throws IOException {
		socket.getOutputStream().write((line + "\n").getBytes(StandardCharsets.UTF_8));
		socket.getOutputStream().flush();
	}

	public static boolean awaitCondition(BooleanSupplier condition, Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (System.nanoTime() < deadline) {
			if (condition.getAsBoolean())
				return true;
			Thread.sleep(10);
		}
		return condition.getAsBoolean();
	}

	/**
	 * A clock whose instant only moves when told to.
	 */
	public static final class MutableClock extends Clock {
		private volatile Instant instant;

		public MutableClock(Instant instant) {
			this.instant = instant;
		}

		public void advance(Duration duration) {
			this.instant = this.instant.plus(duration);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return this.instant;
		}
	}

	/**
	 * Collects log events so tests can assert on them.
	 */
	public static final class RecordingLifecycleObserver implements LifecycleObserver {
		private final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		private final List<ConnectionInfo> establishedConnections = new CopyOnWriteArrayList<>();
		private final List<ConnectionInfo> terminatedConnections = new CopyOnWriteArrayList<>();

		@Override
		public void didReceiveLogEvent(LogEvent logEvent) {
			this.logEvents.add(logEvent);
		}

		@Override
		public void didEstablishConnection(ConnectionInfo connectionInfo) {
			this.establishedConnections.add(connectionInfo);
		}

		@Override
		public void didTerminateConnection(ConnectionInfo connectionInfo) {
			this.terminatedConnections.add(connectionInfo);
		}

		public List<LogEvent> getLogEvents() {
			return List.copyOf(this.logEvents);
		}

		public List<LogEvent> logEventsOfType(LogEventType logEventType) {
			return this.logEvents.stream().filter(logEvent -> logEvent.getLogEventType() == logEventType).toList();
		}

		public List<ConnectionInfo> getEstablishedConnections() {
			return List.copyOf(this.establishedConnections);
		}

		public List<ConnectionInfo> getTerminatedConnections() {
			return List.copyOf(this.terminatedConnections);
		}
	}
}
