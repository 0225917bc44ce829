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

import com.rallypoint.TestSupport.RecordingLifecycleObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

@ThreadSafe
public class RealtimeServerTests {
	private RealtimeServer realtimeServer;

	@AfterEach
	public void tearDown() {
		if (this.realtimeServer != null)
			this.realtimeServer.stop();
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void handshakeCredentialIsPassedToHandler() throws Exception {
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()), connectionHandler);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"handshake\",\"data\":{\"token\":\"secret-token\"}}");

			Assertions.assertEquals("secret-token", connectionHandler.credentials.poll(5, TimeUnit.SECONDS));

			TestSupport.writeLine(socket, "{\"event\":\"ping\"}");
			Assertions.assertEquals(InboundEvent.with("ping", null), connectionHandler.inboundEvents.poll(5, TimeUnit.SECONDS));
		}

		Assertions.assertTrue(TestSupport.awaitCondition(() -> connectionHandler.disconnectCount() == 1, Duration.ofSeconds(5)));
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void firstFrameWithoutHandshakeIsAnonymousAndDispatched() throws Exception {
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()), connectionHandler);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"joinRoom\",\"data\":\"general\"}");

			Assertions.assertEquals(RecordingConnectionHandler.ANONYMOUS, connectionHandler.credentials.poll(5, TimeUnit.SECONDS));
			Assertions.assertEquals(InboundEvent.with("joinRoom", "general"), connectionHandler.inboundEvents.poll(5, TimeUnit.SECONDS));
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void emittedEventsArriveAsJsonLines() throws Exception {
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		connectionHandler.greeting = Map.of("hello", "world");
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()), connectionHandler);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"handshake\"}");

			InputStream inputStream = socket.getInputStream();
			Assertions.assertEquals("{\"event\":\"greeting\",\"data\":{\"hello\":\"world\"}}", TestSupport.readLine(inputStream));
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void illegalFramesAreSkipped() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()), connectionHandler, lifecycleObserver);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"handshake\"}");
			TestSupport.writeLine(socket, "this is not json");
			TestSupport.writeLine(socket, "");
			TestSupport.writeLine(socket, "{\"event\":\"ping\"}");

			Assertions.assertEquals(InboundEvent.with("ping", null), connectionHandler.inboundEvents.poll(5, TimeUnit.SECONDS));
			Assertions.assertEquals(1, lifecycleObserver.logEventsOfType(LogEventType.ILLEGAL_FRAME).size());
		}
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void oversizedFrameClosesConnection() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()).maximumFrameSizeInBytes(64), connectionHandler, lifecycleObserver);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"handshake\"}");
			TestSupport.writeLine(socket, "{\"event\":\"spam\",\"data\":\"" + "x".repeat(500) + "\"}");

			try {
				Assertions.assertNull(TestSupport.readLine(socket.getInputStream()), "Server should close the connection");
			} catch (SocketException ignored) {
				// Closing with unread bytes pending may surface as a reset instead of end-of-stream
			}
		}

		Assertions.assertTrue(TestSupport.awaitCondition(() -> connectionHandler.disconnectCount() == 1, Duration.ofSeconds(5)));
		Assertions.assertEquals(1, lifecycleObserver.logEventsOfType(LogEventType.ILLEGAL_FRAME).size());
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void silentClientIsDroppedAfterHandshakeTimeout() throws Exception {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()).handshakeTimeout(Duration.ofMillis(200)),
				connectionHandler, lifecycleObserver);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			Assertions.assertEquals(-1, socket.getInputStream().read());
		}

		Assertions.assertEquals(0, connectionHandler.credentials.size(), "A connection that never spoke is never announced");
		Assertions.assertEquals(1, lifecycleObserver.logEventsOfType(LogEventType.CONNECTION_REJECTED).size());
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void stopDisconnectsClientsAndAllowsRestart() throws Exception {
		RecordingConnectionHandler connectionHandler = new RecordingConnectionHandler();
		int port = startServer(RealtimeServer.withPort(TestSupport.findFreePort()), connectionHandler);

		try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 2000)) {
			TestSupport.writeLine(socket, "{\"event\":\"handshake\"}");
			connectionHandler.credentials.poll(5, TimeUnit.SECONDS);

			this.realtimeServer.stop();

			Assertions.assertFalse(this.realtimeServer.isStarted());
			Assertions.assertNull(TestSupport.readLine(socket.getInputStream()));
		}

		this.realtimeServer.start();
		Assertions.assertTrue(this.realtimeServer.isStarted());
	}

	@Test
	public void startRequiresInitialization() {
		RealtimeServer uninitialized = RealtimeServer.withPort(0).build();
		Assertions.assertThrows(IllegalStateException.class, uninitialized::start);
	}

	@Test
	public void invalidConfigurationIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(-1).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(70000).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(0).handshakeTimeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(0).maximumFrameSizeInBytes(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(0).writeQueueCapacity(-5).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(0).concurrentConnectionLimit(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> RealtimeServer.withPort(0).shutdownTimeout(Duration.ofSeconds(-1)).build());
	}

	private int startServer(RealtimeServer.Builder builder, RealtimeServer.ConnectionHandler connectionHandler) {
		return startServer(builder, connectionHandler, new RecordingLifecycleObserver());
	}

	private int startServer(RealtimeServer.Builder builder,
													RealtimeServer.ConnectionHandler connectionHandler,
													LifecycleObserver lifecycleObserver) {
		this.realtimeServer = builder.host("127.0.0.1").build();
		this.realtimeServer.initialize(lifecycleObserver, connectionHandler);
		this.realtimeServer.start();
		return this.realtimeServer.getPort();
	}

	private static final class RecordingConnectionHandler implements RealtimeServer.ConnectionHandler {
		private static final String ANONYMOUS = "<anonymous>";

		private final BlockingQueue<String> credentials = new LinkedBlockingQueue<>();
		private final BlockingQueue<InboundEvent> inboundEvents = new LinkedBlockingQueue<>();
		private final List<String> disconnectedConnectionIds = new CopyOnWriteArrayList<>();
		private volatile Map<String, Object> greeting;

		@Override
		public void didConnect(Connection connection, String credential) {
			this.credentials.add(credential == null ? ANONYMOUS : credential);

			if (this.greeting != null)
				connection.emit("greeting", this.greeting);
		}

		@Override
		public void didReceiveEvent(Connection connection, InboundEvent inboundEvent) {
			this.inboundEvents.add(inboundEvent);
		}

		@Override
		public void didDisconnect(Connection connection) {
			this.disconnectedConnectionIds.add(connection.getId());
		}

		private int disconnectCount() {
			return this.disconnectedConnectionIds.size();
		}
	}
}
