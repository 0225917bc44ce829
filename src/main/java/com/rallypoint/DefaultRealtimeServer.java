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

import com.rallypoint.RealtimeServer.ConnectionHandler;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedInputStream;
import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link RealtimeServer}: newline-delimited JSON frames over plain TCP.
 * <p>
 * Each accepted socket gets a reader task, which performs the handshake and then processes inbound frames strictly in
 * order, and a writer task, which drains a bounded queue of outbound frames.  A connection whose queue overflows is
 * closed.
 */
@ThreadSafe
final class DefaultRealtimeServer implements RealtimeServer {
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_HANDSHAKE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_FRAME_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_WRITE_QUEUE_CAPACITY;
	@NonNull
	private static final Integer DEFAULT_CONCURRENT_CONNECTION_LIMIT;
	@NonNull
	private static final String HANDSHAKE_EVENT;
	@NonNull
	private static final String HANDSHAKE_TOKEN_KEY;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_MAXIMUM_FRAME_SIZE_IN_BYTES = 1_024 * 1_024;
		DEFAULT_WRITE_QUEUE_CAPACITY = 1_024;
		DEFAULT_CONCURRENT_CONNECTION_LIMIT = 8_192;
		HANDSHAKE_EVENT = "handshake";
		HANDSHAKE_TOKEN_KEY = "token";
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final Duration handshakeTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Integer maximumFrameSizeInBytes;
	@NonNull
	private final Integer writeQueueCapacity;
	@NonNull
	private final Integer concurrentConnectionLimit;
	@NonNull
	private final IdGenerator idGenerator;
	@NonNull
	private final FrameCodec frameCodec;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Set<@NonNull DefaultRealtimeConnection> openConnections;
	@NonNull
	private final AtomicInteger activeSocketCount;
	@Nullable
	private volatile LifecycleObserver lifecycleObserver;
	@Nullable
	private volatile ConnectionHandler connectionHandler;
	@Nullable
	private volatile ServerSocket serverSocket;
	@Nullable
	private volatile ExecutorService connectionExecutorService;
	@Nullable
	private Thread acceptThread;
	private volatile boolean started;
	private volatile boolean stopping;

	DefaultRealtimeServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.handshakeTimeout = builder.handshakeTimeout != null ? builder.handshakeTimeout : DEFAULT_HANDSHAKE_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.maximumFrameSizeInBytes = builder.maximumFrameSizeInBytes != null ? builder.maximumFrameSizeInBytes : DEFAULT_MAXIMUM_FRAME_SIZE_IN_BYTES;
		this.writeQueueCapacity = builder.writeQueueCapacity != null ? builder.writeQueueCapacity : DEFAULT_WRITE_QUEUE_CAPACITY;
		this.concurrentConnectionLimit = builder.concurrentConnectionLimit != null ? builder.concurrentConnectionLimit : DEFAULT_CONCURRENT_CONNECTION_LIMIT;
		this.idGenerator = builder.idGenerator != null ? builder.idGenerator : IdGenerator.withDefaults();
		this.frameCodec = builder.frameCodec != null ? builder.frameCodec : FrameCodec.defaultInstance();
		this.lock = new ReentrantLock();
		this.openConnections = ConcurrentHashMap.newKeySet();
		this.activeSocketCount = new AtomicInteger(0);

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port %d is out of range", this.port));

		if (this.handshakeTimeout.isNegative() || this.handshakeTimeout.isZero())
			throw new IllegalArgumentException("Handshake timeout must be > 0");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");

		if (this.maximumFrameSizeInBytes <= 0)
			throw new IllegalArgumentException("Maximum frame size must be > 0");

		if (this.writeQueueCapacity <= 0)
			throw new IllegalArgumentException("Write queue capacity must be > 0");

		if (this.concurrentConnectionLimit <= 0)
			throw new IllegalArgumentException("Concurrent connection limit must be > 0");
	}

	@Override
	public void initialize(@NonNull LifecycleObserver lifecycleObserver,
												 @NonNull ConnectionHandler connectionHandler) {
		requireNonNull(lifecycleObserver);
		requireNonNull(connectionHandler);

		this.lifecycleObserver = lifecycleObserver;
		this.connectionHandler = connectionHandler;
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			if (getConnectionHandler().isEmpty())
				throw new IllegalStateException(format("No %s was registered for %s", ConnectionHandler.class.getSimpleName(), getClass()));

			ServerSocket serverSocket;

			try {
				serverSocket = new ServerSocket();
				serverSocket.setReuseAddress(true);
				serverSocket.bind(new InetSocketAddress(getHost(), this.port));
			} catch (IOException e) {
				throw new UncheckedIOException(format("Unable to bind to %s:%d", getHost(), this.port), e);
			}

			this.serverSocket = serverSocket;
			this.connectionExecutorService = Utilities.createThreadPerTaskExecutor("realtime-connection-", (thread, throwable) ->
					safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, format("Uncaught exception on thread %s", thread.getName()))
							.throwable(throwable)
							.build()));
			this.stopping = false;
			this.started = true;
			this.acceptThread = new Thread(() -> acceptConnections(serverSocket), "realtime-accept-loop");
			this.acceptThread.setDaemon(true);
			this.acceptThread.start();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		ServerSocket serverSocketSnapshot;
		ExecutorService connectionExecutorServiceSnapshot;
		Thread acceptThreadSnapshot;

		getLock().lock();

		try {
			if (!isStarted())
				return;

			this.stopping = true;
			serverSocketSnapshot = this.serverSocket;
			connectionExecutorServiceSnapshot = this.connectionExecutorService;
			acceptThreadSnapshot = this.acceptThread;
		} finally {
			getLock().unlock();
		}

		// Close server socket to unblock accept()
		if (serverSocketSnapshot != null) {
			try {
				serverSocketSnapshot.close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, "Unable to close server socket").throwable(e).build());
			}
		}

		for (DefaultRealtimeConnection connection : new ArrayList<>(getOpenConnections()))
			connection.closeImmediately();

		long deadlineNanos = System.nanoTime() + getShutdownTimeout().toNanos();

		if (connectionExecutorServiceSnapshot != null) {
			connectionExecutorServiceSnapshot.shutdown();

			try {
				if (!connectionExecutorServiceSnapshot.awaitTermination(remainingMillis(deadlineNanos), TimeUnit.MILLISECONDS))
					connectionExecutorServiceSnapshot.shutdownNow();
			} catch (InterruptedException e) {
				connectionExecutorServiceSnapshot.shutdownNow();
				Thread.currentThread().interrupt();
			}
		}

		if (acceptThreadSnapshot != null) {
			try {
				acceptThreadSnapshot.join(Math.max(1L, remainingMillis(deadlineNanos)));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}

		getLock().lock();

		try {
			this.started = false;
			this.stopping = false; // allow future restarts
			this.serverSocket = null;
			this.connectionExecutorService = null;
			this.acceptThread = null;
			getOpenConnections().clear();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		return this.started;
	}

	@NonNull
	@Override
	public Integer getPort() {
		ServerSocket serverSocket = this.serverSocket;

		if (serverSocket != null && serverSocket.isBound())
			return serverSocket.getLocalPort();

		return this.port;
	}

	protected void acceptConnections(@NonNull ServerSocket serverSocket) {
		requireNonNull(serverSocket);

		try {
			while (!this.stopping) {
				Socket socket = serverSocket.accept();

				if (getActiveSocketCount().incrementAndGet() > getConcurrentConnectionLimit()) {
					getActiveSocketCount().decrementAndGet();
					safelyLog(LogEvent.with(LogEventType.CONNECTION_REJECTED,
							format("Rejecting connection from %s; limit of %d concurrent connections reached", socket.getRemoteSocketAddress(), getConcurrentConnectionLimit())).build());
					closeQuietly(socket);
					continue;
				}

				ExecutorService executorService = this.connectionExecutorService;

				try {
					if (executorService == null)
						throw new RejectedExecutionException("Server is stopping");

					executorService.submit(() -> {
						try {
							handleSocket(socket);
						} finally {
							getActiveSocketCount().decrementAndGet();
						}
					});
				} catch (RejectedExecutionException e) {
					// Pool is shutting down; close socket and exit the loop
					getActiveSocketCount().decrementAndGet();
					closeQuietly(socket);
					break;
				}
			}
		} catch (SocketException ignored) {
			// Expected when the server socket is closed during shutdown
		} catch (IOException e) {
			if (!this.stopping)
				safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, "Accept loop encountered an IO error").throwable(e).build());
		}
	}

	protected void handleSocket(@NonNull Socket socket) {
		requireNonNull(socket);

		ConnectionHandler connectionHandler = getConnectionHandler().orElseThrow();
		DefaultRealtimeConnection connection = null;
		boolean connected = false;

		try (InputStream inputStream = new BufferedInputStream(socket.getInputStream())) {
			socket.setTcpNoDelay(true);
			socket.setSoTimeout((int) Math.max(1L, getHandshakeTimeout().toMillis()));

			String firstLine;

			try {
				firstLine = readLine(inputStream);
			} catch (SocketTimeoutException e) {
				safelyLog(LogEvent.with(LogEventType.CONNECTION_REJECTED,
						format("No handshake from %s within %s", socket.getRemoteSocketAddress(), getHandshakeTimeout())).build());
				return;
			}

			if (firstLine == null)
				return;

			socket.setSoTimeout(0);

			connection = new DefaultRealtimeConnection(getIdGenerator().generateId(), socket, getWriteQueueCapacity());
			getOpenConnections().add(connection);

			if (this.stopping)
				return;

			DefaultRealtimeConnection writerConnection = connection;
			getConnectionExecutorService().orElseThrow(() -> new RejectedExecutionException("Server is stopping"))
					.submit(writerConnection::drainWriteQueue);

			InboundEvent firstEvent = decodeQuietly(connection, firstLine);
			String credential = null;

			// A client that skips the handshake is treated as anonymous and its first frame is processed normally
			if (firstEvent != null && HANDSHAKE_EVENT.equals(firstEvent.getName())) {
				credential = firstEvent.getString(HANDSHAKE_TOKEN_KEY).orElse(null);
				firstEvent = null;
			}

			connected = true;
			connectionHandler.didConnect(connection, credential);

			if (firstEvent != null)
				dispatchQuietly(connectionHandler, connection, firstEvent);

			String line;

			while (!connection.isClosing() && (line = readLine(inputStream)) != null) {
				if (line.isBlank())
					continue;

				InboundEvent inboundEvent = decodeQuietly(connection, line);

				if (inboundEvent != null)
					dispatchQuietly(connectionHandler, connection, inboundEvent);
			}
		} catch (FrameTooLargeIOException e) {
			safelyLog(LogEvent.with(LogEventType.ILLEGAL_FRAME, e.getMessage())
					.connectionId(connection == null ? null : connection.getId())
					.build());
		} catch (IOException | RejectedExecutionException e) {
			// Remote close or reset; nothing to report unless we were not expecting it
			if (!this.stopping && connection != null && !connection.isClosing() && !isRemoteClose(e))
				safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, "Unable to read from connection")
						.connectionId(connection.getId())
						.throwable(e)
						.build());
		} finally {
			if (connection != null) {
				// Without a writer running, nothing would drain the poison pill
				if (connected)
					connection.close();
				else
					connection.closeImmediately();

				getOpenConnections().remove(connection);
			} else {
				closeQuietly(socket);
			}

			if (connected) {
				try {
					connectionHandler.didDisconnect(connection);
				} catch (Throwable throwable) {
					safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, "Connection handler failed on disconnect")
							.connectionId(connection.getId())
							.throwable(throwable)
							.build());
				}
			}
		}
	}

	@Nullable
	protected InboundEvent decodeQuietly(@NonNull DefaultRealtimeConnection connection,
																			 @NonNull String line) {
		requireNonNull(connection);
		requireNonNull(line);

		try {
			return getFrameCodec().decodeFrame(line);
		} catch (IllegalFrameException e) {
			safelyLog(LogEvent.with(LogEventType.ILLEGAL_FRAME, format("Discarding illegal frame: %s", e.getMessage()))
					.connectionId(connection.getId())
					.throwable(e)
					.build());
			return null;
		}
	}

	protected void dispatchQuietly(@NonNull ConnectionHandler connectionHandler,
																 @NonNull DefaultRealtimeConnection connection,
																 @NonNull InboundEvent inboundEvent) {
		requireNonNull(connectionHandler);
		requireNonNull(connection);
		requireNonNull(inboundEvent);

		try {
			connectionHandler.didReceiveEvent(connection, inboundEvent);
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, format("Connection handler failed for event '%s'", inboundEvent.getName()))
					.connectionId(connection.getId())
					.throwable(throwable)
					.build());
		}
	}

	/**
	 * Reads one LF-terminated line, dropping the terminator and any preceding CR.
	 *
	 * @return the line, or {@code null} at end of stream
	 */
	@Nullable
	protected String readLine(@NonNull InputStream inputStream) throws IOException {
		requireNonNull(inputStream);

		ByteArrayOutputStream line = new ByteArrayOutputStream(256);
		int b;

		while ((b = inputStream.read()) != -1) {
			if (b == '\n') {
				byte[] bytes = line.toByteArray();
				int length = bytes.length > 0 && bytes[bytes.length - 1] == '\r' ? bytes.length - 1 : bytes.length;
				return new String(bytes, 0, length, StandardCharsets.UTF_8);
			}

			if (line.size() >= getMaximumFrameSizeInBytes())
				throw new FrameTooLargeIOException(format("Frame exceeds maximum size of %d bytes", getMaximumFrameSizeInBytes()));

			line.write(b);
		}

		// Unterminated trailing data is a frame too
		return line.size() == 0 ? null : line.toString(StandardCharsets.UTF_8);
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			LifecycleObserver lifecycleObserver = this.lifecycleObserver;
			(lifecycleObserver == null ? LifecycleObserver.defaultInstance() : lifecycleObserver).didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			throwable.printStackTrace(System.err);
		}
	}

	private static boolean isRemoteClose(@Nullable Throwable throwable) {
		Throwable current = throwable;

		while (current != null) {
			if (current instanceof SocketException)
				return true;

			current = current.getCause();
		}

		return false;
	}

	private static long remainingMillis(long deadlineNanos) {
		return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
	}

	private static void closeQuietly(@NonNull Socket socket) {
		try {
			socket.close();
		} catch (IOException ignored) {
			// Nothing to do
		}
	}

	@NonNull
	private String getHost() {
		return this.host;
	}

	@NonNull
	private Duration getHandshakeTimeout() {
		return this.handshakeTimeout;
	}

	@NonNull
	private Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	private Integer getMaximumFrameSizeInBytes() {
		return this.maximumFrameSizeInBytes;
	}

	@NonNull
	private Integer getWriteQueueCapacity() {
		return this.writeQueueCapacity;
	}

	@NonNull
	private Integer getConcurrentConnectionLimit() {
		return this.concurrentConnectionLimit;
	}

	@NonNull
	private IdGenerator getIdGenerator() {
		return this.idGenerator;
	}

	@NonNull
	private FrameCodec getFrameCodec() {
		return this.frameCodec;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Set<@NonNull DefaultRealtimeConnection> getOpenConnections() {
		return this.openConnections;
	}

	@NonNull
	private AtomicInteger getActiveSocketCount() {
		return this.activeSocketCount;
	}

	@NonNull
	private Optional<ConnectionHandler> getConnectionHandler() {
		return Optional.ofNullable(this.connectionHandler);
	}

	@NonNull
	private Optional<ExecutorService> getConnectionExecutorService() {
		return Optional.ofNullable(this.connectionExecutorService);
	}

	@NotThreadSafe
	private static final class FrameTooLargeIOException extends IOException {
		private FrameTooLargeIOException(@Nullable String message) {
			super(message);
		}
	}

	/**
	 * An element of a connection's write queue: an encoded frame, or the poison pill that stops the writer.
	 */
	private record WriteQueueElement(@Nullable String frame) {
		@NonNull
		private static final WriteQueueElement POISON_PILL = new WriteQueueElement(null);

		boolean isPoisonPill() {
			return this == POISON_PILL;
		}
	}

	@ThreadSafe
	private final class DefaultRealtimeConnection implements Connection {
		@NonNull
		private final String id;
		@NonNull
		private final Socket socket;
		@NonNull
		private final BlockingQueue<@NonNull WriteQueueElement> writeQueue;
		@NonNull
		private final AtomicBoolean closing;

		private DefaultRealtimeConnection(@NonNull String id,
																			@NonNull Socket socket,
																			@NonNull Integer writeQueueCapacity) {
			requireNonNull(id);
			requireNonNull(socket);
			requireNonNull(writeQueueCapacity);

			this.id = id;
			this.socket = socket;
			// One extra slot so the poison pill always fits behind a full queue of frames
			this.writeQueue = new ArrayBlockingQueue<>(writeQueueCapacity + 1);
			this.closing = new AtomicBoolean(false);
		}

		@NonNull
		@Override
		public String getId() {
			return this.id;
		}

		@Override
		public void emit(@NonNull String event,
										 @Nullable Object payload) {
			requireNonNull(event);

			if (isClosing())
				return;

			String frame;

			try {
				frame = getFrameCodec().encodeFrame(event, payload);
			} catch (IllegalFrameException e) {
				safelyLog(LogEvent.with(LogEventType.FRAME_ENCODING_FAILED, format("Unable to encode event '%s'", event))
						.connectionId(getId())
						.throwable(e)
						.build());
				return;
			}

			// Leave the last slot for the poison pill
			if (this.writeQueue.remainingCapacity() <= 1 || !this.writeQueue.offer(new WriteQueueElement(frame))) {
				safelyLog(LogEvent.with(LogEventType.CONNECTION_BACKPRESSURE,
								format("Write queue for connection %s is full; closing connection", getId()))
						.connectionId(getId())
						.build());
				closeImmediately();
			}
		}

		@Override
		public void close() {
			if (!this.closing.compareAndSet(false, true))
				return;

			// The writer flushes what is already queued, then closes the socket
			if (!this.writeQueue.offer(WriteQueueElement.POISON_PILL))
				closeQuietly(this.socket);
		}

		void closeImmediately() {
			this.closing.set(true);
			this.writeQueue.clear();
			this.writeQueue.offer(WriteQueueElement.POISON_PILL);
			closeQuietly(this.socket);
		}

		boolean isClosing() {
			return this.closing.get();
		}

		void drainWriteQueue() {
			try (Writer writer = new BufferedWriter(new OutputStreamWriter(this.socket.getOutputStream(), StandardCharsets.UTF_8))) {
				while (true) {
					WriteQueueElement writeQueueElement = this.writeQueue.take();

					if (writeQueueElement.isPoisonPill())
						break;

					writer.write(writeQueueElement.frame());
					writer.write('\n');

					if (this.writeQueue.isEmpty())
						writer.flush();
				}

				writer.flush();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			} catch (IOException e) {
				if (!isClosing() && !isRemoteClose(e))
					safelyLog(LogEvent.with(LogEventType.REALTIME_SERVER_INTERNAL_ERROR, "Unable to write to connection")
							.connectionId(getId())
							.throwable(e)
							.build());
			} finally {
				this.closing.set(true);
				closeQuietly(this.socket);
			}
		}

		@Override
		public String toString() {
			return format("%s{id=%s, remoteAddress=%s}", getClass().getSimpleName(), getId(), this.socket.getRemoteSocketAddress());
		}
	}
}
