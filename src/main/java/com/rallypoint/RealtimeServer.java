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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Wire transport for realtime connections.
 * <p>
 * The server owns sockets, framing, per-connection threads and write queues.  Everything else (authentication,
 * registration, rooms and plugins) happens in the {@link ConnectionHandler} supplied at initialization.
 * <p>
 * A standard implementation speaking newline-delimited JSON over TCP can be acquired via {@link #withPort(Integer)}.
 */
public interface RealtimeServer extends AutoCloseable {
	/**
	 * Starts accepting connections.  If the server is already started, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link Rallypoint} only and should not be invoked elsewhere.</strong>
	 */
	void start();

	/**
	 * Stops accepting connections and closes every open connection.  If the server is already stopped, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link Rallypoint} only and should not be invoked elsewhere.</strong>
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The port this server is bound to, or configured to bind to if not yet started.
	 *
	 * @return the port
	 */
	@NonNull
	Integer getPort();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Invoked exactly once by the managing {@link Rallypoint} before {@link #start()}.
	 *
	 * @param lifecycleObserver receives this server's log events
	 * @param connectionHandler receives connection lifecycle and inbound events
	 */
	void initialize(@NonNull LifecycleObserver lifecycleObserver,
									@NonNull ConnectionHandler connectionHandler);

	/**
	 * Callbacks from a {@link RealtimeServer} into the application.
	 * <p>
	 * For any one connection, calls are made sequentially from that connection's reader thread, in this order:
	 * {@link #didConnect(Connection, String)} once, then {@link #didReceiveEvent(Connection, InboundEvent)} per frame,
	 * then {@link #didDisconnect(Connection)} once.
	 */
	interface ConnectionHandler {
		/**
		 * Called after the handshake frame has been read.
		 *
		 * @param connection the new connection
		 * @param credential the handshake token, if one was supplied
		 */
		void didConnect(@NonNull Connection connection,
										@Nullable String credential);

		void didReceiveEvent(@NonNull Connection connection,
												 @NonNull InboundEvent inboundEvent);

		void didDisconnect(@NonNull Connection connection);
	}

	/**
	 * Acquires a builder for the standard {@link RealtimeServer} implementation.
	 *
	 * @param port the port on which the server should listen; {@code 0} picks an ephemeral port
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link RealtimeServer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Duration handshakeTimeout;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Integer maximumFrameSizeInBytes;
		@Nullable
		Integer writeQueueCapacity;
		@Nullable
		Integer concurrentConnectionLimit;
		@Nullable
		IdGenerator idGenerator;
		@Nullable
		FrameCodec frameCodec;

		protected Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * How long a new connection may take to send its first frame.
		 */
		@NonNull
		public Builder handshakeTimeout(@Nullable Duration handshakeTimeout) {
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * Inbound frames longer than this are discarded and the connection is closed.
		 */
		@NonNull
		public Builder maximumFrameSizeInBytes(@Nullable Integer maximumFrameSizeInBytes) {
			this.maximumFrameSizeInBytes = maximumFrameSizeInBytes;
			return this;
		}

		/**
		 * Outbound frames a connection may have pending before it is considered too slow and closed.
		 */
		@NonNull
		public Builder writeQueueCapacity(@Nullable Integer writeQueueCapacity) {
			this.writeQueueCapacity = writeQueueCapacity;
			return this;
		}

		@NonNull
		public Builder concurrentConnectionLimit(@Nullable Integer concurrentConnectionLimit) {
			this.concurrentConnectionLimit = concurrentConnectionLimit;
			return this;
		}

		@NonNull
		public Builder idGenerator(@Nullable IdGenerator idGenerator) {
			this.idGenerator = idGenerator;
			return this;
		}

		@NonNull
		public Builder frameCodec(@Nullable FrameCodec frameCodec) {
			this.frameCodec = frameCodec;
			return this;
		}

		@NonNull
		public RealtimeServer build() {
			return new DefaultRealtimeServer(this);
		}
	}
}
