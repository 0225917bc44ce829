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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link Connection} that records everything emitted to it.
 */
@ThreadSafe
public final class RecordingConnection implements Connection {
	@NonNull
	private final String id;
	@NonNull
	private final List<@NonNull EmittedEvent> emittedEvents;
	private volatile boolean closed;

	public RecordingConnection(@NonNull String id) {
		requireNonNull(id);
		this.id = id;
		this.emittedEvents = new CopyOnWriteArrayList<>();
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
		this.emittedEvents.add(new EmittedEvent(event, payload));
	}

	@Override
	public void close() {
		this.closed = true;
	}

	public boolean isClosed() {
		return this.closed;
	}

	@NonNull
	public List<@NonNull EmittedEvent> getEmittedEvents() {
		return new ArrayList<>(this.emittedEvents);
	}

	@NonNull
	public List<@NonNull EmittedEvent> emittedEventsNamed(@NonNull String event) {
		requireNonNull(event);
		return getEmittedEvents().stream().filter(emittedEvent -> emittedEvent.event().equals(event)).toList();
	}

	@NonNull
	public List<@NonNull String> emittedEventNames() {
		return getEmittedEvents().stream().map(EmittedEvent::event).toList();
	}

	public void clear() {
		this.emittedEvents.clear();
	}

	public record EmittedEvent(@NonNull String event,
														 @Nullable Object payload) {
		@SuppressWarnings("unchecked")
		@NonNull
		public Map<String, Object> payloadAsMap() {
			return (Map<String, Object>) payload();
		}
	}
}
