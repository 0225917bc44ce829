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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts between newline-delimited JSON wire frames and events.
 * <p>
 * A frame is a single-line JSON object of the form {@code {"event": "<name>", "data": <any JSON>}}.
 * Encoded frames never contain a line terminator; the transport appends one.
 */
@ThreadSafe
public final class FrameCodec {
	@NonNull
	public static final String EVENT_FIELD_NAME;
	@NonNull
	public static final String DATA_FIELD_NAME;
	@NonNull
	private static final FrameCodec DEFAULT_INSTANCE;

	static {
		EVENT_FIELD_NAME = "event";
		DATA_FIELD_NAME = "data";
		DEFAULT_INSTANCE = new FrameCodec(new ObjectMapper());
	}

	@NonNull
	private final ObjectMapper objectMapper;

	@NonNull
	public static FrameCodec defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static FrameCodec withObjectMapper(@NonNull ObjectMapper objectMapper) {
		requireNonNull(objectMapper);
		return new FrameCodec(objectMapper);
	}

	private FrameCodec(@NonNull ObjectMapper objectMapper) {
		requireNonNull(objectMapper);
		this.objectMapper = objectMapper;
	}

	/**
	 * Encodes an outbound event.
	 *
	 * @param event   the event name
	 * @param payload any Jackson-serializable value, or {@code null}
	 * @return the frame, without a trailing newline
	 * @throws IllegalFrameException if the payload cannot be serialized
	 */
	@NonNull
	public String encodeFrame(@NonNull String event,
														@Nullable Object payload) throws IllegalFrameException {
		requireNonNull(event);

		Map<String, Object> frame = new LinkedHashMap<>(2);
		frame.put(EVENT_FIELD_NAME, event);
		frame.put(DATA_FIELD_NAME, payload);

		try {
			return getObjectMapper().writeValueAsString(frame);
		} catch (JsonProcessingException e) {
			throw new IllegalFrameException(format("Unable to encode payload for event '%s'", event), e);
		}
	}

	/**
	 * Decodes an inbound frame.  The {@code data} member, if present, becomes a tree of {@link Map}, {@link java.util.List},
	 * {@link String}, {@link Number}, {@link Boolean} and {@code null} values.
	 *
	 * @param frame a single line received from the client
	 * @return the decoded event
	 * @throws IllegalFrameException if the line is not a JSON object with a non-blank string {@code event} member
	 */
	@NonNull
	public InboundEvent decodeFrame(@NonNull String frame) throws IllegalFrameException {
		requireNonNull(frame);

		JsonNode root;

		try {
			root = getObjectMapper().readTree(frame);
		} catch (JsonProcessingException e) {
			throw new IllegalFrameException("Frame is not valid JSON", e);
		}

		if (root == null || !root.isObject())
			throw new IllegalFrameException("Frame must be a JSON object");

		JsonNode eventNode = root.get(EVENT_FIELD_NAME);

		if (eventNode == null || !eventNode.isTextual())
			throw new IllegalFrameException(format("Frame must have a string '%s' member", EVENT_FIELD_NAME));

		String event = trimAggressivelyToNull(eventNode.textValue());

		if (event == null)
			throw new IllegalFrameException(format("Frame '%s' member must not be blank", EVENT_FIELD_NAME));

		JsonNode dataNode = root.get(DATA_FIELD_NAME);
		Object payload = null;

		if (dataNode != null && !dataNode.isNull()) {
			try {
				payload = getObjectMapper().treeToValue(dataNode, Object.class);
			} catch (JsonProcessingException e) {
				throw new IllegalFrameException(format("Unable to decode payload for event '%s'", event), e);
			}
		}

		return InboundEvent.with(event, payload);
	}

	@NonNull
	private ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}
}
