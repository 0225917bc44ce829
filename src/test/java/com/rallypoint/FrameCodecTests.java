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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ThreadSafe
public class FrameCodecTests {
	private final FrameCodec frameCodec = FrameCodec.defaultInstance();

	@Test
	public void encodesEventAndData() throws IllegalFrameException {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("message", "pong");
		payload.put("type", "info");

		Assertions.assertEquals("{\"event\":\"notification\",\"data\":{\"message\":\"pong\",\"type\":\"info\"}}",
				this.frameCodec.encodeFrame("notification", payload));
		Assertions.assertEquals("{\"event\":\"ping\",\"data\":null}", this.frameCodec.encodeFrame("ping", null));
	}

	@Test
	public void unserializablePayloadIsRejected() {
		Assertions.assertThrows(IllegalFrameException.class, () -> this.frameCodec.encodeFrame("broken", new Object()));
	}

	@Test
	public void decodesStructuredAndScalarData() throws IllegalFrameException {
		InboundEvent resize = this.frameCodec.decodeFrame("{\"event\":\"terminalResize\",\"data\":{\"terminalId\":\"abc\",\"cols\":120,\"rows\":40}}");

		Assertions.assertEquals("terminalResize", resize.getName());
		Assertions.assertEquals("abc", resize.getString("terminalId").orElse(null));
		Assertions.assertEquals(120, resize.getInteger("cols").orElse(null));
		Assertions.assertEquals(40L, resize.getLong("rows").orElse(null));

		InboundEvent joinRoom = this.frameCodec.decodeFrame("{\"event\":\"joinRoom\",\"data\":\"post:5\"}");
		Assertions.assertEquals("post:5", joinRoom.getPayloadAsString().orElse(null));

		InboundEvent subscribe = this.frameCodec.decodeFrame("{\"event\":\"subscribeToPost\",\"data\":17}");
		Assertions.assertEquals(17L, subscribe.getPayloadAsLong().orElse(null));

		InboundEvent list = this.frameCodec.decodeFrame("{\"event\":\"batch\",\"data\":[1,\"two\"]}");
		Assertions.assertEquals(List.of(1, "two"), list.getPayload().orElse(null));
	}

	@Test
	public void missingOrNullDataMeansNoPayload() throws IllegalFrameException {
		Assertions.assertTrue(this.frameCodec.decodeFrame("{\"event\":\"ping\"}").getPayload().isEmpty());
		Assertions.assertTrue(this.frameCodec.decodeFrame("{\"event\":\"ping\",\"data\":null}").getPayload().isEmpty());
	}

	@Test
	public void malformedFramesAreRejected() {
		for (String frame : List.of("", "not json", "[1,2]", "\"ping\"", "{\"data\":1}", "{\"event\":7}", "{\"event\":\"   \"}"))
			Assertions.assertThrows(IllegalFrameException.class, () -> this.frameCodec.decodeFrame(frame), frame);
	}

	@Test
	public void inboundEventAccessorsAreLenient() {
		InboundEvent inboundEvent = InboundEvent.with("typing", Map.of("postId", "12", "isTyping", "TRUE", "fraction", 1.5));

		Assertions.assertEquals(12L, inboundEvent.getLong("postId").orElse(null));
		Assertions.assertEquals(true, inboundEvent.getBoolean("isTyping").orElse(null));
		Assertions.assertTrue(inboundEvent.getLong("fraction").isEmpty(), "Non-integral numbers are not identifiers");
		Assertions.assertTrue(inboundEvent.getString("missing").isEmpty());
		Assertions.assertTrue(inboundEvent.getPayloadAsString().isEmpty(), "A map payload is not a scalar");
	}

	@Test
	public void integersOutsideIntRangeAreAbsent() {
		InboundEvent inboundEvent = InboundEvent.with("terminalCreate", Map.of("cols", 4294967376L, "rows", "-2147483649", "width", 2147483647L));

		Assertions.assertTrue(inboundEvent.getInteger("cols").isEmpty(), "Oversized values are not wrapped into range");
		Assertions.assertTrue(inboundEvent.getInteger("rows").isEmpty());
		Assertions.assertEquals(Integer.MAX_VALUE, inboundEvent.getInteger("width").orElse(null));
		Assertions.assertEquals(4294967376L, inboundEvent.getLong("cols").orElse(null));
	}
}
