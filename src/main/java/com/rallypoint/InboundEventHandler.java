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

/**
 * Handles one named client event on one connection.
 * <p>
 * Invoked on the connection's reader thread, so events from a single connection are handled strictly in order.
 * Exceptions are caught, logged as {@link LogEventType#PLUGIN_EVENT_HANDLER_FAILED} and do not affect other handlers.
 */
@FunctionalInterface
public interface InboundEventHandler {
	void handleInboundEvent(@NonNull InboundEvent inboundEvent) throws Exception;
}
