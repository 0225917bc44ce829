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

import static java.util.Objects.requireNonNull;

/**
 * Classification of a {@link Room}, inferred from its identifier the first time anyone joins it.
 */
public enum RoomKind {
	/**
	 * The lobby every connection joins, or any identifier without a recognized {@code <prefix>:<id>} shape.
	 */
	GENERAL,
	/**
	 * A subject-scoped room such as {@code post:42}.
	 */
	TOPIC,
	/**
	 * A room addressed to a single user, {@code user:<id>}.
	 */
	USER_SCOPED,
	/**
	 * A room addressed to administrators, {@code admin:<id>}.
	 */
	ADMIN_SCOPED;

	/**
	 * Infers the kind of room from its identifier.
	 *
	 * @param roomId the room identifier
	 * @return the inferred kind
	 */
	@NonNull
	public static RoomKind fromRoomId(@NonNull String roomId) {
		requireNonNull(roomId);

		int separatorIndex = roomId.indexOf(':');

		// Needs a non-empty prefix and a non-empty remainder
		if (separatorIndex <= 0 || separatorIndex == roomId.length() - 1)
			return GENERAL;

		String prefix = roomId.substring(0, separatorIndex);

		if ("user".equals(prefix))
			return USER_SCOPED;

		if ("admin".equals(prefix))
			return ADMIN_SCOPED;

		return TOPIC;
	}
}
