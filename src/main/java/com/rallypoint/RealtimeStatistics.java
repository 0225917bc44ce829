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
import java.time.Instant;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Health snapshot of a {@link RealtimeHub}, suitable for a status endpoint.
 */
@ThreadSafe
public final class RealtimeStatistics {
	@NonNull
	private final Integer connectionCount;
	@NonNull
	private final Integer userCount;
	@NonNull
	private final Integer roomCount;
	@NonNull
	private final Integer terminalSessionCount;
	@NonNull
	private final Integer pluginCount;
	@NonNull
	private final Boolean ptyAvailable;
	@NonNull
	private final Instant takenAt;

	RealtimeStatistics(@NonNull Integer connectionCount,
										 @NonNull Integer userCount,
										 @NonNull Integer roomCount,
										 @NonNull Integer terminalSessionCount,
										 @NonNull Integer pluginCount,
										 @NonNull Boolean ptyAvailable,
										 @NonNull Instant takenAt) {
		this.connectionCount = requireNonNull(connectionCount);
		this.userCount = requireNonNull(userCount);
		this.roomCount = requireNonNull(roomCount);
		this.terminalSessionCount = requireNonNull(terminalSessionCount);
		this.pluginCount = requireNonNull(pluginCount);
		this.ptyAvailable = requireNonNull(ptyAvailable);
		this.takenAt = requireNonNull(takenAt);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{connectionCount=%s, userCount=%s, roomCount=%s, terminalSessionCount=%s, pluginCount=%s, ptyAvailable=%s, takenAt=%s}",
				getClass().getSimpleName(), getConnectionCount(), getUserCount(), getRoomCount(), getTerminalSessionCount(),
				getPluginCount(), isPtyAvailable(), getTakenAt());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RealtimeStatistics realtimeStatistics))
			return false;

		return Objects.equals(getConnectionCount(), realtimeStatistics.getConnectionCount())
				&& Objects.equals(getUserCount(), realtimeStatistics.getUserCount())
				&& Objects.equals(getRoomCount(), realtimeStatistics.getRoomCount())
				&& Objects.equals(getTerminalSessionCount(), realtimeStatistics.getTerminalSessionCount())
				&& Objects.equals(getPluginCount(), realtimeStatistics.getPluginCount())
				&& Objects.equals(isPtyAvailable(), realtimeStatistics.isPtyAvailable())
				&& Objects.equals(getTakenAt(), realtimeStatistics.getTakenAt());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getConnectionCount(), getUserCount(), getRoomCount(), getTerminalSessionCount(), getPluginCount(),
				isPtyAvailable(), getTakenAt());
	}

	@NonNull
	public Integer getConnectionCount() {
		return this.connectionCount;
	}

	/**
	 * Distinct authenticated users with at least one live connection.
	 *
	 * @return the user count
	 */
	@NonNull
	public Integer getUserCount() {
		return this.userCount;
	}

	@NonNull
	public Integer getRoomCount() {
		return this.roomCount;
	}

	@NonNull
	public Integer getTerminalSessionCount() {
		return this.terminalSessionCount;
	}

	@NonNull
	public Integer getPluginCount() {
		return this.pluginCount;
	}

	@NonNull
	public Boolean isPtyAvailable() {
		return this.ptyAvailable;
	}

	@NonNull
	public Instant getTakenAt() {
		return this.takenAt;
	}
}
