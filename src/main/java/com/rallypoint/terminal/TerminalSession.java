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

package com.rallypoint.terminal;

import com.rallypoint.terminal.TerminalBacking.PtyBacking;
import com.rallypoint.terminal.TerminalBacking.SimulatedBacking;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Mutable state of one terminal session.  Geometry, status and activity are only touched under the
 * {@link TerminalManager} lock.
 */
@NotThreadSafe
final class TerminalSession {
	@NonNull
	private final String id;
	@Nullable
	private final Long ownerUserId;
	@Nullable
	private final String ownerName;
	@NonNull
	private final String shell;
	@NonNull
	private final TerminalBacking terminalBacking;
	@Nullable
	private final TerminalOutputListener outputListener;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private Integer columns;
	@NonNull
	private Integer rows;
	@NonNull
	private TerminalStatus status;
	@NonNull
	private Instant lastActivityAt;

	TerminalSession(@NonNull String id,
									@Nullable Long ownerUserId,
									@Nullable String ownerName,
									@NonNull String shell,
									@NonNull Integer columns,
									@NonNull Integer rows,
									@NonNull TerminalBacking terminalBacking,
									@Nullable TerminalOutputListener outputListener,
									@NonNull Instant createdAt) {
		requireNonNull(id);
		requireNonNull(shell);
		requireNonNull(columns);
		requireNonNull(rows);
		requireNonNull(terminalBacking);
		requireNonNull(createdAt);

		this.id = id;
		this.ownerUserId = ownerUserId;
		this.ownerName = ownerName;
		this.shell = shell;
		this.columns = columns;
		this.rows = rows;
		this.terminalBacking = terminalBacking;
		this.outputListener = outputListener;
		this.createdAt = createdAt;
		this.lastActivityAt = createdAt;
		this.status = TerminalStatus.RUNNING;
	}

	@NonNull
	TerminalInfo toTerminalInfo() {
		Long pid = null;

		if (getTerminalBacking() instanceof PtyBacking ptyBacking)
			pid = ptyBacking.pseudoTerminal().getPid().orElse(null);

		return new TerminalInfo(getId(), this.ownerUserId, this.ownerName, getShell(), getColumns(), getRows(), getStatus(),
				getCreatedAt(), getLastActivityAt(), isSimulated(), pid);
	}

	@NonNull
	Boolean isSimulated() {
		return getTerminalBacking() instanceof SimulatedBacking;
	}

	@NonNull
	String getId() {
		return this.id;
	}

	@NonNull
	Optional<Long> getOwnerUserId() {
		return Optional.ofNullable(this.ownerUserId);
	}

	@NonNull
	String getShell() {
		return this.shell;
	}

	@NonNull
	TerminalBacking getTerminalBacking() {
		return this.terminalBacking;
	}

	@NonNull
	Optional<TerminalOutputListener> getOutputListener() {
		return Optional.ofNullable(this.outputListener);
	}

	@NonNull
	Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	Integer getColumns() {
		return this.columns;
	}

	@NonNull
	Integer getRows() {
		return this.rows;
	}

	void setGeometry(@NonNull Integer columns,
									 @NonNull Integer rows) {
		requireNonNull(columns);
		requireNonNull(rows);

		this.columns = columns;
		this.rows = rows;
	}

	@NonNull
	TerminalStatus getStatus() {
		return this.status;
	}

	void setStatus(@NonNull TerminalStatus status) {
		requireNonNull(status);
		this.status = status;
	}

	@NonNull
	Instant getLastActivityAt() {
		return this.lastActivityAt;
	}

	void setLastActivityAt(@NonNull Instant lastActivityAt) {
		requireNonNull(lastActivityAt);
		this.lastActivityAt = lastActivityAt;
	}
}
