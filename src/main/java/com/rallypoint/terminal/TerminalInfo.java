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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable point-in-time projection of a terminal session.
 */
@ThreadSafe
public final class TerminalInfo {
	@NonNull
	private final String id;
	@Nullable
	private final Long ownerUserId;
	@Nullable
	private final String ownerName;
	@NonNull
	private final String shell;
	@NonNull
	private final Integer columns;
	@NonNull
	private final Integer rows;
	@NonNull
	private final TerminalStatus status;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final Instant lastActivityAt;
	@NonNull
	private final Boolean simulated;
	@Nullable
	private final Long pid;

	TerminalInfo(@NonNull String id,
							 @Nullable Long ownerUserId,
							 @Nullable String ownerName,
							 @NonNull String shell,
							 @NonNull Integer columns,
							 @NonNull Integer rows,
							 @NonNull TerminalStatus status,
							 @NonNull Instant createdAt,
							 @NonNull Instant lastActivityAt,
							 @NonNull Boolean simulated,
							 @Nullable Long pid) {
		requireNonNull(id);
		requireNonNull(shell);
		requireNonNull(columns);
		requireNonNull(rows);
		requireNonNull(status);
		requireNonNull(createdAt);
		requireNonNull(lastActivityAt);
		requireNonNull(simulated);

		this.id = id;
		this.ownerUserId = ownerUserId;
		this.ownerName = ownerName;
		this.shell = shell;
		this.columns = columns;
		this.rows = rows;
		this.status = status;
		this.createdAt = createdAt;
		this.lastActivityAt = lastActivityAt;
		this.simulated = simulated;
		this.pid = pid;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, ownerUserId=%s, shell=%s, columns=%s, rows=%s, status=%s, simulated=%s}", getClass().getSimpleName(),
				getId(), getOwnerUserId().orElse(null), getShell(), getColumns(), getRows(), getStatus(), isSimulated());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TerminalInfo terminalInfo))
			return false;

		return Objects.equals(getId(), terminalInfo.getId())
				&& Objects.equals(getOwnerUserId(), terminalInfo.getOwnerUserId())
				&& Objects.equals(getOwnerName(), terminalInfo.getOwnerName())
				&& Objects.equals(getShell(), terminalInfo.getShell())
				&& Objects.equals(getColumns(), terminalInfo.getColumns())
				&& Objects.equals(getRows(), terminalInfo.getRows())
				&& Objects.equals(getStatus(), terminalInfo.getStatus())
				&& Objects.equals(getCreatedAt(), terminalInfo.getCreatedAt())
				&& Objects.equals(getLastActivityAt(), terminalInfo.getLastActivityAt())
				&& Objects.equals(isSimulated(), terminalInfo.isSimulated())
				&& Objects.equals(getPid(), terminalInfo.getPid());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getOwnerUserId(), getOwnerName(), getShell(), getColumns(), getRows(), getStatus(),
				getCreatedAt(), getLastActivityAt(), isSimulated(), getPid());
	}

	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public Optional<Long> getOwnerUserId() {
		return Optional.ofNullable(this.ownerUserId);
	}

	@NonNull
	public Optional<String> getOwnerName() {
		return Optional.ofNullable(this.ownerName);
	}

	@NonNull
	public String getShell() {
		return this.shell;
	}

	@NonNull
	public Integer getColumns() {
		return this.columns;
	}

	@NonNull
	public Integer getRows() {
		return this.rows;
	}

	@NonNull
	public TerminalStatus getStatus() {
		return this.status;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	public Instant getLastActivityAt() {
		return this.lastActivityAt;
	}

	/**
	 * Whether this session is backed by the built-in command simulator rather than a real pseudo-terminal.
	 *
	 * @return {@code true} if simulated
	 */
	@NonNull
	public Boolean isSimulated() {
		return this.simulated;
	}

	/**
	 * Operating system process ID of the shell, if the session is real and the platform reports one.
	 *
	 * @return the process ID, or {@link Optional#empty()}
	 */
	@NonNull
	public Optional<Long> getPid() {
		return Optional.ofNullable(this.pid);
	}
}
