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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Parameters for {@link TerminalManager#create(TerminalCreateOptions)}.
 * <p>
 * Instances can be acquired via the {@link #withDefaults()} builder factory method.
 */
@ThreadSafe
public final class TerminalCreateOptions {
	@NonNull
	public static final Integer DEFAULT_COLUMNS;
	@NonNull
	public static final Integer DEFAULT_ROWS;

	static {
		DEFAULT_COLUMNS = 80;
		DEFAULT_ROWS = 24;
	}

	@NonNull
	private final Integer columns;
	@NonNull
	private final Integer rows;
	@Nullable
	private final String shell;
	@Nullable
	private final Long ownerUserId;
	@Nullable
	private final String ownerName;
	@Nullable
	private final TerminalOutputListener outputListener;

	/**
	 * Acquires a builder seeded with 80 columns, 24 rows and the platform's default shell.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected TerminalCreateOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.columns = builder.columns != null ? builder.columns : DEFAULT_COLUMNS;
		this.rows = builder.rows != null ? builder.rows : DEFAULT_ROWS;
		this.shell = trimAggressivelyToNull(builder.shell);
		this.ownerUserId = builder.ownerUserId;
		this.ownerName = trimAggressivelyToNull(builder.ownerName);
		this.outputListener = builder.outputListener;

		if (this.columns <= 0)
			throw new IllegalArgumentException("Columns must be > 0");

		if (this.rows <= 0)
			throw new IllegalArgumentException("Rows must be > 0");
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, rows=%s, shell=%s, ownerUserId=%s}", getClass().getSimpleName(),
				getColumns(), getRows(), getShell().orElse(null), getOwnerUserId().orElse(null));
	}

	@NonNull
	public Integer getColumns() {
		return this.columns;
	}

	@NonNull
	public Integer getRows() {
		return this.rows;
	}

	/**
	 * The shell to launch, or {@link Optional#empty()} for the platform default.
	 *
	 * @return the shell
	 */
	@NonNull
	public Optional<String> getShell() {
		return Optional.ofNullable(this.shell);
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
	public Optional<TerminalOutputListener> getOutputListener() {
		return Optional.ofNullable(this.outputListener);
	}

	/**
	 * Builder used to construct instances of {@link TerminalCreateOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Integer columns;
		@Nullable
		private Integer rows;
		@Nullable
		private String shell;
		@Nullable
		private Long ownerUserId;
		@Nullable
		private String ownerName;
		@Nullable
		private TerminalOutputListener outputListener;

		protected Builder() {
			// Only vended by TerminalCreateOptions
		}

		@NonNull
		public Builder columns(@Nullable Integer columns) {
			this.columns = columns;
			return this;
		}

		@NonNull
		public Builder rows(@Nullable Integer rows) {
			this.rows = rows;
			return this;
		}

		@NonNull
		public Builder shell(@Nullable String shell) {
			this.shell = shell;
			return this;
		}

		@NonNull
		public Builder ownerUserId(@Nullable Long ownerUserId) {
			this.ownerUserId = ownerUserId;
			return this;
		}

		@NonNull
		public Builder ownerName(@Nullable String ownerName) {
			this.ownerName = ownerName;
			return this;
		}

		@NonNull
		public Builder outputListener(@Nullable TerminalOutputListener outputListener) {
			this.outputListener = outputListener;
			return this;
		}

		@NonNull
		public TerminalCreateOptions build() {
			return new TerminalCreateOptions(this);
		}
	}
}
