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
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;

/**
 * {@link IdGenerator} for connection identifiers: a per-process sequence number behind a best-effort host prefix,
 * e.g. {@code "conn-10.0.0.4-17"}.
 */
@ThreadSafe
final class DefaultIdGenerator implements IdGenerator {
	@NonNull
	private static final String DEFAULT_ID_PREFIX;

	static {
		String idPrefix = "conn-";

		try {
			String hostAddress = InetAddress.getLocalHost().getHostAddress();

			if (hostAddress != null && hostAddress.trim().length() > 0)
				idPrefix = format("conn-%s-", hostAddress.trim());
		} catch (UnknownHostException | SecurityException ignored) {
			// Fall back to the bare prefix
		}

		DEFAULT_ID_PREFIX = idPrefix;
	}

	@NonNull
	private final AtomicLong sequence;
	@NonNull
	private final String idPrefix;

	@NonNull
	static DefaultIdGenerator withDefaults() {
		return new DefaultIdGenerator(null);
	}

	@NonNull
	static DefaultIdGenerator withPrefix(@Nullable String prefix) {
		return new DefaultIdGenerator(prefix);
	}

	private DefaultIdGenerator(@Nullable String idPrefix) {
		this.idPrefix = idPrefix == null ? DEFAULT_ID_PREFIX : idPrefix;
		this.sequence = new AtomicLong(1L);
	}

	@NonNull
	@Override
	public String generateId() {
		return format("%s%d", getIdPrefix(), getSequence().getAndIncrement());
	}

	@NonNull
	private AtomicLong getSequence() {
		return this.sequence;
	}

	@NonNull
	private String getIdPrefix() {
		return this.idPrefix;
	}
}
