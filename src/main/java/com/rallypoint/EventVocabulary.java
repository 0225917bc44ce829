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
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The merged set of event names declared by every registered plugin.  Documentation only; dispatch does not consult it.
 */
@ThreadSafe
public final class EventVocabulary {
	@NonNull
	private final SortedSet<@NonNull String> inboundEventNames;
	@NonNull
	private final SortedSet<@NonNull String> outboundEventNames;

	EventVocabulary(@NonNull SortedSet<@NonNull String> inboundEventNames,
									@NonNull SortedSet<@NonNull String> outboundEventNames) {
		requireNonNull(inboundEventNames);
		requireNonNull(outboundEventNames);

		this.inboundEventNames = Collections.unmodifiableSortedSet(new TreeSet<>(inboundEventNames));
		this.outboundEventNames = Collections.unmodifiableSortedSet(new TreeSet<>(outboundEventNames));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{inboundEventNames=%s, outboundEventNames=%s}", getClass().getSimpleName(),
				getInboundEventNames(), getOutboundEventNames());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof EventVocabulary eventVocabulary))
			return false;

		return Objects.equals(getInboundEventNames(), eventVocabulary.getInboundEventNames())
				&& Objects.equals(getOutboundEventNames(), eventVocabulary.getOutboundEventNames());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getInboundEventNames(), getOutboundEventNames());
	}

	@NonNull
	public SortedSet<@NonNull String> getInboundEventNames() {
		return this.inboundEventNames;
	}

	@NonNull
	public SortedSet<@NonNull String> getOutboundEventNames() {
		return this.outboundEventNames;
	}
}
