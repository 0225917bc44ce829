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
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z})+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z})+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Creates an executor which runs each task on a new, named daemon platform thread.
	 * <p>
	 * Thread names look like {@code "<threadNamePrefix>1"}, {@code "<threadNamePrefix>2"}, ...
	 *
	 * @param threadNamePrefix         prefix for names of threads created by the executor
	 * @param uncaughtExceptionHandler handler for exceptions that escape a task
	 * @return a thread-per-task executor service
	 */
	@NonNull
	static ExecutorService createThreadPerTaskExecutor(@NonNull String threadNamePrefix,
																										 @NonNull UncaughtExceptionHandler uncaughtExceptionHandler) {
		requireNonNull(threadNamePrefix);
		requireNonNull(uncaughtExceptionHandler);

		AtomicLong threadCounter = new AtomicLong(1L);

		ThreadFactory threadFactory = (runnable) -> {
			Thread thread = new Thread(runnable, format("%s%d", threadNamePrefix, threadCounter.getAndIncrement()));
			thread.setDaemon(true);
			thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
			return thread;
		};

		return Executors.newCachedThreadPool(threadFactory);
	}

	/**
	 * Renders bytes as lowercase hexadecimal, two characters per byte.
	 *
	 * @param bytes the bytes to render
	 * @return the hex representation
	 */
	@NonNull
	public static String toHexString(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return HexFormat.of().formatHex(bytes);
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string.trim()).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("").trim();
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Aggressively trims Unicode whitespace from the given string and returns {@code ""} if the input is {@code null}.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed string (never {@code null})
	 */
	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}
}
