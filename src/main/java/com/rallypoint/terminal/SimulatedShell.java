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

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Line-editing command simulator used when no real pseudo-terminal is available.
 * <p>
 * The vocabulary is fixed: {@code pwd}, {@code ls}, {@code whoami}, {@code date}, {@code echo}, {@code clear},
 * {@code help} and {@code exit}.  Anything else yields a {@code command not found} line.
 * <p>
 * Callers serialize access; {@link TerminalManager} does so per session.
 */
@NotThreadSafe
public final class SimulatedShell {
	@NonNull
	private static final String LS_OUTPUT;
	@NonNull
	private static final String HELP_OUTPUT;
	@NonNull
	private static final String CLEAR_SCREEN;
	@NonNull
	private static final String BACKSPACE_ERASE;
	@NonNull
	private static final DateTimeFormatter DATE_FORMATTER;

	static {
		LS_OUTPUT = "\r\nDocuments  Downloads  Desktop  Pictures  Music  Videos\r\n";
		HELP_OUTPUT = "\r\nAvailable commands: pwd, ls, whoami, date, echo, clear, help, exit\r\n";
		CLEAR_SCREEN = "\u001b[2J\u001b[H";
		BACKSPACE_ERASE = "\b \b";
		DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE MMM dd yyyy HH:mm:ss 'GMT'xx (zzzz)", Locale.US);
	}

	@NonNull
	private final Clock clock;
	@NonNull
	private final Map<@NonNull String, @NonNull String> environment;
	@NonNull
	private final StringBuilder pendingLine;
	@NonNull
	private final List<@NonNull String> history;
	@NonNull
	private final Path currentDirectory;
	private long commandCount;

	public SimulatedShell(@NonNull Path currentDirectory,
												@NonNull Map<@NonNull String, @NonNull String> environment,
												@NonNull Clock clock) {
		requireNonNull(currentDirectory);
		requireNonNull(environment);
		requireNonNull(clock);

		this.currentDirectory = currentDirectory;
		this.environment = new LinkedHashMap<>(environment);
		this.clock = clock;
		this.pendingLine = new StringBuilder();
		this.history = new ArrayList<>();
		this.commandCount = 0L;
	}

	/**
	 * Feeds client keystrokes to the shell, one character at a time.
	 * <p>
	 * CR or LF executes the pending line and appends a fresh prompt; backspace ({@code \b} or DEL) erases the last
	 * pending character; anything else is appended to the pending line and echoed.
	 *
	 * @param input raw client input
	 * @return the output to display, possibly empty
	 */
	@NonNull
	public String handleInput(@NonNull String input) {
		requireNonNull(input);

		StringBuilder output = new StringBuilder();

		for (int i = 0; i < input.length(); ++i) {
			char c = input.charAt(i);

			if (c == '\r' || c == '\n') {
				String line = this.pendingLine.toString();
				this.pendingLine.setLength(0);

				if (line.trim().length() > 0)
					this.history.add(line);

				output.append(executeCommand(line));
				output.append(prompt());
				++this.commandCount;
			} else if (c == '\b' || c == '\u007f') {
				if (this.pendingLine.length() > 0) {
					this.pendingLine.setLength(this.pendingLine.length() - 1);
					output.append(BACKSPACE_ERASE);
				}
			} else {
				this.pendingLine.append(c);
				output.append(c);
			}
		}

		return output.toString();
	}

	/**
	 * Produces the output of a single command line, without a trailing prompt.
	 *
	 * @param line the command line
	 * @return the command's output
	 */
	@NonNull
	public String executeCommand(@NonNull String line) {
		requireNonNull(line);

		String command = line.trim();

		if (command.isEmpty())
			return "\r\n";

		int separatorIndex = command.indexOf(' ');
		String program = separatorIndex == -1 ? command : command.substring(0, separatorIndex);

		switch (program) {
			case "pwd":
				return format("\r\n%s\r\n", this.currentDirectory);
			case "ls":
				return LS_OUTPUT;
			case "whoami":
				return format("\r\n%s\r\n", user());
			case "date":
				return format("\r\n%s\r\n", DATE_FORMATTER.format(ZonedDateTime.now(this.clock)));
			case "echo":
				return format("\r\n%s\r\n", command.length() > 5 ? command.substring(5) : "");
			case "clear":
				return CLEAR_SCREEN;
			case "help":
				return HELP_OUTPUT;
			case "exit":
				return "\r\nSession ended.\r\n";
			default:
				return format("\r\nbash: %s: command not found\r\n", program);
		}
	}

	/**
	 * The shell prompt, {@code user@host:dir$ }.
	 *
	 * @return the prompt
	 */
	@NonNull
	public String prompt() {
		Path fileName = this.currentDirectory.getFileName();
		String directoryName = fileName == null ? this.currentDirectory.toString() : fileName.toString();
		return format("%s@%s:%s$ ", user(), this.environment.getOrDefault("HOSTNAME", "localhost"), directoryName);
	}

	@NonNull
	public String welcomeMessage() {
		return format("Welcome to simulated terminal!\r\nType 'help' for available commands.\r\n\r\n%s", prompt());
	}

	@NonNull
	public Path getCurrentDirectory() {
		return this.currentDirectory;
	}

	@NonNull
	public String getPendingLine() {
		return this.pendingLine.toString();
	}

	/**
	 * Non-blank lines executed so far, oldest first.
	 *
	 * @return the history
	 */
	@NonNull
	public List<@NonNull String> getHistory() {
		return Collections.unmodifiableList(this.history);
	}

	public long getCommandCount() {
		return this.commandCount;
	}

	@NonNull
	private String user() {
		return this.environment.getOrDefault("USER", "user");
	}
}
