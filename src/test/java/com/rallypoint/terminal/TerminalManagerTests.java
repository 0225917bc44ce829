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

import com.rallypoint.LifecycleObserver;
import com.rallypoint.LogEvent;
import com.rallypoint.LogEventType;
import com.rallypoint.TestSupport;
import com.rallypoint.TestSupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

@ThreadSafe
public class TerminalManagerTests {
	private static final Path HOME_DIRECTORY = Paths.get("/home/tester");

	private final RecordingObserver lifecycleObserver = new RecordingObserver();
	private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
	private TerminalManager terminalManager;

	@AfterEach
	public void tearDown() {
		if (this.terminalManager != null)
			this.terminalManager.close();
	}

	@Test
	public void fallsBackToSimulatedTerminalWhenPtyIsUnavailable() {
		this.terminalManager = simulatedTerminalManager();

		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().ownerUserId(3L).build());

		Assertions.assertFalse(this.terminalManager.isPtyAvailable());
		Assertions.assertTrue(terminalInfo.isSimulated());
		Assertions.assertEquals(TerminalStatus.RUNNING, terminalInfo.getStatus());
		Assertions.assertEquals(TerminalCreateOptions.DEFAULT_COLUMNS, terminalInfo.getColumns());
		Assertions.assertEquals(TerminalCreateOptions.DEFAULT_ROWS, terminalInfo.getRows());
		Assertions.assertEquals("/bin/zsh", terminalInfo.getShell());
		Assertions.assertTrue(terminalInfo.getPid().isEmpty());
		Assertions.assertTrue(this.terminalManager.welcomeMessage(terminalInfo.getId()).orElseThrow().contains("tester@localhost:tester$ "));
		Assertions.assertEquals(List.of(terminalInfo), this.lifecycleObserver.created);
	}

	@Test
	public void fallsBackWhenSpawnFails() {
		PtyLauncher failingLauncher = new PtyLauncher() {
			@Override
			public boolean isAvailable() {
				return true;
			}

			@Override
			public PseudoTerminal launch(String shell, int columns, int rows, Path workingDirectory, Map<String, String> environment) throws IOException {
				throw new IOException("No such file: " + shell);
			}
		};

		this.terminalManager = terminalManagerBuilder().ptyLauncher(failingLauncher).build();

		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().shell("/bin/missing").build());

		Assertions.assertTrue(this.terminalManager.isPtyAvailable());
		Assertions.assertTrue(terminalInfo.isSimulated());
		Assertions.assertEquals("/bin/missing", terminalInfo.getShell());
		Assertions.assertEquals(1, this.lifecycleObserver.logEventsOfType(LogEventType.TERMINAL_PTY_UNAVAILABLE).size());
	}

	@Test
	public void simulatedInputProducesShellOutput() {
		this.terminalManager = simulatedTerminalManager();
		StringBuilder output = new StringBuilder();

		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults()
				.outputListener((terminalId, data) -> output.append(data))
				.build());

		Assertions.assertTrue(this.terminalManager.write(terminalInfo.getId(), "pwd\r"));
		Assertions.assertTrue(output.toString().contains(HOME_DIRECTORY.toString()), output.toString());

		output.setLength(0);
		this.terminalManager.write(terminalInfo.getId(), "echo hello\r");
		Assertions.assertTrue(output.toString().startsWith("echo hello\r\nhello\r\n"), output.toString());

		output.setLength(0);
		this.terminalManager.write(terminalInfo.getId(), "nosuchcmd\r");
		Assertions.assertTrue(output.toString().contains("bash: nosuchcmd: command not found"), output.toString());
	}

	@Test
	public void unknownSessionsAreReportedWithoutExceptions() {
		this.terminalManager = simulatedTerminalManager();

		Assertions.assertFalse(this.terminalManager.write("missing", "ls\r"));
		Assertions.assertFalse(this.terminalManager.resize("missing", 100, 40));
		Assertions.assertFalse(this.terminalManager.destroy("missing"));
		Assertions.assertFalse(this.terminalManager.destroy("missing"));
		Assertions.assertTrue(this.terminalManager.get("missing").isEmpty());
		Assertions.assertTrue(this.terminalManager.welcomeMessage("missing").isEmpty());
	}

	@Test
	public void destroyIsIdempotent() {
		this.terminalManager = simulatedTerminalManager();
		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		Assertions.assertTrue(this.terminalManager.destroy(terminalInfo.getId()));
		Assertions.assertFalse(this.terminalManager.destroy(terminalInfo.getId()));
		Assertions.assertFalse(this.terminalManager.destroy(terminalInfo.getId()));

		Assertions.assertTrue(this.terminalManager.get(terminalInfo.getId()).isEmpty());
		Assertions.assertEquals(1, this.lifecycleObserver.destroyed.size());
		Assertions.assertEquals(TerminalStatus.STOPPED, this.lifecycleObserver.destroyed.get(0).getStatus());
	}

	@Test
	public void resizeUpdatesGeometry() {
		this.terminalManager = simulatedTerminalManager();
		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		Assertions.assertTrue(this.terminalManager.resize(terminalInfo.getId(), 132, 43));
		Assertions.assertFalse(this.terminalManager.resize(terminalInfo.getId(), 0, 43));
		Assertions.assertFalse(this.terminalManager.resize(terminalInfo.getId(), 132, -1));

		TerminalInfo resized = this.terminalManager.get(terminalInfo.getId()).orElseThrow();
		Assertions.assertEquals(132, resized.getColumns());
		Assertions.assertEquals(43, resized.getRows());
	}

	@Test
	public void sweepKeepsSessionsIdleForExactlyTheThreshold() {
		this.terminalManager = simulatedTerminalManager();

		TerminalInfo stale = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());
		TerminalInfo active = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		this.clock.advance(Duration.ofMinutes(10));
		this.terminalManager.write(active.getId(), "l");

		this.clock.advance(Duration.ofMinutes(20));
		Assertions.assertEquals(0, this.terminalManager.sweepIdle(Duration.ofMinutes(30)), "Idle for exactly the threshold is kept");

		this.clock.advance(Duration.ofSeconds(1));
		Assertions.assertEquals(1, this.terminalManager.sweepIdle(Duration.ofMinutes(30)));

		Assertions.assertTrue(this.terminalManager.get(stale.getId()).isEmpty());
		Assertions.assertTrue(this.terminalManager.get(active.getId()).isPresent());
	}

	@Test
	public void queriesFilterByOwner() {
		this.terminalManager = simulatedTerminalManager();

		TerminalInfo first = this.terminalManager.create(TerminalCreateOptions.withDefaults().ownerUserId(1L).ownerName("Ada").build());
		TerminalInfo second = this.terminalManager.create(TerminalCreateOptions.withDefaults().ownerUserId(1L).build());
		TerminalInfo unowned = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		Assertions.assertEquals(List.of(first, second), this.terminalManager.forUser(1L));
		Assertions.assertEquals(List.of(), this.terminalManager.forUser(2L));
		Assertions.assertEquals(3, this.terminalManager.all().size());
		Assertions.assertEquals(3, this.terminalManager.countSessions());
		Assertions.assertEquals("Ada", first.getOwnerName().orElse(null));
		Assertions.assertTrue(unowned.getOwnerUserId().isEmpty());
	}

	@Test
	public void identifiersAreUniqueHex() {
		this.terminalManager = simulatedTerminalManager();
		Set<String> terminalIds = new HashSet<>();

		for (int i = 0; i < 50; ++i) {
			TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());
			Assertions.assertTrue(terminalInfo.getId().matches("[0-9a-f]{32}"), terminalInfo.getId());
			terminalIds.add(terminalInfo.getId());
			this.terminalManager.destroy(terminalInfo.getId());
		}

		Assertions.assertEquals(50, terminalIds.size());
	}

	@Test
	public void liveIdentifiersAreDistinct() {
		this.terminalManager = simulatedTerminalManager();
		Set<String> terminalIds = new HashSet<>();

		for (int i = 0; i < 40; ++i)
			terminalIds.add(this.terminalManager.create(TerminalCreateOptions.withDefaults().build()).getId());

		Assertions.assertEquals(40, terminalIds.size());
		Assertions.assertEquals(40, this.terminalManager.countSessions());
		Assertions.assertEquals(40, this.terminalManager.destroyAll());
		Assertions.assertEquals(0, this.terminalManager.countSessions());
	}

	@Test
	public void invalidGeometryIsRejectedUpFront() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> TerminalCreateOptions.withDefaults().columns(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> TerminalCreateOptions.withDefaults().rows(-3).build());
	}

	@Test
	public void closeDestroysEverySession() {
		this.terminalManager = simulatedTerminalManager();
		this.terminalManager.create(TerminalCreateOptions.withDefaults().build());
		this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		this.terminalManager.close();

		Assertions.assertEquals(0, this.terminalManager.countSessions());
		Assertions.assertEquals(2, this.lifecycleObserver.destroyed.size());
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void ptyBackedSessionRelaysInputOutputAndExit() throws Exception {
		FakePseudoTerminal fakePseudoTerminal = new FakePseudoTerminal();
		this.terminalManager = terminalManagerBuilder().ptyLauncher(new FakePtyLauncher(fakePseudoTerminal)).build();

		BlockingQueue<String> output = new LinkedBlockingQueue<>();
		CountDownLatch exited = new CountDownLatch(1);

		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults()
				.columns(100)
				.rows(30)
				.outputListener(new TerminalOutputListener() {
					@Override
					public void didReceiveOutput(String terminalId, String data) {
						output.add(data);
					}

					@Override
					public void didExit(String terminalId, Integer exitCode) {
						exited.countDown();
					}
				})
				.build());

		Assertions.assertFalse(terminalInfo.isSimulated());
		Assertions.assertEquals(Optional.of(4242L), terminalInfo.getPid());
		Assertions.assertTrue(this.terminalManager.welcomeMessage(terminalInfo.getId()).isEmpty());

		Assertions.assertTrue(this.terminalManager.write(terminalInfo.getId(), "ls -la\r"));
		Assertions.assertEquals("ls -la\r", fakePseudoTerminal.writtenInput());

		Assertions.assertTrue(this.terminalManager.resize(terminalInfo.getId(), 120, 50));
		Assertions.assertEquals("120x50", fakePseudoTerminal.geometry);

		fakePseudoTerminal.emitOutput("total 0\r\n");
		Assertions.assertEquals("total 0\r\n", output.poll(5, TimeUnit.SECONDS));

		fakePseudoTerminal.exit(3);

		Assertions.assertTrue(exited.await(5, TimeUnit.SECONDS));
		Assertions.assertEquals("\r\n[Process completed with exit code 3]\r\n", output.poll(5, TimeUnit.SECONDS));
		Assertions.assertTrue(TestSupport.awaitCondition(() -> this.terminalManager.get(terminalInfo.getId()).isEmpty(), Duration.ofSeconds(5)));
	}

	@Test
	@Timeout(value = 10, unit = TimeUnit.SECONDS)
	public void destroyKillsPtyProcess() {
		FakePseudoTerminal fakePseudoTerminal = new FakePseudoTerminal();
		this.terminalManager = terminalManagerBuilder().ptyLauncher(new FakePtyLauncher(fakePseudoTerminal)).build();

		TerminalInfo terminalInfo = this.terminalManager.create(TerminalCreateOptions.withDefaults().build());

		Assertions.assertTrue(this.terminalManager.destroy(terminalInfo.getId()));
		Assertions.assertTrue(fakePseudoTerminal.destroyed);
		Assertions.assertFalse(this.terminalManager.destroy(terminalInfo.getId()));
	}

	@Test
	public void defaultsComeFromEnvironment() {
		Assertions.assertEquals(Paths.get("/home/ada"), TerminalManager.defaultHomeDirectory(Map.of("HOME", "/home/ada")));

		if (!System.getProperty("os.name", "").toLowerCase().startsWith("windows")) {
			Assertions.assertEquals("/usr/bin/fish", TerminalManager.defaultShell(Map.of("SHELL", "/usr/bin/fish")));
			Assertions.assertEquals("/bin/bash", TerminalManager.defaultShell(Map.of()));
		}
	}

	private TerminalManager simulatedTerminalManager() {
		return terminalManagerBuilder().ptyLauncher(PtyLauncher.unavailable()).build();
	}

	private TerminalManager.Builder terminalManagerBuilder() {
		return TerminalManager.withDefaults()
				.clock(this.clock)
				.homeDirectory(HOME_DIRECTORY)
				.environment(Map.of("USER", "tester"))
				.defaultShell("/bin/zsh")
				.lifecycleObserver(this.lifecycleObserver);
	}

	private static final class RecordingObserver implements LifecycleObserver {
		private final List<TerminalInfo> created = new CopyOnWriteArrayList<>();
		private final List<TerminalInfo> destroyed = new CopyOnWriteArrayList<>();
		private final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();

		@Override
		public void didCreateTerminalSession(TerminalInfo terminalInfo) {
			this.created.add(terminalInfo);
		}

		@Override
		public void didDestroyTerminalSession(TerminalInfo terminalInfo) {
			this.destroyed.add(terminalInfo);
		}

		@Override
		public void didReceiveLogEvent(LogEvent logEvent) {
			this.logEvents.add(logEvent);
		}

		private List<LogEvent> logEventsOfType(LogEventType logEventType) {
			return this.logEvents.stream().filter(logEvent -> logEvent.getLogEventType() == logEventType).toList();
		}
	}

	private static final class FakePtyLauncher implements PtyLauncher {
		private final FakePseudoTerminal fakePseudoTerminal;

		private FakePtyLauncher(FakePseudoTerminal fakePseudoTerminal) {
			this.fakePseudoTerminal = fakePseudoTerminal;
		}

		@Override
		public boolean isAvailable() {
			return true;
		}

		@Override
		public PseudoTerminal launch(String shell, int columns, int rows, Path workingDirectory, Map<String, String> environment) {
			this.fakePseudoTerminal.geometry = columns + "x" + rows;
			return this.fakePseudoTerminal;
		}
	}

	// Process output arrives in whole chunks; an empty chunk marks end of stream
	private static final class FakePseudoTerminal implements PseudoTerminal {
		private static final byte[] END_OF_STREAM = new byte[0];

		private final BlockingQueue<byte[]> processOutput = new LinkedBlockingQueue<>();
		private final ByteArrayOutputStream processInput = new ByteArrayOutputStream();
		private final CountDownLatch exitLatch = new CountDownLatch(1);
		private volatile int exitCode;
		private volatile String geometry;
		private volatile boolean destroyed;

		private final InputStream inputStream = new InputStream() {
			private byte[] chunk = new byte[0];
			private int position;

			@Override
			public int read() throws IOException {
				byte[] single = new byte[1];
				return read(single, 0, 1) == -1 ? -1 : single[0] & 0xFF;
			}

			@Override
			public synchronized int read(byte[] buffer, int offset, int length) throws IOException {
				if (length == 0)
					return 0;

				if (this.position == this.chunk.length) {
					try {
						byte[] next = processOutput.take();

						if (next == END_OF_STREAM) {
							processOutput.add(END_OF_STREAM);
							return -1;
						}

						this.chunk = next;
						this.position = 0;
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						throw new IOException(e);
					}
				}

				int count = Math.min(length, this.chunk.length - this.position);
				System.arraycopy(this.chunk, this.position, buffer, offset, count);
				this.position += count;
				return count;
			}

			@Override
			public synchronized int available() {
				return this.chunk.length - this.position;
			}
		};

		void emitOutput(String output) {
			this.processOutput.add(output.getBytes(StandardCharsets.UTF_8));
		}

		void exit(int exitCode) {
			this.exitCode = exitCode;
			this.exitLatch.countDown();
			this.processOutput.add(END_OF_STREAM);
		}

		String writtenInput() {
			synchronized (this.processInput) {
				return this.processInput.toString(StandardCharsets.UTF_8);
			}
		}

		@Override
		public InputStream getInputStream() {
			return this.inputStream;
		}

		@Override
		public OutputStream getOutputStream() {
			return this.processInput;
		}

		@Override
		public void resize(int columns, int rows) {
			this.geometry = columns + "x" + rows;
		}

		@Override
		public int waitFor() throws InterruptedException {
			this.exitLatch.await();
			return this.exitCode;
		}

		@Override
		public boolean isAlive() {
			return this.exitLatch.getCount() > 0;
		}

		@Override
		public void destroy() {
			this.destroyed = true;
			exit(137);
		}

		@Override
		public Optional<Long> getPid() {
			return Optional.of(4242L);
		}
	}
}
