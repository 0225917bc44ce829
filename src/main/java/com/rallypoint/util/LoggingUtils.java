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


package com.rallypoint.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Handler;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Reconfigures Logback from a file on disk and routes {@code java.util.logging} through SLF4J.
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	public enum LogbackOption {
		/**
		 * Print Logback's own status messages if configuration produced errors or warnings.
		 */
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Replaces the current Logback configuration with the contents of {@code logbackConfigurationFile}.
	 *
	 * @param logbackConfigurationFile a Logback XML configuration file
	 * @param logbackOptions           optional behavior switches
	 * @throws IllegalArgumentException if the file does not exist or is not a regular file
	 * @throws IllegalStateException    if Logback rejects the configuration
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		Set<LogbackOption> logbackOptionsAsSet = logbackOptions == null || logbackOptions.length == 0
				? Set.of() : EnumSet.copyOf(Arrays.asList(logbackOptions));

		synchronized (LOCK) {
			if (!Files.exists(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. Could not find a configuration file at %s",
						logbackConfigurationFile.toAbsolutePath()));

			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format(
						"Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
						logbackConfigurationFile.toAbsolutePath()));

			uninstallJulBridge();

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
			} catch (JoranException e) {
				throw new IllegalStateException(format("Unable to configure Logback logging from %s", logbackConfigurationFile.toAbsolutePath()), e);
			}

			if (logbackOptionsAsSet.contains(LogbackOption.DEBUGGING_ENABLED))
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			installJulBridge();
		}
	}

	/**
	 * Sends all {@code java.util.logging} output to SLF4J, removing any handlers already on the JUL root logger.
	 */
	public static void installJulBridge() {
		synchronized (LOCK) {
			java.util.logging.Logger rootLogger = getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers())
				rootLogger.removeHandler(handler);

			if (!SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.install();
		}
	}

	public static void uninstallJulBridge() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}
}
