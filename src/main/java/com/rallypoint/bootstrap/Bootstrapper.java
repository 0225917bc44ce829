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

package com.rallypoint.bootstrap;

import com.rallypoint.PrincipalResolver;
import com.rallypoint.Rallypoint;
import com.rallypoint.RallypointConfig;
import com.rallypoint.RealtimeServer;
import com.rallypoint.plugin.PostPlugin;
import com.rallypoint.util.LoggingUtils;
import com.rallypoint.util.PropertiesFileReader;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Command-line entry point.
 * <p>
 * Usage: {@code java -jar rallypoint.jar [path/to/rallypoint.properties]}.  Without an argument, the
 * {@code rallypoint.properties} classpath resource is used.
 */
public class Bootstrapper {
	@NonNull
	public static final String DEFAULT_PROPERTIES_RESOURCE_NAME = "rallypoint.properties";
	@NonNull
	public static final Integer DEFAULT_PORT = 8081;

	public static void main(String[] args) throws InterruptedException {
		PropertiesFileReader propertiesFileReader = args.length > 0
				? PropertiesFileReader.fromPath(Paths.get(args[0]))
				: PropertiesFileReader.fromClasspathResource(DEFAULT_PROPERTIES_RESOURCE_NAME);

		new Bootstrapper().run(propertiesFileReader);
	}

	public void run(@NonNull PropertiesFileReader propertiesFileReader) throws InterruptedException {
		requireNonNull(propertiesFileReader);

		Path logbackConfiguration = propertiesFileReader.optionalValueFor("rallypoint.logbackConfiguration", Path.class).orElse(null);

		if (logbackConfiguration != null)
			LoggingUtils.initializeLogback(logbackConfiguration);
		else
			LoggingUtils.installJulBridge();

		Logger logger = LoggerFactory.getLogger(Bootstrapper.class);

		try (Rallypoint rallypoint = Rallypoint.withConfig(createRallypointConfig(propertiesFileReader))) {
			rallypoint.start();
			logger.info("Rallypoint is listening on port {}", rallypoint.getRallypointConfig().getRealtimeServer().getPort());
			rallypoint.awaitShutdown();
		}
	}

	/**
	 * Builds configuration from the {@code rallypoint.*} properties.
	 *
	 * @param propertiesFileReader source of property values
	 * @return the configuration
	 */
	@NonNull
	public RallypointConfig createRallypointConfig(@NonNull PropertiesFileReader propertiesFileReader) {
		requireNonNull(propertiesFileReader);

		Integer port = propertiesFileReader.optionalValueFor("rallypoint.port", Integer.class).orElse(DEFAULT_PORT);
		String host = propertiesFileReader.optionalValueFor("rallypoint.host", String.class).orElse(null);
		String jwtSecret = propertiesFileReader.optionalValueFor("rallypoint.jwtSecret", String.class).orElse(null);
		Duration idleTimeout = propertiesFileReader.optionalValueFor("rallypoint.terminal.idleTimeoutSeconds", Duration.class).orElse(null);
		Duration sweepInterval = propertiesFileReader.optionalValueFor("rallypoint.terminal.sweepIntervalSeconds", Duration.class).orElse(null);

		RealtimeServer realtimeServer = RealtimeServer.withPort(port)
				.host(host)
				.build();

		return RallypointConfig.withRealtimeServer(realtimeServer)
				.principalResolver(jwtSecret == null ? PrincipalResolver.anonymousOnly() : PrincipalResolver.withHmacSecret(jwtSecret))
				.plugins(List.of(new PostPlugin()))
				.terminalIdleTimeout(idleTimeout)
				.terminalSweepInterval(sweepInterval)
				.build();
	}
}
