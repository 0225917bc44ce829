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

import com.rallypoint.PrincipalResolutionException;
import com.rallypoint.RallypointConfig;
import com.rallypoint.plugin.PostPlugin;
import com.rallypoint.util.PropertiesFileReader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@ThreadSafe
public class BootstrapperTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void bundledPropertiesProduceDefaults() throws PrincipalResolutionException {
		RallypointConfig rallypointConfig = new Bootstrapper()
				.createRallypointConfig(PropertiesFileReader.fromClasspathResource(Bootstrapper.DEFAULT_PROPERTIES_RESOURCE_NAME));

		Assertions.assertEquals(8081, rallypointConfig.getRealtimeServer().getPort());
		Assertions.assertEquals(Duration.ofMinutes(30), rallypointConfig.getTerminalIdleTimeout());
		Assertions.assertEquals(Duration.ofMinutes(5), rallypointConfig.getTerminalSweepInterval());
		Assertions.assertEquals(1, rallypointConfig.getPlugins().size());
		Assertions.assertTrue(rallypointConfig.getPlugins().get(0) instanceof PostPlugin);
		Assertions.assertTrue(rallypointConfig.getPrincipalResolver().resolvePrincipal("any.token.here").isEmpty(),
				"Without a secret every connection is anonymous");
	}

	@Test
	public void propertiesOverrideDefaults() throws IOException {
		Path propertiesFile = this.temporaryDirectory.resolve("rallypoint.properties");
		Files.write(propertiesFile, String.join("\n",
				"rallypoint.port=9191",
				"rallypoint.jwtSecret=s3cret",
				"rallypoint.terminal.idleTimeoutSeconds=60",
				"rallypoint.terminal.sweepIntervalSeconds=15").getBytes(StandardCharsets.UTF_8));

		RallypointConfig rallypointConfig = new Bootstrapper().createRallypointConfig(PropertiesFileReader.fromPath(propertiesFile));

		Assertions.assertEquals(9191, rallypointConfig.getRealtimeServer().getPort());
		Assertions.assertEquals(Duration.ofSeconds(60), rallypointConfig.getTerminalIdleTimeout());
		Assertions.assertEquals(Duration.ofSeconds(15), rallypointConfig.getTerminalSweepInterval());
		Assertions.assertThrows(PrincipalResolutionException.class,
				() -> rallypointConfig.getPrincipalResolver().resolvePrincipal("not-a-token"));
	}

	@Test
	public void portDefaultsWhenAbsent() throws IOException {
		Path propertiesFile = this.temporaryDirectory.resolve("empty.properties");
		Files.write(propertiesFile, new byte[0]);

		RallypointConfig rallypointConfig = new Bootstrapper().createRallypointConfig(PropertiesFileReader.fromPath(propertiesFile));

		Assertions.assertEquals(Bootstrapper.DEFAULT_PORT, rallypointConfig.getRealtimeServer().getPort());
	}
}
