/*
 --------------------------------------------------------------------------------
 Complex - Graph schema and data manipulation language.

 This program is free software: you can redistribute it and/or
 modify it under the terms of the GNU General Public License as
 published by the Free Software Foundation, either version 3 of the
 License, or (at your option) any later version.

 This program is distributed in the hope that it will be useful,
 but WITHOUT ANY WARRANTY; without even the implied warranty of
 MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
 General Public License for more details.

 You should have received a copy of the GNU General Public License
 along with this program. If not, see <http://www.gnu.org/licenses/>.
 --------------------------------------------------------------------------------
 */

package complex.storage.neo4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import complex.utility.Result;

class ConfigurationTest{

	@TempDir
	Path directory;

	@Test
	void defaultsApply(){
		final Result<Configuration> result = Configuration.initialize(
				Configuration.keyDbHomeDirectoryPath + "='" + directory + "'", null);
		assertFalse(result.error, result.toErrorString());
		assertEquals(directory.toFile().getAbsolutePath(), result.result.dbHomeDirectoryFile.getAbsolutePath());
		assertEquals("neo4j", result.result.dbName);
		assertEquals(Configuration.defaultTransactionTimeoutInSeconds, result.result.transactionTimeoutInSeconds);
		assertEquals(Configuration.defaultMaxRetries, result.result.maxRetries);
		assertNull(result.result.neo4jConfigFilePath);
		assertFalse(result.result.debug);
	}

	@Test
	void argumentsOverrideFile() throws Exception{
		final Path file = directory.resolve("gateway.config");
		Files.write(file, ("dbms.directories.neo4j_home=" + directory + "\nmaxRetries=9\ndebug=true\n")
				.getBytes(StandardCharsets.UTF_8));
		final Result<Configuration> result = Configuration.initialize("maxRetries=1 transactionTimeoutInSeconds=0",
				file.toString());
		assertFalse(result.error, result.toErrorString());
		assertEquals(1, result.result.maxRetries);
		assertEquals(0, result.result.transactionTimeoutInSeconds);
		assertTrue(result.result.debug);
	}

	@Test
	void homeDirectoryIsRequired(){
		assertTrue(Configuration.initialize("maxRetries=1", null).error);
	}

	@Test
	void invalidValuesFail(){
		final String home = Configuration.keyDbHomeDirectoryPath + "='" + directory + "' ";
		assertTrue(Configuration.initialize(home + "maxRetries=-1", null).error);
		assertTrue(Configuration.initialize(home + "transactionTimeoutInSeconds=soon", null).error);
		assertTrue(Configuration.initialize(home + "debug=maybe", null).error);
		assertTrue(Configuration.initialize(home + "neo4jConfigFilePath=/does/not/exist.conf", null).error);
	}
}
