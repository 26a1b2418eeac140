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

import java.io.File;
import java.util.HashMap;
import java.util.Map;

import org.neo4j.configuration.GraphDatabaseSettings;

import complex.utility.FileUtility;
import complex.utility.HelperFunctions;
import complex.utility.Result;

public class Configuration{

	public static final String
		// Database setup
		keyDbHomeDirectoryPath = "dbms.directories.neo4j_home",
		keyDbDataDirectoryName = "database",
		keyDbName = "dbms.default_database",
		keyNeo4jConfigFilePath = "neo4jConfigFilePath",
		// Query execution
		keyTransactionTimeoutInSeconds = "transactionTimeoutInSeconds",
		keyMaxRetries = "maxRetries",
		// Logging
		keyDebug = "debug";

	public static final String defaultDbName = GraphDatabaseSettings.DEFAULT_DATABASE_NAME;
	public static final long defaultTransactionTimeoutInSeconds = 60;
	public static final int defaultMaxRetries = 3;

	// Database setup
	public final File dbHomeDirectoryFile;
	public final String dbDataDirectoryName;
	public final String dbName;
	public final File neo4jConfigFilePath;
	// Query execution. Timeout of 0 means no timeout
	public final long transactionTimeoutInSeconds;
	public final int maxRetries;
	// Logging
	public final boolean debug;
	// The stringified map that was left after removing all valid keys. Used as a warning in case the user uses illegal keys
	public final String extraKeysAndValues;

	public Configuration(
			final File dbHomeDirectoryFile,
			final String dbDataDirectoryName,
			final String dbName,
			final File neo4jConfigFilePath,
			final long transactionTimeoutInSeconds,
			final int maxRetries,
			final boolean debug,
			final String extraKeysAndValues){
		this.dbHomeDirectoryFile = dbHomeDirectoryFile;
		this.dbDataDirectoryName = dbDataDirectoryName;
		this.dbName = dbName;
		this.neo4jConfigFilePath = neo4jConfigFilePath;
		this.transactionTimeoutInSeconds = transactionTimeoutInSeconds;
		this.maxRetries = maxRetries;
		this.debug = debug;
		this.extraKeysAndValues = extraKeysAndValues;
	}

	private final static Result<File> parseOptionalReadableFile(final Map<String, String> map, final String key){
		final String pathString = map.remove(key);
		if(HelperFunctions.isNullOrEmpty(pathString)){
			return Result.successful(null);
		}
		final File file = new File(pathString.trim());
		if(!file.exists()){
			return Result.failed("The path for key '" + key + "' does not exist: '" + file.getAbsolutePath() + "'");
		}
		if(!file.isFile() || !file.canRead()){
			return Result.failed("The path for key '" + key + "' is not a readable file: '" + file.getAbsolutePath() + "'");
		}
		return Result.successful(file);
	}

	private final static Result<File> parseDbHomeDirectoryFile(final Map<String, String> map, final String key){
		final String pathString = map.remove(key);
		if(HelperFunctions.isNullOrEmpty(pathString)){
			return Result.failed("NULL/Empty value for '" + key + "': '" + pathString + "'");
		}
		final File directory = new File(pathString.trim());
		if(directory.exists()){
			if(!directory.isDirectory()){
				return Result.failed("Path for key '" + key + "' exists but is not a directory: '" + directory.getAbsolutePath() + "'");
			}
			if(!directory.canRead() || !directory.canWrite()){
				return Result.failed("Path for key '" + key + "' must be a readable and writable directory: '" + directory.getAbsolutePath() + "'");
			}
		}
		return Result.successful(directory);
	}

	private final static Result<Long> parseOptionalLong(final Map<String, String> map, final String key,
			final long defaultValue, final long min, final long max){
		final String valueString = map.remove(key);
		if(HelperFunctions.isNullOrEmpty(valueString)){
			return Result.successful(defaultValue);
		}
		final Result<Long> result = HelperFunctions.parseLong(valueString, min, max);
		if(result.error){
			return Result.failed("Invalid value for '" + key + "': '" + valueString + "'", result);
		}
		return result;
	}

	/**
	 * @param arguments The arguments string for the gateway. Overrides the config file
	 * @param configFilePath The config file path of the gateway
	 * @return The result object containing the successful object or an error object
	 */
	public final static Result<Configuration> initialize(final String arguments, final String configFilePath){
		// NOTE: Remove keys from map because at the end the map is kept as the extra keys

		final Map<String, String> map = new HashMap<String, String>();
		try{
			map.putAll(FileUtility.readConfigFileAsKeyValueMap(configFilePath, "="));
		}catch(Exception e){
			return Result.failed("Failed to read config file: " + configFilePath, e, null);
		}

		if(!HelperFunctions.isNullOrEmpty(arguments)){
			final Result<HashMap<String, String>> argumentsParseResult = HelperFunctions.parseKeysValuesInString(arguments);
			if(argumentsParseResult.error){
				return Result.failed("Failed to parse arguments", argumentsParseResult);
			}
			map.putAll(argumentsParseResult.result);
		}

		final Result<File> dbHomeDirectoryFileResult = parseDbHomeDirectoryFile(map, keyDbHomeDirectoryPath);
		if(dbHomeDirectoryFileResult.error){
			return Result.failed(dbHomeDirectoryFileResult.errorMessage, dbHomeDirectoryFileResult.exception, dbHomeDirectoryFileResult.cause);
		}

		final String dbNameString = map.remove(keyDbName);
		final String dbName = HelperFunctions.isNullOrEmpty(dbNameString) ? defaultDbName : dbNameString.trim();

		final String dbDataDirectoryNameString = map.remove(keyDbDataDirectoryName);
		final String dbDataDirectoryName = HelperFunctions.isNullOrEmpty(dbDataDirectoryNameString)
				? GraphDatabaseSettings.DEFAULT_DATA_DIR_NAME : dbDataDirectoryNameString.trim();

		final Result<File> neo4jConfigFilePathResult = parseOptionalReadableFile(map, keyNeo4jConfigFilePath);
		if(neo4jConfigFilePathResult.error){
			return Result.failed(neo4jConfigFilePathResult.errorMessage, neo4jConfigFilePathResult.exception, neo4jConfigFilePathResult.cause);
		}

		final Result<Long> transactionTimeoutResult = parseOptionalLong(map, keyTransactionTimeoutInSeconds,
				defaultTransactionTimeoutInSeconds, 0, Integer.MAX_VALUE);
		if(transactionTimeoutResult.error){
			return Result.failed(transactionTimeoutResult.errorMessage, transactionTimeoutResult.cause);
		}

		final Result<Long> maxRetriesResult = parseOptionalLong(map, keyMaxRetries, defaultMaxRetries, 0, Integer.MAX_VALUE);
		if(maxRetriesResult.error){
			return Result.failed(maxRetriesResult.errorMessage, maxRetriesResult.cause);
		}

		final boolean debug;
		final String debugString = map.remove(keyDebug);
		if(HelperFunctions.isNullOrEmpty(debugString)){
			debug = false;
		}else{
			final Result<Boolean> debugResult = HelperFunctions.parseBoolean(debugString);
			if(debugResult.error){
				return Result.failed("Invalid value for '" + keyDebug + "': '" + debugString + "'", debugResult);
			}
			debug = debugResult.result;
		}

		return Result.successful(new Configuration(
				dbHomeDirectoryFileResult.result,
				dbDataDirectoryName,
				dbName,
				neo4jConfigFilePathResult.result,
				transactionTimeoutResult.result,
				maxRetriesResult.result.intValue(),
				debug,
				map.toString()));
	}

	@Override
	public String toString(){
		final String newLine = System.lineSeparator();
		return "Configuration [" + newLine
				+ keyDbHomeDirectoryPath + "=" + dbHomeDirectoryFile.getAbsolutePath() + newLine
				+ ", " + keyDbDataDirectoryName + "=" + dbDataDirectoryName + newLine
				+ ", " + keyDbName + "=" + dbName + newLine
				+ ", " + keyNeo4jConfigFilePath + "=" + neo4jConfigFilePath + newLine
				+ ", " + keyTransactionTimeoutInSeconds + "=" + transactionTimeoutInSeconds + newLine
				+ ", " + keyMaxRetries + "=" + maxRetries + newLine
				+ ", " + keyDebug + "=" + debug + newLine
				+ ", extraKeysAndValues=" + extraKeysAndValues + newLine
				+ "]";
	}
}
