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

package complex.query.dsl.core;

import java.util.HashMap;
import java.util.Map;

import complex.utility.FileUtility;
import complex.utility.HelperFunctions;
import complex.utility.Result;

public class InterpreterConfiguration{

	public static final String
		keyEdgeReferences = "edgeReferences",
		keyDebug = "debug";

	/** Emit an edge from an inserted node to each node its fields refer to by alias. */
	public final boolean edgeReferences;
	/** Log the parse tree and every emitted query. */
	public final boolean debug;
	// Keys that were not recognized. Used as a warning.
	public final String extraKeysAndValues;

	public InterpreterConfiguration(final boolean edgeReferences, final boolean debug, final String extraKeysAndValues){
		this.edgeReferences = edgeReferences;
		this.debug = debug;
		this.extraKeysAndValues = extraKeysAndValues;
	}

	private static Result<Boolean> parseOptionalBoolean(final Map<String, String> map, final String key,
			final boolean defaultValue){
		final String valueString = map.remove(key);
		if(HelperFunctions.isNullOrEmpty(valueString)){
			return Result.successful(defaultValue);
		}
		final Result<Boolean> result = HelperFunctions.parseBoolean(valueString);
		if(result.error){
			return Result.failed("Invalid boolean value for key '" + key + "'", result);
		}
		return result;
	}

	/**
	 * Values in the arguments override the ones in the config file.
	 * 
	 * @param arguments 'key=value' pairs separated by spaces. May be null or empty.
	 * @param configFilePath May be null or point to a missing file.
	 * @return The result object containing the successful object or an error object
	 */
	public static Result<InterpreterConfiguration> initialize(final String arguments, final String configFilePath){
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

		final Result<Boolean> edgeReferencesResult = parseOptionalBoolean(map, keyEdgeReferences, true);
		if(edgeReferencesResult.error){
			return Result.failed(edgeReferencesResult.errorMessage, edgeReferencesResult.cause);
		}
		final Result<Boolean> debugResult = parseOptionalBoolean(map, keyDebug, false);
		if(debugResult.error){
			return Result.failed(debugResult.errorMessage, debugResult.cause);
		}

		return Result.successful(new InterpreterConfiguration(edgeReferencesResult.result, debugResult.result, map.toString()));
	}

	@Override
	public String toString(){
		return "InterpreterConfiguration [" + keyEdgeReferences + "=" + edgeReferences + ", " + keyDebug + "=" + debug
				+ ", extraKeysAndValues=" + extraKeysAndValues + "]";
	}
}
