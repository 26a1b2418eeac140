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

package complex.utility;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.AbstractMap.SimpleEntry;
import java.util.ArrayList;
import java.util.HashMap;

public class HelperFunctions{

	/**
	 * Input: a=b c='d' e="f f"
	 * Output: Map{a=b, c=d, e=f f}
	 * 
	 * If empty string then empty hashmap returned
	 * 
	 * @param str string to parse
	 * @return HashMap in result or error
	 */
	public static Result<HashMap<String, String>> parseKeysValuesInString(final String str){
		final Result<ArrayList<SimpleEntry<String, String>>> entriesResult = parseKeyValueEntriesInString(str);
		if(entriesResult.error){
			return Result.failed(entriesResult.errorMessage, entriesResult.exception, entriesResult.cause);
		}
		final HashMap<String, String> map = new HashMap<String, String>();
		for(final SimpleEntry<String, String> entry : entriesResult.result){
			map.put(entry.getKey(), entry.getValue());
		}
		return Result.successful(map);
	}

	/**
	 * Same as {@link #parseKeysValuesInString(String)} but keeps the order and duplicates of the keys.
	 * 
	 * @param str string to parse
	 * @return List in result or error
	 */
	public static Result<ArrayList<SimpleEntry<String, String>>> parseKeyValueEntriesInString(final String str){
		if(str == null){
			return Result.failed("NULL string to parse keys-values entries from");
		}
		final ArrayList<SimpleEntry<String, String>> entries = new ArrayList<SimpleEntry<String, String>>();
		final String trimmed = str.trim();
		int startFrom = 0;
		while(startFrom < trimmed.length()){
			final int equalsIndex = trimmed.indexOf('=', startFrom);
			if(equalsIndex < 0){
				break;
			}
			final String key = trimmed.substring(startFrom, equalsIndex).trim();
			if(key.isEmpty()){
				return Result.failed("Empty key at index " + equalsIndex + " in str='" + str + "'");
			}
			final int valueStart = equalsIndex + 1;
			if(valueStart >= trimmed.length()){
				entries.add(new SimpleEntry<String, String>(key, ""));
				break;
			}
			final char first = trimmed.charAt(valueStart);
			if(first == '\'' || first == '"'){
				final int valueEnd = trimmed.indexOf(first, valueStart + 1);
				if(valueEnd < 0){
					return Result.failed("No ending quote in str='" + str + "'");
				}
				entries.add(new SimpleEntry<String, String>(key, trimmed.substring(valueStart + 1, valueEnd)));
				startFrom = valueEnd + 1;
			}else{
				int valueEnd = trimmed.indexOf(' ', valueStart);
				if(valueEnd < 0){
					valueEnd = trimmed.length();
				}
				entries.add(new SimpleEntry<String, String>(key, trimmed.substring(valueStart, valueEnd).trim()));
				startFrom = valueEnd;
			}
		}
		return Result.successful(entries);
	}

	/**
	 * Parse string to boolean. Accepts true/false, 1/0, on/off and yes/no in any case.
	 * 
	 * @param str string with value to parse
	 * @return Result with boolean or error
	 */
	public static Result<Boolean> parseBoolean(final String str){
		if(str == null){
			return Result.failed("Not a boolean: NULL");
		}
		switch(str.trim().toLowerCase()){
			case "true":
			case "1":
			case "on":
			case "yes":
				return Result.successful(true);
			case "false":
			case "0":
			case "off":
			case "no":
				return Result.successful(false);
			default:
				return Result.failed("Not a boolean: '" + str + "'");
		}
	}

	/**
	 * Parse string to long within the inclusive range [min, max].
	 */
	public static Result<Long> parseLong(final String str, final long min, final long max){
		if(isNullOrEmpty(str)){
			return Result.failed("Not a number: '" + str + "'");
		}
		final long value;
		try{
			value = Long.parseLong(str.trim());
		}catch(NumberFormatException nfe){
			return Result.failed("Not a number: '" + str + "'", nfe, null);
		}
		if(value < min || value > max){
			return Result.failed("Number '" + value + "' not in range [" + min + ", " + max + "]");
		}
		return Result.successful(value);
	}

	public static boolean isNullOrEmpty(final String str){
		return (str == null || str.trim().isEmpty());
	}

	/**
	 * @param e Exception
	 * @return formatted exception stacktrace string
	 */
	public static String formatExceptionStackTrace(final Exception e){
		if(e == null){
			return "(null)";
		}
		final StringWriter buffer = new StringWriter();
		try(final PrintWriter writer = new PrintWriter(buffer)){
			e.printStackTrace(writer);
		}
		return buffer.toString();
	}
}
