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

import java.io.File;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;

public class FileUtility{

	/**
	 * Path must be valid, exist, be a file, and be readable.
	 */
	public static boolean isFileReadable(final String path){
		final File file = new File(path);
		return file.isFile() && file.canRead();
	}

	/**
	 * Path must be valid, exist, be a file, and be readable.
	 */
	public static List<String> readLines(final String path) throws Exception{
		if(isFileReadable(path)){
			return FileUtils.readLines(new File(path), "UTF-8");
		}else{
			throw new Exception("Not a readable file: '" + path + "'");
		}
	}

	/**
	 * Reads the 'key<separator>value' lines of the file. Empty lines and lines starting with '#' are skipped.
	 * A file that does not exist gives an empty map.
	 */
	public static Map<String, String> readConfigFileAsKeyValueMap(final String filepath, final String keyValueSeparator)
			throws Exception{
		final Map<String, String> map = new HashMap<String, String>();
		if(filepath == null || !new File(filepath).exists()){
			return map;
		}
		final List<String> lines = readLines(filepath);
		int lineNumber = 0;
		for(String line : lines){
			lineNumber++;
			line = line.trim();
			if(!line.isEmpty() && !line.startsWith("#")){
				final String tokens[] = line.split(keyValueSeparator, 2);
				if(tokens.length == 2){
					map.put(tokens[0].trim(), tokens[1].trim());
				}else{
					throw new Exception("Missing '" + keyValueSeparator + "' at line (#" + lineNumber + "): '" + line + "'");
				}
			}
		}
		return map;
	}
}
