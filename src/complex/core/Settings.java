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

package complex.core;

import java.io.File;

public class Settings{

	public static final String keyConfigDirectory = "complex.config.directory";

	private static final String defaultConfigDirectory = "cfg";

	public static String getConfigDirectoryPath(){
		final String path = System.getProperty(keyConfigDirectory);
		if(path == null || path.trim().isEmpty()){
			return defaultConfigDirectory;
		}
		return path.trim();
	}

	public static String getPathRelativeToConfigDirectory(final String path){
		return new File(getConfigDirectoryPath(), path).getPath();
	}

	/**
	 * @return 'cfg/&lt;fully qualified class name&gt;.config' relative to the config directory
	 */
	public static String getDefaultConfigFilePath(final Class<?> forClass){
		return getPathRelativeToConfigDirectory(forClass.getName() + ".config");
	}
}
