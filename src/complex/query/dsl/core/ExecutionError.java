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

/**
 * The datastore rejected or failed to run an emitted query.
 */
public class ExecutionError extends ComplexException{

	private static final long serialVersionUID = -5521489134617724509L;

	private final String code;

	public ExecutionError(final String message){
		this(message, null, null);
	}

	public ExecutionError(final String message, final String code, final Throwable cause){
		super(message, cause);
		this.code = code;
	}

	/**
	 * @return the datastore's native error code or null
	 */
	public String getCode(){
		return code;
	}
}
