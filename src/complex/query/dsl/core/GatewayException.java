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
 * Failure of a {@link GraphQueryGateway} call, classified so that callers can react without
 * knowing the datastore's own error codes.
 */
public class GatewayException extends Exception{

	private static final long serialVersionUID = -1297635307451094725L;

	public enum Kind{
		/** The datastore is unreachable, unavailable or shut down. */
		CONNECTION,
		/** A schema object (index, constraint, label) being created exists already. */
		ALREADY_EXISTS,
		/** A temporary failure. The same query may succeed if retried. */
		TRANSIENT,
		/** Every other failure of the query. */
		QUERY
	}

	private final Kind kind;
	private final String code;

	public GatewayException(final Kind kind, final String code, final String message, final Throwable cause){
		super(message, cause);
		this.kind = kind;
		this.code = code;
	}

	public Kind getKind(){
		return kind;
	}

	/**
	 * @return the datastore's native error code or null
	 */
	public String getCode(){
		return code;
	}
}
