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

import org.neo4j.graphdb.DatabaseShutdownException;
import org.neo4j.graphdb.QueryExecutionException;
import org.neo4j.graphdb.TransientFailureException;

import complex.query.dsl.core.GatewayException;

/**
 * Maps Neo4j failures to gateway failure kinds using the Neo4j status codes.
 */
public class Neo4jErrorClassifier{

	public static final String
		prefixTransientError = "Neo.TransientError.",
		prefixSchemaError = "Neo.ClientError.Schema.",
		suffixAlreadyExists = "AlreadyExists",
		markerDatabaseUnavailable = "DatabaseUnavailable",
		markerDatabaseNotFound = "DatabaseNotFound";

	public static GatewayException.Kind classify(final String statusCode){
		if(statusCode == null){
			return GatewayException.Kind.QUERY;
		}
		if(statusCode.contains(markerDatabaseUnavailable) || statusCode.contains(markerDatabaseNotFound)){
			return GatewayException.Kind.CONNECTION;
		}
		if(statusCode.startsWith(prefixSchemaError) && statusCode.endsWith(suffixAlreadyExists)){
			return GatewayException.Kind.ALREADY_EXISTS;
		}
		if(statusCode.startsWith(prefixTransientError)){
			return GatewayException.Kind.TRANSIENT;
		}
		return GatewayException.Kind.QUERY;
	}

	/**
	 * @param query the query that failed. Only used in the message
	 */
	public static GatewayException toGatewayException(final Exception exception, final String query){
		Throwable current = exception;
		while(current != null){
			if(current instanceof QueryExecutionException){
				final String statusCode = ((QueryExecutionException)current).getStatusCode();
				return new GatewayException(classify(statusCode), statusCode,
						current.getMessage() + " (query: " + query + ")", exception);
			}else if(current instanceof DatabaseShutdownException){
				return new GatewayException(GatewayException.Kind.CONNECTION, null,
						"Database is shut down (query: " + query + ")", exception);
			}else if(current instanceof TransientFailureException){
				return new GatewayException(GatewayException.Kind.TRANSIENT, null,
						current.getMessage() + " (query: " + query + ")", exception);
			}
			current = current.getCause() == current ? null : current.getCause();
		}
		return new GatewayException(GatewayException.Kind.QUERY, null,
				exception.getMessage() + " (query: " + query + ")", exception);
	}
}
