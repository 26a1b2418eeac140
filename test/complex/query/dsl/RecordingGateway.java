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

package complex.query.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import complex.query.dsl.core.GatewayException;
import complex.query.dsl.core.GraphQueryGateway;

/**
 * In-memory gateway that records every query.
 * 
 * Created nodes get increasing ids starting at 100. Creating the same index twice fails with ALREADY_EXISTS.
 * Queries that start with a registered prefix fail with the registered exception.
 */
class RecordingGateway implements GraphQueryGateway{

	final List<String> queries = new ArrayList<String>();
	final Set<String> indexes = new HashSet<String>();
	final Map<String, Exception> failures = new HashMap<String, Exception>();
	List<Map<String, Object>> matchRows = new ArrayList<Map<String, Object>>();
	long nextId = 100;

	@Override
	public List<Map<String, Object>> runGraphQuery(final String query) throws GatewayException{
		queries.add(query);
		for(final Map.Entry<String, Exception> failure : failures.entrySet()){
			if(query.startsWith(failure.getKey())){
				if(failure.getValue() instanceof GatewayException){
					throw (GatewayException)failure.getValue();
				}
				throw (RuntimeException)failure.getValue();
			}
		}
		if(query.startsWith("CREATE INDEX")){
			if(!indexes.add(query)){
				throw new GatewayException(GatewayException.Kind.ALREADY_EXISTS,
						"Neo.ClientError.Schema.EquivalentSchemaRuleAlreadyExists", "An equivalent index already exists", null);
			}
			return Collections.emptyList();
		}
		if(query.startsWith("CREATE (n:") || query.contains(" RETURN id(r) AS id")){
			return Collections.singletonList(Collections.<String, Object>singletonMap("id", nextId++));
		}
		if(query.startsWith("MATCH") && query.contains(" RETURN ") && !query.contains(" CREATE ")){
			return new ArrayList<Map<String, Object>>(matchRows);
		}
		return Collections.emptyList();
	}

	String lastQuery(){
		return queries.get(queries.size() - 1);
	}
}
