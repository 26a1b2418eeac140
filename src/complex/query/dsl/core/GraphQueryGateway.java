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

import java.util.List;
import java.util.Map;

/**
 * Executes a Cypher query text against a graph datastore.
 */
public interface GraphQueryGateway{

	/**
	 * @param query Cypher text
	 * @return the result rows in order, each one a column name to value map. Empty if the query returns nothing.
	 * @throws GatewayException if the query could not be run
	 */
	public List<Map<String, Object>> runGraphQuery(String query) throws GatewayException;

}
