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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.neo4j.graphdb.Entity;
import org.neo4j.graphdb.Path;
import org.neo4j.graphdb.Transaction;

import complex.core.Settings;
import complex.query.dsl.core.GatewayException;
import complex.query.dsl.core.GraphQueryGateway;
import complex.utility.Result;

/**
 * Runs Cypher on an embedded Neo4j database. One transaction per query.
 * 
 * Nodes and relationships in the results are returned as their property maps and paths as lists of those.
 * Transient failures are retried up to the configured number of times.
 */
public class Neo4jGateway implements GraphQueryGateway, AutoCloseable{

	private final Logger logger = Logger.getLogger(this.getClass().getName());

	private final Configuration configuration;
	private final DatabaseManager databaseManager;

	public Neo4jGateway(final Configuration configuration){
		if(configuration == null){
			throw new IllegalArgumentException("NULL configuration");
		}
		this.configuration = configuration;
		this.databaseManager = new DatabaseManager(configuration);
	}

	/**
	 * Reads the default config file of this class and overrides its values with the arguments.
	 * 
	 * @param arguments 'key=value' pairs. May be null.
	 */
	public static Neo4jGateway create(final String arguments){
		final String configFile = Settings.getDefaultConfigFilePath(Neo4jGateway.class);
		final Result<Configuration> result = Configuration.initialize(arguments, configFile);
		if(result.error){
			throw new IllegalArgumentException("Invalid configuration. " + result.toErrorString().trim(), result.exception);
		}
		return new Neo4jGateway(result.result);
	}

	public Configuration getConfiguration(){
		return configuration;
	}

	public void initialize() throws Exception{
		databaseManager.initialize();
		if(configuration.debug){
			logger.log(Level.INFO, "Initialized with configuration: " + configuration);
		}
	}

	public boolean isUsable(){
		return databaseManager.isUsable();
	}

	@Override
	public List<Map<String, Object>> runGraphQuery(final String query) throws GatewayException{
		if(!databaseManager.isUsable()){
			throw new GatewayException(GatewayException.Kind.CONNECTION, null,
					"Database not initialized or already shutdown", null);
		}
		int attempt = 0;
		while(true){
			try{
				return executeInTransaction(query);
			}catch(GatewayException e){
				if(e.getKind() != GatewayException.Kind.TRANSIENT || attempt >= configuration.maxRetries){
					throw e;
				}
				attempt++;
				logger.log(Level.WARNING, "Retrying (" + attempt + "/" + configuration.maxRetries + ") after transient failure: "
						+ e.getMessage());
			}
		}
	}

	private List<Map<String, Object>> executeInTransaction(final String query) throws GatewayException{
		final long startTime = System.currentTimeMillis();
		try(final Transaction tx = databaseManager.beginTransaction()){
			final List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
			try(final org.neo4j.graphdb.Result result = tx.execute(query)){
				final List<String> columns = result.columns();
				while(result.hasNext()){
					final Map<String, Object> record = result.next();
					final Map<String, Object> row = new LinkedHashMap<String, Object>();
					for(final String column : columns){
						row.put(column, convertValue(record.get(column)));
					}
					rows.add(row);
				}
			}
			tx.commit();
			if(configuration.debug){
				logger.log(Level.INFO, (System.currentTimeMillis() - startTime) + " millis taken to execute query '"
						+ query + "'");
			}
			return rows;
		}catch(Exception e){
			// The transaction is rolled back on close if not committed
			throw Neo4jErrorClassifier.toGatewayException(e, query);
		}
	}

	/**
	 * Copies graph objects out of the transaction.
	 */
	private static Object convertValue(final Object value){
		if(value instanceof Entity){
			return new LinkedHashMap<String, Object>(((Entity)value).getAllProperties());
		}else if(value instanceof Path){
			final List<Object> list = new ArrayList<Object>();
			for(final Entity entity : (Path)value){
				list.add(convertValue(entity));
			}
			return list;
		}else if(value instanceof List){
			final List<Object> list = new ArrayList<Object>();
			for(final Object item : (List<?>)value){
				list.add(convertValue(item));
			}
			return list;
		}else if(value instanceof Map){
			final Map<String, Object> map = new LinkedHashMap<String, Object>();
			for(final Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()){
				map.put(String.valueOf(entry.getKey()), convertValue(entry.getValue()));
			}
			return map;
		}
		return value;
	}

	@Override
	public void close() throws Exception{
		databaseManager.shutdown();
	}
}
