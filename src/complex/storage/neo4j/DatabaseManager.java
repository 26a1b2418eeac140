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

import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.neo4j.configuration.GraphDatabaseSettings;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.dbms.api.DatabaseManagementServiceBuilder;
import org.neo4j.graphdb.GraphDatabaseService;
import org.neo4j.graphdb.Transaction;

/**
 * Owns the embedded database service. A JVM shutdown hook stops the service if the owner never does.
 */
public class DatabaseManager{

	private final Logger logger = Logger.getLogger(this.getClass().getName());

	private final Configuration configuration;

	private volatile boolean shutdownHookAdded = false;
	private final Thread databaseShutdownThreadForJVMShutdown = new Thread(){
		@Override
		public void run(){
			synchronized(dbManagementServiceLock){
				if(dbManagementService != null){
					try{
						dbManagementService.shutdown();
					}catch(Exception e){
						logger.log(Level.WARNING, "Failed to shutdown database using the shutdown hook", e);
					}
					dbManagementService = null;
				}
			}
		}
	};

	private final Object dbManagementServiceLock = new Object();
	private DatabaseManagementService dbManagementService;

	private volatile GraphDatabaseService graphDatabaseService;

	public DatabaseManager(final Configuration configuration){
		this.configuration = configuration;
	}

	private final void addShutdownHook(){
		synchronized(databaseShutdownThreadForJVMShutdown){
			if(shutdownHookAdded){
				return;
			}
			Runtime.getRuntime().addShutdownHook(databaseShutdownThreadForJVMShutdown);
			shutdownHookAdded = true;
		}
	}

	private final void removeShutdownHook(){
		synchronized(databaseShutdownThreadForJVMShutdown){
			if(!shutdownHookAdded){
				return;
			}
			try{
				Runtime.getRuntime().removeShutdownHook(databaseShutdownThreadForJVMShutdown);
			}catch(IllegalStateException e){
				// JVM is already shutting down and the hook is running
				logger.log(Level.FINE, "Shutdown hook not removed", e);
			}
			shutdownHookAdded = false;
		}
	}

	public final boolean isUsable(){
		return graphDatabaseService != null && graphDatabaseService.isAvailable();
	}

	public final void initialize() throws Exception{
		if(graphDatabaseService != null){
			throw new IllegalStateException("Database already initialized");
		}

		boolean success = false;
		try{
			DatabaseManagementServiceBuilder dbServiceBuilder = new DatabaseManagementServiceBuilder(
					configuration.dbHomeDirectoryFile.getAbsoluteFile().toPath());

			if(configuration.neo4jConfigFilePath != null){
				dbServiceBuilder = dbServiceBuilder.loadPropertiesFromFile(configuration.neo4jConfigFilePath.toPath());
			}

			dbServiceBuilder = dbServiceBuilder.setConfig(
					GraphDatabaseSettings.data_directory, Paths.get(configuration.dbDataDirectoryName));

			synchronized(dbManagementServiceLock){
				dbManagementService = dbServiceBuilder.build();
			}
			addShutdownHook();

			if(!dbManagementService.listDatabases().contains(configuration.dbName)){
				// Only the enterprise edition allows more than the default database
				dbManagementService.createDatabase(configuration.dbName);
			}
			graphDatabaseService = dbManagementService.database(configuration.dbName);

			success = true;
			logger.log(Level.INFO, "Database '" + configuration.dbName + "' started in '"
					+ configuration.dbHomeDirectoryFile.getAbsolutePath() + "'");
		}finally{
			if(!success){
				shutdown();
			}
		}
	}

	/**
	 * @return a new transaction with the configured timeout
	 */
	public final Transaction beginTransaction(){
		final GraphDatabaseService graphDb = graphDatabaseService;
		if(graphDb == null){
			throw new IllegalStateException("Database not initialized or already shutdown");
		}
		if(configuration.transactionTimeoutInSeconds > 0){
			return graphDb.beginTx(configuration.transactionTimeoutInSeconds, TimeUnit.SECONDS);
		}
		return graphDb.beginTx();
	}

	public final void shutdown() throws Exception{
		graphDatabaseService = null;
		removeShutdownHook();
		synchronized(dbManagementServiceLock){
			if(dbManagementService != null){
				try{
					dbManagementService.shutdown();
				}finally{
					dbManagementService = null;
				}
			}
		}
	}
}
