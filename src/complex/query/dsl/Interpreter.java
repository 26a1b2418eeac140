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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

import complex.core.Settings;
import complex.query.dsl.ast.Assignment;
import complex.query.dsl.ast.ConnectRelationship;
import complex.query.dsl.ast.DeleteStatement;
import complex.query.dsl.ast.EntityDef;
import complex.query.dsl.ast.InsertEntity;
import complex.query.dsl.ast.NodeReference;
import complex.query.dsl.ast.Program;
import complex.query.dsl.ast.QueryStatement;
import complex.query.dsl.ast.RelationshipDef;
import complex.query.dsl.ast.Statement;
import complex.query.dsl.ast.TargetRef;
import complex.query.dsl.ast.UpdateStatement;
import complex.query.dsl.core.ComplexException;
import complex.query.dsl.core.ConnectionError;
import complex.query.dsl.core.CypherQueryBuilder;
import complex.query.dsl.core.ExecutionError;
import complex.query.dsl.core.GatewayException;
import complex.query.dsl.core.GraphQueryGateway;
import complex.query.dsl.core.InterpreterConfiguration;
import complex.query.dsl.core.QueryEnvironment;
import complex.query.dsl.core.SemanticError;
import complex.query.dsl.parser.DSLParser;
import complex.query.dsl.parser.DSLParserWrapper;
import complex.query.dsl.parser.ParseTreeTransformer;
import complex.utility.Result;

/**
 * Top level class for running DSL scripts against a graph datastore.
 * 
 * Each statement is validated against the session's schema registry, compiled to Cypher and sent to the
 * gateway on its own. A failure stops the script but does not undo the statements before it.
 * 
 * Not thread-safe.
 */
public class Interpreter{

	private final Logger logger = Logger.getLogger(this.getClass().getName());

	private final GraphQueryGateway gateway;
	private final InterpreterConfiguration configuration;
	private final QueryEnvironment queryEnvironment = new QueryEnvironment();

	private final DSLParserWrapper parserWrapper = new DSLParserWrapper();
	private final ParseTreeTransformer transformer = new ParseTreeTransformer();

	/**
	 * Reads the configuration from the default config file of this class.
	 */
	public Interpreter(final GraphQueryGateway gateway){
		this(gateway, loadDefaultConfiguration());
	}

	public Interpreter(final GraphQueryGateway gateway, final InterpreterConfiguration configuration){
		if(gateway == null){
			throw new IllegalArgumentException("NULL gateway");
		}
		if(configuration == null){
			throw new IllegalArgumentException("NULL configuration");
		}
		this.gateway = gateway;
		this.configuration = configuration;
	}

	private static InterpreterConfiguration loadDefaultConfiguration(){
		final String configFile = Settings.getDefaultConfigFilePath(Interpreter.class);
		final Result<InterpreterConfiguration> result = InterpreterConfiguration.initialize(null, configFile);
		if(result.error){
			throw new IllegalArgumentException("Failed to parse configuration file: '" + configFile + "'. "
					+ result.toErrorString().trim(), result.exception);
		}
		return result.result;
	}

	public InterpreterConfiguration getConfiguration(){
		return configuration;
	}

	public QueryEnvironment getQueryEnvironment(){
		return queryEnvironment;
	}

	/**
	 * Parses the whole script and then runs its statements in order.
	 * 
	 * Aliases from a previous call are forgotten. Schema definitions are kept.
	 * 
	 * @param script DSL text
	 * @return rows of all query statements in statement order
	 * @throws ComplexException the first parse, semantic or execution error
	 */
	public List<Map<String, Object>> execute(final String script){
		final Program program;
		try{
			final DSLParser.ProgramContext parseTree = parserWrapper.parse(script);
			program = transformer.transform(parseTree);
			if(configuration.debug){
				logger.log(Level.INFO, "Parse tree:\n" + parseTree.toStringTree(Arrays.asList(DSLParser.ruleNames)));
				logger.log(Level.INFO, "Program:\n" + program.toString());
			}
		}catch(ComplexException e){
			logger.log(Level.SEVERE, "Failed to parse script", e);
			throw e;
		}

		queryEnvironment.clearAliases();

		final List<Map<String, Object>> results = new ArrayList<Map<String, Object>>();
		for(final Statement statement : program.getStatements()){
			try{
				final List<Map<String, Object>> rows = executeStatement(statement);
				if(rows != null && !rows.isEmpty()){
					results.addAll(rows);
				}
			}catch(ComplexException e){
				logger.log(Level.SEVERE, "Failed statement: " + statement.getShortString(), e);
				throw e;
			}catch(RuntimeException e){
				logger.log(Level.SEVERE, "Failed statement: " + statement.getShortString(), e);
				throw new ExecutionError("Unexpected execution error: " + e.getMessage(), null, e);
			}
		}
		return results;
	}

	private List<Map<String, Object>> executeStatement(final Statement statement){
		switch(statement.getStatementType()){
			case ENTITY_DEF: executeEntityDef((EntityDef)statement); return null;
			case RELATIONSHIP_DEF: executeRelationshipDef((RelationshipDef)statement); return null;
			case INSERT_ENTITY: executeInsertEntity((InsertEntity)statement); return null;
			case CONNECT_RELATIONSHIP: executeConnectRelationship((ConnectRelationship)statement); return null;
			case UPDATE: executeUpdate((UpdateStatement)statement); return null;
			case DELETE: executeDelete((DeleteStatement)statement); return null;
			case QUERY: return executeQuery((QueryStatement)statement);
			default: throw new IllegalStateException("Unhandled statement type: " + statement.getStatementType());
		}
	}

	private void executeEntityDef(final EntityDef entityDef){
		queryEnvironment.registerEntity(entityDef);
		try{
			runQuery(CypherQueryBuilder.createLabelIndex(entityDef.getName()));
		}catch(GatewayException e){
			if(e.getKind() != GatewayException.Kind.ALREADY_EXISTS){
				throw toExecutionError(e);
			}
			logger.log(Level.FINE, "Label already set up for entity: " + entityDef.getName());
		}
	}

	private void executeRelationshipDef(final RelationshipDef relationshipDef){
		queryEnvironment.registerRelationship(relationshipDef);
	}

	private void executeInsertEntity(final InsertEntity insert){
		if(!queryEnvironment.isEntityDefined(insert.getEntityType())){
			throw new SemanticError("Unknown entity type: " + insert.getEntityType());
		}

		final Map<String, Object> properties = new LinkedHashMap<String, Object>();
		// field -> native id of the referenced node
		final Map<String, Long> references = new LinkedHashMap<String, Long>();
		for(final Assignment assignment : insert.getAssignments()){
			final Object value = resolveValue(assignment);
			properties.put(assignment.getField(), value);
			if(assignment.isReference() && value instanceof Long){
				references.put(assignment.getField(), (Long)value);
			}
		}
		properties.remove(CypherQueryBuilder.idPropertyName);
		properties.put(CypherQueryBuilder.idPropertyName, UUID.randomUUID().toString());

		final long nativeId = getReturnedId(mustRunQuery(CypherQueryBuilder.createNode(insert.getEntityType(), properties)));
		if(insert.getAlias() != null){
			queryEnvironment.bindAlias(insert.getAlias(), nativeId);
		}

		if(configuration.edgeReferences){
			for(final Map.Entry<String, Long> reference : references.entrySet()){
				mustRunQuery(CypherQueryBuilder.createReferenceEdge(nativeId, reference.getKey(), reference.getValue()));
			}
		}
	}

	private void executeConnectRelationship(final ConnectRelationship connect){
		if(!queryEnvironment.isRelationshipDefined(connect.getRelationship())){
			throw new SemanticError("Unknown relationship type: " + connect.getRelationship());
		}
		final long fromId = resolveNodeReference(connect.getFromRef());
		final long toId = resolveNodeReference(connect.getToRef());
		mustRunQuery(CypherQueryBuilder.createRelationship(fromId, connect.getRelationship(), toId,
				resolveAssignments(connect.getProperties())));
	}

	private void executeUpdate(final UpdateStatement update){
		final Long targetId = resolveTarget(update.getTarget());
		mustRunQuery(CypherQueryBuilder.updateNodes(update.getTarget(), targetId,
				resolveAssignments(update.getAssignments())));
	}

	private void executeDelete(final DeleteStatement delete){
		final Long targetId = resolveTarget(delete.getTarget());
		mustRunQuery(CypherQueryBuilder.deleteNodes(delete.getTarget(), targetId));
	}

	private List<Map<String, Object>> executeQuery(final QueryStatement query){
		return mustRunQuery(CypherQueryBuilder.matchQuery(query));
	}

	/////////////////////////////////////////////////////

	/**
	 * Literal as is. A bound alias becomes its native id. Any other name is kept as the raw string.
	 */
	private Object resolveValue(final Assignment assignment){
		if(!assignment.isReference()){
			return assignment.getLiteral().getValue();
		}
		final Long nativeId = queryEnvironment.lookupAlias(assignment.getReference());
		return nativeId != null ? nativeId : assignment.getReference();
	}

	private Map<String, Object> resolveAssignments(final List<Assignment> assignments){
		final Map<String, Object> values = new LinkedHashMap<String, Object>();
		for(final Assignment assignment : assignments){
			values.put(assignment.getField(), resolveValue(assignment));
		}
		return values;
	}

	private long resolveNodeReference(final NodeReference reference){
		switch(reference.getKind()){
			case ID: return reference.getId();
			case ALIAS: return mustLookupAlias(reference.getAlias());
			default: throw new IllegalStateException("Unhandled node reference kind: " + reference.getKind());
		}
	}

	/**
	 * @return native id for alias and id targets, null for pattern targets
	 */
	private Long resolveTarget(final TargetRef target){
		switch(target.getKind()){
			case ID: return target.getId();
			case ALIAS: return mustLookupAlias(target.getAlias());
			case PATTERN: return null;
			default: throw new IllegalStateException("Unhandled target kind: " + target.getKind());
		}
	}

	private long mustLookupAlias(final String alias){
		final Long nativeId = queryEnvironment.lookupAlias(alias);
		if(nativeId == null){
			throw new SemanticError("Unknown alias: " + alias);
		}
		return nativeId;
	}

	private long getReturnedId(final List<Map<String, Object>> rows){
		if(rows == null || rows.isEmpty()){
			throw new ExecutionError("No id returned for the created node");
		}
		final Object id = rows.get(0).get("id");
		if(!(id instanceof Number)){
			throw new ExecutionError("Unexpected id returned for the created node: " + id);
		}
		return ((Number)id).longValue();
	}

	private List<Map<String, Object>> runQuery(final String query) throws GatewayException{
		if(configuration.debug){
			logger.log(Level.INFO, "Cypher: " + query);
		}
		final List<Map<String, Object>> rows = gateway.runGraphQuery(query);
		return rows == null ? Collections.<Map<String, Object>>emptyList() : rows;
	}

	private List<Map<String, Object>> mustRunQuery(final String query){
		try{
			return runQuery(query);
		}catch(GatewayException e){
			throw toExecutionError(e);
		}
	}

	private static ExecutionError toExecutionError(final GatewayException e){
		if(e.getKind() == GatewayException.Kind.CONNECTION){
			return new ConnectionError("Failed to reach graph datastore: " + e.getMessage(), e.getCode(), e);
		}
		return new ExecutionError("Failed to execute query: " + e.getMessage(), e.getCode(), e);
	}
}
