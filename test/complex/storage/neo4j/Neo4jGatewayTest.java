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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import complex.query.dsl.Interpreter;
import complex.query.dsl.core.GatewayException;
import complex.query.dsl.core.InterpreterConfiguration;
import complex.query.dsl.core.SemanticError;
import complex.utility.Result;

/**
 * Runs scripts end to end against an embedded database in a temporary directory.
 */
class Neo4jGatewayTest{

	@TempDir
	static Path homeDirectory;

	private static Neo4jGateway gateway;

	@BeforeAll
	static void startDatabase() throws Exception{
		final Result<Configuration> configuration = Configuration.initialize(
				Configuration.keyDbHomeDirectoryPath + "='" + homeDirectory + "' maxRetries=1", null);
		gateway = new Neo4jGateway(configuration.getOrThrow());
		gateway.initialize();
	}

	@AfterAll
	static void stopDatabase() throws Exception{
		if(gateway != null){
			gateway.close();
		}
	}

	private static Interpreter newInterpreter(final boolean edgeReferences){
		return new Interpreter(gateway, new InterpreterConfiguration(edgeReferences, false, "{}"));
	}

	@Test
	void insertThenMatchReturnsTheRow(){
		final Interpreter interpreter = newInterpreter(true);
		final List<Map<String, Object>> rows = interpreter.execute(
				"ENTITY Employee { name: STRING, department: STRING };\n"
				+ "INSERT Employee { name = \"Ann\", department = \"R&D\" } AS ann;\n"
				+ "MATCH (e:Employee) RETURN e.name;");
		assertEquals(Collections.singletonList(Collections.<String, Object>singletonMap("e.name", "Ann")), rows);
	}

	@Test
	void entityCanBeDefinedAgainInNewSession(){
		newInterpreter(true).execute("ENTITY Repeated { x: STRING };");
		newInterpreter(true).execute("ENTITY Repeated { x: STRING };");
		final Interpreter interpreter = newInterpreter(true);
		interpreter.execute("ENTITY Repeated { x: STRING };");
		interpreter.execute("ENTITY Repeated { x: STRING };");
	}

	@Test
	void connectUpdateAndDelete(){
		final Interpreter interpreter = newInterpreter(true);
		interpreter.execute(
				"ENTITY Engineer { name: STRING, level: INT };\n"
				+ "ENTITY Project { title: STRING };\n"
				+ "RELATIONSHIP ASSIGNED (Engineer * -> Project *) { role: STRING };\n"
				+ "INSERT Engineer { name = \"Bo\", level = 1 } AS bo;\n"
				+ "INSERT Project { title = \"Search\" } AS search;\n"
				+ "CONNECT bo - ASSIGNED -> search { role = \"Lead\" };\n"
				+ "UPDATE bo SET level = 2;");

		List<Map<String, Object>> rows = interpreter.execute(
				"MATCH (e:Engineer)-[:ASSIGNED]->(p:Project) RETURN e.level, p.title;");
		assertEquals(1, rows.size());
		assertEquals(2L, rows.get(0).get("e.level"));
		assertEquals("Search", rows.get(0).get("p.title"));

		rows = interpreter.execute("MATCH (p:Project)<-[:ASSIGNED {role: \"Lead\"}]-(e) RETURN e;");
		assertEquals(1, rows.size());
		final Object engineer = rows.get(0).get("e");
		assertTrue(engineer instanceof Map, String.valueOf(engineer));
		assertEquals("Bo", ((Map<?, ?>)engineer).get("name"));
		assertTrue(((Map<?, ?>)engineer).containsKey("id"));

		interpreter.execute("DELETE Engineer { name = \"Bo\" };");
		assertTrue(interpreter.execute("MATCH (e:Engineer) RETURN e;").isEmpty());
	}

	@Test
	void referenceFieldCreatesEdge(){
		final Interpreter interpreter = newInterpreter(true);
		final List<Map<String, Object>> rows = interpreter.execute(
				"ENTITY Member { name: STRING, mentor: Member };\n"
				+ "INSERT Member { name = \"Cy\" } AS cy;\n"
				+ "INSERT Member { name = \"Di\", mentor = cy };\n"
				+ "MATCH (d:Member)-[:mentor]->(m:Member) RETURN d.name, m.name;");
		assertEquals(1, rows.size());
		assertEquals("Di", rows.get(0).get("d.name"));
		assertEquals("Cy", rows.get(0).get("m.name"));
	}

	@Test
	void unknownAliasFailsBeforeTouchingDatabase(){
		final Interpreter interpreter = newInterpreter(true);
		assertThrows(SemanticError.class, () -> interpreter.execute("UPDATE missing_alias SET x = 1;"));
	}

	@Test
	void badCypherIsQueryFailure(){
		final GatewayException error = assertThrows(GatewayException.class, () -> gateway.runGraphQuery("MATCH (n RETURN n"));
		assertEquals(GatewayException.Kind.QUERY, error.getKind());
		assertTrue(error.getCode().startsWith("Neo.ClientError."), error.getCode());
	}

	@Test
	void duplicateIndexIsAlreadyExists() throws Exception{
		gateway.runGraphQuery("CREATE INDEX complex_Dup_id FOR (n:Dup) ON (n.id)");
		final GatewayException error = assertThrows(GatewayException.class,
				() -> gateway.runGraphQuery("CREATE INDEX complex_Dup_id FOR (n:Dup) ON (n.id)"));
		assertEquals(GatewayException.Kind.ALREADY_EXISTS, error.getKind());
	}

	@Test
	void createReadsDefaultConfigFileAndArguments(){
		final Neo4jGateway created = Neo4jGateway.create(
				Configuration.keyDbHomeDirectoryPath + "='" + homeDirectory.resolve("other") + "' maxRetries=5");
		assertEquals(homeDirectory.resolve("other").toFile().getAbsolutePath(),
				created.getConfiguration().dbHomeDirectoryFile.getAbsolutePath());
		assertEquals(5, created.getConfiguration().maxRetries);
		assertEquals("neo4j", created.getConfiguration().dbName);
		assertFalse(created.isUsable());
	}

	@Test
	void closedGatewayIsConnectionFailure() throws Exception{
		final Result<Configuration> configuration = Configuration.initialize(
				Configuration.keyDbHomeDirectoryPath + "='" + homeDirectory.resolve("unused") + "'", null);
		final Neo4jGateway notStarted = new Neo4jGateway(configuration.getOrThrow());
		assertFalse(notStarted.isUsable());
		final GatewayException error = assertThrows(GatewayException.class, () -> notStarted.runGraphQuery("RETURN 1"));
		assertEquals(GatewayException.Kind.CONNECTION, error.getKind());
	}
}
