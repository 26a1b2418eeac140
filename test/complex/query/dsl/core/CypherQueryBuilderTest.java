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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import complex.query.dsl.ast.Condition;
import complex.query.dsl.ast.EdgePattern;
import complex.query.dsl.ast.Literal;
import complex.query.dsl.ast.NodePattern;
import complex.query.dsl.ast.Pattern;
import complex.query.dsl.ast.PropertyCondition;
import complex.query.dsl.ast.QueryStatement;
import complex.query.dsl.ast.ReturnItem;
import complex.query.dsl.ast.TargetRef;
import complex.query.dsl.parser.DSLParserWrapper;
import complex.query.dsl.parser.ParseTreeTransformer;

class CypherQueryBuilderTest{

	private static String match(final String script){
		final QueryStatement statement = (QueryStatement)new ParseTreeTransformer()
				.transform(new DSLParserWrapper().parse(script)).getStatements().get(0);
		return CypherQueryBuilder.matchQuery(statement);
	}

	@Test
	void labelIndex(){
		assertEquals("CREATE INDEX complex_Employee_id FOR (n:Employee) ON (n.id)",
				CypherQueryBuilder.createLabelIndex("Employee"));
	}

	@Test
	void createNodeWithProperties(){
		final Map<String, Object> properties = new LinkedHashMap<String, Object>();
		properties.put("name", "Ann");
		properties.put("age", 30L);
		properties.put("id", "u-1");
		assertEquals("CREATE (n:Employee {name: 'Ann', age: 30, id: 'u-1'}) RETURN id(n) AS id",
				CypherQueryBuilder.createNode("Employee", properties));
	}

	@Test
	void createRelationshipWithAndWithoutProperties(){
		assertEquals("MATCH (a), (b) WHERE id(a) = 1 AND id(b) = 2 CREATE (a)-[r:WORKS_ON]->(b) RETURN id(r) AS id",
				CypherQueryBuilder.createRelationship(1, "WORKS_ON", 2, Collections.<String, Object>emptyMap()));
		assertEquals("MATCH (a), (b) WHERE id(a) = 1 AND id(b) = 2 CREATE (a)-[r:WORKS_ON {role: 'Lead'}]->(b) RETURN id(r) AS id",
				CypherQueryBuilder.createRelationship(1, "WORKS_ON", 2, Collections.<String, Object>singletonMap("role", "Lead")));
	}

	@Test
	void referenceEdge(){
		assertEquals("MATCH (a), (b) WHERE id(a) = 7 AND id(b) = 3 CREATE (a)-[:manager]->(b)",
				CypherQueryBuilder.createReferenceEdge(7, "manager", 3));
	}

	@Test
	void literalFormatting(){
		assertEquals("'it\\'s'", CypherQueryBuilder.formatValue("it's"));
		assertEquals("'C:\\\\tmp'", CypherQueryBuilder.formatValue("C:\\tmp"));
		assertEquals("42", CypherQueryBuilder.formatValue(42L));
		assertEquals("-3", CypherQueryBuilder.formatValue(-3L));
		assertEquals("1.5", CypherQueryBuilder.formatValue(1.5d));
		assertEquals("3.0", CypherQueryBuilder.formatValue(3.0d));
		assertEquals("100000000000000000000.0", CypherQueryBuilder.formatValue(1e20d));
		assertEquals("0.0001", CypherQueryBuilder.formatValue(1e-4d));
		assertEquals("true", CypherQueryBuilder.formatValue(Boolean.TRUE));
		assertEquals("false", CypherQueryBuilder.formatValue(Boolean.FALSE));
		assertEquals("null", CypherQueryBuilder.formatValue(null));
	}

	@Test
	void updateByIdAndDeleteByPattern(){
		final Map<String, Object> assignments = new LinkedHashMap<String, Object>();
		assignments.put("department", "Sales");
		assignments.put("level", 2L);
		assertEquals("MATCH (n) WHERE id(n) = 5 SET n.department = 'Sales', n.level = 2",
				CypherQueryBuilder.updateNodes(TargetRef.ofAlias("e"), 5L, assignments));

		final Condition condition = new Condition(
				Arrays.asList(new PropertyCondition(null, "department", Literal.ofString("Temporary"))),
				Collections.emptyList());
		assertEquals("MATCH (n:Employee) WHERE n.department = 'Temporary' DETACH DELETE n",
				CypherQueryBuilder.deleteNodes(TargetRef.ofPattern("Employee", condition), null));
		assertEquals("MATCH (n:Employee) DETACH DELETE n",
				CypherQueryBuilder.deleteNodes(TargetRef.ofPattern("Employee", null), null));
		assertEquals("MATCH (n) WHERE id(n) = 9 DETACH DELETE n",
				CypherQueryBuilder.deleteNodes(TargetRef.ofId(9), 9L));
	}

	@Test
	void queryWithQualifiedWhereAndReturnItems(){
		assertEquals("MATCH (e:Employee)-[:WORKS_ON]->(p:Epic) WHERE e.department = 'R&D' RETURN e.name, p",
				match("MATCH (e:Employee)-[:WORKS_ON]->(p:Epic) WHERE e.department = \"R&D\" RETURN e.name, p;"));
	}

	@Test
	void unnamedNodesGetDistinctAliases(){
		assertEquals("MATCH (n:Employee)-[:WORKS_ON]->(n1:Epic) RETURN *",
				match("MATCH (:Employee)-[:WORKS_ON]->(:Epic);"));
		assertEquals("MATCH (n) RETURN n", match("MATCH (n) RETURN n;"));
	}

	@Test
	void backslashCannotCloseTheString(){
		// The lexeme keeps the backslash: x\' OR true //
		assertEquals("MATCH (e:Employee) WHERE e.name = 'x\\\\\\' OR true //' RETURN *",
				match("MATCH (e:Employee) WHERE e.name = \"x\\' OR true //\";"));
	}

	@Test
	void defaultAliasesAvoidUserAliases(){
		assertEquals("MATCH (n_1:Employee)-[:WORKS_ON]->(n:Epic) RETURN n",
				match("MATCH (:Employee)-[:WORKS_ON]->(n:Epic) RETURN n;"));
		assertEquals("MATCH (n:Employee)-->(n1_1)-->(n1) RETURN *",
				match("MATCH (:Employee)-->()-->(n1);"));
		assertEquals("MATCH (n_2)-->(n)-->(n_1) RETURN *",
				match("MATCH ()-->(n)-->(n_1);"));
	}

	@Test
	void unqualifiedPropertyBindsToFirstNode(){
		assertEquals("MATCH (e:Employee)-->(p) WHERE e.name = 'Ann' AND p.title = 'X' RETURN *",
				match("MATCH (e:Employee)-->(p) WHERE name = \"Ann\" AND p.title = \"X\";"));
	}

	@Test
	void mixedOperatorsAreEvaluatedLeftToRight(){
		assertEquals("MATCH (n) WHERE n.a = 1 OR n.b = 2 RETURN *", match("MATCH (n) WHERE a = 1 OR b = 2;"));
		assertEquals("MATCH (n) WHERE (n.a = 1 OR n.b = 2) AND n.c = 3 RETURN *",
				match("MATCH (n) WHERE a = 1 OR b = 2 AND c = 3;"));
	}

	@Test
	void nullComparison(){
		assertEquals("MATCH (n) WHERE n.a IS NULL RETURN *", match("MATCH (n) WHERE a = NULL;"));
	}

	@Test
	void inlineFiltersAndDirections(){
		assertEquals("MATCH (e:Employee {department: 'R&D'})-[:WORKS_ON {role: 'Lead'}]->(p) RETURN *",
				match("MATCH (e:Employee {department: \"R&D\"})-[:WORKS_ON {role = \"Lead\"}]->(p);"));
		assertEquals("MATCH (a)<-[:R]-(b)--(c)-[{w: 1}]-(d) RETURN *",
				match("MATCH (a)<-[:R]-(b)--(c)-[{w: 1}]-(d);"));
	}

	@Test
	void inlineFilterWithOrIsRejected(){
		final SemanticError error = assertThrows(SemanticError.class,
				() -> match("MATCH (e:Employee {a: 1 OR b: 2});"));
		assertTrue(error.getMessage().contains("AND"));
	}

	@Test
	void disconnectedPatternIsRejected(){
		final Pattern pattern = new Pattern(
				Arrays.asList(new NodePattern("a", null, null), new NodePattern("b", null, null)),
				Collections.<EdgePattern>emptyList());
		assertThrows(SemanticError.class, () -> CypherQueryBuilder.matchQuery(
				new QueryStatement(pattern, null, Collections.<ReturnItem>emptyList())));
		assertThrows(SemanticError.class, () -> CypherQueryBuilder.matchQuery(new QueryStatement(
				new Pattern(Collections.<NodePattern>emptyList(), Collections.<EdgePattern>emptyList()),
				null, Collections.<ReturnItem>emptyList())));
	}

	@Test
	void unknownAliasInQueryIsRejected(){
		assertEquals("Unknown alias: x",
				assertThrows(SemanticError.class, () -> match("MATCH (e:Employee) RETURN x.name;")).getMessage());
		assertEquals("Unknown alias: x",
				assertThrows(SemanticError.class, () -> match("MATCH (e:Employee) WHERE x.name = 1;")).getMessage());
	}
}
