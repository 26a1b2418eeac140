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

package complex.query.dsl.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import complex.query.dsl.ast.Assignment;
import complex.query.dsl.ast.BooleanOperator;
import complex.query.dsl.ast.ConnectRelationship;
import complex.query.dsl.ast.DeleteStatement;
import complex.query.dsl.ast.Direction;
import complex.query.dsl.ast.EntityDef;
import complex.query.dsl.ast.InsertEntity;
import complex.query.dsl.ast.Literal;
import complex.query.dsl.ast.Multiplicity;
import complex.query.dsl.ast.NodePattern;
import complex.query.dsl.ast.NodeReference;
import complex.query.dsl.ast.Program;
import complex.query.dsl.ast.PropertyCondition;
import complex.query.dsl.ast.QueryStatement;
import complex.query.dsl.ast.RelationshipDef;
import complex.query.dsl.ast.ReturnItem;
import complex.query.dsl.ast.Statement;
import complex.query.dsl.ast.TargetRef;
import complex.query.dsl.ast.UpdateStatement;
import complex.query.dsl.core.ParseError;

class ParseTreeTransformerTest{

	private static final String schemaScript =
			"ENTITY Person { name: STRING };\n"
			+ "ENTITY Employee { name: STRING, age: INT, skills: STRING[], manager: Employee, } EXTENDS Person;\n"
			+ "ENTITY Epic { title: STRING };\n"
			+ "RELATIONSHIP WORKS_ON (Employee * -> Epic *) { role: STRING, start_date: DATE };\n"
			+ "RELATIONSHIP REPORTS_TO (Employee -> Employee 1);\n";

	private Program parse(final String script){
		return new ParseTreeTransformer().transform(new DSLParserWrapper().parse(script));
	}

	private Statement parseOne(final String script){
		final List<Statement> statements = parse(script).getStatements();
		assertEquals(1, statements.size());
		return statements.get(0);
	}

	@Test
	void entityDefinitionKeepsFieldOrderAndTypes(){
		final Program program = parse(schemaScript);
		assertEquals(5, program.getStatements().size());

		final EntityDef employee = (EntityDef)program.getStatements().get(1);
		assertEquals(Statement.StatementType.ENTITY_DEF, employee.getStatementType());
		assertEquals("Employee", employee.getName());
		assertEquals("Person", employee.getExtendsName());
		assertEquals(4, employee.getFields().size());
		assertEquals("age", employee.getFields().get(1).getName());
		assertEquals("INT", employee.getFields().get(1).getDataType().getName());
		assertTrue(employee.getFields().get(2).getDataType().isArray());
		assertFalse(employee.getFields().get(3).getDataType().isPrimitive());
		assertEquals("Employee", employee.getFields().get(3).getDataType().getName());

		assertNull(((EntityDef)program.getStatements().get(0)).getExtendsName());
	}

	@Test
	void relationshipMultiplicityDefaultsToOne(){
		final Program program = parse(schemaScript);
		final RelationshipDef worksOn = (RelationshipDef)program.getStatements().get(3);
		assertEquals("Employee", worksOn.getFromEntity());
		assertEquals("Epic", worksOn.getToEntity());
		assertEquals(Multiplicity.MANY, worksOn.getFromMultiplicity());
		assertEquals(Multiplicity.MANY, worksOn.getToMultiplicity());
		assertEquals(2, worksOn.getFields().size());

		final RelationshipDef reportsTo = (RelationshipDef)program.getStatements().get(4);
		assertEquals(Multiplicity.ONE, reportsTo.getFromMultiplicity());
		assertEquals(Multiplicity.ONE, reportsTo.getToMultiplicity());
		assertTrue(reportsTo.getFields().isEmpty());
	}

	@Test
	void reparsingGivesEqualPrograms(){
		final Program first = parse(schemaScript);
		final Program second = parse(schemaScript);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertEquals(first.toString(), second.toString());
	}

	@Test
	void everyPrimitiveDataTypeIsAccepted(){
		final EntityDef entity = (EntityDef)parse("ENTITY TestEntity {\n"
				+ "  s: STRING, i: INT, f: FLOAT, b: BOOL, d: DATE,\n"
				+ "  dt: DATETIME, bl: BLOB, u: UUID, j: JSON\n"
				+ "};").getStatements().get(0);
		final List<String> expected = Arrays.asList("STRING", "INT", "FLOAT", "BOOL", "DATE", "DATETIME", "BLOB", "UUID", "JSON");
		assertEquals(expected.size(), entity.getFields().size());
		for(int i = 0; i < expected.size(); i++){
			assertEquals(expected.get(i), entity.getFields().get(i).getDataType().getName());
			assertTrue(entity.getFields().get(i).getDataType().isPrimitive());
		}
	}

	@Test
	void unknownUppercaseDataTypeIsRejected(){
		final ParseError error = assertThrows(ParseError.class,
				() -> parse("ENTITY Foo { name: INVALID_TYPE };"));
		assertTrue(error.getMessage().contains("Unknown data type: INVALID_TYPE"), error.getMessage());
		assertEquals(1, error.getLine());
		assertNotNull(error.getColumn());
	}

	@Test
	void multiplicityOtherThanOneIsRejected(){
		assertThrows(ParseError.class, () -> parse("RELATIONSHIP R (A 2 -> B);"));
		assertThrows(ParseError.class, () -> parse("RELATIONSHIP R (A -> B 1.0);"));
	}

	@Test
	void missingSemicolonReportsPosition(){
		final ParseError error = assertThrows(ParseError.class,
				() -> parse("ENTITY A { x: STRING };\nENTITY B { y: STRING }\nINSERT A { x = \"a\" };"));
		assertEquals(3, error.getLine());
		assertEquals(1, error.getColumn());
		assertTrue(error.getMessage().startsWith("Parse error at line 3, column 1: "), error.getMessage());
		assertNotNull(error.getSourceText());
	}

	@Test
	void missingSemicolonAtEndOfScript(){
		final ParseError error = assertThrows(ParseError.class, () -> parse("MATCH (n) RETURN n"));
		assertEquals(1, error.getLine());
		assertNotNull(error.getColumn());
	}

	@Test
	void lexerErrorIsParseError(){
		final ParseError error = assertThrows(ParseError.class, () -> parse("INSERT Foo { x = @ };"));
		assertEquals(1, error.getLine());
		assertEquals(18, error.getColumn());
	}

	@Test
	void literalsAreInferred(){
		final InsertEntity insert = (InsertEntity)parseOne(
				"INSERT Thing { s = \"a \\\"b\\\"\", i = 42, n = -7, d = 3.25, t = TRUE, f = FALSE, z = NULL, r = other } AS t1;");
		final List<Assignment> assignments = insert.getAssignments();
		assertEquals(Literal.ofString("a \\\"b\\\""), assignments.get(0).getLiteral());
		assertEquals(Long.valueOf(42), assignments.get(1).getLiteral().getValue());
		assertEquals(Long.valueOf(-7), assignments.get(2).getLiteral().getValue());
		assertEquals(Double.valueOf(3.25), assignments.get(3).getLiteral().getValue());
		assertEquals(Boolean.TRUE, assignments.get(4).getLiteral().getValue());
		assertEquals(Boolean.FALSE, assignments.get(5).getLiteral().getValue());
		assertEquals(Literal.Kind.NULL, assignments.get(6).getLiteral().getKind());
		assertTrue(assignments.get(7).isReference());
		assertEquals("other", assignments.get(7).getReference());
		assertEquals("t1", insert.getAlias());
	}

	@Test
	void connectAcceptsAliasesAndIds(){
		final ConnectRelationship connect = (ConnectRelationship)parseOne(
				"CONNECT emp1 - WORKS_ON -> 17 { role = \"Lead\", since = 2020 };");
		assertEquals(NodeReference.ofAlias("emp1"), connect.getFromRef());
		assertEquals(NodeReference.ofId(17), connect.getToRef());
		assertEquals("WORKS_ON", connect.getRelationship());
		assertEquals(2, connect.getProperties().size());

		final ConnectRelationship bare = (ConnectRelationship)parseOne("CONNECT a - R -> b;");
		assertTrue(bare.getProperties().isEmpty());
	}

	@Test
	void nodeIdentifierMustBeInteger(){
		assertThrows(ParseError.class, () -> parse("CONNECT 1.5 - R -> b;"));
		assertThrows(ParseError.class, () -> parse("DELETE 2.0;"));
	}

	@Test
	void updateAndDeleteTargets(){
		final UpdateStatement update = (UpdateStatement)parseOne("UPDATE emp1 SET department = \"Sales\", level = 3;");
		assertEquals(TargetRef.ofAlias("emp1"), update.getTarget());
		assertEquals(2, update.getAssignments().size());

		final UpdateStatement patternUpdate = (UpdateStatement)parseOne(
				"UPDATE Employee {department = \"Engineering\"} SET department = \"R&D\";");
		assertEquals(TargetRef.Kind.PATTERN, patternUpdate.getTarget().getKind());
		assertEquals("Employee", patternUpdate.getTarget().getEntityType());
		assertEquals("department", patternUpdate.getTarget().getCondition().getConditions().get(0).getProperty());

		final DeleteStatement deleteById = (DeleteStatement)parseOne("DELETE 12;");
		assertEquals(TargetRef.ofId(12), deleteById.getTarget());

		final DeleteStatement deleteAll = (DeleteStatement)parseOne("DELETE Employee {};");
		assertEquals(TargetRef.ofPattern("Employee", null), deleteAll.getTarget());
	}

	@Test
	void queryPatternDirectionsAndAliases(){
		final QueryStatement query = (QueryStatement)parseOne(
				"MATCH (e:Employee)-[:WORKS_ON]->(p:Epic)<-[:OWNS]-(:Team)--(x) RETURN e.name, p;");
		final List<NodePattern> nodes = query.getPattern().getNodes();
		assertEquals(4, nodes.size());
		assertEquals(3, query.getPattern().getEdges().size());
		assertTrue(query.getPattern().isConnected());

		assertEquals(new NodePattern("e", "Employee", null), nodes.get(0));
		assertEquals(new NodePattern(null, "Team", null), nodes.get(2));
		assertEquals(new NodePattern("x", null, null), nodes.get(3));

		assertEquals(Direction.FORWARD, query.getPattern().getEdges().get(0).getDirection());
		assertEquals("WORKS_ON", query.getPattern().getEdges().get(0).getRelationship());
		assertEquals(Direction.BACKWARD, query.getPattern().getEdges().get(1).getDirection());
		assertEquals(Direction.BIDIRECTIONAL, query.getPattern().getEdges().get(2).getDirection());
		assertNull(query.getPattern().getEdges().get(2).getRelationship());

		assertEquals(Arrays.asList(new ReturnItem("e", "name"), new ReturnItem("p", null)), query.getReturnItems());
	}

	@Test
	void returnStarAndMissingReturnAreEquivalent(){
		final QueryStatement star = (QueryStatement)parseOne("MATCH (n) RETURN *;");
		final QueryStatement none = (QueryStatement)parseOne("MATCH (n);");
		assertTrue(star.getReturnItems().isEmpty());
		assertEquals(star, none);
	}

	@Test
	void conditionsKeepOperatorsInOrder(){
		final QueryStatement query = (QueryStatement)parseOne(
				"MATCH (e:Employee {department: \"R&D\"}) WHERE e.age = 30 OR name = \"Ann\" AND e.active = TRUE;");
		assertEquals("department", query.getPattern().getNodes().get(0).getCondition().getConditions().get(0).getProperty());
		assertEquals(Arrays.asList(BooleanOperator.OR, BooleanOperator.AND), query.getWhere().getOperators());
		final List<PropertyCondition> conditions = query.getWhere().getConditions();
		assertEquals(new PropertyCondition("e", "age", Literal.ofLong(30)), conditions.get(0));
		assertEquals(new PropertyCondition(null, "name", Literal.ofString("Ann")), conditions.get(1));
	}

	@Test
	void edgeCannotPointBothWays(){
		assertThrows(ParseError.class, () -> parse("MATCH (a)<-[:R]->(b);"));
	}

	@Test
	void commentsAreSkipped(){
		final Program program = parse("// schema\nENTITY Foo { x: STRING }; // trailing\n// done\n");
		assertEquals(1, program.getStatements().size());
	}

	@Test
	void emptyScriptIsEmptyProgram(){
		assertTrue(parse("  \n// nothing\n").getStatements().isEmpty());
	}

	@Test
	void keywordsAreCaseSensitive(){
		assertThrows(ParseError.class, () -> parse("entity Foo { x: STRING };"));
	}

	@Test
	void nonProgramTreeIsRejected(){
		assertThrows(ParseError.class, () -> new ParseTreeTransformer().transform(null));
		final DSLParser.ProgramContext tree = new DSLParserWrapper().parse("MATCH (n);");
		assertThrows(ParseError.class, () -> new ParseTreeTransformer().transform(tree.statement(0)));
	}
}
