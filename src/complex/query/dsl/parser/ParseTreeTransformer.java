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

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import complex.query.dsl.ast.Assignment;
import complex.query.dsl.ast.BooleanOperator;
import complex.query.dsl.ast.Condition;
import complex.query.dsl.ast.ConnectRelationship;
import complex.query.dsl.ast.DataType;
import complex.query.dsl.ast.DeleteStatement;
import complex.query.dsl.ast.Direction;
import complex.query.dsl.ast.EdgePattern;
import complex.query.dsl.ast.EntityDef;
import complex.query.dsl.ast.FieldDecl;
import complex.query.dsl.ast.InsertEntity;
import complex.query.dsl.ast.Literal;
import complex.query.dsl.ast.Multiplicity;
import complex.query.dsl.ast.NodePattern;
import complex.query.dsl.ast.NodeReference;
import complex.query.dsl.ast.Pattern;
import complex.query.dsl.ast.Program;
import complex.query.dsl.ast.PropertyCondition;
import complex.query.dsl.ast.QueryStatement;
import complex.query.dsl.ast.RelationshipDef;
import complex.query.dsl.ast.ReturnItem;
import complex.query.dsl.ast.Statement;
import complex.query.dsl.ast.TargetRef;
import complex.query.dsl.ast.UpdateStatement;
import complex.query.dsl.core.ParseError;

/**
 * Builds the immutable {@link Program} from the parse tree. One visit method per production.
 */
public class ParseTreeTransformer extends DSLBaseVisitor<Object>{

	public Program transform(final ParseTree tree){
		if(!(tree instanceof DSLParser.ProgramContext)){
			throw new ParseError("Expected a program parse tree but got: "
					+ (tree == null ? "NULL" : tree.getClass().getSimpleName()));
		}
		return visitProgram((DSLParser.ProgramContext)tree);
	}

	@Override
	public Program visitProgram(final DSLParser.ProgramContext ctx){
		final List<Statement> statements = new ArrayList<Statement>();
		for(final DSLParser.StatementContext statementCtx : ctx.statement()){
			statements.add(visitStatement(statementCtx));
		}
		return new Program(statements);
	}

	@Override
	public Statement visitStatement(final DSLParser.StatementContext ctx){
		if(ctx.getChildCount() != 1){
			throw error(ctx, "Unexpected statement shape");
		}
		final Object result = visit(ctx.getChild(0));
		if(!(result instanceof Statement)){
			throw error(ctx, "Unexpected statement: '" + ctx.getText() + "'");
		}
		return (Statement)result;
	}

	/////////////////////////////////////////////////////
	// Schema definitions

	@Override
	public EntityDef visitEntityDef(final DSLParser.EntityDefContext ctx){
		final String extendsName = ctx.extendsClause() == null ? null : ctx.extendsClause().TOKEN_NAME().getText();
		return new EntityDef(ctx.TOKEN_NAME().getText(), visitOptionalFieldList(ctx.fieldList()), extendsName);
	}

	@Override
	public RelationshipDef visitRelationshipDef(final DSLParser.RelationshipDefContext ctx){
		final DSLParser.RelationshipEndContext from = ctx.relationshipEnd(0);
		final DSLParser.RelationshipEndContext to = ctx.relationshipEnd(1);
		if(from == null || to == null){
			throw error(ctx, "Relationship must have a source and a target entity");
		}
		final List<FieldDecl> fields = ctx.fieldBlock() == null
				? new ArrayList<FieldDecl>() : visitFieldBlock(ctx.fieldBlock());
		return new RelationshipDef(ctx.TOKEN_NAME().getText(),
				from.TOKEN_NAME().getText(), visitOptionalMultiplicity(from.multiplicity()),
				to.TOKEN_NAME().getText(), visitOptionalMultiplicity(to.multiplicity()),
				fields);
	}

	private Multiplicity visitOptionalMultiplicity(final DSLParser.MultiplicityContext ctx){
		return ctx == null ? Multiplicity.ONE : visitMultiplicity(ctx);
	}

	@Override
	public Multiplicity visitMultiplicity(final DSLParser.MultiplicityContext ctx){
		if(ctx.TOKEN_STAR() != null){
			return Multiplicity.MANY;
		}
		if("1".equals(ctx.getText())){
			return Multiplicity.ONE;
		}
		throw error(ctx, "Invalid multiplicity '" + ctx.getText() + "'. Must be '1' or '*'");
	}

	@Override
	public List<FieldDecl> visitFieldBlock(final DSLParser.FieldBlockContext ctx){
		return visitOptionalFieldList(ctx.fieldList());
	}

	private List<FieldDecl> visitOptionalFieldList(final DSLParser.FieldListContext ctx){
		return ctx == null ? new ArrayList<FieldDecl>() : visitFieldList(ctx);
	}

	@Override
	public List<FieldDecl> visitFieldList(final DSLParser.FieldListContext ctx){
		final List<FieldDecl> fields = new ArrayList<FieldDecl>();
		for(final DSLParser.FieldDeclContext fieldCtx : ctx.fieldDecl()){
			fields.add(visitFieldDecl(fieldCtx));
		}
		return fields;
	}

	@Override
	public FieldDecl visitFieldDecl(final DSLParser.FieldDeclContext ctx){
		return new FieldDecl(ctx.TOKEN_NAME().getText(), visitDataType(ctx.dataType()));
	}

	@Override
	public DataType visitDataType(final DSLParser.DataTypeContext ctx){
		final DataType dataType = new DataType(ctx.TOKEN_NAME().getText(), ctx.TOKEN_LBRACKET() != null);
		// All-caps names are reserved for primitive types. Anything else is an entity reference.
		if(!dataType.isPrimitive() && isAllUpperCase(dataType.getName())){
			throw error(ctx, "Unknown data type: " + dataType.getName());
		}
		return dataType;
	}

	private static boolean isAllUpperCase(final String name){
		boolean hasLetter = false;
		for(final char c : name.toCharArray()){
			if(Character.isLowerCase(c)){
				return false;
			}
			hasLetter |= Character.isLetter(c);
		}
		return hasLetter;
	}

	/////////////////////////////////////////////////////
	// Data manipulation

	@Override
	public InsertEntity visitInsertEntity(final DSLParser.InsertEntityContext ctx){
		final String alias = ctx.aliasClause() == null ? null : ctx.aliasClause().TOKEN_NAME().getText();
		return new InsertEntity(ctx.TOKEN_NAME().getText(), visitOptionalAssignmentList(ctx.assignmentList()), alias);
	}

	private List<Assignment> visitOptionalAssignmentList(final DSLParser.AssignmentListContext ctx){
		return ctx == null ? new ArrayList<Assignment>() : visitAssignmentList(ctx);
	}

	@Override
	public List<Assignment> visitAssignmentList(final DSLParser.AssignmentListContext ctx){
		final List<Assignment> assignments = new ArrayList<Assignment>();
		for(final DSLParser.AssignmentContext assignmentCtx : ctx.assignment()){
			assignments.add(visitAssignment(assignmentCtx));
		}
		return assignments;
	}

	@Override
	public Assignment visitAssignment(final DSLParser.AssignmentContext ctx){
		final String field = ctx.TOKEN_NAME().getText();
		final DSLParser.ValueContext valueCtx = ctx.value();
		if(valueCtx instanceof DSLParser.LiteralValueContext){
			return Assignment.ofLiteral(field, visitLiteral(((DSLParser.LiteralValueContext)valueCtx).literal()));
		}else if(valueCtx instanceof DSLParser.ReferenceValueContext){
			return Assignment.ofReference(field, ((DSLParser.ReferenceValueContext)valueCtx).TOKEN_NAME().getText());
		}
		throw error(ctx, "Unexpected value in assignment to '" + field + "'");
	}

	@Override
	public ConnectRelationship visitConnectRelationship(final DSLParser.ConnectRelationshipContext ctx){
		final List<Assignment> properties = ctx.propertyBlock() == null
				? new ArrayList<Assignment>() : visitPropertyBlock(ctx.propertyBlock());
		return new ConnectRelationship(toNodeReference(ctx.nodeReference(0)), ctx.TOKEN_NAME().getText(),
				toNodeReference(ctx.nodeReference(1)), properties);
	}

	@Override
	public List<Assignment> visitPropertyBlock(final DSLParser.PropertyBlockContext ctx){
		return visitOptionalAssignmentList(ctx.assignmentList());
	}

	private NodeReference toNodeReference(final DSLParser.NodeReferenceContext ctx){
		if(ctx instanceof DSLParser.AliasReferenceContext){
			return NodeReference.ofAlias(((DSLParser.AliasReferenceContext)ctx).TOKEN_NAME().getText());
		}else if(ctx instanceof DSLParser.IdReferenceContext){
			return NodeReference.ofId(parseIdentifier(((DSLParser.IdReferenceContext)ctx).TOKEN_NUMBER()));
		}
		throw error(ctx, "Unexpected node reference: '" + (ctx == null ? null : ctx.getText()) + "'");
	}

	@Override
	public UpdateStatement visitUpdateStatement(final DSLParser.UpdateStatementContext ctx){
		return new UpdateStatement(toTargetRef(ctx.targetReference()), visitAssignmentList(ctx.assignmentList()));
	}

	@Override
	public DeleteStatement visitDeleteStatement(final DSLParser.DeleteStatementContext ctx){
		return new DeleteStatement(toTargetRef(ctx.targetReference()));
	}

	private TargetRef toTargetRef(final DSLParser.TargetReferenceContext ctx){
		if(ctx instanceof DSLParser.PatternTargetContext){
			final DSLParser.PatternTargetContext patternCtx = (DSLParser.PatternTargetContext)ctx;
			final Condition condition = patternCtx.condition() == null ? null : visitCondition(patternCtx.condition());
			return TargetRef.ofPattern(patternCtx.TOKEN_NAME().getText(), condition);
		}else if(ctx instanceof DSLParser.AliasTargetContext){
			return TargetRef.ofAlias(((DSLParser.AliasTargetContext)ctx).TOKEN_NAME().getText());
		}else if(ctx instanceof DSLParser.IdTargetContext){
			return TargetRef.ofId(parseIdentifier(((DSLParser.IdTargetContext)ctx).TOKEN_NUMBER()));
		}
		throw error(ctx, "Unexpected target: '" + (ctx == null ? null : ctx.getText()) + "'");
	}

	/////////////////////////////////////////////////////
	// Queries

	@Override
	public QueryStatement visitQueryStatement(final DSLParser.QueryStatementContext ctx){
		final Condition where = ctx.whereClause() == null ? null : visitCondition(ctx.whereClause().condition());
		final List<ReturnItem> returnItems = ctx.returnClause() == null
				? new ArrayList<ReturnItem>() : visitReturnClause(ctx.returnClause());
		return new QueryStatement(visitPattern(ctx.pattern()), where, returnItems);
	}

	@Override
	public Pattern visitPattern(final DSLParser.PatternContext ctx){
		final List<NodePattern> nodes = new ArrayList<NodePattern>();
		final List<EdgePattern> edges = new ArrayList<EdgePattern>();
		boolean expectNode = true;
		for(final ParseTree child : ctx.children){
			if(expectNode && child instanceof DSLParser.NodePatternContext){
				nodes.add(visitNodePattern((DSLParser.NodePatternContext)child));
			}else if(!expectNode && child instanceof DSLParser.EdgePatternContext){
				edges.add(visitEdgePattern((DSLParser.EdgePatternContext)child));
			}else{
				throw error(ctx, "Pattern must alternate between nodes and edges: '" + ctx.getText() + "'");
			}
			expectNode = !expectNode;
		}
		if(expectNode){
			throw error(ctx, "Pattern must end with a node: '" + ctx.getText() + "'");
		}
		return new Pattern(nodes, edges);
	}

	@Override
	public NodePattern visitNodePattern(final DSLParser.NodePatternContext ctx){
		final List<TerminalNode> names = ctx.TOKEN_NAME();
		final String alias;
		final String entityType;
		if(ctx.TOKEN_COLON() == null){
			alias = names.isEmpty() ? null : names.get(0).getText();
			entityType = null;
		}else if(names.size() == 2){
			alias = names.get(0).getText();
			entityType = names.get(1).getText();
		}else if(names.size() == 1){
			alias = null;
			entityType = names.get(0).getText();
		}else{
			throw error(ctx, "Unexpected node pattern: '" + ctx.getText() + "'");
		}
		final Condition condition = ctx.inlineCondition() == null ? null : visitCondition(ctx.inlineCondition().condition());
		return new NodePattern(alias, entityType, condition);
	}

	@Override
	public EdgePattern visitEdgePattern(final DSLParser.EdgePatternContext ctx){
		final boolean leftArrow = ctx.edgeStart().TOKEN_LEFT_ARROW() != null;
		final boolean rightArrow = ctx.edgeEnd().TOKEN_ARROW() != null;
		final Direction direction;
		if(leftArrow && rightArrow){
			throw error(ctx, "Edge cannot point in both directions: '" + ctx.getText() + "'");
		}else if(rightArrow){
			direction = Direction.FORWARD;
		}else if(leftArrow){
			direction = Direction.BACKWARD;
		}else{
			direction = Direction.BIDIRECTIONAL;
		}

		String relationship = null;
		Condition condition = null;
		final DSLParser.EdgeDetailContext detail = ctx.edgeDetail();
		if(detail != null){
			relationship = detail.TOKEN_NAME() == null ? null : detail.TOKEN_NAME().getText();
			condition = detail.inlineCondition() == null ? null : visitCondition(detail.inlineCondition().condition());
		}
		return new EdgePattern(relationship, condition, direction);
	}

	@Override
	public List<ReturnItem> visitReturnClause(final DSLParser.ReturnClauseContext ctx){
		final List<ReturnItem> items = new ArrayList<ReturnItem>();
		// 'RETURN *' gives no items
		for(final DSLParser.ReturnItemContext itemCtx : ctx.returnItem()){
			items.add(visitReturnItem(itemCtx));
		}
		return items;
	}

	@Override
	public ReturnItem visitReturnItem(final DSLParser.ReturnItemContext ctx){
		final List<TerminalNode> names = ctx.TOKEN_NAME();
		return new ReturnItem(names.get(0).getText(), names.size() > 1 ? names.get(1).getText() : null);
	}

	/////////////////////////////////////////////////////
	// Conditions and literals

	@Override
	public Condition visitCondition(final DSLParser.ConditionContext ctx){
		final List<PropertyCondition> conditions = new ArrayList<PropertyCondition>();
		for(final DSLParser.PropertyConditionContext conditionCtx : ctx.propertyCondition()){
			conditions.add(visitPropertyCondition(conditionCtx));
		}
		final List<BooleanOperator> operators = new ArrayList<BooleanOperator>();
		for(final DSLParser.BooleanOperatorContext operatorCtx : ctx.booleanOperator()){
			operators.add(visitBooleanOperator(operatorCtx));
		}
		if(operators.size() != conditions.size() - 1){
			throw error(ctx, "Malformed condition: '" + ctx.getText() + "'");
		}
		return new Condition(conditions, operators);
	}

	@Override
	public BooleanOperator visitBooleanOperator(final DSLParser.BooleanOperatorContext ctx){
		return ctx.TOKEN_AND() != null ? BooleanOperator.AND : BooleanOperator.OR;
	}

	@Override
	public PropertyCondition visitPropertyCondition(final DSLParser.PropertyConditionContext ctx){
		final List<TerminalNode> names = ctx.propertyPath().TOKEN_NAME();
		final Literal value = visitLiteral(ctx.literal());
		if(names.size() == 1){
			return new PropertyCondition(null, names.get(0).getText(), value);
		}
		return new PropertyCondition(names.get(0).getText(), names.get(1).getText(), value);
	}

	@Override
	public Literal visitLiteral(final DSLParser.LiteralContext ctx){
		if(ctx.TOKEN_STRING() != null){
			final String quoted = ctx.TOKEN_STRING().getText();
			return Literal.ofString(quoted.substring(1, quoted.length() - 1));
		}else if(ctx.TOKEN_NUMBER() != null){
			return parseNumber(ctx.TOKEN_NUMBER());
		}else if(ctx.TOKEN_TRUE() != null){
			return Literal.ofBoolean(true);
		}else if(ctx.TOKEN_FALSE() != null){
			return Literal.ofBoolean(false);
		}else if(ctx.TOKEN_NULL() != null){
			return Literal.ofNull();
		}
		throw error(ctx, "Unexpected literal: '" + ctx.getText() + "'");
	}

	private Literal parseNumber(final TerminalNode node){
		final String text = node.getText();
		try{
			if(text.contains(".")){
				return Literal.ofDouble(Double.parseDouble(text));
			}
			return Literal.ofLong(Long.parseLong(text));
		}catch(NumberFormatException nfe){
			throw error(node.getSymbol(), "Number out of range: '" + text + "'", nfe);
		}
	}

	private long parseIdentifier(final TerminalNode node){
		final String text = node.getText();
		if(text.contains(".")){
			throw error(node.getSymbol(), "Node identifier must be an integer: '" + text + "'", null);
		}
		try{
			return Long.parseLong(text);
		}catch(NumberFormatException nfe){
			throw error(node.getSymbol(), "Node identifier out of range: '" + text + "'", nfe);
		}
	}

	/////////////////////////////////////////////////////

	private static ParseError error(final ParserRuleContext ctx, final String message){
		if(ctx == null){
			return new ParseError(message);
		}
		return error(ctx.getStart(), message, null);
	}

	private static ParseError error(final Token token, final String message, final Throwable cause){
		if(token == null){
			return new ParseError(message, null, null, null, cause);
		}
		String sourceText = null;
		if(token.getInputStream() != null){
			sourceText = token.getInputStream().getText(Interval.of(0, token.getInputStream().size() - 1));
		}
		return new ParseError(message, token.getLine(), token.getCharPositionInLine() + 1, sourceText, cause);
	}
}
