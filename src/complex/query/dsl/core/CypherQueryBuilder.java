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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import complex.query.dsl.ast.BooleanOperator;
import complex.query.dsl.ast.Condition;
import complex.query.dsl.ast.EdgePattern;
import complex.query.dsl.ast.NodePattern;
import complex.query.dsl.ast.Pattern;
import complex.query.dsl.ast.PropertyCondition;
import complex.query.dsl.ast.QueryStatement;
import complex.query.dsl.ast.ReturnItem;
import complex.query.dsl.ast.TargetRef;

/**
 * Builds the Cypher text for each statement kind.
 * 
 * Values are inlined as Cypher literals. Strings escape only the backslash and the single quote delimiter.
 */
public class CypherQueryBuilder{

	public static final String nodeAlias = "n";
	public static final String idPropertyName = "id";
	public static final String indexNamePrefix = "complex_";

	public static String createLabelIndex(final String entityType){
		return "CREATE INDEX " + indexNamePrefix + entityType + "_" + idPropertyName
				+ " FOR (" + nodeAlias + ":" + entityType + ") ON (" + nodeAlias + "." + idPropertyName + ")";
	}

	/**
	 * @param properties resolved values in assignment order. Must already contain the reserved id property.
	 */
	public static String createNode(final String entityType, final Map<String, Object> properties){
		return "CREATE (" + nodeAlias + ":" + entityType + formatPropertyMap(properties) + ")"
				+ " RETURN id(" + nodeAlias + ") AS id";
	}

	public static String createRelationship(final long fromId, final String relationship, final long toId,
			final Map<String, Object> properties){
		return "MATCH (a), (b) WHERE id(a) = " + fromId + " AND id(b) = " + toId
				+ " CREATE (a)-[r:" + relationship + formatPropertyMap(properties) + "]->(b)"
				+ " RETURN id(r) AS id";
	}

	/**
	 * Edge from a new node to the node that one of its fields refers to. The edge type is the field name.
	 */
	public static String createReferenceEdge(final long fromId, final String field, final long toId){
		return "MATCH (a), (b) WHERE id(a) = " + fromId + " AND id(b) = " + toId
				+ " CREATE (a)-[:" + field + "]->(b)";
	}

	/**
	 * @param resolvedId native id for alias and id targets. Ignored for pattern targets.
	 */
	public static String updateNodes(final TargetRef target, final Long resolvedId, final Map<String, Object> assignments){
		final List<String> setItems = new ArrayList<String>();
		for(final Map.Entry<String, Object> entry : assignments.entrySet()){
			setItems.add(nodeAlias + "." + entry.getKey() + " = " + formatValue(entry.getValue()));
		}
		return matchTarget(target, resolvedId) + " SET " + StringUtils.join(setItems, ", ");
	}

	public static String deleteNodes(final TargetRef target, final Long resolvedId){
		return matchTarget(target, resolvedId) + " DETACH DELETE " + nodeAlias;
	}

	private static String matchTarget(final TargetRef target, final Long resolvedId){
		switch(target.getKind()){
			case ALIAS:
			case ID:
				return "MATCH (" + nodeAlias + ") WHERE id(" + nodeAlias + ") = " + resolvedId;
			case PATTERN:{
				String query = "MATCH (" + nodeAlias + ":" + target.getEntityType() + ")";
				if(target.getCondition() != null){
					// Every property in a target condition is a property of the target node
					query += " WHERE " + formatCondition(target.getCondition(), nodeAlias, true);
				}
				return query;
			}
			default: throw new IllegalStateException("Unhandled target kind: " + target.getKind());
		}
	}

	/**
	 * @throws SemanticError if the pattern is not connected, an inline condition uses OR, or an alias is unknown
	 */
	public static String matchQuery(final QueryStatement statement){
		final Pattern pattern = statement.getPattern();
		if(!pattern.isConnected()){
			throw new SemanticError("Pattern must have at least one node and exactly one edge between consecutive nodes: "
					+ pattern.getNodes().size() + " node(s), " + pattern.getEdges().size() + " edge(s)");
		}

		final List<String> aliases = effectiveAliases(pattern.getNodes());
		final Set<String> knownAliases = new HashSet<String>(aliases);

		final StringBuilder query = new StringBuilder("MATCH ");
		for(int i = 0; i < pattern.getNodes().size(); i++){
			if(i > 0){
				query.append(formatEdge(pattern.getEdges().get(i - 1)));
			}
			query.append(formatNode(pattern.getNodes().get(i), aliases.get(i)));
		}

		if(statement.getWhere() != null){
			for(final PropertyCondition condition : statement.getWhere().getConditions()){
				if(condition.getQualifier() != null && !knownAliases.contains(condition.getQualifier())){
					throw new SemanticError("Unknown alias: " + condition.getQualifier());
				}
			}
			query.append(" WHERE ").append(formatCondition(statement.getWhere(), aliases.get(0), false));
		}

		query.append(" RETURN ");
		if(statement.getReturnItems().isEmpty()){
			query.append("*");
		}else{
			final List<String> items = new ArrayList<String>();
			for(final ReturnItem item : statement.getReturnItems()){
				if(!knownAliases.contains(item.getAlias())){
					throw new SemanticError("Unknown alias: " + item.getAlias());
				}
				items.add(item.getProperty() == null ? item.getAlias() : item.getAlias() + "." + item.getProperty());
			}
			query.append(StringUtils.join(items, ", "));
		}
		return query.toString();
	}

	/**
	 * The alias of every node. An unnamed node gets 'n' (first node) or 'n&lt;i&gt;' (node at index i),
	 * suffixed with '_&lt;k&gt;' while that name is taken by another node of the pattern.
	 */
	public static List<String> effectiveAliases(final List<NodePattern> nodes){
		final Set<String> taken = new HashSet<String>();
		for(final NodePattern node : nodes){
			if(node.getAlias() != null){
				taken.add(node.getAlias());
			}
		}
		final List<String> aliases = new ArrayList<String>();
		for(int i = 0; i < nodes.size(); i++){
			final NodePattern node = nodes.get(i);
			if(node.getAlias() != null){
				aliases.add(node.getAlias());
				continue;
			}
			final String base = i == 0 ? nodeAlias : nodeAlias + i;
			String alias = base;
			for(int k = 1; taken.contains(alias); k++){
				alias = base + "_" + k;
			}
			taken.add(alias);
			aliases.add(alias);
		}
		return aliases;
	}

	private static String formatNode(final NodePattern node, final String alias){
		String str = "(" + alias;
		if(node.getEntityType() != null){
			str += ":" + node.getEntityType();
		}
		if(node.getCondition() != null){
			str += " " + formatInlineCondition(node.getCondition(), alias);
		}
		return str + ")";
	}

	private static String formatEdge(final EdgePattern edge){
		String detail = "";
		if(edge.getRelationship() != null){
			detail += ":" + edge.getRelationship();
		}
		if(edge.getCondition() != null){
			detail += (detail.isEmpty() ? "" : " ") + formatInlineCondition(edge.getCondition(), null);
		}
		final String body = detail.isEmpty() ? "" : "[" + detail + "]";
		switch(edge.getDirection()){
			case FORWARD: return "-" + body + "->";
			case BACKWARD: return "<-" + body + "-";
			case BIDIRECTIONAL: return "-" + body + "-";
			default: throw new IllegalStateException("Unhandled direction: " + edge.getDirection());
		}
	}

	private static String formatInlineCondition(final Condition condition, final String ownerAlias){
		if(!condition.isConjunction()){
			throw new SemanticError("Inline pattern filters only support AND");
		}
		final List<String> entries = new ArrayList<String>();
		for(final PropertyCondition propertyCondition : condition.getConditions()){
			final String qualifier = propertyCondition.getQualifier();
			if(qualifier != null && !qualifier.equals(ownerAlias)){
				throw new SemanticError("Inline filter property '" + qualifier + "." + propertyCondition.getProperty()
						+ "' does not belong to the filtered element");
			}
			entries.add(propertyCondition.getProperty() + ": " + formatValue(propertyCondition.getValue().getValue()));
		}
		return "{" + StringUtils.join(entries, ", ") + "}";
	}

	/**
	 * Joins left to right. Mixed AND/OR are parenthesized so that the evaluation order is the written one.
	 * 
	 * @param defaultAlias alias for unqualified properties
	 * @param forceDefault bind every property to the default alias
	 */
	public static String formatCondition(final Condition condition, final String defaultAlias, final boolean forceDefault){
		final List<PropertyCondition> conditions = condition.getConditions();
		final List<BooleanOperator> operators = condition.getOperators();
		final boolean mixed = operators.contains(BooleanOperator.AND) && operators.contains(BooleanOperator.OR);
		String expression = formatComparison(conditions.get(0), defaultAlias, forceDefault);
		for(int i = 0; i < operators.size(); i++){
			if(mixed && i > 0){
				expression = "(" + expression + ")";
			}
			expression += " " + operators.get(i).name() + " " + formatComparison(conditions.get(i + 1), defaultAlias, forceDefault);
		}
		return expression;
	}

	private static String formatComparison(final PropertyCondition condition, final String defaultAlias,
			final boolean forceDefault){
		final String alias = (forceDefault || condition.getQualifier() == null) ? defaultAlias : condition.getQualifier();
		final Object value = condition.getValue().getValue();
		if(value == null){
			return alias + "." + condition.getProperty() + " IS NULL";
		}
		return alias + "." + condition.getProperty() + " = " + formatValue(value);
	}

	private static String formatPropertyMap(final Map<String, Object> properties){
		if(properties == null || properties.isEmpty()){
			return "";
		}
		final List<String> entries = new ArrayList<String>();
		for(final Map.Entry<String, Object> entry : properties.entrySet()){
			entries.add(entry.getKey() + ": " + formatValue(entry.getValue()));
		}
		return " {" + StringUtils.join(entries, ", ") + "}";
	}

	/**
	 * String, Long/Integer, Double/Float, Boolean or null as a Cypher literal.
	 */
	public static String formatValue(final Object value){
		if(value == null){
			return "null";
		}else if(value instanceof String){
			return "'" + ((String)value).replace("\\", "\\\\").replace("'", "\\'") + "'";
		}else if(value instanceof Boolean){
			return ((Boolean)value) ? "true" : "false";
		}else if(value instanceof Double || value instanceof Float){
			final String plain = new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
			return plain.contains(".") ? plain : plain + ".0";
		}else if(value instanceof Number){
			return String.valueOf(((Number)value).longValue());
		}else{
			throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
		}
	}
}
