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

package complex.query.dsl.ast;

import java.util.Objects;

import complex.query.dsl.utility.TreeStringSerializable;

/**
 * '( [alias] [: Entity] [{ condition }] )'. All parts are optional.
 */
public class NodePattern extends TreeStringSerializable{

	private final String alias;
	private final String entityType;
	private final Condition condition;

	public NodePattern(final String alias, final String entityType, final Condition condition){
		this.alias = alias;
		this.entityType = entityType;
		this.condition = condition;
	}

	public String getAlias(){
		return alias;
	}

	public String getEntityType(){
		return entityType;
	}

	public Condition getCondition(){
		return condition;
	}

	@Override
	public String getLabel(){
		return "NodePattern";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("alias", alias).inline("entityType", entityType);
		if(condition != null){
			fields.child("condition", condition);
		}
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final NodePattern other = (NodePattern)obj;
		return Objects.equals(alias, other.alias) && Objects.equals(entityType, other.entityType)
				&& Objects.equals(condition, other.condition);
	}

	@Override
	public int hashCode(){
		return Objects.hash(alias, entityType, condition);
	}
}
