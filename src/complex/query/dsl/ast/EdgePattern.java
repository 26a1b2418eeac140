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

public class EdgePattern extends TreeStringSerializable{

	private final String relationship;
	private final Condition condition;
	private final Direction direction;

	public EdgePattern(final String relationship, final Condition condition, final Direction direction){
		this.relationship = relationship;
		this.condition = condition;
		this.direction = Objects.requireNonNull(direction, "direction");
	}

	public String getRelationship(){
		return relationship;
	}

	public Condition getCondition(){
		return condition;
	}

	public Direction getDirection(){
		return direction;
	}

	@Override
	public String getLabel(){
		return "EdgePattern";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("relationship", relationship).inline("direction", direction);
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
		final EdgePattern other = (EdgePattern)obj;
		return direction == other.direction && Objects.equals(relationship, other.relationship)
				&& Objects.equals(condition, other.condition);
	}

	@Override
	public int hashCode(){
		return Objects.hash(relationship, condition, direction);
	}
}
