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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import complex.query.dsl.utility.TreeStringSerializable;

/**
 * Property conditions joined left to right by AND/OR. There is always one operator less than conditions.
 */
public class Condition extends TreeStringSerializable{

	private final List<PropertyCondition> conditions;
	private final List<BooleanOperator> operators;

	public Condition(final List<PropertyCondition> conditions, final List<BooleanOperator> operators){
		if(conditions == null || conditions.isEmpty()){
			throw new IllegalArgumentException("Condition must have at least one property condition");
		}
		if(operators == null || operators.size() != conditions.size() - 1){
			throw new IllegalArgumentException("Condition must have exactly one operator between each pair of property conditions");
		}
		this.conditions = Collections.unmodifiableList(new ArrayList<PropertyCondition>(conditions));
		this.operators = Collections.unmodifiableList(new ArrayList<BooleanOperator>(operators));
	}

	public List<PropertyCondition> getConditions(){
		return conditions;
	}

	public List<BooleanOperator> getOperators(){
		return operators;
	}

	public boolean isConjunction(){
		return !operators.contains(BooleanOperator.OR);
	}

	@Override
	public String getLabel(){
		return "Condition";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("operators", operators);
		fields.children("conditions", conditions);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final Condition other = (Condition)obj;
		return conditions.equals(other.conditions) && operators.equals(other.operators);
	}

	@Override
	public int hashCode(){
		return 31 * conditions.hashCode() + operators.hashCode();
	}
}
