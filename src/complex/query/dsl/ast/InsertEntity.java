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
import java.util.Objects;

/**
 * INSERT &lt;Entity&gt; { assignments } [AS &lt;alias&gt;];
 */
public class InsertEntity extends Statement{

	private final String entityType;
	private final List<Assignment> assignments;
	private final String alias;

	public InsertEntity(final String entityType, final List<Assignment> assignments, final String alias){
		super(StatementType.INSERT_ENTITY);
		this.entityType = Objects.requireNonNull(entityType, "entityType");
		this.assignments = Collections.unmodifiableList(new ArrayList<Assignment>(assignments));
		this.alias = alias;
	}

	public String getEntityType(){
		return entityType;
	}

	public List<Assignment> getAssignments(){
		return assignments;
	}

	public String getAlias(){
		return alias;
	}

	@Override
	public String getLabel(){
		return "InsertEntity";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("entityType", entityType).inline("alias", alias);
		fields.children("assignments", assignments);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final InsertEntity other = (InsertEntity)obj;
		return entityType.equals(other.entityType) && assignments.equals(other.assignments)
				&& Objects.equals(alias, other.alias);
	}

	@Override
	public int hashCode(){
		return Objects.hash(entityType, assignments, alias);
	}
}
