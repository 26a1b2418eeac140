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

public class UpdateStatement extends Statement{

	private final TargetRef target;
	private final List<Assignment> assignments;

	public UpdateStatement(final TargetRef target, final List<Assignment> assignments){
		super(StatementType.UPDATE);
		this.target = Objects.requireNonNull(target, "target");
		if(assignments == null || assignments.isEmpty()){
			throw new IllegalArgumentException("Update must have at least one assignment");
		}
		this.assignments = Collections.unmodifiableList(new ArrayList<Assignment>(assignments));
	}

	public TargetRef getTarget(){
		return target;
	}

	public List<Assignment> getAssignments(){
		return assignments;
	}

	@Override
	public String getLabel(){
		return "UpdateStatement";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.child("target", target);
		fields.children("assignments", assignments);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final UpdateStatement other = (UpdateStatement)obj;
		return target.equals(other.target) && assignments.equals(other.assignments);
	}

	@Override
	public int hashCode(){
		return Objects.hash(target, assignments);
	}
}
