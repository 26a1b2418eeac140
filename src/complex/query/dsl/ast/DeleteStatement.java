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

public class DeleteStatement extends Statement{

	private final TargetRef target;

	public DeleteStatement(final TargetRef target){
		super(StatementType.DELETE);
		this.target = Objects.requireNonNull(target, "target");
	}

	public TargetRef getTarget(){
		return target;
	}

	@Override
	public String getLabel(){
		return "DeleteStatement";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.child("target", target);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		return target.equals(((DeleteStatement)obj).target);
	}

	@Override
	public int hashCode(){
		return target.hashCode();
	}
}
