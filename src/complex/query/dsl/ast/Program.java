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
 * Ordered statements of one script.
 */
public class Program extends TreeStringSerializable{

	private final List<Statement> statements;

	public Program(final List<Statement> statements){
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	public List<Statement> getStatements(){
		return statements;
	}

	@Override
	public String getLabel(){
		return "Program";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.children("statements", statements);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		return statements.equals(((Program)obj).statements);
	}

	@Override
	public int hashCode(){
		return statements.hashCode();
	}
}
