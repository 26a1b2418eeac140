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

import complex.query.dsl.utility.TreeStringSerializable;

public abstract class Statement extends TreeStringSerializable{

	public enum StatementType{
		ENTITY_DEF,
		RELATIONSHIP_DEF,
		INSERT_ENTITY,
		CONNECT_RELATIONSHIP,
		UPDATE,
		DELETE,
		QUERY
	}

	private final StatementType statementType;

	protected Statement(final StatementType statementType){
		this.statementType = statementType;
	}

	public final StatementType getStatementType(){
		return statementType;
	}
}
