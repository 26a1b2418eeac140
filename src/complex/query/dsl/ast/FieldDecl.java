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

public class FieldDecl extends TreeStringSerializable{

	private final String name;
	private final DataType dataType;

	public FieldDecl(final String name, final DataType dataType){
		this.name = Objects.requireNonNull(name, "name");
		this.dataType = Objects.requireNonNull(dataType, "dataType");
	}

	public String getName(){
		return name;
	}

	public DataType getDataType(){
		return dataType;
	}

	@Override
	public String getLabel(){
		return "FieldDecl";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("name", name).inline("type", dataType.getName() + (dataType.isArray() ? "[]" : ""));
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final FieldDecl other = (FieldDecl)obj;
		return name.equals(other.name) && dataType.equals(other.dataType);
	}

	@Override
	public int hashCode(){
		return Objects.hash(name, dataType);
	}
}
