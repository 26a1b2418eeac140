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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import complex.query.dsl.utility.TreeStringSerializable;

/**
 * A field type. Either one of the primitive type names or the name of an entity (a reference type).
 */
public class DataType extends TreeStringSerializable{

	public static final Set<String> primitiveTypeNames = Collections.unmodifiableSet(new LinkedHashSet<String>(
			Arrays.asList("STRING", "INT", "INTEGER", "FLOAT", "DOUBLE", "BOOL", "BOOLEAN", "DATE", "DATETIME",
					"BLOB", "UUID", "JSON")));

	private final String name;
	private final boolean array;

	public DataType(final String name, final boolean array){
		this.name = Objects.requireNonNull(name, "name");
		this.array = array;
	}

	public String getName(){
		return name;
	}

	public boolean isArray(){
		return array;
	}

	public boolean isPrimitive(){
		return primitiveTypeNames.contains(name);
	}

	@Override
	public String getLabel(){
		return "DataType";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("name", name).inline("array", array);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final DataType other = (DataType)obj;
		return array == other.array && name.equals(other.name);
	}

	@Override
	public int hashCode(){
		return Objects.hash(name, array);
	}
}
