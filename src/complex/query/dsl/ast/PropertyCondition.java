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
 * '[qualifier.]property = literal'
 */
public class PropertyCondition extends TreeStringSerializable{

	private final String qualifier;
	private final String property;
	private final Literal value;

	public PropertyCondition(final String qualifier, final String property, final Literal value){
		this.qualifier = qualifier;
		this.property = Objects.requireNonNull(property, "property");
		this.value = Objects.requireNonNull(value, "value");
	}

	/**
	 * @return the alias before the dot, or null if the property is unqualified
	 */
	public String getQualifier(){
		return qualifier;
	}

	public String getProperty(){
		return property;
	}

	public Literal getValue(){
		return value;
	}

	@Override
	public String getLabel(){
		return "PropertyCondition";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("property", qualifier == null ? property : qualifier + "." + property)
			.inline("value", value.getValue());
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final PropertyCondition other = (PropertyCondition)obj;
		return Objects.equals(qualifier, other.qualifier) && property.equals(other.property)
				&& value.equals(other.value);
	}

	@Override
	public int hashCode(){
		return Objects.hash(qualifier, property, value);
	}
}
