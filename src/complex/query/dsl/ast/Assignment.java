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
 * 'field = value' where the value is either a literal or a bare name (alias or raw reference).
 */
public class Assignment extends TreeStringSerializable{

	private final String field;
	private final Literal literal;
	private final String reference;

	private Assignment(final String field, final Literal literal, final String reference){
		this.field = Objects.requireNonNull(field, "field");
		this.literal = literal;
		this.reference = reference;
	}

	public static Assignment ofLiteral(final String field, final Literal literal){
		return new Assignment(field, Objects.requireNonNull(literal, "literal"), null);
	}

	public static Assignment ofReference(final String field, final String reference){
		return new Assignment(field, null, Objects.requireNonNull(reference, "reference"));
	}

	public String getField(){
		return field;
	}

	public boolean isReference(){
		return reference != null;
	}

	public Literal getLiteral(){
		return literal;
	}

	public String getReference(){
		return reference;
	}

	@Override
	public String getLabel(){
		return "Assignment";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("field", field);
		if(isReference()){
			fields.inline("reference", reference);
		}else{
			fields.inline("literal", literal.getValue());
		}
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final Assignment other = (Assignment)obj;
		return field.equals(other.field) && Objects.equals(literal, other.literal)
				&& Objects.equals(reference, other.reference);
	}

	@Override
	public int hashCode(){
		return Objects.hash(field, literal, reference);
	}
}
