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
 * A constant value. Numbers are held as Long or Double.
 */
public class Literal extends TreeStringSerializable{

	public enum Kind{ STRING, NUMBER, BOOLEAN, NULL }

	private static final Literal nullLiteral = new Literal(Kind.NULL, null);

	private final Kind kind;
	private final Object value;

	private Literal(final Kind kind, final Object value){
		this.kind = kind;
		this.value = value;
	}

	public static Literal ofString(final String value){
		return new Literal(Kind.STRING, Objects.requireNonNull(value, "value"));
	}

	public static Literal ofLong(final long value){
		return new Literal(Kind.NUMBER, Long.valueOf(value));
	}

	public static Literal ofDouble(final double value){
		return new Literal(Kind.NUMBER, Double.valueOf(value));
	}

	public static Literal ofBoolean(final boolean value){
		return new Literal(Kind.BOOLEAN, Boolean.valueOf(value));
	}

	public static Literal ofNull(){
		return nullLiteral;
	}

	public Kind getKind(){
		return kind;
	}

	/**
	 * @return String, Long, Double, Boolean or null
	 */
	public Object getValue(){
		return value;
	}

	@Override
	public String getLabel(){
		return "Literal";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("kind", kind).inline("value", value);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final Literal other = (Literal)obj;
		return kind == other.kind && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode(){
		return Objects.hash(kind, value);
	}
}
