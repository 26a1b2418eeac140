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
 * An endpoint of a CONNECT statement. Either a session alias or a native node id.
 */
public class NodeReference extends TreeStringSerializable{

	public enum Kind{ ALIAS, ID }

	private final Kind kind;
	private final String alias;
	private final long id;

	private NodeReference(final Kind kind, final String alias, final long id){
		this.kind = kind;
		this.alias = alias;
		this.id = id;
	}

	public static NodeReference ofAlias(final String alias){
		return new NodeReference(Kind.ALIAS, Objects.requireNonNull(alias, "alias"), 0);
	}

	public static NodeReference ofId(final long id){
		return new NodeReference(Kind.ID, null, id);
	}

	public Kind getKind(){
		return kind;
	}

	public String getAlias(){
		return alias;
	}

	public long getId(){
		return id;
	}

	@Override
	public String getLabel(){
		return "NodeReference";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("kind", kind).inline(kind == Kind.ALIAS ? "alias" : "id", kind == Kind.ALIAS ? alias : id);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final NodeReference other = (NodeReference)obj;
		return kind == other.kind && id == other.id && Objects.equals(alias, other.alias);
	}

	@Override
	public int hashCode(){
		return Objects.hash(kind, alias, id);
	}
}
