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

/**
 * ENTITY &lt;name&gt; { fields } [EXTENDS &lt;name&gt;];
 */
public class EntityDef extends Statement{

	private final String name;
	private final List<FieldDecl> fields;
	private final String extendsName;

	public EntityDef(final String name, final List<FieldDecl> fields, final String extendsName){
		super(StatementType.ENTITY_DEF);
		this.name = Objects.requireNonNull(name, "name");
		this.fields = Collections.unmodifiableList(new ArrayList<FieldDecl>(fields));
		this.extendsName = extendsName;
	}

	public String getName(){
		return name;
	}

	public List<FieldDecl> getFields(){
		return fields;
	}

	/**
	 * @return the parent entity name or null. Never validated.
	 */
	public String getExtendsName(){
		return extendsName;
	}

	@Override
	public String getLabel(){
		return "EntityDef";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("name", name).inline("extends", extendsName);
		fields.children("fields", this.fields);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final EntityDef other = (EntityDef)obj;
		return name.equals(other.name) && fields.equals(other.fields) && Objects.equals(extendsName, other.extendsName);
	}

	@Override
	public int hashCode(){
		return Objects.hash(name, fields, extendsName);
	}
}
