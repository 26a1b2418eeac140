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
 * RELATIONSHIP &lt;name&gt; (&lt;from&gt; [1|*] -&gt; &lt;to&gt; [1|*]) [{ fields }];
 */
public class RelationshipDef extends Statement{

	private final String name;
	private final String fromEntity;
	private final Multiplicity fromMultiplicity;
	private final String toEntity;
	private final Multiplicity toMultiplicity;
	private final List<FieldDecl> fields;

	public RelationshipDef(final String name,
			final String fromEntity, final Multiplicity fromMultiplicity,
			final String toEntity, final Multiplicity toMultiplicity,
			final List<FieldDecl> fields){
		super(StatementType.RELATIONSHIP_DEF);
		this.name = Objects.requireNonNull(name, "name");
		this.fromEntity = Objects.requireNonNull(fromEntity, "fromEntity");
		this.fromMultiplicity = Objects.requireNonNull(fromMultiplicity, "fromMultiplicity");
		this.toEntity = Objects.requireNonNull(toEntity, "toEntity");
		this.toMultiplicity = Objects.requireNonNull(toMultiplicity, "toMultiplicity");
		this.fields = Collections.unmodifiableList(new ArrayList<FieldDecl>(fields));
	}

	public String getName(){
		return name;
	}

	public String getFromEntity(){
		return fromEntity;
	}

	public Multiplicity getFromMultiplicity(){
		return fromMultiplicity;
	}

	public String getToEntity(){
		return toEntity;
	}

	public Multiplicity getToMultiplicity(){
		return toMultiplicity;
	}

	public List<FieldDecl> getFields(){
		return fields;
	}

	@Override
	public String getLabel(){
		return "RelationshipDef";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("name", name)
			.inline("from", fromEntity).inline("fromMultiplicity", fromMultiplicity)
			.inline("to", toEntity).inline("toMultiplicity", toMultiplicity);
		fields.children("fields", this.fields);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final RelationshipDef other = (RelationshipDef)obj;
		return name.equals(other.name)
				&& fromEntity.equals(other.fromEntity) && fromMultiplicity == other.fromMultiplicity
				&& toEntity.equals(other.toEntity) && toMultiplicity == other.toMultiplicity
				&& fields.equals(other.fields);
	}

	@Override
	public int hashCode(){
		return Objects.hash(name, fromEntity, fromMultiplicity, toEntity, toMultiplicity, fields);
	}
}
