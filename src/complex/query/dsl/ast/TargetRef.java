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
 * What an UPDATE or DELETE applies to: an alias, a native id, or all nodes of an entity type
 * matching an optional condition.
 */
public class TargetRef extends TreeStringSerializable{

	public enum Kind{ ALIAS, ID, PATTERN }

	private final Kind kind;
	private final String alias;
	private final long id;
	private final String entityType;
	private final Condition condition;

	private TargetRef(final Kind kind, final String alias, final long id, final String entityType,
			final Condition condition){
		this.kind = kind;
		this.alias = alias;
		this.id = id;
		this.entityType = entityType;
		this.condition = condition;
	}

	public static TargetRef ofAlias(final String alias){
		return new TargetRef(Kind.ALIAS, Objects.requireNonNull(alias, "alias"), 0, null, null);
	}

	public static TargetRef ofId(final long id){
		return new TargetRef(Kind.ID, null, id, null, null);
	}

	/**
	 * @param condition may be null to match every node of the type
	 */
	public static TargetRef ofPattern(final String entityType, final Condition condition){
		return new TargetRef(Kind.PATTERN, null, 0, Objects.requireNonNull(entityType, "entityType"), condition);
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

	public String getEntityType(){
		return entityType;
	}

	public Condition getCondition(){
		return condition;
	}

	@Override
	public String getLabel(){
		return "TargetRef";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("kind", kind);
		switch(kind){
			case ALIAS: fields.inline("alias", alias); break;
			case ID: fields.inline("id", id); break;
			case PATTERN:
				fields.inline("entityType", entityType);
				if(condition != null){
					fields.child("condition", condition);
				}
				break;
			default: throw new IllegalStateException("Unhandled target kind: " + kind);
		}
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final TargetRef other = (TargetRef)obj;
		return kind == other.kind && id == other.id && Objects.equals(alias, other.alias)
				&& Objects.equals(entityType, other.entityType) && Objects.equals(condition, other.condition);
	}

	@Override
	public int hashCode(){
		return Objects.hash(kind, alias, id, entityType, condition);
	}
}
