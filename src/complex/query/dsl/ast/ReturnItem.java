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
 * 'alias' or 'alias.property' in a RETURN clause.
 */
public class ReturnItem extends TreeStringSerializable{

	private final String alias;
	private final String property;

	public ReturnItem(final String alias, final String property){
		this.alias = Objects.requireNonNull(alias, "alias");
		this.property = property;
	}

	public String getAlias(){
		return alias;
	}

	public String getProperty(){
		return property;
	}

	@Override
	public String getLabel(){
		return "ReturnItem";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("alias", alias).inline("property", property);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final ReturnItem other = (ReturnItem)obj;
		return alias.equals(other.alias) && Objects.equals(property, other.property);
	}

	@Override
	public int hashCode(){
		return Objects.hash(alias, property);
	}
}
