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
 * MATCH &lt;pattern&gt; [WHERE &lt;condition&gt;] [RETURN ...];
 * 
 * An empty list of return items means everything is returned.
 */
public class QueryStatement extends Statement{

	private final Pattern pattern;
	private final Condition where;
	private final List<ReturnItem> returnItems;

	public QueryStatement(final Pattern pattern, final Condition where, final List<ReturnItem> returnItems){
		super(StatementType.QUERY);
		this.pattern = Objects.requireNonNull(pattern, "pattern");
		this.where = where;
		this.returnItems = Collections.unmodifiableList(new ArrayList<ReturnItem>(returnItems));
	}

	public Pattern getPattern(){
		return pattern;
	}

	public Condition getWhere(){
		return where;
	}

	public List<ReturnItem> getReturnItems(){
		return returnItems;
	}

	@Override
	public String getLabel(){
		return "QueryStatement";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.child("pattern", pattern);
		if(where != null){
			fields.child("where", where);
		}
		fields.children("returnItems", returnItems);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final QueryStatement other = (QueryStatement)obj;
		return pattern.equals(other.pattern) && Objects.equals(where, other.where)
				&& returnItems.equals(other.returnItems);
	}

	@Override
	public int hashCode(){
		return Objects.hash(pattern, where, returnItems);
	}
}
