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
 * CONNECT &lt;from&gt; - &lt;Relationship&gt; -&gt; &lt;to&gt; [{ properties }];
 */
public class ConnectRelationship extends Statement{

	private final NodeReference fromRef;
	private final String relationship;
	private final NodeReference toRef;
	private final List<Assignment> properties;

	public ConnectRelationship(final NodeReference fromRef, final String relationship, final NodeReference toRef,
			final List<Assignment> properties){
		super(StatementType.CONNECT_RELATIONSHIP);
		this.fromRef = Objects.requireNonNull(fromRef, "fromRef");
		this.relationship = Objects.requireNonNull(relationship, "relationship");
		this.toRef = Objects.requireNonNull(toRef, "toRef");
		this.properties = Collections.unmodifiableList(new ArrayList<Assignment>(properties));
	}

	public NodeReference getFromRef(){
		return fromRef;
	}

	public String getRelationship(){
		return relationship;
	}

	public NodeReference getToRef(){
		return toRef;
	}

	public List<Assignment> getProperties(){
		return properties;
	}

	@Override
	public String getLabel(){
		return "ConnectRelationship";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("relationship", relationship);
		fields.child("from", fromRef).child("to", toRef);
		fields.children("properties", properties);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final ConnectRelationship other = (ConnectRelationship)obj;
		return fromRef.equals(other.fromRef) && relationship.equals(other.relationship)
				&& toRef.equals(other.toRef) && properties.equals(other.properties);
	}

	@Override
	public int hashCode(){
		return Objects.hash(fromRef, relationship, toRef, properties);
	}
}
