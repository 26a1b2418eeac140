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

import complex.query.dsl.utility.TreeStringSerializable;

/**
 * Nodes and the edges between them. Edge i connects node i and node i+1.
 */
public class Pattern extends TreeStringSerializable{

	private final List<NodePattern> nodes;
	private final List<EdgePattern> edges;

	public Pattern(final List<NodePattern> nodes, final List<EdgePattern> edges){
		this.nodes = Collections.unmodifiableList(new ArrayList<NodePattern>(nodes));
		this.edges = Collections.unmodifiableList(new ArrayList<EdgePattern>(edges));
	}

	public List<NodePattern> getNodes(){
		return nodes;
	}

	public List<EdgePattern> getEdges(){
		return edges;
	}

	/**
	 * @return true if there is at least one node and exactly one edge between consecutive nodes
	 */
	public boolean isConnected(){
		return !nodes.isEmpty() && edges.size() == nodes.size() - 1;
	}

	@Override
	public String getLabel(){
		return "Pattern";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.children("nodes", nodes).children("edges", edges);
	}

	@Override
	public boolean equals(final Object obj){
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		final Pattern other = (Pattern)obj;
		return nodes.equals(other.nodes) && edges.equals(other.edges);
	}

	@Override
	public int hashCode(){
		return 31 * nodes.hashCode() + edges.hashCode();
	}
}
