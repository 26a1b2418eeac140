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

package complex.query.dsl.utility;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for the DSL intermediate representations that can be dumped as an indented tree
 * (e.g. the program and its statements).
 */
public abstract class TreeStringSerializable{

	private static final int maxLineWidth = 120;

	public abstract String getLabel();

	/**
	 * Adds this node's fields to the collector. Scalars are printed inline, nodes and lists of nodes as children.
	 */
	protected abstract void collectFields(Fields fields);

	@Override
	public String toString(){
		return getNodeString(true, true, "", "");
	}

	public String getShortString(){
		final Fields fields = new Fields();
		collectFields(fields);
		return getHeadString(true, "", "", fields, false);
	}

	protected String getNodeString(final boolean isRoot, final boolean isLast, final String parentPrefix,
			final String nodeName){
		final Fields fields = new Fields();
		collectFields(fields);

		final StringBuilder ret = new StringBuilder(getHeadString(isRoot, parentPrefix, nodeName, fields, true));
		ret.append("\n");

		final String childPrefix = isRoot ? "" : getIndentedPrefix(isLast, parentPrefix);
		final int total = fields.childNames.size() + fields.listNames.size();
		int index = 0;
		for(int i = 0; i < fields.childNames.size(); i++, index++){
			final TreeStringSerializable child = fields.children.get(i);
			final boolean last = index == total - 1;
			if(child == null){
				ret.append(childPrefix).append("+-").append(fields.childNames.get(i)).append("=(null)\n");
			}else{
				ret.append(child.getNodeString(false, last, childPrefix, fields.childNames.get(i)));
			}
		}
		for(int i = 0; i < fields.listNames.size(); i++, index++){
			ret.append(getNodeListString(index == total - 1, childPrefix, fields.listNames.get(i), fields.lists.get(i)));
		}
		return ret.toString();
	}

	private String getNodeListString(final boolean isLast, final String prefix, final String nodeName,
			final List<? extends TreeStringSerializable> nodes){
		final StringBuilder ret = new StringBuilder();
		ret.append(prefix).append("+-").append(nodeName).append("=\n");
		final String itemPrefix = getIndentedPrefix(isLast, prefix);
		if(nodes.isEmpty()){
			ret.append(itemPrefix).append("+-[]\n");
			return ret.toString();
		}
		for(int i = 0; i < nodes.size(); i++){
			ret.append(nodes.get(i).getNodeString(false, i == nodes.size() - 1, itemPrefix, ""));
		}
		return ret.toString();
	}

	private String getHeadString(final boolean isRoot, final String parentPrefix, final String nodeName,
			final Fields fields, final boolean multiLine){
		final StringBuilder ret = new StringBuilder();
		final String wrapPrefix = parentPrefix + "  ";
		final StringBuilder currentLine = new StringBuilder(parentPrefix);
		if(!isRoot){
			currentLine.append("+-");
		}
		if(!nodeName.isEmpty()){
			currentLine.append(nodeName).append("=");
		}
		currentLine.append(getLabel());

		if(!fields.inlineNames.isEmpty()){
			currentLine.append("[");
			for(int i = 0; i < fields.inlineNames.size(); i++){
				final StringBuilder inlineField = new StringBuilder(fields.inlineNames.get(i));
				inlineField.append("=").append(escape(fields.inlineValues.get(i)));
				if(i < fields.inlineNames.size() - 1){
					inlineField.append(",");
				}
				if(multiLine && currentLine.length() + inlineField.length() > maxLineWidth){
					ret.append(currentLine).append("\n");
					currentLine.setLength(0);
					currentLine.append(wrapPrefix);
				}
				currentLine.append(inlineField);
			}
			currentLine.append("]");
		}
		ret.append(currentLine);
		return ret.toString();
	}

	private static String getIndentedPrefix(final boolean isLast, final String prefix){
		return prefix + (isLast ? "  " : "| ");
	}

	private static String escape(final String str){
		if(str == null){
			return "(null)";
		}
		return str.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t");
	}

	protected static final class Fields{
		private final List<String> inlineNames = new ArrayList<String>();
		private final List<String> inlineValues = new ArrayList<String>();
		private final List<String> childNames = new ArrayList<String>();
		private final List<TreeStringSerializable> children = new ArrayList<TreeStringSerializable>();
		private final List<String> listNames = new ArrayList<String>();
		private final List<List<? extends TreeStringSerializable>> lists = new ArrayList<List<? extends TreeStringSerializable>>();

		public Fields inline(final String name, final Object value){
			inlineNames.add(name);
			inlineValues.add(value == null ? null : String.valueOf(value));
			return this;
		}

		public Fields child(final String name, final TreeStringSerializable value){
			childNames.add(name);
			children.add(value);
			return this;
		}

		public Fields children(final String name, final List<? extends TreeStringSerializable> values){
			listNames.add(name);
			lists.add(values);
			return this;
		}
	}
}
