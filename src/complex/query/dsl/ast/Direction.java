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

/**
 * Direction of an edge in a match pattern, relative to the node on its left.
 */
public enum Direction{
	/** (a)-[]-&gt;(b) */
	FORWARD,
	/** (a)&lt;-[]-(b) */
	BACKWARD,
	/** (a)-[]-(b) */
	BIDIRECTIONAL
}
