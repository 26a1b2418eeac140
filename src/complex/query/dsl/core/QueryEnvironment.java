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

package complex.query.dsl.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import complex.query.dsl.ast.EntityDef;
import complex.query.dsl.ast.RelationshipDef;
import complex.query.dsl.utility.TreeStringSerializable;

/**
 * Session state of one interpreter: the schema registry and the alias table.
 * 
 * The schema registry lives as long as the environment. The alias table is cleared by the interpreter
 * at the start of each script. Not thread-safe.
 */
public class QueryEnvironment extends TreeStringSerializable{

	private final Logger logger = Logger.getLogger(this.getClass().getName());

	private final Map<String, EntityDef> entityDefinitions = new LinkedHashMap<String, EntityDef>();
	private final Map<String, RelationshipDef> relationshipDefinitions = new LinkedHashMap<String, RelationshipDef>();
	private final Map<String, Long> aliases = new LinkedHashMap<String, Long>();

	/**
	 * Adds the definition or replaces the one with the same name.
	 */
	public void registerEntity(final EntityDef entityDef){
		if(entityDefinitions.put(entityDef.getName(), entityDef) != null){
			logger.fine("Replaced entity definition: " + entityDef.getName());
		}
	}

	/**
	 * Adds the definition or replaces the one with the same name.
	 */
	public void registerRelationship(final RelationshipDef relationshipDef){
		if(relationshipDefinitions.put(relationshipDef.getName(), relationshipDef) != null){
			logger.fine("Replaced relationship definition: " + relationshipDef.getName());
		}
	}

	public EntityDef getEntityDefinition(final String name){
		return entityDefinitions.get(name);
	}

	public RelationshipDef getRelationshipDefinition(final String name){
		return relationshipDefinitions.get(name);
	}

	public boolean isEntityDefined(final String name){
		return entityDefinitions.containsKey(name);
	}

	public boolean isRelationshipDefined(final String name){
		return relationshipDefinitions.containsKey(name);
	}

	/**
	 * @return read-only view in registration order
	 */
	public Map<String, EntityDef> getEntityDefinitions(){
		return Collections.unmodifiableMap(entityDefinitions);
	}

	/**
	 * @return read-only view in registration order
	 */
	public Map<String, RelationshipDef> getRelationshipDefinitions(){
		return Collections.unmodifiableMap(relationshipDefinitions);
	}

	public void bindAlias(final String alias, final long nativeId){
		aliases.put(alias, nativeId);
	}

	/**
	 * @return the native id bound to the alias or null
	 */
	public Long lookupAlias(final String alias){
		return aliases.get(alias);
	}

	public Map<String, Long> getAliases(){
		return Collections.unmodifiableMap(aliases);
	}

	public void clearAliases(){
		aliases.clear();
	}

	@Override
	public String getLabel(){
		return "QueryEnvironment";
	}

	@Override
	protected void collectFields(final Fields fields){
		fields.inline("aliases", aliases);
		fields.children("entities", new ArrayList<EntityDef>(entityDefinitions.values()));
		fields.children("relationships", new ArrayList<RelationshipDef>(relationshipDefinitions.values()));
	}
}
