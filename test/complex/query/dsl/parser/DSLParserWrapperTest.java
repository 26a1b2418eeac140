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

package complex.query.dsl.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import complex.query.dsl.core.ParseError;

class DSLParserWrapperTest{

	@TempDir
	Path directory;

	@Test
	void parsesScriptFile() throws Exception{
		final Path script = directory.resolve("schema.cdsl");
		Files.write(script, "ENTITY Foo { x: STRING };\nMATCH (f:Foo) RETURN f.x;\n".getBytes(StandardCharsets.UTF_8));
		final DSLParser.ProgramContext tree = new DSLParserWrapper().parseFile(script.toString());
		assertEquals(2, tree.statement().size());
	}

	@Test
	void nullTextIsParseError(){
		assertThrows(ParseError.class, () -> new DSLParserWrapper().parse(null));
	}

	@Test
	void firstErrorAborts(){
		final ParseError error = assertThrows(ParseError.class,
				() -> new DSLParserWrapper().parse("INSERT ;\nDELETE ;"));
		assertEquals(1, error.getLine());
	}
}
