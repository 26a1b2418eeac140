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

import java.io.IOException;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import complex.query.dsl.core.ParseError;

/**
 * Parses script text into the ANTLR parse tree of the DSL grammar.
 * 
 * The first lexer or parser error aborts the parse with a {@link ParseError}.
 */
public class DSLParserWrapper{

	public DSLParser.ProgramContext parse(final String text){
		if(text == null){
			throw new ParseError("NULL script text");
		}
		return fromCharStream(CharStreams.fromString(text), text);
	}

	public DSLParser.ProgramContext parseFile(final String filename) throws IOException{
		final CharStream input = CharStreams.fromFileName(filename);
		return fromCharStream(input, input.toString());
	}

	private DSLParser.ProgramContext fromCharStream(final CharStream input, final String sourceText){
		final ThrowingErrorListener errorListener = new ThrowingErrorListener(sourceText);

		final DSLLexer lexer = new DSLLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		final DSLParser parser = new DSLParser(new CommonTokenStream(lexer));
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);
		return parser.program();
	}

	private static final class ThrowingErrorListener extends BaseErrorListener{
		private final String sourceText;

		private ThrowingErrorListener(final String sourceText){
			this.sourceText = sourceText;
		}

		@Override
		public void syntaxError(final Recognizer<?, ?> recognizer, final Object offendingSymbol, final int line,
				final int charPositionInLine, final String msg, final RecognitionException e){
			// ANTLR columns are 0-based
			throw new ParseError(msg, line, charPositionInLine + 1, sourceText, e);
		}
	}
}
