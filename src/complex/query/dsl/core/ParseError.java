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

/**
 * Malformed script text. Raised by the lexer, the parser or the tree transformer.
 */
public class ParseError extends ComplexException{

	private static final long serialVersionUID = -3088162751873029466L;

	private final String detail;
	private final Integer line;
	private final Integer column;
	private final String sourceText;

	public ParseError(final String detail){
		this(detail, null, null, null, null);
	}

	public ParseError(final String detail, final Integer line, final Integer column, final String sourceText){
		this(detail, line, column, sourceText, null);
	}

	public ParseError(final String detail, final Integer line, final Integer column, final String sourceText,
			final Throwable cause){
		super(formatMessage(detail, line, column), cause);
		this.detail = detail;
		this.line = line;
		this.column = column;
		this.sourceText = sourceText;
	}

	private static String formatMessage(final String detail, final Integer line, final Integer column){
		if(line != null && column != null){
			return "Parse error at line " + line + ", column " + column + ": " + detail;
		}
		return detail;
	}

	public String getDetail(){
		return detail;
	}

	/**
	 * @return 1-based line or null if unknown
	 */
	public Integer getLine(){
		return line;
	}

	/**
	 * @return 1-based column or null if unknown
	 */
	public Integer getColumn(){
		return column;
	}

	public String getSourceText(){
		return sourceText;
	}
}
