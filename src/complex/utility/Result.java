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

package complex.utility;

/**
 * Outcome of an operation that either produced a value or failed with a message,
 * an exception and/or a failed cause.
 */
public class Result<T>{

	public final boolean error;
	public final String errorMessage;
	public final Exception exception;
	public final T result;

	public final Result<?> cause;

	private Result(final boolean error, final String errorMessage, final Exception exception, final T result,
			final Result<?> cause){
		this.error = error;
		this.errorMessage = errorMessage;
		this.exception = exception;
		this.result = result;
		this.cause = cause;
	}

	/**
	 * @return the successful value
	 * @throws IllegalStateException with the full error chain if this is a failed result
	 */
	public T getOrThrow(){
		if(error){
			throw new IllegalStateException(toErrorString().trim(), exception);
		}
		return result;
	}

	public String toErrorString(){
		if(!error){
			return "No error";
		}
		final StringBuilder str = new StringBuilder();
		if(errorMessage != null){
			str.append(errorMessage).append(System.lineSeparator());
		}
		if(exception != null){
			str.append(HelperFunctions.formatExceptionStackTrace(exception)).append(System.lineSeparator());
		}
		if(cause != null){
			str.append(cause.toErrorString()).append(System.lineSeparator());
		}
		return str.toString();
	}

	@Override
	public String toString(){
		return String.format("Result [%s=%s, %s=%s, %s=%s, %s=%s, %s=%s]",
				"error", error,
				"errorMessage", errorMessage,
				"exception", exception,
				"result", result,
				"cause", cause);
	}

	public static <T> Result<T> successful(final T result){
		return new Result<T>(false, null, null, result, null);
	}

	public static <T> Result<T> failed(final String errorMessage, final Exception exception, final Result<?> cause){
		return new Result<T>(true, errorMessage, exception, null, cause);
	}

	public static <T> Result<T> failed(final String errorMessage){
		return failed(errorMessage, null, null);
	}

	public static <T> Result<T> failed(final String errorMessage, final Result<?> cause){
		return failed(errorMessage, null, cause);
	}
}
