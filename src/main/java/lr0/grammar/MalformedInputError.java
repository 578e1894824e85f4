package lr0.grammar;

import lr0.LR0Exception;

/**
 * Thrown by grammar loaders for structurally invalid input that can't be turned into a {@link RawGrammar}.
 */
public class MalformedInputError extends LR0Exception {

	/**
	 * Location of the error in the grammar description or {@code null} if the input didn't come from a text
	 */
	public final Location location;

	public MalformedInputError(String message) {
		super(message);
		this.location = null;
	}

	public MalformedInputError(String message, Throwable cause) {
		super(message, cause);
		this.location = null;
	}

	public MalformedInputError(Location location, String message) {
		super(String.format("Error at %s: %s", location, message));
		this.location = location;
	}
}
