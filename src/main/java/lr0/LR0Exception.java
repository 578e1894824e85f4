package lr0;

/**
 * Base class of all exceptions thrown while loading grammars and building automata.
 */
public class LR0Exception extends RuntimeException {

	public LR0Exception(String message) {
		super(message);
	}

	public LR0Exception(String message, Throwable cause) {
		super(message, cause);
	}
}
