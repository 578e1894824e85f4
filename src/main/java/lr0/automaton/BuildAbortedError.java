package lr0.automaton;

import lr0.LR0Exception;

/**
 * Thrown if the construction of an automaton exceeds a budget imposed by the caller.
 *
 * No partial automaton is returned.
 */
public class BuildAbortedError extends LR0Exception {

	/**
	 * Number of states discovered before the construction stopped
	 */
	public final int discoveredStates;

	public BuildAbortedError(int discoveredStates, String message) {
		super(message);
		this.discoveredStates = discoveredStates;
	}
}
