package lr0.automaton;

/**
 * Attached to an automaton that has more states than the configured threshold.
 *
 * The automaton is still complete, consumers use this to decide whether a rendering is worth it.
 */
public final class StateLimitAdvisory {

	public final int threshold;
	public final int stateCount;

	public StateLimitAdvisory(int threshold, int stateCount) {
		this.threshold = threshold;
		this.stateCount = stateCount;
	}

	@Override
	public String toString() {
		return String.format("The automaton has %d states, more than the threshold of %d states", stateCount, threshold);
	}
}
