package lr0.grammar;

/**
 * A non terminal symbol, typically written in upper case.
 *
 * The productions of a non terminal are stored in its {@link Grammar}.
 */
public final class NonTerminal extends Symbol {

	public NonTerminal(int id, String name) {
		super(id, name);
	}

	@Override
	public Kind kind() {
		return Kind.NON_TERMINAL;
	}
}
