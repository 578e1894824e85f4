package lr0.grammar;

/**
 * A terminal symbol
 */
public final class Terminal extends Symbol {

	public Terminal(int id, String name) {
		super(id, name);
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}
}
