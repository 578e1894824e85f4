package lr0.grammar;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Two symbols are equal if they are of the same kind and have the same name.
 */
public abstract class Symbol implements Comparable<Symbol> {

	public enum Kind {
		TERMINAL, NON_TERMINAL
	}

	/**
	 * Name of the symbol, as declared in the grammar
	 */
	public final String name;

	/**
	 * Position of the symbol in the list of declared terminals or non terminals
	 */
	public final int id;

	protected Symbol(int id, String name) {
		this.id = id;
		this.name = name;
	}

	public abstract Kind kind();

	public boolean isTerminal(){
		return kind() == Kind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind() == Kind.NON_TERMINAL;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + kind().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Symbol && ((Symbol) obj).kind() == kind() && ((Symbol) obj).name.equals(name);
	}

	/**
	 * Terminals come before non terminals, symbols of the same kind are ordered by their declaration.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (kind() != o.kind()){
			return kind().compareTo(o.kind());
		}
		return Integer.compare(id, o.id);
	}

	@Override
	public String toString() {
		return name;
	}
}
