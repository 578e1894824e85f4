package lr0.automaton;

import java.util.Objects;

import lr0.grammar.Symbol;

/**
 * Transition from one state to another that consumes a symbol.
 */
public final class Edge {

	public final int sourceId;
	public final Symbol symbol;
	public final int targetId;

	public Edge(int sourceId, Symbol symbol, int targetId) {
		this.sourceId = sourceId;
		this.symbol = symbol;
		this.targetId = targetId;
	}

	/**
	 * Does this edge shift a terminal?
	 */
	public boolean isTerminalEdge(){
		return symbol.isTerminal();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Edge)){
			return false;
		}
		Edge other = (Edge) obj;
		return other.sourceId == sourceId && other.targetId == targetId && other.symbol.equals(symbol);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sourceId, symbol, targetId);
	}

	@Override
	public String toString() {
		return "I" + sourceId + " --" + symbol + "--> I" + targetId;
	}
}
