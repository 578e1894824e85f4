package lr0.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lr0.grammar.Symbol;
import lr0.util.Utils;

/**
 * A state in which an LR(0) parser can't decide on its next action.
 *
 * Conflicts are only reported, LR(0) has no lookahead to resolve them.
 */
public final class Conflict {

	public enum Type {
		SHIFT_REDUCE("shift/reduce"),
		REDUCE_REDUCE("reduce/reduce");

		public final String description;

		Type(String description){
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	public final Type type;

	public final int stateId;

	/**
	 * Ids of the productions that are completed in the state, ascending
	 */
	public final List<Integer> productionIndices;

	/**
	 * Terminals with an outgoing edge, empty for reduce/reduce conflicts
	 */
	public final List<Symbol> shiftSymbols;

	public Conflict(Type type, int stateId, List<Integer> productionIndices, List<Symbol> shiftSymbols) {
		this.type = type;
		this.stateId = stateId;
		this.productionIndices = Collections.unmodifiableList(new ArrayList<>(productionIndices));
		this.shiftSymbols = Collections.unmodifiableList(new ArrayList<>(shiftSymbols));
	}

	@Override
	public String toString() {
		if (type == Type.REDUCE_REDUCE){
			return String.format("%s conflict in I%d between the productions %s", type, stateId,
					Utils.join(productionIndices, ", "));
		}
		return String.format("%s conflict in I%d: reduce by %s or shift %s", type, stateId,
				Utils.join(productionIndices, ", "), Utils.join(shiftSymbols, ", "));
	}
}
