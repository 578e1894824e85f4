package lr0.automaton;

import java.util.*;

import lr0.grammar.Symbol;

/**
 * Finds the conflicts in the states of an automaton.
 *
 * A state has a reduce/reduce conflict if it completes more than one production and a shift/reduce conflict if it
 * completes a production and has an outgoing edge on a terminal.
 */
public class ConflictAnalyzer {

	private ConflictAnalyzer(){
	}

	/**
	 * @param states states ordered by id
	 * @param edges all edges between the states
	 * @return conflicts ordered by state id, a reduce/reduce conflict of a state comes before its shift/reduce conflict
	 */
	public static List<Conflict> analyze(List<State> states, List<Edge> edges){
		Map<Integer, List<Edge>> edgesPerState = new HashMap<>();
		for (Edge edge : edges){
			edgesPerState.computeIfAbsent(edge.sourceId, id -> new ArrayList<>()).add(edge);
		}
		List<Conflict> conflicts = new ArrayList<>();
		for (State state : states){
			conflicts.addAll(analyze(state, edgesPerState.getOrDefault(state.id, Collections.emptyList())));
		}
		return conflicts;
	}

	/**
	 * @param outgoing edges that start at the passed state
	 */
	public static List<Conflict> analyze(State state, List<Edge> outgoing){
		List<Conflict> conflicts = new ArrayList<>();
		if (!state.isAcceptance()){
			return conflicts;
		}
		List<Integer> completed = state.getCompletedProductionIndices();
		if (completed.size() > 1){
			conflicts.add(new Conflict(Conflict.Type.REDUCE_REDUCE, state.id, completed, Collections.emptyList()));
		}
		List<Symbol> shiftSymbols = new ArrayList<>();
		for (Edge edge : outgoing){
			if (edge.isTerminalEdge() && !shiftSymbols.contains(edge.symbol)){
				shiftSymbols.add(edge.symbol);
			}
		}
		if (!shiftSymbols.isEmpty()){
			Collections.sort(shiftSymbols);
			conflicts.add(new Conflict(Conflict.Type.SHIFT_REDUCE, state.id, completed, shiftSymbols));
		}
		return conflicts;
	}
}
