package lr0.automaton;

import java.util.*;
import java.util.stream.Collectors;

import lr0.grammar.*;
import lr0.util.Utils;

/**
 * The LR(0) automaton of an augmented grammar: states, edges, conflicts and the optional state limit advisory.
 *
 * Immutable, it can be read by several consumers at once. Use the {@link AutomatonBuilder} to create one.
 */
public class Automaton {

	public final Grammar grammar;

	private final List<State> states;
	private final List<Edge> edges;
	private final List<Conflict> conflicts;
	private final StateLimitAdvisory stateLimitAdvisory;

	private final Map<Integer, List<Edge>> edgesPerState = new HashMap<>();
	private final Map<ItemSet, State> statesPerItems = new HashMap<>();

	Automaton(Grammar grammar, List<State> states, List<Edge> edges, List<Conflict> conflicts,
	          StateLimitAdvisory stateLimitAdvisory) {
		this.grammar = grammar;
		this.states = Collections.unmodifiableList(new ArrayList<>(states));
		this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
		this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
		this.stateLimitAdvisory = stateLimitAdvisory;
		for (State state : states){
			edgesPerState.put(state.id, new ArrayList<>());
			statesPerItems.put(state.items, state);
		}
		for (Edge edge : edges){
			edgesPerState.get(edge.sourceId).add(edge);
		}
	}

	public int getStartStateId(){
		return 0;
	}

	public State getStartState(){
		return states.get(getStartStateId());
	}

	/**
	 * States ordered by id
	 */
	public List<State> getStates() {
		return states;
	}

	/**
	 * @throws IndexOutOfBoundsException if there is no state with this id
	 */
	public State getState(int id){
		return states.get(id);
	}

	public int size(){
		return states.size();
	}

	/**
	 * Edges in the order of their discovery
	 */
	public List<Edge> getEdges() {
		return edges;
	}

	public List<Edge> getEdgesFrom(int stateId){
		return Collections.unmodifiableList(edgesPerState.getOrDefault(stateId, Collections.emptyList()));
	}

	/**
	 * @return state reached from the passed state by consuming the symbol, empty if there is no such transition
	 */
	public Optional<State> transition(int stateId, Symbol symbol){
		for (Edge edge : getEdgesFrom(stateId)){
			if (edge.symbol.equals(symbol)){
				return Optional.of(states.get(edge.targetId));
			}
		}
		return Optional.empty();
	}

	/**
	 * @return state reached from the passed state by consuming the symbols one after another
	 */
	public Optional<State> transition(int stateId, String... symbols){
		Optional<State> current = Optional.of(getState(stateId));
		for (String name : symbols){
			Symbol symbol = grammar.getSymbol(name);
			if (symbol == null){
				return Optional.empty();
			}
			current = current.flatMap(s -> transition(s.id, symbol));
		}
		return current;
	}

	/**
	 * @return state with exactly the passed items
	 */
	public Optional<State> findState(ItemSet items){
		return Optional.ofNullable(statesPerItems.get(items));
	}

	public List<State> getAcceptanceStates(){
		return states.stream().filter(State::isAcceptance).collect(Collectors.toList());
	}

	public List<Conflict> getConflicts() {
		return conflicts;
	}

	public List<Conflict> getConflictsOf(int stateId){
		return conflicts.stream().filter(c -> c.stateId == stateId).collect(Collectors.toList());
	}

	public boolean hasConflicts(){
		return !conflicts.isEmpty();
	}

	public boolean isShiftReduceConflicted(int stateId){
		return hasConflict(stateId, Conflict.Type.SHIFT_REDUCE);
	}

	public boolean isReduceReduceConflicted(int stateId){
		return hasConflict(stateId, Conflict.Type.REDUCE_REDUCE);
	}

	private boolean hasConflict(int stateId, Conflict.Type type){
		return conflicts.stream().anyMatch(c -> c.stateId == stateId && c.type == type);
	}

	public Optional<StateLimitAdvisory> getStateLimitAdvisory() {
		return Optional.ofNullable(stateLimitAdvisory);
	}

	/**
	 * Textual report: the states with their items, completed productions, conflicts and edges, followed by the
	 * advisory if present.
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != getStartStateId()){
				builder.append("\n–––––––\n");
			}
			builder.append(state);
			if (state.isAcceptance()){
				builder.append("\n  reduce: ").append(Utils.join(state.getCompletedProductionIndices(), ", "));
			}
			for (Conflict conflict : getConflictsOf(state.id)){
				builder.append("\n  ").append(conflict);
			}
			for (Edge edge : getEdgesFrom(state.id)){
				builder.append("\n  ").append(edge.symbol).append(" → I").append(edge.targetId);
			}
		}
		if (stateLimitAdvisory != null){
			builder.append("\n\n").append(stateLimitAdvisory);
		}
		return builder.toString();
	}
}
