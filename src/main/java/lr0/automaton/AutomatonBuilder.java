package lr0.automaton;

import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;

import lr0.Config;
import lr0.grammar.*;

/**
 * Builds the LR(0) automaton of a grammar.
 *
 * Starts with the closure of the start item <pre>S' → · S</pre> as state I0 and processes the states of a
 * worklist: for each symbol (terminals before non terminals, in declaration order) the goto of the state is
 * computed, an empty goto means no transition, a goto equal to the item set of a known state becomes an edge to that
 * state, any other goto becomes a new state with the next id. The same grammar always yields the same automaton.
 */
public class AutomatonBuilder {

	private static final Logger LOG = Logger.getLogger("LR0");

	private final Grammar grammar;

	private int stateCountWarningThreshold = Config.stateCountWarningThreshold();

	private int stateBudget = Integer.MAX_VALUE;

	private Duration timeBudget = null;

	/**
	 * @param grammar grammar, augmented if it isn't already
	 */
	public AutomatonBuilder(Grammar grammar) {
		this.grammar = grammar.augment();
	}

	public static Automaton build(Grammar grammar){
		return new AutomatonBuilder(grammar).build();
	}

	/**
	 * Number of states above which the built automaton carries a {@link StateLimitAdvisory}
	 */
	public AutomatonBuilder stateCountWarningThreshold(int threshold){
		if (threshold < 0){
			throw new IllegalArgumentException("The threshold has to be non negative");
		}
		this.stateCountWarningThreshold = threshold;
		return this;
	}

	/**
	 * Abort the construction with a {@link BuildAbortedError} once more than the passed number of states is discovered
	 */
	public AutomatonBuilder stateBudget(int maxStates){
		if (maxStates < 1){
			throw new IllegalArgumentException("The state budget has to be positive");
		}
		this.stateBudget = maxStates;
		return this;
	}

	/**
	 * Abort the construction with a {@link BuildAbortedError} once it takes longer than the passed duration
	 */
	public AutomatonBuilder timeBudget(Duration timeBudget){
		this.timeBudget = Objects.requireNonNull(timeBudget);
		return this;
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public Automaton build(){
		long startTime = System.nanoTime();
		List<State> states = new ArrayList<>();
		Map<ItemSet, State> statesPerItems = new HashMap<>();
		List<Edge> edges = new ArrayList<>();
		Deque<State> worklist = new ArrayDeque<>();
		State startState = new State(0, Closure.of(grammar, new Item(grammar.getStartProduction())));
		states.add(startState);
		statesPerItems.put(startState.items, startState);
		worklist.add(startState);
		while (!worklist.isEmpty()){
			checkBudgets(states.size(), startTime);
			State currentState = worklist.poll();
			for (Symbol symbol : grammar.getSymbols()){
				ItemSet items = Goto.of(grammar, currentState.items, symbol);
				if (items.isEmpty()){
					continue;
				}
				State nextState = statesPerItems.get(items);
				if (nextState == null){
					nextState = new State(states.size(), items);
					states.add(nextState);
					statesPerItems.put(items, nextState);
					worklist.add(nextState);
					LOG.fine(() -> "New state " + states.get(states.size() - 1));
				}
				edges.add(new Edge(currentState.id, symbol, nextState.id));
			}
		}
		List<Conflict> conflicts = ConflictAnalyzer.analyze(states, edges);
		for (Conflict conflict : conflicts){
			LOG.info(conflict.toString());
		}
		StateLimitAdvisory advisory = null;
		if (states.size() > stateCountWarningThreshold){
			advisory = new StateLimitAdvisory(stateCountWarningThreshold, states.size());
			LOG.warning(advisory.toString());
		}
		LOG.fine(() -> String.format("Built automaton with %d states and %d edges", states.size(), edges.size()));
		return new Automaton(grammar, states, edges, conflicts, advisory);
	}

	private void checkBudgets(int discoveredStates, long startTime){
		if (discoveredStates > stateBudget){
			throw new BuildAbortedError(discoveredStates, String.format(
					"Aborted the construction after discovering %d states, the budget is %d states",
					discoveredStates, stateBudget));
		}
		if (timeBudget != null && System.nanoTime() - startTime > timeBudget.toNanos()){
			throw new BuildAbortedError(discoveredStates, String.format(
					"Aborted the construction after %s with %d discovered states", timeBudget, discoveredStates));
		}
	}
}
