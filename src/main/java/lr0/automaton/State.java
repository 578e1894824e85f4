package lr0.automaton;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A state of the automaton: a closed item set with an id that is unique in its automaton.
 *
 * A state is an acceptance state if it contains at least one completed item, i.e. the parser can reduce there.
 */
public class State implements Comparable<State> {

	public final int id;
	public final ItemSet items;

	private final List<Integer> completedProductionIndices;

	public State(int id, ItemSet items) {
		this.id = id;
		this.items = items;
		this.completedProductionIndices = items.completedProductionIndices();
	}

	/**
	 * Name of the state, "I" followed by its id
	 */
	public String getName(){
		return "I" + id;
	}

	public boolean isAcceptance(){
		return !completedProductionIndices.isEmpty();
	}

	/**
	 * Ids of the productions that can be reduced in this state, ascending
	 */
	public List<Integer> getCompletedProductionIndices() {
		return completedProductionIndices;
	}

	public List<Item> getCompletedItems(){
		return items.completedItems();
	}

	/**
	 * Items that weren't added by the closure: the items with the dot after the first symbol and the start item.
	 */
	public List<Item> getKernel(){
		return items.stream().filter(i -> i.position > 0 || i.production.id == 0).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return "State " + getName() + "\n" + items;
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
