package lr0.automaton;

import java.util.*;

import lr0.grammar.*;

/**
 * Closure of item sets: adds <pre>B → · γ</pre> for every production of a non terminal <pre>B</pre> that stands
 * right after the dot of an item in the set, until nothing changes anymore.
 */
public final class Closure {

	private Closure(){
	}

	/**
	 * Computes the closure of the passed items.
	 *
	 * @param grammar grammar the items belong to
	 * @param items initial items, duplicates are ignored
	 * @return closed item set, independent of the order of the passed items
	 */
	public static ItemSet of(Grammar grammar, Collection<Item> items){
		Set<Item> closure = new HashSet<>(items);
		Deque<Item> worklist = new ArrayDeque<>(closure);
		while (!worklist.isEmpty()){
			Item item = worklist.poll();
			if (item.atEnd()){
				continue;
			}
			Symbol next = item.nextSymbol();
			switch (next.kind()){
				case NON_TERMINAL:
					for (Production production : grammar.getProductionsOf((NonTerminal) next)){
						Item expanded = new Item(production);
						if (closure.add(expanded)){
							worklist.add(expanded);
						}
					}
					break;
				case TERMINAL:
					break;
			}
		}
		return ItemSet.of(closure);
	}

	public static ItemSet of(Grammar grammar, ItemSet items){
		return of(grammar, items.asList());
	}

	public static ItemSet of(Grammar grammar, Item... items){
		return of(grammar, Arrays.asList(items));
	}
}
