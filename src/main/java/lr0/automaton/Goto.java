package lr0.automaton;

import java.util.*;

import lr0.grammar.*;

/**
 * Transition function of the automaton: the closed item set reached from an item set by consuming one symbol.
 */
public final class Goto {

	private Goto(){
	}

	/**
	 * Advances the dot of all items that stand in front of the passed symbol and closes the result.
	 *
	 * @return closed item set, empty if no item stands in front of the symbol (then there is no transition)
	 */
	public static ItemSet of(Grammar grammar, ItemSet items, Symbol symbol){
		List<Item> advanced = new ArrayList<>();
		for (Item item : items){
			if (item.inFrontOf(symbol)){
				advanced.add(item.advance());
			}
		}
		if (advanced.isEmpty()){
			return ItemSet.empty();
		}
		return Closure.of(grammar, advanced);
	}

	/**
	 * Symbols with a non empty goto from the passed item set, in the symbol order of the grammar
	 */
	public static List<Symbol> symbolsAfterDot(Grammar grammar, ItemSet items){
		Set<Symbol> next = new HashSet<>();
		for (Item item : items){
			if (item.canAdvance()){
				next.add(item.nextSymbol());
			}
		}
		List<Symbol> symbols = new ArrayList<>();
		for (Symbol symbol : grammar.getSymbols()){
			if (next.contains(symbol)){
				symbols.add(symbol);
			}
		}
		return symbols;
	}
}
