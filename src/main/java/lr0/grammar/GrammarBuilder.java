package lr0.grammar;

import java.util.*;

/**
 * Allows the simple creation of grammars.
 *
 * <pre>
 * new GrammarBuilder().initial("E").terminals("+", "n").nonTerminals("E")
 *         .add("E", "E", "+", "n")
 *         .add("E", "n")
 *         .toGrammar();
 * </pre>
 */
public class GrammarBuilder {

	private String initial;
	private final List<String> terminals = new ArrayList<>();
	private final List<String> nonTerminals = new ArrayList<>();
	private final List<RawGrammar.RawProduction> productions = new ArrayList<>();

	public GrammarBuilder initial(String initial){
		this.initial = initial;
		return this;
	}

	public GrammarBuilder terminals(String... terminals){
		this.terminals.addAll(Arrays.asList(terminals));
		return this;
	}

	public GrammarBuilder nonTerminals(String... nonTerminals){
		this.nonTerminals.addAll(Arrays.asList(nonTerminals));
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are names of declared symbols, "" is equivalent to ε.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production, nothing for an epsilon production
	 */
	public GrammarBuilder add(String left, String... right){
		List<String> symbols = new ArrayList<>();
		for (String symbol : right){
			if (symbol != null && symbol.isEmpty()){
				continue;
			}
			symbols.add(symbol);
		}
		productions.add(new RawGrammar.RawProduction(left, symbols));
		return this;
	}

	public RawGrammar toRawGrammar(){
		return new RawGrammar(initial, terminals, nonTerminals, productions);
	}

	/**
	 * @throws GrammarError if the grammar isn't valid
	 */
	public Grammar toGrammar(){
		return Grammar.validate(toRawGrammar());
	}
}
