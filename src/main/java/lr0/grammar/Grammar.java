package lr0.grammar;

import java.util.*;

import static lr0.util.Utils.join;

/**
 * Immutable grammar consisting of terminals, non terminals and productions.
 *
 * Use {@link #validate(RawGrammar)} or the {@link GrammarBuilder} to create a grammar instance and
 * {@link #augment()} to add the start production that the automaton construction begins with.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar {

	/**
	 * Terminals in declaration order
	 */
	private final List<Terminal> terminals;
	/**
	 * Non terminals in declaration order, the augmented start non terminal comes last
	 */
	private final List<NonTerminal> nonTerminals;

	private final List<Production> productions;

	/**
	 * Start non terminal declared by the user
	 */
	private final NonTerminal start;

	/**
	 * Non terminal of the <pre>S' → S</pre> production or {@code null} if the grammar isn't augmented
	 */
	private final NonTerminal augmentedStart;

	private final Map<String, Symbol> symbolsByName = new HashMap<>();

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal = new HashMap<>();

	private Grammar(List<Terminal> terminals, List<NonTerminal> nonTerminals, NonTerminal start,
	                NonTerminal augmentedStart, List<Production> productions) {
		this.terminals = Collections.unmodifiableList(terminals);
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.start = start;
		this.augmentedStart = augmentedStart;
		this.productions = Collections.unmodifiableList(productions);
		for (Symbol symbol : getSymbols()){
			symbolsByName.put(symbol.name, symbol);
		}
		for (NonTerminal nonTerminal : nonTerminals){
			productionsPerNonTerminal.put(nonTerminal, new ArrayList<>());
		}
		for (Production production : productions){
			productionsPerNonTerminal.get(production.left).add(production);
		}
	}

	/**
	 * Checks the raw grammar and creates a grammar from it.
	 *
	 * The checks are done in the following order: the start symbol has to be a declared non terminal, each
	 * production (in order) can only use declared symbols and has a non terminal on its left hand side and at least
	 * one production has to have the start symbol on its left hand side.
	 *
	 * @param raw unvalidated grammar
	 * @return grammar whose productions have the indices of the raw productions as ids
	 * @throws GrammarError for the first violation found
	 */
	public static Grammar validate(RawGrammar raw){
		Map<String, Symbol> symbols = new HashMap<>();
		List<Terminal> terminals = new ArrayList<>();
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (String name : raw.terminals){
			Terminal terminal = new Terminal(terminals.size(), name);
			terminals.add(terminal);
			symbols.put(name, terminal);
		}
		for (String name : raw.nonTerminals){
			NonTerminal nonTerminal = new NonTerminal(nonTerminals.size(), name);
			nonTerminals.add(nonTerminal);
			symbols.put(name, nonTerminal);
		}
		Symbol start = symbols.get(raw.initial);
		if (start == null || !start.isNonTerminal()){
			throw GrammarError.invalidStart(raw.initial);
		}
		List<Production> productions = new ArrayList<>();
		boolean hasStartProduction = false;
		for (int i = 0; i < raw.productions.size(); i++){
			RawGrammar.RawProduction rawProduction = raw.productions.get(i);
			Symbol left = symbols.get(rawProduction.left);
			if (left == null){
				throw GrammarError.undeclaredSymbol(rawProduction.left, i, "left hand side isn't declared");
			}
			if (!left.isNonTerminal()){
				throw GrammarError.undeclaredSymbol(rawProduction.left, i, "left hand side is a terminal");
			}
			List<Symbol> right = new ArrayList<>();
			for (String name : rawProduction.right){
				Symbol symbol = symbols.get(name);
				if (symbol == null){
					throw GrammarError.undeclaredSymbol(name, i, "right hand side " + rawProduction);
				}
				right.add(symbol);
			}
			hasStartProduction = hasStartProduction || left.equals(start);
			productions.add(new Production(i, (NonTerminal) left, right));
		}
		if (!hasStartProduction){
			throw GrammarError.noStartProduction(raw.initial);
		}
		return new Grammar(terminals, nonTerminals, (NonTerminal) start, null, productions);
	}

	/**
	 * Inserts a new start non terminal with a <pre>S' → S</pre> production (assuming <pre>S</pre> is the current
	 * start non terminal). The new non terminal is named after <pre>S</pre> with as many apostrophes appended as
	 * needed to not collide with any declared symbol.
	 *
	 * @return new grammar with the start production as production 0 (the other productions keep their order and
	 * get ids starting at 1) or this grammar if it is already augmented
	 */
	public Grammar augment(){
		if (isAugmented()){
			return this;
		}
		String startName = start.name + "'";
		while (symbolsByName.containsKey(startName)){
			startName += "'";
		}
		NonTerminal newStart = new NonTerminal(nonTerminals.size(), startName);
		List<NonTerminal> newNonTerminals = new ArrayList<>(nonTerminals);
		newNonTerminals.add(newStart);
		List<Production> newProductions = new ArrayList<>();
		newProductions.add(new Production(0, newStart, Collections.singletonList(start)));
		for (Production production : productions){
			newProductions.add(production.withId(newProductions.size()));
		}
		return new Grammar(new ArrayList<>(terminals), newNonTerminals, start, newStart, newProductions);
	}

	public boolean isAugmented(){
		return augmentedStart != null;
	}

	/**
	 * Start non terminal as declared by the user, augmenting doesn't change it
	 */
	public NonTerminal getStart() {
		return start;
	}

	/**
	 * @throws IllegalStateException if the grammar isn't augmented
	 */
	public NonTerminal getAugmentedStart() {
		if (!isAugmented()){
			throw new IllegalStateException("The grammar isn't augmented");
		}
		return augmentedStart;
	}

	/**
	 * The <pre>S' → S</pre> production
	 *
	 * @throws IllegalStateException if the grammar isn't augmented
	 */
	public Production getStartProduction(){
		if (!isAugmented()){
			throw new IllegalStateException("The grammar isn't augmented");
		}
		return productions.get(0);
	}

	public List<Terminal> getTerminals() {
		return terminals;
	}

	public List<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	/**
	 * Terminals followed by the non terminals, each in declaration order.
	 */
	public List<Symbol> getSymbols(){
		List<Symbol> symbols = new ArrayList<>(terminals);
		symbols.addAll(nonTerminals);
		return symbols;
	}

	public List<Production> getProductions() {
		return productions;
	}

	public Production getProduction(int id){
		return productions.get(id);
	}

	/**
	 * Productions that have the passed non terminal on their left hand side, in grammar order
	 */
	public List<Production> getProductionsOf(NonTerminal nonTerminal) {
		return Collections.unmodifiableList(productionsPerNonTerminal.getOrDefault(nonTerminal,
				Collections.emptyList()));
	}

	/**
	 * @return symbol with the passed name or {@code null} if there is no such symbol
	 */
	public Symbol getSymbol(String name){
		return symbolsByName.get(name);
	}

	public boolean hasSymbol(String name){
		return symbolsByName.containsKey(name);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
