package lr0.grammar;

import java.util.*;

import lr0.util.Utils;

/**
 * Unvalidated grammar, as handed over by a loader: names of the start symbol, the terminals and non terminals and
 * the productions.
 *
 * Only the structure is checked here, {@link Grammar#validate(RawGrammar)} checks the semantics.
 */
public class RawGrammar {

	/**
	 * Unvalidated production, an empty right hand side stands for epsilon.
	 */
	public static class RawProduction {

		public final String left;
		public final List<String> right;

		public RawProduction(String left, List<String> right) {
			if (left == null || left.trim().isEmpty()){
				throw new MalformedInputError("The left hand side of a production has to be a non empty name");
			}
			if (right == null){
				throw new MalformedInputError(String.format("The production for '%s' has no right hand side", left));
			}
			for (String symbol : right){
				if (symbol == null || symbol.trim().isEmpty()){
					throw new MalformedInputError(
							String.format("The right hand side of a production for '%s' contains an empty name", left));
				}
			}
			this.left = left;
			this.right = Collections.unmodifiableList(new ArrayList<>(right));
		}

		@Override
		public String toString() {
			return left + " → " + (right.isEmpty() ? "ε" : Utils.join(right, " "));
		}
	}

	public final String initial;
	public final List<String> terminals;
	public final List<String> nonTerminals;
	public final List<RawProduction> productions;

	/**
	 * Duplicate names in one declaration list are dropped (keeping the first occurrence)
	 *
	 * @throws MalformedInputError if a list is missing, a name is empty or declared as terminal and non terminal
	 */
	public RawGrammar(String initial, List<String> terminals, List<String> nonTerminals,
	                  List<RawProduction> productions) {
		if (initial == null){
			throw new MalformedInputError("The grammar has no initial symbol");
		}
		if (terminals == null || nonTerminals == null || productions == null){
			throw new MalformedInputError("The grammar needs a terminal, a non terminal and a production list");
		}
		this.initial = initial;
		this.terminals = checkedNames(terminals, "terminal");
		this.nonTerminals = checkedNames(nonTerminals, "non terminal");
		for (String terminal : this.terminals){
			if (this.nonTerminals.contains(terminal)){
				throw new MalformedInputError(
						String.format("'%s' is declared as a terminal and as a non terminal", terminal));
			}
		}
		for (RawProduction production : productions){
			if (production == null){
				throw new MalformedInputError("The production list contains an empty entry");
			}
		}
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
	}

	private static List<String> checkedNames(List<String> names, String kind){
		Set<String> unique = new LinkedHashSet<>();
		for (String name : names){
			if (name == null || name.trim().isEmpty()){
				throw new MalformedInputError(String.format("The name of a %s can't be empty", kind));
			}
			unique.add(name);
		}
		return Collections.unmodifiableList(new ArrayList<>(unique));
	}

	@Override
	public String toString() {
		return "Initial: " + initial + "\n" +
				"Terminals: " + terminals + "\n" +
				"Non terminals: " + nonTerminals + "\n" +
				"Productions: \n" + Utils.join(productions, "\n");
	}
}
