package lr0.grammar;

import lr0.LR0Exception;

/**
 * Thrown while validating a {@link RawGrammar}, stops the construction of the grammar.
 */
public class GrammarError extends LR0Exception {

	public enum Kind {
		/**
		 * A production uses a symbol that isn't declared (or a terminal on its left hand side)
		 */
		UNDECLARED_SYMBOL,
		/**
		 * The start symbol isn't a declared non terminal
		 */
		INVALID_START,
		/**
		 * No production has the start symbol on its left hand side
		 */
		NO_START_PRODUCTION
	}

	public final Kind kind;

	/**
	 * Name of the offending symbol
	 */
	public final String symbol;

	/**
	 * Index of the offending production in the raw production list, -1 if the error isn't related to a production
	 */
	public final int productionIndex;

	private GrammarError(Kind kind, String symbol, int productionIndex, String message) {
		super(message);
		this.kind = kind;
		this.symbol = symbol;
		this.productionIndex = productionIndex;
	}

	public static GrammarError undeclaredSymbol(String symbol, int productionIndex, String detail){
		return new GrammarError(Kind.UNDECLARED_SYMBOL, symbol, productionIndex,
				String.format("Production %d uses the undeclared symbol '%s': %s", productionIndex, symbol, detail));
	}

	public static GrammarError invalidStart(String symbol){
		return new GrammarError(Kind.INVALID_START, symbol, -1,
				String.format("The start symbol '%s' isn't a declared non terminal", symbol));
	}

	public static GrammarError noStartProduction(String symbol){
		return new GrammarError(Kind.NO_START_PRODUCTION, symbol, -1,
				String.format("There is no production for the start symbol '%s'", symbol));
	}
}
