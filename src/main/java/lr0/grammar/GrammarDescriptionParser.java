package lr0.grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parser for textual grammar descriptions.
 *
 * <pre>
 * # comment
 * initial: S
 * terminals: a b
 * nonTerminals: S A
 * S -> a A | b
 * A -> ε
 * </pre>
 *
 * Symbols are separated by white space, alternatives by "|". "ε" or an empty alternative stands for an epsilon
 * production. The three header lines are required, the productions keep the order of the description.
 * "|" and "->" are reserved and can't be part of a symbol name, use {@link GrammarJsonLoader} for such grammars.
 * Lines starting with a header key followed by ":" are always headers.
 */
public class GrammarDescriptionParser {

	public static final String EPSILON = "ε";

	private static final String ARROW = "->";

	private static final List<String> HEADERS = Arrays.asList("initial", "terminals", "nonTerminals");

	private final Map<String, List<String>> headers = new HashMap<>();
	private final Map<String, Location> headerLocations = new HashMap<>();
	private final List<RawGrammar.RawProduction> productions = new ArrayList<>();

	private GrammarDescriptionParser(){
	}

	/**
	 * @throws MalformedInputError if the description doesn't follow the format
	 */
	public static RawGrammar parse(String description){
		return new GrammarDescriptionParser().parseDescription(description);
	}

	/**
	 * @throws MalformedInputError if the description doesn't follow the format
	 */
	public static RawGrammar parse(Path file) throws IOException {
		return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
	}

	private RawGrammar parseDescription(String description){
		String[] lines = description.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++){
			parseLine(i + 1, lines[i]);
		}
		for (String header : HEADERS){
			if (!headers.containsKey(header)){
				throw new MalformedInputError(new Location(lines.length, 1),
						String.format("Missing '%s:' line", header));
			}
		}
		List<String> initial = headers.get("initial");
		if (initial.size() != 1){
			throw new MalformedInputError(headerLocations.get("initial"),
					String.format("Expected exactly one initial symbol, got %s", initial));
		}
		return new RawGrammar(initial.get(0), headers.get("terminals"), headers.get("nonTerminals"), productions);
	}

	private void parseLine(int lineNumber, String line){
		String trimmed = line.trim();
		if (trimmed.isEmpty() || trimmed.startsWith("#")){
			return;
		}
		int colon = line.indexOf(':');
		String key = colon == -1 ? "" : line.substring(0, colon).trim();
		int arrow = line.indexOf(ARROW);
		if (arrow != -1 && !HEADERS.contains(key)){
			parseProductions(lineNumber, line, arrow);
			return;
		}
		if (colon == -1){
			throw new MalformedInputError(new Location(lineNumber, column(line)),
					String.format("Expected a production ('%s') or a header ('key:')", ARROW));
		}
		if (!HEADERS.contains(key)){
			throw new MalformedInputError(new Location(lineNumber, column(line)),
					String.format("Unknown header '%s', expected one of %s", key, HEADERS));
		}
		if (headers.containsKey(key)){
			throw new MalformedInputError(new Location(lineNumber, column(line)),
					String.format("Duplicate header '%s'", key));
		}
		headers.put(key, symbols(line.substring(colon + 1)));
		headerLocations.put(key, new Location(lineNumber, column(line)));
	}

	private void parseProductions(int lineNumber, String line, int arrow){
		List<String> left = symbols(line.substring(0, arrow));
		if (left.size() != 1){
			throw new MalformedInputError(new Location(lineNumber, column(line)),
					"Expected exactly one non terminal on the left hand side");
		}
		for (String alternative : line.substring(arrow + ARROW.length()).split("\\|", -1)){
			List<String> right = symbols(alternative);
			if (right.contains(EPSILON)){
				if (right.size() != 1){
					throw new MalformedInputError(new Location(lineNumber, arrow + 1),
							String.format("'%s' can't be combined with other symbols", EPSILON));
				}
				right = Collections.emptyList();
			}
			productions.add(new RawGrammar.RawProduction(left.get(0), right));
		}
	}

	private static List<String> symbols(String part){
		List<String> symbols = new ArrayList<>();
		for (String symbol : part.trim().split("\\s+")){
			if (!symbol.isEmpty()){
				symbols.add(symbol);
			}
		}
		return symbols;
	}

	/**
	 * Column of the first non white space character
	 */
	private static int column(String line){
		int i = 0;
		while (i < line.length() && Character.isWhitespace(line.charAt(i))){
			i++;
		}
		return i + 1;
	}
}
