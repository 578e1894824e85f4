package lr0.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarDescriptionParserTest {

	static Path resource(String name) throws URISyntaxException {
		return Paths.get(GrammarDescriptionParserTest.class.getResource("/grammars/" + name).toURI());
	}

	@Test
	public void testExpressionGrammarFile() throws IOException, URISyntaxException {
		RawGrammar raw = GrammarDescriptionParser.parse(resource("expression.grammar"));
		assertEquals("E", raw.initial);
		assertEquals(Arrays.asList("+", "*", "(", ")", "id"), raw.terminals);
		assertEquals(Arrays.asList("E", "T", "F"), raw.nonTerminals);
		assertEquals(6, raw.productions.size());
		assertEquals("E", raw.productions.get(1).left);
		assertEquals(Collections.singletonList("T"), raw.productions.get(1).right);
		assertEquals(Arrays.asList("(", "E", ")"), raw.productions.get(4).right);
		Grammar grammar = Grammar.validate(raw);
		assertEquals(6, grammar.getProductions().size());
	}

	@Test
	public void testEpsilonFile() throws IOException, URISyntaxException {
		RawGrammar raw = GrammarDescriptionParser.parse(resource("optional.grammar"));
		assertEquals(3, raw.productions.size());
		assertTrue(raw.productions.get(2).right.isEmpty());
	}

	@Test
	public void testEmptyAlternativeIsEpsilon(){
		RawGrammar raw = GrammarDescriptionParser.parse(
				"initial: S\nterminals: a\nnonTerminals: S\nS -> a S |\n");
		assertEquals(2, raw.productions.size());
		assertTrue(raw.productions.get(1).right.isEmpty());
	}

	@Test
	public void testCommentsAndBlankLines(){
		RawGrammar raw = GrammarDescriptionParser.parse(
				"# start\n\ninitial: S\r\n  # indented comment\nterminals:\nnonTerminals: S\nS -> ε\n");
		assertTrue(raw.terminals.isEmpty());
		assertEquals(1, raw.productions.size());
	}

	@ParameterizedTest
	@CsvSource(delimiter = ';', value = {
			"initial: S\\nterminals: a\\nnonTerminals: S\\nS a;4;1",
			"initial: S\\nterminals: a\\nnonTerminals: S\\nS A -> a;4;1",
			"initial: S\\nterminals: a\\nnonTerminals: S\\nstart: S;4;1",
			"initial: S\\ninitial: S\\nterminals: a\\nnonTerminals: S;2;1",
			"initial: S\\nterminals: a\\nnonTerminals: S\\nS -> a ε;4;3",
			"initial: S\\nterminals: a;2;1",
	})
	public void testMalformedDescriptions(String description, int line, int column){
		MalformedInputError error = assertThrows(MalformedInputError.class,
				() -> GrammarDescriptionParser.parse(description.replace("\\n", "\n")));
		assertEquals(new Location(line, column), error.location, error.getMessage());
	}

	@Test
	public void testMultipleInitialSymbols(){
		MalformedInputError error = assertThrows(MalformedInputError.class, () -> GrammarDescriptionParser.parse(
				"terminals: a\n  initial: S A\nnonTerminals: S A\nS -> a\n"));
		assertEquals(new Location(2, 3), error.location);
	}

	@Test
	public void testHeaderKeysWin(){
		RawGrammar raw = GrammarDescriptionParser.parse(
				"initial: S\nterminals: a-> ->b\nnonTerminals: S\nS -> ε\n");
		assertEquals(Arrays.asList("a->", "->b"), raw.terminals);
		assertEquals(1, raw.productions.size());
		assertTrue(raw.productions.get(0).right.isEmpty());
	}

	@Test
	public void testUndeclaredSymbolsAreLeftToValidation(){
		RawGrammar raw = GrammarDescriptionParser.parse("initial: S\nterminals: a\nnonTerminals: S\nS -> b\n");
		GrammarError error = assertThrows(GrammarError.class, () -> Grammar.validate(raw));
		assertEquals(GrammarError.Kind.UNDECLARED_SYMBOL, error.kind);
	}
}
