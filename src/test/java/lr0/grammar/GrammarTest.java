package lr0.grammar;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	static GrammarBuilder single(){
		return new GrammarBuilder().initial("S").terminals("a").nonTerminals("S").add("S", "a");
	}

	static GrammarError assertGrammarError(GrammarError.Kind kind, GrammarBuilder builder){
		GrammarError error = assertThrows(GrammarError.class, builder::toGrammar);
		assertEquals(kind, error.kind, error.getMessage());
		return error;
	}

	@Nested
	public class Validation {

		@Test
		public void testValidGrammar(){
			Grammar grammar = single().toGrammar();
			assertEquals("S", grammar.getStart().name);
			assertEquals(1, grammar.getProductions().size());
			assertEquals(0, grammar.getProduction(0).id);
			assertFalse(grammar.isAugmented());
		}

		@Test
		public void testUndeclaredStart(){
			GrammarError error = assertGrammarError(GrammarError.Kind.INVALID_START,
					new GrammarBuilder().initial("X").terminals("a").nonTerminals("S").add("S", "a"));
			assertEquals("X", error.symbol);
			assertEquals(-1, error.productionIndex);
		}

		@Test
		public void testTerminalStart(){
			assertGrammarError(GrammarError.Kind.INVALID_START,
					new GrammarBuilder().initial("a").terminals("a").nonTerminals("S").add("S", "a"));
		}

		@Test
		public void testUndeclaredRightSymbol(){
			GrammarError error = assertGrammarError(GrammarError.Kind.UNDECLARED_SYMBOL,
					single().nonTerminals("A").add("A", "a").add("S", "A", "b"));
			assertEquals("b", error.symbol);
			assertEquals(2, error.productionIndex);
		}

		@Test
		public void testUndeclaredLeftSymbol(){
			GrammarError error = assertGrammarError(GrammarError.Kind.UNDECLARED_SYMBOL, single().add("B", "a"));
			assertEquals("B", error.symbol);
			assertEquals(1, error.productionIndex);
		}

		@Test
		public void testTerminalOnLeftSide(){
			GrammarError error = assertGrammarError(GrammarError.Kind.UNDECLARED_SYMBOL, single().add("a", "S"));
			assertEquals("a", error.symbol);
		}

		@Test
		public void testNoStartProduction(){
			GrammarError error = assertGrammarError(GrammarError.Kind.NO_START_PRODUCTION,
					new GrammarBuilder().initial("S").terminals("a").nonTerminals("S", "A").add("A", "a"));
			assertEquals("S", error.symbol);
		}

		@Test
		public void testFirstViolationWins(){
			assertGrammarError(GrammarError.Kind.INVALID_START,
					new GrammarBuilder().initial("X").terminals("a").nonTerminals("S").add("S", "b"));
			GrammarError error = assertGrammarError(GrammarError.Kind.UNDECLARED_SYMBOL,
					new GrammarBuilder().initial("S").terminals("a").nonTerminals("S", "A")
							.add("A", "c").add("A", "d"));
			assertEquals("c", error.symbol);
		}

		@Test
		public void testEpsilonProduction(){
			Grammar grammar = single().add("S").toGrammar();
			assertTrue(grammar.getProduction(1).isEpsilonProduction());
			assertEquals(0, grammar.getProduction(1).rightSize());
			assertEquals("1 S → ε", grammar.getProduction(1).toString());
		}

		@Test
		public void testProductionsOf(){
			Grammar grammar = new GrammarBuilder().initial("S").terminals("a").nonTerminals("S", "A")
					.add("S", "A").add("A", "a").add("S", "a").toGrammar();
			NonTerminal s = (NonTerminal) grammar.getSymbol("S");
			assertEquals(Arrays.asList(0, 2), Arrays.asList(grammar.getProductionsOf(s).get(0).id,
					grammar.getProductionsOf(s).get(1).id));
		}

		@Test
		public void testSymbolOrder(){
			Grammar grammar = new GrammarBuilder().initial("S").terminals("b", "a").nonTerminals("S", "A")
					.add("S", "A").add("A", "a", "b").toGrammar();
			List<String> names = new ArrayList<>();
			for (Symbol symbol : grammar.getSymbols()){
				names.add(symbol.name);
			}
			assertEquals(Arrays.asList("b", "a", "S", "A"), names);
		}
	}

	@Nested
	public class Augmentation {

		@Test
		public void testStartProduction(){
			Grammar grammar = single().toGrammar().augment();
			assertTrue(grammar.isAugmented());
			Production start = grammar.getStartProduction();
			assertEquals(0, start.id);
			assertEquals("S'", start.left.name);
			assertEquals(Collections.singletonList(grammar.getStart()), start.right);
			assertEquals(grammar.getAugmentedStart(), start.left);
		}

		@Test
		public void testOriginalStartIsKept(){
			Grammar grammar = single().toGrammar().augment();
			assertEquals("S", grammar.getStart().name);
		}

		@Test
		public void testProductionsAreShifted(){
			Grammar original = single().nonTerminals("A").add("S", "A").add("A").toGrammar();
			Grammar grammar = original.augment();
			assertEquals(original.getProductions().size() + 1, grammar.getProductions().size());
			for (Production production : original.getProductions()){
				Production shifted = grammar.getProduction(production.id + 1);
				assertEquals(production.id + 1, shifted.id);
				assertEquals(production.left, shifted.left);
				assertEquals(production.right, shifted.right);
			}
		}

		@Test
		public void testFreshName(){
			Grammar grammar = new GrammarBuilder().initial("S").terminals("S''").nonTerminals("S", "S'")
					.add("S", "S'").add("S'", "S''").toGrammar().augment();
			assertEquals("S'''", grammar.getAugmentedStart().name);
			assertEquals(3, grammar.getNonTerminals().size());
		}

		@Test
		public void testAugmentIsIdempotent(){
			Grammar grammar = single().toGrammar().augment();
			assertSame(grammar, grammar.augment());
		}

		@Test
		public void testUnaugmentedGrammarHasNoStartProduction(){
			Grammar grammar = single().toGrammar();
			assertThrows(IllegalStateException.class, grammar::getStartProduction);
			assertThrows(IllegalStateException.class, grammar::getAugmentedStart);
		}
	}

	@Nested
	public class MalformedInput {

		@Test
		public void testSymbolDeclaredTwice(){
			assertThrows(MalformedInputError.class,
					() -> new GrammarBuilder().initial("S").terminals("S").nonTerminals("S").toRawGrammar());
		}

		@Test
		public void testEmptyNames(){
			assertThrows(MalformedInputError.class,
					() -> new GrammarBuilder().initial("S").terminals(" ").nonTerminals("S").toRawGrammar());
			assertThrows(MalformedInputError.class, () -> new GrammarBuilder().add(""));
			assertThrows(MalformedInputError.class, () -> new GrammarBuilder().add("S", "a", null));
		}

		@Test
		public void testMissingParts(){
			assertThrows(MalformedInputError.class,
					() -> new RawGrammar(null, Collections.emptyList(), Collections.emptyList(), Collections.emptyList()));
			assertThrows(MalformedInputError.class,
					() -> new RawGrammar("S", null, Collections.emptyList(), Collections.emptyList()));
		}

		@Test
		public void testDuplicatesAreDropped(){
			RawGrammar raw = new GrammarBuilder().initial("S").terminals("a", "a").nonTerminals("S", "S")
					.add("S", "a").toRawGrammar();
			assertEquals(Collections.singletonList("a"), raw.terminals);
			assertEquals(Collections.singletonList("S"), raw.nonTerminals);
		}
	}
}
