package lr0;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lr0.automaton.Automaton;
import lr0.automaton.AutomatonBuilder;
import lr0.grammar.GrammarBuilder;
import lr0.grammar.GrammarError;
import lr0.grammar.MalformedInputError;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	@TempDir
	Path dir;

	@AfterEach
	public void reset(){
		Config.reset();
	}

	private Path grammarFile(String content) throws IOException {
		Path file = dir.resolve("test.grammar");
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testReport() throws IOException {
		Path file = grammarFile("initial: S\nterminals: a\nnonTerminals: S\nS -> a | a\n");
		String report = Main.run(new String[]{file.toString()});
		assertTrue(report.contains("Start non terminal: S"), report);
		assertTrue(report.contains("State I2"), report);
		assertTrue(report.contains("reduce/reduce conflict in I1"), report);
	}

	@Test
	public void testDotOutput() throws IOException {
		Config.set("outputDir", dir.toString());
		Path file = grammarFile("initial: S\nterminals: a\nnonTerminals: S\nS -> a\n");
		Main.run(new String[]{file.toString(), "--dot"});
		assertTrue(Files.exists(dir.resolve("test.dot")));
	}

	@Test
	public void testThresholdOption() throws IOException {
		Path file = grammarFile("initial: S\nterminals: a\nnonTerminals: S\nS -> a\n");
		String report = Main.run(new String[]{file.toString(), "--threshold", "2"});
		assertTrue(report.contains("more than the threshold of 2 states"), report);
	}

	@Test
	public void testThresholdOptionDoesNotChangeLaterBuilds() throws IOException {
		Path file = grammarFile("initial: S\nterminals: a\nnonTerminals: S\nS -> a\n");
		Main.run(new String[]{file.toString(), "--threshold", "2"});
		assertEquals(32, Config.stateCountWarningThreshold());
		Automaton automaton = AutomatonBuilder.build(new GrammarBuilder().initial("S").terminals("a")
				.nonTerminals("S").add("S", "a").toGrammar());
		assertFalse(automaton.getStateLimitAdvisory().isPresent());
	}

	@Test
	public void testInvalidThreshold() throws IOException {
		Path file = grammarFile("initial: S\nterminals: a\nnonTerminals: S\nS -> a\n");
		assertThrows(LR0Exception.class, () -> Main.run(new String[]{file.toString(), "--threshold", "many"}));
		assertThrows(LR0Exception.class, () -> Main.run(new String[]{file.toString(), "--threshold", "-3"}));
		assertThrows(LR0Exception.class, () -> Main.run(new String[]{file.toString(), "--threshold"}));
	}

	@Test
	public void testJsonGrammar() throws IOException {
		Path file = dir.resolve("duplicate.json");
		Files.write(file, ("{\"initial\": \"S\", \"terminals\": [\"a\"], \"nonTerminals\": [\"S\"],"
				+ " \"productions\": [{\"left\": \"S\", \"right\": [\"a\"]}, {\"left\": \"S\", \"right\": [\"a\"]}]}")
				.getBytes(StandardCharsets.UTF_8));
		String report = Main.run(new String[]{file.toString()});
		assertTrue(report.contains("reduce/reduce conflict in I1"), report);
		Path broken = dir.resolve("broken.json");
		Files.write(broken, "{\"initial\": \"S\"}".getBytes(StandardCharsets.UTF_8));
		assertThrows(MalformedInputError.class, () -> Main.run(new String[]{broken.toString()}));
	}

	@Test
	public void testErrors() throws IOException {
		assertThrows(LR0Exception.class, () -> Main.run(new String[0]));
		Path file = grammarFile("initial: X\nterminals: a\nnonTerminals: S\nS -> a\n");
		assertThrows(GrammarError.class, () -> Main.run(new String[]{file.toString()}));
		assertThrows(LR0Exception.class, () -> Main.run(new String[]{file.toString(), "--png"}));
		Path malformed = grammarFile("initial: S\nS a\n");
		assertThrows(MalformedInputError.class, () -> Main.run(new String[]{malformed.toString()}));
	}
}
