package lr0;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

import lr0.automaton.*;
import lr0.grammar.*;

/**
 * Command line tool: loads a grammar description, builds its LR(0) automaton and prints the report.
 *
 * <pre>
 * Main GRAMMAR_FILE [--dot] [--svg] [--threshold N]
 * </pre>
 *
 * Files ending in ".json" are read with {@link GrammarJsonLoader}, all others with {@link GrammarDescriptionParser}.
 * "--dot" and "--svg" write the automaton (named after the grammar file) into the configured output directory.
 */
public class Main {

	private static final Logger LOG = Logger.getLogger("LR0");

	public static void main(String[] args) {
		try {
			System.out.println(run(args));
		} catch (LR0Exception | IOException ex){
			System.err.println(ex.getMessage());
			System.exit(1);
		}
	}

	/**
	 * @return the report of the built automaton
	 */
	static String run(String[] args) throws IOException {
		if (args.length == 0){
			throw new LR0Exception("Usage: Main GRAMMAR_FILE [--dot] [--svg] [--threshold N]");
		}
		Path grammarFile = Paths.get(args[0]);
		boolean dot = false;
		boolean svg = false;
		int threshold = Config.stateCountWarningThreshold();
		for (int i = 1; i < args.length; i++){
			switch (args[i]){
				case "--dot":
					dot = true;
					break;
				case "--svg":
					svg = true;
					break;
				case "--threshold":
					if (i + 1 == args.length){
						throw new LR0Exception("--threshold needs a number");
					}
					threshold = parseThreshold(args[++i]);
					break;
				default:
					throw new LR0Exception("Unknown option " + args[i]);
			}
		}
		Grammar grammar = Grammar.validate(load(grammarFile));
		Automaton automaton = new AutomatonBuilder(grammar).stateCountWarningThreshold(threshold).build();
		String name = grammarFile.getFileName().toString().replaceFirst("\\.[^.]*$", "");
		if (dot){
			Path file = Paths.get(Config.getOutputDir(), name + ".dot");
			AutomatonDotExporter.writeDot(automaton, file);
			LOG.info("Wrote " + file);
		}
		if (svg){
			if (automaton.getStateLimitAdvisory().isPresent()){
				LOG.warning("Skipping the svg: " + automaton.getStateLimitAdvisory().get());
			} else {
				File file = Paths.get(Config.getOutputDir(), name + ".svg").toFile();
				AutomatonDotExporter.renderSvg(automaton, file);
				LOG.info("Wrote " + file);
			}
		}
		return automaton.grammar.longDescription() + "\n\n" + automaton;
	}

	private static int parseThreshold(String value){
		try {
			int threshold = Integer.parseInt(value.trim());
			if (threshold < 0){
				throw new LR0Exception("--threshold has to be non negative, got " + threshold);
			}
			return threshold;
		} catch (NumberFormatException ex){
			throw new LR0Exception("--threshold needs a number, got \"" + value + "\"", ex);
		}
	}

	/**
	 * Loads JSON grammars (".json" files) and textual grammar descriptions (all other files)
	 */
	static RawGrammar load(Path file) throws IOException {
		if (file.getFileName().toString().toLowerCase().endsWith(".json")){
			return GrammarJsonLoader.load(file);
		}
		return GrammarDescriptionParser.parse(file);
	}
}
