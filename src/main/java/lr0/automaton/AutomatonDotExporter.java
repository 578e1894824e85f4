package lr0.automaton;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.engine.Engine;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Creates graphviz graphs of automata: one box per state that lists its items, acceptance states are green, the
 * others pink, conflicted states get a red border. Edges are labelled with their symbol.
 */
public class AutomatonDotExporter {

	public static final String ACCEPTANCE_COLOR = "palegreen";
	public static final String DEFAULT_COLOR = "pink";
	public static final String CONFLICT_COLOR = "red";

	private AutomatonDotExporter(){
	}

	public static MutableGraph createDotGraph(Automaton automaton){
		MutableGraph graph = mutGraph("automaton").setDirected(true);
		graph.graphAttrs().add(attr("rankdir", "LR"), attr("splines", "true"), attr("overlap", "false"));
		graph.nodeAttrs().add(attr("shape", "box"), attr("style", "filled, bold"));
		Map<Integer, MutableNode> nodes = new HashMap<>();
		for (State state : automaton.getStates()){
			MutableNode node = mutNode(state.getName()).add(Label.html(htmlLabel(state)),
					attr("fillcolor", state.isAcceptance() ? ACCEPTANCE_COLOR : DEFAULT_COLOR));
			if (!automaton.getConflictsOf(state.id).isEmpty()){
				node.add(attr("color", CONFLICT_COLOR), attr("penwidth", 3));
			}
			nodes.put(state.id, node);
		}
		for (Edge edge : automaton.getEdges()){
			nodes.get(edge.sourceId).addLink(to(nodes.get(edge.targetId)).with(Label.of(edge.symbol.name)));
		}
		for (State state : automaton.getStates()){
			graph.add(nodes.get(state.id));
		}
		return graph;
	}

	private static String htmlLabel(State state){
		StringBuilder builder = new StringBuilder();
		builder.append("<table border=\"0\" cellborder=\"0\" cellpadding=\"3\">")
				.append("<tr><td bgcolor=\"black\" align=\"center\"><font color=\"white\">")
				.append(state.getName()).append("</font></td></tr>");
		for (Item item : state.items){
			builder.append("<tr><td align=\"left\">").append(item.toHTMLString()).append("</td></tr>");
		}
		if (state.isAcceptance()){
			builder.append("<tr><td align=\"left\">reduce ");
			for (int i = 0; i < state.getCompletedProductionIndices().size(); i++){
				if (i != 0){
					builder.append(", ");
				}
				builder.append(state.getCompletedProductionIndices().get(i));
			}
			builder.append("</td></tr>");
		}
		builder.append("</table>");
		return builder.toString();
	}

	/**
	 * @return the automaton in the dot language
	 */
	public static String toDot(Automaton automaton){
		return createDotGraph(automaton).toString();
	}

	public static void writeDot(Automaton automaton, Path file) throws IOException {
		Files.write(file, toDot(automaton).getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Renders the automaton with the dot engine (requires a graphviz engine to be available)
	 */
	public static void renderSvg(Automaton automaton, File file) throws IOException {
		Graphviz.fromGraph(createDotGraph(automaton)).engine(Engine.DOT).render(Format.SVG).toFile(file);
	}
}
