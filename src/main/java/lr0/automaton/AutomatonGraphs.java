package lr0.automaton;

import java.util.*;
import java.util.stream.Collectors;

import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.traverse.BreadthFirstIterator;

/**
 * Views automata as JGraphT graphs (vertices are state ids, the edges are the automaton edges) for layout and graph
 * algorithms.
 */
public class AutomatonGraphs {

	private AutomatonGraphs(){
	}

	/**
	 * Several edges can connect the same pair of states and a state can have an edge to itself.
	 */
	public static Graph<Integer, Edge> toGraph(Automaton automaton){
		Graph<Integer, Edge> graph = new DirectedPseudograph<>(null, null, false);
		for (State state : automaton.getStates()){
			graph.addVertex(state.id);
		}
		for (Edge edge : automaton.getEdges()){
			graph.addEdge(edge.sourceId, edge.targetId, edge);
		}
		return graph;
	}

	/**
	 * Ids of the states reachable from the start state, in breadth first order
	 */
	public static List<Integer> reachableStates(Automaton automaton){
		List<Integer> reached = new ArrayList<>();
		new BreadthFirstIterator<>(toGraph(automaton), automaton.getStartStateId()).forEachRemaining(reached::add);
		return reached;
	}

	public static List<State> unreachableStates(Automaton automaton){
		Set<Integer> reached = new HashSet<>(reachableStates(automaton));
		return automaton.getStates().stream().filter(s -> !reached.contains(s.id)).collect(Collectors.toList());
	}
}
