package io.surfworks.flowforge.translate;

import io.surfworks.flowforge.sdfg.Connector;
import io.surfworks.flowforge.sdfg.ConnectorNode;
import io.surfworks.flowforge.sdfg.Graph;
import io.surfworks.flowforge.sdfg.InterstateEdge;
import io.surfworks.flowforge.sdfg.MultiEdge;
import io.surfworks.flowforge.sdfg.NestedSdfg;
import io.surfworks.flowforge.sdfg.ScopeEntry;
import io.surfworks.flowforge.sdfg.ScopeExit;
import io.surfworks.flowforge.sdfg.State;
import io.surfworks.flowforge.sdfg.TranslationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a finished graph.
 *
 * Checks:
 * - Start state: set and owned by the graph
 * - Node ids: dense within each state
 * - Edges: both endpoints in the edge's state, named connectors registered
 * - Scopes: closed, entry and exit in the same state, every member reachable
 *   from the entry and reaching the exit
 * - Nested graphs: recursively
 */
public final class SdfgValidator {

    private final List<String> errors = new ArrayList<>();

    public SdfgValidator() {}

    /**
     * Validates a graph and returns a list of errors.
     * Returns empty list if validation passes.
     */
    public List<String> validate(Graph graph) {
        errors.clear();
        validateGraph(graph);
        return new ArrayList<>(errors);
    }

    /**
     * Validates a graph and throws if any errors are found.
     */
    public void check(Graph graph) {
        List<String> validationErrors = validate(graph);
        if (!validationErrors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Graph validation failed:\n");
            for (String error : validationErrors) {
                sb.append("  - ").append(error).append("\n");
            }
            throw TranslationException.structural(sb.toString(), graph.getLocation());
        }
    }

    private void validateGraph(Graph graph) {
        State start = graph.getStartState();
        if (start == null) {
            error("Graph %s has no start state", graph.getName());
        } else if (!graph.getStates().contains(start)) {
            error("Start state %s of %s is not one of its states", start.getName(), graph.getName());
        }

        for (State state : graph.getStates()) {
            validateState(state);
        }

        for (InterstateEdge edge : graph.getEdges()) {
            if (!graph.getStates().contains(edge.getSource()) || !graph.getStates().contains(edge.getDestination())) {
                error("Interstate edge %s -> %s leaves graph %s",
                        edge.getSource().getName(), edge.getDestination().getName(), graph.getName());
            }
        }
    }

    private void validateState(State state) {
        List<ConnectorNode> nodes = state.nodes();
        Set<ConnectorNode> members = new HashSet<>(nodes);
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getId() != i) {
                error("Node %s in state %s has id %d, expected %d",
                        nodes.get(i), state.getName(), nodes.get(i).getId(), i);
            }
        }

        Set<ConnectorNode> withIncoming = new HashSet<>();
        Set<ConnectorNode> withOutgoing = new HashSet<>();
        for (MultiEdge edge : state.edges()) {
            validateEndpoint(edge, edge.getSource(), members, state);
            validateEndpoint(edge, edge.getDestination(), members, state);
            withOutgoing.add(edge.getSource().node());
            withIncoming.add(edge.getDestination().node());
        }

        for (ConnectorNode node : nodes) {
            if (node instanceof ScopeEntry entry) {
                if (!entry.isClosed()) {
                    error("Scope %s in state %s was never closed", entry, state.getName());
                }
                if (!members.contains(entry.getExit())) {
                    error("Exit of %s is not in state %s", entry, state.getName());
                }
            }
            if (node.getParent() instanceof ScopeEntry) {
                if (!(node instanceof ScopeExit) && !withIncoming.contains(node)) {
                    error("%s in state %s has no incoming edge", node, state.getName());
                }
                if (!(node instanceof ScopeEntry) && !withOutgoing.contains(node)) {
                    error("%s in state %s has no outgoing edge", node, state.getName());
                }
            }
            if (node instanceof NestedSdfg nested) {
                validateGraph(nested.getGraph());
            }
        }
    }

    private void validateEndpoint(MultiEdge edge, Connector connector, Set<ConnectorNode> members, State state) {
        ConnectorNode node = connector.node();
        if (!members.contains(node)) {
            error("Edge %s in state %s references %s outside the state", edge, state.getName(), node);
            return;
        }
        if (connector.isNull()) {
            return;
        }
        boolean registered = connector.direction() == Connector.Direction.IN
                ? node.findInConnector(connector.name()).isPresent()
                : node.findOutConnector(connector.name()).isPresent();
        if (!registered) {
            error("Edge %s in state %s uses unregistered connector %s", edge, state.getName(), connector);
        }
    }

    private void error(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
