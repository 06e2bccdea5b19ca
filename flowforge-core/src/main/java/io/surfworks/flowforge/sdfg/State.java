package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dataflow state. Every node of the state, including the members of nested
 * map and consume scopes, is numbered and emitted here.
 */
public final class State extends Node implements Scope {

    private final Graph graph;
    private final List<ConnectorNode> nodes = new ArrayList<>();
    private final List<MultiEdge> edges = new ArrayList<>();
    private final BindingTable bindings = new BindingTable();

    State(Graph graph, Location location) {
        super(location);
        this.graph = graph;
    }

    public Graph getGraph() {
        return graph;
    }

    public BindingTable bindings() {
        return bindings;
    }

    @Override
    public State state() {
        return this;
    }

    @Override
    public Location scopeLocation() {
        return getLocation();
    }

    @Override
    public List<ConnectorNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public List<MultiEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public void addNode(ConnectorNode node) {
        if (node.hasId() && nodes.contains(node)) {
            return;
        }
        if (!node.hasParent()) {
            node.setParent(this);
        }
        node.setId(nodes.size());
        nodes.add(node);
    }

    @Override
    public void addEdge(MultiEdge edge) {
        edges.add(edge);
    }

    @Override
    public void mapConnector(Value value, Connector connector) {
        bindings.bind(value, connector);
    }

    @Override
    public Connector lookup(Value value) {
        if (bindings.contains(value)) {
            return bindings.require(value, getLocation());
        }

        Access access = new Access(getLocation(), value.init());
        access.setName(value.container());
        addNode(access);

        Connector out = Connector.nullOut(access).withData(value.container());
        access.addOutConnector(out);
        mapConnector(value, out);
        return out;
    }

    @Override
    public void addDependency(Value value, Connector connector) {
        addEdge(MultiEdge.dependency(getLocation(), lookup(value), connector));
    }

    @Override
    public void routeWrite(Connector from, Connector to, Value value) {
        ConnectorNode target = to.node();
        addNode(target);
        target.addInConnector(to);
        addEdge(new MultiEdge(getLocation(), from, to));

        Connector out = Connector.nullOut(target).withData(to.data());
        target.addOutConnector(out);
        mapConnector(value, out);
    }

    @Override
    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        jemit.printKVPair("type", "SDFGState");
        jemit.printKVPair("label", getName());
        jemit.printKVPair("id", getId(), false);
        jemit.printKVPair("collapsed", false);

        jemit.startNamedObject("scope_dict");
        for (Map.Entry<Integer, List<Integer>> scope : scopeDict().entrySet()) {
            jemit.startNamedList(Integer.toString(scope.getKey()));
            for (Integer id : scope.getValue()) {
                jemit.startEntry();
                jemit.printString(Integer.toString(id));
            }
            jemit.endList();
        }
        jemit.endObject();

        jemit.startNamedList("nodes");
        for (ConnectorNode node : nodes) {
            jemit.startEntry();
            node.emit(jemit);
        }
        jemit.endList();

        jemit.startNamedList("edges");
        for (MultiEdge edge : edges) {
            jemit.startEntry();
            edge.emit(jemit);
        }
        jemit.endList();

        jemit.startNamedObject("attributes");
        EmitSupport.printLocation(getLocation(), jemit);
        jemit.endObject();
        jemit.endObject();
    }

    /**
     * Node ids grouped by enclosing scope entry id; -1 is the state itself.
     * An exit is filed under its own entry.
     */
    private Map<Integer, List<Integer>> scopeDict() {
        Map<Integer, List<Integer>> dict = new LinkedHashMap<>();
        for (ConnectorNode node : nodes) {
            int scopeId;
            if (node instanceof ScopeExit exit) {
                scopeId = exit.getEntry().getId();
            } else if (node.getParent() instanceof ScopeEntry entry) {
                scopeId = entry.getId();
            } else {
                scopeId = -1;
            }
            dict.computeIfAbsent(scopeId, k -> new ArrayList<>()).add(node.getId());
        }
        return dict;
    }
}
