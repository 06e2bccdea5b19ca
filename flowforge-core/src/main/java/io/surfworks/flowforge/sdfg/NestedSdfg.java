package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node embedding a complete graph. Its connectors are named after the nested
 * graph's arguments.
 */
public final class NestedSdfg extends ConnectorNode {

    private final Graph graph;
    private final Map<String, String> symbolMapping = new LinkedHashMap<>();

    public NestedSdfg(Location location, Graph graph) {
        super(location);
        this.graph = graph;
    }

    public Graph getGraph() {
        return graph;
    }

    /**
     * Maps a symbol of the nested graph to an expression of the parent graph.
     */
    public void mapSymbol(String nestedSymbol, String parentExpression) {
        symbolMapping.put(nestedSymbol, parentExpression);
    }

    public Map<String, String> getSymbolMapping() {
        return Collections.unmodifiableMap(symbolMapping);
    }

    @Override
    protected String typeName() {
        return "NestedSDFG";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        jemit.startNamedObject("symbol_mapping");
        for (Map.Entry<String, String> entry : symbolMapping.entrySet()) {
            jemit.printKVPair(entry.getKey(), entry.getValue());
        }
        jemit.endObject();
        graph.emitNested(jemit);
    }
}
