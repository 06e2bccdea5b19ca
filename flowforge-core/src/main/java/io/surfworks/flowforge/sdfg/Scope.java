package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.Value;

import java.util.List;

/**
 * A region that owns nodes and resolves values to connectors: a state, or a
 * map/consume scope inside one.
 */
public sealed interface Scope permits State, ScopeEntry {

    State state();

    Location scopeLocation();

    /** Nodes registered directly in this scope. */
    List<ConnectorNode> nodes();

    /** Edges added in this scope. */
    List<MultiEdge> edges();

    void addNode(ConnectorNode node);

    void addEdge(MultiEdge edge);

    /**
     * Binds {@code value} to {@code connector}, replacing any earlier binding.
     */
    void mapConnector(Value value, Connector connector);

    /**
     * Returns the connector that currently provides {@code value}, creating
     * an access node or through-connectors on first use.
     */
    Connector lookup(Value value);

    /**
     * Orders {@code connector}'s node after the producer of {@code value}.
     */
    void addDependency(Value value, Connector connector);

    /**
     * Routes the data leaving {@code from} into the container behind {@code to}.
     */
    void routeWrite(Connector from, Connector to, Value value);
}
