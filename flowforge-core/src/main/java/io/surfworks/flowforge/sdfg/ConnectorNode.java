package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node placed inside a state, with ordered in- and out-connectors.
 */
public abstract sealed class ConnectorNode extends Node
        permits Tasklet, Access, Library, NestedSdfg, ScopeEntry, ScopeExit {

    private final List<Connector> inConnectors = new ArrayList<>();
    private final List<Connector> outConnectors = new ArrayList<>();

    protected ConnectorNode(Location location) {
        super(location);
    }

    /** The output format's node type name. */
    protected abstract String typeName();

    /** Variant-specific entries of the {@code attributes} object. */
    protected abstract void emitAttributes(JsonEmitter jemit);

    public void addInConnector(Connector connector) {
        add(inConnectors, connector, Connector.Direction.IN);
    }

    public void addOutConnector(Connector connector) {
        add(outConnectors, connector, Connector.Direction.OUT);
    }

    private void add(List<Connector> connectors, Connector connector, Connector.Direction direction) {
        if (connector.node() != this) {
            throw TranslationException.structural("Connector " + connector + " does not belong to " + this,
                    getLocation());
        }
        if (connector.direction() != direction) {
            throw TranslationException.structural("Connector " + connector + " is not an "
                    + direction.name().toLowerCase() + "-connector", getLocation());
        }
        for (Connector existing : connectors) {
            if (existing.equals(connector)) {
                return;
            }
            if (!connector.isNull() && connector.name().equals(existing.name())) {
                throw TranslationException.structural("Conflicting connector " + connector.name() + " on " + this,
                        getLocation());
            }
        }
        connectors.add(connector);
    }

    public List<Connector> getInConnectors() {
        return Collections.unmodifiableList(inConnectors);
    }

    public List<Connector> getOutConnectors() {
        return Collections.unmodifiableList(outConnectors);
    }

    public Optional<Connector> findInConnector(String name) {
        return inConnectors.stream().filter(c -> name.equals(c.name())).findFirst();
    }

    public Optional<Connector> findOutConnector(String name) {
        return outConnectors.stream().filter(c -> name.equals(c.name())).findFirst();
    }

    public State getState() {
        return getParent().state();
    }

    @Override
    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        jemit.printKVPair("type", typeName());
        jemit.printKVPair("label", getName());

        jemit.startNamedObject("attributes");
        jemit.printKVPair("label", getName());
        EmitSupport.printLocation(getLocation(), jemit);
        emitAttributes(jemit);
        printConnectors("in_connectors", inConnectors, jemit);
        printConnectors("out_connectors", outConnectors, jemit);
        jemit.endObject();

        jemit.printKVPair("id", getId(), false);
        emitScope(jemit);
        jemit.endObject();
    }

    /**
     * Writes the ids of the enclosing scope's entry and exit, null at state level.
     */
    protected void emitScope(JsonEmitter jemit) {
        if (getParent() instanceof ScopeEntry entry) {
            jemit.printKVPair("scope_entry", entry.getId());
            jemit.printKVPair("scope_exit", entry.getExit().getId());
        } else {
            jemit.printKVPair("scope_entry", "null", false);
            jemit.printKVPair("scope_exit", "null", false);
        }
    }

    private static void printConnectors(String key, List<Connector> connectors, JsonEmitter jemit) {
        jemit.startNamedObject(key);
        for (Connector connector : connectors) {
            if (!connector.isNull()) {
                jemit.printKVPair(connector.name(), "null", false);
            }
        }
        jemit.endObject();
    }
}
