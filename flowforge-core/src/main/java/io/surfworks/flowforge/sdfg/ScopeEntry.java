package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry node of a map or consume scope, and the scope itself.
 *
 * <p>Values from outside the scope enter through {@code IN_<value>} /
 * {@code OUT_<value>} connector pairs on this node, created on first lookup.
 * Writes to outside containers land on a mirror access node inside the scope
 * and are queued; when the scope closes, every queued write whose mirror was
 * not re-read inside the scope leaves through an {@code IN_}/{@code OUT_}
 * pair on the exit and is routed on by the parent scope. Closing also wires
 * every node without inputs to the entry and every node without outputs to
 * the exit, so all scope members are reachable.
 *
 * <p>Nodes added here are numbered by, and emitted with, the enclosing state.
 */
public abstract sealed class ScopeEntry extends ConnectorNode implements Scope permits MapEntry, ConsumeEntry {

    private static final Logger LOG = Logger.getLogger(ScopeEntry.class.getName());

    /**
     * A write waiting for scope closure.
     */
    public record QueuedWrite(Connector from, Connector to, Value value) {}

    private final ScopeExit exit;
    private final List<ConnectorNode> nodes = new ArrayList<>();
    private final List<MultiEdge> edges = new ArrayList<>();
    private final BindingTable bindings = new BindingTable();
    private final List<QueuedWrite> writeQueue = new ArrayList<>();
    private boolean closed;

    protected ScopeEntry(Location location, ScopeExit exit) {
        super(location);
        this.exit = exit;
        exit.setEntry(this);
    }

    public ScopeExit getExit() {
        return exit;
    }

    /**
     * Writes the enclosing entry (null at state level) and this scope's own exit.
     */
    @Override
    protected void emitScope(JsonEmitter jemit) {
        if (getParent() instanceof ScopeEntry parent) {
            jemit.printKVPair("scope_entry", parent.getId());
        } else {
            jemit.printKVPair("scope_entry", "null", false);
        }
        jemit.printKVPair("scope_exit", exit.getId());
    }

    public boolean isClosed() {
        return closed;
    }

    public List<QueuedWrite> pendingWrites() {
        return Collections.unmodifiableList(writeQueue);
    }

    public BindingTable bindings() {
        return bindings;
    }

    /**
     * Opens the scope body. Closing the returned handle runs
     * {@link #connectDanglingNodes()}.
     */
    public Body open() {
        if (closed) {
            throw TranslationException.structural(this + " is already closed", getLocation());
        }
        return new Body(this);
    }

    /**
     * Handle for a scope body under construction.
     */
    public static final class Body implements AutoCloseable {
        private final ScopeEntry entry;

        private Body(ScopeEntry entry) {
            this.entry = entry;
        }

        public ScopeEntry scope() {
            return entry;
        }

        @Override
        public void close() {
            entry.connectDanglingNodes();
        }
    }

    // ==================== Scope ====================

    @Override
    public State state() {
        return getParent().state();
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
        node.setParent(this);
        state().addNode(node);
        nodes.add(node);
    }

    @Override
    public void addEdge(MultiEdge edge) {
        state().addEdge(edge);
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

        Scope parent = getParent();
        Connector source = parent.lookup(value);
        String key = Node.sanitize(value.name());

        Connector in = Connector.in(this, "IN_" + key).withData(source.data());
        addInConnector(in);
        parent.addEdge(new MultiEdge(getLocation(), source, in));

        Connector out = Connector.out(this, "OUT_" + key).withData(source.data()).withRanges(source.ranges());
        addOutConnector(out);
        mapConnector(value, out);
        LOG.fine("Routed " + value.toSourceString() + " into " + this);
        return out;
    }

    @Override
    public void addDependency(Value value, Connector connector) {
        if (bindings.contains(value)) {
            addEdge(MultiEdge.dependency(getLocation(), lookup(value), connector));
            return;
        }

        Connector in = Connector.nullIn(this);
        addInConnector(in);
        Connector out = Connector.nullOut(this);
        addOutConnector(out);
        addEdge(MultiEdge.dependency(getLocation(), out, connector));
        getParent().addDependency(value, in);
    }

    @Override
    public void routeWrite(Connector from, Connector to, Value value) {
        if (!(to.node() instanceof Access target)) {
            throw TranslationException.structural("Write target " + to + " is not an access node", getLocation());
        }

        Access mirror = new Access(getLocation(), target.isInit());
        mirror.setName(target.getName());
        addNode(mirror);

        Connector mirrorIn = Connector.nullIn(mirror).withData(to.data()).withRanges(to.ranges());
        mirror.addInConnector(mirrorIn);
        addEdge(new MultiEdge(getLocation(), from, mirrorIn));

        Connector mirrorOut = Connector.nullOut(mirror).withData(to.data());
        mirror.addOutConnector(mirrorOut);
        mapConnector(value, mirrorOut);

        writeQueue.add(new QueuedWrite(mirrorOut, to.withRanges(List.of()), value));
    }

    // ==================== Closure ====================

    /**
     * Finishes the scope. Runs exactly once; a second call is a structural
     * conflict.
     */
    public void connectDanglingNodes() {
        if (closed) {
            throw TranslationException.structural(this + " is already closed", getLocation());
        }
        closed = true;

        Connector entryOut = Connector.nullOut(this);
        addOutConnector(entryOut);
        Connector exitIn = Connector.nullIn(exit);
        exit.addInConnector(exitIn);
        addEdge(new MultiEdge(getLocation(), entryOut, exitIn));

        for (QueuedWrite write : writeQueue) {
            if (hasOutgoingEdge(write.from().node())) {
                LOG.fine("Skipping queued write of " + write.value().toSourceString() + ": read inside " + this);
                continue;
            }
            routeOut(write);
        }
        writeQueue.clear();

        for (ConnectorNode node : List.copyOf(nodes)) {
            if (node instanceof ScopeExit || hasIncomingEdge(node)) {
                continue;
            }
            Connector in = Connector.nullIn(node);
            node.addInConnector(in);
            addEdge(new MultiEdge(getLocation(), entryOut, in));
        }

        for (ConnectorNode node : List.copyOf(nodes)) {
            if (node instanceof ScopeEntry || hasOutgoingEdge(node)) {
                continue;
            }
            Connector out = Connector.nullOut(node);
            node.addOutConnector(out);
            addEdge(new MultiEdge(getLocation(), out, exitIn));
        }
    }

    private void routeOut(QueuedWrite write) {
        String key = Node.sanitize(write.value().name());
        Connector from = write.from();

        Connector in = Connector.in(exit, "IN_" + key).withData(from.data());
        exit.addInConnector(in);
        addEdge(new MultiEdge(getLocation(), from, in));

        Connector out = Connector.out(exit, "OUT_" + key).withData(from.data()).withRanges(from.ranges());
        exit.addOutConnector(out);
        getParent().routeWrite(out, write.to(), write.value());
    }

    private boolean hasIncomingEdge(ConnectorNode node) {
        for (MultiEdge edge : edges) {
            if (edge.getDestination().node() == node) {
                return true;
            }
        }
        return false;
    }

    private boolean hasOutgoingEdge(ConnectorNode node) {
        for (MultiEdge edge : edges) {
            if (edge.getSource().node() == node) {
                return true;
            }
        }
        return false;
    }
}
