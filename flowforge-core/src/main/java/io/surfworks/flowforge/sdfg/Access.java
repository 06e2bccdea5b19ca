package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Access node: a read or write point of a data container. The node's name
 * is the container name.
 */
public final class Access extends ConnectorNode {

    private final boolean init;

    public Access(Location location, boolean init) {
        super(location);
        this.init = init;
    }

    public Access(Location location) {
        this(location, false);
    }

    /** Whether the container is zero-initialized ({@code setzero}). */
    public boolean isInit() {
        return init;
    }

    @Override
    protected String typeName() {
        return "AccessNode";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        jemit.printKVPair("data", getName());
        jemit.printKVPair("setzero", init);
    }
}
