package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;

public final class MapExit extends ScopeExit {

    public MapExit(Location location) {
        super(location);
    }

    @Override
    protected String typeName() {
        return "MapExit";
    }
}
