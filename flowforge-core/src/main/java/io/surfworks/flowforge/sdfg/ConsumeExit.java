package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;

public final class ConsumeExit extends ScopeExit {

    public ConsumeExit(Location location) {
        super(location);
    }

    @Override
    protected String typeName() {
        return "ConsumeExit";
    }
}
