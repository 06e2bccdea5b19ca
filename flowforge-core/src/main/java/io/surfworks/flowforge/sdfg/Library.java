package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Library node. The classpath names the library implementation to call.
 */
public final class Library extends ConnectorNode {

    private String classpath = "";

    public Library(Location location) {
        super(location);
    }

    public String getClasspath() {
        return classpath;
    }

    public void setClasspath(String classpath) {
        this.classpath = classpath;
    }

    @Override
    protected String typeName() {
        return "LibraryNode";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        jemit.printKVPair("classpath", classpath);
    }
}
