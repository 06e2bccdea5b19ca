package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

public final class Tasklet extends ConnectorNode {

    private Code code = Code.EMPTY;
    private Code codeGlobal = Code.EMPTY;
    private boolean sideEffects;

    public Tasklet(Location location) {
        super(location);
    }

    public Code getCode() {
        return code;
    }

    public void setCode(Code code) {
        this.code = code;
    }

    public Code getGlobalCode() {
        return codeGlobal;
    }

    public void setGlobalCode(Code codeGlobal) {
        this.codeGlobal = codeGlobal;
    }

    public boolean hasSideEffects() {
        return sideEffects;
    }

    public void setHasSideEffect(boolean sideEffects) {
        this.sideEffects = sideEffects;
    }

    @Override
    protected String typeName() {
        return "Tasklet";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        code.emit(jemit, "code");
        codeGlobal.emit(jemit, "code_global");
        jemit.printKVPair("side_effects", sideEffects);
    }
}
