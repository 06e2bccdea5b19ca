package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Entry of a streaming consume scope.
 */
public final class ConsumeEntry extends ScopeEntry {

    private String numPes;
    private String peIndex = "";
    private Code condition = Code.EMPTY;

    public ConsumeEntry(Location location) {
        super(location, new ConsumeExit(location));
    }

    @Override
    public ConsumeExit getExit() {
        return (ConsumeExit) super.getExit();
    }

    /** Number of processing elements; null leaves it to the runtime. */
    public void setNumPes(String numPes) {
        this.numPes = numPes;
    }

    public String getNumPes() {
        return numPes;
    }

    public void setPeIndex(String peIndex) {
        this.peIndex = peIndex;
    }

    public String getPeIndex() {
        return peIndex;
    }

    public void setCondition(Code condition) {
        this.condition = condition;
    }

    public Code getCondition() {
        return condition;
    }

    @Override
    protected String typeName() {
        return "ConsumeEntry";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        if (numPes == null) {
            jemit.printKVPair("num_pes", "null", false);
        } else {
            jemit.printKVPair("num_pes", numPes);
        }
        jemit.printKVPair("pe_index", peIndex);
        condition.emit(jemit, "condition");
    }
}
