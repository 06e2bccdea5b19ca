package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Exit node of a map or consume scope. The exit lives in the scope's parent,
 * next to its entry.
 */
public abstract sealed class ScopeExit extends ConnectorNode permits MapExit, ConsumeExit {

    private ScopeEntry entry;

    protected ScopeExit(Location location) {
        super(location);
    }

    public ScopeEntry getEntry() {
        return entry;
    }

    void setEntry(ScopeEntry entry) {
        if (this.entry != null) {
            throw TranslationException.structural(this + " is already paired with " + this.entry, getLocation());
        }
        this.entry = entry;
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
    }

    @Override
    protected void emitScope(JsonEmitter jemit) {
        jemit.printKVPair("scope_entry", entry.getId());
        jemit.printKVPair("scope_exit", getId());
    }
}
