package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;

/**
 * A free symbol of a graph.
 */
public record Symbol(String name, DType type) {

    public void emit(JsonEmitter jemit) {
        jemit.printKVPair(name, type.wireName());
    }
}
