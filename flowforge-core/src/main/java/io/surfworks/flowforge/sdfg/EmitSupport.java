package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.List;

final class EmitSupport {

    private EmitSupport() {}

    static void printLocation(Location location, JsonEmitter jemit) {
        jemit.startNamedObject("debuginfo");
        jemit.printKVPair("type", "DebugInfo");
        jemit.printKVPair("start_line", location.line(), false);
        jemit.printKVPair("end_line", location.line(), false);
        jemit.printKVPair("start_column", location.column(), false);
        jemit.printKVPair("end_column", location.column(), false);
        jemit.printKVPair("filename", location.file());
        jemit.endObject();
    }

    /**
     * Writes {@code key: {"type": "Range", "ranges": [...]}}, or null for an
     * empty range list.
     */
    static void printRanges(String key, List<Range> ranges, JsonEmitter jemit) {
        if (ranges.isEmpty()) {
            jemit.printKVPair(key, "null", false);
            return;
        }
        jemit.startNamedObject(key);
        jemit.printKVPair("type", "Range");
        jemit.startNamedList("ranges");
        for (Range range : ranges) {
            jemit.startEntry();
            range.emit(jemit);
        }
        jemit.endList();
        jemit.endObject();
    }

    static void printStrings(String key, List<String> values, JsonEmitter jemit) {
        jemit.startNamedList(key);
        for (String value : values) {
            jemit.startEntry();
            jemit.printString(value);
        }
        jemit.endList();
    }
}
