package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry of a parallel map scope. Holds one range per parameter.
 */
public final class MapEntry extends ScopeEntry {

    private final List<String> params = new ArrayList<>();
    private final List<Range> ranges = new ArrayList<>();

    public MapEntry(Location location) {
        super(location, new MapExit(location));
    }

    @Override
    public MapExit getExit() {
        return (MapExit) super.getExit();
    }

    public void addParam(String param) {
        params.add(param);
    }

    public void addRange(Range range) {
        ranges.add(range);
    }

    public List<String> getParams() {
        return Collections.unmodifiableList(params);
    }

    public List<Range> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    @Override
    protected String typeName() {
        return "MapEntry";
    }

    @Override
    protected void emitAttributes(JsonEmitter jemit) {
        EmitSupport.printStrings("params", params, jemit);
        jemit.startNamedObject("range");
        jemit.printKVPair("type", "Range");
        jemit.startNamedList("ranges");
        for (Range range : ranges) {
            jemit.startEntry();
            range.emit(jemit);
        }
        jemit.endList();
        jemit.endObject();
    }
}
