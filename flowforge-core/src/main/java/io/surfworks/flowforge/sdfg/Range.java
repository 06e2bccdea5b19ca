package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Symbolic index range. {@code end} is inclusive.
 */
public record Range(String start, String end, String step, String tile) {

    public Range {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(tile, "tile");
    }

    public static Range of(String start, String end, String step) {
        return new Range(start, end, step, "1");
    }

    /**
     * A single index.
     */
    public static Range point(String index) {
        return new Range(index, index, "1", "1");
    }

    public static List<Range> points(List<String> indices) {
        List<Range> ranges = new ArrayList<>(indices.size());
        for (String index : indices) {
            ranges.add(point(index));
        }
        return ranges;
    }

    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        jemit.printKVPair("start", start);
        jemit.printKVPair("end", end);
        jemit.printKVPair("step", step);
        jemit.printKVPair("tile", tile);
        jemit.endObject();
    }
}
