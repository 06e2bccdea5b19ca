package io.surfworks.flowforge.sdfg;

import java.util.List;
import java.util.Objects;

/**
 * A port on a node. A connector with a null name is a nameless pass-through
 * port: it may carry edges but is never listed among the node's connectors in
 * the output. {@code data} names the container flowing through the port, if
 * any, and {@code ranges} narrow it to a subset.
 */
public record Connector(ConnectorNode node, Direction direction, String name, String data, List<Range> ranges) {

    public enum Direction { IN, OUT }

    public Connector {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(direction, "direction");
        ranges = List.copyOf(ranges);
    }

    public static Connector in(ConnectorNode node, String name) {
        return new Connector(node, Direction.IN, name, null, List.of());
    }

    public static Connector out(ConnectorNode node, String name) {
        return new Connector(node, Direction.OUT, name, null, List.of());
    }

    public static Connector nullIn(ConnectorNode node) {
        return in(node, null);
    }

    public static Connector nullOut(ConnectorNode node) {
        return out(node, null);
    }

    public boolean isNull() {
        return name == null;
    }

    public boolean hasData() {
        return data != null;
    }

    public Connector withData(String newData) {
        return new Connector(node, direction, name, newData, ranges);
    }

    public Connector withRanges(List<Range> newRanges) {
        return new Connector(node, direction, name, data, newRanges);
    }

    @Override
    public String toString() {
        return node + "." + direction.name().toLowerCase() + "(" + (name == null ? "null" : name) + ")";
    }
}
