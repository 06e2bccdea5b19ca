package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.List;

/**
 * Dataflow edge between two connectors of the same state. A dependency edge
 * only orders its endpoints and carries no data.
 */
public final class MultiEdge {

    private final Location location;
    private final Connector source;
    private final Connector destination;
    private boolean dependency;

    public MultiEdge(Location location, Connector source, Connector destination) {
        if (source.direction() != Connector.Direction.OUT) {
            throw TranslationException.structural("Edge source " + source + " is not an out-connector", location);
        }
        if (destination.direction() != Connector.Direction.IN) {
            throw TranslationException.structural("Edge destination " + destination + " is not an in-connector",
                    location);
        }
        this.location = location;
        this.source = source;
        this.destination = destination;
    }

    public static MultiEdge dependency(Location location, Connector source, Connector destination) {
        MultiEdge edge = new MultiEdge(location, source, destination);
        edge.makeDependence();
        return edge;
    }

    public void makeDependence() {
        dependency = true;
    }

    public boolean isDependency() {
        return dependency;
    }

    public Connector getSource() {
        return source;
    }

    public Connector getDestination() {
        return destination;
    }

    public Location getLocation() {
        return location;
    }

    /**
     * The container this edge moves: the source's data, else the destination's.
     */
    public String data() {
        if (dependency) {
            return null;
        }
        if (source.hasData()) {
            return source.data();
        }
        return destination.data();
    }

    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        jemit.printKVPair("type", "MultiConnectorEdge");

        jemit.startNamedObject("attributes");
        jemit.startNamedObject("data");
        jemit.printKVPair("type", "Memlet");
        jemit.startNamedObject("attributes");
        EmitSupport.printLocation(location, jemit);

        String data = data();
        if (data != null) {
            jemit.printKVPair("data", data);
            boolean fromSource = source.hasData();
            List<Range> subset = fromSource ? source.ranges() : destination.ranges();
            List<Range> other = fromSource ? destination.ranges() : source.ranges();
            EmitSupport.printRanges("subset", subset, jemit);
            EmitSupport.printRanges("other_subset", other, jemit);
            EmitSupport.printRanges("src_subset", source.ranges(), jemit);
            EmitSupport.printRanges("dst_subset", destination.ranges(), jemit);
        }

        jemit.endObject();
        jemit.endObject();
        jemit.endObject();

        jemit.printKVPair("src", source.node().getId());
        jemit.printKVPair("dst", destination.node().getId());
        printConnectorName("src_connector", source, jemit);
        printConnectorName("dst_connector", destination, jemit);
        jemit.endObject();
    }

    private void printConnectorName(String key, Connector connector, JsonEmitter jemit) {
        if (dependency || connector.isNull()) {
            jemit.printKVPair(key, "null", false);
        } else {
            jemit.printKVPair(key, connector.name());
        }
    }

    @Override
    public String toString() {
        return (dependency ? "dep " : "") + source + " -> " + destination;
    }
}
