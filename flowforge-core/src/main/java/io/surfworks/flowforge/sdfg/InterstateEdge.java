package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Control-flow edge between two states, taken when its condition holds.
 */
public final class InterstateEdge {

    /**
     * Symbol assignment executed when the edge is taken.
     */
    public record Assignment(String key, String value) {

        /**
         * Parses {@code "name: expression"}, splitting at the first colon.
         */
        public static Assignment parse(String text, Location location) {
            int colon = text.indexOf(':');
            if (colon < 0) {
                throw TranslationException.structural("Malformed assignment '" + text + "', expected 'name: value'",
                        location);
            }
            String key = text.substring(0, colon).trim();
            String value = text.substring(colon + 1).trim();
            if (key.isEmpty()) {
                throw TranslationException.structural("Assignment '" + text + "' has no target", location);
            }
            return new Assignment(key, value);
        }
    }

    private final Location location;
    private final State source;
    private final State destination;
    private String condition = "1";
    private final List<Assignment> assignments = new ArrayList<>();

    public InterstateEdge(Location location, State source, State destination) {
        this.location = location;
        this.source = source;
        this.destination = destination;
    }

    public State getSource() {
        return source;
    }

    public State getDestination() {
        return destination;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public void addAssignment(Assignment assignment) {
        for (Assignment existing : assignments) {
            if (existing.key().equals(assignment.key())) {
                throw TranslationException.structural("Symbol '" + assignment.key()
                        + "' is assigned twice on the edge " + source.getName() + " -> "
                        + destination.getName(), location);
            }
        }
        assignments.add(assignment);
    }

    public List<Assignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        jemit.printKVPair("type", "Edge");

        jemit.startNamedObject("attributes");
        jemit.startNamedObject("data");
        jemit.printKVPair("type", "InterstateEdge");
        jemit.startNamedObject("attributes");
        jemit.startNamedObject("assignments");
        for (Assignment assignment : assignments) {
            jemit.printKVPair(assignment.key(), assignment.value());
        }
        jemit.endObject();
        Code.python(condition).emit(jemit, "condition");
        EmitSupport.printLocation(location, jemit);
        jemit.endObject();
        jemit.endObject();
        jemit.endObject();

        jemit.printKVPair("src", source.getId());
        jemit.printKVPair("dst", destination.getId());
        jemit.endObject();
    }
}
