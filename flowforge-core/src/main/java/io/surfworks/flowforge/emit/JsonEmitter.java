package io.surfworks.flowforge.emit;

/**
 * Call contract used by graph entities to serialize themselves.
 *
 * <p>Calls must be balanced: every {@code start*} has a matching
 * {@code end*}. Key names passed to {@code printKVPair} are part of the wire
 * format and are never rewritten by an implementation.
 */
public interface JsonEmitter {

    void startObject();

    void startNamedObject(String name);

    void endObject();

    void startNamedList(String name);

    void endList();

    /**
     * Marks the start of a list element. Implementations that track
     * separators themselves may treat this as a no-op.
     */
    void startEntry();

    /**
     * Writes a bare string element into the current list.
     */
    void printString(String value);

    /**
     * Writes {@code key: value}. With {@code stringify} false the value is
     * written as raw JSON, so {@code "null"}, {@code "true"} or {@code "[]"}
     * keep their JSON meaning; a null value is written as JSON null.
     */
    void printKVPair(String key, String value, boolean stringify);

    void printKVPair(String key, long value, boolean stringify);

    default void printKVPair(String key, String value) {
        printKVPair(key, value, true);
    }

    default void printKVPair(String key, long value) {
        printKVPair(key, value, true);
    }

    default void printKVPair(String key, boolean value) {
        printKVPair(key, Boolean.toString(value), false);
    }
}
