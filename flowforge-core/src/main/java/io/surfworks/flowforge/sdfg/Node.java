package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Base of every graph entity with an id, a name and a source location.
 */
public abstract sealed class Node permits State, ConnectorNode {

    private final Location location;
    private int id = -1;
    private String name = "";
    private Scope parent;

    protected Node(Location location) {
        this.location = location;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public boolean hasId() {
        return id >= 0;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets the name; characters outside {@code [A-Za-z0-9_]} become {@code _}.
     */
    public void setName(String name) {
        this.name = sanitize(name);
    }

    public Location getLocation() {
        return location;
    }

    public Scope getParent() {
        return parent;
    }

    void setParent(Scope parent) {
        this.parent = parent;
    }

    public boolean hasParent() {
        return parent != null;
    }

    public abstract void emit(JsonEmitter jemit);

    public static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(safe ? c : '_');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ":" + name + "]";
    }
}
