package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;

/**
 * Fatal translation error. Carries the kind of failure and the source
 * location of the construct that caused it.
 */
public class TranslationException extends RuntimeException {

    public enum ErrorKind {
        /** Missing or conflicting graph structure. */
        STRUCTURAL_CONFLICT,
        /** An element type with no dtype counterpart. */
        UNSUPPORTED_TYPE
    }

    private final ErrorKind kind;
    private final Location location;

    public TranslationException(ErrorKind kind, String message, Location location) {
        super(String.format("%s at %s", message, location));
        this.kind = kind;
        this.location = location;
    }

    public static TranslationException structural(String message, Location location) {
        return new TranslationException(ErrorKind.STRUCTURAL_CONFLICT, message, location);
    }

    public static TranslationException unsupportedType(String typeName, Location location) {
        return new TranslationException(ErrorKind.UNSUPPORTED_TYPE, "Unsupported type: " + typeName, location);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Location getLocation() {
        return location;
    }
}
