package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.ScalarType;

/**
 * Element types of the output format.
 */
public enum DType {
    BOOL("bool"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    FLOAT16("float16"),
    FLOAT32("float32"),
    FLOAT64("float64");

    private final String wireName;

    DType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps a scalar element type to its dtype.
     *
     * @throws TranslationException of kind UNSUPPORTED_TYPE when no dtype exists
     */
    public static DType of(ScalarType type, Location location) {
        return switch (type.name()) {
            case "i1" -> BOOL;
            case "i8" -> INT8;
            case "i16" -> INT16;
            case "i32" -> INT32;
            case "i64", "index" -> INT64;
            case "f16" -> FLOAT16;
            case "f32" -> FLOAT32;
            case "f64" -> FLOAT64;
            default -> throw TranslationException.unsupportedType(type.name(), location);
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
