package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.ArrayType;
import io.surfworks.flowforge.ir.ProgramAst.Dim;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.ScalarType;
import io.surfworks.flowforge.ir.ProgramAst.StreamType;
import io.surfworks.flowforge.ir.ProgramAst.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * A data container of a graph: array, scalar or stream.
 */
public final class ArrayDescriptor {

    private final String name;
    private final boolean stream;
    private final List<Dim> shape;
    private final DType dtype;
    private final Location location;
    private boolean transientData;

    public ArrayDescriptor(String name, boolean transientData, boolean stream, List<Dim> shape, DType dtype,
                           Location location) {
        this.name = name;
        this.transientData = transientData;
        this.stream = stream;
        this.shape = List.copyOf(shape);
        this.dtype = dtype;
        this.location = location;
    }

    /**
     * Builds a descriptor from a value type.
     *
     * @throws TranslationException of kind UNSUPPORTED_TYPE for an element
     *         type without dtype
     */
    public static ArrayDescriptor of(String name, boolean transientData, Type type, Location location) {
        if (type instanceof ArrayType array) {
            return new ArrayDescriptor(name, transientData, false, array.shape(),
                    DType.of(array.elementType(), location), location);
        }
        if (type instanceof StreamType streamType) {
            return new ArrayDescriptor(name, transientData, true, streamType.shape(),
                    DType.of(streamType.elementType(), location), location);
        }
        ScalarType scalar = (ScalarType) type;
        return new ArrayDescriptor(name, transientData, false, List.of(), DType.of(scalar, location), location);
    }

    public String getName() {
        return name;
    }

    public boolean isTransient() {
        return transientData;
    }

    public void setTransient(boolean transientData) {
        this.transientData = transientData;
    }

    public boolean isStream() {
        return stream;
    }

    public List<Dim> getShape() {
        return shape;
    }

    public DType getDtype() {
        return dtype;
    }

    public Location getLocation() {
        return location;
    }

    public List<String> shapeStrings() {
        if (shape.isEmpty()) {
            return List.of("1");
        }
        List<String> dims = new ArrayList<>(shape.size());
        for (Dim dim : shape) {
            dims.add(dim.toSourceString());
        }
        return dims;
    }

    /**
     * Row-major strides written as products, e.g. {@code ["1 * 8", "1"]}.
     * Empty for rank 0.
     */
    public List<String> strideStrings() {
        int rank = shape.size();
        if (rank == 0) {
            return List.of();
        }
        String[] strides = new String[rank];
        strides[rank - 1] = "1";
        for (int i = rank - 2; i >= 0; i--) {
            strides[i] = strides[i + 1] + " * " + shape.get(i + 1).toSourceString();
        }
        return List.of(strides);
    }

    public void emit(JsonEmitter jemit, boolean argument) {
        jemit.startNamedObject(name);
        String type;
        if (stream) {
            type = "Stream";
        } else if (shape.isEmpty() && !argument) {
            type = "Scalar";
        } else {
            type = "Array";
        }
        jemit.printKVPair("type", type);

        jemit.startNamedObject("attributes");
        jemit.printKVPair("transient", transientData);
        jemit.printKVPair("dtype", dtype.wireName());
        EmitSupport.printStrings("shape", shapeStrings(), jemit);
        if (!shape.isEmpty()) {
            EmitSupport.printStrings("strides", strideStrings(), jemit);
        }
        EmitSupport.printLocation(location, jemit);
        jemit.endObject();
        jemit.endObject();
    }
}
