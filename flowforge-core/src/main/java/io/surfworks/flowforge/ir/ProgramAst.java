package io.surfworks.flowforge.ir;

import java.util.List;
import java.util.Optional;

/**
 * AST classes for the hierarchical dataflow program representation.
 *
 * <p>A program is a tree: {@link Program} → {@link Function} → {@link StateBlock}
 * → {@link Operation}, where map and consume operations own nested operation
 * lists. These records are the input of the SDFG translator; they are produced
 * by upstream lowering passes (or loaded with {@link ProgramJsonReader}) and are
 * assumed to be well-formed.
 */
public final class ProgramAst {

    private ProgramAst() {}

    // ==================== Locations ====================

    /**
     * Source location attached to functions, states and operations.
     */
    public record Location(String file, int line, int column) {
        public static final Location UNKNOWN = new Location("", 0, 0);

        public static Location of(String file, int line, int column) {
            return new Location(file, line, column);
        }

        public boolean isKnown() {
            return !file.isEmpty() || line > 0;
        }

        @Override
        public String toString() {
            if (!isKnown()) {
                return "<unknown>";
            }
            return file + ":" + line + ":" + column;
        }
    }

    // ==================== Types ====================

    /**
     * Base interface for value types.
     */
    public sealed interface Type permits ScalarType, ArrayType, StreamType {
        String toSourceString();
    }

    /**
     * Scalar element types: i1, i32, index, f32, f64, etc.
     */
    public record ScalarType(String name) implements Type {
        public static final ScalarType I1 = new ScalarType("i1");
        public static final ScalarType I8 = new ScalarType("i8");
        public static final ScalarType I16 = new ScalarType("i16");
        public static final ScalarType I32 = new ScalarType("i32");
        public static final ScalarType I64 = new ScalarType("i64");
        public static final ScalarType INDEX = new ScalarType("index");
        public static final ScalarType F16 = new ScalarType("f16");
        public static final ScalarType F32 = new ScalarType("f32");
        public static final ScalarType F64 = new ScalarType("f64");

        public static ScalarType of(String name) {
            return switch (name) {
                case "i1" -> I1;
                case "i8" -> I8;
                case "i16" -> I16;
                case "i32" -> I32;
                case "i64" -> I64;
                case "index" -> INDEX;
                case "f16" -> F16;
                case "f32" -> F32;
                case "f64" -> F64;
                default -> new ScalarType(name);
            };
        }

        public boolean isFloatingPoint() {
            return name.startsWith("f") || name.equals("bf16");
        }

        public boolean isInteger() {
            return name.startsWith("i");
        }

        @Override
        public String toSourceString() {
            return name;
        }
    }

    /**
     * One dimension of an array or stream shape: a literal size or a symbol.
     */
    public sealed interface Dim permits IntDim, SymDim {
        String toSourceString();
    }

    public record IntDim(long size) implements Dim {
        @Override
        public String toSourceString() {
            return Long.toString(size);
        }
    }

    public record SymDim(String symbol) implements Dim {
        @Override
        public String toSourceString() {
            return symbol;
        }
    }

    /**
     * Array type: f32[4, N]. A rank-0 array is a scalar container.
     */
    public record ArrayType(List<Dim> shape, ScalarType elementType) implements Type {

        public ArrayType {
            shape = List.copyOf(shape);
        }

        public int rank() {
            return shape.size();
        }

        @Override
        public String toSourceString() {
            return elementType.toSourceString() + formatShape(shape);
        }
    }

    /**
     * Stream type: stream&lt;f32&gt; or stream&lt;f32&gt;[4].
     */
    public record StreamType(List<Dim> shape, ScalarType elementType) implements Type {

        public StreamType {
            shape = List.copyOf(shape);
        }

        @Override
        public String toSourceString() {
            return "stream<" + elementType.toSourceString() + ">" + formatShape(shape);
        }
    }

    private static String formatShape(List<Dim> shape) {
        if (shape.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < shape.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(shape.get(i).toSourceString());
        }
        return sb.append("]").toString();
    }

    // ==================== Values ====================

    /**
     * A value reference. The name is the stable key used to bind the value to
     * graph connectors; {@code container} names the data container the value
     * originates from (an argument or allocation), which is the name access
     * nodes receive.
     */
    public record Value(String name, Type type, String container, boolean init) {

        public Value(String name, Type type) {
            this(name, type, name, false);
        }

        public static Value container(String name, Type type, boolean init) {
            return new Value(name, type, name, init);
        }

        public String toSourceString() {
            return "%" + name;
        }

        @Override
        public String toString() {
            return "%" + name + " : " + type.toSourceString();
        }
    }

    // ==================== Tasklet bodies ====================

    /**
     * Primitive operations allowed inside a tasklet body.
     */
    public sealed interface BodyOp permits ArithOp, ConstantOp, CastOp, SymOp, GenericOp, ReturnOp {
        String opName();
        List<Value> results();
        List<Value> operands();
        String toSourceString();
    }

    /**
     * Arithmetic kinds understood by the expression lifter.
     */
    public enum ArithKind {
        ADD("arith.add", 2),
        SUB("arith.sub", 2),
        MUL("arith.mul", 2),
        DIV("arith.div", 2),
        REM("arith.rem", 2),
        MIN("arith.min", 2),
        MAX("arith.max", 2),
        NEG("arith.neg", 1);

        private final String opName;
        private final int arity;

        ArithKind(String opName, int arity) {
            this.opName = opName;
            this.arity = arity;
        }

        public String opName() {
            return opName;
        }

        public int arity() {
            return arity;
        }

        public static Optional<ArithKind> fromOpName(String opName) {
            for (ArithKind kind : values()) {
                if (kind.opName.equals(opName)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    public record ArithOp(ArithKind kind, Value result, List<Value> operands) implements BodyOp {

        public ArithOp {
            operands = List.copyOf(operands);
            if (operands.size() != kind.arity()) {
                throw new IllegalArgumentException(kind.opName() + " expects " + kind.arity()
                        + " operands but got " + operands.size());
            }
        }

        @Override
        public String opName() { return kind.opName(); }

        @Override
        public List<Value> results() { return List.of(result); }

        @Override
        public String toSourceString() {
            return result.toSourceString() + " = " + kind.opName() + " " + joinOperands(operands)
                    + " : " + result.type().toSourceString();
        }
    }

    public record ConstantOp(Value result, String literal) implements BodyOp {
        @Override
        public String opName() { return "arith.constant"; }

        @Override
        public List<Value> results() { return List.of(result); }

        @Override
        public List<Value> operands() { return List.of(); }

        @Override
        public String toSourceString() {
            return result.toSourceString() + " = arith.constant " + literal + " : " + result.type().toSourceString();
        }
    }

    public record CastOp(Value result, Value operand) implements BodyOp {
        @Override
        public String opName() { return "arith.index_cast"; }

        @Override
        public List<Value> results() { return List.of(result); }

        @Override
        public List<Value> operands() { return List.of(operand); }

        @Override
        public String toSourceString() {
            return result.toSourceString() + " = arith.index_cast " + operand.toSourceString()
                    + " : " + operand.type().toSourceString() + " to " + result.type().toSourceString();
        }
    }

    /**
     * Symbolic expression evaluated at runtime, e.g. {@code N - 1}.
     */
    public record SymOp(Value result, String expression) implements BodyOp {
        @Override
        public String opName() { return "sdfg.sym"; }

        @Override
        public List<Value> results() { return List.of(result); }

        @Override
        public List<Value> operands() { return List.of(); }

        @Override
        public String toSourceString() {
            return result.toSourceString() + " = sdfg.sym(\"" + expression + "\") : " + result.type().toSourceString();
        }
    }

    /**
     * Any other operation (math intrinsics, calls). Kept verbatim; the lifter
     * does not understand it.
     */
    public record GenericOp(String opName, List<Value> results, List<Value> operands) implements BodyOp {

        public GenericOp {
            results = List.copyOf(results);
            operands = List.copyOf(operands);
        }

        @Override
        public String toSourceString() {
            StringBuilder sb = new StringBuilder();
            if (!results.isEmpty()) {
                sb.append(joinOperands(results)).append(" = ");
            }
            sb.append(opName).append("(").append(joinOperands(operands)).append(")");
            return sb.toString();
        }
    }

    /**
     * Tasklet terminator. Its operands become the tasklet outputs.
     */
    public record ReturnOp(List<Value> operands) implements BodyOp {

        public ReturnOp {
            operands = List.copyOf(operands);
        }

        @Override
        public String opName() { return "sdfg.return"; }

        @Override
        public List<Value> results() { return List.of(); }

        @Override
        public String toSourceString() {
            return "sdfg.return " + joinOperands(operands);
        }
    }

    private static String joinOperands(List<Value> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(values.get(i).toSourceString());
        }
        return sb.toString();
    }

    // ==================== Operations ====================

    /**
     * Base interface for operations inside a state or a nested scope.
     */
    public sealed interface Operation permits
            AllocOp, AllocSymbolOp, TaskletOp, LibCallOp, LoadOp, StoreOp, CopyOp,
            StreamPopOp, StreamPushOp, MapOp, ConsumeOp, NestedGraphOp {

        String opName();
        Location location();
    }

    /**
     * sdfg.alloc - Declares a data container. The container name is the
     * result's {@link Value#container()}.
     */
    public record AllocOp(Value result, boolean transientData, Location location) implements Operation {
        @Override
        public String opName() { return "sdfg.alloc"; }

        public String name() {
            return result.container();
        }
    }

    /**
     * sdfg.alloc_symbol - Declares a free symbol.
     */
    public record AllocSymbolOp(String symbol, Location location) implements Operation {
        @Override
        public String opName() { return "sdfg.alloc_symbol"; }
    }

    /**
     * sdfg.tasklet - Pure computation. {@code params} are the body-local names
     * of the operands, {@code results} the values bound to the body's return
     * operands. {@code dependencies} are values that must be produced before
     * the tasklet runs but are not read by it.
     */
    public record TaskletOp(
            List<Value> operands,
            List<Value> params,
            List<BodyOp> body,
            List<Value> results,
            List<Value> dependencies,
            boolean sideEffects,
            Location location
    ) implements Operation {

        public TaskletOp {
            operands = List.copyOf(operands);
            params = List.copyOf(params);
            body = List.copyOf(body);
            results = List.copyOf(results);
            dependencies = List.copyOf(dependencies);
            if (operands.size() != params.size()) {
                throw new IllegalArgumentException("Tasklet has " + operands.size()
                        + " operands but " + params.size() + " parameters");
            }
        }

        @Override
        public String opName() { return "sdfg.tasklet"; }

        public Optional<ReturnOp> terminator() {
            if (!body.isEmpty() && body.get(body.size() - 1) instanceof ReturnOp ret) {
                return Optional.of(ret);
            }
            return Optional.empty();
        }

        public String inputName(int idx) {
            return params.get(idx).name();
        }

        /**
         * Output connector name: the returned value's name, prefixed with
         * {@code __out} when it collides with an input, or {@code __out<idx>}
         * when the body has no terminator.
         */
        public String outputName(int idx) {
            Optional<ReturnOp> ret = terminator();
            if (ret.isEmpty() || idx >= ret.get().operands().size()) {
                return "__out" + idx;
            }
            String name = ret.get().operands().get(idx).name();
            for (Value param : params) {
                if (param.name().equals(name)) {
                    return "__out" + name;
                }
            }
            return name;
        }

        public String bodyText() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < body.size(); i++) {
                if (i > 0) sb.append("\n");
                sb.append(body.get(i).toSourceString());
            }
            return sb.toString();
        }
    }

    /**
     * sdfg.libcall - Call into a library node. Connector names default to
     * {@code _in<i>} and {@code __out<i>}.
     */
    public record LibCallOp(
            String callee,
            List<Value> operands,
            List<String> inputNames,
            List<Value> results,
            List<String> outputNames,
            List<Value> dependencies,
            Location location
    ) implements Operation {

        public LibCallOp {
            operands = List.copyOf(operands);
            inputNames = List.copyOf(inputNames);
            results = List.copyOf(results);
            outputNames = List.copyOf(outputNames);
            dependencies = List.copyOf(dependencies);
        }

        @Override
        public String opName() { return "sdfg.libcall"; }

        public String inputName(int idx) {
            return idx < inputNames.size() ? inputNames.get(idx) : "_in" + idx;
        }

        public String outputName(int idx) {
            return idx < outputNames.size() ? outputNames.get(idx) : "__out" + idx;
        }
    }

    /**
     * sdfg.load - Reads {@code array[indices]}. An empty index list reads the
     * whole container.
     */
    public record LoadOp(Value result, Value array, List<String> indices, Location location) implements Operation {

        public LoadOp {
            indices = List.copyOf(indices);
        }

        @Override
        public String opName() { return "sdfg.load"; }
    }

    /**
     * sdfg.store - Writes {@code value} into {@code array[indices]}.
     */
    public record StoreOp(Value value, Value array, List<String> indices, Location location) implements Operation {

        public StoreOp {
            indices = List.copyOf(indices);
        }

        @Override
        public String opName() { return "sdfg.store"; }
    }

    /**
     * sdfg.copy - Copies one whole container into another.
     */
    public record CopyOp(Value source, Value destination, Location location) implements Operation {
        @Override
        public String opName() { return "sdfg.copy"; }
    }

    public record StreamPopOp(Value result, Value stream, Location location) implements Operation {
        @Override
        public String opName() { return "sdfg.stream_pop"; }
    }

    public record StreamPushOp(Value value, Value stream, Location location) implements Operation {
        @Override
        public String opName() { return "sdfg.stream_push"; }
    }

    /**
     * sdfg.map - Parallel scope over {@code params}. Bounds are inclusive.
     */
    public record MapOp(
            List<String> params,
            List<String> lowerBounds,
            List<String> upperBounds,
            List<String> steps,
            List<Operation> body,
            Location location
    ) implements Operation {

        public MapOp {
            params = List.copyOf(params);
            lowerBounds = List.copyOf(lowerBounds);
            upperBounds = List.copyOf(upperBounds);
            steps = List.copyOf(steps);
            body = List.copyOf(body);
            if (lowerBounds.size() != params.size() || upperBounds.size() != params.size()
                    || steps.size() != params.size()) {
                throw new IllegalArgumentException("Map bounds do not match its " + params.size() + " parameters");
            }
        }

        @Override
        public String opName() { return "sdfg.map"; }
    }

    /**
     * sdfg.consume - Streaming scope. Each processing element pops
     * {@code element} from {@code stream} until {@code condition} fails.
     * {@code numPes} and {@code condition} may be null.
     */
    public record ConsumeOp(
            Value stream,
            String peIndex,
            Value element,
            String numPes,
            String condition,
            List<Operation> body,
            Location location
    ) implements Operation {

        public ConsumeOp {
            body = List.copyOf(body);
        }

        @Override
        public String opName() { return "sdfg.consume"; }

        public Optional<String> numPesValue() {
            return Optional.ofNullable(numPes);
        }

        public Optional<String> conditionValue() {
            return Optional.ofNullable(condition);
        }
    }

    /**
     * sdfg.nested_sdfg - A complete nested function. Its arguments are bound
     * in order to {@code inputs} followed by {@code outputs}.
     */
    public record NestedGraphOp(
            List<Value> inputs,
            List<Value> outputs,
            Function function,
            Location location
    ) implements Operation {

        public NestedGraphOp {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
            if (function.arguments().size() != inputs.size() + outputs.size()) {
                throw new IllegalArgumentException("Nested function @" + function.name() + " takes "
                        + function.arguments().size() + " arguments but "
                        + (inputs.size() + outputs.size()) + " values are passed");
            }
        }

        @Override
        public String opName() { return "sdfg.nested_sdfg"; }
    }

    // ==================== States, Functions and Program ====================

    /**
     * A state: an unordered dataflow region with its operations in source order.
     */
    public record StateBlock(String name, List<Operation> operations, Location location) {

        public StateBlock {
            operations = List.copyOf(operations);
        }
    }

    /**
     * Control edge between two states. Assignments use the form
     * {@code "name: expression"}.
     */
    public record Transition(
            String source,
            String destination,
            String condition,
            List<String> assignments,
            Location location
    ) {

        public Transition {
            assignments = List.copyOf(assignments);
        }
    }

    /**
     * A function: arguments, free symbols, allocations, states and the edges
     * between them. {@code entry} names the start state and may be null, in
     * which case the first state starts.
     */
    public record Function(
            String name,
            List<Value> arguments,
            List<String> symbols,
            List<AllocOp> allocations,
            List<StateBlock> states,
            List<Transition> transitions,
            String entry,
            Location location
    ) {

        public Function {
            arguments = List.copyOf(arguments);
            symbols = List.copyOf(symbols);
            allocations = List.copyOf(allocations);
            states = List.copyOf(states);
            transitions = List.copyOf(transitions);
        }

        public Optional<String> entryState() {
            return Optional.ofNullable(entry);
        }

        public Optional<StateBlock> getState(String stateName) {
            return states.stream()
                    .filter(s -> s.name().equals(stateName))
                    .findFirst();
        }
    }

    /**
     * A program.
     */
    public record Program(String name, List<Function> functions) {

        public Program {
            functions = List.copyOf(functions);
        }

        public Optional<Function> getFunction(String functionName) {
            return functions.stream()
                    .filter(f -> f.name().equals(functionName))
                    .findFirst();
        }
    }
}
