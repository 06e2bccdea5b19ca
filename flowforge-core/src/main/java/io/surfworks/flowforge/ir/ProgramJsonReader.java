package io.surfworks.flowforge.ir;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.surfworks.flowforge.ir.ProgramAst.*;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads a {@link Program} from its JSON form.
 *
 * <p>Document layout:
 * <pre>
 * {
 *   "name": "vector_add",
 *   "functions": [{
 *     "name": "main",
 *     "arguments": [{"name": "A", "type": "f32[N]"}],
 *     "symbols": ["N"],
 *     "allocations": [{"name": "C", "type": "f32[N]", "transient": true}],
 *     "states": [{"name": "s0", "operations": [ ... ]}],
 *     "edges": [{"source": "s0", "destination": "s1", "condition": "i < N", "assignments": ["i: i + 1"]}],
 *     "entry": "s0"
 *   }]
 * }
 * </pre>
 *
 * <p>Types are written {@code f32}, {@code f32[4, N]} (array),
 * {@code f32[]} (rank-0 array) and {@code stream<f32>} or
 * {@code stream<f32>[4]}. Every operation object has an {@code "op"} field
 * and an optional {@code "loc": {"file", "line", "column"}}. Values are
 * referenced by name and must be defined before use.
 */
public final class ProgramJsonReader {

    private static final Logger LOG = Logger.getLogger(ProgramJsonReader.class.getName());

    private static final Pattern STREAM_TYPE = Pattern.compile("stream<(\\w+)>(\\[(.*)])?");
    private static final Pattern ARRAY_TYPE = Pattern.compile("(\\w+)\\[(.*)]");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    public ProgramJsonReader() {}

    public Program read(Path path) throws IOException {
        return read(Files.readString(path, StandardCharsets.UTF_8), path.getFileName().toString());
    }

    public Program read(Reader reader, String sourceName) {
        try {
            return readProgram(JsonParser.parseReader(reader), sourceName);
        } catch (JsonParseException e) {
            throw new ProgramFormatException("Invalid JSON in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    public Program read(String json, String sourceName) {
        try {
            return readProgram(JsonParser.parseString(json), sourceName);
        } catch (JsonParseException e) {
            throw new ProgramFormatException("Invalid JSON in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private Program readProgram(JsonElement root, String sourceName) {
        JsonObject obj = object(root, "program");
        String name = optString(obj, "name").orElse(sourceName);
        List<Function> functions = new ArrayList<>();
        for (JsonElement fn : array(obj, "functions")) {
            functions.add(new FunctionReader(sourceName).read(object(fn, "function")));
        }
        LOG.fine("Read program " + name + " with " + functions.size() + " function(s)");
        return new Program(name, functions);
    }

    // ==================== Functions ====================

    /**
     * Reads one function; owns the function's value environment.
     */
    private static final class FunctionReader {
        private final String sourceName;
        private final Map<String, Value> values = new HashMap<>();

        FunctionReader(String sourceName) {
            this.sourceName = sourceName;
        }

        Function read(JsonObject obj) {
            String name = string(obj, "name");
            Location location = location(obj, sourceName);

            List<Value> arguments = new ArrayList<>();
            for (JsonElement arg : optArray(obj, "arguments")) {
                JsonObject argObj = object(arg, "argument");
                arguments.add(define(Value.container(string(argObj, "name"), parseType(string(argObj, "type")),
                        optBoolean(argObj, "init", false))));
            }

            List<String> symbols = new ArrayList<>();
            for (JsonElement sym : optArray(obj, "symbols")) {
                symbols.add(sym.getAsString());
            }

            List<AllocOp> allocations = new ArrayList<>();
            for (JsonElement alloc : optArray(obj, "allocations")) {
                allocations.add(readAlloc(object(alloc, "allocation")));
            }

            List<StateBlock> states = new ArrayList<>();
            for (JsonElement state : array(obj, "states")) {
                JsonObject stateObj = object(state, "state");
                states.add(new StateBlock(string(stateObj, "name"), readOperations(optArray(stateObj, "operations")),
                        location(stateObj, sourceName)));
            }

            List<Transition> transitions = new ArrayList<>();
            for (JsonElement edge : optArray(obj, "edges")) {
                JsonObject edgeObj = object(edge, "edge");
                List<String> assignments = new ArrayList<>();
                for (JsonElement assignment : optArray(edgeObj, "assignments")) {
                    assignments.add(assignment.getAsString());
                }
                transitions.add(new Transition(string(edgeObj, "source"), string(edgeObj, "destination"),
                        optString(edgeObj, "condition").orElse(null), assignments, location(edgeObj, sourceName)));
            }

            return new Function(name, arguments, symbols, allocations, states, transitions,
                    optString(obj, "entry").orElse(null), location);
        }

        private AllocOp readAlloc(JsonObject obj) {
            Value result = define(Value.container(string(obj, "name"), parseType(string(obj, "type")),
                    optBoolean(obj, "init", false)));
            return new AllocOp(result, optBoolean(obj, "transient", true), location(obj, sourceName));
        }

        private List<Operation> readOperations(JsonArray ops) {
            List<Operation> operations = new ArrayList<>();
            for (JsonElement op : ops) {
                operations.add(readOperation(object(op, "operation")));
            }
            return operations;
        }

        private Operation readOperation(JsonObject obj) {
            String op = string(obj, "op");
            Location loc = location(obj, sourceName);
            return switch (op) {
                case "alloc" -> readAlloc(obj);
                case "alloc_symbol" -> new AllocSymbolOp(string(obj, "symbol"), loc);
                case "tasklet" -> readTasklet(obj, loc);
                case "libcall" -> readLibCall(obj, loc);
                case "load" -> {
                    Value array = use(string(obj, "array"));
                    Value result = define(new Value(string(obj, "result"), elementType(array.type())));
                    yield new LoadOp(result, array, strings(optArray(obj, "indices")), loc);
                }
                case "store" -> new StoreOp(use(string(obj, "value")), use(string(obj, "array")),
                        strings(optArray(obj, "indices")), loc);
                case "copy" -> new CopyOp(use(string(obj, "source")), use(string(obj, "destination")), loc);
                case "stream_pop" -> {
                    Value stream = use(string(obj, "stream"));
                    Value result = define(new Value(string(obj, "result"), elementType(stream.type())));
                    yield new StreamPopOp(result, stream, loc);
                }
                case "stream_push" -> new StreamPushOp(use(string(obj, "value")), use(string(obj, "stream")), loc);
                case "map" -> new MapOp(strings(array(obj, "params")), strings(array(obj, "lower")),
                        strings(array(obj, "upper")), strings(array(obj, "step")),
                        readOperations(optArray(obj, "body")), loc);
                case "consume" -> {
                    Value stream = use(string(obj, "stream"));
                    Value element = define(new Value(string(obj, "element"), elementType(stream.type())));
                    yield new ConsumeOp(stream, string(obj, "pe_index"), element,
                            optString(obj, "num_pes").orElse(null), optString(obj, "condition").orElse(null),
                            readOperations(optArray(obj, "body")), loc);
                }
                case "nested" -> readNested(obj, loc);
                default -> throw new ProgramFormatException("Unknown operation '" + op + "' at " + loc);
            };
        }

        private TaskletOp readTasklet(JsonObject obj, Location loc) {
            List<Value> operands = uses(optArray(obj, "operands"));
            List<String> paramNames = strings(optArray(obj, "params"));
            if (paramNames.size() != operands.size()) {
                throw new ProgramFormatException("Tasklet at " + loc + " has " + operands.size()
                        + " operands but " + paramNames.size() + " params");
            }

            Map<String, Value> local = new HashMap<>();
            List<Value> params = new ArrayList<>();
            for (int i = 0; i < operands.size(); i++) {
                Value param = new Value(paramNames.get(i), scalarOf(operands.get(i).type()));
                params.add(param);
                local.put(param.name(), param);
            }

            List<BodyOp> body = new ArrayList<>();
            for (JsonElement bodyOp : array(obj, "body")) {
                body.add(readBodyOp(object(bodyOp, "tasklet body operation"), local, loc));
            }

            List<Type> returned = new ArrayList<>();
            if (!body.isEmpty() && body.get(body.size() - 1) instanceof ReturnOp ret) {
                for (Value value : ret.operands()) {
                    returned.add(value.type());
                }
            }
            List<Value> results = new ArrayList<>();
            List<String> resultNames = strings(optArray(obj, "results"));
            for (int i = 0; i < resultNames.size(); i++) {
                Type type = i < returned.size() ? returned.get(i) : ScalarType.F64;
                results.add(define(new Value(resultNames.get(i), type)));
            }

            return new TaskletOp(operands, params, body, results, uses(optArray(obj, "dependencies")),
                    optBoolean(obj, "side_effects", false), loc);
        }

        private BodyOp readBodyOp(JsonObject obj, Map<String, Value> local, Location loc) {
            String op = string(obj, "op");
            List<Value> operands = new ArrayList<>();
            for (String name : strings(optArray(obj, "operands"))) {
                Value value = local.get(name);
                if (value == null) {
                    throw new ProgramFormatException("Undefined tasklet value '" + name + "' at " + loc);
                }
                operands.add(value);
            }
            if (op.equals("return")) {
                return new ReturnOp(operands);
            }

            Type type = optString(obj, "type").map(ProgramJsonReader::parseType)
                    .orElse(operands.isEmpty() ? ScalarType.F64 : operands.get(0).type());
            Value result = new Value(string(obj, "result"), type);
            local.put(result.name(), result);

            Optional<ArithKind> arith = ArithKind.fromOpName(op);
            if (arith.isPresent()) {
                if (operands.size() != arith.get().arity()) {
                    throw new ProgramFormatException(op + " at " + loc + " expects " + arith.get().arity()
                            + " operands");
                }
                return new ArithOp(arith.get(), result, operands);
            }
            return switch (op) {
                case "arith.constant" -> new ConstantOp(result, string(obj, "value"));
                case "arith.index_cast" -> {
                    if (operands.size() != 1) {
                        throw new ProgramFormatException("arith.index_cast at " + loc + " expects one operand");
                    }
                    yield new CastOp(result, operands.get(0));
                }
                case "sdfg.sym" -> new SymOp(result, string(obj, "expression"));
                default -> new GenericOp(op, List.of(result), operands);
            };
        }

        private LibCallOp readLibCall(JsonObject obj, Location loc) {
            List<Value> operands = uses(optArray(obj, "operands"));
            List<Value> results = new ArrayList<>();
            for (String name : strings(optArray(obj, "results"))) {
                results.add(define(new Value(name, ScalarType.F64)));
            }
            return new LibCallOp(string(obj, "callee"), operands, strings(optArray(obj, "inputs")), results,
                    strings(optArray(obj, "outputs")), uses(optArray(obj, "dependencies")), loc);
        }

        private NestedGraphOp readNested(JsonObject obj, Location loc) {
            List<Value> inputs = uses(optArray(obj, "inputs"));
            List<Value> outputs = uses(optArray(obj, "outputs"));
            Function function = new FunctionReader(sourceName).read(object(obj.get("function"), "function"));
            if (function.arguments().size() != inputs.size() + outputs.size()) {
                throw new ProgramFormatException("Nested function @" + function.name() + " at " + loc
                        + " takes " + function.arguments().size() + " arguments");
            }
            return new NestedGraphOp(inputs, outputs, function, loc);
        }

        private Value define(Value value) {
            if (values.putIfAbsent(value.name(), value) != null) {
                throw new ProgramFormatException("Value '" + value.name() + "' is defined twice in " + sourceName);
            }
            return value;
        }

        private Value use(String name) {
            Value value = values.get(name);
            if (value == null) {
                throw new ProgramFormatException("Undefined value '" + name + "' in " + sourceName);
            }
            return value;
        }

        private List<Value> uses(JsonArray names) {
            List<Value> result = new ArrayList<>();
            for (String name : strings(names)) {
                result.add(use(name));
            }
            return result;
        }
    }

    // ==================== Types ====================

    /**
     * Parses the type syntax described in the class comment.
     */
    public static Type parseType(String text) {
        String trimmed = text.trim();
        Matcher stream = STREAM_TYPE.matcher(trimmed);
        if (stream.matches()) {
            return new StreamType(parseShape(stream.group(3)), ScalarType.of(stream.group(1)));
        }
        Matcher array = ARRAY_TYPE.matcher(trimmed);
        if (array.matches()) {
            return new ArrayType(parseShape(array.group(2)), ScalarType.of(array.group(1)));
        }
        if (!trimmed.matches("\\w+")) {
            throw new ProgramFormatException("Malformed type '" + text + "'");
        }
        return ScalarType.of(trimmed);
    }

    private static List<Dim> parseShape(String dims) {
        List<Dim> shape = new ArrayList<>();
        if (dims == null || dims.isBlank()) {
            return shape;
        }
        for (String dim : dims.split(",")) {
            String d = dim.trim();
            shape.add(INTEGER.matcher(d).matches() ? new IntDim(Long.parseLong(d)) : new SymDim(d));
        }
        return shape;
    }

    private static ScalarType elementType(Type type) {
        if (type instanceof ArrayType array) {
            return array.elementType();
        }
        if (type instanceof StreamType stream) {
            return stream.elementType();
        }
        return (ScalarType) type;
    }

    private static Type scalarOf(Type type) {
        return type instanceof ScalarType ? type : elementType(type);
    }

    // ==================== JSON helpers ====================

    private static Location location(JsonObject obj, String sourceName) {
        if (!obj.has("loc")) {
            return Location.UNKNOWN;
        }
        JsonObject loc = object(obj.get("loc"), "loc");
        return Location.of(optString(loc, "file").orElse(sourceName),
                loc.has("line") ? loc.get("line").getAsInt() : 0,
                loc.has("column") ? loc.get("column").getAsInt() : 0);
    }

    private static JsonObject object(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new ProgramFormatException("Expected " + what + " to be an object");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonArray()) {
            throw new ProgramFormatException("Expected '" + key + "' to be a list");
        }
        return element.getAsJsonArray();
    }

    private static JsonArray optArray(JsonObject obj, String key) {
        return obj.has(key) ? array(obj, key) : new JsonArray();
    }

    private static String string(JsonObject obj, String key) {
        return optString(obj, key)
                .orElseThrow(() -> new ProgramFormatException("Missing '" + key + "' in " + obj));
    }

    private static Optional<String> optString(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) {
            return Optional.empty();
        }
        if (!element.isJsonPrimitive()) {
            throw new ProgramFormatException("Expected '" + key + "' to be a string");
        }
        return Optional.of(element.getAsString());
    }

    private static boolean optBoolean(JsonObject obj, String key, boolean fallback) {
        JsonElement element = obj.get(key);
        return element == null || element.isJsonNull() ? fallback : element.getAsBoolean();
    }

    private static List<String> strings(JsonArray array) {
        List<String> result = new ArrayList<>();
        for (JsonElement element : array) {
            result.add(element.getAsString());
        }
        return result;
    }
}
