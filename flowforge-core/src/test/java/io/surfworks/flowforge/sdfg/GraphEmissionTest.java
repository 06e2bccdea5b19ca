package io.surfworks.flowforge.sdfg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.surfworks.flowforge.emit.GsonJsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.ArrayType;
import io.surfworks.flowforge.ir.ProgramAst.IntDim;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.ScalarType;
import io.surfworks.flowforge.ir.ProgramAst.StreamType;
import io.surfworks.flowforge.ir.ProgramAst.SymDim;

/**
 * Tests for the JSON form of graph entities.
 */
@DisplayName("Graph Emission")
class GraphEmissionTest {

    private static final Location LOC = Location.of("emit.mlir", 7, 2);

    private static JsonObject render(Graph graph) {
        return JsonParser.parseString(GsonJsonEmitter.render("", graph::emit)).getAsJsonObject();
    }

    private static Graph graphWithState() {
        Graph graph = new Graph(LOC, 0);
        graph.setName("sdfg_0");
        graph.setStartState(graph.addState("s0", LOC));
        return graph;
    }

    private static List<String> strings(JsonArray array) {
        return array.asList().stream().map(e -> e.getAsString()).toList();
    }

    // ==================== Arrays ====================

    @Nested
    @DisplayName("Arrays")
    class ArrayTests {

        @Test
        @DisplayName("row-major strides are written as products")
        void stridesAreProducts() {
            ArrayDescriptor array = ArrayDescriptor.of("A", false,
                    new ArrayType(List.of(new IntDim(2), new IntDim(3), new IntDim(4)), ScalarType.F64), LOC);

            assertEquals(List.of("2", "3", "4"), array.shapeStrings());
            assertEquals(List.of("1 * 4 * 3", "1 * 4", "1"), array.strideStrings());
        }

        @Test
        @DisplayName("symbolic dimensions keep their names")
        void symbolicDimensions() {
            ArrayDescriptor array = ArrayDescriptor.of("A", false,
                    new ArrayType(List.of(new IntDim(4), new SymDim("N")), ScalarType.F32), LOC);

            assertEquals(List.of("4", "N"), array.shapeStrings());
            assertEquals(List.of("1 * N", "1"), array.strideStrings());
        }

        @Test
        @DisplayName("array, scalar and stream containers")
        void containerKinds() {
            Graph graph = graphWithState();
            graph.addArg(ArrayDescriptor.of("A", false, new ArrayType(List.of(new IntDim(8)), ScalarType.F32), LOC));
            graph.addArg(ArrayDescriptor.of("s", false, new ArrayType(List.of(), ScalarType.I32), LOC));
            graph.addArray(ArrayDescriptor.of("tmp", true, ScalarType.F64, LOC));
            graph.addArray(ArrayDescriptor.of("S", true, new StreamType(List.of(), ScalarType.I64), LOC));

            JsonObject arrays = render(graph).getAsJsonObject("attributes").getAsJsonObject("_arrays");

            JsonObject a = arrays.getAsJsonObject("A");
            assertEquals("Array", a.get("type").getAsString());
            assertEquals("float32", a.getAsJsonObject("attributes").get("dtype").getAsString());
            assertEquals(List.of("8"), strings(a.getAsJsonObject("attributes").getAsJsonArray("shape")));
            assertEquals(List.of("1"), strings(a.getAsJsonObject("attributes").getAsJsonArray("strides")));
            assertFalse(a.getAsJsonObject("attributes").get("transient").getAsBoolean());

            JsonObject scalarArg = arrays.getAsJsonObject("s");
            assertEquals("Array", scalarArg.get("type").getAsString());
            assertEquals(List.of("1"), strings(scalarArg.getAsJsonObject("attributes").getAsJsonArray("shape")));
            assertFalse(scalarArg.getAsJsonObject("attributes").has("strides"));

            JsonObject tmp = arrays.getAsJsonObject("tmp");
            assertEquals("Scalar", tmp.get("type").getAsString());
            assertTrue(tmp.getAsJsonObject("attributes").get("transient").getAsBoolean());

            assertEquals("Stream", arrays.getAsJsonObject("S").get("type").getAsString());
            assertEquals("int64", arrays.getAsJsonObject("S").getAsJsonObject("attributes").get("dtype").getAsString());
        }

        @Test
        @DisplayName("unsupported element type is fatal")
        void unsupportedElementType() {
            TranslationException e = assertThrows(TranslationException.class,
                    () -> ArrayDescriptor.of("A", false,
                            new ArrayType(List.of(new IntDim(2)), ScalarType.of("bf16")), LOC));
            assertEquals(TranslationException.ErrorKind.UNSUPPORTED_TYPE, e.getKind());
            assertTrue(e.getMessage().contains("bf16"));
        }

        @Test
        @DisplayName("dtype mapping")
        void dtypeMapping() {
            assertEquals(DType.BOOL, DType.of(ScalarType.I1, LOC));
            assertEquals(DType.INT64, DType.of(ScalarType.INDEX, LOC));
            assertEquals(DType.INT64, DType.of(ScalarType.I64, LOC));
            assertEquals("float16", DType.of(ScalarType.F16, LOC).wireName());
        }

        @Test
        @DisplayName("nested graphs mark non-argument containers transient")
        void nestedTransient() {
            Graph graph = graphWithState();
            graph.addArg(ArrayDescriptor.of("A", false, ScalarType.F32, LOC));
            graph.addArray(ArrayDescriptor.of("B", false, ScalarType.F32, LOC));

            graph.setNestedTransient();

            assertFalse(graph.findArray("A").orElseThrow().isTransient());
            assertTrue(graph.findArray("B").orElseThrow().isTransient());
        }

        @Test
        @DisplayName("duplicate container names are rejected")
        void duplicateContainers() {
            Graph graph = graphWithState();
            graph.addArray(ArrayDescriptor.of("A", false, ScalarType.F32, LOC));
            assertThrows(TranslationException.class,
                    () -> graph.addArray(ArrayDescriptor.of("A", true, ScalarType.F32, LOC)));
        }
    }

    // ==================== Graph and states ====================

    @Nested
    @DisplayName("Graph")
    class GraphTests {

        @Test
        @DisplayName("top-level keys")
        void topLevelKeys() {
            Graph graph = graphWithState();
            graph.addArg(ArrayDescriptor.of("A", false, ScalarType.F32, LOC));
            graph.addSymbol(new Symbol("N", DType.INT64));

            JsonObject json = render(graph);

            assertEquals("SDFG", json.get("type").getAsString());
            assertTrue(json.get("sdfg_list_id").getAsJsonPrimitive().isNumber());
            assertEquals(0, json.get("start_state").getAsInt());
            JsonObject attributes = json.getAsJsonObject("attributes");
            assertEquals("sdfg_0", attributes.get("name").getAsString());
            assertEquals(List.of("A"), strings(attributes.getAsJsonArray("arg_names")));
            assertEquals(0, attributes.getAsJsonObject("constants_prop").size());
            assertEquals("int64", attributes.getAsJsonObject("symbols").get("N").getAsString());
            assertEquals(7, attributes.getAsJsonObject("debuginfo").get("start_line").getAsInt());
            assertEquals(1, json.getAsJsonArray("nodes").size());
            assertEquals("SDFGState",
                    json.getAsJsonArray("nodes").get(0).getAsJsonObject().get("type").getAsString());
        }

        @Test
        @DisplayName("graph without start state cannot be emitted")
        void missingStartState() {
            Graph graph = new Graph(LOC, 0);
            graph.addState("s0", LOC);
            assertThrows(TranslationException.class, () -> render(graph));
        }

        @Test
        @DisplayName("state names are unique and looked up strictly")
        void stateLookup() {
            Graph graph = graphWithState();
            assertThrows(TranslationException.class, () -> graph.addState("s0", LOC));
            TranslationException e = assertThrows(TranslationException.class, () -> graph.lookup("s9", LOC));
            assertTrue(e.getMessage().contains("s9"));
            assertEquals(0, graph.lookup("s0", LOC).getId());
        }

        @Test
        @DisplayName("conflicting symbols are rejected, identical ones merged")
        void symbols() {
            Graph graph = graphWithState();
            graph.addSymbol(new Symbol("N", DType.INT64));
            graph.addSymbol(new Symbol("N", DType.INT64));
            assertEquals(1, graph.getSymbols().size());
            assertThrows(TranslationException.class, () -> graph.addSymbol(new Symbol("N", DType.INT32)));
        }
    }

    // ==================== Edges ====================

    @Nested
    @DisplayName("Edges")
    class EdgeTests {

        @Test
        @DisplayName("memlet carries data and subset, nameless connectors are null")
        void memletEdge() {
            Graph graph = graphWithState();
            State state = graph.getStartState();
            Access source = new Access(LOC);
            source.setName("A");
            state.addNode(source);
            Tasklet tasklet = new Tasklet(LOC);
            state.addNode(tasklet);
            Connector out = Connector.nullOut(source).withData("A").withRanges(List.of(Range.point("i")));
            source.addOutConnector(out.withRanges(List.of()));
            Connector in = Connector.in(tasklet, "x");
            tasklet.addInConnector(in);
            state.addEdge(new MultiEdge(LOC, out, in));

            JsonObject edge = render(graph).getAsJsonArray("nodes").get(0).getAsJsonObject()
                    .getAsJsonArray("edges").get(0).getAsJsonObject();

            assertEquals("MultiConnectorEdge", edge.get("type").getAsString());
            assertEquals("0", edge.get("src").getAsString());
            assertTrue(edge.get("src").getAsJsonPrimitive().isString());
            assertEquals("1", edge.get("dst").getAsString());
            assertTrue(edge.get("src_connector").isJsonNull());
            assertEquals("x", edge.get("dst_connector").getAsString());

            JsonObject memlet = edge.getAsJsonObject("attributes").getAsJsonObject("data");
            assertEquals("Memlet", memlet.get("type").getAsString());
            JsonObject attributes = memlet.getAsJsonObject("attributes");
            assertEquals("A", attributes.get("data").getAsString());
            JsonObject range = attributes.getAsJsonObject("subset").getAsJsonArray("ranges").get(0).getAsJsonObject();
            assertEquals("i", range.get("start").getAsString());
            assertEquals("i", range.get("end").getAsString());
            assertEquals("1", range.get("step").getAsString());
            assertTrue(attributes.get("dst_subset").isJsonNull());
        }

        @Test
        @DisplayName("dependency edge has no data and null connectors")
        void dependencyEdge() {
            Graph graph = graphWithState();
            State state = graph.getStartState();
            Tasklet first = new Tasklet(LOC);
            Tasklet second = new Tasklet(LOC);
            state.addNode(first);
            state.addNode(second);
            Connector out = Connector.out(first, "r").withData("A");
            first.addOutConnector(out);
            Connector in = Connector.nullIn(second);
            second.addInConnector(in);
            state.addEdge(MultiEdge.dependency(LOC, out, in));

            JsonObject edge = render(graph).getAsJsonArray("nodes").get(0).getAsJsonObject()
                    .getAsJsonArray("edges").get(0).getAsJsonObject();

            assertTrue(edge.get("src_connector").isJsonNull());
            assertTrue(edge.get("dst_connector").isJsonNull());
            JsonObject attributes = edge.getAsJsonObject("attributes").getAsJsonObject("data")
                    .getAsJsonObject("attributes");
            assertFalse(attributes.has("data"));
        }

        @Test
        @DisplayName("interstate edge defaults to an unconditional transition")
        void interstateEdge() {
            Graph graph = graphWithState();
            State next = graph.addState("s1", LOC);
            InterstateEdge edge = new InterstateEdge(LOC, graph.getStartState(), next);
            edge.addAssignment(InterstateEdge.Assignment.parse("i: i + 1", LOC));
            graph.addEdge(edge);

            JsonObject json = render(graph).getAsJsonArray("edges").get(0).getAsJsonObject();

            assertEquals("0", json.get("src").getAsString());
            assertEquals("1", json.get("dst").getAsString());
            JsonObject data = json.getAsJsonObject("attributes").getAsJsonObject("data");
            assertEquals("InterstateEdge", data.get("type").getAsString());
            JsonObject attributes = data.getAsJsonObject("attributes");
            assertEquals("i + 1", attributes.getAsJsonObject("assignments").get("i").getAsString());
            assertEquals("1", attributes.getAsJsonObject("condition").get("string_data").getAsString());
            assertEquals("Python", attributes.getAsJsonObject("condition").get("language").getAsString());
        }

        @Test
        @DisplayName("assignments split at the first colon")
        void assignmentParsing() {
            InterstateEdge.Assignment assignment = InterstateEdge.Assignment.parse("a: b ? c : d", LOC);
            assertEquals("a", assignment.key());
            assertEquals("b ? c : d", assignment.value());

            assertThrows(TranslationException.class, () -> InterstateEdge.Assignment.parse("a = 1", LOC));
            assertThrows(TranslationException.class, () -> InterstateEdge.Assignment.parse(": 1", LOC));
        }

        @Test
        @DisplayName("a symbol is assigned at most once per edge")
        void duplicateAssignment() {
            Graph graph = graphWithState();
            State next = graph.addState("s1", LOC);
            InterstateEdge edge = new InterstateEdge(LOC, graph.getStartState(), next);
            edge.addAssignment(InterstateEdge.Assignment.parse("i: 0", LOC));

            TranslationException e = assertThrows(TranslationException.class,
                    () -> edge.addAssignment(InterstateEdge.Assignment.parse("i: i + 1", LOC)));
            assertEquals(TranslationException.ErrorKind.STRUCTURAL_CONFLICT, e.getKind());
            assertEquals(1, edge.getAssignments().size());
        }
    }

    // ==================== Nodes ====================

    @Nested
    @DisplayName("Nodes")
    class NodeTests {

        @Test
        @DisplayName("scope members reference their entry and exit")
        void scopeMembership() {
            Graph graph = graphWithState();
            State state = graph.getStartState();
            MapEntry entry = new MapEntry(LOC);
            entry.setName("map_0");
            entry.addParam("i");
            entry.addRange(Range.of("0", "N - 1", "1"));
            state.addNode(entry);
            state.addNode(entry.getExit());
            Tasklet tasklet = new Tasklet(LOC);
            tasklet.setName("add");
            entry.addNode(tasklet);
            entry.connectDanglingNodes();

            JsonObject stateJson = render(graph).getAsJsonArray("nodes").get(0).getAsJsonObject();
            JsonArray nodes = stateJson.getAsJsonArray("nodes");

            JsonObject entryJson = nodes.get(0).getAsJsonObject();
            assertEquals("MapEntry", entryJson.get("type").getAsString());
            assertTrue(entryJson.get("scope_entry").isJsonNull());
            assertEquals("1", entryJson.get("scope_exit").getAsString());
            JsonObject mapAttributes = entryJson.getAsJsonObject("attributes");
            assertEquals(List.of("i"), strings(mapAttributes.getAsJsonArray("params")));
            assertEquals("N - 1", mapAttributes.getAsJsonObject("range").getAsJsonArray("ranges")
                    .get(0).getAsJsonObject().get("end").getAsString());

            JsonObject exitJson = nodes.get(1).getAsJsonObject();
            assertEquals("MapExit", exitJson.get("type").getAsString());
            assertEquals("0", exitJson.get("scope_entry").getAsString());
            assertEquals("1", exitJson.get("scope_exit").getAsString());

            JsonObject taskletJson = nodes.get(2).getAsJsonObject();
            assertEquals("0", taskletJson.get("scope_entry").getAsString());
            assertEquals("1", taskletJson.get("scope_exit").getAsString());
            assertEquals(0, taskletJson.getAsJsonObject("attributes").getAsJsonObject("in_connectors").size());

            assertEquals(List.of("0"), strings(stateJson.getAsJsonObject("scope_dict").getAsJsonArray("-1")));
            assertEquals(List.of("1", "2"), strings(stateJson.getAsJsonObject("scope_dict").getAsJsonArray("0")));
        }

        @Test
        @DisplayName("nested entries name their own exit and the enclosing entry")
        void nestedScopeMembership() {
            Graph graph = graphWithState();
            State state = graph.getStartState();
            MapEntry outer = new MapEntry(LOC);
            outer.setName("map_0");
            outer.addParam("i");
            outer.addRange(Range.of("0", "N - 1", "1"));
            state.addNode(outer);
            state.addNode(outer.getExit());
            MapEntry inner = new MapEntry(LOC);
            inner.setName("map_1");
            inner.addParam("j");
            inner.addRange(Range.of("0", "M - 1", "1"));
            outer.addNode(inner);
            outer.addNode(inner.getExit());
            Tasklet tasklet = new Tasklet(LOC);
            tasklet.setName("neg");
            inner.addNode(tasklet);
            inner.connectDanglingNodes();
            outer.connectDanglingNodes();

            JsonObject stateJson = render(graph).getAsJsonArray("nodes").get(0).getAsJsonObject();
            JsonArray nodes = stateJson.getAsJsonArray("nodes");

            JsonObject outerJson = nodes.get(0).getAsJsonObject();
            assertTrue(outerJson.get("scope_entry").isJsonNull());
            assertEquals("1", outerJson.get("scope_exit").getAsString());

            JsonObject innerJson = nodes.get(2).getAsJsonObject();
            assertEquals("MapEntry", innerJson.get("type").getAsString());
            assertEquals("0", innerJson.get("scope_entry").getAsString());
            assertEquals("3", innerJson.get("scope_exit").getAsString());

            JsonObject innerExitJson = nodes.get(3).getAsJsonObject();
            assertEquals("2", innerExitJson.get("scope_entry").getAsString());
            assertEquals("3", innerExitJson.get("scope_exit").getAsString());

            JsonObject scopeDict = stateJson.getAsJsonObject("scope_dict");
            assertEquals(List.of("0"), strings(scopeDict.getAsJsonArray("-1")));
            assertEquals(List.of("1", "2"), strings(scopeDict.getAsJsonArray("0")));
            assertEquals(List.of("3", "4"), strings(scopeDict.getAsJsonArray("2")));
        }

        @Test
        @DisplayName("tasklet code, consume entry and library attributes")
        void variantAttributes() {
            Graph graph = graphWithState();
            State state = graph.getStartState();
            Tasklet tasklet = new Tasklet(LOC);
            tasklet.setCode(Code.python("z = x + y"));
            tasklet.addInConnector(Connector.in(tasklet, "x"));
            state.addNode(tasklet);
            ConsumeEntry consume = new ConsumeEntry(LOC);
            consume.setPeIndex("p");
            state.addNode(consume);
            state.addNode(consume.getExit());
            consume.connectDanglingNodes();
            Library library = new Library(LOC);
            library.setClasspath("dace.libraries.blas.Gemm");
            state.addNode(library);

            JsonArray nodes = render(graph).getAsJsonArray("nodes").get(0).getAsJsonObject()
                    .getAsJsonArray("nodes");

            JsonObject taskletAttributes = nodes.get(0).getAsJsonObject().getAsJsonObject("attributes");
            assertEquals("z = x + y", taskletAttributes.getAsJsonObject("code").get("string_data").getAsString());
            assertEquals("Python", taskletAttributes.getAsJsonObject("code").get("language").getAsString());
            assertEquals("", taskletAttributes.getAsJsonObject("code_global").get("string_data").getAsString());
            assertFalse(taskletAttributes.get("side_effects").getAsBoolean());
            assertTrue(taskletAttributes.getAsJsonObject("in_connectors").has("x"));

            JsonObject consumeAttributes = nodes.get(1).getAsJsonObject().getAsJsonObject("attributes");
            assertTrue(consumeAttributes.get("num_pes").isJsonNull());
            assertEquals("p", consumeAttributes.get("pe_index").getAsString());

            JsonObject libraryAttributes = nodes.get(3).getAsJsonObject().getAsJsonObject("attributes");
            assertEquals("dace.libraries.blas.Gemm", libraryAttributes.get("classpath").getAsString());
        }
    }
}
