package io.surfworks.flowforge.sdfg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.flowforge.ir.ProgramAst.ArrayType;
import io.surfworks.flowforge.ir.ProgramAst.IntDim;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.ScalarType;
import io.surfworks.flowforge.ir.ProgramAst.Value;
import io.surfworks.flowforge.translate.SdfgValidator;

/**
 * Tests for value binding and connector routing across scopes.
 */
@DisplayName("Scope Routing")
class ScopeRoutingTest {

    private static final Location LOC = Location.of("routing.mlir", 3, 5);
    private static final ArrayType VECTOR_F32 = new ArrayType(List.of(new IntDim(8)), ScalarType.F32);

    private Graph graph;
    private State state;
    private Value a;
    private Value b;

    @BeforeEach
    void setUp() {
        graph = new Graph(LOC, 0);
        state = graph.addState("s0", LOC);
        graph.setStartState(state);
        graph.addArg(ArrayDescriptor.of("A", false, VECTOR_F32, LOC));
        graph.addArg(ArrayDescriptor.of("B", false, VECTOR_F32, LOC));
        a = Value.container("A", VECTOR_F32, false);
        b = Value.container("B", VECTOR_F32, false);
    }

    private MapEntry openMap() {
        MapEntry entry = new MapEntry(LOC);
        entry.setName("map_0");
        entry.addParam("i");
        entry.addRange(Range.of("0", "7", "1"));
        state.addNode(entry);
        state.addNode(entry.getExit());
        return entry;
    }

    private static Connector writeTarget(String container, List<Range> ranges) {
        Access access = new Access(LOC);
        access.setName(container);
        return Connector.nullIn(access).withData(container).withRanges(ranges);
    }

    private static List<String> named(List<Connector> connectors) {
        return connectors.stream().filter(c -> !c.isNull()).map(Connector::name).toList();
    }

    // ==================== Binding Table ====================

    @Nested
    @DisplayName("State lookup")
    class StateLookupTests {

        @Test
        @DisplayName("creates one access node per value")
        void lookupIsIdempotent() {
            Connector first = state.lookup(a);
            Connector second = state.lookup(a);

            assertEquals(first, second);
            assertEquals(1, state.nodes().size());
            Access access = (Access) first.node();
            assertEquals("A", access.getName());
            assertTrue(first.isNull());
            assertEquals("A", first.data());
        }

        @Test
        @DisplayName("access node follows the value's init flag")
        void accessNodeCarriesInit() {
            Value zeroed = Value.container("Z", VECTOR_F32, true);
            Access access = (Access) state.lookup(zeroed).node();
            assertTrue(access.isInit());
        }

        @Test
        @DisplayName("mapConnector overwrites an earlier binding")
        void mapConnectorOverwrites() {
            state.lookup(a);
            Tasklet tasklet = new Tasklet(LOC);
            state.addNode(tasklet);
            Connector out = Connector.out(tasklet, "__out0");
            tasklet.addOutConnector(out);

            state.mapConnector(a, out);

            assertSame(tasklet, state.lookup(a).node());
        }

        @Test
        @DisplayName("routeWrite binds the value to the written node")
        void routeWriteRebinds() {
            Tasklet tasklet = new Tasklet(LOC);
            state.addNode(tasklet);
            Connector out = Connector.out(tasklet, "r");
            tasklet.addOutConnector(out);
            Connector to = writeTarget("B", List.of(Range.point("0")));

            state.routeWrite(out, to, b);

            Connector bound = state.lookup(b);
            assertSame(to.node(), bound.node());
            assertEquals("B", bound.data());
            assertEquals(2, state.nodes().size());
            assertEquals(1, state.edges().size());
        }
    }

    @Nested
    @DisplayName("Map lookup")
    class MapLookupTests {

        @Test
        @DisplayName("creates a single through-connector pair per value")
        void throughConnectorsAreUnique() {
            MapEntry entry = openMap();

            Connector first = entry.lookup(a);
            Connector second = entry.lookup(a);

            assertEquals(first, second);
            assertEquals(List.of("IN_A"), named(entry.getInConnectors()));
            assertEquals(List.of("OUT_A"), named(entry.getOutConnectors()));
            assertEquals("OUT_A", first.name());
            assertEquals("A", first.data());
            assertEquals(1, state.edges().size());
        }

        @Test
        @DisplayName("the parent-side edge is owned by the parent scope")
        void parentEdgeGoesToParent() {
            MapEntry entry = openMap();
            entry.lookup(a);

            assertTrue(entry.edges().isEmpty());
            assertEquals(1, state.edges().size());
            MultiEdge edge = state.edges().get(0);
            assertTrue(edge.getSource().node() instanceof Access);
            assertEquals("IN_A", edge.getDestination().name());
        }

        @Test
        @DisplayName("nested maps chain their through-connectors")
        void nestedMapsChain() {
            MapEntry outer = openMap();
            MapEntry inner = new MapEntry(LOC);
            outer.addNode(inner);
            outer.addNode(inner.getExit());

            Connector innerOut = inner.lookup(a);

            assertEquals("OUT_A", innerOut.name());
            assertSame(inner, innerOut.node());
            assertEquals(List.of("IN_A"), named(outer.getInConnectors()));
            assertEquals(1, outer.edges().size());
            assertSame(outer, outer.edges().get(0).getSource().node());
        }

        @Test
        @DisplayName("scope members are numbered by the state")
        void membersAreNumberedByState() {
            MapEntry entry = openMap();
            Tasklet tasklet = new Tasklet(LOC);
            entry.addNode(tasklet);

            assertEquals(2, tasklet.getId());
            assertSame(entry, tasklet.getParent());
            assertSame(state, tasklet.getState());
            assertEquals(List.of(tasklet), entry.nodes());
        }
    }

    // ==================== Dependencies ====================

    @Nested
    @DisplayName("Dependencies")
    class DependencyTests {

        @Test
        @DisplayName("unbound value at map level routes through nameless connectors")
        void mapDependencyUsesNamelessConnectors() {
            Value token = new Value("tok", ScalarType.I32);
            Tasklet producer = new Tasklet(LOC);
            state.addNode(producer);
            Connector produced = Connector.out(producer, "__out0");
            producer.addOutConnector(produced);
            state.mapConnector(token, produced);

            MapEntry entry = openMap();
            Tasklet consumer = new Tasklet(LOC);
            entry.addNode(consumer);
            Connector waiting = Connector.nullIn(consumer);
            consumer.addInConnector(waiting);

            entry.addDependency(token, waiting);

            assertEquals(2, state.edges().size());
            assertTrue(state.edges().stream().allMatch(MultiEdge::isDependency));
            assertTrue(named(entry.getInConnectors()).isEmpty());
            assertEquals(1, entry.getInConnectors().size());
            assertEquals(1, entry.edges().size());
            assertSame(producer, state.edges().get(1).getSource().node());
            assertSame(entry, state.edges().get(1).getDestination().node());
        }

        @Test
        @DisplayName("bound value gets a direct dependency edge")
        void boundValueGetsDirectEdge() {
            Tasklet consumer = new Tasklet(LOC);
            state.addNode(consumer);
            Connector waiting = Connector.nullIn(consumer);
            consumer.addInConnector(waiting);

            state.addDependency(a, waiting);

            assertEquals(1, state.edges().size());
            MultiEdge edge = state.edges().get(0);
            assertTrue(edge.isDependency());
            assertNull(edge.data());
        }
    }

    // ==================== Closure ====================

    @Nested
    @DisplayName("Scope closure")
    class ClosureTests {

        @Test
        @DisplayName("unread write leaves through one exit connector pair")
        void unreadWriteIsRoutedOut() {
            MapEntry entry = openMap();
            Tasklet producer = new Tasklet(LOC);
            entry.addNode(producer);
            Connector out = Connector.out(producer, "r");
            producer.addOutConnector(out);

            entry.routeWrite(out, writeTarget("B", List.of(Range.point("i"))), b);
            assertEquals(1, entry.pendingWrites().size());

            entry.connectDanglingNodes();

            MapExit exit = entry.getExit();
            assertEquals(List.of("IN_B"), named(exit.getInConnectors()));
            assertEquals(List.of("OUT_B"), named(exit.getOutConnectors()));
            assertTrue(entry.pendingWrites().isEmpty());

            Connector bound = state.lookup(b);
            Access written = (Access) bound.node();
            assertSame(state, written.getParent());
            assertEquals("B", written.getName());
            assertTrue(written.getInConnectors().get(0).ranges().isEmpty());
            assertTrue(new SdfgValidator().validate(graph).isEmpty());
        }

        @Test
        @DisplayName("mirror access node keeps the written subset")
        void mirrorKeepsRanges() {
            MapEntry entry = openMap();
            Tasklet producer = new Tasklet(LOC);
            entry.addNode(producer);
            Connector out = Connector.out(producer, "r");
            producer.addOutConnector(out);

            entry.routeWrite(out, writeTarget("B", List.of(Range.point("i"))), b);

            Access mirror = (Access) entry.lookup(b).node();
            assertSame(entry, mirror.getParent());
            assertEquals(List.of(Range.point("i")), mirror.getInConnectors().get(0).ranges());
        }

        @Test
        @DisplayName("write re-read inside the scope is not routed out")
        void rereadWriteIsSkipped() {
            MapEntry entry = openMap();
            Tasklet producer = new Tasklet(LOC);
            entry.addNode(producer);
            Connector out = Connector.out(producer, "r");
            producer.addOutConnector(out);
            entry.routeWrite(out, writeTarget("B", List.of(Range.point("i"))), b);

            Tasklet consumer = new Tasklet(LOC);
            entry.addNode(consumer);
            Connector in = Connector.in(consumer, "x");
            consumer.addInConnector(in);
            entry.addEdge(new MultiEdge(LOC, entry.lookup(b), in));

            entry.connectDanglingNodes();

            assertTrue(named(entry.getExit().getInConnectors()).isEmpty());
            assertTrue(entry.pendingWrites().isEmpty());
            assertTrue(new SdfgValidator().validate(graph).isEmpty());
        }

        @Test
        @DisplayName("dangling nodes are wired to entry and exit")
        void danglingNodesAreConnected() {
            MapEntry entry = openMap();
            Tasklet lonely = new Tasklet(LOC);
            entry.addNode(lonely);

            entry.connectDanglingNodes();

            assertEquals(3, entry.edges().size());
            MultiEdge link = entry.edges().get(0);
            assertSame(entry, link.getSource().node());
            assertSame(entry.getExit(), link.getDestination().node());
            assertTrue(link.getSource().isNull());
            assertTrue(entry.edges().stream().anyMatch(e -> e.getDestination().node() == lonely));
            assertTrue(entry.edges().stream().anyMatch(e -> e.getSource().node() == lonely));
            assertTrue(new SdfgValidator().validate(graph).isEmpty());
        }

        @Test
        @DisplayName("empty scope only links entry to exit")
        void emptyScopeLinksEntryToExit() {
            MapEntry entry = openMap();

            try (ScopeEntry.Body body = entry.open()) {
                assertSame(entry, body.scope());
            }

            assertTrue(entry.isClosed());
            assertEquals(1, state.edges().size());
        }

        @Test
        @DisplayName("closing twice is a structural conflict")
        void closingTwiceFails() {
            MapEntry entry = openMap();
            entry.connectDanglingNodes();

            TranslationException e = assertThrows(TranslationException.class, entry::connectDanglingNodes);
            assertEquals(TranslationException.ErrorKind.STRUCTURAL_CONFLICT, e.getKind());
            assertThrows(TranslationException.class, entry::open);
        }

        @Test
        @DisplayName("inner scope writes bubble through the outer scope")
        void nestedWritesBubbleOut() {
            MapEntry outer = openMap();
            MapEntry inner = new MapEntry(LOC);
            outer.addNode(inner);
            outer.addNode(inner.getExit());
            Tasklet producer = new Tasklet(LOC);
            inner.addNode(producer);
            Connector out = Connector.out(producer, "r");
            producer.addOutConnector(out);

            inner.routeWrite(out, writeTarget("B", List.of(Range.point("j"))), b);
            inner.connectDanglingNodes();
            assertEquals(1, outer.pendingWrites().size());
            outer.connectDanglingNodes();

            assertEquals(List.of("IN_B"), named(inner.getExit().getInConnectors()));
            assertEquals(List.of("IN_B"), named(outer.getExit().getInConnectors()));
            assertFalse(state.lookup(b).node().getParent() instanceof ScopeEntry);
            assertTrue(new SdfgValidator().validate(graph).isEmpty());
        }
    }

    // ==================== Connectors ====================

    @Nested
    @DisplayName("Connectors")
    class ConnectorTests {

        @Test
        @DisplayName("adding an identical connector twice is a no-op")
        void identicalConnectorIsDeduplicated() {
            Access access = new Access(LOC);
            access.addOutConnector(Connector.out(access, "x").withData("A"));
            access.addOutConnector(Connector.out(access, "x").withData("A"));
            access.addOutConnector(Connector.nullOut(access));
            access.addOutConnector(Connector.nullOut(access));

            assertEquals(2, access.getOutConnectors().size());
        }

        @Test
        @DisplayName("conflicting named connector is rejected")
        void conflictingConnectorFails() {
            Access access = new Access(LOC);
            access.addOutConnector(Connector.out(access, "x").withData("A"));

            TranslationException e = assertThrows(TranslationException.class,
                    () -> access.addOutConnector(Connector.out(access, "x").withData("B")));
            assertEquals(TranslationException.ErrorKind.STRUCTURAL_CONFLICT, e.getKind());
            assertEquals(LOC, e.getLocation());
        }

        @Test
        @DisplayName("connector of another node is rejected")
        void foreignConnectorFails() {
            Access first = new Access(LOC);
            Access second = new Access(LOC);
            assertThrows(TranslationException.class, () -> first.addInConnector(Connector.nullIn(second)));
        }

        @Test
        @DisplayName("edge directions are enforced")
        void edgeDirectionsAreEnforced() {
            Access access = new Access(LOC);
            assertThrows(TranslationException.class,
                    () -> new MultiEdge(LOC, Connector.nullIn(access), Connector.nullIn(access)));
        }

        @Test
        @DisplayName("names are sanitized")
        void namesAreSanitized() {
            Tasklet tasklet = new Tasklet(LOC);
            tasklet.setName("my-task.0");
            assertEquals("my_task_0", tasklet.getName());
        }
    }
}
