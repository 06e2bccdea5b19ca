package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.Location;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A stateful dataflow multigraph: states joined by interstate edges, plus
 * the containers and symbols they use.
 */
public final class Graph {

    private final Location location;
    private final int listId;
    private String name = "";
    private final List<State> states = new ArrayList<>();
    private final Map<String, State> statesByName = new LinkedHashMap<>();
    private final List<InterstateEdge> edges = new ArrayList<>();
    private final Map<String, ArrayDescriptor> arrays = new LinkedHashMap<>();
    private final List<ArrayDescriptor> args = new ArrayList<>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private State startState;

    public Graph(Location location, int listId) {
        this.location = location;
        this.listId = listId;
    }

    public Location getLocation() {
        return location;
    }

    public int getListId() {
        return listId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Node.sanitize(name);
    }

    // ==================== States ====================

    public State addState(String stateName, Location stateLocation) {
        if (statesByName.containsKey(stateName)) {
            throw TranslationException.structural("Duplicate state " + stateName, stateLocation);
        }
        State state = new State(this, stateLocation);
        state.setName(stateName);
        state.setId(states.size());
        states.add(state);
        statesByName.put(stateName, state);
        return state;
    }

    public Optional<State> findState(String stateName) {
        return Optional.ofNullable(statesByName.get(stateName));
    }

    /**
     * @throws TranslationException when no state has this name
     */
    public State lookup(String stateName, Location referenceLocation) {
        State state = statesByName.get(stateName);
        if (state == null) {
            throw TranslationException.structural("State " + stateName + " does not exist", referenceLocation);
        }
        return state;
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    public void setStartState(State state) {
        if (state.getGraph() != this) {
            throw TranslationException.structural("Start state " + state.getName() + " belongs to another graph",
                    state.getLocation());
        }
        startState = state;
    }

    public State getStartState() {
        return startState;
    }

    public void addEdge(InterstateEdge edge) {
        edges.add(edge);
    }

    public List<InterstateEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    // ==================== Containers and symbols ====================

    public void addArray(ArrayDescriptor array) {
        if (arrays.containsKey(array.getName())) {
            throw TranslationException.structural("Duplicate container " + array.getName(), array.getLocation());
        }
        arrays.put(array.getName(), array);
    }

    /**
     * Adds an argument container; arguments are also graph arrays.
     */
    public void addArg(ArrayDescriptor array) {
        addArray(array);
        args.add(array);
    }

    public Optional<ArrayDescriptor> findArray(String arrayName) {
        return Optional.ofNullable(arrays.get(arrayName));
    }

    public Collection<ArrayDescriptor> getArrays() {
        return Collections.unmodifiableCollection(arrays.values());
    }

    public List<ArrayDescriptor> getArgs() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Adds a symbol. Re-adding an identical symbol is a no-op.
     */
    public void addSymbol(Symbol symbol) {
        Symbol existing = symbols.get(symbol.name());
        if (existing != null) {
            if (!existing.equals(symbol)) {
                throw TranslationException.structural("Conflicting symbol " + symbol.name(), location);
            }
            return;
        }
        symbols.put(symbol.name(), symbol);
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    /**
     * Marks every non-argument container transient.
     */
    public void setNestedTransient() {
        for (ArrayDescriptor array : arrays.values()) {
            if (!args.contains(array)) {
                array.setTransient(true);
            }
        }
    }

    // ==================== Emission ====================

    public void emit(JsonEmitter jemit) {
        jemit.startObject();
        emitBody(jemit);
        jemit.endObject();
    }

    /**
     * Emits this graph as the {@code sdfg} entry of a nested graph node.
     */
    public void emitNested(JsonEmitter jemit) {
        jemit.startNamedObject("sdfg");
        emitBody(jemit);
        jemit.endObject();
    }

    private void emitBody(JsonEmitter jemit) {
        if (startState == null) {
            throw TranslationException.structural("Graph " + name + " has no start state", location);
        }
        jemit.printKVPair("type", "SDFG");
        jemit.printKVPair("sdfg_list_id", listId, false);
        jemit.printKVPair("start_state", startState.getId(), false);

        jemit.startNamedObject("attributes");
        jemit.printKVPair("name", name);
        jemit.startNamedList("arg_names");
        for (ArrayDescriptor arg : args) {
            jemit.startEntry();
            jemit.printString(arg.getName());
        }
        jemit.endList();
        jemit.startNamedObject("constants_prop");
        jemit.endObject();

        jemit.startNamedObject("_arrays");
        for (ArrayDescriptor array : arrays.values()) {
            array.emit(jemit, args.contains(array));
        }
        jemit.endObject();

        jemit.startNamedObject("symbols");
        for (Symbol symbol : symbols.values()) {
            symbol.emit(jemit);
        }
        jemit.endObject();
        EmitSupport.printLocation(location, jemit);
        jemit.endObject();

        jemit.startNamedList("nodes");
        for (State state : states) {
            jemit.startEntry();
            state.emit(jemit);
        }
        jemit.endList();

        jemit.startNamedList("edges");
        for (InterstateEdge edge : edges) {
            jemit.startEntry();
            edge.emit(jemit);
        }
        jemit.endList();
    }
}
