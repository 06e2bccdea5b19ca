package io.surfworks.flowforge.translate;

import io.surfworks.flowforge.emit.GsonJsonEmitter;
import io.surfworks.flowforge.ir.ProgramAst.AllocOp;
import io.surfworks.flowforge.ir.ProgramAst.AllocSymbolOp;
import io.surfworks.flowforge.ir.ProgramAst.ArithOp;
import io.surfworks.flowforge.ir.ProgramAst.BodyOp;
import io.surfworks.flowforge.ir.ProgramAst.CastOp;
import io.surfworks.flowforge.ir.ProgramAst.ConstantOp;
import io.surfworks.flowforge.ir.ProgramAst.ConsumeOp;
import io.surfworks.flowforge.ir.ProgramAst.CopyOp;
import io.surfworks.flowforge.ir.ProgramAst.Function;
import io.surfworks.flowforge.ir.ProgramAst.GenericOp;
import io.surfworks.flowforge.ir.ProgramAst.LibCallOp;
import io.surfworks.flowforge.ir.ProgramAst.LoadOp;
import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.MapOp;
import io.surfworks.flowforge.ir.ProgramAst.NestedGraphOp;
import io.surfworks.flowforge.ir.ProgramAst.Operation;
import io.surfworks.flowforge.ir.ProgramAst.Program;
import io.surfworks.flowforge.ir.ProgramAst.ReturnOp;
import io.surfworks.flowforge.ir.ProgramAst.StateBlock;
import io.surfworks.flowforge.ir.ProgramAst.StoreOp;
import io.surfworks.flowforge.ir.ProgramAst.StreamPopOp;
import io.surfworks.flowforge.ir.ProgramAst.StreamPushOp;
import io.surfworks.flowforge.ir.ProgramAst.SymOp;
import io.surfworks.flowforge.ir.ProgramAst.TaskletOp;
import io.surfworks.flowforge.ir.ProgramAst.Transition;
import io.surfworks.flowforge.ir.ProgramAst.Value;
import io.surfworks.flowforge.sdfg.Access;
import io.surfworks.flowforge.sdfg.ArrayDescriptor;
import io.surfworks.flowforge.sdfg.Code;
import io.surfworks.flowforge.sdfg.CodeLanguage;
import io.surfworks.flowforge.sdfg.Connector;
import io.surfworks.flowforge.sdfg.ConsumeEntry;
import io.surfworks.flowforge.sdfg.DType;
import io.surfworks.flowforge.sdfg.Graph;
import io.surfworks.flowforge.sdfg.IdGenerator;
import io.surfworks.flowforge.sdfg.InterstateEdge;
import io.surfworks.flowforge.sdfg.Library;
import io.surfworks.flowforge.sdfg.MapEntry;
import io.surfworks.flowforge.sdfg.MultiEdge;
import io.surfworks.flowforge.sdfg.NestedSdfg;
import io.surfworks.flowforge.sdfg.Range;
import io.surfworks.flowforge.sdfg.Scope;
import io.surfworks.flowforge.sdfg.ScopeEntry;
import io.surfworks.flowforge.sdfg.State;
import io.surfworks.flowforge.sdfg.Symbol;
import io.surfworks.flowforge.sdfg.Tasklet;
import io.surfworks.flowforge.sdfg.TranslationException;

import java.io.Writer;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Translates a {@link Program} into a {@link Graph} in a single walk.
 *
 * <p>Data flow is tracked through the binding table of the current scope:
 * every operand is resolved with {@link Scope#lookup}, every result is bound
 * with {@link Scope#mapConnector}, and every write to a container goes
 * through {@link Scope#routeWrite}. Map and consume bodies run inside a
 * {@link ScopeEntry.Body} so their closure wiring happens exactly once.
 *
 * <p>A failed translation throws {@link TranslationException} and produces no
 * output.
 */
public final class SdfgTranslator {

    private static final Logger LOG = Logger.getLogger(SdfgTranslator.class.getName());

    private final TranslatorConfig config;
    private final ExpressionLifter lifter;
    private IdGenerator ids = new IdGenerator();

    public SdfgTranslator() {
        this(TranslatorConfig.defaults());
    }

    public SdfgTranslator(TranslatorConfig config) {
        this(config, new PythonLifter());
    }

    public SdfgTranslator(TranslatorConfig config, ExpressionLifter lifter) {
        this.config = config;
        this.lifter = lifter;
    }

    public TranslatorConfig getConfig() {
        return config;
    }

    /**
     * Builds the graph of a single-function program.
     *
     * @throws TranslationException if the program is structurally broken
     */
    public Graph translate(Program program) {
        ids = new IdGenerator();
        try {
            if (program.functions().size() != 1) {
                throw TranslationException.structural("Expected exactly one function but found "
                        + program.functions().size(), Location.UNKNOWN);
            }
            Graph graph = translateFunction(program.functions().get(0));
            if (config.validate()) {
                new SdfgValidator().check(graph);
            }
            return graph;
        } catch (TranslationException e) {
            LOG.severe("Translation of " + program.name() + " failed: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Translates and renders the graph as JSON text.
     */
    public String translateToJson(Program program) {
        Graph graph = translate(program);
        return GsonJsonEmitter.render(config.effectiveIndent(), graph::emit);
    }

    /**
     * Translates and writes the graph as JSON. Nothing is written if the
     * translation fails.
     */
    public void translate(Program program, Writer out) {
        Graph graph = translate(program);
        GsonJsonEmitter emitter = new GsonJsonEmitter(out, config.effectiveIndent());
        graph.emit(emitter);
        emitter.flush();
    }

    // ==================== Functions ====================

    private Graph translateFunction(Function function) {
        Graph graph = new Graph(function.location(), ids.nextGraphId());
        graph.setName(ids.generateName("sdfg"));
        LOG.fine("Translating @" + function.name() + " as " + graph.getName());

        for (Value arg : function.arguments()) {
            graph.addArg(ArrayDescriptor.of(arg.container(), false, arg.type(), function.location()));
        }
        for (String symbol : function.symbols()) {
            graph.addSymbol(new Symbol(symbol, DType.INT64));
        }
        for (AllocOp alloc : function.allocations()) {
            visitAlloc(alloc, graph);
        }

        if (function.states().isEmpty()) {
            throw TranslationException.structural("Function @" + function.name() + " has no states",
                    function.location());
        }
        for (StateBlock block : function.states()) {
            State state = graph.addState(block.name(), block.location());
            for (Operation op : block.operations()) {
                visit(op, state);
            }
        }

        State start = function.entryState()
                .map(name -> graph.lookup(name, function.location()))
                .orElse(graph.getStates().get(0));
        graph.setStartState(start);

        for (Transition transition : function.transitions()) {
            visitTransition(transition, graph);
        }
        return graph;
    }

    private void visitTransition(Transition transition, Graph graph) {
        State source = graph.lookup(transition.source(), transition.location());
        State destination = graph.lookup(transition.destination(), transition.location());
        InterstateEdge edge = new InterstateEdge(transition.location(), source, destination);
        if (transition.condition() != null && !transition.condition().isBlank()) {
            edge.setCondition(transition.condition());
        }
        for (String assignment : transition.assignments()) {
            edge.addAssignment(InterstateEdge.Assignment.parse(assignment, transition.location()));
        }
        graph.addEdge(edge);
    }

    // ==================== Operations ====================

    private void visit(Operation op, Scope scope) {
        if (op instanceof AllocOp alloc) {
            visitAlloc(alloc, scope.state().getGraph());
        } else if (op instanceof AllocSymbolOp allocSymbol) {
            scope.state().getGraph().addSymbol(new Symbol(allocSymbol.symbol(), DType.INT64));
        } else if (op instanceof TaskletOp tasklet) {
            visitTasklet(tasklet, scope);
        } else if (op instanceof LibCallOp libCall) {
            visitLibCall(libCall, scope);
        } else if (op instanceof LoadOp load) {
            Connector source = scope.lookup(load.array());
            if (!load.indices().isEmpty()) {
                source = source.withRanges(Range.points(load.indices()));
            }
            scope.mapConnector(load.result(), source);
        } else if (op instanceof StoreOp store) {
            writeTo(store.array(), Range.points(store.indices()), scope.lookup(store.value()), scope,
                    store.location());
        } else if (op instanceof CopyOp copy) {
            writeTo(copy.destination(), List.of(), scope.lookup(copy.source()), scope, copy.location());
        } else if (op instanceof StreamPopOp pop) {
            scope.mapConnector(pop.result(), scope.lookup(pop.stream()));
        } else if (op instanceof StreamPushOp push) {
            writeTo(push.stream(), List.of(), scope.lookup(push.value()), scope, push.location());
        } else if (op instanceof MapOp map) {
            visitMap(map, scope);
        } else if (op instanceof ConsumeOp consume) {
            visitConsume(consume, scope);
        } else if (op instanceof NestedGraphOp nested) {
            visitNestedGraph(nested, scope);
        } else {
            throw TranslationException.structural("Unsupported operation " + op.opName(), op.location());
        }
    }

    private static void visitAlloc(AllocOp alloc, Graph graph) {
        graph.addArray(ArrayDescriptor.of(alloc.name(), alloc.transientData(), alloc.result().type(),
                alloc.location()));
    }

    private static void writeTo(Value container, List<Range> ranges, Connector from, Scope scope,
                                Location location) {
        Access access = new Access(location, container.init());
        access.setName(container.container());
        Connector to = Connector.nullIn(access).withData(container.container()).withRanges(ranges);
        scope.routeWrite(from, to, container);
    }

    private void visitTasklet(TaskletOp op, Scope scope) {
        Tasklet tasklet = new Tasklet(op.location());
        tasklet.setName(taskletLabel(op));
        tasklet.setHasSideEffect(op.sideEffects());
        scope.addNode(tasklet);

        for (int i = 0; i < op.operands().size(); i++) {
            Connector in = Connector.in(tasklet, op.inputName(i));
            tasklet.addInConnector(in);
            scope.addEdge(new MultiEdge(op.location(), scope.lookup(op.operands().get(i)), in));
        }
        for (int i = 0; i < op.results().size(); i++) {
            Connector out = Connector.out(tasklet, op.outputName(i));
            tasklet.addOutConnector(out);
            scope.mapConnector(op.results().get(i), out);
        }
        for (Value dependency : op.dependencies()) {
            Connector in = Connector.nullIn(tasklet);
            tasklet.addInConnector(in);
            scope.addDependency(dependency, in);
        }

        tasklet.setCode(liftBody(op));
    }

    private Code liftBody(TaskletOp op) {
        if (config.liftToPython()) {
            Optional<String> lifted = lifter.lift(op);
            if (lifted.isPresent()) {
                return Code.python(lifted.get());
            }
            LOG.fine("Could not lift tasklet at " + op.location() + " to Python, keeping MLIR body");
        }
        return new Code(op.bodyText(), CodeLanguage.MLIR);
    }

    /**
     * Label of a tasklet, taken from its first body operation.
     */
    static String taskletLabel(TaskletOp op) {
        if (op.body().isEmpty()) {
            return "task";
        }
        BodyOp first = op.body().get(0);
        if (first instanceof ArithOp arith) {
            return switch (arith.kind()) {
                case ADD -> "add";
                case SUB -> "sub";
                case MUL -> "mult";
                case DIV -> "div";
                case NEG -> "neg";
                default -> "task";
            };
        }
        if (first instanceof ConstantOp) {
            return "constant";
        }
        if (first instanceof CastOp) {
            return "cast";
        }
        if (first instanceof SymOp) {
            return "sym";
        }
        if (first instanceof ReturnOp) {
            return "return";
        }
        if (first instanceof GenericOp generic) {
            if (generic.opName().endsWith(".load")) {
                return "load";
            }
            if (generic.opName().endsWith(".store")) {
                return "store";
            }
        }
        return "task";
    }

    private void visitLibCall(LibCallOp op, Scope scope) {
        Library library = new Library(op.location());
        int dot = op.callee().lastIndexOf('.');
        library.setName(dot >= 0 ? op.callee().substring(dot + 1) : op.callee());
        library.setClasspath(op.callee());
        scope.addNode(library);

        for (int i = 0; i < op.operands().size(); i++) {
            Connector in = Connector.in(library, op.inputName(i));
            library.addInConnector(in);
            scope.addEdge(new MultiEdge(op.location(), scope.lookup(op.operands().get(i)), in));
        }
        for (int i = 0; i < op.results().size(); i++) {
            Connector out = Connector.out(library, op.outputName(i));
            library.addOutConnector(out);
            scope.mapConnector(op.results().get(i), out);
        }
        for (Value dependency : op.dependencies()) {
            Connector in = Connector.nullIn(library);
            library.addInConnector(in);
            scope.addDependency(dependency, in);
        }
    }

    // ==================== Scopes ====================

    private void visitMap(MapOp op, Scope scope) {
        MapEntry entry = new MapEntry(op.location());
        entry.setName(ids.generateName("map"));
        entry.getExit().setName(entry.getName());
        for (int i = 0; i < op.params().size(); i++) {
            entry.addParam(op.params().get(i));
            entry.addRange(Range.of(op.lowerBounds().get(i), op.upperBounds().get(i), op.steps().get(i)));
        }
        scope.addNode(entry);
        scope.addNode(entry.getExit());

        try (ScopeEntry.Body body = entry.open()) {
            for (Operation inner : op.body()) {
                visit(inner, body.scope());
            }
        }
    }

    private void visitConsume(ConsumeOp op, Scope scope) {
        ConsumeEntry entry = new ConsumeEntry(op.location());
        entry.setName(ids.generateName("consume"));
        entry.getExit().setName(entry.getName());
        entry.setPeIndex(op.peIndex());
        entry.setNumPes(op.numPes());
        entry.setCondition(op.conditionValue().map(Code::python).orElse(Code.EMPTY));
        scope.addNode(entry);
        scope.addNode(entry.getExit());

        try (ScopeEntry.Body body = entry.open()) {
            entry.mapConnector(op.element(), entry.lookup(op.stream()));
            for (Operation inner : op.body()) {
                visit(inner, body.scope());
            }
        }
    }

    private void visitNestedGraph(NestedGraphOp op, Scope scope) {
        Graph parent = scope.state().getGraph();
        Graph nested = translateFunction(op.function());
        nested.setNestedTransient();

        NestedSdfg node = new NestedSdfg(op.location(), nested);
        node.setName(nested.getName());
        for (Symbol symbol : parent.getSymbols()) {
            nested.addSymbol(symbol);
            node.mapSymbol(symbol.name(), symbol.name());
        }
        scope.addNode(node);

        List<Value> arguments = op.function().arguments();
        for (int i = 0; i < op.inputs().size(); i++) {
            Connector in = Connector.in(node, arguments.get(i).container());
            node.addInConnector(in);
            scope.addEdge(new MultiEdge(op.location(), scope.lookup(op.inputs().get(i)), in));
        }
        for (int i = 0; i < op.outputs().size(); i++) {
            Value argument = arguments.get(op.inputs().size() + i);
            Connector out = Connector.out(node, argument.container());
            node.addOutConnector(out);
            writeTo(op.outputs().get(i), List.of(), out, scope, op.location());
        }
    }
}
