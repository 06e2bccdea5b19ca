package io.surfworks.flowforge.translate;

import io.surfworks.flowforge.ir.ProgramAst.ArithOp;
import io.surfworks.flowforge.ir.ProgramAst.ArrayType;
import io.surfworks.flowforge.ir.ProgramAst.BodyOp;
import io.surfworks.flowforge.ir.ProgramAst.CastOp;
import io.surfworks.flowforge.ir.ProgramAst.ConstantOp;
import io.surfworks.flowforge.ir.ProgramAst.GenericOp;
import io.surfworks.flowforge.ir.ProgramAst.ReturnOp;
import io.surfworks.flowforge.ir.ProgramAst.ScalarType;
import io.surfworks.flowforge.ir.ProgramAst.StreamType;
import io.surfworks.flowforge.ir.ProgramAst.SymOp;
import io.surfworks.flowforge.ir.ProgramAst.TaskletOp;
import io.surfworks.flowforge.ir.ProgramAst.Type;
import io.surfworks.flowforge.ir.ProgramAst.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifts arithmetic and element load/store tasklet bodies to Python, one
 * assignment per operation.
 *
 * <p>Inputs are read through their parameter names and results are assigned
 * to the tasklet's output connector names, so
 * <pre>
 *   %z = arith.add %x, %y : f32
 *   sdfg.return %z
 * </pre>
 * becomes {@code z = x + y}.
 */
public final class PythonLifter implements ExpressionLifter {

    @Override
    public Optional<String> lift(TaskletOp tasklet) {
        List<String> lines = new ArrayList<>();
        for (BodyOp op : tasklet.body()) {
            if (op instanceof ReturnOp ret) {
                for (int i = 0; i < ret.operands().size(); i++) {
                    String output = tasklet.outputName(i);
                    String operand = ret.operands().get(i).name();
                    if (!output.equals(operand)) {
                        lines.add(output + " = " + operand);
                    }
                }
                continue;
            }
            Optional<String> line = liftOperation(op);
            if (line.isEmpty()) {
                return Optional.empty();
            }
            lines.add(line.get());
        }
        return Optional.of(String.join("\n", lines));
    }

    private static Optional<String> liftOperation(BodyOp op) {
        if (op instanceof ArithOp arith) {
            return Optional.of(arith.result().name() + " = " + arithExpression(arith));
        }
        if (op instanceof ConstantOp constant) {
            return Optional.of(constant.result().name() + " = " + literal(constant));
        }
        if (op instanceof CastOp cast) {
            String conversion = isFloat(cast.result().type()) ? "float" : "int";
            return Optional.of(cast.result().name() + " = " + conversion + "(" + cast.operand().name() + ")");
        }
        if (op instanceof SymOp sym) {
            return Optional.of(sym.result().name() + " = " + sym.expression());
        }
        if (op instanceof GenericOp generic) {
            if (generic.opName().endsWith(".load")) {
                return liftLoad(generic);
            }
            if (generic.opName().endsWith(".store")) {
                return liftStore(generic);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code v = A[i, j]}. The array is the array-typed operand, otherwise the last one.
     */
    private static Optional<String> liftLoad(GenericOp op) {
        if (op.results().size() != 1 || op.operands().isEmpty()) {
            return Optional.empty();
        }
        List<Value> indices = new ArrayList<>(op.operands());
        int arrayIndex = arrayOperand(indices);
        Value array = indices.remove(arrayIndex < 0 ? indices.size() - 1 : arrayIndex);
        return Optional.of(op.results().get(0).name() + " = " + subscript(array.name(), indices));
    }

    /**
     * {@code A[i, j] = v}. The value is the last non-array operand; the target is the
     * array-typed operand, or the op's single result when no operand is an array.
     */
    private static Optional<String> liftStore(GenericOp op) {
        List<Value> indices = new ArrayList<>(op.operands());
        int arrayIndex = arrayOperand(indices);
        String target;
        if (arrayIndex >= 0) {
            target = indices.remove(arrayIndex).name();
        } else if (op.results().size() == 1) {
            target = op.results().get(0).name();
        } else {
            return Optional.empty();
        }
        if (indices.isEmpty()) {
            return Optional.empty();
        }
        Value value = indices.remove(indices.size() - 1);
        return Optional.of(subscript(target, indices) + " = " + value.name());
    }

    private static int arrayOperand(List<Value> operands) {
        for (int i = 0; i < operands.size(); i++) {
            Type type = operands.get(i).type();
            if (type instanceof ArrayType || type instanceof StreamType) {
                return i;
            }
        }
        return -1;
    }

    private static String subscript(String array, List<Value> indices) {
        if (indices.isEmpty()) {
            return array;
        }
        return array + "[" + String.join(", ", indices.stream().map(Value::name).toList()) + "]";
    }

    private static String arithExpression(ArithOp op) {
        List<Value> operands = op.operands();
        String lhs = operands.get(0).name();
        return switch (op.kind()) {
            case ADD -> lhs + " + " + operands.get(1).name();
            case SUB -> lhs + " - " + operands.get(1).name();
            case MUL -> lhs + " * " + operands.get(1).name();
            case DIV -> lhs + (isFloat(op.result().type()) ? " / " : " // ") + operands.get(1).name();
            case REM -> lhs + " % " + operands.get(1).name();
            case MIN -> "min(" + lhs + ", " + operands.get(1).name() + ")";
            case MAX -> "max(" + lhs + ", " + operands.get(1).name() + ")";
            case NEG -> "-" + lhs;
        };
    }

    private static String literal(ConstantOp op) {
        if (op.result().type() instanceof ScalarType scalar && scalar.name().equals("i1")) {
            return switch (op.literal()) {
                case "true", "1" -> "True";
                case "false", "0" -> "False";
                default -> op.literal();
            };
        }
        return op.literal();
    }

    private static boolean isFloat(Type type) {
        return type instanceof ScalarType scalar && scalar.isFloatingPoint();
    }
}
