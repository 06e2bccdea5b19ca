package io.surfworks.flowforge.translate;

import io.surfworks.flowforge.ir.ProgramAst.TaskletOp;

import java.util.Optional;

/**
 * Translates a tasklet body into code of the output language.
 */
@FunctionalInterface
public interface ExpressionLifter {

    /**
     * @return the lifted code, or empty when the body uses an operation the
     *         lifter does not understand
     */
    Optional<String> lift(TaskletOp tasklet);
}
