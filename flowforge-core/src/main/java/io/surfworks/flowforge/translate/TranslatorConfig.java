package io.surfworks.flowforge.translate;

import java.util.function.UnaryOperator;

/**
 * Settings of a translation run.
 *
 * <p>{@link #fromEnvironment()} reads the {@code FLOWFORGE_*} variables below;
 * unset variables keep their defaults.
 *
 * @param liftToPython lift tasklet bodies to Python; when false bodies are
 *                     emitted as MLIR text
 * @param validate     run {@link SdfgValidator} on the finished graph
 * @param prettyPrint  indent the emitted JSON
 * @param indent       indentation per level when pretty printing
 */
public record TranslatorConfig(boolean liftToPython, boolean validate, boolean prettyPrint, String indent) {

    /**
     * Environment variable to enable/disable lifting to Python.
     */
    public static final String ENV_LIFT = "FLOWFORGE_LIFT";

    /**
     * Environment variable to enable/disable post-translation validation.
     */
    public static final String ENV_VALIDATE = "FLOWFORGE_VALIDATE";

    /**
     * Environment variable to enable/disable indented output.
     */
    public static final String ENV_PRETTY = "FLOWFORGE_PRETTY";

    public static final String DEFAULT_INDENT = "  ";

    public static TranslatorConfig defaults() {
        return new TranslatorConfig(true, true, true, DEFAULT_INDENT);
    }

    public static TranslatorConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static TranslatorConfig fromEnvironment(UnaryOperator<String> env) {
        TranslatorConfig defaults = defaults();
        return new TranslatorConfig(
                flag(env.apply(ENV_LIFT), defaults.liftToPython()),
                flag(env.apply(ENV_VALIDATE), defaults.validate()),
                flag(env.apply(ENV_PRETTY), defaults.prettyPrint()),
                defaults.indent());
    }

    public TranslatorConfig withLiftToPython(boolean value) {
        return new TranslatorConfig(value, validate, prettyPrint, indent);
    }

    public TranslatorConfig withValidate(boolean value) {
        return new TranslatorConfig(liftToPython, value, prettyPrint, indent);
    }

    public TranslatorConfig withPrettyPrint(boolean value) {
        return new TranslatorConfig(liftToPython, validate, value, indent);
    }

    /**
     * Indentation handed to the emitter; empty for compact output.
     */
    public String effectiveIndent() {
        return prettyPrint ? indent : "";
    }

    private static boolean flag(String value, boolean fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }
}
