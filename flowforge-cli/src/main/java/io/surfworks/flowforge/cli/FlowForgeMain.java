package io.surfworks.flowforge.cli;

import io.surfworks.flowforge.ir.ProgramAst.Program;
import io.surfworks.flowforge.ir.ProgramFormatException;
import io.surfworks.flowforge.ir.ProgramJsonReader;
import io.surfworks.flowforge.sdfg.TranslationException;
import io.surfworks.flowforge.translate.SdfgTranslator;
import io.surfworks.flowforge.translate.TranslatorConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FlowForgeMain {

    static final String EXAMPLE_PROGRAM = """
        {
          "name": "vector_add",
          "functions": [{
            "name": "main",
            "arguments": [
              {"name": "A", "type": "f32[N]"},
              {"name": "B", "type": "f32[N]"},
              {"name": "C", "type": "f32[N]"}
            ],
            "symbols": ["N"],
            "states": [{
              "name": "compute",
              "operations": [{
                "op": "map",
                "params": ["i"],
                "lower": ["0"],
                "upper": ["N - 1"],
                "step": ["1"],
                "body": [
                  {"op": "load", "result": "a", "array": "A", "indices": ["i"]},
                  {"op": "load", "result": "b", "array": "B", "indices": ["i"]},
                  {"op": "tasklet", "operands": ["a", "b"], "params": ["x", "y"], "results": ["c"],
                   "body": [
                     {"op": "arith.add", "result": "z", "operands": ["x", "y"]},
                     {"op": "return", "operands": ["z"]}
                   ]},
                  {"op": "store", "value": "c", "array": "C", "indices": ["i"]}
                ]
              }]
            }]
          }]
        }
        """;

    private FlowForgeMain() {}

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 0;
        }

        TranslatorConfig config = TranslatorConfig.fromEnvironment();
        String command = args[0];
        int firstOption = "--translate".equals(command) ? 2 : 1;
        for (int i = firstOption; i < args.length; i++) {
            switch (args[i]) {
                case "--compact" -> config = config.withPrettyPrint(false);
                case "--no-lift" -> config = config.withLiftToPython(false);
                case "--no-validate" -> config = config.withValidate(false);
                default -> {
                    err.println("Unknown option: " + args[i]);
                    printUsage(err);
                    return 1;
                }
            }
        }

        return switch (command) {
            case "--help", "-h" -> {
                printUsage(out);
                yield 0;
            }
            case "--translate" -> runTranslate(args, config, out, err);
            case "--example" -> translate(EXAMPLE_PROGRAM, "<example>", config, out, err);
            default -> {
                err.println("Unknown command: " + command);
                printUsage(err);
                yield 1;
            }
        };
    }

    private static void printUsage(PrintStream out) {
        out.println("FlowForge CLI - Dataflow program to SDFG translator");
        out.println();
        out.println("Usage: flowforge <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --translate FILE         Translate a JSON program and print the SDFG as JSON");
        out.println("  --example                Translate the built-in vector addition example");
        out.println("  --help, -h               Print this help message");
        out.println();
        out.println("Options:");
        out.println("  --compact                Print JSON without indentation");
        out.println("  --no-lift                Keep tasklet bodies as MLIR instead of Python");
        out.println("  --no-validate            Skip structural validation of the graph");
        out.println();
        out.println("Environment: " + TranslatorConfig.ENV_LIFT + ", " + TranslatorConfig.ENV_VALIDATE + ", "
                + TranslatorConfig.ENV_PRETTY);
    }

    private static int runTranslate(String[] args, TranslatorConfig config, PrintStream out, PrintStream err) {
        if (args.length < 2 || args[1].startsWith("--")) {
            err.println("Error: --translate requires a FILE argument");
            return 1;
        }

        Path inputPath = Path.of(args[1]);
        if (!Files.exists(inputPath)) {
            err.println("Error: File not found: " + inputPath);
            return 1;
        }

        try {
            String json = Files.readString(inputPath, StandardCharsets.UTF_8);
            return translate(json, inputPath.getFileName().toString(), config, out, err);
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return 1;
        }
    }

    private static int translate(String json, String sourceName, TranslatorConfig config,
                                 PrintStream out, PrintStream err) {
        try {
            Program program = new ProgramJsonReader().read(json, sourceName);
            String sdfg = new SdfgTranslator(config).translateToJson(program);
            out.println(sdfg);
            return 0;
        } catch (ProgramFormatException e) {
            err.println("Error reading " + sourceName + ": " + e.getMessage());
            return 1;
        } catch (TranslationException e) {
            err.println("Error translating " + sourceName + ": " + e.getMessage());
            return 1;
        }
    }
}
