package com.claro.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.claro.debug.ConsoleDebugSink;
import com.claro.debug.Debug;
import com.claro.debug.DebugLevel;
import com.claro.script.exec.LineInput;

/**
 * Command line front end.
 *
 * <pre>
 *   claro -e program.claro      run a file
 *   claro -i                    interactive session
 *   claro --version
 *   options: --config file.json, --debug
 * </pre>
 */
public final class ClaroCli {

    public static final String VERSION = "Claro Interpreter Version 1.0";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: claro [options] -e <file> | -i",
            "  -e <file>          execute a program file",
            "  -i                 start an interactive session",
            "  --config <file>    read engine settings from a JSON file",
            "  --debug            log every executed statement to stderr",
            "  --version          print the version and exit",
            "  -h, --help         print this help and exit");

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public ClaroCli(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int code = new ClaroCli(stdin, System.out, System.err).run(args);
        if (code != 0) System.exit(code);
    }

    /** @return process exit code */
    public int run(String[] args) {
        String file = null;
        String configFile = null;
        boolean interactive = false;
        boolean debug = false;

        if (args.length == 0) {
            out.println(USAGE);
            return 0;
        }
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return 0;
                case "--version":
                    out.println(VERSION);
                    return 0;
                case "-i":
                    interactive = true;
                    break;
                case "--debug":
                    debug = true;
                    break;
                case "-e":
                case "--config":
                    if (i + 1 >= args.length) {
                        err.println("Option " + a + " requires a file argument");
                        err.println(USAGE);
                        return 1;
                    }
                    if (a.equals("-e")) file = args[++i];
                    else configFile = args[++i];
                    break;
                default:
                    err.println("Unknown option: " + a);
                    err.println(USAGE);
                    return 1;
            }
        }
        if (file == null && !interactive) {
            err.println("Nothing to do: give -e <file> or -i");
            err.println(USAGE);
            return 1;
        }

        ClaroConfig config;
        try {
            config = (configFile == null) ? ClaroConfig.defaults() : ClaroConfig.load(Path.of(configFile));
        } catch (IOException | IllegalArgumentException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }

        DebugLevel level = (debug || config.isDebug()) ? DebugLevel.TRACE : DebugLevel.WARN;
        Debug.get().setSink(new ConsoleDebugSink(err, level));

        ClaroScript engine = new ClaroScript(config);
        engine.setLineInput(promptingInput());

        return (file != null) ? runFile(engine, Path.of(file)) : runInteractive(engine);
    }

    private int runFile(ClaroScript engine, Path path) {
        final String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read program file: " + path + " (" + e.getMessage() + ")");
            return 1;
        }

        // report-and-suppress so the output produced before the error is still printed
        engine.setErrorReporter(error -> { });
        RunResult result = engine.run(source);
        result.output().forEach(out::println);
        if (result.failed()) {
            err.println(result.error().describe());
            return 1;
        }
        return 0;
    }

    private int runInteractive(ClaroScript engine) {
        ClaroSession session = new ClaroSession(engine);
        out.println(VERSION);
        out.println("Type 'exit' to quit.");
        try {
            while (true) {
                out.print(session.isBuffering() ? "... " : ">>> ");
                out.flush();
                String line = in.readLine();
                if (line == null) break;
                if (!session.isBuffering() && line.trim().toLowerCase(Locale.ROOT).equals("exit")) break;

                RunResult result = session.feed(line);
                if (result == null) continue;
                result.output().forEach(out::println);
                if (result.failed()) err.println(result.error().describe());
                if (result.halted()) break;
            }
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private LineInput promptingInput() {
        return prompt -> {
            out.print(prompt);
            out.flush();
            try {
                return in.readLine();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read input: " + e.getMessage(), e);
            }
        };
    }
}
