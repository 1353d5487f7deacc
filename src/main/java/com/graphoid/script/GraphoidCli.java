package com.graphoid.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.errors.SourcePosition;
import com.graphoid.script.runtime.Value;
import com.graphoid.script.runtime.ValueJson;

public final class GraphoidCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREADABLE = 3;

    private static final String USAGE = "Usage: GraphoidCli [--config cfg.json] [--json] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        Path configPath = null;
        boolean json = false;
        Path scriptPath = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--json")) {
                json = true;
            } else if (a.equals("--config")) {
                if (i + 1 >= args.length) {
                    err.println("--config requires a file argument");
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                configPath = Path.of(args[++i]);
            } else if (a.startsWith("--") || scriptPath != null) {
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                scriptPath = Path.of(a);
            }
        }
        if (scriptPath == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        final String script;
        final String config;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
            config = (configPath == null) ? null : Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read file: " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        final Graphoid engine = new Graphoid(out);

        if (config != null) {
            try {
                engine.applyConfigJson(config);
            } catch (GraphoidException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
        }

        final BufferedReader stdin =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        // Blocking stdin reader; returns none at EOF.
        engine.registerFunction("read_line", fnArgs -> {
            if (!fnArgs.isEmpty()) {
                throw GraphoidException.runtime("read_line() takes no arguments");
            }
            try {
                String line = stdin.readLine();
                return (line == null) ? Value.none() : Value.string(line);
            } catch (IOException ioe) {
                throw GraphoidException.io("read_line() failed: " + ioe.getMessage(), SourcePosition.UNKNOWN);
            }
        });

        try {
            engine.executeFile(scriptPath);
        } catch (GraphoidException e) {
            err.println(e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }

        if (json) {
            out.println(ValueJson.write(engine.snapshotJson(), true));
        }
        return EXIT_OK;
    }

    private GraphoidCli() {}
}
