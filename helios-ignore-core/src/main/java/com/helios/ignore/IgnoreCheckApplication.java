package com.helios.ignore;

import com.helios.ignore.api.exceptions.IgnoreCompilationException;
import com.helios.ignore.api.model.MatchExplanation;
import com.helios.ignore.core.IgnoreLoader;
import com.helios.ignore.infra.config.IgnoreConfig;
import com.helios.ignore.infra.telemetry.TracingService;
import com.helios.ignore.runtime.evaluation.IgnoreMatcher;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * {@code ignore-check <ignore-file> [--describe] [--explain] [path ...]}
 *
 * <p>Prints {@code ignored <path>} or {@code kept <path>} for every path argument, or for
 * every line of standard input when no paths are given.
 */
public class IgnoreCheckApplication {
    private static final Logger logger = Logger.getLogger(IgnoreCheckApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_LOAD_FAILED = 2;

    private static final String USAGE = "usage: ignore-check <ignore-file> [--describe] [--explain] [path ...]";

    private final IgnoreLoader loader;
    private final PrintStream out;
    private final PrintStream err;

    IgnoreCheckApplication(IgnoreLoader loader, PrintStream out, PrintStream err) {
        this.loader = loader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        if (System.getProperty("otel.disabled") == null) {
            System.setProperty("otel.disabled", "true");
        }
        IgnoreConfig config = IgnoreConfig.loadDefault();
        IgnoreLoader loader = IgnoreLoader.create(config, TracingService.getInstance().getTracer());
        int status = new IgnoreCheckApplication(loader, System.out, System.err)
                .run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        System.exit(status);
    }

    int run(String[] args, BufferedReader stdin) {
        String ignoreFile = null;
        boolean describe = false;
        boolean explain = false;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if ("--describe".equals(arg)) {
                describe = true;
            } else if ("--explain".equals(arg)) {
                explain = true;
            } else if (arg.startsWith("--")) {
                err.println("unknown option: " + arg);
                err.println(USAGE);
                return EXIT_USAGE;
            } else if (ignoreFile == null) {
                ignoreFile = arg;
            } else {
                paths.add(arg);
            }
        }
        if (ignoreFile == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        IgnoreMatcher matcher;
        try {
            matcher = loader.load(Path.of(ignoreFile), false);
        } catch (IgnoreCompilationException e) {
            logger.log(Level.FINE, "Load failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_LOAD_FAILED;
        }

        if (describe) {
            matcher.describe().forEach(out::println);
        }

        try {
            if (paths.isEmpty() && !describe) {
                String line;
                while ((line = stdin.readLine()) != null) {
                    if (!line.isEmpty()) {
                        check(matcher, line, explain);
                    }
                }
            } else {
                for (String path : paths) {
                    check(matcher, path, explain);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading paths from standard input", e);
        }
        return EXIT_OK;
    }

    private void check(IgnoreMatcher matcher, String path, boolean explain) {
        boolean ignored = matcher.match(path);
        if (!explain) {
            out.println((ignored ? "ignored " : "kept ") + path);
            return;
        }
        MatchExplanation explanation = matcher.explain(path);
        out.println((ignored ? "ignored " : "kept ") + path
                + (explanation.matched()
                ? "\t#" + explanation.predicateIndex() + " " + explanation.predicate()
                : "\t(no match)"));
    }

    private static void configureLogging() {
        try (InputStream is = IgnoreCheckApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }
}
