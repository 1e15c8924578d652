package com.helios.ignore.infra.management;

import com.helios.ignore.api.IIgnoreMatcherManager;
import com.helios.ignore.api.exceptions.IgnoreCompilationException;
import com.helios.ignore.core.IgnoreLoader;
import com.helios.ignore.infra.config.IgnoreConfig;
import com.helios.ignore.runtime.evaluation.IgnoreMatcher;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps an up-to-date matcher for one ignore file and everything it includes.
 *
 * <p>Reloads go through {@link IgnoreLoader#load(Path, boolean)} with caching enabled, so a
 * reload that yields identical rules keeps the warm result cache, and a real change starts
 * from an empty one.
 */
public class IgnoreMatcherManager implements IIgnoreMatcherManager {
    private static final Logger logger = Logger.getLogger(IgnoreMatcherManager.class.getName());

    private final Path ignoreFile;
    private final IgnoreLoader loader;
    private final boolean cacheEnabled;
    private final long checkIntervalSeconds;

    /**
     * Holds the currently active matcher.
     * <p>
     * Updated atomically; readers always see a complete matcher without taking a lock,
     * including while a reload is in progress.
     */
    private final AtomicReference<IgnoreMatcher> activeMatcher = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;
    private final Tracer tracer;

    private volatile long lastModifiedTime = -1;

    /**
     * Takes caching and the polling interval from {@code config}.
     */
    public IgnoreMatcherManager(Path ignoreFile, Tracer tracer, IgnoreLoader loader, IgnoreConfig config) {
        this(ignoreFile, tracer, loader, config.isCacheEnabled(), config.getReloadIntervalSeconds());
    }

    public IgnoreMatcherManager(Path ignoreFile, Tracer tracer, IgnoreLoader loader,
                                boolean cacheEnabled, long checkIntervalSeconds) {
        this.ignoreFile = ignoreFile;
        this.tracer = tracer;
        this.loader = loader;
        this.cacheEnabled = cacheEnabled;
        this.checkIntervalSeconds = checkIntervalSeconds;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Ignore-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadMatcherInternal(); // Initial load, fail fast
    }

    @Override
    public IgnoreMatcher getMatcher() {
        return activeMatcher.get();
    }

    @Override
    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                checkIntervalSeconds, checkIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Reloads immediately regardless of modification times.
     *
     * @throws IgnoreCompilationException if the new rules cannot be compiled; the previous
     *                                    matcher stays active
     */
    public void reload() {
        reloadMatcherInternal();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-ignore-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ignoreFile", ignoreFile.toString());
            long currentModifiedTime = latestModifiedTime(watchedFiles());
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in ignore file. Attempting to reload...");
                loadMatcher();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check ignore files for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during ignore reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadMatcher() {
        try {
            reloadMatcherInternal();
        } catch (IgnoreCompilationException e) {
            logger.log(Level.SEVERE, "Failed to compile new ignore rules. Old matcher remains active.", e);
        }
    }

    private void reloadMatcherInternal() {
        Span span = tracer.spanBuilder("load-ignore-matcher").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(ignoreFile).toMillis();
            IgnoreMatcher newMatcher = loader.load(ignoreFile, cacheEnabled);
            IgnoreMatcher previous = activeMatcher.getAndSet(newMatcher);
            long sourcesModifiedTime = latestModifiedTime(newMatcher.ruleSet().sources());
            // a source vanished after compiling; leave the next check to reload again
            this.lastModifiedTime = sourcesModifiedTime == Long.MAX_VALUE
                    ? -1
                    : Math.max(modifiedTime, sourcesModifiedTime);

            boolean cacheReused = previous != null
                    && previous.cache().isPresent()
                    && previous.cache().equals(newMatcher.cache());
            span.setAttribute("predicateCount", newMatcher.ruleSet().size());
            span.setAttribute("cacheReused", cacheReused);
            logger.info(String.format("Loaded %d ignore predicates from %s (cache %s)",
                    newMatcher.ruleSet().size(), ignoreFile,
                    !cacheEnabled ? "disabled" : cacheReused ? "reused" : "fresh"));
        } catch (IOException e) {
            span.recordException(e);
            throw new IgnoreCompilationException("Cannot stat ignore file \"" + ignoreFile + "\"",
                    ignoreFile.toString(), e);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<Path> watchedFiles() {
        IgnoreMatcher current = activeMatcher.get();
        if (current == null || current.ruleSet().sources().isEmpty()) {
            return List.of(ignoreFile);
        }
        return current.ruleSet().sources();
    }

    /**
     * Newest modification time over {@code files}, or {@link Long#MAX_VALUE} if any of them
     * no longer exists. A deleted source counts as a change.
     */
    private static long latestModifiedTime(List<Path> files) throws IOException {
        long latest = -1;
        for (Path file : files) {
            try {
                latest = Math.max(latest, Files.getLastModifiedTime(file).toMillis());
            } catch (NoSuchFileException e) {
                logger.fine(() -> "Watched ignore file disappeared: " + file);
                return Long.MAX_VALUE;
            }
        }
        return latest;
    }
}
