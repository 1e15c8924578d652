package com.helios.ignore;

import com.helios.ignore.core.IgnoreLoader;
import com.helios.ignore.infra.config.IgnoreConfig;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class IgnoreCheckApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private IgnoreCheckApplication app;
    private Path ignoreFile;

    @BeforeEach
    void setUp() throws Exception {
        ignoreFile = tempDir.resolve(".stignore");
        Files.writeString(ignoreFile, "!keep.log\n*.log\n");
        IgnoreLoader loader = IgnoreLoader.create(IgnoreConfig.defaults(), OpenTelemetry.noop().getTracer("test"));
        app = new IgnoreCheckApplication(loader,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String stdin, String... args) {
        return app.run(args, new BufferedReader(new StringReader(stdin)));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldCheckPathArguments() {
        int status = run("", ignoreFile.toString(), "debug.log", "keep.log", "Main.java");

        assertThat(status).isEqualTo(IgnoreCheckApplication.EXIT_OK);
        assertThat(stdout().lines()).containsExactly("ignored debug.log", "kept keep.log", "kept Main.java");
    }

    @Test
    void shouldReadPathsFromStdinWhenNoneGiven() {
        int status = run("a/b.log\n\nsrc/x.txt\n", ignoreFile.toString());

        assertThat(status).isEqualTo(IgnoreCheckApplication.EXIT_OK);
        assertThat(stdout().lines()).containsExactly("ignored a/b.log", "kept src/x.txt");
    }

    @Test
    void shouldDescribePredicates() {
        int status = run("", ignoreFile.toString(), "--describe");

        assertThat(status).isEqualTo(IgnoreCheckApplication.EXIT_OK);
        assertThat(stdout().lines()).hasSize(8).first().isEqualTo("(?exclude)^keep\\.log$");
    }

    @Test
    void shouldExplainDecision() {
        run("", ignoreFile.toString(), "--explain", "keep.log", "notes.txt");

        assertThat(stdout().lines()).containsExactly(
                "kept keep.log\t#0 (?exclude)^keep\\.log$",
                "kept notes.txt\t(no match)");
    }

    @Test
    void shouldReportUsageErrors() {
        assertThat(run("")).isEqualTo(IgnoreCheckApplication.EXIT_USAGE);
        assertThat(run("", "--bogus", ignoreFile.toString())).isEqualTo(IgnoreCheckApplication.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("usage: ignore-check");
    }

    @Test
    void shouldReportLoadFailure() throws Exception {
        Files.writeString(ignoreFile, "#include nowhere.ignore\n");

        int status = run("", ignoreFile.toString(), "x");

        assertThat(status).isEqualTo(IgnoreCheckApplication.EXIT_LOAD_FAILED);
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("error: Cannot read ignore file");
        assertThat(stdout()).isEmpty();
    }
}
