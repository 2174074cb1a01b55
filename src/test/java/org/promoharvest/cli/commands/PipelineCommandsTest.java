package org.promoharvest.cli.commands;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.cli.config.LoggingConfigurator;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the subcommands against a configuration file in a temporary data directory.
 * Command execution reloads the Logback configuration, so the log watch extension is not used here.
 */
@Tag("integration")
class PipelineCommandsTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private Path configFile;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/products/", exchange -> {
            String id = exchange.getRequestURI().getPath().substring("/products/".length());
            byte[] body = ("{\"product_id\":\"" + id + "\",\"name\":\"Product " + id + "\"}")
                .getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();

        String dataDir = tempDir.toString().replace("\\", "/");
        configFile = tempDir.resolve("promoharvest.conf");
        Files.writeString(configFile, String.format("""
            pipeline {
              dataDirectory = "%s"
              resources.fetcher.options.urlTemplate = "http://127.0.0.1:%d/products/{identity}"
              resources.batcher.options.batchSize = 2
              ingest.options {
                minDelayMs = 0
                maxPerMinute = 600
                retryDelayMs = 10
                shutdownGraceSeconds = 5
              }
            }
            logging.format = "PLAIN"
            """, dataDir, server.getAddress().getPort()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @AfterAll
    static void restoreTestLogging() throws Exception {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(PipelineCommandsTest.class.getClassLoader().getResource("logback-test.xml"));
    }

    @Test
    void ingest_fetchesBacklogAndMergesIntoLog() throws Exception {
        // Given
        Files.write(tempDir.resolve("links.jsonl"), List.of("{\"id\":\"a\"}", "{\"id\":\"b\"}", "{\"id\":\"c\"}"));

        // When
        int exitCode = execute("ingest");

        // Then
        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("completed: 3 fetched, 0 failed");
        assertThat(JsonLinesCodec.readAll(tempDir.resolve("records.jsonl")))
            .extracting(r -> r.get("product_id")).containsExactly("a", "b", "c");
        assertThat(tempDir.resolve("records.jsonl.lock")).doesNotExist();
        assertThat(tempDir.resolve("records.jsonl.resume")).doesNotExist();
    }

    @Test
    void ingest_refusesToRunWhileLocked() throws Exception {
        Files.write(tempDir.resolve("links.jsonl"), List.of("{\"id\":\"a\"}"));
        Files.writeString(tempDir.resolve("records.jsonl.lock"), "4242\n");

        int exitCode = execute("ingest");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("PID 4242");
        assertThat(tempDir.resolve("records.jsonl")).doesNotExist();
    }

    @Test
    void ingest_reportsMissingBacklogAsFailure() {
        int exitCode = execute("ingest");

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("records.jsonl.lock")).doesNotExist();
    }

    @Test
    void repair_cleansGivenLog() throws Exception {
        // Given
        Path log = tempDir.resolve("other.jsonl");
        Files.write(log, List.of(
            "{\"product_id\":\"a\",\"name\":\"A\"}",
            "{\"product_id\":\"a\",\"name\":\"A again\"}",
            "{\"product_id\":\"b\",\"na",
            "{\"product_id\":\"c\",\"name\":\"C\"}"));

        // When
        int exitCode = execute("repair", "--no-backup", log.toString());

        // Then
        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("1 invalid, 1 duplicates, 2 kept").contains("Log rewritten");
        assertThat(JsonLinesCodec.readAll(log)).extracting(r -> r.get("name")).containsExactly("A", "C");
        assertThat(tempDir.resolve("other.jsonl.bak")).doesNotExist();
    }

    @Test
    void merge_foldsBatchFilesIntoLog() throws Exception {
        Path batches = Files.createDirectories(tempDir.resolve("batches"));
        Files.write(batches.resolve("batch_20240301T120000Z_000001.jsonl"), List.of(
            "{\"product_id\":\"a\",\"name\":\"A\"}",
            "{\"product_id\":\"b\",\"name\":\"B\"}"));

        int exitCode = execute("merge");

        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(out.toString()).contains("Merged 1 batch files").contains("2 records written");
        assertThat(JsonLinesCodec.readAll(tempDir.resolve("records.jsonl"))).hasSize(2);
    }

    @Test
    void status_describesEmptyDataDirectory() {
        int exitCode = execute("status");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("(missing)")
            .contains("Status: no run recorded")
            .contains("Failed identities: 0");
    }

    @Test
    void missingConfigFile_exitsWithError() {
        int exitCode = CommandLineInterface.newCommandLine()
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err))
            .execute("-c", tempDir.resolve("absent.conf").toString(), "status");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Configuration file not found");
    }

    private int execute(String... args) {
        CommandLine cmd = CommandLineInterface.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        String[] full = new String[args.length + 2];
        full[0] = "-c";
        full[1] = configFile.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cmd.execute(full);
    }
}
