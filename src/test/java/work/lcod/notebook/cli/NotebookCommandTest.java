package work.lcod.notebook.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class NotebookCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String NOTEBOOK = "# Databricks notebook source\nprint(1)\n\n# COMMAND ----------\n\n"
        + "# MAGIC %sql\n# MAGIC SELECT 1\n";

    @TempDir
    Path tempDir;

    private Path notebookFile;

    @BeforeEach
    void setUp() throws Exception {
        notebookFile = tempDir.resolve("etl.py");
        Files.writeString(notebookFile, NOTEBOOK);
    }

    @Test
    void parsePrintsJsonDocument() throws Exception {
        var result = run("", "parse", notebookFile.toString());
        assertEquals(0, result.exitCode(), result.err());
        JsonNode tree = JSON.readTree(result.out());
        assertEquals("SOURCE", tree.get("format").asText());
        assertEquals(2, tree.get("cells").size());
        assertEquals("sql", tree.get("cells").get(1).get("language").asText());
    }

    @Test
    void parseReadsStdinAndPrintsYaml() {
        var result = run(NOTEBOOK, "parse", "-", "--output", "yaml");
        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.out().contains("format: \"SOURCE\"") || result.out().contains("format: SOURCE"), result.out());
        assertTrue(result.out().contains("language: \"sql\"") || result.out().contains("language: sql"), result.out());
    }

    @Test
    void renderRebuildsSource() throws Exception {
        Path document = tempDir.resolve("cells.json");
        Files.writeString(document, "{\"cells\":[{\"content\":\"print(1)\"},{\"content\":\"# MAGIC %md\\n# MAGIC hi\",\"language\":\"md\"}]}");

        var result = run("", "render", document.toString());
        assertEquals(0, result.exitCode(), result.err());
        assertEquals(
            "# Databricks notebook source\nprint(1)\n\n# COMMAND ----------\n\n# MAGIC %md\n# MAGIC hi\n",
            result.out()
        );

        var headerless = run("", "render", "--no-header", document.toString());
        assertTrue(headerless.out().startsWith("print(1)\n"));
    }

    @Test
    void renderRejectsMalformedDocument() throws Exception {
        Path document = tempDir.resolve("cells.json");
        Files.writeString(document, "{\"cells\":3}");

        var result = run("", "render", document.toString());
        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("malformed_input"), result.err());
    }

    @Test
    void listShowsOneLinePerCell() {
        var result = run("", "cells", "list", notebookFile.toString());
        assertEquals(0, result.exitCode(), result.err());
        assertEquals("0\t-\tprint(1)\n1\tsql\t# MAGIC %sql\n", result.out().replace("\r\n", "\n"));
    }

    @Test
    void getPrintsCellContent() {
        var raw = run("", "cells", "get", notebookFile.toString(), "1");
        assertEquals("# MAGIC %sql\n# MAGIC SELECT 1", raw.out().strip());

        var unwrapped = run("", "cells", "get", notebookFile.toString(), "1", "--unwrap");
        assertEquals("SELECT 1", unwrapped.out().strip());
    }

    @Test
    void getOutOfRangeFails() {
        var result = run("", "cells", "get", notebookFile.toString(), "5");
        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("index_out_of_range"), result.err());
        assertTrue(result.err().contains("5"), result.err());
    }

    @Test
    void updateRewritesFile() throws Exception {
        var result = run("", "cells", "update", notebookFile.toString(), "0", "--content", "SELECT 2", "--language", "sql");
        assertEquals(0, result.exitCode(), result.err());
        JsonNode summary = JSON.readTree(result.out());
        assertEquals("update", summary.get("operation").asText());
        assertEquals(2, summary.get("cells").asInt());

        assertEquals(
            "# Databricks notebook source\n# MAGIC %sql\n# MAGIC SELECT 2\n\n# COMMAND ----------\n\n"
                + "# MAGIC %sql\n# MAGIC SELECT 1\n",
            Files.readString(notebookFile)
        );
    }

    @Test
    void updateWithoutContentFails() throws Exception {
        var result = run("", "cells", "update", notebookFile.toString(), "0");
        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("missing_content"), result.err());
        assertEquals(NOTEBOOK, Files.readString(notebookFile));
    }

    @Test
    void insertReadsContentFromFileAndPrintsToStdout() throws Exception {
        Path content = tempDir.resolve("cell.md");
        Files.writeString(content, "# Title\n");

        var result = run("", "cells", "insert", notebookFile.toString(), "0", "--content-file", content.toString(),
            "--language", "md", "--stdout");
        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.out().startsWith("# Databricks notebook source\n# MAGIC %md\n# MAGIC # Title\n\n# COMMAND ----------\n\nprint(1)"),
            result.out());
        assertEquals(NOTEBOOK, Files.readString(notebookFile));
    }

    @Test
    void insertAtEndAppends() throws Exception {
        var result = run("", "cells", "insert", notebookFile.toString(), "2", "-c", "display(df)");
        assertEquals(0, result.exitCode(), result.err());
        assertTrue(Files.readString(notebookFile).endsWith("# COMMAND ----------\n\ndisplay(df)\n"));
    }

    @Test
    void deleteRemovesCell() throws Exception {
        var result = run("", "cells", "delete", notebookFile.toString(), "0");
        assertEquals(0, result.exitCode(), result.err());
        assertEquals("# Databricks notebook source\n# MAGIC %sql\n# MAGIC SELECT 1\n", Files.readString(notebookFile));
    }

    @Test
    void editingStdinPrintsResult() {
        var result = run(NOTEBOOK, "cells", "delete", "-", "1");
        assertEquals(0, result.exitCode(), result.err());
        assertEquals("# Databricks notebook source\nprint(1)\n", result.out());
    }

    @Test
    void unknownLanguageFails() {
        var result = run("", "cells", "insert", notebookFile.toString(), "0", "-c", "x", "-l", "cobol");
        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("Unsupported language"), result.err());
    }

    @Test
    void missingFileIsUsageError() {
        var result = run("", "parse", tempDir.resolve("nope.py").toString());
        assertEquals(2, result.exitCode());
        assertTrue(result.err().contains("File not found"), result.err());
    }

    @Test
    void configSetThenShow() throws Exception {
        Path config = tempDir.resolve("config.toml");
        var set = run("", "--config", config.toString(), "config", "set", "--host", "https://ws.example", "--token", "dapi-secret-9876");
        assertEquals(0, set.exitCode(), set.err());
        assertTrue(Files.exists(config));

        var show = run("", "--config", config.toString(), "config", "show");
        assertEquals(0, show.exitCode(), show.err());
        JsonNode view = JSON.readTree(show.out());
        assertEquals("https://ws.example", view.get("host").asText());
        assertEquals("****9876", view.get("token").asText());
        assertTrue(view.get("complete").asBoolean());
        assertFalse(show.out().contains("dapi-secret"));
    }

    @Test
    void configSetRequiresAValue() {
        var result = run("", "--config", tempDir.resolve("c.toml").toString(), "config", "set");
        assertEquals(2, result.exitCode());
    }

    @Test
    void debugLogLevelWritesDiagnostics() {
        var result = run("", "--log-level", "debug", "parse", notebookFile.toString());
        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.err().contains("Parsed 2 cell(s)"), result.err());

        var quiet = run("", "parse", notebookFile.toString());
        assertEquals("", quiet.err());
    }

    @Test
    void deleteKeepsHeaderlessFileAndEmptyFirstCell() throws Exception {
        Path headerless = tempDir.resolve("nb.py");
        Files.writeString(headerless, "# COMMAND ----------\n\nfoo\n\n# COMMAND ----------\n\nbar\n");

        var result = run("", "cells", "delete", headerless.toString(), "2");
        assertEquals(0, result.exitCode(), result.err());
        assertEquals(2, JSON.readTree(result.out()).get("cells").asInt());

        String written = Files.readString(headerless);
        assertFalse(written.startsWith("# Databricks notebook source"), written);
        var list = run("", "cells", "list", headerless.toString());
        assertEquals("0\t-\t\n1\t-\tfoo\n", list.out());
    }

    @Test
    void headerlessFileStaysHeaderless() throws Exception {
        Path headerless = tempDir.resolve("plain.py");
        Files.writeString(headerless, "x = 1\n");

        var result = run("", "cells", "insert", headerless.toString(), "1", "-c", "y = 2");
        assertEquals(0, result.exitCode(), result.err());
        assertEquals("x = 1\n\n# COMMAND ----------\n\ny = 2\n", Files.readString(headerless));
    }

    @Test
    void insertRejectsDelimiterInContent() throws Exception {
        var result = run("", "cells", "insert", notebookFile.toString(), "0", "-c", "a\n# COMMAND ----------\nb");
        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("invalid_content"), result.err());
        assertEquals(NOTEBOOK, Files.readString(notebookFile));
    }

    @Test
    void versionFallsBackOutsideJar() {
        var result = run("", "--version");
        assertEquals(0, result.exitCode());
        assertEquals("nbsource (java) development", result.out().strip());
    }

    private Result run(String stdin, String... args) {
        var command = new NotebookCommand(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), Map.of());
        var out = new StringWriter();
        var err = new StringWriter();
        var commandLine = new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    private record Result(int exitCode, String out, String err) {}
}
