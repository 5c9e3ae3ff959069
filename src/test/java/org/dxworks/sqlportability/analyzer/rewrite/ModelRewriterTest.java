package org.dxworks.sqlportability.analyzer.rewrite;

import org.dxworks.sqlportability.PortabilityConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModelRewriterTest {

    private static final Path MODELS = Paths.get("src/test/resources/models");
    private static final List<String> SPARK_DUCKDB = List.of("spark", "duckdb");

    @TempDir
    Path tmp;

    @Test
    void rewriteText_collectListScenario() {
        String out = ModelRewriter.rewriteText("SELECT COLLECT_LIST(col) FROM t", SPARK_DUCKDB, "spark");

        assertEquals("SELECT {{ portable_collect_list('col') }} FROM t", out);
        assertTrue(out.contains("portable_collect_list("));
        assertFalse(out.contains("COLLECT_LIST("));
    }

    @Test
    void rewriteText_lowerCaseSourceKeepsSurroundingText() {
        String out = ModelRewriter.rewriteText("select collect_list(col) as l from t", SPARK_DUCKDB, "spark");

        assertEquals("select {{ portable_collect_list('col') }} as l from t", out);
    }

    @Test
    void rewriteText_preservesControlFlow() {
        String source = "SELECT {% if x %} COLLECT_LIST(a) {% endif %} FROM t";
        String out = ModelRewriter.rewriteText(source, SPARK_DUCKDB, "spark");

        assertEquals("SELECT {% if x %} {{ portable_collect_list('a') }} {% endif %} FROM t", out);
    }

    @Test
    void rewriteText_windowedCallKeepsItsWindow() {
        String out = ModelRewriter.rewriteText(
                "SELECT COLLECT_LIST(col) OVER (PARTITION BY id) AS l FROM t", SPARK_DUCKDB, "spark");

        assertEquals("SELECT {{ portable_collect_list('col') }} OVER (PARTITION BY id) AS l FROM t", out);
    }

    @Test
    void rewriteText_callInsideSubquery() {
        String out = ModelRewriter.rewriteText(
                "SELECT id FROM t WHERE id IN (SELECT COLLECT_LIST(x) FROM u)", SPARK_DUCKDB, "spark");

        assertEquals("SELECT id FROM t WHERE id IN (SELECT {{ portable_collect_list('x') }} FROM u)", out);
    }

    @Test
    void rewriteText_rewrittenOutputIsVetoedOnTheNextPass() {
        String once = ModelRewriter.rewriteText("SELECT COLLECT_LIST(a), COLLECT_SET(b) FROM t", SPARK_DUCKDB, "spark");

        assertEquals("SELECT {{ portable_collect_list('a') }}, {{ portable_collect_set('b') }} FROM t", once);
        assertEquals(once, ModelRewriter.rewriteText(once, SPARK_DUCKDB, "spark"));
    }

    @Test
    void rewriteText_uniformAggregatesAreNeverRewritten() {
        // an unknown dialect makes every rendering fail, so only the eligibility rules keep these
        String source = "SELECT COUNT(*), COUNT() FROM t";

        assertEquals(source, ModelRewriter.rewriteText(source, List.of("spark", "mydb"), "spark"));
        assertEquals("SELECT COUNT(*) FROM t",
                ModelRewriter.rewriteText("SELECT COUNT(*) FROM t", SPARK_DUCKDB, "spark"));
    }

    @Test
    void rewriteText_isIdempotent() throws Exception {
        for (String model : List.of("order_items_rollup.sql", "tagged_products.sql", "already_portable.sql")) {
            String source = Files.readString(MODELS.resolve(model), StandardCharsets.UTF_8);
            String once = ModelRewriter.rewriteText(source, SPARK_DUCKDB, "spark");
            String twice = ModelRewriter.rewriteText(once, SPARK_DUCKDB, "spark");
            assertEquals(once, twice, model);
        }
    }

    @Test
    void rewriteText_unknownPrimaryLeavesTextAlone() {
        String source = "SELECT COLLECT_LIST(col) FROM t";

        assertEquals(source, ModelRewriter.rewriteText(source, List.of("mydb", "spark"), "mydb"));
    }

    @Test
    void rewriteFile_rollupModel() throws Exception {
        Path file = copy("order_items_rollup.sql");

        assertTrue(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));

        String out = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(out.startsWith("{{ config(materialized='table') }}\n"));
        assertTrue(out.contains("    {{ portable_collect_list('product_id') }} AS product_ids,\n"));
        assertTrue(out.contains("    {{ portable_collect_set('category') }} AS categories,\n"));
        assertTrue(out.contains("SUM(quantity) AS total_items"));
        assertTrue(out.contains("COUNT(*) AS line_count"));
        assertTrue(out.contains("FROM {{ ref('raw_order_items') }}"));
        assertFalse(out.contains("COLLECT_LIST("));
    }

    @Test
    void rewriteFile_controlFlowModel() throws Exception {
        Path file = copy("tagged_products.sql");

        assertTrue(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));

        String out = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(out.contains("{% if var('include_tags', true) %}"));
        assertTrue(out.contains("{% endif %}"));
        assertTrue(out.contains("{{ portable_collect_list('tag_name') }} AS tags,"));
    }

    @Test
    void rewriteFile_plainSelectIsNotModified() throws Exception {
        Path file = copy("users.sql");
        String before = Files.readString(file, StandardCharsets.UTF_8);

        assertFalse(ModelRewriter.rewriteFile(file, List.of("postgres", "snowflake"), "postgres", false));
        assertEquals(before, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void rewriteFile_unsafeTemplateIsLeftByteIdentical() throws Exception {
        Path file = copy("custom_macro.sql");
        byte[] before = Files.readAllBytes(file);

        assertFalse(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void rewriteFile_modelCallingPortableMacrosIsLeftByteIdentical() throws Exception {
        Path file = copy("already_portable.sql");
        byte[] before = Files.readAllBytes(file);

        assertFalse(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void rewriteFile_dryRunDoesNotWrite() throws Exception {
        Path file = copy("order_items_rollup.sql");
        byte[] before = Files.readAllBytes(file);

        assertTrue(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", true));
        assertArrayEquals(before, Files.readAllBytes(file));

        assertTrue(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));
        assertFalse(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", true));
    }

    @Test
    void rewriteFile_missingAndEmptyFiles() throws Exception {
        assertFalse(ModelRewriter.rewriteFile(tmp.resolve("missing.sql"), SPARK_DUCKDB, "spark", false));

        Path empty = Files.writeString(tmp.resolve("empty.sql"), "");
        assertFalse(ModelRewriter.rewriteFile(empty, SPARK_DUCKDB, "spark", false));
    }

    @Test
    void rewriteFile_unparsableSqlIsSkipped() throws Exception {
        Path file = Files.writeString(tmp.resolve("broken.sql"), "SELECT COLLECT_LIST(a FROM");

        assertFalse(ModelRewriter.rewriteFile(file, SPARK_DUCKDB, "spark", false));
    }

    @Test
    void rewriteModels_reportsChangedFiles() throws Exception {
        Path models = Files.createDirectories(tmp.resolve("models").resolve("marts"));
        for (String model : List.of("order_items_rollup.sql", "tagged_products.sql", "users.sql",
                "custom_macro.sql", "already_portable.sql")) {
            Files.copy(MODELS.resolve(model), models.resolve(model));
        }
        PortabilityConfig config = PortabilityConfig.with(
                SPARK_DUCKDB,
                tmp.resolve("macros/portable_functions.sql"),
                true,
                List.of(tmp.resolve("models")),
                tmp);

        List<Path> changed = ModelRewriter.rewriteModels(config, false);

        assertEquals(2, changed.size());
        assertTrue(changed.contains(models.resolve("order_items_rollup.sql")));
        assertTrue(changed.contains(models.resolve("tagged_products.sql")));
        assertTrue(ModelRewriter.rewriteModels(config, false).isEmpty());
    }

    private Path copy(String model) throws Exception {
        Path target = tmp.resolve(model);
        Files.copy(MODELS.resolve(model), target);
        return target;
    }
}
