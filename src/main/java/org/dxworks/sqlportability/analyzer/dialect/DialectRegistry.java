package org.dxworks.sqlportability.analyzer.dialect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of the bundled dialect profiles, keyed by canonical dialect name.
 * Catalogs are read from {@code dialects/<name>.yml} on the classpath; a catalog
 * without an {@code extends} entry inherits from {@code base}.
 */
public final class DialectRegistry {

    private static final String CATALOG_DIR = "/dialects/";
    private static final String BASE_CATALOG = "base";

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();
    private static final Map<String, DialectProfile> PROFILES = new LinkedHashMap<>();

    static {
        ALIASES.put("postgres", "postgres");
        ALIASES.put("postgresql", "postgres");
        ALIASES.put("snowflake", "snowflake");
        ALIASES.put("bigquery", "bigquery");
        ALIASES.put("spark", "spark");
        ALIASES.put("databricks", "databricks");
        ALIASES.put("redshift", "redshift");
        ALIASES.put("duckdb", "duckdb");
        ALIASES.put("trino", "trino");
        ALIASES.put("presto", "presto");

        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        Map<String, FunctionCatalog> loaded = new LinkedHashMap<>();
        try {
            for (String dialect : ALIASES.values()) {
                if (!PROFILES.containsKey(dialect)) {
                    FunctionCatalog catalog = loadCatalog(yamlMapper, dialect, loaded);
                    PROFILES.put(dialect, new CatalogDialectProfile(dialect, catalog));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load dialect catalogs", e);
        }
    }

    private DialectRegistry() {
        // utility class
    }

    /**
     * Maps a user-facing dialect spelling to its canonical name. Unknown ids pass
     * through lower-cased.
     */
    public static String normalize(String dialectId) {
        String key = dialectId == null ? "" : dialectId.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }

    public static Optional<DialectProfile> find(String dialectId) {
        return Optional.ofNullable(PROFILES.get(normalize(dialectId)));
    }

    public static DialectProfile get(String dialectId) {
        return find(dialectId).orElseThrow(() -> new UnknownDialectException(normalize(dialectId)));
    }

    public static Set<String> knownDialects() {
        return Collections.unmodifiableSet(PROFILES.keySet());
    }

    private static FunctionCatalog loadCatalog(ObjectMapper yamlMapper,
                                               String dialect,
                                               Map<String, FunctionCatalog> loaded) throws IOException {
        FunctionCatalog cached = loaded.get(dialect);
        if (cached != null) {
            return cached;
        }

        FunctionCatalog.CatalogFile file;
        try (InputStream in = DialectRegistry.class.getResourceAsStream(CATALOG_DIR + dialect + ".yml")) {
            if (in == null) {
                throw new IOException("Missing catalog resource for dialect " + dialect);
            }
            file = yamlMapper.readValue(in, FunctionCatalog.CatalogFile.class);
        }
        if (file == null) {
            file = new FunctionCatalog.CatalogFile();
        }

        FunctionCatalog parent;
        if (BASE_CATALOG.equals(dialect)) {
            parent = FunctionCatalog.empty(dialect);
        } else {
            String parentName = file.parent != null ? file.parent : BASE_CATALOG;
            parent = loadCatalog(yamlMapper, parentName, loaded);
        }

        FunctionCatalog catalog = FunctionCatalog.extend(parent, dialect, file);
        loaded.put(dialect, catalog);
        return catalog;
    }
}
