package org.dxworks.sqlportability.analyzer.dialect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in function table of one dialect.
 * <p>
 * {@code functions} maps the names a dialect's parser accepts to an implementation
 * key shared across dialects (for instance Spark's {@code COLLECT_LIST} and DuckDB's
 * {@code LIST} both map to {@code ARRAY_AGG}). {@code renderings} says how the
 * dialect writes an implementation back out: a plain function name, or a template
 * using {@code {0}}, {@code {1}}, ... and {@code {args}}. Keys without a rendering
 * are written under their own name. Keys listed as unsupported cannot be written
 * at all.
 */
public final class FunctionCatalog {

    private final String dialect;
    private final Map<String, String> functions;
    private final Map<String, String> renderings;
    private final Set<String> unsupported;

    private FunctionCatalog(String dialect,
                            Map<String, String> functions,
                            Map<String, String> renderings,
                            Set<String> unsupported) {
        this.dialect = dialect;
        this.functions = Collections.unmodifiableMap(functions);
        this.renderings = Collections.unmodifiableMap(renderings);
        this.unsupported = Collections.unmodifiableSet(unsupported);
    }

    public String getDialect() {
        return dialect;
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public Optional<String> implementationOf(String functionName) {
        if (functionName == null) return Optional.empty();
        return Optional.ofNullable(functions.get(functionName.toUpperCase(Locale.ROOT)));
    }

    public boolean isUnsupported(String implementation) {
        return unsupported.contains(implementation);
    }

    /**
     * @return the name or template this dialect writes the implementation with
     */
    public String renderingOf(String implementation) {
        return renderings.getOrDefault(implementation, implementation);
    }

    /**
     * Implementation key together with how this dialect writes it. Two dialects
     * agree on a function name only when these are equal.
     */
    public Optional<String> identityOf(String functionName) {
        return implementationOf(functionName).map(impl ->
                impl + " -> " + (isUnsupported(impl) ? "<unsupported>" : renderingOf(impl)));
    }

    static FunctionCatalog empty(String dialect) {
        return new FunctionCatalog(dialect, new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashSet<>());
    }

    /**
     * Layers a catalog file over its parent. Child entries win; {@code removed}
     * drops inherited names and {@code unsupported} drops inherited renderings.
     */
    static FunctionCatalog extend(FunctionCatalog parent, String dialect, CatalogFile file) {
        Map<String, String> functions = new LinkedHashMap<>(parent.functions);
        Map<String, String> renderings = new LinkedHashMap<>(parent.renderings);
        Set<String> unsupported = new LinkedHashSet<>(parent.unsupported);

        for (String name : safeList(file.removed)) {
            functions.remove(name.toUpperCase(Locale.ROOT));
        }
        if (file.functions != null) {
            file.functions.forEach((name, impl) ->
                    functions.put(name.toUpperCase(Locale.ROOT), impl.toUpperCase(Locale.ROOT)));
        }
        if (file.renderings != null) {
            file.renderings.forEach((impl, rendering) -> {
                String key = impl.toUpperCase(Locale.ROOT);
                renderings.put(key, rendering);
                unsupported.remove(key);
            });
        }
        for (String impl : safeList(file.unsupported)) {
            String key = impl.toUpperCase(Locale.ROOT);
            unsupported.add(key);
            renderings.remove(key);
        }

        return new FunctionCatalog(dialect, functions, renderings, unsupported);
    }

    private static List<String> safeList(List<String> list) {
        return list == null ? List.of() : list;
    }

    /** YAML shape of {@code dialects/<name>.yml}. */
    static class CatalogFile {
        @JsonProperty("extends")
        public String parent;
        public Map<String, String> functions;
        public Map<String, String> renderings;
        public List<String> unsupported;
        public List<String> removed;
    }
}
