package org.dxworks.sqlportability.analyzer.scan;

import net.sf.jsqlparser.statement.Statement;
import org.dxworks.sqlportability.PortabilityConfig;
import org.dxworks.sqlportability.SqlFileCollector;
import org.dxworks.sqlportability.analyzer.dialect.DialectOracle;
import org.dxworks.sqlportability.analyzer.dialect.DialectProfile;
import org.dxworks.sqlportability.analyzer.dialect.DialectRegistry;
import org.dxworks.sqlportability.analyzer.rewrite.FunctionCallCollector;
import org.dxworks.sqlportability.analyzer.template.TemplateClassifier;
import org.dxworks.sqlportability.model.rewrite.FunctionCandidate;
import org.dxworks.sqlportability.model.template.MaskedSpan;
import org.dxworks.sqlportability.model.template.Region;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts, across a project's models, the calls to functions whose catalogs differ
 * between the configured dialects.
 */
public final class ProjectScanner {

    private ProjectScanner() {
        // utility class
    }

    public static SortedMap<String, Integer> scanProject(PortabilityConfig config) {
        if (!config.isScanProject()) {
            return new TreeMap<>();
        }
        return scan(config.getModelPaths(), config.getAdapters());
    }

    /**
     * Tallies function names under the primary (first) dialect, keeping only the
     * names {@link DialectOracle#catalogDifferences} reports.
     */
    public static SortedMap<String, Integer> scan(List<Path> modelRoots, List<String> dialects) {
        SortedMap<String, Integer> result = new TreeMap<>();
        if (dialects.isEmpty()) {
            return result;
        }
        Optional<DialectProfile> primary = DialectRegistry.find(dialects.get(0));
        if (primary.isEmpty()) {
            return result;
        }

        List<Path> files = SqlFileCollector.collect(modelRoots);
        ConcurrentMap<String, Integer> tally = new ConcurrentHashMap<>();
        files.parallelStream().forEach(file -> {
            for (String name : functionNamesIn(file, primary.get())) {
                tally.merge(name, 1, Integer::sum);
            }
        });

        Set<String> differing = DialectOracle.catalogDifferences(dialects);
        tally.forEach((name, count) -> {
            if (differing.contains(name)) {
                result.put(name, count);
            }
        });
        return result;
    }

    static List<String> functionNamesIn(Path file, DialectProfile primary) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return List.of();
        }
        return functionNamesIn(content, primary);
    }

    static List<String> functionNamesIn(String content, DialectProfile primary) {
        List<Region> regions = TemplateClassifier.classify(content);
        if (!TemplateClassifier.canSafelyRewrite(regions).canRewrite) {
            return List.of();
        }

        List<String> names = new ArrayList<>();
        for (MaskedSpan span : TemplateClassifier.extractMaskedSpans(regions)) {
            List<Statement> statements;
            try {
                statements = primary.parse(span.maskedText);
            } catch (Exception e) {
                continue;
            }
            for (FunctionCandidate candidate : FunctionCallCollector.collect(statements, primary)) {
                names.add(candidate.renderedName);
            }
        }
        return names;
    }
}
