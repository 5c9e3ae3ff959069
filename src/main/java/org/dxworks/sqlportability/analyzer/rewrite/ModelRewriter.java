package org.dxworks.sqlportability.analyzer.rewrite;

import net.sf.jsqlparser.statement.Statement;
import org.dxworks.sqlportability.PortabilityConfig;
import org.dxworks.sqlportability.SqlFileCollector;
import org.dxworks.sqlportability.analyzer.dialect.DialectProfile;
import org.dxworks.sqlportability.analyzer.dialect.DialectRegistry;
import org.dxworks.sqlportability.analyzer.template.TemplateClassifier;
import org.dxworks.sqlportability.model.rewrite.FunctionCandidate;
import org.dxworks.sqlportability.model.rewrite.RewriteDirective;
import org.dxworks.sqlportability.model.template.MaskedSpan;
import org.dxworks.sqlportability.model.template.Region;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rewrites templated SQL models so that calls whose spelling differs between the
 * configured dialects go through {@code portable_*} dispatch macros.
 * <p>
 * Files the classifier marks unsafe are never touched. Spans that do not parse
 * are left as they are. Running the rewriter on its own output changes nothing.
 */
public final class ModelRewriter {

    private ModelRewriter() {
        // utility class
    }

    /**
     * @return true when the file's text changes, whether or not it was written
     */
    public static boolean rewriteFile(Path path, List<String> dialects, String primaryDialect, boolean dryRun) {
        String original;
        try {
            original = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return false;
        }
        if (original.isEmpty()) {
            return false;
        }

        String rewritten = rewriteText(original, dialects, primaryDialect);
        if (rewritten.equals(original)) {
            return false;
        }
        if (!dryRun) {
            return write(path, rewritten);
        }
        return true;
    }

    /**
     * Rewrites every model under the configured model paths, in parallel.
     *
     * @return the files that changed (or would change in a dry run), in no particular order
     */
    public static List<Path> rewriteModels(PortabilityConfig config, boolean dryRun) {
        List<Path> files = SqlFileCollector.collect(config.getModelPaths());
        List<String> dialects = config.getAdapters();
        String primary = config.getPrimaryAdapter();

        return files.parallelStream()
                .filter(file -> rewriteFile(file, dialects, primary, dryRun))
                .collect(Collectors.toList());
    }

    public static String rewriteText(String source, List<String> dialects, String primaryDialect) {
        List<Region> regions = TemplateClassifier.classify(source);
        if (!TemplateClassifier.canSafelyRewrite(regions).canRewrite) {
            return source;
        }

        Optional<DialectProfile> primary = DialectRegistry.find(primaryDialect);
        if (primary.isEmpty()) {
            return source;
        }

        RewriteState state = RewriteState.of(source);
        for (MaskedSpan span : TemplateClassifier.extractMaskedSpans(regions)) {
            state = SpanRewriter.rewriteSpan(state, span, directivesFor(span, dialects, primary.get()));
        }
        return state.text;
    }

    static List<RewriteDirective> directivesFor(MaskedSpan span, List<String> dialects, DialectProfile primary) {
        List<Statement> statements;
        try {
            statements = primary.parse(span.maskedText);
        } catch (Exception e) {
            return List.of();
        }

        List<RewriteDirective> directives = new ArrayList<>();
        for (FunctionCandidate candidate : FunctionCallCollector.collect(statements, primary)) {
            if (!RewriteFilters.isMeaningfullyRewritable(candidate)) continue;
            if (!RewriteFilters.differsAcrossDialects(candidate, dialects)) continue;

            directives.add(new RewriteDirective(
                    candidate.renderedText,
                    MacroCallBuilder.build(candidate.renderedName, candidate.renderedText)));
        }
        return directives;
    }

    private static boolean write(Path path, String content) {
        Path dir = path.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("[ModelRewriter] Failed to write " + path + ": " + e.getMessage());
            }
            deleteQuietly(tmp);
            return false;
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            System.err.println("[ModelRewriter] Failed to remove temporary file " + tmp + ": " + e.getMessage());
        }
    }
}
