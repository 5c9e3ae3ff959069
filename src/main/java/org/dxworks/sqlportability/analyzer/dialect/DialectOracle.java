package org.dxworks.sqlportability.analyzer.dialect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides whether a function behaves the same under every configured dialect.
 */
public final class DialectOracle {

    private DialectOracle() {
        // utility class
    }

    /**
     * Renders the call under each dialect. Any rendering failure counts as a
     * difference.
     */
    public static boolean functionDiffers(FunctionCall call, List<DialectProfile> dialects) {
        Set<String> renderings = new HashSet<>();
        for (DialectProfile dialect : dialects) {
            try {
                renderings.add(dialect.render(call));
            } catch (UnsupportedFunctionException | RuntimeException e) {
                return true;
            }
        }
        return renderings.size() > 1;
    }

    public static boolean functionDiffersAcross(FunctionCall call, List<String> dialectIds) {
        List<DialectProfile> profiles = new ArrayList<>();
        for (String id : dialectIds) {
            Optional<DialectProfile> profile = DialectRegistry.find(id);
            if (profile.isEmpty()) {
                return true;
            }
            profiles.add(profile.get());
        }
        return functionDiffers(call, profiles);
    }

    /**
     * Function names, across the catalogs of the given dialects, whose
     * implementation or rendering is not the same everywhere, or that some
     * dialect lacks.
     * A dialect without a bundled catalog knows no functions.
     */
    public static SortedSet<String> catalogDifferences(List<String> dialectIds) {
        List<FunctionCatalog> catalogs = new ArrayList<>();
        Set<String> allNames = new TreeSet<>();
        for (String id : dialectIds) {
            String dialect = DialectRegistry.normalize(id);
            FunctionCatalog catalog = DialectRegistry.find(dialect)
                    .map(DialectProfile::catalog)
                    .orElseGet(() -> FunctionCatalog.empty(dialect));
            catalogs.add(catalog);
            allNames.addAll(catalog.functionNames());
        }

        SortedSet<String> differing = new TreeSet<>();
        for (String name : allNames) {
            Set<String> implementations = new HashSet<>();
            int present = 0;
            for (FunctionCatalog catalog : catalogs) {
                Optional<String> identity = catalog.identityOf(name);
                if (identity.isPresent()) {
                    implementations.add(identity.get());
                    present++;
                }
            }
            if (implementations.size() > 1 || present < catalogs.size()) {
                differing.add(name);
            }
        }
        return differing;
    }
}
