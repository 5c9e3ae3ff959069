package org.dxworks.sqlportability.analyzer.macro;

import org.dxworks.sqlportability.PortabilityConfig;
import org.dxworks.sqlportability.analyzer.dialect.DialectProfile;
import org.dxworks.sqlportability.analyzer.dialect.DialectRegistry;
import org.dxworks.sqlportability.analyzer.dialect.FunctionCatalog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes the dbt macro library the rewritten models call into: one
 * {@code portable_<name>} dispatcher per function plus a {@code default__<name>}
 * and a {@code <dialect>__<name>} implementation for every configured dialect.
 */
public final class MacroGenerator {

    private static final String HEADER =
            "{# Generated by sql-portability. Changes are overwritten on the next run. #}\n";

    private static final Pattern TEMPLATE_SLOT = Pattern.compile("\\{(\\d+|args)}");

    private MacroGenerator() {
        // utility class
    }

    /**
     * Writes the library to the configured macro output.
     *
     * @return the output path; nothing is written for an empty name list
     */
    public static Path generate(PortabilityConfig config, List<String> functionNames) throws IOException {
        Path output = config.getMacroOutput();
        if (functionNames.isEmpty()) {
            return output;
        }

        String content = render(config.getAdapters(), functionNames);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, content, StandardCharsets.UTF_8);
        return output;
    }

    public static String render(List<String> dialects, List<String> functionNames) {
        Set<String> targets = new LinkedHashSet<>();
        for (String dialect : dialects) {
            targets.add(DialectRegistry.normalize(dialect));
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : functionNames) {
            names.add(name.toUpperCase(Locale.ROOT));
        }

        StringBuilder sb = new StringBuilder(HEADER);
        for (String name : names) {
            String implementation = implementationOf(name, targets);
            sb.append('\n');
            appendDispatcher(sb, name);
            sb.append('\n');
            appendMacro(sb, "default__" + MacroNaming.dispatchName(name), name + "({{ args }})");
            for (String dialect : targets) {
                sb.append('\n');
                appendMacro(sb, MacroNaming.adapterMacroName(dialect, name), bodyFor(dialect, name, implementation));
            }
        }
        return sb.toString();
    }

    private static void appendDispatcher(StringBuilder sb, String name) {
        sb.append("{% macro ").append(MacroNaming.portableMacroName(name)).append("(args) %}\n")
          .append("    {{ return(adapter.dispatch('").append(MacroNaming.dispatchName(name))
          .append("', '").append(MacroNaming.MACRO_NAMESPACE).append("')(args)) }}\n")
          .append("{% endmacro %}\n");
    }

    private static void appendMacro(StringBuilder sb, String macroName, String body) {
        sb.append("{% macro ").append(macroName).append("(args) %}\n")
          .append("    ").append(body).append('\n')
          .append("{% endmacro %}\n");
    }

    /**
     * Implementation key of {@code name} in the first configured catalog that knows it.
     */
    private static String implementationOf(String name, Set<String> dialects) {
        for (String dialect : dialects) {
            Optional<DialectProfile> profile = DialectRegistry.find(dialect);
            if (profile.isPresent()) {
                Optional<String> impl = profile.get().catalog().implementationOf(name);
                if (impl.isPresent()) {
                    return impl.get();
                }
            }
        }
        return name;
    }

    private static String bodyFor(String dialect, String name, String implementation) {
        Optional<DialectProfile> profile = DialectRegistry.find(dialect);
        if (profile.isEmpty()) {
            return name + "({{ args }})";
        }

        FunctionCatalog catalog = profile.get().catalog();
        if (catalog.isUnsupported(implementation)) {
            return "{{ exceptions.raise_compiler_error(\"" + name + " is not supported on " + dialect + "\") }}";
        }

        String rendering = catalog.renderingOf(implementation);
        if (!TEMPLATE_SLOT.matcher(rendering).find()) {
            return rendering + "({{ args }})";
        }
        return "{%- set parts = args.split(',') -%}" + fillTemplate(rendering);
    }

    private static String fillTemplate(String template) {
        Matcher m = TEMPLATE_SLOT.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String slot = m.group(1);
            String value = "args".equals(slot) ? "{{ args }}" : "{{ parts[" + slot + "] | trim }}";
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
