package org.dxworks.sqlportability.analyzer.template;

import org.dxworks.sqlportability.model.template.MaskedSpan;
import org.dxworks.sqlportability.model.template.Region;
import org.dxworks.sqlportability.model.template.RegionKind;
import org.dxworks.sqlportability.model.template.SafetyVerdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits a templated SQL source into typed regions and decides whether the
 * source can be rewritten.
 * <p>
 * Expressions ({@code {{ }}}) are safe only when they call one of the built-in
 * accessors; blocks ({@code {% %}}) are accepted
 * when they are structural control flow. Anything else, or a source the lexer
 * rejects, is unsafe and vetoes rewriting for the whole file.
 */
public final class TemplateClassifier {

    static final Set<String> SAFE_FUNCTIONS = Set.of(
            "ref", "source", "var", "config", "this", "target", "env_var");

    static final Set<String> CONTROL_FLOW_KEYWORDS = Set.of(
            "if", "elif", "else", "endif",
            "for", "endfor",
            "block", "endblock",
            "macro", "endmacro",
            "set", "endset");

    public static final String EXPRESSION_PLACEHOLDER = " __PLACEHOLDER__ ";
    public static final String BLOCK_PLACEHOLDER = " __JINJA__, ";

    private TemplateClassifier() {
        // utility class
    }

    public static List<Region> classify(String source) {
        String text = source == null ? "" : source;

        List<TemplateToken> tokens;
        try {
            tokens = TemplateLexer.tokenize(text);
        } catch (TemplateSyntaxException e) {
            List<Region> unsafe = new ArrayList<>();
            unsafe.add(new Region(0, RegionKind.UNSAFE, text));
            return unsafe;
        }

        List<Region> regions = processTokenStream(tokens);
        if (regions.isEmpty() && !text.isEmpty()) {
            regions.add(new Region(0, RegionKind.STATIC, text));
        }
        return regions;
    }

    public static SafetyVerdict canSafelyRewrite(List<Region> regions) {
        // control flow is masked as an opaque placeholder, so only unsafe regions veto
        for (Region region : regions) {
            if (region.kind == RegionKind.UNSAFE) {
                return new SafetyVerdict(false, "Template contains complex Jinja expressions");
            }
        }
        return new SafetyVerdict(true, "Template is safe to rewrite");
    }

    public static List<MaskedSpan> extractMaskedSpans(List<Region> regions) {
        StringBuilder masked = new StringBuilder();
        int sourceLength = 0;
        for (Region region : regions) {
            masked.append(mask(region));
            sourceLength = Math.max(sourceLength, region.end);
        }

        List<MaskedSpan> spans = new ArrayList<>();
        if (!masked.toString().isBlank()) {
            spans.add(new MaskedSpan(0, sourceLength, masked.toString()));
        }
        return spans;
    }

    private static String mask(Region region) {
        return switch (region.kind) {
            case STATIC -> region.content;
            case SAFE_EXPRESSION -> EXPRESSION_PLACEHOLDER;
            case CONTROL_FLOW, UNSAFE -> BLOCK_PLACEHOLDER;
        };
    }

    private static List<Region> processTokenStream(List<TemplateToken> tokens) {
        List<Region> regions = new ArrayList<>();
        int pos = 0;
        int index = 0;

        while (index < tokens.size()) {
            TemplateToken token = tokens.get(index);

            if (token.type == TemplateTokenType.DATA) {
                regions.add(new Region(pos, RegionKind.STATIC, token.value));
                pos += token.value.length();
                index++;
            } else if (token.type.isUnitOpener()) {
                int next = endOfUnit(tokens, index);
                List<TemplateToken> unit = tokens.subList(index, next);
                String content = join(unit);
                regions.add(new Region(pos, classifyUnit(token.type, unit), content));
                pos += content.length();
                index = next;
            } else {
                pos += token.value.length();
                index++;
            }
        }
        return regions;
    }

    private static int endOfUnit(List<TemplateToken> tokens, int opener) {
        int i = opener;
        while (i < tokens.size()) {
            TemplateToken token = tokens.get(i++);
            if (token.type.isUnitCloser()) {
                break;
            }
        }
        return i;
    }

    private static RegionKind classifyUnit(TemplateTokenType opener, List<TemplateToken> unit) {
        if (opener == TemplateTokenType.COMMENT_BEGIN) {
            return RegionKind.CONTROL_FLOW;
        }
        String name = firstName(unit);
        if (opener == TemplateTokenType.BLOCK_BEGIN) {
            return name != null && CONTROL_FLOW_KEYWORDS.contains(name)
                    ? RegionKind.CONTROL_FLOW
                    : RegionKind.UNSAFE;
        }
        return name != null && SAFE_FUNCTIONS.contains(name)
                ? RegionKind.SAFE_EXPRESSION
                : RegionKind.UNSAFE;
    }

    private static String firstName(List<TemplateToken> unit) {
        for (TemplateToken token : unit) {
            if (token.type == TemplateTokenType.NAME) {
                return token.value;
            }
        }
        return null;
    }

    private static String join(List<TemplateToken> unit) {
        StringBuilder sb = new StringBuilder();
        for (TemplateToken token : unit) {
            sb.append(token.value);
        }
        return sb.toString();
    }
}
