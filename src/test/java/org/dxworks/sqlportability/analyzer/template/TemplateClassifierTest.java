package org.dxworks.sqlportability.analyzer.template;

import org.dxworks.sqlportability.model.template.MaskedSpan;
import org.dxworks.sqlportability.model.template.Region;
import org.dxworks.sqlportability.model.template.RegionKind;
import org.dxworks.sqlportability.model.template.SafetyVerdict;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateClassifierTest {

    private static final List<String> SOURCES = List.of(
            "",
            "   ",
            "SELECT id, name FROM users",
            "{{ config(materialized='view') }}\nSELECT * FROM {{ ref('a') }}",
            "SELECT {% if x %} COLLECT_LIST(a) {% endif %} FROM t",
            "SELECT {{ my_macro('a') }} FROM t",
            "{{ ref('x' }}",
            "{# only a comment #}",
            "SELECT {%- for c in cols -%}{{ c }},{%- endfor %} 1 FROM t",
            "{% raw %}{{ kept }}{% endraw %} SELECT 1");

    @Test
    void classify_regionsTileTheSource() {
        for (String source : SOURCES) {
            List<Region> regions = TemplateClassifier.classify(source);
            int pos = 0;
            for (Region region : regions) {
                assertEquals(pos, region.start, "gap before " + region + " in: " + source);
                assertEquals(source.substring(region.start, region.end), region.content);
                pos = region.end;
            }
            assertEquals(source.length(), pos, "regions do not cover: " + source);
        }
    }

    @Test
    void classify_emptyTextIsSafe() {
        List<Region> regions = TemplateClassifier.classify("");

        assertTrue(regions.isEmpty());
        assertTrue(TemplateClassifier.canSafelyRewrite(regions).canRewrite);
        assertTrue(TemplateClassifier.extractMaskedSpans(regions).isEmpty());
    }

    @Test
    void classify_unterminatedExpressionIsUnsafe() {
        String source = "{{ ref('x' }}";
        List<Region> regions = TemplateClassifier.classify(source);

        assertEquals(1, regions.size());
        assertEquals(RegionKind.UNSAFE, regions.get(0).kind);
        assertEquals(source, regions.get(0).content);
        assertFalse(TemplateClassifier.canSafelyRewrite(regions).canRewrite);
    }

    @Test
    void classify_allowlistedExpressionsAreSafe() {
        for (String name : List.of("ref('a')", "source('s', 't')", "var('v')", "config(x=1)",
                "this", "target.name", "env_var('E')")) {
            List<Region> regions = TemplateClassifier.classify("{{ " + name + " }}");
            assertEquals(RegionKind.SAFE_EXPRESSION, regions.get(0).kind, name);
        }
    }

    @Test
    void classify_portableMacroCallsAreNotAllowlisted() {
        for (String source : List.of("SELECT {{ portable_foo('x') }} FROM t",
                "SELECT {{ portable_collect_list('a') }} FROM t")) {
            List<Region> regions = TemplateClassifier.classify(source);

            assertEquals(RegionKind.UNSAFE, regions.get(1).kind, source);
            assertFalse(TemplateClassifier.canSafelyRewrite(regions).canRewrite, source);
        }
    }

    @Test
    void classify_otherExpressionsVetoRewriting() {
        List<Region> regions = TemplateClassifier.classify("SELECT {{ cents_to_dollars('amount') }} FROM t");

        assertEquals(RegionKind.UNSAFE, regions.get(1).kind);
        SafetyVerdict verdict = TemplateClassifier.canSafelyRewrite(regions);
        assertFalse(verdict.canRewrite);
        assertEquals("Template contains complex Jinja expressions", verdict.reason);
    }

    @Test
    void classify_controlFlowIsAllowed() {
        List<Region> regions = TemplateClassifier.classify("SELECT {% if x %} a {% else %} b {% endif %} FROM t");

        assertEquals(RegionKind.CONTROL_FLOW, regions.get(1).kind);
        assertEquals(RegionKind.CONTROL_FLOW, regions.get(3).kind);
        assertEquals(RegionKind.CONTROL_FLOW, regions.get(5).kind);
        assertTrue(TemplateClassifier.canSafelyRewrite(regions).canRewrite);
    }

    @Test
    void classify_unknownBlockIsUnsafe() {
        List<Region> regions = TemplateClassifier.classify("{% call statement('x') %}SELECT 1{% endcall %}");

        assertEquals(RegionKind.UNSAFE, regions.get(0).kind);
        assertFalse(TemplateClassifier.canSafelyRewrite(regions).canRewrite);
    }

    @Test
    void extractMaskedSpans_replacesTemplatingWithPlaceholders() {
        String source = "SELECT {% if x %}a{% endif %} FROM {{ ref('t') }}";
        List<MaskedSpan> spans = TemplateClassifier.extractMaskedSpans(TemplateClassifier.classify(source));

        assertEquals(1, spans.size());
        assertEquals(0, spans.get(0).start);
        assertEquals(source.length(), spans.get(0).end);
        assertEquals("SELECT  __JINJA__, a __JINJA__,  FROM  __PLACEHOLDER__ ", spans.get(0).maskedText);
    }

    @Test
    void extractMaskedSpans_nothingLeftToParse() {
        List<Region> regions = TemplateClassifier.classify("  \n  ");

        assertEquals(1, regions.size());
        assertTrue(TemplateClassifier.extractMaskedSpans(regions).isEmpty());
    }
}
