package org.dxworks.sqlportability.analyzer.template;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateLexerTest {

    @Test
    void tokenize_joinsBackToSource() throws Exception {
        String source = "SELECT {{ ref('orders') }} {%- if x > 1 -%} a {% endif %} {# note #}";
        List<TemplateToken> tokens = TemplateLexer.tokenize(source);

        StringBuilder joined = new StringBuilder();
        for (TemplateToken token : tokens) {
            assertEquals(joined.length(), token.offset);
            joined.append(token.value);
        }
        assertEquals(source, joined.toString());
    }

    @Test
    void tokenize_keepsWhitespaceControlInDelimiters() throws Exception {
        List<TemplateToken> tokens = TemplateLexer.tokenize("{%- set x = 1 -%}");

        assertEquals(TemplateTokenType.BLOCK_BEGIN, tokens.get(0).type);
        assertEquals("{%-", tokens.get(0).value);
        TemplateToken last = tokens.get(tokens.size() - 1);
        assertEquals(TemplateTokenType.BLOCK_END, last.type);
        assertEquals("-%}", last.value);
    }

    @Test
    void tokenize_closingDelimiterInsideBracketsIsNotAClose() throws Exception {
        List<TemplateToken> tokens = TemplateLexer.tokenize("{{ config(meta={'a': 1}) }}");

        long ends = tokens.stream().filter(t -> t.type == TemplateTokenType.VARIABLE_END).count();
        assertEquals(1, ends);
        assertEquals("}}", tokens.get(tokens.size() - 1).value);
    }

    @Test
    void tokenize_rawBodyIsData() throws Exception {
        List<TemplateToken> tokens = TemplateLexer.tokenize("{% raw %}{{ not parsed }}{% endraw %}");

        assertTrue(tokens.stream().anyMatch(t ->
                t.type == TemplateTokenType.DATA && t.value.equals("{{ not parsed }}")));
    }

    @Test
    void tokenize_unterminatedExpressionFails() {
        TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class,
                () -> TemplateLexer.tokenize("SELECT {{ ref('x') "));
        assertEquals(7, e.getPosition());
    }

    @Test
    void tokenize_mismatchedBracketFails() {
        assertThrows(TemplateSyntaxException.class, () -> TemplateLexer.tokenize("{{ ref('x' }}"));
    }

    @Test
    void tokenize_unterminatedStringFails() {
        assertThrows(TemplateSyntaxException.class, () -> TemplateLexer.tokenize("{{ ref('x) }}"));
    }

    @Test
    void tokenize_unexpectedCharacterFails() {
        assertThrows(TemplateSyntaxException.class, () -> TemplateLexer.tokenize("{{ a @ b }}"));
    }

    @Test
    void tokenize_unclosedCommentFails() {
        assertThrows(TemplateSyntaxException.class, () -> TemplateLexer.tokenize("SELECT 1 {# never closed"));
    }
}
