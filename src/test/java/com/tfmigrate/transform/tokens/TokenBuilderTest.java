package com.tfmigrate.transform.tokens;

import com.tfmigrate.parser.HclParser;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.transform.scan.ElementType;
import com.tfmigrate.transform.scan.ExpressionScanner;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tfmigrate.parser.HclWriter.toText;
import static org.assertj.core.api.Assertions.*;

class TokenBuilderTest {

    @Test
    void testResourceReference() {
        List<HclToken> tokens = TokenBuilder.resourceReference("cloudflare_dns_record", "example");

        assertThat(toText(tokens)).isEqualTo("cloudflare_dns_record.example");
        assertThat(tokens).extracting(HclToken::getType)
                .containsExactly(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER);
    }

    @Test
    void testTemplateString() {
        List<HclToken> tokens = TokenBuilder.templateString(HclParser.parseExpression("each.key"), "-suffix");

        assertThat(toText(tokens)).isEqualTo("\"${each.key}-suffix\"");
        assertThat(ExpressionScanner.classify(tokens)).isEqualTo(ElementType.TEMPLATE);
    }

    @Test
    void testTemplateStringWithoutSuffix() {
        List<HclToken> tokens = TokenBuilder.templateString(TokenBuilder.identifier("var.zone"), "");

        assertThat(toText(tokens)).isEqualTo("\"${var.zone}\"");
    }

    @Test
    void testStringLiteralEscaping() {
        assertThat(toText(TokenBuilder.stringLiteral("say \"hi\""))).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(toText(TokenBuilder.stringLiteral("a\\b\n"))).isEqualTo("\"a\\\\b\\n\"");
        assertThat(toText(TokenBuilder.stringLiteral("${not} %{this}"))).isEqualTo("\"$${not} %%{this}\"");
        assertThat(toText(TokenBuilder.stringLiteral(""))).isEqualTo("\"\"");
    }

    @Test
    void testSimpleValue() {
        assertThat(toText(TokenBuilder.simpleValue("on"))).isEqualTo("\"on\"");
        assertThat(toText(TokenBuilder.simpleValue(42))).isEqualTo("42");
        assertThat(toText(TokenBuilder.simpleValue(3600L))).isEqualTo("3600");
        assertThat(toText(TokenBuilder.simpleValue(1.5))).isEqualTo("1.5");
        assertThat(toText(TokenBuilder.simpleValue(2.0))).isEqualTo("2");
        assertThat(toText(TokenBuilder.simpleValue(true))).isEqualTo("true");
        assertThat(TokenBuilder.simpleValue(List.of("a"))).isEmpty();
        assertThat(TokenBuilder.simpleValue(null)).isEmpty();
    }

    @Test
    void testTuples() {
        List<List<HclToken>> elements = List.of(TokenBuilder.identifier("a"), TokenBuilder.identifier("b"));

        assertThat(toText(TokenBuilder.tuple(elements))).isEqualTo("[a, b]");
        assertThat(toText(TokenBuilder.tuple(List.of()))).isEqualTo("[]");
        assertThat(toText(TokenBuilder.multilineTuple(elements))).isEqualTo("[\na,\nb\n]");
        assertThat(toText(TokenBuilder.multilineTuple(List.of()))).isEqualTo("[]");
    }

    @Test
    void testObject() {
        Map<String, List<HclToken>> fields = new LinkedHashMap<>();
        fields.put("name", TokenBuilder.stringLiteral("x"));
        fields.put("has space", TokenBuilder.nullValue());

        assertThat(toText(TokenBuilder.object(fields))).isEqualTo("{\nname = \"x\"\n\"has space\" = null\n}");
        assertThat(toText(TokenBuilder.object(Map.of()))).isEqualTo("{}");
    }

    @Test
    void testResultsAreMutable() {
        List<HclToken> tokens = TokenBuilder.emptyArray();

        tokens.add(0, HclToken.of(TokenType.WHITESPACE, " "));

        assertThat(toText(tokens)).isEqualTo(" []");
    }
}
