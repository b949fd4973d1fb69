package com.tfmigrate.parser;

import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HclTokenizerTest {

    @Test
    void testTokensJoinBackToSource() {
        String source = """
            # managed by hand
            resource "cloudflare_record" "www" {
              zone_id = var.zone_id // zone
              name    = "www-${var.env}"
              ttl     = 3600
              tags    = ["a", "b"]
              /* multi
                 line */
              value = <<-EOT
                hello ${var.name}
              EOT
            }
            """;

        List<HclToken> tokens = tokenize(source);

        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.EOF);
        assertThat(HclWriter.toText(tokens)).isEqualTo(source);
    }

    @Test
    void testQuotedTemplateWithInterpolation() {
        List<HclToken> tokens = tokenize("\"a-${var.x}-b\"");

        assertThat(tokens).extracting(HclToken::getType).containsExactly(
                TokenType.OQUOTE,
                TokenType.QUOTED_LIT,
                TokenType.TEMPLATE_INTERP,
                TokenType.IDENTIFIER,
                TokenType.DOT,
                TokenType.IDENTIFIER,
                TokenType.TEMPLATE_SEQ_END,
                TokenType.QUOTED_LIT,
                TokenType.CQUOTE,
                TokenType.EOF);
        assertThat(tokens.get(1).getText()).isEqualTo("a-");
        assertThat(tokens.get(7).getText()).isEqualTo("-b");
    }

    @Test
    void testEscapedInterpolationStaysLiteral() {
        List<HclToken> tokens = tokenize("\"$${literal}\"");

        assertThat(tokens).extracting(HclToken::getType).containsExactly(
                TokenType.OQUOTE, TokenType.QUOTED_LIT, TokenType.CQUOTE, TokenType.EOF);
        assertThat(tokens.get(1).getText()).isEqualTo("$${literal}");
    }

    @Test
    void testBracesInsideInterpolationDoNotEndIt() {
        List<HclToken> tokens = tokenize("\"${{a = 1}.a}\"");

        assertThat(tokens).extracting(HclToken::getType).contains(TokenType.OBRACE, TokenType.CBRACE);
        assertThat(tokens.get(tokens.size() - 3).getType()).isEqualTo(TokenType.TEMPLATE_SEQ_END);
        assertThat(tokens.get(tokens.size() - 2).getType()).isEqualTo(TokenType.CQUOTE);
    }

    @Test
    void testHeredoc() {
        String source = "v = <<EOT\nline one\nEOT\n";
        List<HclToken> tokens = tokenize(source);

        assertThat(tokens).extracting(HclToken::getType).containsExactly(
                TokenType.IDENTIFIER,
                TokenType.WHITESPACE,
                TokenType.EQUAL,
                TokenType.WHITESPACE,
                TokenType.OHEREDOC,
                TokenType.STRING_LIT,
                TokenType.CHEREDOC,
                TokenType.NEWLINE,
                TokenType.EOF);
        assertThat(tokens.get(5).getText()).isEqualTo("line one\n");
    }

    @Test
    void testKeywordsAreIdentifiers() {
        List<HclToken> tokens = tokenize("true");

        assertThat(tokens.get(0).isIdentifier("true")).isTrue();
    }

    @Test
    void testOperatorsAndNumbers() {
        List<HclToken> tokens = tokenize("a >= 1.5e3 ? x => y : z...");

        assertThat(tokens).extracting(HclToken::getType).contains(
                TokenType.OPERATOR, TokenType.NUMBER_LIT, TokenType.QUESTION,
                TokenType.ARROW, TokenType.COLON, TokenType.ELLIPSIS);
        assertThat(tokens).extracting(HclToken::getText).contains(">=", "1.5e3", "=>", "...");
    }

    @Test
    void testLineNumbersAreTracked() {
        List<HclToken> tokens = tokenize("a = 1\nb = 2\n");

        HclToken b = tokens.stream().filter(t -> t.isIdentifier("b")).findFirst().orElseThrow();
        assertThat(b.getLine()).isEqualTo(2);
    }

    @Test
    void testUnterminatedStringFails() {
        assertThatThrownBy(() -> tokenize("name = \"open\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated quoted string");
    }

    @Test
    void testUnterminatedHeredocFails() {
        assertThatThrownBy(() -> tokenize("v = <<EOT\nno end\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated heredoc");
    }

    private List<HclToken> tokenize(String source) {
        return new HclTokenizer(source, "test.tf").tokenize();
    }
}
