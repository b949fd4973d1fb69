package com.tfmigrate.transform.scan;

import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * A key/value pair read from an object or map literal.
 */
@Value
public class MapEntry {
    @NonNull
    List<HclToken> keyTokens;
    @NonNull
    List<HclToken> valueTokens;

    /**
     * The key as written: an identifier, or a quoted key without its quotes.
     * Computed keys come back as their source text.
     */
    public String getKey() {
        StringBuilder key = new StringBuilder();
        boolean quoted = !keyTokens.isEmpty() && keyTokens.get(0).is(TokenType.OQUOTE)
                && keyTokens.get(keyTokens.size() - 1).is(TokenType.CQUOTE);
        for (HclToken token : keyTokens) {
            if (quoted && (token.is(TokenType.OQUOTE) || token.is(TokenType.CQUOTE))) {
                continue;
            }
            key.append(token.getText());
        }
        return key.toString();
    }
}
