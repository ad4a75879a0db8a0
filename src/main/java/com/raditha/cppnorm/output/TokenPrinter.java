package com.raditha.cppnorm.output;

import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a token list as text.
 * <p>
 * Tokens are separated by single spaces. The listing forms keep each token on the
 * source line it came from, so an inserted token shows up on the line of the token it
 * was inserted next to.
 */
public class TokenPrinter {

    private final boolean showVarIds;

    public TokenPrinter(boolean showVarIds) {
        this.showVarIds = showVarIds;
    }

    /**
     * All tokens on one line.
     */
    public String toCode(TokenList tokens) {
        StringJoiner joiner = new StringJoiner(" ");
        for (Token tok : tokens) {
            joiner.add(render(tok));
        }
        return joiner.toString();
    }

    /**
     * One entry per source line from the first to the last line that has tokens. Lines
     * without tokens are empty. Tokens from other files of the list are put on the line
     * they are on in their own file.
     */
    public List<String> toLines(TokenList tokens) {
        List<StringBuilder> lines = new ArrayList<>();
        for (Token tok : tokens) {
            int line = Math.max(tok.line(), 1);
            while (lines.size() < line) {
                lines.add(new StringBuilder());
            }
            StringBuilder sb = lines.get(line - 1);
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(render(tok));
        }
        List<String> result = new ArrayList<>(lines.size());
        for (StringBuilder sb : lines) {
            result.add(sb.toString());
        }
        return result;
    }

    /**
     * Listing with line numbers, skipping empty lines: {@code "3: int x@1 ;"}.
     */
    public String toListing(TokenList tokens) {
        StringBuilder sb = new StringBuilder();
        List<String> lines = toLines(tokens);
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isEmpty()) {
                sb.append(i + 1).append(": ").append(lines.get(i)).append('\n');
            }
        }
        return sb.toString();
    }

    private String render(Token tok) {
        if (showVarIds && tok.varId() != 0) {
            return tok.str() + "@" + tok.varId();
        }
        return tok.str();
    }
}
