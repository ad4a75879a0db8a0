package com.raditha.cppnorm.linking;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Links {@code {}}, {@code ()} and {@code []} pairs.
 * <p>
 * One stack holds every open bracket, so a closer must match the innermost opener
 * whatever its kind. That is the same as keeping one stack per kind and requiring the
 * pairs to nest, which is what later passes rely on.
 */
public class BracketLinker {

    private static final Logger logger = LoggerFactory.getLogger(BracketLinker.class);

    /**
     * Link all round, square and curly brackets of {@code tokens}.
     *
     * @return number of linked pairs
     * @throws SimplifyException if a closer has no opener, closes the wrong kind, or an
     *                           opener is never closed
     */
    public int linkBrackets(TokenList tokens) {
        Deque<Token> open = new ArrayDeque<>();
        int pairs = 0;
        for (Token tok : tokens) {
            String str = tok.str();
            if (str.length() != 1) {
                continue;
            }
            char c = str.charAt(0);
            if (c == '(' || c == '[' || c == '{') {
                open.push(tok);
            } else if (c == ')' || c == ']' || c == '}') {
                if (open.isEmpty() || open.peek().str().charAt(0) != openerOf(c)) {
                    throw SimplifyException.syntax(tok, "Unmatched '" + c + "'.");
                }
                tokens.createLink(open.pop(), tok);
                pairs++;
            }
        }
        if (!open.isEmpty()) {
            Token unclosed = open.peekLast();
            throw SimplifyException.syntax(unclosed, "Unmatched '" + unclosed.str() + "'.");
        }
        logger.debug("Linked {} bracket pairs", pairs);
        return pairs;
    }

    static char openerOf(char closer) {
        return switch (closer) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }
}
