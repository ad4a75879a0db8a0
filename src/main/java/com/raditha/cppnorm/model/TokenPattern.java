package com.raditha.cppnorm.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Matches a token sequence against a compact textual pattern.
 * <p>
 * A pattern is a space separated list of elements; each element is matched against one
 * token and advances to the next one. An element is a {@code |} separated list of
 * alternatives. Alternatives are literal token texts or one of the classes below. An
 * empty alternative ({@code "a|"}) makes the element optional: when nothing else
 * matches, the element matches without consuming a token. {@code !!x} matches any
 * token except {@code x}, and also matches past the end of the list.
 * <ul>
 * <li>{@code %name%} any name, keywords included</li>
 * <li>{@code %var%} a token with a variable id</li>
 * <li>{@code %type%} a name that is not a variable and not a keyword, or a fundamental type</li>
 * <li>{@code %num%}, {@code %str%}, {@code %char%}, {@code %bool%} literals</li>
 * <li>{@code %op%} any operator, {@code %cop%} constant operators, {@code %comp%} comparisons,
 * {@code %assign%} assignments</li>
 * <li>{@code %or%} and {@code %oror%} the tokens {@code |} and {@code ||}</li>
 * <li>{@code %any%} any token</li>
 * </ul>
 */
public final class TokenPattern {

    private static final Map<String, List<Element>> CACHE = new ConcurrentHashMap<>();

    private TokenPattern() {
    }

    /**
     * Match {@code pattern} starting at {@code tok}. A null token only matches
     * patterns whose elements are all optional or negated.
     */
    public static boolean match(Token tok, String pattern) {
        for (Element element : CACHE.computeIfAbsent(pattern, TokenPattern::compile)) {
            if (element.negated != null) {
                if (tok != null && tok.str().equals(element.negated)) {
                    return false;
                }
                tok = tok == null ? null : tok.next();
                continue;
            }
            if (tok != null && element.matches(tok)) {
                tok = tok.next();
            } else if (!element.optional) {
                return false;
            }
        }
        return true;
    }

    /**
     * Match literal token texts separated by single spaces.
     */
    public static boolean simpleMatch(Token tok, String pattern) {
        int start = 0;
        while (start <= pattern.length()) {
            int end = pattern.indexOf(' ', start);
            if (end < 0) {
                end = pattern.length();
            }
            if (tok == null || !tok.str().equals(pattern.substring(start, end))) {
                return false;
            }
            tok = tok.next();
            start = end + 1;
        }
        return true;
    }

    /**
     * Find the first token at or after {@code start}, and before {@code end}, that
     * matches {@code pattern}. A null {@code end} searches to the end of the list.
     */
    public static Token findMatch(Token start, String pattern, Token end) {
        for (Token tok = start; tok != null && tok != end; tok = tok.next()) {
            if (match(tok, pattern)) {
                return tok;
            }
        }
        return null;
    }

    private static List<Element> compile(String pattern) {
        List<Element> elements = new ArrayList<>();
        for (String part : pattern.trim().split(" +")) {
            if (part.startsWith("!!") && part.length() > 2) {
                elements.add(new Element(List.of(), false, part.substring(2)));
                continue;
            }
            List<String> alternatives = new ArrayList<>();
            boolean optional = false;
            for (String alt : part.split("\\|", -1)) {
                if (alt.isEmpty()) {
                    optional = true;
                } else {
                    alternatives.add(alt);
                }
            }
            elements.add(new Element(alternatives, optional, null));
        }
        return elements;
    }

    private record Element(List<String> alternatives, boolean optional, String negated) {

        boolean matches(Token tok) {
            for (String alt : alternatives) {
                if (matchesAlternative(tok, alt)) {
                    return true;
                }
            }
            return false;
        }

        private static boolean matchesAlternative(Token tok, String alt) {
            if (alt.length() < 3 || alt.charAt(0) != '%' || alt.charAt(alt.length() - 1) != '%') {
                return tok.str().equals(alt);
            }
            return switch (alt) {
                case "%name%" -> tok.isName();
                case "%var%" -> tok.varId() != 0;
                case "%type%" -> tok.isStandardType() || (tok.isIdentifier() && tok.varId() == 0);
                case "%num%" -> tok.kind() == TokenKind.NUMBER;
                case "%str%" -> tok.kind() == TokenKind.STRING;
                case "%char%" -> tok.kind() == TokenKind.CHAR;
                case "%bool%" -> tok.kind() == TokenKind.BOOLEAN;
                case "%op%" -> tok.isOp();
                case "%cop%" -> tok.kind().isConstantOperator();
                case "%comp%" -> tok.kind() == TokenKind.COMPARISON_OP;
                case "%assign%" -> tok.kind() == TokenKind.ASSIGNMENT_OP;
                case "%or%" -> tok.str().equals("|");
                case "%oror%" -> tok.str().equals("||");
                case "%any%" -> true;
                default -> tok.str().equals(alt);
            };
        }
    }
}
