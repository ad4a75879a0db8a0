package com.raditha.cppnorm.linking;

import com.raditha.cppnorm.model.CppKeywords;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenKind;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Links {@code <} and {@code >} tokens that delimit template argument lists.
 * <p>
 * Without a grammar this cannot be exact, so the linker only links what it can
 * justify and leaves every doubtful angle bracket alone. A {@code <} opens a candidate
 * when it follows {@code template}, a cast keyword, a name known to be a template, or
 * an unknown name that is not a variable. Candidates are kept per bracket level and
 * dropped as soon as something that cannot appear in a template argument list shows
 * up at that level. A {@code >>} that closes two candidates is split into two
 * {@code >} tokens.
 * <p>
 * Must run after {@link BracketLinker}, because it relies on round brackets being linked.
 */
public class TemplateLinker {

    private static final Logger logger = LoggerFactory.getLogger(TemplateLinker.class);

    /** Standard library templates that are commonly used without a visible declaration. */
    private static final Set<String> STANDARD_TEMPLATES = Set.of(
            "vector", "list", "forward_list", "deque", "queue", "priority_queue", "stack",
            "map", "multimap", "set", "multiset", "unordered_map", "unordered_multimap",
            "unordered_set", "unordered_multiset", "array", "pair", "tuple", "optional", "variant",
            "shared_ptr", "unique_ptr", "weak_ptr", "function", "basic_string", "basic_string_view",
            "allocator", "less", "greater", "equal_to", "hash", "numeric_limits", "initializer_list",
            "enable_if", "enable_if_t", "is_same", "is_same_v", "conditional", "conditional_t",
            "remove_reference", "decay", "decay_t", "span", "atomic", "reference_wrapper",
            "make_shared", "make_unique", "make_pair", "make_tuple", "declval", "integral_constant",
            "basic_ostream", "basic_istream", "iterator_traits", "char_traits");

    private final boolean splitShift;

    /**
     * Linker for C++11 and later, where {@code >>} can close two argument lists.
     */
    public TemplateLinker() {
        this(true);
    }

    /**
     * @param splitShift whether {@code >>} may close two argument lists; false for C++03
     */
    public TemplateLinker(boolean splitShift) {
        this.splitShift = splitShift;
    }

    /**
     * Link template angle brackets of a C++ token list.
     *
     * @return number of linked {@code <>} pairs
     */
    public int linkTemplates(TokenList tokens) {
        if (!tokens.isCpp()) {
            return 0;
        }
        Set<String> templates = collectTemplateNames(tokens);
        Set<String> variables = collectVariableNames(tokens, templates);

        Deque<Deque<Candidate>> frames = new ArrayDeque<>();
        frames.push(new ArrayDeque<>());
        int pairs = 0;

        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            Deque<Candidate> candidates = frames.peek();
            String str = tok.str();
            switch (str) {
                case "(", "[" -> frames.push(new ArrayDeque<>());
                case ")", "]" -> popFrame(frames);
                case "{" -> {
                    candidates.clear();
                    frames.push(new ArrayDeque<>());
                }
                case "}" -> {
                    popFrame(frames);
                    frames.peek().clear();
                }
                case ";", "?", ":", "||", "<<", "==", "!=", "<=", ">=", "<=>", ">>=" -> candidates.clear();
                case "<" -> {
                    Candidate candidate = candidateFor(tok, templates, variables);
                    if (candidate != null) {
                        candidates.push(candidate);
                    } else {
                        candidates.clear();
                    }
                }
                case ">" -> {
                    if (!candidates.isEmpty()) {
                        Candidate top = candidates.peek();
                        if (top.weak && !fitsTypeContext(tok.next())) {
                            candidates.clear();
                        } else {
                            candidates.pop();
                            link(tokens, top, tok);
                            pairs++;
                        }
                    }
                }
                case ">>" -> {
                    if (candidates.isEmpty()) {
                        break;
                    }
                    if (!splitShift || candidates.size() < 2) {
                        candidates.clear();
                        break;
                    }
                    Candidate inner = candidates.pop();
                    Candidate outer = candidates.peek();
                    if (outer.weak && !fitsTypeContext(tok.next())) {
                        candidates.clear();
                        break;
                    }
                    candidates.pop();
                    tok.setStr(">");
                    Token second = tokens.insertAfter(tok, ">");
                    second.addFlag(TokenFlag.SPLIT_SHIFT);
                    link(tokens, inner, tok);
                    link(tokens, outer, second);
                    pairs += 2;
                    tok = second;
                }
                case "&&" -> {
                    if (!TokenPattern.match(tok.next(), ">|,|...|>>|)")) {
                        candidates.clear();
                    }
                }
                default -> {
                    if (tok.kind() == TokenKind.ASSIGNMENT_OP
                            && !(str.equals("=") && !candidates.isEmpty() && candidates.peek().templateParams)) {
                        candidates.clear();
                    }
                }
            }
        }
        logger.debug("Linked {} template bracket pairs", pairs);
        return pairs;
    }

    private static void popFrame(Deque<Deque<Candidate>> frames) {
        if (frames.size() > 1) {
            frames.pop();
        }
    }

    private static void link(TokenList tokens, Candidate candidate, Token close) {
        Token open = candidate.open;
        tokens.createLink(open, close);
        open.setKind(TokenKind.BRACKET);
        close.setKind(TokenKind.BRACKET);
        if (candidate.cast) {
            open.addFlag(TokenFlag.CAST);
            close.addFlag(TokenFlag.CAST);
            open.previous().addFlag(TokenFlag.CAST);
        }
    }

    private static Candidate candidateFor(Token lt, Set<String> templates, Set<String> variables) {
        Token prev = lt.previous();
        if (prev == null) {
            return null;
        }
        if (prev.is("template")) {
            return new Candidate(lt, false, true, false);
        }
        if (CppKeywords.isCastKeyword(prev.str())) {
            return new Candidate(lt, false, false, true);
        }
        if (prev.is("]") && isLambdaIntroducer(prev.link())) {
            return new Candidate(lt, false, false, false);
        }
        if (!prev.isIdentifier()) {
            return null;
        }
        Token before = prev.previous();
        if (before != null && before.is("operator")) {
            return null;
        }
        if (before != null && before.is("template")) {
            return new Candidate(lt, false, false, false);
        }
        if (TokenPattern.match(before, ".|->")) {
            return null;
        }
        if (templates.contains(prev.str()) || STANDARD_TEMPLATES.contains(prev.str())) {
            return new Candidate(lt, false, false, false);
        }
        if (variables.contains(prev.str())) {
            return null;
        }
        return new Candidate(lt, true, false, false);
    }

    private static boolean isLambdaIntroducer(Token open) {
        if (open == null) {
            return false;
        }
        Token before = open.previous();
        return before == null || TokenPattern.match(before, "(|,|=|{|;|return|}");
    }

    /**
     * Whether the token after a closing {@code >} can follow a template id.
     */
    static boolean fitsTypeContext(Token next) {
        if (next == null) {
            return false;
        }
        if (next.isName()) {
            return true;
        }
        return TokenPattern.match(next, "::|(|)|{|}|;|,|>|>>|*|&|&&|...|[|]|=|.|->");
    }

    /**
     * Names declared as templates anywhere in the list: classes, aliases, functions
     * and variables introduced by a {@code template <...>} header.
     */
    static Set<String> collectTemplateNames(TokenList tokens) {
        Set<String> names = new HashSet<>();
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (!TokenPattern.simpleMatch(tok, "template <")) {
                continue;
            }
            Token end = skipTemplateHeader(tok.next());
            if (end == null) {
                break;
            }
            Token after = end.next();
            while (TokenPattern.simpleMatch(after, "template <")) {
                end = skipTemplateHeader(after.next());
                after = end == null ? null : end.next();
            }
            if (TokenPattern.match(after, "class|struct|union|using %name%")) {
                Token name = after.next();
                while (TokenPattern.match(name, "%name% ::")) {
                    name = name.tokAt(2);
                }
                if (name != null && name.isIdentifier()) {
                    names.add(name.str());
                }
                continue;
            }
            for (Token t = after; t != null; t = t.next()) {
                if (TokenPattern.match(t, "(|=|;|{")) {
                    Token name = t.previous();
                    if (name != null && name.isIdentifier()) {
                        names.add(name.str());
                    }
                    break;
                }
                if (t.is("<")) {
                    t = skipTemplateHeader(t);
                    if (t == null) {
                        break;
                    }
                }
            }
        }
        return names;
    }

    /**
     * Skip from a {@code <} to its closing {@code >} by counting angle brackets, jumping
     * over linked round brackets.
     *
     * @return the closing token, or null when the list ends first
     */
    private static Token skipTemplateHeader(Token open) {
        int depth = 0;
        for (Token t = open; t != null; t = t.next()) {
            if (t.is("(") && t.link() != null) {
                t = t.link();
            } else if (t.is("<")) {
                depth++;
            } else if (t.is(">")) {
                depth--;
            } else if (t.is(">>")) {
                depth -= 2;
            } else if (t.is(";") || t.is("{")) {
                return null;
            }
            if (depth <= 0) {
                return t;
            }
        }
        return null;
    }

    /**
     * Names that appear in a declaration shape ({@code type name ;}, {@code type * name =},
     * ...) and are therefore treated as variables, never as templates.
     */
    static Set<String> collectVariableNames(TokenList tokens, Set<String> templates) {
        Set<String> names = new HashSet<>();
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (!tok.isIdentifier() || templates.contains(tok.str())) {
                continue;
            }
            Token prev = tok.previous();
            if (prev != null && TokenPattern.match(tok.next(), ";|=|,|[|)|{") && isTypeLike(prev)) {
                names.add(tok.str());
            }
        }
        return names;
    }

    private static boolean isTypeLike(Token prev) {
        if (prev.isStandardType() || prev.is(">")) {
            return true;
        }
        Token before = prev.previous();
        if (prev.isIdentifier()) {
            // "a b ;" declares b unless a is part of an expression
            return before == null || !TokenPattern.match(before, ".|->|%op%");
        }
        if (!TokenPattern.match(prev, "*|&|&&")) {
            return false;
        }
        return before != null && (before.isStandardType() || before.isIdentifier()
                || TokenPattern.match(before, "*|&|>|const"));
    }

    private static final class Candidate {
        private final Token open;
        private final boolean weak;
        private final boolean templateParams;
        private final boolean cast;

        Candidate(Token open, boolean weak, boolean templateParams, boolean cast) {
            this.open = open;
            this.weak = weak;
            this.templateParams = templateParams;
            this.cast = cast;
        }
    }
}
