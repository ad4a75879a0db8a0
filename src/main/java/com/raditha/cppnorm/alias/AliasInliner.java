package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Finds the uses of one alias declaration and substitutes each of them.
 * <p>
 * The search runs from the end of the declaration to the end of its block, or to the
 * end of the file for aliases declared in a namespace or class. A scope tracker copied
 * from the declaration's position decides which unqualified and qualified uses refer
 * to the alias. A variable, parameter, record or alias of the same name declared in a
 * nested scope hides the alias until that scope closes.
 */
public class AliasInliner {

    private static final Logger logger = LoggerFactory.getLogger(AliasInliner.class);

    private final String diagnosticId;
    private final AliasSubstituter substituter;

    /**
     * @param diagnosticId id of the debug diagnostics, {@code simplifyTypedef} or {@code simplifyUsing}
     */
    public AliasInliner(String diagnosticId) {
        this(diagnosticId, new AliasSubstituter());
    }

    AliasInliner(String diagnosticId, AliasSubstituter substituter) {
        this.diagnosticId = diagnosticId;
        this.substituter = substituter;
    }

    /**
     * Substitute every visible use of {@code decl}.
     *
     * @param tracker tracker positioned at the declaration; it is copied, not advanced
     * @return number of substituted uses
     */
    public int inline(AliasDeclaration decl, ScopeTracker tracker, TokenList tokens, SimplifyContext ctx) {
        ScopeTracker scan = tracker.copy();
        Token skipUntil = null;
        int uses = 0;
        Token tok = decl.end().next();
        while (tok != null && tok != decl.rescanEnd()) {
            if (!scan.update(tok)) {
                ctx.reportDebug(tok, diagnosticId + "UnmatchedBodyEnd",
                        "Unmatched '}' while inlining '" + decl.name() + "'.");
                break;
            }
            if (skipUntil != null) {
                if (tok == skipUntil) {
                    skipUntil = null;
                }
                tok = tok.next();
                continue;
            }
            if (!tok.isIdentifier() || !tok.is(decl.name())) {
                tok = tok.next();
                continue;
            }

            NamePosition.Declares declares = NamePosition.declaration(tok);
            if (declares != NamePosition.Declares.NONE) {
                boolean sameScope = scan.current().bodyStart() == decl.scopeStart();
                Token paren = enclosingParen(tok);
                if (paren != null && declares == NamePosition.Declares.VARIABLE) {
                    skipUntil = parameterScopeEnd(paren);
                } else if (sameScope && declares == NamePosition.Declares.VARIABLE) {
                    logger.debug("'{}' redeclared at line {}, stop inlining", decl.name(), tok.line());
                    break;
                } else if (!sameScope) {
                    skipUntil = scan.current().bodyEnd();
                    if (skipUntil == null) {
                        break;
                    }
                }
                tok = tok.next();
                continue;
            }

            Optional<AliasSubstituter.UseSite> site = useSite(tok, decl, scan);
            if (site.isPresent()) {
                tok = substituter.substitute(site.get(), decl, scan, tokens).next();
                uses++;
            } else {
                tok = tok.next();
            }
        }
        logger.debug("Inlined '{}' at {} use(s)", decl.name(), uses);
        return uses;
    }

    /**
     * Check whether {@code tok} is a use of {@code decl} visible at the tracker's position.
     */
    Optional<AliasSubstituter.UseSite> useSite(Token tok, AliasDeclaration decl, ScopeTracker scan) {
        if (NamePosition.isExcluded(tok, decl.shape())) {
            return Optional.empty();
        }
        if (!TokenPattern.simpleMatch(tok.previous(), "::")) {
            boolean visible = scan.isInside(decl.scope()) || scan.seesNamespace(decl.scope())
                    || scan.inheritsFrom(decl.scope());
            return visible ? Optional.of(new AliasSubstituter.UseSite(tok)) : Optional.empty();
        }

        Token first = tok;
        Token start = tok.previous();
        StringBuilder qualifier = new StringBuilder();
        while (TokenPattern.simpleMatch(start, "::") && start.previous() != null && start.previous().isIdentifier()) {
            qualifier.insert(0, qualifier.length() == 0 ? start.previous().str() : start.previous().str() + "::");
            first = start.previous();
            start = first.previous();
        }
        if (TokenPattern.match(start, ".|->")) {
            return Optional.empty();
        }
        boolean global = TokenPattern.simpleMatch(start, "::")
                && !(start.previous() != null && (start.previous().isIdentifier() || start.previous().is(">")));
        if (TokenPattern.simpleMatch(start, "::") && !global) {
            return Optional.empty();
        }
        if (global) {
            first = start;
        } else if (first == tok) {
            return Optional.empty();
        }
        String resolved = global ? qualifier.toString() : scan.resolveQualified(qualifier.toString());
        if (!resolved.equals(decl.scope())) {
            return Optional.empty();
        }
        return Optional.of(new AliasSubstituter.UseSite(tok, first));
    }

    /**
     * The unmatched {@code (} around {@code tok} in the same statement, or null.
     */
    static Token enclosingParen(Token tok) {
        for (Token t = tok.previous(); t != null; t = t.previous()) {
            if (TokenPattern.match(t, ")|]|>") && t.link() != null) {
                t = t.link();
            } else if (t.is("(")) {
                return t.link() != null ? t : null;
            } else if (TokenPattern.match(t, ";|{|}")) {
                return null;
            }
        }
        return null;
    }

    /**
     * Where a parameter declared inside {@code open} stops being visible: the end of the
     * function body when the parentheses start a definition, otherwise the closing
     * parenthesis.
     */
    static Token parameterScopeEnd(Token open) {
        Token close = open.link();
        boolean initializers = false;
        for (Token t = close.next(); t != null; t = t.next()) {
            if (t.is("{")) {
                if (initializers && (t.previous().isIdentifier() || t.previous().is(">"))) {
                    t = t.link();
                    continue;
                }
                return t.link() != null ? t.link() : close;
            }
            if (TokenPattern.match(t, ";|}") || (!initializers && TokenPattern.match(t, ",|)|="))) {
                return close;
            }
            if (t.is(":")) {
                initializers = true;
            } else if (TokenPattern.match(t, "(|[|<") && t.link() != null) {
                t = t.link();
            }
        }
        return close;
    }
}
