package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.scope.ScopeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Walks a token list with a scope tracker and inlines every alias declaration it can
 * parse. Subclasses say which tokens start a declaration and how to parse it.
 * <p>
 * Declarations that cannot be parsed are left in place with a debug diagnostic. When
 * the context's deadline expires, the walk stops with an information diagnostic and
 * the remaining declarations stay as they are.
 */
public abstract class AliasSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(AliasSimplifier.class);

    protected final DeclaratorParser parser;
    private final AnonymousTypeSplitter splitter;
    private final AliasInliner inliner;

    protected AliasSimplifier(DeclaratorParser parser, AnonymousTypeSplitter splitter, AliasInliner inliner) {
        this.parser = parser;
        this.splitter = splitter;
        this.inliner = inliner;
    }

    /**
     * Inline the aliases of {@code tokens} and delete their declarations.
     *
     * @return number of declarations inlined and removed
     */
    public int simplify(TokenList tokens, SimplifyContext ctx) {
        ScopeTracker tracker = new ScopeTracker();
        int removed = 0;
        Token tok = tokens.front();
        while (tok != null) {
            if (!isAliasStart(tok)) {
                if (!tracker.update(tok)) {
                    ctx.reportDebug(tok, diagnosticId() + "UnmatchedBodyEnd", "Unmatched '}' in scope tracking.");
                    break;
                }
                tok = tok.next();
                continue;
            }
            if (ctx.deadline().isExpired()) {
                reportTimeout(tok, ctx);
                break;
            }
            Token definition = splitter.split(tok, tokens, ctx);
            if (definition != null) {
                tok = definition;
                continue;
            }
            List<AliasDeclaration> decls = parse(tok, tracker);
            if (decls.isEmpty()) {
                ctx.reportDebug(tok, diagnosticId(), "Failed to parse '" + tok.str() + "' declaration, it is kept.");
                ctx.aliasSkipped();
                tok = tok.next();
                continue;
            }
            for (AliasDeclaration decl : decls) {
                ctx.aliasInlined(inliner.inline(decl, tracker, tokens, ctx));
            }
            AliasDeclaration first = decls.get(0);
            Token next = first.end().next();
            tokens.deleteRange(first.keyword(), first.end());
            removed++;
            tok = next;
        }
        logger.debug("{}: removed {} declaration(s)", diagnosticId(), removed);
        return removed;
    }

    protected void reportTimeout(Token tok, SimplifyContext ctx) {
        long seconds = ctx.config().aliasTimeBudget().toSeconds();
        logger.warn("{} stopped at line {}: time budget of {}s exceeded", diagnosticId(), tok.line(), seconds);
        ctx.reportInformation(tok, maxTimeId(),
                "Alias simplification stopped after the time budget of " + seconds + "s was exceeded.");
    }

    /** Whether {@code tok} starts a declaration this simplifier handles. */
    protected abstract boolean isAliasStart(Token tok);

    /**
     * Parse the declaration at {@code start}; empty when it cannot be parsed.
     */
    protected abstract List<AliasDeclaration> parse(Token start, ScopeTracker tracker);

    /** Id of the debug diagnostic for declarations that are kept. */
    protected abstract String diagnosticId();

    /** Id of the information diagnostic reported when the deadline expires. */
    protected abstract String maxTimeId();
}
