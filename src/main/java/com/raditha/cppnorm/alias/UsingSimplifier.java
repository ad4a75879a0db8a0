package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeTracker;

import java.util.List;

/**
 * Inlines C++11 {@code using Name = type;} aliases, after rewriting single-name
 * using-declarations into that form.
 */
public class UsingSimplifier extends AliasSimplifier {

    public static final String DIAGNOSTIC_ID = "simplifyUsing";
    public static final String MAX_TIME_ID = "simplifyUsingMaxTime";

    private final UsingDeclarationNormalizer normalizer = new UsingDeclarationNormalizer();

    public UsingSimplifier() {
        super(new DeclaratorParser(), new AnonymousTypeSplitter(), new AliasInliner(DIAGNOSTIC_ID));
    }

    @Override
    public int simplify(TokenList tokens, SimplifyContext ctx) {
        if (!tokens.isCpp()) {
            return 0;
        }
        normalizer.normalize(tokens);
        return super.simplify(tokens, ctx);
    }

    @Override
    protected boolean isAliasStart(Token tok) {
        return TokenPattern.match(tok, "using %name% =") && tok.next().isIdentifier();
    }

    @Override
    protected List<AliasDeclaration> parse(Token start, ScopeTracker tracker) {
        return parser.parseUsing(start, tracker).map(List::of).orElse(List.of());
    }

    @Override
    protected String diagnosticId() {
        return DIAGNOSTIC_ID;
    }

    @Override
    protected String maxTimeId() {
        return MAX_TIME_ID;
    }
}
