package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inlines {@code typedef} declarations.
 * <p>
 * File-scope typedefs whose name is declared once and only ever used as a type are
 * inlined first, in one pass each and without scope tracking. Everything else goes
 * through the scope-aware walk of {@link AliasSimplifier}.
 */
public class TypedefSimplifier extends AliasSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(TypedefSimplifier.class);

    public static final String DIAGNOSTIC_ID = "simplifyTypedef";
    public static final String MAX_TIME_ID = "typedefMaxTime";

    private final AliasSubstituter substituter = new AliasSubstituter();

    public TypedefSimplifier() {
        super(new DeclaratorParser(), new AnonymousTypeSplitter(), new AliasInliner(DIAGNOSTIC_ID));
    }

    @Override
    public int simplify(TokenList tokens, SimplifyContext ctx) {
        int fast = simplifyFileScope(tokens, ctx);
        if (ctx.deadline().isExpired()) {
            return fast;
        }
        return fast + super.simplify(tokens, ctx);
    }

    /**
     * Inline the typedefs that qualify for the fast path.
     *
     * @return number of declarations removed
     */
    int simplifyFileScope(TokenList tokens, SimplifyContext ctx) {
        Map<String, Integer> declarations = new HashMap<>();
        Map<Token, String> candidates = new LinkedHashMap<>();
        Map<String, List<Token>> occurrences = new HashMap<>();
        int depth = 0;
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (tok.is("{")) {
                depth++;
            } else if (tok.is("}")) {
                depth--;
            } else if (tok.is("typedef")) {
                List<AliasDeclaration> decls = parser.parseTypedef(tok, null);
                decls.forEach(d -> declarations.merge(d.name(), 1, Integer::sum));
                if (depth == 0 && decls.size() == 1) {
                    candidates.put(tok, decls.get(0).name());
                }
            } else if (TokenPattern.match(tok, "using %name% =")) {
                declarations.merge(tok.next().str(), 1, Integer::sum);
            } else if (TokenPattern.match(tok, "class|struct|union|enum|namespace %name%")) {
                declarations.merge(tok.next().str(), 1, Integer::sum);
            }
            if (tok.isIdentifier()) {
                occurrences.computeIfAbsent(tok.str(), k -> new ArrayList<>()).add(tok);
            }
        }

        int removed = 0;
        for (Map.Entry<Token, String> candidate : candidates.entrySet()) {
            String name = candidate.getValue();
            if (declarations.get(name) != 1) {
                continue;
            }
            if (ctx.deadline().isExpired()) {
                reportTimeout(candidate.getKey(), ctx);
                return removed;
            }
            List<AliasDeclaration> decls = parser.parseTypedef(candidate.getKey(), null);
            if (decls.size() != 1) {
                continue;
            }
            AliasDeclaration decl = decls.get(0);
            List<Token> uses = usesAfter(decl, occurrences.get(name));
            if (uses == null) {
                continue;
            }
            for (Token use : uses) {
                substituter.substitute(new AliasSubstituter.UseSite(use), decl, null, tokens);
            }
            ctx.aliasInlined(uses.size());
            tokens.deleteRange(decl.keyword(), decl.end());
            removed++;
        }
        logger.debug("File-scope pass inlined {} typedef(s)", removed);
        return removed;
    }

    /**
     * The occurrences of the name after the declaration, or null when any occurrence
     * is something other than a plain type use.
     */
    private static List<Token> usesAfter(AliasDeclaration decl, List<Token> occurrences) {
        List<Token> uses = new ArrayList<>();
        boolean afterDeclaration = false;
        for (Token tok : occurrences) {
            if (tok == decl.nameToken()) {
                afterDeclaration = true;
                continue;
            }
            if (tok.isDeleted()) {
                continue;
            }
            if (TokenPattern.simpleMatch(tok.previous(), "::") || TokenPattern.simpleMatch(tok.next(), "::")
                    || NamePosition.declaration(tok) != NamePosition.Declares.NONE
                    || NamePosition.isExcluded(tok, decl.shape())) {
                return null;
            }
            if (afterDeclaration) {
                uses.add(tok);
            }
        }
        return uses;
    }

    @Override
    protected boolean isAliasStart(Token tok) {
        return tok.is("typedef");
    }

    @Override
    protected List<AliasDeclaration> parse(Token start, ScopeTracker tracker) {
        return parser.parseTypedef(start, tracker);
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
