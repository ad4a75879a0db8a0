package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.analyzer.SimplifyContext;
import com.raditha.cppnorm.model.CppKeywords;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenFlag;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Moves a type definition out of an alias declaration.
 * <p>
 * {@code typedef struct { int x; } S;} becomes
 * {@code struct Unnamed0 { int x; } ; typedef struct Unnamed0 S ;} so that the
 * record can still be named after the alias has been inlined. Named definitions keep
 * their name. {@code using S = struct { .. };} is handled the same way.
 */
public class AnonymousTypeSplitter {

    private static final Logger logger = LoggerFactory.getLogger(AnonymousTypeSplitter.class);

    /**
     * Split the definition out of the alias declaration starting at {@code aliasStart}.
     *
     * @param aliasStart a {@code typedef} or {@code using} token
     * @return the record keyword, which now starts the statement in front of the
     *         alias, or null when the declaration contains no type definition
     */
    public Token split(Token aliasStart, TokenList tokens, SimplifyContext ctx) {
        Token keyword = recordKeyword(aliasStart);
        if (keyword == null) {
            return null;
        }
        Token nameAnchor = keyword;
        if (keyword.is("enum") && TokenPattern.match(keyword.next(), "class|struct")) {
            nameAnchor = keyword.next();
        }
        Token name = nameAnchor.next();
        if (name != null && !name.isIdentifier()) {
            name = null;
        }
        Token body = name == null ? nameAnchor.next() : name.next();
        if (TokenPattern.simpleMatch(body, ":")) {
            body = TokenPattern.findMatch(body, "{|;", null);
        }
        if (body == null || !body.is("{") || body.link() == null) {
            return null;
        }
        if (name == null) {
            name = tokens.insertAfter(nameAnchor, "Unnamed" + ctx.nextUnnamed());
            name.addFlag(TokenFlag.ANONYMOUS_NAME);
        }

        List<Token> prefix = new ArrayList<>();
        for (Token t = aliasStart; t != keyword; t = t.next()) {
            prefix.add(t);
        }
        Token cursor = tokens.insertAfter(body.link(), ";");
        cursor = tokens.copyTokens(cursor, prefix, new HashMap<>());
        cursor = tokens.insertAfter(cursor, keyword.str());
        Token copiedName = tokens.insertAfter(cursor, name.str());
        if (name.hasFlag(TokenFlag.ANONYMOUS_NAME)) {
            copiedName.addFlag(TokenFlag.ANONYMOUS_NAME);
        }
        tokens.deleteRange(aliasStart, keyword.previous());
        logger.debug("Split type definition '{}' out of alias at line {}", name.str(), keyword.line());
        return keyword;
    }

    /**
     * The struct, union, class or enum keyword directly following the alias
     * introducer and its cv-qualifiers, or null.
     */
    private static Token recordKeyword(Token aliasStart) {
        Token t;
        if (aliasStart.is("typedef")) {
            t = aliasStart.next();
        } else if (TokenPattern.match(aliasStart, "using %name% =")) {
            t = aliasStart.tokAt(3);
        } else {
            return null;
        }
        while (t != null && (CppKeywords.isCvQualifier(t.str()) || t.is("typename"))) {
            t = t.next();
        }
        return TokenPattern.match(t, "struct|union|class|enum") ? t : null;
    }
}
