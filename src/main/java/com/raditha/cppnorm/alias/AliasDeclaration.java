package com.raditha.cppnorm.alias;

import com.raditha.cppnorm.model.Token;

import java.util.List;

/**
 * One parsed typedef or using alias.
 * <p>
 * The token lists reference the declaration's own tokens, which stay in the list until
 * every use has been substituted. A use {@code T d} becomes
 * {@code base left d right}, so {@code typedef void (*Fn)(int)} has base {@code void},
 * left {@code ( *} and right {@code ) ( int )}.
 *
 * @param keyword       the {@code typedef} or {@code using} token
 * @param name          alias name
 * @param nameToken     token declaring the name
 * @param scope         qualified name of the declaring scope, empty for file scope
 * @param scopeStart    opening brace of the declaring scope, null for file scope
 * @param rescanEnd     token where the search for uses stops, null for end of file
 * @param shape         declarator shape
 * @param base          base type tokens
 * @param baseNameToken unqualified type name inside {@code base} that needs a qualifier
 *                      outside {@code baseQualifier}, or null
 * @param baseQualifier qualified name of the scope owning the base type, or null
 * @param left          declarator tokens before the name
 * @param right         declarator tokens after the name
 * @param end           terminating {@code ;}
 */
public record AliasDeclaration(
        Token keyword,
        String name,
        Token nameToken,
        String scope,
        Token scopeStart,
        Token rescanEnd,
        DeclaratorShape shape,
        List<Token> base,
        Token baseNameToken,
        String baseQualifier,
        List<Token> left,
        List<Token> right,
        Token end) {

    public AliasDeclaration {
        base = List.copyOf(base);
        left = List.copyOf(left);
        right = List.copyOf(right);
    }

    public boolean isUsing() {
        return keyword.is("using");
    }

    /** Whether uses need a declarator wrapped around the use site. */
    public boolean hasDeclarator() {
        return !left.isEmpty() || !right.isEmpty();
    }
}
