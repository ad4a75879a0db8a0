package com.raditha.cppnorm.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * A lexical token owned by a {@link TokenList}.
 * <p>
 * The token itself only carries its text, category, position and flags. Neighbours,
 * the bracket link and the variable id live in the owning list's index tables, keyed
 * by {@link #index()}, so deleting a token never leaves a dangling reference behind:
 * a deleted token simply reports no neighbours.
 */
public final class Token {

    private final TokenList list;
    private final int index;
    private String str;
    private TokenKind kind;
    private final EnumSet<TokenFlag> flags = EnumSet.noneOf(TokenFlag.class);
    private final int fileIndex;
    private final int line;
    private final int column;
    private String originalName;

    Token(TokenList list, int index, String str, int fileIndex, int line, int column) {
        this.list = list;
        this.index = index;
        this.fileIndex = fileIndex;
        this.line = line;
        this.column = column;
        setStr(str);
    }

    public String str() {
        return str;
    }

    /**
     * Replace the token text in place. The category is recomputed from the new text.
     */
    public void setStr(String str) {
        if (str == null || str.isEmpty()) {
            throw new IllegalArgumentException("token text cannot be empty");
        }
        this.str = str;
        this.kind = TokenKind.classify(str, list.isCpp());
    }

    public TokenKind kind() {
        return kind;
    }

    public void setKind(TokenKind kind) {
        this.kind = kind;
    }

    public int index() {
        return index;
    }

    public TokenList list() {
        return list;
    }

    public Token next() {
        return list.next(this);
    }

    public Token previous() {
        return list.previous(this);
    }

    /**
     * Token {@code n} positions away, negative values walk backwards.
     */
    public Token tokAt(int n) {
        Token tok = this;
        while (tok != null && n > 0) {
            tok = tok.next();
            n--;
        }
        while (tok != null && n < 0) {
            tok = tok.previous();
            n++;
        }
        return tok;
    }

    public Token link() {
        return list.link(this);
    }

    public int varId() {
        return list.varId(this);
    }

    public void setVarId(int varId) {
        list.setVarId(this, varId);
    }

    public boolean isDeleted() {
        return list.isDeleted(this);
    }

    public boolean isName() {
        return kind == TokenKind.NAME || kind == TokenKind.KEYWORD
                || kind == TokenKind.STANDARD_TYPE || kind == TokenKind.BOOLEAN;
    }

    public boolean isKeyword() {
        return kind == TokenKind.KEYWORD || kind == TokenKind.STANDARD_TYPE || kind == TokenKind.BOOLEAN;
    }

    public boolean isStandardType() {
        return kind == TokenKind.STANDARD_TYPE;
    }

    public boolean isLiteral() {
        return kind.isLiteral();
    }

    public boolean isOp() {
        return kind.isOperator();
    }

    /** Plain identifier: a name that is not a keyword. */
    public boolean isIdentifier() {
        return kind == TokenKind.NAME;
    }

    public boolean is(String text) {
        return str.equals(text);
    }

    public boolean hasFlag(TokenFlag flag) {
        return flags.contains(flag);
    }

    public void addFlag(TokenFlag flag) {
        flags.add(flag);
    }

    public void removeFlag(TokenFlag flag) {
        flags.remove(flag);
    }

    public Set<TokenFlag> flags() {
        return EnumSet.copyOf(flags);
    }

    void copyFlagsFrom(Token other) {
        flags.addAll(other.flags);
    }

    /** Alias name this token was expanded from, or null. */
    public String originalName() {
        return originalName;
    }

    public void setOriginalName(String originalName) {
        this.originalName = originalName;
    }

    public int fileIndex() {
        return fileIndex;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public SourceLocation location() {
        return new SourceLocation(list.file(fileIndex), line, column);
    }

    @Override
    public String toString() {
        return str;
    }
}
