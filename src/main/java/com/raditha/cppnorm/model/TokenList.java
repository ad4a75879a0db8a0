package com.raditha.cppnorm.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Arena of tokens forming a doubly linked sequence.
 * <p>
 * Tokens are addressed by stable indices that are never reused. Previous/next
 * neighbours, bracket links and variable ids are kept in index tables owned by the
 * list, which gives O(1) navigation while keeping deletion safe: a deleted token is
 * unhooked from every table, and its link partner loses the link.
 */
public class TokenList implements Iterable<Token> {

    /** Marker for "no token" in the index tables. */
    public static final int NONE = -1;

    private final boolean cpp;
    private final List<String> files = new ArrayList<>();
    private final List<Token> arena = new ArrayList<>();
    private int[] prev = new int[64];
    private int[] next = new int[64];
    private int[] link = new int[64];
    private int[] varIds = new int[64];
    private boolean[] deleted = new boolean[64];
    private int head = NONE;
    private int tail = NONE;
    private int liveCount;

    public TokenList(boolean cpp) {
        this.cpp = cpp;
    }

    public boolean isCpp() {
        return cpp;
    }

    /**
     * Register a source file and return its index in the file table.
     */
    public int addFile(String path) {
        int existing = files.indexOf(path);
        if (existing >= 0) {
            return existing;
        }
        files.add(path);
        return files.size() - 1;
    }

    public String file(int fileIndex) {
        return fileIndex >= 0 && fileIndex < files.size() ? files.get(fileIndex) : "";
    }

    public List<String> files() {
        return List.copyOf(files);
    }

    public Token front() {
        return head == NONE ? null : arena.get(head);
    }

    public Token back() {
        return tail == NONE ? null : arena.get(tail);
    }

    /** Number of live tokens. */
    public int size() {
        return liveCount;
    }

    public boolean isEmpty() {
        return liveCount == 0;
    }

    /** Token by arena index, deleted or not. */
    public Token get(int index) {
        return arena.get(index);
    }

    /**
     * Append a token at the end of the list.
     */
    public Token append(String str, int fileIndex, int line, int column) {
        Token tok = allocate(str, fileIndex, line, column);
        int idx = tok.index();
        prev[idx] = tail;
        next[idx] = NONE;
        if (tail != NONE) {
            next[tail] = idx;
        } else {
            head = idx;
        }
        tail = idx;
        return tok;
    }

    /**
     * Insert a token after {@code where}, taking over its source position.
     * A null {@code where} inserts at the front.
     */
    public Token insertAfter(Token where, String str) {
        if (where == null) {
            Token first = front();
            if (first == null) {
                return append(str, 0, 0, 0);
            }
            return insertBefore(first, str);
        }
        checkLive(where);
        Token tok = allocate(str, where.fileIndex(), where.line(), where.column());
        int idx = tok.index();
        int w = where.index();
        int after = next[w];
        prev[idx] = w;
        next[idx] = after;
        next[w] = idx;
        if (after != NONE) {
            prev[after] = idx;
        } else {
            tail = idx;
        }
        return tok;
    }

    /**
     * Insert a token before {@code where}, taking over its source position.
     */
    public Token insertBefore(Token where, String str) {
        checkLive(where);
        Token tok = allocate(str, where.fileIndex(), where.line(), where.column());
        int idx = tok.index();
        int w = where.index();
        int before = prev[w];
        next[idx] = w;
        prev[idx] = before;
        prev[w] = idx;
        if (before != NONE) {
            next[before] = idx;
        } else {
            head = idx;
        }
        return tok;
    }

    /**
     * Splice a token out of the sequence. Its link partner loses the link.
     */
    public void delete(Token tok) {
        checkLive(tok);
        int idx = tok.index();
        removeLink(tok);
        int before = prev[idx];
        int after = next[idx];
        if (before != NONE) {
            next[before] = after;
        } else {
            head = after;
        }
        if (after != NONE) {
            prev[after] = before;
        } else {
            tail = before;
        }
        prev[idx] = NONE;
        next[idx] = NONE;
        varIds[idx] = 0;
        deleted[idx] = true;
        liveCount--;
    }

    /**
     * Delete {@code first} through {@code last}, both inclusive.
     */
    public void deleteRange(Token first, Token last) {
        Token tok = first;
        while (tok != null) {
            Token following = tok.next();
            boolean done = tok == last;
            delete(tok);
            if (done) {
                return;
            }
            tok = following;
        }
        throw new IllegalArgumentException("range end not reachable from range start");
    }

    /**
     * Copy the tokens {@code first}..{@code last} (inclusive) after {@code dest}.
     * Bracket pairs whose both ends lie in the copied range are linked in the copy.
     *
     * @return the last inserted token, or {@code dest} when nothing was copied
     */
    public Token copyRange(Token dest, Token first, Token last) {
        List<Token> sources = new ArrayList<>();
        for (Token tok = first; tok != null; tok = tok.next()) {
            sources.add(tok);
            if (tok == last) {
                break;
            }
        }
        return copyTokens(dest, sources, new HashMap<>());
    }

    /**
     * Copy the given tokens after {@code dest}, recording every copy in
     * {@code copies} (source index to copy). A copied bracket is linked as soon as
     * its partner has a copy in the map, so pairs split over several calls sharing
     * one map are linked too.
     *
     * @return the last inserted token, or {@code dest} when the list is empty
     */
    public Token copyTokens(Token dest, List<Token> sources, Map<Integer, Token> copies) {
        Token cursor = dest;
        for (Token source : sources) {
            Token copy = insertAfter(cursor, source.str());
            copy.setKind(source.kind());
            copy.copyFlagsFrom(source);
            copy.setOriginalName(source.originalName());
            copies.put(source.index(), copy);
            Token partner = source.link();
            if (partner != null && copies.containsKey(partner.index())) {
                createLink(copies.get(partner.index()), copy);
            }
            cursor = copy;
        }
        return cursor;
    }

    /**
     * Link two bracket tokens to each other. Any previous links are dropped first.
     */
    public void createLink(Token a, Token b) {
        checkLive(a);
        checkLive(b);
        removeLink(a);
        removeLink(b);
        link[a.index()] = b.index();
        link[b.index()] = a.index();
    }

    /**
     * Drop the link of {@code tok} and of its partner.
     */
    public void removeLink(Token tok) {
        int idx = tok.index();
        int partner = link[idx];
        if (partner != NONE) {
            link[partner] = NONE;
            link[idx] = NONE;
        }
    }

    Token next(Token tok) {
        int n = next[tok.index()];
        return n == NONE ? null : arena.get(n);
    }

    Token previous(Token tok) {
        int p = prev[tok.index()];
        return p == NONE ? null : arena.get(p);
    }

    Token link(Token tok) {
        int l = link[tok.index()];
        return l == NONE ? null : arena.get(l);
    }

    int varId(Token tok) {
        return varIds[tok.index()];
    }

    void setVarId(Token tok, int varId) {
        checkLive(tok);
        varIds[tok.index()] = varId;
    }

    boolean isDeleted(Token tok) {
        return deleted[tok.index()];
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<>() {
            private Token current = front();

            @Override
            public boolean hasNext() {
                return current != null;
            }

            @Override
            public Token next() {
                if (current == null) {
                    throw new NoSuchElementException();
                }
                Token result = current;
                current = current.next();
                return result;
            }
        };
    }

    public Stream<Token> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), liveCount, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Texts of all live tokens in order. */
    public List<String> texts() {
        return stream().map(Token::str).toList();
    }

    private Token allocate(String str, int fileIndex, int line, int column) {
        int idx = arena.size();
        ensureCapacity(idx + 1);
        Token tok = new Token(this, idx, str, fileIndex, line, column);
        arena.add(tok);
        prev[idx] = NONE;
        next[idx] = NONE;
        link[idx] = NONE;
        varIds[idx] = 0;
        deleted[idx] = false;
        liveCount++;
        return tok;
    }

    private void ensureCapacity(int capacity) {
        if (capacity <= prev.length) {
            return;
        }
        int size = Math.max(capacity, prev.length * 2);
        prev = Arrays.copyOf(prev, size);
        next = Arrays.copyOf(next, size);
        link = Arrays.copyOf(link, size);
        varIds = Arrays.copyOf(varIds, size);
        deleted = Arrays.copyOf(deleted, size);
    }

    private void checkLive(Token tok) {
        if (tok.list() != this) {
            throw new IllegalArgumentException("token belongs to another list: " + tok);
        }
        if (deleted[tok.index()]) {
            throw new IllegalStateException("token has been deleted: " + tok);
        }
    }
}
