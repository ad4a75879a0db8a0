package com.raditha.cppnorm.varid;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Name to variable id bindings with nested scopes.
 * <p>
 * Entering a scope pushes a checkpoint. Binding a name inside the scope remembers the
 * binding it shadows, and leaving the scope puts those bindings back, so an outer
 * variable becomes visible again once the inner one goes out of scope.
 */
public class VariableMap {

    /** Where a variable was declared. */
    public enum Origin { GLOBAL, MEMBER, LOCAL }

    public record Binding(int id, Origin origin) {
    }

    private final Map<String, Binding> visible = new HashMap<>();
    private final Deque<Map<String, Binding>> checkpoints = new ArrayDeque<>();
    private final Map<String, Integer> globals = new HashMap<>();

    public void enterScope() {
        checkpoints.push(new HashMap<>());
    }

    /**
     * Drop the bindings made since the matching {@link #enterScope()} and restore the
     * ones they shadowed.
     *
     * @throws IllegalStateException at file scope
     */
    public void leaveScope() {
        if (checkpoints.isEmpty()) {
            throw new IllegalStateException("no scope to leave");
        }
        for (Map.Entry<String, Binding> saved : checkpoints.pop().entrySet()) {
            if (saved.getValue() == null) {
                visible.remove(saved.getKey());
            } else {
                visible.put(saved.getKey(), saved.getValue());
            }
        }
    }

    public void bind(String name, int id, Origin origin) {
        Map<String, Binding> top = checkpoints.peek();
        if (top != null && !top.containsKey(name)) {
            top.put(name, visible.get(name));
        }
        visible.put(name, new Binding(id, origin));
        if (top == null) {
            globals.put(name, id);
        }
    }

    public Optional<Binding> find(String name) {
        return Optional.ofNullable(visible.get(name));
    }

    /** Binding made at file scope, used for {@code ::name}. */
    public OptionalInt global(String name) {
        Integer id = globals.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public boolean isVariable(String name) {
        return visible.containsKey(name);
    }

    /** Whether the name was bound in the innermost scope. */
    public boolean isBoundInCurrentScope(String name) {
        Map<String, Binding> top = checkpoints.peek();
        return top == null ? globals.containsKey(name) : top.containsKey(name);
    }

    public int depth() {
        return checkpoints.size();
    }
}
