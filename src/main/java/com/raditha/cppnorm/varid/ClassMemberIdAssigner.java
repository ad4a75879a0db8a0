package com.raditha.cppnorm.varid;

import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import com.raditha.cppnorm.scope.ScopeInfo;
import com.raditha.cppnorm.scope.ScopeKind;
import com.raditha.cppnorm.scope.ScopeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Second variable id pass: data members used where the first pass could not see them.
 * <p>
 * That covers member function bodies defined outside the class, inline bodies that use
 * a member declared further down, constructor initializer lists, {@code this->x} and
 * {@code C::x}. Inherited members are found through the base classes. A local variable
 * always wins over a member of the same name, a member wins over a global.
 */
public class ClassMemberIdAssigner {

    private static final Logger logger = LoggerFactory.getLogger(ClassMemberIdAssigner.class);

    /**
     * @return number of tokens given a member id
     */
    public int assign(TokenList tokens, VariableIdAssigner.Summary summary) {
        if (summary.memberIds().isEmpty()) {
            return 0;
        }
        Map<String, Map<String, Integer>> members = collectMembers(tokens, summary.memberIds());
        logger.debug("Collected data members of {} class(es)", members.size());
        return new Stamper(members, summary.globalIds()).run(tokens);
    }

    private static Map<String, Map<String, Integer>> collectMembers(TokenList tokens, Set<Integer> memberIds) {
        Map<String, Map<String, Integer>> members = new HashMap<>();
        ScopeTracker tracker = new ScopeTracker();
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (!tracker.update(tok)) {
                break;
            }
            ScopeInfo scope = tracker.current();
            if (scope.kind() == ScopeKind.RECORD && memberIds.contains(tok.varId())) {
                members.computeIfAbsent(scope.fullName(), k -> new HashMap<>()).putIfAbsent(tok.str(), tok.varId());
            }
        }
        return members;
    }

    private static final class Stamper {
        private final Map<String, Map<String, Integer>> members;
        private final Set<Integer> globalIds;
        private final ScopeTracker tracker = new ScopeTracker();
        private ScopeInfo initializerRecord;
        private Token initializerEnd;
        private int stamped;

        Stamper(Map<String, Map<String, Integer>> members, Set<Integer> globalIds) {
            this.members = members;
            this.globalIds = globalIds;
        }

        int run(TokenList tokens) {
            for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
                if (tok == initializerEnd) {
                    initializerRecord = null;
                    initializerEnd = null;
                }
                if (!tracker.update(tok)) {
                    break;
                }
                if (initializerRecord == null) {
                    startInitializerList(tok);
                }
                if (tok.isIdentifier()) {
                    visit(tok);
                }
            }
            return stamped;
        }

        /**
         * {@code A::A(...) : x(1), y{2} {}} keeps {@code A} current until the body.
         */
        private void startInitializerList(Token tok) {
            if (!TokenPattern.match(tok, "%name% :: %name% (") || !tok.isIdentifier()
                    || !tok.str().equals(tok.tokAt(2).str())) {
                return;
            }
            Token close = tok.tokAt(3).link();
            if (close == null || !TokenPattern.simpleMatch(close.next(), ":")) {
                return;
            }
            Token body = DeclarationParser.functionBodyAfter(close);
            if (body == null) {
                return;
            }
            Optional<ScopeInfo> record = tracker.findRecord(tok.str());
            if (record.isPresent()) {
                initializerRecord = record.get();
                initializerEnd = body;
            }
        }

        private void visit(Token tok) {
            Token prev = tok.previous();
            if (TokenPattern.match(tok.next(), "::") || TokenPattern.match(prev, "goto|~")) {
                return;
            }
            if (TokenPattern.match(prev, ".|->")) {
                if (TokenPattern.simpleMatch(prev.previous(), "this") && prev.is("->")) {
                    memberOfEnclosing(tok);
                }
                return;
            }
            if (TokenPattern.simpleMatch(prev, "::")) {
                Token owner = prev.previous();
                if (owner != null && owner.isIdentifier()) {
                    tracker.findRecord(qualifierOf(owner)).ifPresent(r -> stamp(tok, r));
                }
                return;
            }
            if (tok.varId() != 0 && !globalIds.contains(tok.varId())) {
                return;
            }
            memberOfEnclosing(tok);
        }

        private void memberOfEnclosing(Token tok) {
            if (initializerRecord != null) {
                stamp(tok, initializerRecord);
                return;
            }
            tracker.enclosingRecord().ifPresent(r -> stamp(tok, r));
        }

        private void stamp(Token tok, ScopeInfo record) {
            OptionalInt id = lookup(record, tok.str(), new HashSet<>());
            if (id.isPresent() && tok.varId() != id.getAsInt()) {
                tok.setVarId(id.getAsInt());
                stamped++;
            }
        }

        private OptionalInt lookup(ScopeInfo record, String name, Set<String> seen) {
            if (!seen.add(record.fullName())) {
                return OptionalInt.empty();
            }
            Integer own = members.getOrDefault(record.fullName(), Map.of()).get(name);
            if (own != null) {
                return OptionalInt.of(own);
            }
            for (String base : record.baseTypes()) {
                Optional<ScopeInfo> baseRecord = tracker.findRecord(record.parent(), base);
                if (baseRecord.isPresent()) {
                    OptionalInt inherited = lookup(baseRecord.get(), name, seen);
                    if (inherited.isPresent()) {
                        return inherited;
                    }
                }
            }
            return OptionalInt.empty();
        }
    }

    /** {@code "A::B"} for the qualifier ending at {@code last} in {@code A::B::x}. */
    private static String qualifierOf(Token last) {
        StringBuilder sb = new StringBuilder(last.str());
        Token t = last.previous();
        while (TokenPattern.simpleMatch(t, "::") && t.previous() != null && t.previous().isIdentifier()) {
            sb.insert(0, t.previous().str() + "::");
            t = t.tokAt(-2);
        }
        return sb.toString();
    }
}
