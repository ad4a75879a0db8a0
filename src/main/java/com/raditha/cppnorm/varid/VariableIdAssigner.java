package com.raditha.cppnorm.varid;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.Token;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.model.TokenPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Gives every variable a small positive id and stamps it on the declaration and on
 * each reference.
 * <p>
 * The first pass walks the tokens once, keeping a stack of frames that mirrors braces
 * and the parentheses of parameter lists and control statements, and a
 * {@link VariableMap} whose scopes follow the frames. Declarations are recognised by
 * {@link DeclarationParser} at positions where a declaration may start. Member accesses
 * {@code a.x} get ids of their own, keyed by the id of {@code a}. The second pass,
 * {@link ClassMemberIdAssigner}, resolves the members of classes used in member
 * function bodies defined away from their declarations.
 */
public class VariableIdAssigner {

    private static final Logger logger = LoggerFactory.getLogger(VariableIdAssigner.class);

    enum FrameKind {
        GLOBAL, NAMESPACE, RECORD, ENUM, FUNCTION, BLOCK, CONTROL, PARAMS, INITIALIZER;

        boolean isExecutable() {
            return this == FUNCTION || this == BLOCK || this == CONTROL || this == INITIALIZER;
        }

        boolean allowsDeclarations() {
            return this != ENUM && this != INITIALIZER;
        }
    }

    private static final class Frame {
        private FrameKind kind;
        private Token open;
        private Token awaitedBody;
        private boolean pendingStatement;

        Frame(FrameKind kind, Token open) {
            this.kind = kind;
            this.open = open;
        }

        boolean isBraced() {
            return open != null && open.is("{");
        }
    }

    /**
     * Ids handed out by the first pass that the second pass needs.
     *
     * @param lastId          highest id assigned
     * @param globalIds       ids of variables declared at namespace or file scope
     * @param memberIds       ids of data members declared in class bodies
     */
    public record Summary(int lastId, Set<Integer> globalIds, Set<Integer> memberIds) {
    }

    private final DeclarationParser parser = new DeclarationParser();

    /**
     * Run both passes.
     *
     * @return number of ids handed out
     * @throws SimplifyException of kind {@code INTERNAL} when a closing brace does not
     *                           match the innermost open frame
     */
    public int assign(TokenList tokens) {
        Summary summary = assignStructural(tokens);
        if (tokens.isCpp()) {
            int stamped = new ClassMemberIdAssigner().assign(tokens, summary);
            logger.debug("Class member pass stamped {} token(s)", stamped);
        }
        return summary.lastId();
    }

    /**
     * First pass: declarations, shadowing and member accesses.
     */
    public Summary assignStructural(TokenList tokens) {
        return new Pass(tokens).run();
    }

    private final class Pass {
        private final TokenList tokens;
        private final VariableMap variables = new VariableMap();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Set<Token> parameterLists = new HashSet<>();
        private final Map<Integer, Map<String, Integer>> memberAccessIds = new HashMap<>();
        private final Set<Integer> globalIds = new HashSet<>();
        private final Set<Integer> memberIds = new HashSet<>();
        private Token recordEnd;
        private int lastId;

        Pass(TokenList tokens) {
            this.tokens = tokens;
            frames.push(new Frame(FrameKind.GLOBAL, null));
        }

        Summary run() {
            Token tok = tokens.front();
            while (tok != null) {
                if (startsDeclaration(tok)) {
                    Token resume = declare(tok);
                    if (resume != null && resume != tok) {
                        tok = resume;
                        continue;
                    }
                }
                structure(tok);
                if (tok.isIdentifier() && tok.varId() == 0) {
                    reference(tok);
                }
                tok = tok.next();
            }
            if (frames.size() > 1) {
                logger.debug("{} frame(s) still open at end of input", frames.size() - 1);
            }
            return new Summary(lastId, Set.copyOf(globalIds), Set.copyOf(memberIds));
        }

        private boolean startsDeclaration(Token tok) {
            Frame frame = frames.peek();
            if (!frame.kind.allowsDeclarations() || !(tok.isName() || tok.is("::") || tok.is("~") || tok.is("["))) {
                return false;
            }
            Token prev = tok.previous();
            if (prev == null) {
                return true;
            }
            if (prev == recordEnd) {
                return false;
            }
            if (TokenPattern.match(prev, ";|{|}|else|do")) {
                return !(frame.kind == FrameKind.PARAMS && prev.is(";"));
            }
            if (prev.is("(")) {
                return prev == frame.open && (frame.kind == FrameKind.PARAMS || frame.kind == FrameKind.CONTROL);
            }
            if (prev.is(",")) {
                return frame.kind == FrameKind.PARAMS && frame.awaitedBody == null;
            }
            if (prev.is(":")) {
                return frame.kind == FrameKind.RECORD || frame.kind == FrameKind.BLOCK
                        || frame.kind == FrameKind.FUNCTION || frame.kind == FrameKind.CONTROL;
            }
            return prev.is(">") && prev.link() != null && TokenPattern.simpleMatch(prev.link().previous(), "template");
        }

        /**
         * Try a declaration at {@code tok}; returns where to continue, or null when
         * there is none.
         */
        private Token declare(Token tok) {
            Frame frame = frames.peek();
            if (TokenPattern.simpleMatch(tok, "template <") && tok.next().link() != null) {
                return tok.next().link().next();
            }
            if (tok.isIdentifier() && TokenPattern.simpleMatch(tok.next(), ":") && frame.kind.isExecutable()) {
                // label
                return null;
            }
            boolean single = frame.kind == FrameKind.PARAMS;
            Optional<DeclarationParser.Declaration> decl =
                    parser.parse(tok, frame.kind.isExecutable(), single, variables::isVariable);
            if (decl.isEmpty()) {
                return null;
            }
            for (Token name : decl.get().names()) {
                bind(name, frame);
            }
            if (decl.get().isFunction()) {
                parameterLists.add(decl.get().params());
            }
            return decl.get().typeEnd().next();
        }

        private void declareAfterRecord(Token closingBrace) {
            Frame frame = frames.peek();
            parser.parseAfterBody(closingBrace, frame.kind.isExecutable(), variables::isVariable)
                    .ifPresent(d -> d.names().forEach(name -> bind(name, frame)));
        }

        private void bind(Token name, Frame frame) {
            VariableMap.Origin origin = switch (frame.kind) {
                case GLOBAL, NAMESPACE -> VariableMap.Origin.GLOBAL;
                case RECORD -> VariableMap.Origin.MEMBER;
                default -> VariableMap.Origin.LOCAL;
            };
            Optional<VariableMap.Binding> existing = variables.find(name.str());
            int id;
            if (existing.isPresent() && variables.isBoundInCurrentScope(name.str())
                    && existing.get().origin() == origin && origin != VariableMap.Origin.LOCAL) {
                // "extern int x; int x;" declares one variable
                id = existing.get().id();
            } else {
                id = ++lastId;
                variables.bind(name.str(), id, origin);
            }
            if (origin == VariableMap.Origin.GLOBAL) {
                globalIds.add(id);
            } else if (origin == VariableMap.Origin.MEMBER) {
                memberIds.add(id);
            }
            name.setVarId(id);
        }

        private void structure(Token tok) {
            switch (tok.str()) {
                case "{" -> openBrace(tok);
                case "}" -> closeBrace(tok);
                case "(" -> openParen(tok);
                case ")" -> closeParen(tok);
                case ";" -> {
                    while (frames.peek().pendingStatement) {
                        pop();
                    }
                }
                default -> {
                }
            }
        }

        private void openBrace(Token tok) {
            Frame top = frames.peek();
            if (top.awaitedBody == tok) {
                top.open = tok;
                top.awaitedBody = null;
                if (top.kind == FrameKind.PARAMS) {
                    top.kind = FrameKind.FUNCTION;
                }
                return;
            }
            push(new Frame(classifyBrace(tok, top), tok));
        }

        private void closeBrace(Token tok) {
            while (frames.peek().kind != FrameKind.GLOBAL && !frames.peek().isBraced()) {
                pop();
            }
            Frame top = frames.peek();
            if (top.kind == FrameKind.GLOBAL || !top.isBraced() || top.open.link() != tok) {
                throw SimplifyException.internal(tok, "Unexpected '}' while assigning variable ids.");
            }
            pop();
            if (top.kind == FrameKind.RECORD || top.kind == FrameKind.ENUM) {
                recordEnd = tok;
                declareAfterRecord(tok);
            }
            while (frames.peek().pendingStatement) {
                pop();
            }
        }

        private void openParen(Token tok) {
            if (parameterLists.remove(tok) || isLambdaParameters(tok)) {
                push(new Frame(FrameKind.PARAMS, tok));
            } else if (TokenPattern.match(tok.previous(), "if|while|switch|for|catch|constexpr")) {
                push(new Frame(FrameKind.CONTROL, tok));
            }
        }

        private void closeParen(Token tok) {
            Frame top = frames.peek();
            if (top.open == null || top.open.link() != tok) {
                return;
            }
            if (top.kind == FrameKind.PARAMS) {
                Token body = DeclarationParser.functionBodyAfter(tok);
                if (body == null) {
                    pop();
                } else {
                    top.awaitedBody = body;
                }
            } else if (top.kind == FrameKind.CONTROL) {
                if (TokenPattern.simpleMatch(tok.next(), "{")) {
                    top.awaitedBody = tok.next();
                } else if (endsDoWhile(top.open)) {
                    pop();
                } else {
                    top.pendingStatement = true;
                }
            }
        }

        private void push(Frame frame) {
            frames.push(frame);
            variables.enterScope();
        }

        private void pop() {
            frames.pop();
            variables.leaveScope();
        }

        /**
         * Stamp a reference to a variable.
         */
        private void reference(Token tok) {
            Token prev = tok.previous();
            Token next = tok.next();
            if (TokenPattern.match(next, "::") || TokenPattern.match(prev, "goto|~")) {
                return;
            }
            if (TokenPattern.match(prev, ".|->")) {
                member(tok, prev.previous());
                return;
            }
            if (TokenPattern.simpleMatch(prev, "::")) {
                Token before = prev.previous();
                if (before == null || !(before.isIdentifier() || before.is(">"))) {
                    variables.global(tok.str()).ifPresent(tok::setVarId);
                }
                return;
            }
            variables.find(tok.str()).ifPresent(b -> tok.setVarId(b.id()));
        }

        private void member(Token tok, Token base) {
            if (TokenPattern.simpleMatch(tok.next(), "(")) {
                return;
            }
            while (base != null && base.is("]") && base.link() != null) {
                base = base.link().previous();
            }
            if (base == null || base.varId() == 0) {
                return;
            }
            Map<String, Integer> members = memberAccessIds.computeIfAbsent(base.varId(), k -> new HashMap<>());
            Integer id = members.get(tok.str());
            if (id == null) {
                id = ++lastId;
                members.put(tok.str(), id);
            }
            tok.setVarId(id);
        }
    }

    private static FrameKind classifyBrace(Token tok, Frame top) {
        FrameKind declared = recordOrNamespace(tok);
        if (declared != null) {
            return declared;
        }
        Token prev = tok.previous();
        if (prev == null) {
            return FrameKind.BLOCK;
        }
        if (top.kind == FrameKind.INITIALIZER || top.kind == FrameKind.ENUM) {
            return FrameKind.INITIALIZER;
        }
        if (TokenPattern.match(prev, "=|return|,|(|[|?|<")) {
            return FrameKind.INITIALIZER;
        }
        if (prev.is("]")) {
            return isLambdaIntroducer(prev.link()) ? FrameKind.BLOCK : FrameKind.INITIALIZER;
        }
        if (prev.isIdentifier() || (prev.is(">") && prev.link() != null)) {
            return FrameKind.INITIALIZER;
        }
        return FrameKind.BLOCK;
    }

    /**
     * Walk back over the head of the statement owning {@code lbrace} looking for the
     * keyword that introduces a class, enum or namespace body.
     */
    private static FrameKind recordOrNamespace(Token lbrace) {
        for (Token t = lbrace.previous(); t != null; t = t.previous()) {
            if (TokenPattern.match(t, ";|{|}|(|)|=|return")) {
                return null;
            }
            if (t.is(">") && t.link() != null) {
                t = t.link();
            } else if (t.is("namespace")) {
                return FrameKind.NAMESPACE;
            } else if (t.is("enum")) {
                return FrameKind.ENUM;
            } else if (TokenPattern.match(t, "class|struct|union")) {
                return TokenPattern.simpleMatch(t.previous(), "enum") ? FrameKind.ENUM : FrameKind.RECORD;
            } else if (TokenPattern.match(t, "%str%") && TokenPattern.simpleMatch(t.previous(), "extern")) {
                return FrameKind.NAMESPACE;
            }
        }
        return null;
    }

    /** {@code do {..} while (cond);} has no statement after the condition. */
    private static boolean endsDoWhile(Token open) {
        Token keyword = open.previous();
        if (!TokenPattern.simpleMatch(keyword, "while")) {
            return false;
        }
        Token before = keyword.previous();
        if (before != null && before.is("}") && before.link() != null) {
            return TokenPattern.simpleMatch(before.link().previous(), "do");
        }
        return before != null && before.is(";") && isSingleStatementDo(before);
    }

    private static boolean isSingleStatementDo(Token semicolon) {
        Token t = semicolon.previous();
        while (t != null && !TokenPattern.match(t, ";|{|}")) {
            if (t.is("do")) {
                return true;
            }
            t = t.is(")") && t.link() != null ? t.link().previous() : t.previous();
        }
        return false;
    }

    private static boolean isLambdaParameters(Token open) {
        Token prev = open.previous();
        return prev != null && prev.is("]") && isLambdaIntroducer(prev.link());
    }

    private static boolean isLambdaIntroducer(Token open) {
        if (open == null) {
            return false;
        }
        Token before = open.previous();
        return before == null || TokenPattern.match(before, "(|,|=|{|;|return|}|[");
    }
}
