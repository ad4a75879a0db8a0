package com.raditha.cppnorm.analyzer;

import com.raditha.cppnorm.alias.TypedefSimplifier;
import com.raditha.cppnorm.alias.UsingSimplifier;
import com.raditha.cppnorm.config.Standard;
import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.linking.BracketLinker;
import com.raditha.cppnorm.linking.TemplateLinker;
import com.raditha.cppnorm.model.TokenList;
import com.raditha.cppnorm.varid.VariableIdAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Runs the normalization phases over one token list in their fixed order:
 * bracket linking, template linking, typedef inlining, using alias inlining and
 * variable ids.
 * <p>
 * The stop flag is checked before each phase. A fatal error in any phase propagates as
 * {@link SimplifyException}; later phases do not run.
 */
public class TokenSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(TokenSimplifier.class);

    private final BracketLinker bracketLinker;
    private final Function<Boolean, TemplateLinker> templateLinkers;
    private final TypedefSimplifier typedefSimplifier;
    private final UsingSimplifier usingSimplifier;
    private final VariableIdAssigner variableIdAssigner;

    public TokenSimplifier() {
        this(new BracketLinker(), TemplateLinker::new, new TypedefSimplifier(), new UsingSimplifier(),
                new VariableIdAssigner());
    }

    /**
     * @param templateLinkers creates the template linker, given whether {@code >>} may
     *                        close two argument lists
     */
    public TokenSimplifier(BracketLinker bracketLinker, Function<Boolean, TemplateLinker> templateLinkers,
            TypedefSimplifier typedefSimplifier, UsingSimplifier usingSimplifier,
            VariableIdAssigner variableIdAssigner) {
        this.bracketLinker = bracketLinker;
        this.templateLinkers = templateLinkers;
        this.typedefSimplifier = typedefSimplifier;
        this.usingSimplifier = usingSimplifier;
        this.variableIdAssigner = variableIdAssigner;
    }

    /**
     * Normalize {@code tokens} in place.
     *
     * @return counters of the phases that ran; {@code completed} is false when the stop
     *         flag ended the run early
     * @throws SimplifyException on unmatched brackets, a failed alias expansion, or
     *                           scope tracking that falls out of step with the braces
     */
    public SimplificationStats simplify(TokenList tokens, SimplifyContext ctx) {
        Counters counters = new Counters();
        runPhases(tokens, ctx, counters);
        if (!counters.completed) {
            logger.info("Stop requested, remaining phases skipped");
        }
        logger.debug("brackets={} templates={} typedefs={} usings={} varids={}",
                counters.brackets, counters.templates, counters.typedefs, counters.usings, counters.varIds);
        return new SimplificationStats(counters.brackets, counters.templates, counters.typedefs, counters.usings,
                ctx.aliasesSkipped(), ctx.aliasUseSites(), counters.varIds, counters.completed);
    }

    private void runPhases(TokenList tokens, SimplifyContext ctx, Counters counters) {
        if (ctx.isStopRequested()) {
            return;
        }
        counters.brackets = bracketLinker.linkBrackets(tokens);

        if (ctx.isStopRequested()) {
            return;
        }
        if (tokens.isCpp()) {
            boolean splitShift = ctx.config().standard().isAtLeast(Standard.CPP11);
            counters.templates = templateLinkers.apply(splitShift).linkTemplates(tokens);
        }

        if (ctx.isStopRequested()) {
            return;
        }
        ctx.deadline().start();
        counters.typedefs = typedefSimplifier.simplify(tokens, ctx);

        if (ctx.isStopRequested()) {
            return;
        }
        counters.usings = usingSimplifier.simplify(tokens, ctx);

        if (ctx.isStopRequested()) {
            return;
        }
        counters.varIds = variableIdAssigner.assign(tokens);
        counters.completed = true;
    }

    private static final class Counters {
        private int brackets;
        private int templates;
        private int typedefs;
        private int usings;
        private int varIds;
        private boolean completed;
    }
}
