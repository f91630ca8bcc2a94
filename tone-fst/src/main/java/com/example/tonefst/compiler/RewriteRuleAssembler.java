package com.example.tonefst.compiler;

import com.example.tonefst.fst.FstException;
import com.example.tonefst.fst.Fsts;
import com.example.tonefst.fst.WeightedFst;
import com.example.tonefst.rules.RegexAst;
import com.example.tonefst.rules.RewriteRule;

import java.util.List;
import java.util.Objects;

/**
 * Builds the transducer of one context rule. The assembled chain reads
 *
 * <pre>
 * [left] . source:0 . 0:underlying . right . sigma* . 0:target
 * </pre>
 *
 * so the rule consumes its source, emits the underlying part of it in place and appends the
 * target after the rest of the word.
 */
public final class RewriteRuleAssembler {

    private final NodeCompiler compiler;
    private final double delta;

    public RewriteRuleAssembler(NodeCompiler compiler, double delta) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.delta = delta;
    }

    public NodeCompiler compiler() {
        return compiler;
    }

    /**
     * @param dropLeftContext leave the left context out; used when the context is supplied by
     *                        composition instead
     * @throws com.example.tonefst.rules.RuleCompilationException if the rule source is not a group
     */
    public WeightedFst assemble(RewriteRule rule, boolean dropLeftContext) {
        List<RegexAst> underlying = rule.underlyingSequence();

        WeightedFst source = Fsts.outputsToEpsilon(compiler.compile(rule.source()));
        WeightedFst underlyingFragment = Fsts.inputsToEpsilon(compiler.compile(new RegexAst.Group(underlying)));
        WeightedFst target = Fsts.inputsToEpsilon(compiler.compile(rule.target()));

        WeightedFst chain = dropLeftContext
                ? WeightedFst.epsilonSeed(compiler.symbols())
                : context(rule.left());
        Fsts.concat(chain, source);
        Fsts.concat(chain, underlyingFragment);
        Fsts.concat(chain, context(rule.right()));
        Fsts.concat(chain, WeightedFst.sigmaStar(compiler.symbols()));
        Fsts.concat(chain, target);
        Fsts.addSuperFinalState(chain);

        WeightedFst result = WeightedFst.epsilonSeed(compiler.symbols());
        Fsts.concat(result, chain);
        optimize(result);
        return result;
    }

    /**
     * Builds the rule as a local rewrite {@code left . source:0 . 0:underlying . right . 0:target}
     * with the target emitted in place. Blank contexts match nothing, so the fragment covers exactly
     * the rewritten span and its explicit contexts.
     */
    public WeightedFst assembleInPlace(RewriteRule rule) {
        WeightedFst chain = localContext(rule.left());
        Fsts.concat(chain, Fsts.outputsToEpsilon(compiler.compile(rule.source())));
        Fsts.concat(chain, Fsts.inputsToEpsilon(compiler.compile(new RegexAst.Group(rule.underlyingSequence()))));
        Fsts.concat(chain, localContext(rule.right()));
        Fsts.concat(chain, Fsts.inputsToEpsilon(compiler.compile(rule.target())));
        Fsts.addSuperFinalState(chain);
        optimize(chain);
        return chain;
    }

    /**
     * Runs {@link Fsts#optimize}; the automaton is left as it was when the pass fails.
     */
    void optimize(WeightedFst fst) {
        try {
            Fsts.optimize(fst, delta);
        } catch (FstException ex) {
            compiler.diagnostics().warn("Optimization skipped: " + ex.getMessage());
        }
    }

    private WeightedFst context(RegexAst node) {
        if (node instanceof RegexAst.Epsilon) {
            return WeightedFst.sigmaStar(compiler.symbols());
        }
        return compiler.compile(node);
    }

    private WeightedFst localContext(RegexAst node) {
        return node instanceof RegexAst.Epsilon ? WeightedFst.epsilonSeed(compiler.symbols()) : compiler.compile(node);
    }
}
