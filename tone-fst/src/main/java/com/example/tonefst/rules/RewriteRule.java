package com.example.tonefst.rules;

import java.util.List;
import java.util.Objects;

/**
 * Context rule {@code source -> target / left _ right}.
 */
public record RewriteRule(RegexAst left, RegexAst source, RegexAst right, RegexAst target) {

    public RewriteRule {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(target, "target");
    }

    /**
     * Part of the source that the rule keeps as its underlying form: the nodes before the first
     * arrow (without a leading annotation delimiter), or the whole source when it has no arrow.
     *
     * @throws RuleCompilationException if the source is not a {@link RegexAst.Group}
     */
    public List<RegexAst> underlyingSequence() {
        if (!(source instanceof RegexAst.Group group)) {
            throw new RuleCompilationException("Rule source must be a group but was " + source);
        }
        List<RegexAst> nodes = group.nodes();
        int arrow = nodes.indexOf(RegexAst.ARROW);
        if (arrow < 0) {
            return nodes;
        }
        int from = !nodes.isEmpty() && nodes.get(0).equals(RegexAst.ANNOTATION_OPEN) ? 1 : 0;
        return nodes.subList(Math.min(from, arrow), arrow);
    }
}
