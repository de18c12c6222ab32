package org.stylecast.lowering.frontend.css;

import java.util.List;

/**
 * A node of the generic CSS parse tree produced by {@link CssTreeParser}.
 */
public sealed interface CssNode {

    /**
     * A style rule. The selector is fully resolved against enclosing rules and
     * carries the {@link CssTreeParser#SELECTOR_SENTINEL} after every {@code &}.
     */
    record Rule(String selector, List<CssNode> children) implements CssNode {
        public Rule {
            children = List.copyOf(children);
        }
    }

    /** A declaration, {@code text} is the raw statement without the terminating semicolon. */
    record Declaration(String text) implements CssNode {}

    /** A comment including its delimiters. */
    record Comment(String text) implements CssNode {}

    /** An at-rule such as {@code @media (min-width: 600px)}; block-less at-rules have no children. */
    record AtRule(String name, String params, List<CssNode> children) implements CssNode {
        public AtRule {
            children = List.copyOf(children);
        }

        /**
         * @return The at-rule prelude as written, e.g. {@code @media (min-width: 600px)}.
         */
        public String text() {
            return params.isEmpty() ? "@" + name : "@" + name + " " + params;
        }
    }
}
