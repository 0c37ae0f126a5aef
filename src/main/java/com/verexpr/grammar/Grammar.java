package com.verexpr.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Objects;

/**
 * An immutable, validated set of named rules with a designated start rule.
 *
 * <p>If {@code WHITESPACE} or {@code COMMENT} rules are defined, every sequence and repetition
 * in non-atomic context skips any run of them between its elements.
 */
public final class Grammar {
    public static final String WHITESPACE = "WHITESPACE";
    public static final String COMMENT = "COMMENT";

    private final ImmutableList<Rule> rules;
    private final ImmutableMap<String, Rule> rulesByName;
    private final String startRule;
    private final ImmutableList<Rule> skipRules;

    private Grammar(ImmutableList<Rule> rules, ImmutableMap<String, Rule> rulesByName, String startRule) {
        this.rules = rules;
        this.rulesByName = rulesByName;
        this.startRule = startRule;
        this.skipRules = Lists.immutable.of(WHITESPACE, COMMENT)
            .collectIf(rulesByName::containsKey, rulesByName::get);
    }

    public static Builder builder(String startRule) {
        return new Builder(startRule);
    }

    public String startRule() {
        return startRule;
    }

    /** Returns the rule with the given name, or {@code null} if none is defined. */
    public Rule rule(String name) {
        return rulesByName.get(name);
    }

    public boolean defines(String name) {
        return rulesByName.containsKey(name);
    }

    /** Rules in definition order. */
    public ImmutableList<Rule> rules() {
        return rules;
    }

    public ImmutableList<Rule> skipRules() {
        return skipRules;
    }

    public boolean hasSkipRules() {
        return skipRules.notEmpty();
    }

    public static final class Builder {
        private final String startRule;
        private final MutableList<Rule> rules = Lists.mutable.empty();
        private final MutableMap<String, Rule> rulesByName = Maps.mutable.empty();

        private Builder(String startRule) {
            this.startRule = Objects.requireNonNull(startRule, "startRule");
        }

        public Builder rule(String name, PegExpr body) {
            return rule(name, RuleKind.NORMAL, body);
        }

        public Builder rule(String name, RuleKind kind, PegExpr body) {
            if (Builtins.isBuiltin(name)) {
                throw new GrammarException("Rule '" + name + "' redefines a built-in rule");
            }
            if (rulesByName.containsKey(name)) {
                throw new GrammarException("Rule '" + name + "' is defined more than once");
            }
            Rule rule = new Rule(name, kind, body);
            rules.add(rule);
            rulesByName.put(name, rule);
            return this;
        }

        public Grammar build() {
            Rule start = rulesByName.get(startRule);
            if (start == null) {
                throw new GrammarException("Start rule '" + startRule + "' is not defined");
            }
            if (!start.kind().producesNode()) {
                throw new GrammarException("Start rule '" + startRule + "' must not be silent");
            }
            for (Rule rule : rules) {
                MutableSet<String> referenced = Sets.mutable.empty();
                collectReferences(rule.body(), referenced);
                for (String name : referenced) {
                    if (!rulesByName.containsKey(name) && !Builtins.isBuiltin(name)) {
                        throw new GrammarException("Rule '" + rule.name() + "' references undefined rule '" + name + "'");
                    }
                }
            }
            return new Grammar(rules.toImmutable(), rulesByName.toImmutable(), startRule);
        }

        private static void collectReferences(PegExpr expr, MutableSet<String> names) {
            if (expr instanceof PegExpr.RuleRef ref) {
                names.add(ref.name());
            } else if (expr instanceof PegExpr.Sequence sequence) {
                for (PegExpr item : sequence.items()) {
                    collectReferences(item, names);
                }
            } else if (expr instanceof PegExpr.Choice choice) {
                for (PegExpr alternative : choice.alternatives()) {
                    collectReferences(alternative, names);
                }
            } else if (expr instanceof PegExpr.Repeat repeat) {
                collectReferences(repeat.inner(), names);
            } else if (expr instanceof PegExpr.Lookahead lookahead) {
                collectReferences(lookahead.inner(), names);
            }
        }
    }
}
