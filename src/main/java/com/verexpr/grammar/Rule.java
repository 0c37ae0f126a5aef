package com.verexpr.grammar;

import java.util.Objects;

public record Rule(String name, RuleKind kind, PegExpr body) {
    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(body, "body");
    }
}
