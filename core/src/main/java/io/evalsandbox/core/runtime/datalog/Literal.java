package io.evalsandbox.core.runtime.datalog;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A predicate applied to terms, e.g. {@code parent(john, X)}. Predicates are identified by name and arity,
 * so {@code p/1} and {@code p/2} are unrelated.
 */
record Literal(String predicate, List<Term> args) {

    Literal {
        args = List.copyOf(args);
    }

    /** Relation key, e.g. {@code parent/2}. */
    String key() {
        return predicate + "/" + args.size();
    }

    int arity() {
        return args.size();
    }

    boolean isGround() {
        for (Term arg : args) {
            if (!arg.isGround()) {
                return false;
            }
        }
        return true;
    }

    /** Replaces bound variables with their values; unbound variables are kept. */
    Literal substitute(Map<Term.Var, Term> bindings) {
        if (bindings.isEmpty()) {
            return this;
        }
        return new Literal(
                predicate,
                args.stream().map(arg -> arg instanceof Term.Var v ? bindings.getOrDefault(v, v) : arg)
                        .collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return predicate;
        }
        return args.stream().map(Term::toString).collect(Collectors.joining(", ", predicate + "(", ")"));
    }
}
