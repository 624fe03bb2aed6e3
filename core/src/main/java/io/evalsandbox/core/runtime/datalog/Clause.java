package io.evalsandbox.core.runtime.datalog;

import java.util.List;
import java.util.stream.Collectors;

/** A rule {@code head :- body}. A fact is a clause with an empty body. */
record Clause(Literal head, List<Literal> body) {

    Clause {
        body = List.copyOf(body);
    }

    boolean isFact() {
        return body.isEmpty();
    }

    @Override
    public String toString() {
        if (body.isEmpty()) {
            return head + ".";
        }
        return body.stream().map(Literal::toString).collect(Collectors.joining(", ", head + " :- ", "."));
    }
}
