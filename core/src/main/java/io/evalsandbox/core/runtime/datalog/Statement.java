package io.evalsandbox.core.runtime.datalog;

/**
 * One parsed top-level statement.
 *
 * @param kind   what to do with the clause
 * @param clause the clause; for queries and retractions only the head is meaningful
 * @param line   1-based source line of the statement's first token
 * @param column 1-based source column of the statement's first token
 */
record Statement(Kind kind, Clause clause, int line, int column) {

    enum Kind {
        /** {@code p(a).} or {@code p(X) :- q(X).} */
        ASSERT,
        /** {@code p(a)~} */
        RETRACT,
        /** {@code p(X)?} */
        QUERY
    }
}
