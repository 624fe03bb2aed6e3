package io.evalsandbox.core.runtime.datalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers queries by semi-naive bottom-up evaluation.
 *
 * <p>
 * Only rules the query's relation depends on are evaluated. The first round applies every such rule to the
 * asserted facts; each later round re-applies a rule once per body position that has new facts from the
 * previous round, drawing that position from the new facts only. Evaluation stops when a round derives
 * nothing new. Derived facts are charged to the {@link MemoryMeter} as they are produced and released when
 * the query returns, so a program that derives facts without bound exhausts the meter instead of the heap.
 */
final class FixpointEvaluator {

    private final KnowledgeBase kb;
    private final Builtins builtins;
    private final MemoryMeter meter;
    private final Runnable checkpoint;

    /**
     * @param checkpoint called at every evaluation step; throws to abort the query
     */
    FixpointEvaluator(KnowledgeBase kb, Builtins builtins, MemoryMeter meter, Runnable checkpoint) {
        this.kb = kb;
        this.builtins = builtins;
        this.meter = meter;
        this.checkpoint = checkpoint;
    }

    /** Returns every fact matching {@code goal}, in assertion order followed by derivation order. */
    List<Literal> query(Literal goal) {
        if (builtins.isReserved(goal.predicate())) {
            return builtins.solve(goal)
                    .filter(solved -> match(goal, solved, new HashMap<>()) != null)
                    .map(List::of)
                    .orElse(List.of());
        }
        Derivation derivation = new Derivation();
        try {
            derivation.run(relevantRules(goal.key()));
            List<Literal> answers = new ArrayList<>();
            for (Literal fact : derivation.facts(goal.key())) {
                if (match(goal, fact, new HashMap<>()) != null) {
                    answers.add(fact);
                }
            }
            return answers;
        } finally {
            meter.release(derivation.chargedBytes);
        }
    }

    /** Rules whose head relation the goal relation transitively depends on. */
    private List<Clause> relevantRules(String goalKey) {
        Set<String> needed = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(goalKey);
        while (!pending.isEmpty()) {
            String key = pending.poll();
            if (!needed.add(key)) {
                continue;
            }
            for (Clause rule : kb.rules()) {
                if (rule.head().key().equals(key)) {
                    for (Literal literal : rule.body()) {
                        if (!builtins.isReserved(literal.predicate())) {
                            pending.add(literal.key());
                        }
                    }
                }
            }
        }
        List<Clause> relevant = new ArrayList<>();
        for (Clause rule : kb.rules()) {
            if (needed.contains(rule.head().key())) {
                relevant.add(rule);
            }
        }
        return relevant;
    }

    /** State of one query's fixpoint computation. */
    private final class Derivation {

        private final Map<String, Set<Literal>> derived = new HashMap<>();
        private long chargedBytes;

        void run(List<Clause> rules) {
            if (rules.isEmpty()) {
                return;
            }
            Map<String, Set<Literal>> delta = new HashMap<>();
            for (Clause rule : rules) {
                Set<Literal> heads = new LinkedHashSet<>();
                join(rule, 0, -1, null, new HashMap<>(), heads);
                record(heads, delta);
            }
            while (!delta.isEmpty()) {
                checkpoint.run();
                Map<String, Set<Literal>> next = new HashMap<>();
                for (Clause rule : rules) {
                    List<Literal> body = rule.body();
                    for (int i = 0; i < body.size(); i++) {
                        Set<Literal> changed = delta.get(body.get(i).key());
                        if (changed != null && !builtins.isReserved(body.get(i).predicate())) {
                            Set<Literal> heads = new LinkedHashSet<>();
                            join(rule, 0, i, changed, new HashMap<>(), heads);
                            record(heads, next);
                        }
                    }
                }
                delta = next;
            }
        }

        /** Asserted facts followed by derived facts of one relation. */
        Iterable<Literal> facts(String key) {
            Set<Literal> asserted = kb.facts(key);
            Set<Literal> extra = derived.get(key);
            if (extra == null || extra.isEmpty()) {
                return asserted;
            }
            List<Literal> all = new ArrayList<>(asserted.size() + extra.size());
            all.addAll(asserted);
            all.addAll(extra);
            return all;
        }

        private boolean isKnown(Literal fact) {
            if (kb.contains(fact)) {
                return true;
            }
            Set<Literal> relation = derived.get(fact.key());
            return relation != null && relation.contains(fact);
        }

        private void record(Set<Literal> heads, Map<String, Set<Literal>> delta) {
            for (Literal head : heads) {
                derived.computeIfAbsent(head.key(), k -> new LinkedHashSet<>()).add(head);
                delta.computeIfAbsent(head.key(), k -> new LinkedHashSet<>()).add(head);
            }
        }

        /**
         * Enumerates body solutions left to right. Position {@code deltaPos} draws from {@code delta}, every
         * other relational position from all known facts. New heads are charged and collected into
         * {@code out}; they become visible to joins only after the current rule finishes.
         */
        private void join(
                Clause rule,
                int index,
                int deltaPos,
                Set<Literal> delta,
                Map<Term.Var, Term> bindings,
                Set<Literal> out) {
            checkpoint.run();
            if (index == rule.body().size()) {
                Literal head = rule.head().substitute(bindings);
                if (!isKnown(head) && !out.contains(head)) {
                    long size = MemoryMeter.sizeOf(head);
                    meter.charge(size);
                    chargedBytes += size;
                    out.add(head);
                }
                return;
            }
            Literal literal = rule.body().get(index);
            if (builtins.isReserved(literal.predicate())) {
                Literal instantiated = literal.substitute(bindings);
                Optional<Literal> solved = builtins.solve(instantiated);
                if (solved.isPresent()) {
                    Map<Term.Var, Term> extended = match(instantiated, solved.get(), bindings);
                    if (extended != null) {
                        join(rule, index + 1, deltaPos, delta, extended, out);
                    }
                }
                return;
            }
            Iterable<Literal> source = index == deltaPos ? delta : facts(literal.key());
            for (Literal fact : source) {
                Map<Term.Var, Term> extended = match(literal, fact, bindings);
                if (extended != null) {
                    join(rule, index + 1, deltaPos, delta, extended, out);
                }
            }
        }
    }

    /**
     * Matches {@code pattern} against ground {@code fact} under {@code bindings}. Returns the extended bindings,
     * or {@code null} if they do not match. {@code bindings} is never modified.
     */
    static Map<Term.Var, Term> match(Literal pattern, Literal fact, Map<Term.Var, Term> bindings) {
        if (!pattern.predicate().equals(fact.predicate()) || pattern.arity() != fact.arity()) {
            return null;
        }
        Map<Term.Var, Term> extended = null;
        for (int i = 0; i < pattern.arity(); i++) {
            Term p = pattern.args().get(i);
            Term f = fact.args().get(i);
            if (p instanceof Term.Var v) {
                Term current = extended != null ? extended.get(v) : bindings.get(v);
                if (current == null) {
                    if (extended == null) {
                        extended = new HashMap<>(bindings);
                    }
                    extended.put(v, f);
                } else if (!current.equals(f)) {
                    return null;
                }
            } else if (!p.equals(f)) {
                return null;
            }
        }
        return extended != null ? extended : bindings;
    }
}
