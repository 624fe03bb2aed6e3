package io.evalsandbox.core.runtime.datalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Asserted facts (indexed by relation key) and rules of one Datalog instance. Not thread-safe. */
final class KnowledgeBase {

    private final Map<String, Set<Literal>> facts = new HashMap<>();
    private final List<Clause> rules = new ArrayList<>();

    /** Adds a ground fact; returns {@code false} if it was already present. */
    boolean addFact(Literal fact) {
        return facts.computeIfAbsent(fact.key(), k -> new LinkedHashSet<>()).add(fact);
    }

    /** Removes a fact; returns {@code false} if it was not present. */
    boolean removeFact(Literal fact) {
        Set<Literal> relation = facts.get(fact.key());
        if (relation == null || !relation.remove(fact)) {
            return false;
        }
        if (relation.isEmpty()) {
            facts.remove(fact.key());
        }
        return true;
    }

    /** Adds a rule; returns {@code false} if an identical rule was already present. */
    boolean addRule(Clause rule) {
        if (rules.contains(rule)) {
            return false;
        }
        rules.add(rule);
        return true;
    }

    boolean contains(Literal fact) {
        Set<Literal> relation = facts.get(fact.key());
        return relation != null && relation.contains(fact);
    }

    /** Facts of one relation in assertion order; empty if none. */
    Set<Literal> facts(String key) {
        Set<Literal> relation = facts.get(key);
        return relation != null ? Collections.unmodifiableSet(relation) : Set.of();
    }

    List<Clause> rules() {
        return Collections.unmodifiableList(rules);
    }
}
