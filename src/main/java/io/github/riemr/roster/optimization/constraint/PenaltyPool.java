package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.IntVar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Penalty terms collected by the soft constraint builder, consumed by the objective assembler. */
public final class PenaltyPool {

    private final List<PenaltyTerm> terms = new ArrayList<>();

    public PenaltyTerm add(PenaltyFamily family, String name, IntVar variable, long weight, long upperBound) {
        PenaltyTerm term = new PenaltyTerm(family, name, variable, weight, upperBound);
        terms.add(term);
        return term;
    }

    public List<PenaltyTerm> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    public List<PenaltyTerm> termsOf(PenaltyFamily family) {
        return terms.stream().filter(t -> t.family() == family).toList();
    }

    public Map<PenaltyFamily, Integer> countByFamily() {
        Map<PenaltyFamily, Integer> counts = new EnumMap<>(PenaltyFamily.class);
        for (PenaltyTerm t : terms) {
            counts.merge(t.family(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return terms.size();
    }
}
