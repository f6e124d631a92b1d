package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.config.FilterEngineConfig;
import com.fsnow.filterengine.exception.CanonicalizationException;
import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.Term;
import com.google.common.collect.Lists;
import com.google.common.primitives.ImmutableLongArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Converts a standardized filter tree to a minimized disjunctive normal form.
 * <p>
 * Every literal and every compound leaf of the tree is a boolean variable.
 * The tree is evaluated for each of the 2^n assignments, the resulting truth
 * table is minimized, and each implicant is mapped back to an AND-clause:
 * <pre>
 * and[equals a=1, or[exists b, equals c=2]]
 *   =&gt; [[equals a=1, exists b], [equals a=1, equals c=2]]
 * </pre>
 * Compound leaves are expanded after minimization, then clauses are
 * simplified: impossible clauses are dropped, a clause absorbs its supersets,
 * and {@code everything} conditions are removed from AND-clauses holding
 * other conditions. The output is deterministic: terms are sorted within
 * clauses, and clauses are sorted.
 */
public class CanonicalConverter {

    private static final Logger logger = LoggerFactory.getLogger(CanonicalConverter.class);

    private final int maxConditionsPerFilter;
    private final QuineMcCluskeyMinimizer minimizer;
    private final ImpossiblePredicateFilter impossiblePredicateFilter;

    public CanonicalConverter(FilterEngineConfig config) {
        this(config, new QuineMcCluskeyMinimizer());
    }

    CanonicalConverter(FilterEngineConfig config, QuineMcCluskeyMinimizer minimizer) {
        this.maxConditionsPerFilter = config.getMaxConditionsPerFilter();
        this.minimizer = minimizer;
        this.impossiblePredicateFilter = new ImpossiblePredicateFilter();
    }

    /**
     * Converts a standardized filter.
     *
     * @param filter The standardized filter tree
     * @return AND-clauses, OR'ed together
     * @throws FilterValidationException if the filter has too many conditions
     * @throws CanonicalizationException if the truth table cannot be minimized
     */
    public List<List<Term>> convert(FilterNode filter) {
        List<FilterNode> variables = new ArrayList<>();
        extractVariables(filter, variables);

        if (variables.size() > maxConditionsPerFilter) {
            throw new FilterValidationException("Maximum number of sub conditions reached");
        }

        int n = variables.size();
        long[] minterms = truthTable(filter, n);
        List<Implicant> implicants;

        try {
            implicants = minimizer.minimize(n, minterms);
        } catch (RuntimeException e) {
            throw new CanonicalizationException("Unable to minimize filter " + filter, e);
        }

        if (implicants.isEmpty()) {
            logger.debug("Filter {} can never match", filter);
            return nothing();
        }

        for (Implicant implicant : implicants) {
            if (implicant.isTautology()) {
                logger.debug("Filter {} always matches", filter);
                return List.of(List.of(Term.everything()));
            }
        }

        List<List<Term>> clauses = new ArrayList<>();
        for (Implicant implicant : implicants) {
            clauses.addAll(toClauses(implicant, variables));
        }

        clauses = impossiblePredicateFilter.filter(clauses);
        if (clauses.isEmpty()) {
            return nothing();
        }

        return simplify(sortClauses(clauses));
    }

    private void extractVariables(FilterNode node, List<FilterNode> variables) {
        if (node.isVariable()) {
            variables.add(node);
            return;
        }
        for (FilterNode child : node.getChildren()) {
            extractVariables(child, variables);
        }
    }

    /**
     * Returns the rows satisfying the filter, in increasing order.
     */
    private long[] truthTable(FilterNode filter, int n) {
        long rowCount = 1L << n;
        ImmutableLongArray.Builder minterms = ImmutableLongArray.builder();
        int[] position = new int[1];

        for (long row = 0; row < rowCount; row++) {
            position[0] = 0;
            if (evaluate(filter, row, position)) {
                minterms.add(row);
            }
        }

        return minterms.build().toArray();
    }

    /**
     * Evaluates the tree, variable {@code i} taking the value of bit {@code i} of the row.
     * Variables are numbered in the order they are met, left to right.
     */
    private boolean evaluate(FilterNode node, long row, int[] position) {
        if (node.isVariable()) {
            return (row & (1L << position[0]++)) != 0;
        }

        switch (node.getType()) {
            case NOT:
                return !evaluate(node.getChildren().get(0), row, position);
            case AND: {
                // no short-circuit: every child must consume its variables
                boolean result = true;
                for (FilterNode child : node.getChildren()) {
                    result &= evaluate(child, row, position);
                }
                return result;
            }
            case OR: {
                boolean result = false;
                for (FilterNode child : node.getChildren()) {
                    result |= evaluate(child, row, position);
                }
                return result;
            }
            default:
                throw new CanonicalizationException("Unexpected node type: " + node.getType());
        }
    }

    private List<List<Term>> toClauses(Implicant implicant, List<FilterNode> variables) {
        List<Term> conjunction = new ArrayList<>();
        List<List<Term>> alternatives = new ArrayList<>();

        for (int i = 0; i < variables.size(); i++) {
            if (implicant.isDontCare(i)) {
                continue;
            }

            FilterNode variable = variables.get(i);
            boolean asserted = implicant.isAsserted(i);

            if (variable.isLiteral()) {
                conjunction.add(asserted ? variable.getTerm() : variable.getTerm().negate());
                continue;
            }

            List<Term> terms = new ArrayList<>();
            for (FilterNode child : variable.getChildren()) {
                terms.add(asserted ? child.getTerm() : child.getTerm().negate());
            }

            // and / not(or): every term holds; or / not(and): at least one does
            boolean conjunctive = variable.getType() == FilterNode.Type.AND;
            if (conjunctive == asserted) {
                conjunction.addAll(terms);
            } else {
                alternatives.add(terms);
            }
        }

        if (alternatives.isEmpty()) {
            return List.of(conjunction);
        }

        List<List<Term>> clauses = new ArrayList<>();
        for (List<Term> combination : Lists.cartesianProduct(alternatives)) {
            List<Term> clause = new ArrayList<>(conjunction);
            clause.addAll(combination);
            clauses.add(clause);
        }
        return clauses;
    }

    private List<List<Term>> sortClauses(List<List<Term>> clauses) {
        Map<String, List<Term>> unique = new TreeMap<>();

        for (List<Term> clause : clauses) {
            Map<String, Term> terms = new LinkedHashMap<>();
            for (Term term : clause) {
                terms.putIfAbsent(term.getSortKey(), term);
            }

            List<Term> sorted = new ArrayList<>(terms.values());
            sorted.sort(Comparator.comparing(Term::getSortKey));

            StringBuilder key = new StringBuilder();
            for (Term term : sorted) {
                key.append(term.getSortKey()).append('\n');
            }
            unique.putIfAbsent(key.toString(), sorted);
        }

        return new ArrayList<>(unique.values());
    }

    /**
     * Applies absorption and constant rules to sorted, de-duplicated clauses.
     */
    private List<List<Term>> simplify(List<List<Term>> clauses) {
        List<List<Term>> withoutConstants = new ArrayList<>();
        Set<String> singleTerms = new HashSet<>();

        for (List<Term> clause : clauses) {
            List<Term> terms = new ArrayList<>(clause);
            if (terms.size() > 1) {
                terms.removeIf(term -> term.getKeyword() == Keyword.EVERYTHING);
            }

            if (terms.size() == 1) {
                Term term = terms.get(0);
                // a OR not(a)
                if (term.getKeyword() == Keyword.EVERYTHING || singleTerms.contains(term.negate().getSortKey())) {
                    return List.of(List.of(Term.everything()));
                }
                singleTerms.add(term.getSortKey());
            }
            withoutConstants.add(terms);
        }

        List<List<Term>> result = new ArrayList<>();
        for (List<Term> clause : withoutConstants) {
            boolean absorbed = false;
            for (List<Term> other : withoutConstants) {
                if (other != clause && other.size() < clause.size() && clause.containsAll(other)) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                result.add(clause);
            }
        }

        return sortClauses(result);
    }

    private static List<List<Term>> nothing() {
        return List.of(List.of(Term.nothing()));
    }
}
