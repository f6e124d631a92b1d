package com.fsnow.filterengine.transformation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Two-level logic minimizer (Quine-McCluskey).
 * <p>
 * Takes the rows of a truth table for which the function is true and returns
 * a minimal sum of products: prime implicants are computed by merging
 * implicants that differ by a single variable, then essential primes are
 * selected and the remaining rows are covered greedily. The output order is
 * deterministic for a given input.
 */
public class QuineMcCluskeyMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(QuineMcCluskeyMinimizer.class);

    /**
     * Rows are encoded in a long, with one spare bit to enumerate them safely.
     */
    public static final int MAX_VARIABLES = 62;

    /**
     * Minimizes a boolean function.
     *
     * @param variableCount Number of variables of the function
     * @param minterms Rows for which the function is true; bit {@code i} holds variable {@code i}
     * @return the implicants of a minimal cover, empty if the function is never true
     * @throws IllegalArgumentException if the variable count or a row is out of bounds
     */
    public List<Implicant> minimize(int variableCount, long[] minterms) {
        if (variableCount < 0 || variableCount > MAX_VARIABLES) {
            throw new IllegalArgumentException("Unsupported number of variables: " + variableCount);
        }

        long rowCount = 1L << variableCount;
        Set<Long> distinct = new LinkedHashSet<>();
        for (long minterm : minterms) {
            if (minterm < 0 || minterm >= rowCount) {
                throw new IllegalArgumentException(String.format(
                        "Row %d is out of bounds for %d variables", minterm, variableCount));
            }
            distinct.add(minterm);
        }

        if (distinct.isEmpty()) {
            return Collections.emptyList();
        }

        if (distinct.size() == rowCount) {
            return Collections.singletonList(new Implicant(variableCount, 0, rowCount - 1));
        }

        long[] rows = distinct.stream().mapToLong(Long::longValue).sorted().toArray();
        List<Implicant> primes = primeImplicants(variableCount, rows);
        List<Implicant> cover = selectCover(primes, rows);

        logger.debug("Minimized {} rows over {} variables into {} implicants ({} primes)",
                rows.length, variableCount, cover.size(), primes.size());
        return cover;
    }

    private List<Implicant> primeImplicants(int variableCount, long[] rows) {
        Set<Implicant> current = new LinkedHashSet<>();
        for (long row : rows) {
            current.add(new Implicant(variableCount, row, 0));
        }

        List<Implicant> primes = new ArrayList<>();

        while (!current.isEmpty()) {
            Set<Implicant> next = new LinkedHashSet<>();
            Set<Implicant> merged = new HashSet<>();

            for (Implicant implicant : current) {
                for (int variable = 0; variable < variableCount; variable++) {
                    if (implicant.isDontCare(variable) || implicant.isAsserted(variable)) {
                        continue;
                    }

                    Implicant sibling = new Implicant(variableCount,
                            implicant.getValue() | (1L << variable), implicant.getMask());

                    if (current.contains(sibling)) {
                        next.add(implicant.combine(variable));
                        merged.add(implicant);
                        merged.add(sibling);
                    }
                }
            }

            for (Implicant implicant : current) {
                if (!merged.contains(implicant)) {
                    primes.add(implicant);
                }
            }

            current = next;
        }

        return primes;
    }

    private List<Implicant> selectCover(List<Implicant> primes, long[] rows) {
        // coverage[p] = rows covered by prime p
        List<BitSet> coverage = new ArrayList<>(primes.size());
        for (Implicant prime : primes) {
            BitSet covered = new BitSet(rows.length);
            for (int r = 0; r < rows.length; r++) {
                if (prime.covers(rows[r])) {
                    covered.set(r);
                }
            }
            coverage.add(covered);
        }

        BitSet uncovered = new BitSet(rows.length);
        uncovered.set(0, rows.length);
        List<Integer> selected = new ArrayList<>();

        // essential primes: the only prime covering some row
        for (int r = 0; r < rows.length; r++) {
            int only = -1;
            for (int p = 0; p < primes.size(); p++) {
                if (coverage.get(p).get(r)) {
                    if (only != -1) {
                        only = -2;
                        break;
                    }
                    only = p;
                }
            }
            if (only >= 0 && !selected.contains(only)) {
                selected.add(only);
                uncovered.andNot(coverage.get(only));
            }
        }

        while (!uncovered.isEmpty()) {
            int best = -1;
            int bestCount = 0;

            for (int p = 0; p < primes.size(); p++) {
                BitSet gain = (BitSet) coverage.get(p).clone();
                gain.and(uncovered);
                int count = gain.cardinality();

                if (count > bestCount || count == bestCount && count > 0
                        && primes.get(p).literalCount() < primes.get(best).literalCount()) {
                    best = p;
                    bestCount = count;
                }
            }

            if (best < 0) {
                throw new IllegalStateException("Prime implicants do not cover every row");
            }

            selected.add(best);
            uncovered.andNot(coverage.get(best));
        }

        List<Implicant> cover = new ArrayList<>();
        for (int p : selected) {
            cover.add(primes.get(p));
        }
        cover.sort(Comparator.comparingLong(Implicant::getMask).thenComparingLong(Implicant::getValue));
        return cover;
    }
}
