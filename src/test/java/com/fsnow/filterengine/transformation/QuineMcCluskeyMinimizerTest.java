package com.fsnow.filterengine.transformation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuineMcCluskeyMinimizerTest {

    private QuineMcCluskeyMinimizer minimizer;

    @BeforeEach
    void setUp() {
        minimizer = new QuineMcCluskeyMinimizer();
    }

    private static List<String> rows(List<Implicant> implicants) {
        return implicants.stream().map(Implicant::toString).collect(java.util.stream.Collectors.toList());
    }

    @Test
    void testNeverTrueFunctionHasNoImplicant() {
        assertThat(minimizer.minimize(3, new long[0])).isEmpty();
    }

    @Test
    void testAlwaysTrueFunctionIsATautology() {
        List<Implicant> result = minimizer.minimize(3, LongStream.range(0, 8).toArray());

        assertThat(result).hasSize(1);
        assertThat(result.get(0).isTautology()).isTrue();
        assertThat(result.get(0).toString()).isEqualTo("---");
    }

    @Test
    void testSingleVariable() {
        assertThat(rows(minimizer.minimize(1, new long[]{1}))).containsExactly("1");
        assertThat(rows(minimizer.minimize(1, new long[]{0}))).containsExactly("0");
    }

    @Test
    void testAndOfTwoVariables() {
        // a AND b: only row 0b11
        assertThat(rows(minimizer.minimize(2, new long[]{3}))).containsExactly("11");
    }

    @Test
    void testOrOfTwoVariables() {
        // a OR b: rows 01, 10, 11 (bit 0 = a)
        assertThat(rows(minimizer.minimize(2, new long[]{1, 2, 3})))
                .containsExactlyInAnyOrder("1-", "-1");
    }

    @Test
    void testAbsorption() {
        // a OR (a AND b) == a
        assertThat(rows(minimizer.minimize(2, new long[]{1, 3}))).containsExactly("1-");
    }

    @Test
    void testClassicFourVariableFunction() {
        // f = sum(4, 8, 10, 11, 12, 15) + minimal cover uses 3 or 4 implicants
        long[] minterms = {4, 8, 10, 11, 12, 15};
        List<Implicant> result = minimizer.minimize(4, minterms);

        for (long minterm : minterms) {
            assertThat(result).anyMatch(implicant -> implicant.covers(minterm));
        }
        for (long row = 0; row < 16; row++) {
            long r = row;
            boolean expected = LongStream.of(minterms).anyMatch(m -> m == r);
            assertThat(result.stream().anyMatch(implicant -> implicant.covers(r))).isEqualTo(expected);
        }
        assertThat(result.size()).isLessThanOrEqualTo(4);
    }

    @Test
    void testOutputIsDeterministic() {
        long[] minterms = {1, 3, 5, 6, 7, 9, 13, 14};
        long[] shuffled = {14, 13, 9, 7, 6, 5, 3, 1};

        assertThat(minimizer.minimize(4, minterms)).isEqualTo(minimizer.minimize(4, shuffled));
    }

    @Test
    void testRejectsMalformedInput() {
        assertThatThrownBy(() -> minimizer.minimize(2, new long[]{4}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of bounds");
        assertThatThrownBy(() -> minimizer.minimize(-1, new long[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
