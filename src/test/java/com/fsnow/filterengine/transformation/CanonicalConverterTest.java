package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.config.FilterEngineConfig;
import com.fsnow.filterengine.exception.CanonicalizationException;
import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.Term;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalConverterTest {

    private Standardizer standardizer;
    private CanonicalConverter converter;

    @BeforeEach
    void setUp() {
        standardizer = new Standardizer();
        converter = new CanonicalConverter(FilterEngineConfig.defaultConfig());
    }

    private List<List<Term>> convert(String json) {
        return converter.convert(standardizer.standardize(Document.parse(json)));
    }

    private static Term equals(String field, Object value) {
        return Term.of(Keyword.EQUALS, new Document(field, value));
    }

    private static Term exists(String field) {
        return Term.of(Keyword.EXISTS, new Document("field", field));
    }

    @Test
    void testEmptyFilter() {
        assertThat(converter.convert(standardizer.standardize(new Document())))
                .containsExactly(List.of(Term.everything()));
    }

    @Test
    void testSingleCondition() {
        assertThat(convert("{equals: {a: 1}}")).containsExactly(List.of(equals("a", 1)));
    }

    @Test
    void testNegatedCondition() {
        assertThat(convert("{not: {equals: {a: 1}}}")).containsExactly(List.of(equals("a", 1).negate()));
    }

    @Test
    void testAndOfConditionsIsASingleClause() {
        assertThat(convert("{and: [{equals: {a: 1}}, {exists: {field: 'b'}}]}"))
                .containsExactly(List.of(equals("a", 1), exists("b")));
    }

    @Test
    void testOrOfConditionsIsOneClauseEach() {
        assertThat(convert("{or: [{equals: {a: 1}}, {exists: {field: 'b'}}]}"))
                .containsExactlyInAnyOrder(List.of(equals("a", 1)), List.of(exists("b")));
    }

    @Test
    void testDistribution() {
        List<List<Term>> result = convert(
                "{and: [{equals: {a: 1}}, {or: [{exists: {field: 'b'}}, {equals: {c: 2}}]}]}");

        assertThat(result).containsExactlyInAnyOrder(
                List.of(equals("a", 1), exists("b")),
                List.of(equals("a", 1), equals("c", 2)));
    }

    @Test
    void testNegatedAndGivesOneClausePerNegatedTerm() {
        List<List<Term>> result = convert("{not: {and: [{equals: {a: 1}}, {exists: {field: 'b'}}]}}");

        assertThat(result).containsExactlyInAnyOrder(
                List.of(equals("a", 1).negate()),
                List.of(exists("b").negate()));
    }

    @Test
    void testEquivalentSyntaxesGiveSameResult() {
        assertThat(convert("{in: {a: ['x', 'y']}}"))
                .isEqualTo(convert("{or: [{equals: {a: 'y'}}, {equals: {a: 'x'}}]}"));
        assertThat(convert("{and: [{equals: {a: 1}}, {exists: {field: 'b'}}]}"))
                .isEqualTo(convert("{and: [{exists: {field: 'b'}}, {equals: {a: 1}}]}"));
        assertThat(convert("{missing: {field: 'a'}}"))
                .isEqualTo(convert("{not: {exists: {field: 'a'}}}"));
    }

    @Test
    void testRedundantConditionsAreMinimized() {
        // a OR (a AND b) == a
        assertThat(convert("{or: [{equals: {a: 1}}, {and: [{equals: {a: 1}}, {exists: {field: 'b'}}]}]}"))
                .containsExactly(List.of(equals("a", 1)));
    }

    @Test
    void testContradictionMatchesNothing() {
        assertThat(convert("{and: [{exists: {field: 'a'}}, {missing: {field: 'a'}}]}"))
                .containsExactly(List.of(Term.nothing()));
    }

    @Test
    void testTautologyMatchesEverything() {
        assertThat(convert("{or: [{exists: {field: 'a'}}, {missing: {field: 'a'}}]}"))
                .containsExactly(List.of(Term.everything()));
    }

    @Test
    void testImpossibleClausesAreRemoved() {
        List<List<Term>> result = convert("{and: [{equals: {a: 1}}, "
                + "{or: [{equals: {a: 2}}, {exists: {field: 'b'}}]}]}");

        assertThat(result).containsExactly(List.of(equals("a", 1), exists("b")));
    }

    @Test
    void testEqualsOutsideRangeIsImpossible() {
        assertThat(convert("{and: [{equals: {age: 10}}, {range: {age: {gte: 18}}}]}"))
                .containsExactly(List.of(Term.nothing()));
        assertThat(convert("{and: [{equals: {age: 20}}, {range: {age: {gte: 18}}}]}")).hasSize(1);
    }

    @Test
    void testOutputIsSortedAndDeterministic() {
        List<List<Term>> first = convert("{or: [{equals: {z: 1}}, {exists: {field: 'a'}}, {range: {m: {gt: 0}}}]}");
        List<List<Term>> second = convert("{or: [{range: {m: {gt: 0}}}, {equals: {z: 1}}, {exists: {field: 'a'}}]}");

        assertThat(first).isEqualTo(second);

        List<String> keys = new ArrayList<>();
        for (List<Term> clause : first) {
            keys.add(clause.get(0).getSortKey());
        }
        assertThat(keys).isSorted();
    }

    @Test
    void testTooManyConditionsAreRejected() {
        CanonicalConverter limited = new CanonicalConverter(FilterEngineConfig.builder()
                .maxConditionsPerFilter(2)
                .build());

        assertThatThrownBy(() -> limited.convert(standardizer.standardize(Document.parse(
                "{or: [{and: [{equals: {a: 1}}, {equals: {b: 1}}]}, {exists: {field: 'c'}}, "
                        + "{and: [{equals: {d: 1}}, {missing: {field: 'e'}}]}]}"))))
                .isInstanceOf(FilterValidationException.class)
                .hasMessage("Maximum number of sub conditions reached");
    }

    @Test
    void testCompoundLeafTakesASingleColumn() {
        CanonicalConverter limited = new CanonicalConverter(FilterEngineConfig.builder()
                .maxConditionsPerFilter(1)
                .build());

        List<List<Term>> result = limited.convert(standardizer.standardize(Document.parse(
                "{in: {a: ['v1', 'v2', 'v3', 'v4', 'v5']}}")));

        assertThat(result).hasSize(5);
    }

    @Test
    void testMinimizerFailureIsReported() {
        QuineMcCluskeyMinimizer failing = new QuineMcCluskeyMinimizer() {
            @Override
            public List<Implicant> minimize(int variableCount, long[] minterms) {
                throw new IllegalStateException("broken minimizer");
            }
        };
        CanonicalConverter broken = new CanonicalConverter(FilterEngineConfig.defaultConfig(), failing);

        assertThatThrownBy(() -> broken.convert(standardizer.standardize(Document.parse("{equals: {a: 1}}"))))
                .isInstanceOf(CanonicalizationException.class)
                .hasMessageStartingWith("Unable to minimize filter")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
