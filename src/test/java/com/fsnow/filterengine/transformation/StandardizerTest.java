package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.geo.GeoShape;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.Term;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StandardizerTest {

    private Standardizer standardizer;

    @BeforeEach
    void setUp() {
        standardizer = new Standardizer();
    }

    private FilterNode standardize(String json) {
        return standardizer.standardize(Document.parse(json));
    }

    private void assertRejected(String json, String message) {
        assertThatThrownBy(() -> standardize(json))
                .isInstanceOf(FilterValidationException.class)
                .hasMessageContaining(message);
    }

    @Test
    void testEmptyFilterMatchesEverything() {
        assertThat(standardizer.standardize(new Document()))
                .isEqualTo(FilterNode.literal(Term.everything()));
        assertThat(standardizer.standardize(null))
                .isEqualTo(FilterNode.literal(Term.everything()));
    }

    @Test
    void testRejectsMultipleKeywords() {
        assertRejected("{equals: {a: 1}, exists: {field: 'a'}}", "Filters must have one keyword only");
    }

    @Test
    void testRejectsUnknownKeyword() {
        assertRejected("{foo: {a: 1}}", "Unknown DSL keyword: foo");
    }

    @Test
    void testEquals() {
        FilterNode node = standardize("{equals: {status: 'open'}}");

        assertThat(node.isLiteral()).isTrue();
        assertThat(node.getTerm()).isEqualTo(Term.of(Keyword.EQUALS, new Document("status", "open")));
    }

    @Test
    void testEqualNumbersGetOneRepresentation() {
        Term integer = standardize("{equals: {a: 1}}").getTerm();

        assertThat(standardizer.standardize(new Document("equals", new Document("a", 1.0))).getTerm())
                .isEqualTo(integer);
        assertThat(standardizer.standardize(new Document("equals", new Document("a", 1L))).getTerm())
                .isEqualTo(integer);
        assertThat(integer.getValue().get("a")).isEqualTo(1);

        Term large = standardizer.standardize(new Document("equals", new Document("a", 3.0e9))).getTerm();
        assertThat(large.getValue().get("a")).isEqualTo(3000000000L);

        Term fraction = standardize("{equals: {a: 1.5}}").getTerm();
        assertThat(fraction.getValue().get("a")).isEqualTo(1.5);
    }

    @Test
    void testEqualsValidation() {
        assertRejected("{equals: {}}", "\"equals\" must be a non-empty object");
        assertRejected("{equals: {a: 1, b: 2}}", "\"equals\" can contain only one attribute");
        assertRejected("{equals: {a: [1, 2]}}", "must be either a string, a number, a boolean or null");
        assertRejected("{equals: 'a'}", "\"equals\" must be a non-empty object");
    }

    @Test
    void testExistsAndMissing() {
        Term exists = Term.of(Keyword.EXISTS, new Document("field", "a.b"));

        assertThat(standardize("{exists: {field: 'a.b'}}").getTerm()).isEqualTo(exists);
        assertThat(standardize("{missing: {field: 'a.b'}}").getTerm()).isEqualTo(exists.negate());
        assertRejected("{exists: {field: 42}}", "Attribute \"field\" in \"exists\" must be a string");
        assertRejected("{exists: {field: ''}}", "exists: cannot test empty field name");
        assertRejected("{missing: {field: 'a', other: 'b'}}", "\"missing\" can contain only one attribute");
    }

    @Test
    void testInBecomesCompoundOrOfEquals() {
        FilterNode node = standardize("{in: {color: ['red', 'blue']}}");

        assertThat(node.getType()).isEqualTo(FilterNode.Type.OR);
        assertThat(node.isCompoundLeaf()).isTrue();
        assertThat(node.getChildren()).containsExactly(
                FilterNode.literal(Term.of(Keyword.EQUALS, new Document("color", "red"))),
                FilterNode.literal(Term.of(Keyword.EQUALS, new Document("color", "blue"))));
    }

    @Test
    void testInWithSingleValueIsAnEquals() {
        assertThat(standardize("{in: {color: ['red']}}"))
                .isEqualTo(standardize("{equals: {color: 'red'}}"));
    }

    @Test
    void testInValidation() {
        assertRejected("{in: {color: []}}", "Attribute \"color\" in \"in\" cannot be empty");
        assertRejected("{in: {color: 'red'}}", "Attribute \"color\" in \"in\" must be an array");
        assertRejected("{in: {color: ['red', 42]}}", "Array \"color\" in keyword \"in\" can only contain strings");
    }

    @Test
    void testIdsTestsTheIdField() {
        FilterNode node = standardize("{ids: {values: ['foo', 'bar']}}");

        assertThat(node.getChildren()).extracting(FilterNode::getTerm).containsExactly(
                Term.of(Keyword.EQUALS, new Document("_id", "foo")),
                Term.of(Keyword.EQUALS, new Document("_id", "bar")));
        assertRejected("{ids: {foo: ['bar']}}", "\"ids\" requires the following attribute: values");
        assertRejected("{ids: {values: [42]}}", "Array \"values\" in keyword \"ids\" can only contain strings");
    }

    @Test
    void testRangeBoundsAreSorted() {
        assertThat(standardize("{range: {age: {lt: 30, gte: 18}}}"))
                .isEqualTo(standardize("{range: {age: {gte: 18, lt: 30}}}"));
    }

    @Test
    void testRangeValidation() {
        assertRejected("{range: {age: {}}}", "\"range.age\" must be a non-empty object");
        assertRejected("{range: {age: {foo: 1}}}", "accepts only the following attributes : gt, gte, lt, lte");
        assertRejected("{range: {age: {gt: 'a'}}}", "\"range.age.gt\" must be a number");
        assertRejected("{range: {age: {gt: 1, gte: 2}}}", "only 1 lower boundary allowed");
        assertRejected("{range: {age: {lt: 1, lte: 2}}}", "only 1 upper boundary allowed");
        assertRejected("{range: {age: {gt: 10, lt: 10}}}", "lower boundary must be strictly inferior to the upper one");
    }

    @Test
    void testRegexp() {
        Term expected = Term.of(Keyword.REGEXP,
                new Document("name", new Document("value", "^A").append("flags", "i")));

        assertThat(standardize("{regexp: {name: {value: '^A', flags: 'i'}}}").getTerm()).isEqualTo(expected);
        assertThat(standardize("{regexp: {name: '^A'}}").getTerm())
                .isEqualTo(Term.of(Keyword.REGEXP, new Document("name", new Document("value", "^A"))));
    }

    @Test
    void testRegexpValidation() {
        assertRejected("{regexp: {name: {value: '^A', foo: 'i'}}}",
                "Keyword \"regexp\" can only contain the following attributes: flags, value");
        assertRejected("{regexp: {name: {flags: 'i'}}}", "\"regexp\" requires the following attribute: value");
        assertRejected("{regexp: {name: {value: '(unclosed'}}}", "Unclosed group");
        assertRejected("{regexp: {name: {value: 'a', flags: 'x'}}}", "Invalid regular expression flag: x");
        assertRejected("{regexp: {name: 42}}", "regexp.name must be either a string or a non-empty object");
    }

    @Test
    void testBoundingBoxFormatsAreNormalized() {
        Term expected = Term.of(Keyword.GEOSPATIAL, new Document(GeoShape.BOUNDING_BOX,
                new Document("location", new Document("top", 43.6).append("left", 3.8)
                        .append("bottom", 43.5).append("right", 3.9))));

        assertThat(standardize("{geoBoundingBox: {location: {top: 43.6, left: 3.8, bottom: 43.5, right: 3.9}}}")
                .getTerm()).isEqualTo(expected);
        assertThat(standardize("{geoBoundingBox: {location: {topLeft: {lat: 43.6, lon: 3.8}, "
                + "bottomRight: {lat: 43.5, lon: 3.9}}}}").getTerm()).isEqualTo(expected);
        assertThat(standardize("{geoBoundingBox: {location: {top_left: [43.6, 3.8], "
                + "bottom_right: [43.5, 3.9]}}}").getTerm()).isEqualTo(expected);
        assertThat(standardize("{geoBoundingBox: {location: {topLeft: '43.6, 3.8', "
                + "bottomRight: '43.5, 3.9'}}}").getTerm()).isEqualTo(expected);
    }

    @Test
    void testBoundingBoxFromGeohashes() {
        FilterNode node = standardize("{geoBoundingBox: {location: {topLeft: 'spf8prntv18e', "
                + "bottomRight: 'spdzrz7huh5x'}}}");

        Document box = (Document) ((Document) node.getTerm().getValue().get(GeoShape.BOUNDING_BOX)).get("location");
        assertThat(box.getDouble("top")).isCloseTo(43.6, within(0.1));
        assertThat(box.getDouble("left")).isCloseTo(3.85, within(0.1));
    }

    @Test
    void testBoundingBoxValidation() {
        assertRejected("{geoBoundingBox: {location: {top: 43.6, left: 3.8}}}",
                "Unrecognized geo-point format in \"geoBoundingBox.location\"");
        assertRejected("{geoBoundingBox: {location: {topLeft: 'foo bar', bottomRight: 'bar'}}}",
                "Unrecognized geo-point format");
    }

    @Test
    void testGeoDistanceConvertsToMeters() {
        FilterNode node = standardize("{geoDistance: {location: {lat: 43.6, lon: 3.8}, distance: '1.5km'}}");

        assertThat(node.getTerm()).isEqualTo(Term.of(Keyword.GEOSPATIAL, new Document(GeoShape.DISTANCE,
                new Document("location", new Document("lat", 43.6).append("lon", 3.8)
                        .append("distance", 1500.0)))));
    }

    @Test
    void testGeoDistanceValidation() {
        assertRejected("{geoDistance: {location: {lat: 43.6, lon: 3.8}}}",
                "requires a document field and a \"distance\" attribute");
        assertRejected("{geoDistance: {location: {lat: 43.6, lon: 3.8}, distance: 1000}}",
                "Attribute \"distance\" in \"geoDistance\" must be a string");
        assertRejected("{geoDistance: {location: {lat: 43.6, lon: 3.8}, distance: '10 parsecs'}}",
                "unknown distance unit");
        assertRejected("{geoDistance: {location: 'nowhere', distance: '10m'}}", "unrecognized point format");
    }

    @Test
    void testGeoDistanceRange() {
        FilterNode node = standardize("{geoDistanceRange: {location: [43.6, 3.8], from: '1km', to: '2km'}}");

        assertThat(node.getTerm()).isEqualTo(Term.of(Keyword.GEOSPATIAL, new Document(GeoShape.DISTANCE_RANGE,
                new Document("location", new Document("lat", 43.6).append("lon", 3.8)
                        .append("from", 1000.0).append("to", 2000.0)))));
        assertRejected("{geoDistanceRange: {location: [43.6, 3.8], from: '2km', to: '1km'}}",
                "inner radius must be smaller than outer radius");
        assertRejected("{geoDistanceRange: {location: [43.6, 3.8], from: '1km'}}",
                "requires a document field and the following attributes: \"from\", \"to\"");
    }

    @Test
    void testGeoPolygon() {
        FilterNode node = standardize("{geoPolygon: {location: {points: "
                + "[[0, 0], {lat: 0, lon: 10}, '10, 10', {latLon: [10, 0]}]}}}");

        Object points = ((Document) node.getTerm().getValue().get(GeoShape.POLYGON)).get("location");
        assertThat(points).isEqualTo(Arrays.asList(Arrays.asList(0.0, 0.0), Arrays.asList(0.0, 10.0),
                Arrays.asList(10.0, 10.0), Arrays.asList(10.0, 0.0)));

        assertRejected("{geoPolygon: {location: {points: [[0, 0], [1, 1]]}}}",
                "at least 3 points are required to build a polygon");
        assertRejected("{geoPolygon: {location: {points: [[0, 0], [1, 1], 'foo']}}}",
                "unrecognized point format");
        assertRejected("{geoPolygon: {location: {foo: 'bar'}}}",
                "\"geoPolygon.location\" requires the following attribute: points");
    }

    @Test
    void testNotIsPushedDownToLiterals() {
        FilterNode node = standardize("{not: {and: [{equals: {a: 1}}, {exists: {field: 'b'}}]}}");

        assertThat(node.getType()).isEqualTo(FilterNode.Type.OR);
        assertThat(node.getChildren()).extracting(FilterNode::getTerm).containsExactly(
                Term.of(Keyword.EQUALS, new Document("a", 1)).negate(),
                Term.of(Keyword.EXISTS, new Document("field", "b")).negate());
    }

    @Test
    void testDoubleNegationIsRemoved() {
        assertThat(standardize("{not: {not: {equals: {a: 1}}}}"))
                .isEqualTo(standardize("{equals: {a: 1}}"));
    }

    @Test
    void testNestedSameOperatorGroupsAreFlattened() {
        FilterNode node = standardize("{and: [{equals: {a: 1}}, {and: [{equals: {b: 2}}, {equals: {c: 3}}]}]}");

        assertThat(node.isCompoundLeaf()).isTrue();
        assertThat(node.getChildren()).hasSize(3);
    }

    @Test
    void testMixedGroupWrapsLiteralsInCompoundLeaf() {
        FilterNode node = standardize("{and: [{equals: {a: 1}}, {equals: {b: 2}}, "
                + "{or: [{equals: {c: 3}}, {and: [{equals: {d: 4}}, {equals: {e: 5}}]}]}]}");

        assertThat(node.getType()).isEqualTo(FilterNode.Type.AND);
        assertThat(node.isCompoundLeaf()).isFalse();
        assertThat(node.getChildren()).hasSize(2);
        assertThat(node.getChildren().get(0).getType()).isEqualTo(FilterNode.Type.OR);
        assertThat(node.getChildren().get(1).isCompoundLeaf()).isTrue();
        assertThat(node.getChildren().get(1).getChildren()).hasSize(2);
    }

    @Test
    void testGroupValidation() {
        assertRejected("{and: []}", "Attribute \"and\" in \"and\" cannot be empty");
        assertRejected("{or: {equals: {a: 1}}}", "Attribute \"or\" in \"or\" must be an array");
        assertRejected("{or: [{}]}", "\"or\" operand can only contain non-empty objects");
        assertRejected("{not: {}}", "\"not\" must be a non-empty object");
    }

    @Test
    void testBoolIsRewrittenToAnd() {
        FilterNode bool = standardize("{bool: {"
                + "must: [{equals: {a: 1}}], "
                + "must_not: [{equals: {b: 2}}], "
                + "should: [{equals: {c: 3}}, {equals: {d: 4}}], "
                + "should_not: [{exists: {field: 'e'}}]}}");
        FilterNode rewritten = standardize("{and: ["
                + "{equals: {a: 1}}, "
                + "{not: {or: [{equals: {b: 2}}]}}, "
                + "{or: [{equals: {c: 3}}, {equals: {d: 4}}]}, "
                + "{not: {and: [{exists: {field: 'e'}}]}}]}");

        assertThat(bool).isEqualTo(rewritten);
        assertRejected("{bool: {must: [{equals: {a: 1}}], foo: []}}",
                "\"bool\" operand accepts only the following attributes: must, must_not, should, should_not");
    }

    @Test
    void testNothingKeyword() {
        assertThat(standardize("{nothing: {}}").getTerm()).isEqualTo(Term.nothing());
    }

    @Test
    void testDoesNotMutateInput() {
        Document filter = Document.parse("{bool: {must: [{in: {a: ['x', 'y']}}], must_not: [{missing: {field: 'b'}}]}}");
        String before = filter.toJson();

        standardizer.standardize(filter);

        assertThat(filter.toJson()).isEqualTo(before);
    }
}
