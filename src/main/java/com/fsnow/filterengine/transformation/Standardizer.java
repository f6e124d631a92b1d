package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.geo.DistanceConverter;
import com.fsnow.filterengine.geo.GeoHash;
import com.fsnow.filterengine.geo.GeoPoint;
import com.fsnow.filterengine.geo.GeoPoints;
import com.fsnow.filterengine.geo.GeoShape;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.RegexpPattern;
import com.fsnow.filterengine.model.Term;
import com.fsnow.filterengine.storage.operand.ScalarComparator;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Verifies that a raw filter is well-formed and rewrites it into a tree
 * using a small set of primitive keywords.
 * <p>
 * Examples of rewrites:
 * <ul>
 *   <li>{@code {in: {a: ["x", "y"]}}} =&gt; {@code or[equals a=x, equals a=y]}</li>
 *   <li>{@code {missing: {field: "a"}}} =&gt; {@code not exists a}</li>
 *   <li>{@code {bool: {must: [...], must_not: [...]}}} =&gt; {@code and[..., not or[...]]}</li>
 *   <li>geo keywords =&gt; a geospatial term with unit-normalized coordinates and distances</li>
 * </ul>
 * Does not mutate the input filter.
 */
public class Standardizer {

    private static final Logger logger = LoggerFactory.getLogger(Standardizer.class);

    private static final Set<String> RANGE_ATTRIBUTES = new HashSet<>(Arrays.asList("gt", "gte", "lt", "lte"));
    private static final Set<String> REGEXP_ATTRIBUTES = new HashSet<>(Arrays.asList("value", "flags"));
    private static final List<String> BOOL_ATTRIBUTES = Arrays.asList("must", "must_not", "should", "should_not");

    /**
     * Standardizes a raw filter.
     *
     * @param filter The raw filter, may be null or empty
     * @return the standardized tree; an empty filter yields a single "everything" literal
     * @throws FilterValidationException if the filter is malformed
     */
    public FilterNode standardize(Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return FilterNode.literal(Term.everything());
        }

        if (filter.size() > 1) {
            throw new FilterValidationException("Invalid filter syntax. Filters must have one keyword only");
        }

        String keyword = filter.keySet().iterator().next();
        Object argument = filter.get(keyword);

        switch (keyword) {
            case "equals":
                return equalsFilter(argument);
            case "exists":
                return FilterNode.literal(Term.of(Keyword.EXISTS, existsField(argument, "exists")));
            case "missing":
                return FilterNode.literal(Term.of(Keyword.EXISTS, existsField(argument, "missing")).negate());
            case "ids":
                return ids(argument);
            case "in":
                return in(argument);
            case "range":
                return range(argument);
            case "regexp":
                return regexp(argument);
            case "geoBoundingBox":
                return geoBoundingBox(argument);
            case "geoDistance":
                return geoDistance(argument);
            case "geoDistanceRange":
                return geoDistanceRange(argument);
            case "geoPolygon":
                return geoPolygon(argument);
            case "and":
                return filterArray(argument, FilterNode.Type.AND, "and");
            case "or":
                return filterArray(argument, FilterNode.Type.OR, "or");
            case "not":
                return not(argument);
            case "bool":
                return bool(argument);
            case "nothing":
                return FilterNode.literal(Term.nothing());
            default:
                logger.debug("Rejecting unknown DSL keyword: {}", keyword);
                throw new FilterValidationException("Unknown DSL keyword: " + keyword);
        }
    }

    private FilterNode equalsFilter(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "equals");
        String field = onlyOneFieldAttribute(fields, "equals");
        Object value = fields.get(field);

        if (!ScalarComparator.isScalar(value)) {
            throw new FilterValidationException(
                    String.format("\"%s\" in \"equals\" must be either a string, a number, a boolean or null", field));
        }

        return FilterNode.literal(Term.of(Keyword.EQUALS, new Document(field, ScalarComparator.canonicalValue(value))));
    }

    private Document existsField(Object argument, String keyword) {
        Map<String, Object> attributes = mustBeNonEmptyObject(argument, keyword);
        onlyOneFieldAttribute(attributes, keyword);
        String field = mustBeString(attributes, keyword, "field");

        if (field.isEmpty()) {
            throw new FilterValidationException(keyword + ": cannot test empty field name");
        }

        return new Document("field", field);
    }

    private FilterNode ids(Object argument) {
        Map<String, Object> attributes = mustBeNonEmptyObject(argument, "ids");
        onlyOneFieldAttribute(attributes, "ids");
        requireAttribute(attributes, "ids", "values");
        List<?> values = mustBeNonEmptyArray(attributes, "ids", "values");

        if (values.stream().anyMatch(v -> !(v instanceof String))) {
            throw new FilterValidationException("Array \"values\" in keyword \"ids\" can only contain strings");
        }

        return equalsAlternatives("_id", values);
    }

    private FilterNode in(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "in");
        String field = onlyOneFieldAttribute(fields, "in");
        List<?> values = mustBeNonEmptyArray(fields, "in", field);

        if (values.stream().anyMatch(v -> !(v instanceof String))) {
            throw new FilterValidationException(
                    String.format("Array \"%s\" in keyword \"in\" can only contain strings", field));
        }

        return equalsAlternatives(field, values);
    }

    private FilterNode equalsAlternatives(String field, List<?> values) {
        List<FilterNode> alternatives = new ArrayList<>();
        for (Object value : values) {
            alternatives.add(FilterNode.literal(Term.of(Keyword.EQUALS, new Document(field, value))));
        }

        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        return FilterNode.or(alternatives, true);
    }

    private FilterNode range(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "range");
        String field = onlyOneFieldAttribute(fields, "range");
        Map<String, Object> bounds = mustBeNonEmptyObject(fields.get(field), "range." + field);

        double low = Double.NEGATIVE_INFINITY;
        double high = Double.POSITIVE_INFINITY;
        boolean hasLow = false;
        boolean hasHigh = false;
        Document standardized = new Document();

        for (String bound : bounds.keySet()) {
            if (!RANGE_ATTRIBUTES.contains(bound)) {
                throw new FilterValidationException(
                        String.format("\"range.%s\" accepts only the following attributes : gt, gte, lt, lte", field));
            }
        }

        // sorted so that {gte, lt} and {lt, gte} standardize identically
        for (String bound : Arrays.asList("gt", "gte", "lt", "lte")) {
            if (!bounds.containsKey(bound)) {
                continue;
            }

            Object value = bounds.get(bound);
            if (!(value instanceof Number)) {
                throw new FilterValidationException(String.format("\"range.%s.%s\" must be a number", field, bound));
            }

            double number = ((Number) value).doubleValue();
            if (bound.startsWith("lt")) {
                if (hasHigh) {
                    throw new FilterValidationException(
                            String.format("\"range.%s:\" only 1 upper boundary allowed", field));
                }
                hasHigh = true;
                high = number;
            } else {
                if (hasLow) {
                    throw new FilterValidationException(
                            String.format("\"range.%s:\" only 1 lower boundary allowed", field));
                }
                hasLow = true;
                low = number;
            }
            standardized.append(bound, value);
        }

        if (high <= low) {
            throw new FilterValidationException(String.format(
                    "\"range.%s:\" lower boundary must be strictly inferior to the upper one", field));
        }

        return FilterNode.literal(Term.of(Keyword.RANGE, new Document(field, standardized)));
    }

    private FilterNode regexp(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "regexp");
        String field = onlyOneFieldAttribute(fields, "regexp");
        Object definition = fields.get(field);
        String value;
        String flags = null;

        if (definition instanceof String) {
            value = (String) definition;
        } else if (definition instanceof Map && !((Map<?, ?>) definition).isEmpty()) {
            Map<String, Object> attributes = asMap(definition);

            if (!REGEXP_ATTRIBUTES.containsAll(attributes.keySet())) {
                throw new FilterValidationException(
                        "Keyword \"regexp\" can only contain the following attributes: flags, value");
            }

            requireAttribute(attributes, "regexp", "value");
            value = mustBeString(attributes, "regexp", "value");

            if (attributes.get("flags") != null) {
                flags = mustBeString(attributes, "regexp", "flags");
            }
        } else {
            throw new FilterValidationException(
                    String.format("regexp.%s must be either a string or a non-empty object", field));
        }

        try {
            RegexpPattern.compile(value, flags);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException(e.getMessage(), e);
        }

        Document standardized = new Document("value", value);
        if (flags != null && !flags.isEmpty()) {
            standardized.append("flags", flags);
        }

        return FilterNode.literal(Term.of(Keyword.REGEXP, new Document(field, standardized)));
    }

    private FilterNode geoBoundingBox(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "geoBoundingBox");
        String field = onlyOneFieldAttribute(fields, "geoBoundingBox");
        Map<String, Object> box = mustBeNonEmptyObject(fields.get(field), "geoBoundingBox." + field);

        Document standardized = convertBoundingBox(toCamelCase(box))
                .orElseThrow(() -> new FilterValidationException(
                        String.format("Unrecognized geo-point format in \"geoBoundingBox.%s\"", field)));

        return geospatial(GeoShape.BOUNDING_BOX, field, standardized);
    }

    private Optional<Document> convertBoundingBox(Map<String, Object> box) {
        // { top: 43.61, left: 3.85, bottom: 43.59, right: 3.89 }
        if (box.size() == 4 && allNumbers(box, "top", "left", "bottom", "right")) {
            return Optional.of(boundingBox(number(box.get("top")), number(box.get("left")),
                    number(box.get("bottom")), number(box.get("right"))));
        }

        if (box.size() != 2 || !box.containsKey("topLeft") || !box.containsKey("bottomRight")) {
            return Optional.empty();
        }

        Object topLeft = box.get("topLeft");
        Object bottomRight = box.get("bottomRight");

        // { topLeft: { lat: 43.61, lon: 3.85 }, bottomRight: { lat: 43.59, lon: 3.89 } }
        if (topLeft instanceof Map && bottomRight instanceof Map) {
            Map<String, Object> tl = asMap(topLeft);
            Map<String, Object> br = asMap(bottomRight);
            if (tl.size() == 2 && br.size() == 2 && allNumbers(tl, "lat", "lon") && allNumbers(br, "lat", "lon")) {
                return Optional.of(boundingBox(number(tl.get("lat")), number(tl.get("lon")),
                        number(br.get("lat")), number(br.get("lon"))));
            }
            return Optional.empty();
        }

        // { topLeft: [43.61, 3.85], bottomRight: [43.59, 3.89] }
        if (topLeft instanceof List && bottomRight instanceof List) {
            Optional<GeoPoint> tl = GeoPoints.parseArray((List<?>) topLeft);
            Optional<GeoPoint> br = GeoPoints.parseArray((List<?>) bottomRight);
            if (tl.isPresent() && br.isPresent()) {
                return Optional.of(boundingBox(tl.get(), br.get()));
            }
            return Optional.empty();
        }

        if (topLeft instanceof String && bottomRight instanceof String) {
            String tl = (String) topLeft;
            String br = (String) bottomRight;

            // { topLeft: "43.61, 3.85", bottomRight: "43.59, 3.89" }
            Matcher tlMatcher = GeoPoints.LAT_LON_STRING.matcher(tl);
            Matcher brMatcher = GeoPoints.LAT_LON_STRING.matcher(br);
            if (tlMatcher.matches() && brMatcher.matches()) {
                return Optional.of(boundingBox(Double.parseDouble(tlMatcher.group(1)),
                        Double.parseDouble(tlMatcher.group(2)),
                        Double.parseDouble(brMatcher.group(1)),
                        Double.parseDouble(brMatcher.group(2))));
            }

            // { topLeft: "spf8prntv18e", bottomRight: "spdzrz7huh5x" }
            if (GeoPoints.GEOHASH_STRING.matcher(tl).matches() && GeoHash.isValid(tl)
                    && GeoPoints.GEOHASH_STRING.matcher(br).matches() && GeoHash.isValid(br)) {
                return Optional.of(boundingBox(GeoHash.decode(tl), GeoHash.decode(br)));
            }
        }

        return Optional.empty();
    }

    private FilterNode geoDistance(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "geoDistance");

        if (fields.size() != 2 || !fields.containsKey("distance")) {
            throw new FilterValidationException(
                    "\"geoDistance\" keyword requires a document field and a \"distance\" attribute");
        }

        String distance = mustBeString(fields, "geoDistance", "distance");
        String field = otherField(fields, "distance");
        GeoPoint point = GeoPoints.parse(toCamelCaseIfMap(fields.get(field)))
                .orElseThrow(() -> new FilterValidationException(
                        String.format("geoDistance.%s: unrecognized point format", field)));

        Document standardized = new Document("lat", point.getLat())
                .append("lon", point.getLon())
                .append("distance", toMeters(distance, "geoDistance"));

        return geospatial(GeoShape.DISTANCE, field, standardized);
    }

    private FilterNode geoDistanceRange(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "geoDistanceRange");

        if (fields.size() != 3 || !fields.containsKey("from") || !fields.containsKey("to")) {
            throw new FilterValidationException(
                    "\"geoDistanceRange\" keyword requires a document field and the following attributes: \"from\", \"to\"");
        }

        String from = mustBeString(fields, "geoDistanceRange", "from");
        String to = mustBeString(fields, "geoDistanceRange", "to");
        String field = otherField(fields, "from", "to");
        GeoPoint point = GeoPoints.parse(toCamelCaseIfMap(fields.get(field)))
                .orElseThrow(() -> new FilterValidationException(
                        String.format("geoDistanceRange.%s: unrecognized point format", field)));

        double fromMeters = toMeters(from, "geoDistanceRange");
        double toMeters = toMeters(to, "geoDistanceRange");

        if (fromMeters >= toMeters) {
            throw new FilterValidationException(String.format(
                    "geoDistanceRange.%s: inner radius must be smaller than outer radius", field));
        }

        Document standardized = new Document("lat", point.getLat())
                .append("lon", point.getLon())
                .append("from", fromMeters)
                .append("to", toMeters);

        return geospatial(GeoShape.DISTANCE_RANGE, field, standardized);
    }

    private FilterNode geoPolygon(Object argument) {
        Map<String, Object> fields = mustBeNonEmptyObject(argument, "geoPolygon");
        String field = onlyOneFieldAttribute(fields, "geoPolygon");
        Map<String, Object> polygon = mustBeNonEmptyObject(fields.get(field), "geoPolygon." + field);

        requireAttribute(polygon, "geoPolygon." + field, "points");
        if (polygon.size() > 1) {
            throw new FilterValidationException(
                    String.format("\"geoPolygon.%s\" can only contain the following attribute: points", field));
        }

        List<?> rawPoints = mustBeNonEmptyArray(polygon, "geoPolygon." + field, "points");
        if (rawPoints.size() < 3) {
            throw new FilterValidationException(String.format(
                    "\"geoPolygon.%s\": at least 3 points are required to build a polygon", field));
        }

        List<List<Double>> points = new ArrayList<>();
        for (Object rawPoint : rawPoints) {
            GeoPoint point = GeoPoints.parse(toCamelCaseIfMap(rawPoint))
                    .orElseThrow(() -> new FilterValidationException(String.format(
                            "geoPolygon.%s: unrecognized point format (%s)", field, rawPoint)));
            points.add(Arrays.asList(point.getLat(), point.getLon()));
        }

        return FilterNode.literal(Term.of(Keyword.GEOSPATIAL,
                new Document(GeoShape.POLYGON, new Document(field, points))));
    }

    private FilterNode geospatial(String type, String field, Document shape) {
        return FilterNode.literal(Term.of(Keyword.GEOSPATIAL, new Document(type, new Document(field, shape))));
    }

    private FilterNode not(Object argument) {
        Map<String, Object> operand = mustBeNonEmptyObject(argument, "not");
        String keyword = onlyOneFieldAttribute(operand, "not");

        if ("and".equals(keyword) || "or".equals(keyword)) {
            mustBeNonEmptyArray(operand, "not", keyword);
        } else {
            mustBeNonEmptyObject(operand.get(keyword), "not." + keyword);
        }

        return standardize(operand).negate();
    }

    private FilterNode bool(Object argument) {
        Map<String, Object> attributes = mustBeNonEmptyObject(argument, "bool");

        if (!BOOL_ATTRIBUTES.containsAll(attributes.keySet())) {
            throw new FilterValidationException(
                    "\"bool\" operand accepts only the following attributes: " + String.join(", ", BOOL_ATTRIBUTES));
        }

        List<Object> and = new ArrayList<>();
        if (attributes.get("must") != null) {
            and.addAll(asList(attributes.get("must")));
        }
        if (attributes.get("must_not") != null) {
            and.add(new Document("not", new Document("or", attributes.get("must_not"))));
        }
        if (attributes.get("should") != null) {
            and.add(new Document("or", attributes.get("should")));
        }
        if (attributes.get("should_not") != null) {
            and.add(new Document("not", new Document("and", attributes.get("should_not"))));
        }

        return standardize(new Document("and", and));
    }

    /**
     * Standardizes an AND-like or OR-like array.
     * Literal members are gathered into a compound leaf, so that they take a single
     * truth-table column during canonicalization; nested groups using the same
     * operand are flattened.
     */
    private FilterNode filterArray(Object argument, FilterNode.Type operand, String keyword) {
        if (!(argument instanceof List)) {
            throw new FilterValidationException(
                    String.format("Attribute \"%s\" in \"%s\" must be an array", keyword, keyword));
        }

        List<?> members = (List<?>) argument;
        if (members.isEmpty()) {
            throw new FilterValidationException(
                    String.format("Attribute \"%s\" in \"%s\" cannot be empty", keyword, keyword));
        }

        for (Object member : members) {
            if (!(member instanceof Map) || ((Map<?, ?>) member).isEmpty()) {
                throw new FilterValidationException(
                        String.format("\"%s\" operand can only contain non-empty objects", keyword));
            }
        }

        List<FilterNode> literals = new ArrayList<>();
        List<FilterNode> groups = new ArrayList<>();

        for (Object member : members) {
            absorb(standardize(asMap(member)), operand, literals, groups);
        }

        if (groups.isEmpty()) {
            if (literals.size() == 1) {
                return literals.get(0);
            }
            return FilterNode.group(operand, literals, true);
        }

        List<FilterNode> children = new ArrayList<>(groups);
        if (literals.size() == 1) {
            children.add(literals.get(0));
        } else if (literals.size() > 1) {
            children.add(FilterNode.group(operand, literals, true));
        }

        if (children.size() == 1) {
            return children.get(0);
        }
        return FilterNode.group(operand, children, false);
    }

    private void absorb(FilterNode node, FilterNode.Type operand, List<FilterNode> literals, List<FilterNode> groups) {
        if (node.getType() == operand) {
            for (FilterNode child : node.getChildren()) {
                absorb(child, operand, literals, groups);
            }
        } else if (node.isLiteral()) {
            literals.add(node);
        } else {
            groups.add(node);
        }
    }

    private static Document boundingBox(double top, double left, double bottom, double right) {
        return new Document("top", top).append("left", left).append("bottom", bottom).append("right", right);
    }

    private static Document boundingBox(GeoPoint topLeft, GeoPoint bottomRight) {
        return boundingBox(topLeft.getLat(), topLeft.getLon(), bottomRight.getLat(), bottomRight.getLon());
    }

    private static double toMeters(String distance, String keyword) {
        try {
            return DistanceConverter.toMeters(distance);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException(keyword + ": " + e.getMessage(), e);
        }
    }

    private static String otherField(Map<String, Object> fields, String... reserved) {
        List<String> reservedList = Arrays.asList(reserved);
        return fields.keySet().stream()
                .filter(f -> !reservedList.contains(f))
                .findFirst()
                .orElseThrow(() -> new FilterValidationException("Missing document field"));
    }

    private static Object toCamelCaseIfMap(Object value) {
        return value instanceof Map ? toCamelCase(asMap(value)) : value;
    }

    /**
     * Converts snake_case geo attributes (top_left, lat_lon...) to camelCase.
     */
    private static Map<String, Object> toCamelCase(Map<String, Object> value) {
        Document result = new Document();
        for (Map.Entry<String, Object> entry : value.entrySet()) {
            StringBuilder key = new StringBuilder();
            boolean upper = false;
            for (char c : entry.getKey().toCharArray()) {
                if (c == '_') {
                    upper = true;
                } else {
                    key.append(upper ? Character.toUpperCase(c) : c);
                    upper = false;
                }
            }
            result.put(key.toString(), entry.getValue());
        }
        return result;
    }

    private static boolean allNumbers(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            if (!(map.get(key) instanceof Number)) {
                return false;
            }
        }
        return true;
    }

    private static double number(Object value) {
        return ((Number) value).doubleValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : List.of(value);
    }

    /**
     * Tests if the argument is a non-empty object.
     */
    private static Map<String, Object> mustBeNonEmptyObject(Object argument, String keyword) {
        if (!(argument instanceof Map) || ((Map<?, ?>) argument).isEmpty()) {
            throw new FilterValidationException(String.format("\"%s\" must be a non-empty object", keyword));
        }
        return asMap(argument);
    }

    /**
     * Verifies that the object holds a single attribute and returns its name.
     */
    private static String onlyOneFieldAttribute(Map<String, Object> fields, String keyword) {
        if (fields.size() > 1) {
            throw new FilterValidationException(String.format("\"%s\" can contain only one attribute", keyword));
        }
        return fields.keySet().iterator().next();
    }

    private static void requireAttribute(Map<String, Object> filter, String keyword, String attribute) {
        if (filter.get(attribute) == null) {
            throw new FilterValidationException(
                    String.format("\"%s\" requires the following attribute: %s", keyword, attribute));
        }
    }

    private static String mustBeString(Map<String, Object> filter, String keyword, String attribute) {
        Object value = filter.get(attribute);
        if (!(value instanceof String)) {
            throw new FilterValidationException(
                    String.format("Attribute \"%s\" in \"%s\" must be a string", attribute, keyword));
        }
        return (String) value;
    }

    private static List<?> mustBeNonEmptyArray(Map<String, Object> filter, String keyword, String attribute) {
        Object value = filter.get(attribute);
        if (!(value instanceof List)) {
            throw new FilterValidationException(
                    String.format("Attribute \"%s\" in \"%s\" must be an array", attribute, keyword));
        }
        if (((List<?>) value).isEmpty()) {
            throw new FilterValidationException(
                    String.format("Attribute \"%s\" in \"%s\" cannot be empty", attribute, keyword));
        }
        return (List<?>) value;
    }
}
