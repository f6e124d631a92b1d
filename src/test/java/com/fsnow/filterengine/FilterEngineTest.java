package com.fsnow.filterengine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fsnow.filterengine.config.FilterEngineConfig;
import com.fsnow.filterengine.exception.CanonicalizationException;
import com.fsnow.filterengine.exception.FilterNotFoundException;
import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.exception.InvalidNamespaceException;
import com.fsnow.filterengine.model.FilterDiff;
import com.fsnow.filterengine.model.NormalizedFilter;
import com.fsnow.filterengine.model.RegistrationResult;
import com.fsnow.filterengine.model.Term;
import com.fsnow.filterengine.storage.NamespaceStorage;
import com.fsnow.filterengine.transformation.CanonicalConverter;
import com.fsnow.filterengine.transformation.FilterNode;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterEngineTest {

    private static final String INDEX = "tickets";
    private static final String COLLECTION = "issues";

    private FilterEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FilterEngine();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private String register(String filter) {
        return engine.register(INDEX, COLLECTION, Document.parse(filter)).getId();
    }

    private List<String> test(String document) {
        return engine.test(INDEX, COLLECTION, Document.parse(document));
    }

    @Test
    void testEquivalentFiltersShareTheirId() {
        String in = register("{in: {a: ['x', 'y']}}");
        String or = register("{or: [{equals: {a: 'x'}}, {equals: {a: 'y'}}]}");
        String reordered = register("{or: [{equals: {a: 'y'}}, {equals: {a: 'x'}}]}");
        String negated = register("{not: {not: {in: {a: ['y', 'x']}}}}");

        assertThat(or).isEqualTo(in);
        assertThat(reordered).isEqualTo(in);
        assertThat(negated).isEqualTo(in);
        assertThat(engine.getFilterIds(INDEX, COLLECTION)).containsExactly(in);
    }

    @Test
    void testEqualNumbersShareTheirId() {
        String integer = register("{equals: {a: 1}}");
        String floating = register("{equals: {a: 1.0}}");
        String redundant = register("{and: [{equals: {a: 1}}, {equals: {a: 1.0}}]}");

        assertThat(floating).isEqualTo(integer);
        assertThat(redundant).isEqualTo(integer);
        assertThat(test("{a: 1}")).containsExactly(integer);
    }

    @Test
    void testSameFilterOnAnotherNamespaceGetsAnotherId() {
        String first = register("{equals: {a: 1}}");
        String second = engine.register(INDEX, "other", Document.parse("{equals: {a: 1}}")).getId();

        assertThat(second).isNotEqualTo(first);
        assertThat(engine.getCollections(INDEX)).containsExactly(COLLECTION, "other");
        assertThat(engine.getIndexes()).containsExactly(INDEX);
    }

    @Test
    void testRegistrationIsIdempotent() {
        RegistrationResult first = engine.register(INDEX, COLLECTION, Document.parse("{exists: {field: 'a'}}"));
        RegistrationResult second = engine.register(INDEX, COLLECTION, Document.parse("{exists: {field: 'a'}}"));

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        assertThat(second.getId()).isEqualTo(first.getId());

        engine.remove(first.getId());
        assertThat(engine.hasFilter(first.getId())).isFalse();

        assertThatThrownBy(() -> engine.remove(first.getId()))
                .isInstanceOf(FilterNotFoundException.class)
                .hasMessageContaining(first.getId());
    }

    @Test
    void testRoundTripLeavesNothingBehind() {
        String id = register("{and: [{equals: {a: 1}}, {range: {b: {gt: 0}}}]}");
        NamespaceStorage namespace = engine.getStorage().getNamespace(INDEX, COLLECTION).orElseThrow();

        engine.remove(id);

        assertThat(engine.exists(INDEX, COLLECTION)).isFalse();
        assertThat(engine.getFilterIds(INDEX, COLLECTION)).isEmpty();
        assertThat(engine.getIndexes()).isEmpty();
        assertThat(namespace.getFilterCount()).isZero();
        assertThat(namespace.getSubfilterCount()).isZero();
        assertThat(namespace.getConditionCount()).isZero();
        assertThat(namespace.getOperandStores()).isEmpty();
        assertThat(test("{a: 1, b: 1}")).isEmpty();
    }

    @Test
    void testEmptyFilterMatchesEverything() {
        String id = engine.register(INDEX, COLLECTION, new Document()).getId();

        assertThat(test("{}")).containsExactly(id);
        assertThat(test("{a: 1, b: {c: 'd'}}")).containsExactly(id);

        engine.remove(id);
        assertThat(engine.exists(INDEX, COLLECTION)).isFalse();
    }

    @Test
    void testTicketsScenario() {
        String id = register("{and: [{equals: {status: 'open'}}, {range: {age: {gte: 18}}}]}");

        assertThat(test("{status: 'open', age: 21}")).containsExactly(id);
        assertThat(test("{status: 'closed', age: 21}")).isEmpty();
        assertThat(test("{status: 'open', age: 17}")).isEmpty();
    }

    @Test
    void testRegexpScenario() {
        String id = register("{regexp: {name: {value: '^A', flags: 'i'}}}");

        assertThat(test("{name: 'alice'}")).containsExactly(id);
        assertThat(test("{name: 'bob'}")).isEmpty();
    }

    @Test
    void testSharedSubfilterSurvivesRemoval() {
        String first = register("{or: [{equals: {x: 1}}, {equals: {y: 2}}]}");
        String second = register("{or: [{equals: {x: 1}}, {exists: {field: 'z'}}]}");
        NamespaceStorage namespace = engine.getStorage().getNamespace(INDEX, COLLECTION).orElseThrow();

        assertThat(namespace.getSubfilterCount()).isEqualTo(3);
        assertThat(test("{x: 1}")).containsExactlyInAnyOrder(first, second);

        engine.remove(first);

        assertThat(namespace.getSubfilterCount()).isEqualTo(2);
        assertThat(namespace.getConditionCount()).isEqualTo(2);
        assertThat(test("{x: 1}")).containsExactly(second);
        assertThat(test("{y: 2}")).isEmpty();
    }

    @Test
    void testFilterIsReportedOnce() {
        String id = register("{or: [{equals: {a: 1}}, {exists: {field: 'a'}}, {range: {a: {gt: 0}}}]}");

        assertThat(test("{a: 1}")).containsExactly(id);
    }

    @Test
    void testDocumentId() {
        String id = register("{ids: {values: ['42']}}");

        assertThat(engine.test(INDEX, COLLECTION, new Document(), "42")).containsExactly(id);
        assertThat(engine.test(INDEX, COLLECTION, new Document(), "43")).isEmpty();
    }

    @Test
    void testUnknownNamespace() {
        register("{equals: {a: 1}}");

        assertThat(engine.test(INDEX, "unknown", Document.parse("{a: 1}"))).isEmpty();
        assertThat(engine.exists("unknown", COLLECTION)).isFalse();
        assertThat(engine.getFilterIds("unknown", COLLECTION)).isEmpty();
    }

    @Test
    void testCanonicalizationFailureIsLoggedAndRethrown() {
        CanonicalConverter failing = new CanonicalConverter(FilterEngineConfig.defaultConfig()) {
            @Override
            public List<List<Term>> convert(FilterNode filter) {
                throw new CanonicalizationException("Unable to minimize filter " + filter);
            }
        };
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Logger engineLogger = (Logger) LoggerFactory.getLogger(FilterEngine.class);
        appender.start();
        engineLogger.addAppender(appender);

        try (FilterEngine broken = new FilterEngine(FilterEngineConfig.defaultConfig(), failing)) {
            assertThatThrownBy(() -> broken.register(INDEX, COLLECTION, Document.parse("{equals: {a: 1}}")))
                    .isInstanceOf(CanonicalizationException.class);
            assertThat(broken.exists(INDEX, COLLECTION)).isFalse();
        } finally {
            engineLogger.detachAppender(appender);
        }

        assertThat(appender.list)
                .filteredOn(event -> event.getLevel() == Level.ERROR)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement(InstanceOfAssertFactories.STRING)
                .startsWith("Unable to canonicalize filter")
                .endsWith("on tickets/issues");
    }

    @Test
    void testValidation() {
        assertThat(engine.validate(Document.parse("{equals: {a: 1}}"))).isTrue();

        assertThatThrownBy(() -> engine.validate(Document.parse("{foo: {a: 1}}")))
                .isInstanceOf(FilterValidationException.class)
                .hasMessage("Unknown DSL keyword: foo");
        assertThatThrownBy(() -> register("{range: {a: {gt: 'x'}}}"))
                .isInstanceOf(FilterValidationException.class);
        assertThat(engine.exists(INDEX, COLLECTION)).isFalse();
    }

    @Test
    void testInvalidNamespace() {
        assertThatThrownBy(() -> engine.register("", COLLECTION, Document.parse("{equals: {a: 1}}")))
                .isInstanceOf(InvalidNamespaceException.class);
        assertThatThrownBy(() -> engine.register(INDEX, "  ", Document.parse("{equals: {a: 1}}")))
                .isInstanceOf(InvalidNamespaceException.class);
        assertThatThrownBy(() -> engine.register(null, COLLECTION, Document.parse("{equals: {a: 1}}")))
                .isInstanceOf(FilterValidationException.class);
    }

    @Test
    void testNormalizeDoesNotStore() {
        NormalizedFilter normalized = engine.normalize(INDEX, COLLECTION, Document.parse("{equals: {a: 1}}"));

        assertThat(engine.hasFilter(normalized.getId())).isFalse();
        assertThat(engine.exists(INDEX, COLLECTION)).isFalse();
        assertThat(normalized.getClauses()).hasSize(1);
    }

    @Test
    void testReplicatedFilter() {
        RegistrationResult result = engine.register(INDEX, COLLECTION,
                Document.parse("{or: [{equals: {a: 1}}, {exists: {field: 'b'}}]}"));
        FilterDiff diff = result.getDiff().orElseThrow();

        Document transport = diff.toDocument();
        assertThat(transport.get("ftAdd", Document.class).getString("id")).isEqualTo(result.getId());

        FilterDiff received = FilterDiff.fromDocument(Document.parse(transport.toJson()));
        assertThat(received.getFilter().getClauses()).isEqualTo(diff.getFilter().getClauses());
        assertThat(received.getAddedSubfilterIds()).isEqualTo(diff.getAddedSubfilterIds());

        try (FilterEngine peer = new FilterEngine()) {
            RegistrationResult replicated = peer.store(received.getFilter());

            assertThat(replicated.getId()).isEqualTo(result.getId());
            assertThat(peer.test(INDEX, COLLECTION, Document.parse("{b: 0}"))).containsExactly(result.getId());
            assertThat(peer.getFilter(result.getId())).contains(diff.getFilter());
        }
    }

    @Test
    void testManyFiltersOnSameField() {
        for (int i = 0; i < 100; i++) {
            register("{range: {price: {gte: " + i + ", lt: " + (i + 10) + "}}}");
        }

        assertThat(test("{price: 50}")).hasSize(10);
        assertThat(test("{price: -1}")).isEmpty();
        assertThat(test("{price: 105}")).hasSize(4);
    }
}
