package com.fsnow.filterengine;

import com.fsnow.filterengine.config.FilterEngineConfig;
import com.fsnow.filterengine.exception.CanonicalizationException;
import com.fsnow.filterengine.exception.FilterNotFoundException;
import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.exception.InvalidNamespaceException;
import com.fsnow.filterengine.matching.Matcher;
import com.fsnow.filterengine.model.NormalizedFilter;
import com.fsnow.filterengine.model.RegistrationResult;
import com.fsnow.filterengine.model.Term;
import com.fsnow.filterengine.storage.ContentHasher;
import com.fsnow.filterengine.storage.FilterStorage;
import com.fsnow.filterengine.storage.Reindexer;
import com.fsnow.filterengine.transformation.CanonicalConverter;
import com.fsnow.filterengine.transformation.FilterNode;
import com.fsnow.filterengine.transformation.Standardizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Main entry point of the real-time filter engine.
 * <p>
 * Filters are registered on an (index, collection) namespace, then every
 * incoming document is tested against all filters of its namespace at once.
 * Filters are canonicalized before being stored, so that equivalent filters
 * share the same id and the same storage.
 */
public class FilterEngine implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(FilterEngine.class);

    private final FilterEngineConfig config;
    private final Standardizer standardizer;
    private final CanonicalConverter canonicalConverter;
    private final ContentHasher hasher;
    private final Reindexer reindexer;
    private final FilterStorage storage;
    private final Matcher matcher;

    /**
     * Creates a FilterEngine with the default configuration.
     */
    public FilterEngine() {
        this(FilterEngineConfig.defaultConfig());
    }

    /**
     * Creates a FilterEngine.
     *
     * @param config The engine configuration
     */
    public FilterEngine(FilterEngineConfig config) {
        this(config, new CanonicalConverter(config));
    }

    FilterEngine(FilterEngineConfig config, CanonicalConverter canonicalConverter) {
        this.config = config;
        this.standardizer = new Standardizer();
        this.canonicalConverter = canonicalConverter;
        this.hasher = new ContentHasher();
        this.reindexer = new Reindexer(config.getReindexThreshold(), config.getReindexDelayMillis());
        this.storage = new FilterStorage(hasher, reindexer);
        this.matcher = new Matcher(storage);

        logger.info("Filter engine started: {}", config);
    }

    public FilterEngineConfig getConfig() {
        return config;
    }

    /**
     * Checks that a filter is well-formed.
     *
     * @param filter The raw filter
     * @return true if the filter is valid
     * @throws FilterValidationException if it is not
     */
    public boolean validate(Map<String, Object> filter) {
        standardizer.standardize(filter);
        return true;
    }

    /**
     * Converts a raw filter to its canonical form and computes its id,
     * without storing anything.
     *
     * @throws FilterValidationException if the filter or the namespace is invalid
     * @throws CanonicalizationException if the filter cannot be canonicalized
     */
    public NormalizedFilter normalize(String index, String collection, Map<String, Object> filter) {
        validateNamespace(index, collection);

        FilterNode standardized = standardizer.standardize(filter);
        List<List<Term>> clauses;

        try {
            clauses = canonicalConverter.convert(standardized);
        } catch (CanonicalizationException e) {
            logger.error("Unable to canonicalize filter {} on {}/{}", filter, index, collection, e);
            throw e;
        }

        return new NormalizedFilter(index, collection, hasher.filterId(index, collection, clauses), clauses);
    }

    /**
     * Stores a normalized filter, typically one replicated from a peer.
     */
    public RegistrationResult store(NormalizedFilter filter) {
        RegistrationResult result = storage.store(filter);

        if (result.isCreated()) {
            logger.debug("Registered filter {} on {}/{}", result.getId(), filter.getIndex(), filter.getCollection());
        }
        return result;
    }

    /**
     * Registers a filter on a namespace.
     * Registering an equivalent filter again returns the same id and no diff.
     *
     * @param index The index name
     * @param collection The collection name
     * @param filter The raw filter, an empty one matching every document
     * @return the filter id, with the storage diff if the filter was created
     * @throws FilterValidationException if the filter or the namespace is invalid
     */
    public RegistrationResult register(String index, String collection, Map<String, Object> filter) {
        return store(normalize(index, collection, filter));
    }

    /**
     * Gets the ids of the filters matching a document.
     */
    public List<String> test(String index, String collection, Map<String, Object> document) {
        return test(index, collection, document, null);
    }

    /**
     * Gets the ids of the filters matching a document.
     *
     * @param documentId The document id, tested by the "ids" keyword; may be null
     * @return matched filter ids, each appearing once
     */
    public List<String> test(String index, String collection, Map<String, Object> document, String documentId) {
        return matcher.test(index, collection, document, documentId);
    }

    /**
     * Removes a filter.
     *
     * @throws FilterNotFoundException if the filter id is unknown
     */
    public void remove(String filterId) {
        storage.remove(filterId);
        logger.debug("Removed filter {}", filterId);
    }

    /**
     * Checks if a namespace holds at least one filter.
     */
    public boolean exists(String index, String collection) {
        return storage.exists(index, collection);
    }

    /**
     * Checks if a filter is registered.
     */
    public boolean hasFilter(String filterId) {
        return storage.hasFilter(filterId);
    }

    public Optional<NormalizedFilter> getFilter(String filterId) {
        return storage.getFilter(filterId);
    }

    /**
     * Ids of the filters registered on a namespace, empty if there is none.
     */
    public List<String> getFilterIds(String index, String collection) {
        return storage.getFilterIds(index, collection);
    }

    public Set<String> getIndexes() {
        return storage.getIndexes();
    }

    public Set<String> getCollections(String index) {
        return storage.getCollections(index);
    }

    FilterStorage getStorage() {
        return storage;
    }

    Reindexer getReindexer() {
        return reindexer;
    }

    /**
     * Validates that both parts of the namespace are non-blank.
     *
     * @throws InvalidNamespaceException if either is missing or blank
     */
    private void validateNamespace(String index, String collection) {
        if (index == null || index.trim().isEmpty() || collection == null || collection.trim().isEmpty()) {
            throw new InvalidNamespaceException(index, collection);
        }
    }

    @Override
    public void close() {
        reindexer.shutdown();
    }
}
