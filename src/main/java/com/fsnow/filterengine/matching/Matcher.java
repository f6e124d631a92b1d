package com.fsnow.filterengine.matching;

import com.fsnow.filterengine.storage.FilterStorage;
import com.fsnow.filterengine.storage.NamespaceStorage;
import com.fsnow.filterengine.storage.operand.OperandStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tests documents against the filters registered on a namespace.
 * <p>
 * Operand stores are walked in keyword order. Each satisfied condition
 * decrements the counter of the subfilters using it, and a subfilter whose
 * counter reaches zero reports its filters, each filter at most once.
 */
public class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private final FilterStorage storage;

    public Matcher(FilterStorage storage) {
        this.storage = storage;
    }

    /**
     * Gets the ids of the filters matched by a document.
     *
     * @param document The document to test
     * @param documentId The document id, may be null
     * @return matched filter ids, without duplicates
     */
    public List<String> test(String index, String collection, Map<String, Object> document, String documentId) {
        Optional<NamespaceStorage> namespace = storage.getNamespace(index, collection);
        if (namespace.isEmpty()) {
            return Collections.emptyList();
        }

        FlattenedDocument flattened = FlattenedDocument.of(document, documentId);
        NamespaceStorage namespaceStorage = namespace.get();

        namespaceStorage.lock();
        try {
            if (namespaceStorage.isDropped()) {
                return Collections.emptyList();
            }

            MatchContext context = namespaceStorage.getTestTable().newMatchContext();
            for (OperandStore store : namespaceStorage.getOperandStores()) {
                store.match(flattened, context);
            }

            List<String> matches = new ArrayList<>(context.getMatches());
            logger.trace("Document matched {} filters on {}/{}", matches.size(), index, collection);
            return matches;
        } finally {
            namespaceStorage.unlock();
        }
    }
}
