package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.exception.FilterNotFoundException;
import com.fsnow.filterengine.model.FilterDiff;
import com.fsnow.filterengine.model.NormalizedFilter;
import com.fsnow.filterengine.model.RegistrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage engine: registered filters, by index then collection.
 * <p>
 * Registrations and removals are serialized. Each namespace is guarded by its
 * own lock, shared with matching and reindexing. Namespaces are created with
 * their first filter, and pruned with their last one, along with the index
 * entry when it becomes empty.
 */
public class FilterStorage {

    private static final Logger logger = LoggerFactory.getLogger(FilterStorage.class);

    private final Map<String, Map<String, NamespaceStorage>> namespaces = new ConcurrentHashMap<>();
    private final Map<String, NamespaceStorage> filterNamespaces = new ConcurrentHashMap<>();
    private final ContentHasher hasher;
    private final Reindexer reindexer;

    public FilterStorage(ContentHasher hasher, Reindexer reindexer) {
        this.hasher = hasher;
        this.reindexer = reindexer;
    }

    /**
     * Stores a normalized filter. Storing an already registered filter changes nothing.
     *
     * @return the filter id, with the storage diff if the filter was created
     */
    public synchronized RegistrationResult store(NormalizedFilter filter) {
        if (filterNamespaces.containsKey(filter.getId())) {
            logger.debug("Filter {} already registered", filter.getId());
            return RegistrationResult.existing(filter.getId());
        }

        NamespaceStorage namespace = namespaces
                .computeIfAbsent(filter.getIndex(), i -> new ConcurrentHashMap<>())
                .computeIfAbsent(filter.getCollection(),
                        c -> new NamespaceStorage(filter.getIndex(), filter.getCollection(), hasher));

        namespace.lock();
        try {
            FilterDiff diff = namespace.store(filter);
            filterNamespaces.put(filter.getId(), namespace);
            return RegistrationResult.created(diff);
        } finally {
            namespace.unlock();
        }
    }

    /**
     * Removes a filter, cascading to the structures it was the last user of.
     *
     * @throws FilterNotFoundException if the filter is unknown
     */
    public synchronized void remove(String filterId) {
        NamespaceStorage namespace = filterNamespaces.get(filterId);
        if (namespace == null) {
            throw new FilterNotFoundException(filterId);
        }

        namespace.lock();
        try {
            boolean empty = namespace.remove(filterId);
            filterNamespaces.remove(filterId);

            if (empty) {
                namespace.markDropped();
                drop(namespace);
            } else if (reindexer.needsReindex(namespace)) {
                reindexer.schedule(namespace);
            }
        } finally {
            namespace.unlock();
        }
    }

    private void drop(NamespaceStorage namespace) {
        Map<String, NamespaceStorage> collections = namespaces.get(namespace.getIndex());
        if (collections == null) {
            return;
        }

        collections.remove(namespace.getCollection());
        if (collections.isEmpty()) {
            namespaces.remove(namespace.getIndex());
        }
        logger.debug("Dropped empty namespace {}/{}", namespace.getIndex(), namespace.getCollection());
    }

    /**
     * Gets the storage of a namespace holding at least one filter.
     */
    public Optional<NamespaceStorage> getNamespace(String index, String collection) {
        Map<String, NamespaceStorage> collections = namespaces.get(index);
        if (collections == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(collections.get(collection));
    }

    public boolean exists(String index, String collection) {
        return getNamespace(index, collection).isPresent();
    }

    public boolean hasFilter(String filterId) {
        return filterNamespaces.containsKey(filterId);
    }

    /**
     * Ids of the filters registered on a namespace, in registration order.
     */
    public List<String> getFilterIds(String index, String collection) {
        Optional<NamespaceStorage> namespace = getNamespace(index, collection);
        if (namespace.isEmpty()) {
            return Collections.emptyList();
        }

        NamespaceStorage storage = namespace.get();
        storage.lock();
        try {
            return storage.getFilterIds();
        } finally {
            storage.unlock();
        }
    }

    public Optional<NormalizedFilter> getFilter(String filterId) {
        NamespaceStorage namespace = filterNamespaces.get(filterId);
        if (namespace == null) {
            return Optional.empty();
        }

        namespace.lock();
        try {
            StoredFilter filter = namespace.getFilter(filterId);
            return filter == null ? Optional.empty() : Optional.of(filter.getFilter());
        } finally {
            namespace.unlock();
        }
    }

    /**
     * Indexes holding at least one filter, sorted.
     */
    public Set<String> getIndexes() {
        return new TreeSet<>(namespaces.keySet());
    }

    /**
     * Collections of an index holding at least one filter, sorted.
     */
    public Set<String> getCollections(String index) {
        Map<String, NamespaceStorage> collections = namespaces.get(index);
        return collections == null ? Collections.emptySet() : new TreeSet<>(collections.keySet());
    }
}
