package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.model.FilterDiff;
import com.fsnow.filterengine.model.Keyword;
import com.fsnow.filterengine.model.NormalizedFilter;
import com.fsnow.filterengine.model.Term;
import com.fsnow.filterengine.storage.operand.OperandStore;
import com.fsnow.filterengine.storage.operand.OperandStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Filters, subfilters, conditions, operand stores and test table of one
 * (index, collection) pair.
 * <p>
 * Records reference each other by id. Every read or write must happen while
 * holding {@link #lock()}: this single critical section keeps matching,
 * registration, removal and reindexing mutually exclusive.
 */
public final class NamespaceStorage {

    private static final Logger logger = LoggerFactory.getLogger(NamespaceStorage.class);

    private final String index;
    private final String collection;
    private final ContentHasher hasher;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean reindexScheduled = new AtomicBoolean(false);
    private volatile boolean dropped;

    private final Map<String, StoredFilter> filters = new LinkedHashMap<>();
    private final Map<String, Subfilter> subfilters = new LinkedHashMap<>();
    private final Map<String, StoredCondition> conditions = new LinkedHashMap<>();
    private final EnumMap<Keyword, OperandStore> operandStores = new EnumMap<>(Keyword.class);
    private final TestTable testTable = new TestTable();

    NamespaceStorage(String index, String collection, ContentHasher hasher) {
        this.index = index;
        this.collection = collection;
        this.hasher = hasher;
    }

    public String getIndex() {
        return index;
    }

    public String getCollection() {
        return collection;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * A dropped namespace lost its last filter and is no longer reachable.
     */
    public boolean isDropped() {
        return dropped;
    }

    void markDropped() {
        dropped = true;
    }

    /**
     * @return true if the caller is the one to schedule a reindex pass
     */
    boolean markReindexScheduled() {
        return reindexScheduled.compareAndSet(false, true);
    }

    void clearReindexScheduled() {
        reindexScheduled.set(false);
    }

    public TestTable getTestTable() {
        return testTable;
    }

    /**
     * Non-empty operand stores, in matching order.
     */
    public Collection<OperandStore> getOperandStores() {
        return operandStores.values();
    }

    public boolean hasFilter(String filterId) {
        return filters.containsKey(filterId);
    }

    public List<String> getFilterIds() {
        return new ArrayList<>(filters.keySet());
    }

    public int getFilterCount() {
        return filters.size();
    }

    public int getSubfilterCount() {
        return subfilters.size();
    }

    public int getConditionCount() {
        return conditions.size();
    }

    public StoredFilter getFilter(String filterId) {
        return filters.get(filterId);
    }

    public Subfilter getSubfilter(String subfilterId) {
        return subfilters.get(subfilterId);
    }

    public StoredCondition getCondition(String conditionId) {
        return conditions.get(conditionId);
    }

    /**
     * Stores a filter not yet registered in this namespace.
     * Subfilters and conditions already known are shared, not duplicated.
     *
     * @return the structures created by this registration
     */
    FilterDiff store(NormalizedFilter normalized) {
        String filterId = normalized.getId();
        List<String> addedSubfilters = new ArrayList<>();
        List<String> addedConditions = new ArrayList<>();
        Set<String> subfilterIds = new LinkedHashSet<>();
        List<Subfilter> owned = new ArrayList<>();

        for (List<Term> clause : normalized.getClauses()) {
            Map<String, Term> terms = new LinkedHashMap<>();
            for (Term term : clause) {
                terms.putIfAbsent(hasher.conditionId(term), term);
            }

            List<String> conditionIds = new ArrayList<>(terms.keySet());
            String subfilterId = hasher.subfilterId(conditionIds);

            if (!subfilterIds.add(subfilterId)) {
                continue;
            }

            Subfilter subfilter = subfilters.get(subfilterId);

            if (subfilter == null) {
                subfilter = new Subfilter(subfilterId, conditionIds);
                subfilter.setSlot(testTable.addSubfilter(conditionIds.size()));
                subfilters.put(subfilterId, subfilter);
                addedSubfilters.add(subfilterId);

                for (Map.Entry<String, Term> entry : terms.entrySet()) {
                    StoredCondition condition = conditions.get(entry.getKey());

                    if (condition == null) {
                        condition = new StoredCondition(entry.getKey(), entry.getValue());
                        conditions.put(entry.getKey(), condition);
                        addedConditions.add(entry.getKey());
                    }

                    condition.addSubfilter(subfilterId);
                    operandStores.computeIfAbsent(condition.getKeyword(), OperandStores::create)
                            .add(condition, subfilter);
                }
            }

            owned.add(subfilter);
        }

        StoredFilter filter = new StoredFilter(normalized, new ArrayList<>(subfilterIds));
        filter.setSlot(testTable.addFilter(filterId));
        filters.put(filterId, filter);

        for (Subfilter subfilter : owned) {
            subfilter.addFilter(filterId);
            testTable.attach(subfilter.getSlot(), filter.getSlot());
        }

        logger.debug("Stored filter {} on {}/{}: {} new subfilters, {} new conditions",
                filterId, index, collection, addedSubfilters.size(), addedConditions.size());
        return new FilterDiff(normalized, addedSubfilters, addedConditions);
    }

    /**
     * Removes a filter, then every subfilter and condition it was the last user of.
     *
     * @return true if the namespace holds no filter anymore
     */
    boolean remove(String filterId) {
        StoredFilter filter = filters.remove(filterId);
        if (filter == null) {
            return filters.isEmpty();
        }

        int removedSubfilters = 0;
        int removedConditions = 0;

        for (String subfilterId : filter.getSubfilterIds()) {
            Subfilter subfilter = subfilters.get(subfilterId);
            testTable.detach(subfilter.getSlot(), filter.getSlot());

            if (!subfilter.removeFilter(filterId)) {
                continue;
            }

            for (String conditionId : subfilter.getConditionIds()) {
                StoredCondition condition = conditions.get(conditionId);
                OperandStore store = operandStores.get(condition.getKeyword());
                store.remove(condition, subfilter);

                if (store.isEmpty()) {
                    operandStores.remove(condition.getKeyword());
                }

                if (condition.removeSubfilter(subfilterId)) {
                    conditions.remove(conditionId);
                    removedConditions++;
                }
            }

            subfilters.remove(subfilterId);
            testTable.removeSubfilter(subfilter.getSlot());
            removedSubfilters++;
        }

        testTable.removeFilter(filter.getSlot());

        logger.debug("Removed filter {} from {}/{}: {} subfilters and {} conditions released",
                filterId, index, collection, removedSubfilters, removedConditions);
        return filters.isEmpty();
    }

    /**
     * Rebuilds the test table without holes, renumbering live subfilters and filters.
     */
    void reindex() {
        int before = testTable.getSubfilterCount() + testTable.getFilterCount();
        testTable.reset();

        for (StoredFilter filter : filters.values()) {
            filter.setSlot(testTable.addFilter(filter.getId()));
        }

        for (Subfilter subfilter : subfilters.values()) {
            subfilter.setSlot(testTable.addSubfilter(subfilter.getConditionIds().size()));
            for (String filterId : subfilter.getFilterIds()) {
                testTable.attach(subfilter.getSlot(), filters.get(filterId).getSlot());
            }
        }

        logger.debug("Reindexed {}/{}: {} slots compacted to {}", index, collection, before,
                testTable.getSubfilterCount() + testTable.getFilterCount());
    }

    /**
     * Operand store of a keyword, if this namespace has conditions using it.
     */
    public OperandStore getOperandStore(Keyword keyword) {
        return operandStores.get(keyword);
    }

    @Override
    public String toString() {
        return String.format("NamespaceStorage{index='%s', collection='%s', filters=%d, subfilters=%d, conditions=%d}",
                index, collection, filters.size(), subfilters.size(), conditions.size());
    }
}
