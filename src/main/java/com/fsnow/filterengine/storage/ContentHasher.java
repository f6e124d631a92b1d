package com.fsnow.filterengine.storage;

import com.fsnow.filterengine.model.CanonicalJson;
import com.fsnow.filterengine.model.NormalizedFilter;
import com.fsnow.filterengine.model.Term;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Computes the content-derived ids of filters, subfilters and conditions.
 * Ids are hex-encoded 128-bit Murmur3 hashes of a canonical JSON rendering,
 * so structurally identical content always gets the same id.
 */
public final class ContentHasher {

    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    public String filterId(String index, String collection, List<List<Term>> clauses) {
        return hash(CanonicalJson.of(Arrays.asList(index, collection, NormalizedFilter.toDocuments(clauses))));
    }

    public String subfilterId(List<String> conditionIds) {
        return hash(CanonicalJson.of(conditionIds));
    }

    public String conditionId(Term term) {
        return hash(term.getSortKey());
    }

    private static String hash(String content) {
        return HASH_FUNCTION.hashString(content, StandardCharsets.UTF_8).toString();
    }
}
