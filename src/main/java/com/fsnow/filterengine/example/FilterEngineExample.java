package com.fsnow.filterengine.example;

import com.fsnow.filterengine.FilterEngine;
import com.fsnow.filterengine.config.FilterEngineConfig;
import com.fsnow.filterengine.exception.FilterValidationException;
import com.fsnow.filterengine.model.RegistrationResult;
import org.bson.Document;

import java.util.List;

/**
 * Example demonstrating how to register filters and test incoming documents.
 * Filters and documents are written as JSON and parsed to BSON documents.
 */
public class FilterEngineExample {

    public static void main(String[] args) {
        String index = "tickets";
        String collection = "issues";

        FilterEngineConfig config = FilterEngineConfig.builder()
                .maxConditionsPerFilter(16)
                .reindexThreshold(0.1)      // Compact once 10% of the slots are freed
                .reindexDelayMillis(1000)   // Let removal bursts complete first
                .build();

        try (FilterEngine engine = new FilterEngine(config)) {

            // Example 1: register a few subscriptions
            RegistrationResult adults = engine.register(index, collection, Document.parse(
                    "{and: [{equals: {status: 'open'}}, {range: {age: {gte: 18}}}]}"));
            RegistrationResult names = engine.register(index, collection, Document.parse(
                    "{regexp: {name: {value: '^A', flags: 'i'}}}"));
            RegistrationResult nearby = engine.register(index, collection, Document.parse(
                    "{geoDistance: {location: {lat: 43.6, lon: 3.88}, distance: '10km'}}"));

            System.out.println("=== Registered filters ===");
            System.out.println(adults);
            System.out.println(names);
            System.out.println(nearby);
            adults.getDiff().ifPresent(diff -> System.out.println("Diff: " + diff.toDocument().toJson()));

            // Example 2: equivalent filters share the same id
            RegistrationResult in = engine.register(index, collection, Document.parse(
                    "{in: {color: ['red', 'blue']}}"));
            RegistrationResult or = engine.register(index, collection, Document.parse(
                    "{or: [{equals: {color: 'red'}}, {equals: {color: 'blue'}}]}"));
            System.out.println("\n=== Equivalent filters ===");
            System.out.println("Same id: " + in.getId().equals(or.getId()) + ", second created: " + or.isCreated());

            // Example 3: test documents
            System.out.println("\n=== Matching ===");
            List<String> matches = engine.test(index, collection, Document.parse(
                    "{status: 'open', age: 21, name: 'alice', location: {lat: 43.61, lon: 3.87}}"));
            System.out.println("Matched filters: " + matches);
            System.out.println("Matched filters: " + engine.test(index, collection, Document.parse(
                    "{status: 'closed', color: 'red'}")));

            // Example 4: invalid filters are rejected
            try {
                engine.validate(Document.parse("{range: {age: {gt: 30, lt: 10}}}"));
            } catch (FilterValidationException e) {
                System.out.println("\nRejected filter: " + e.getMessage());
            }

            // Example 5: removal
            engine.remove(names.getId());
            System.out.println("\nFilters left: " + engine.getFilterIds(index, collection));
        }
    }
}
