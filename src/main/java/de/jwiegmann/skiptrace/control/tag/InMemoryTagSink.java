package de.jwiegmann.skiptrace.control.tag;

import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryTagSink implements TagSink {

    // Map<recordId, tags>
    private final Map<String, Set<String>> store = new ConcurrentHashMap<>();

    @Override
    public void accept(String recordId, Set<String> tags) {
        store.computeIfAbsent(recordId, k -> ConcurrentHashMap.newKeySet()).addAll(tags);
    }

    public Set<String> tagsOf(String recordId) {
        return new LinkedHashSet<>(store.getOrDefault(recordId, Set.of()));
    }
}
