package com.brainfusion.common.knowledge;

import com.brainfusion.common.model.KnowledgeItem;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public class InMemoryKnowledgeRepository implements KnowledgeRepository {

    private final ConcurrentHashMap<String, KnowledgeItem> items = new ConcurrentHashMap<>();

    @Override
    public KnowledgeItem save(KnowledgeItem item) {
        items.put(item.id(), item);
        return item;
    }

    @Override
    public Collection<KnowledgeItem> findAll() {
        return List.copyOf(items.values());
    }

    @Override
    public Optional<KnowledgeItem> update(String id, UnaryOperator<KnowledgeItem> fn) {
        return Optional.ofNullable(items.computeIfPresent(id, (key, current) -> fn.apply(current)));
    }

    @Override
    public int removeIf(Predicate<KnowledgeItem> predicate) {
        int before = items.size();
        items.values().removeIf(predicate);
        return Math.max(0, before - items.size());
    }
}
