package com.brainfusion.common.knowledge;

import com.brainfusion.common.model.KnowledgeItem;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Storage for shared knowledge items, keyed by item id.
 * {@link #update} must be atomic per id.
 */
public interface KnowledgeRepository {

    /** Stores {@code item}, replacing any item with the same id. */
    KnowledgeItem save(KnowledgeItem item);

    Collection<KnowledgeItem> findAll();

    /** Applies {@code fn} to the stored item; empty when no item has that id. */
    Optional<KnowledgeItem> update(String id, UnaryOperator<KnowledgeItem> fn);

    /** @return number of removed items */
    int removeIf(Predicate<KnowledgeItem> predicate);
}
