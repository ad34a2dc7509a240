package com.ethnicthv.domain.repository;

import com.ethnicthv.domain.entity.Entity;
import com.ethnicthv.domain.specification.Specification;

import java.util.List;
import java.util.Optional;

/**
 * Collection-like access to the entities of one type.
 *
 * @param <E>  the entity type
 * @param <ID> the identifier type
 */
public interface Repository<E extends Entity<ID>, ID> {

    Optional<E> findById(ID id);

    List<E> findAll();

    List<E> find(Specification<E> specification);

    /**
     * The single entity satisfying {@code specification}, if any.
     *
     * @throws IllegalStateException when more than one entity matches
     */
    default Optional<E> findSingle(Specification<E> specification) {
        List<E> matches = find(specification);
        if (matches.size() > 1) {
            throw new IllegalStateException("Expected at most one match but found " + matches.size());
        }
        return matches.stream().findFirst();
    }

    default int count(Specification<E> specification) {
        return find(specification).size();
    }

    default boolean any(Specification<E> specification) {
        return !find(specification).isEmpty();
    }

    void add(E entity);

    default void addAll(Iterable<? extends E> entities) {
        if (entities == null) return;
        for (E entity : entities) {
            add(entity);
        }
    }

    void update(E entity);

    void remove(E entity);

    default void removeAll(Iterable<? extends E> entities) {
        if (entities == null) return;
        for (E entity : entities) {
            remove(entity);
        }
    }
}
