package com.ethnicthv.domain.repository;

import com.ethnicthv.domain.entity.Entity;
import com.ethnicthv.domain.specification.Specification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryTest {

    static final class Product extends Entity<Integer> {
        final String name;
        final int stock;

        Product(Integer id, String name, int stock) {
            super(id);
            this.name = name;
            this.stock = stock;
        }
    }

    static final class InMemoryProducts implements Repository<Product, Integer> {
        private final Map<Integer, Product> store = new LinkedHashMap<>();

        @Override
        public Optional<Product> findById(Integer id) {
            return Optional.ofNullable(store.get(id));
        }

        @Override
        public List<Product> findAll() {
            return new ArrayList<>(store.values());
        }

        @Override
        public List<Product> find(Specification<Product> specification) {
            return store.values().stream().filter(specification::isSatisfiedBy).collect(Collectors.toList());
        }

        @Override
        public void add(Product entity) {
            if (store.putIfAbsent(entity.getId(), entity) != null) {
                throw new IllegalArgumentException("Duplicate id " + entity.getId());
            }
        }

        @Override
        public void update(Product entity) {
            store.replace(entity.getId(), entity);
        }

        @Override
        public void remove(Product entity) {
            store.remove(entity.getId());
        }
    }

    private final Specification<Product> inStock = p -> p.stock > 0;
    private final Specification<Product> namedPen = Specification.of(p -> p.name.equals("pen"));

    private InMemoryProducts products;

    @BeforeEach
    void setUp() {
        products = new InMemoryProducts();
        products.addAll(List.of(new Product(1, "pen", 10), new Product(2, "ink", 0), new Product(3, "pad", 4)));
    }

    @Test
    @DisplayName("Specification queries filter, count and test for matches")
    void specificationQueries() {
        assertEquals(List.of(1, 3), ids(products.find(inStock)));
        assertEquals(2, products.count(inStock));
        assertTrue(products.any(inStock.not()));
        assertFalse(products.any(inStock.not().and(namedPen)));
        assertEquals(0, products.count(p -> p.stock > 100));
    }

    @Test
    @DisplayName("findSingle returns the lone match and rejects ambiguous ones")
    void findSingle() {
        assertEquals(Optional.of(1), products.findSingle(namedPen).map(Entity::getId));
        assertTrue(products.findSingle(p -> p.name.equals("cap")).isEmpty());
        assertThrows(IllegalStateException.class, () -> products.findSingle(inStock));
    }

    @Test
    @DisplayName("Bulk add and remove apply to every entity")
    void bulk() {
        products.removeAll(products.find(inStock.not()));
        assertEquals(List.of(1, 3), ids(products.findAll()));

        products.update(new Product(3, "pad", 0));
        assertEquals(0, products.findById(3).orElseThrow().stock);

        products.removeAll(null);
        products.addAll(null);
        assertEquals(2, products.findAll().size());
    }

    private static List<Integer> ids(List<Product> list) {
        return list.stream().map(Entity::getId).collect(Collectors.toList());
    }
}
