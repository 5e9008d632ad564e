package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.Category;
import com.hhplus.storefront.domain.catalog.CategoryRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Category Repository 구현
 */
@Repository
@Primary
public class MySQLCategoryRepository implements CategoryRepository {

    private final CategoryJpaRepository categoryJpaRepository;

    public MySQLCategoryRepository(CategoryJpaRepository categoryJpaRepository) {
        this.categoryJpaRepository = categoryJpaRepository;
    }

    @Override
    public List<Category> findAllOrderByName() {
        return categoryJpaRepository.findAllByOrderByNameAsc();
    }

    @Override
    public Optional<Category> findBySlug(String slug) {
        return categoryJpaRepository.findBySlug(slug);
    }

    @Override
    public boolean existsBySlug(String slug) {
        return categoryJpaRepository.existsBySlug(slug);
    }

    @Override
    public Category save(Category category) {
        return categoryJpaRepository.save(category);
    }

    @Override
    public void delete(Category category) {
        categoryJpaRepository.delete(category);
    }
}
