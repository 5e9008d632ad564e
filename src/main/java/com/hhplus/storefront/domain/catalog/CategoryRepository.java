package com.hhplus.storefront.domain.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Category Repository Interface (Domain Layer - Port)
 */
public interface CategoryRepository {

    /**
     * 이름순 전체 카테고리 조회
     */
    List<Category> findAllOrderByName();

    Optional<Category> findBySlug(String slug);

    boolean existsBySlug(String slug);

    Category save(Category category);

    /**
     * 카테고리 삭제 (소속 상품은 DB에서 함께 삭제됨)
     */
    void delete(Category category);
}
