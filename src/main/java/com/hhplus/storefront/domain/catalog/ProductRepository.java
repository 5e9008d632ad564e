package com.hhplus.storefront.domain.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * 판매 중인 상품 검색
     *
     * @param categoryId 카테고리 ID (null이면 전체)
     * @param searchText 상품명/설명 부분 일치 검색어, 대소문자 무시 (null이면 전체)
     * @param sort 정렬 기준
     * @return 조건에 맞는 활성 상품 목록
     */
    List<Product> searchActive(Long categoryId, String searchText, ProductSort sort);

    Optional<Product> findById(Long productId);

    /**
     * ID 목록으로 상품 일괄 조회 (장바구니 화면용)
     */
    List<Product> findAllById(Iterable<Long> productIds);

    /**
     * 비관적 락을 사용하여 상품 조회
     * SELECT ... FOR UPDATE로 즉시 락 획득
     *
     * 용도: 결제 시 재고 차감 동시성 제어
     */
    Optional<Product> findByIdForUpdate(Long productId);

    Optional<Product> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<Product> findByCategoryId(Long categoryId);

    Product save(Product product);

    void delete(Product product);
}
