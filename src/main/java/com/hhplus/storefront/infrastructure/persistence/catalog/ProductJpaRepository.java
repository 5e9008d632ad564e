package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    /**
     * 판매 중인 상품 검색
     *
     * - categoryId, pattern이 null이면 해당 조건 무시
     * - pattern은 소문자로 변환되고 '!'로 이스케이프된 LIKE 패턴
     */
    @Query("SELECT p FROM Product p " +
           "WHERE p.active = true " +
           "AND (:categoryId IS NULL OR p.category.categoryId = :categoryId) " +
           "AND (:pattern IS NULL " +
           "     OR LOWER(p.name) LIKE :pattern ESCAPE '!' " +
           "     OR LOWER(p.description) LIKE :pattern ESCAPE '!')")
    List<Product> searchActive(@Param("categoryId") Long categoryId,
                               @Param("pattern") String pattern,
                               Sort sort);

    /**
     * 상품을 비관적 락으로 조회
     *
     * 동시성 제어:
     * - SELECT ... FOR UPDATE로 DB 레벨 exclusive lock 획득
     * - 같은 상품을 동시에 결제하면 순서대로 재고가 차감됨
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.productId = :productId")
    Optional<Product> findByIdForUpdate(@Param("productId") Long productId);

    Optional<Product> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<Product> findByCategory_CategoryId(Long categoryId);
}
