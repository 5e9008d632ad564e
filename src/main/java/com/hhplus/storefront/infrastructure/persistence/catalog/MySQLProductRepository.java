package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.catalog.ProductSort;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private static final char LIKE_ESCAPE = '!';

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public List<Product> searchActive(Long categoryId, String searchText, ProductSort sort) {
        return productJpaRepository.searchActive(categoryId, toLikePattern(searchText), toSort(sort));
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<Product> findAllById(Iterable<Long> productIds) {
        return productJpaRepository.findAllById(productIds);
    }

    /**
     * 비관적 락을 사용하여 Product 조회
     *
     * 용도: 결제 시 재고 차감
     * 호출하는 쪽에서 트랜잭션이 열려 있어야 한다.
     */
    @Override
    public Optional<Product> findByIdForUpdate(Long productId) {
        return productJpaRepository.findByIdForUpdate(productId);
    }

    @Override
    public Optional<Product> findBySlug(String slug) {
        return productJpaRepository.findBySlug(slug);
    }

    @Override
    public boolean existsBySlug(String slug) {
        return productJpaRepository.existsBySlug(slug);
    }

    @Override
    public List<Product> findByCategoryId(Long categoryId) {
        return productJpaRepository.findByCategory_CategoryId(categoryId);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public void delete(Product product) {
        productJpaRepository.delete(product);
    }

    static Sort toSort(ProductSort sort) {
        return switch (sort == null ? ProductSort.DEFAULT : sort) {
            case PRICE_ASC -> Sort.by(Sort.Order.asc("price"), Sort.Order.asc("productId"));
            case PRICE_DESC -> Sort.by(Sort.Order.desc("price"), Sort.Order.asc("productId"));
            case NEW -> Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("productId"));
            case DEFAULT -> Sort.by(Sort.Order.asc("productId"));
        };
    }

    /**
     * 검색어를 LIKE 패턴으로 변환 (와일드카드 문자는 이스케이프)
     */
    static String toLikePattern(String searchText) {
        if (searchText == null || searchText.isEmpty()) {
            return null;
        }
        StringBuilder escaped = new StringBuilder("%");
        for (char c : searchText.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.append('%').toString();
    }
}
