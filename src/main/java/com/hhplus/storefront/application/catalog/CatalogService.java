package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.domain.catalog.Category;
import com.hhplus.storefront.domain.catalog.CategoryNotFoundException;
import com.hhplus.storefront.domain.catalog.CategoryRepository;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.catalog.ProductSearchCondition;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * CatalogService - 카탈로그 조회 (Application 계층)
 *
 * 판매 중(is_active=true)인 상품만 노출한다.
 */
@Service
@Transactional(readOnly = true)
public class CatalogService {

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;

    public CatalogService(CategoryRepository categoryRepository,
                          ProductRepository productRepository) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
    }

    /**
     * 상품 목록 조회
     *
     * - 카테고리 슬러그가 주어지면 해당 카테고리 상품만 (존재하지 않으면 404)
     * - 검색어는 상품명 또는 설명에 대해 대소문자 무시 부분 일치
     * - 정렬: price_asc, price_desc, new, 그 외 등록순
     *
     * @throws CategoryNotFoundException 카테고리 슬러그가 존재하지 않음
     */
    public List<Product> listProducts(ProductSearchCondition condition) {
        Long categoryId = condition.categorySlug()
                .map(slug -> getCategory(slug).getCategoryId())
                .orElse(null);

        return productRepository.searchActive(
                categoryId,
                condition.searchText().orElse(null),
                condition.sortOrDefault());
    }

    /**
     * 상품 상세 조회 (판매 중인 상품만)
     *
     * @throws ProductNotFoundException 상품이 없거나 비활성
     */
    public Product getProductBySlug(String slug) {
        return productRepository.findBySlug(slug)
                .filter(Product::isAvailable)
                .orElseThrow(() -> new ProductNotFoundException(slug));
    }

    public Category getCategory(String slug) {
        return categoryRepository.findBySlug(slug)
                .orElseThrow(() -> new CategoryNotFoundException(slug));
    }

    /**
     * 이름순 카테고리 목록
     */
    public List<Category> listCategories() {
        return categoryRepository.findAllOrderByName();
    }
}
