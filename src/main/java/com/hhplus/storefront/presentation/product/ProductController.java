package com.hhplus.storefront.presentation.product;

import com.hhplus.storefront.application.catalog.CatalogService;
import com.hhplus.storefront.domain.catalog.ProductSearchCondition;
import com.hhplus.storefront.domain.catalog.ProductSort;
import com.hhplus.storefront.presentation.common.session.SessionCartStore;
import com.hhplus.storefront.presentation.product.response.CategoryResponse;
import com.hhplus.storefront.presentation.product.response.ProductListResponse;
import com.hhplus.storefront.presentation.product.response.ProductResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * ProductController - Presentation 계층
 * 카탈로그 조회 API
 */
@RestController
public class ProductController {

    private final CatalogService catalogService;
    private final SessionCartStore sessionCartStore;

    public ProductController(CatalogService catalogService, SessionCartStore sessionCartStore) {
        this.catalogService = catalogService;
        this.sessionCartStore = sessionCartStore;
    }

    /**
     * GET /products?q=&sort= - 전체 상품 목록
     */
    @GetMapping("/products")
    public ResponseEntity<ProductListResponse> getProducts(
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "sort", required = false) String sort,
            HttpSession session) {
        return ResponseEntity.ok(buildList(null, query, sort, session));
    }

    /**
     * GET /categories/{slug}/products?q=&sort= - 카테고리별 상품 목록
     */
    @GetMapping("/categories/{slug}/products")
    public ResponseEntity<ProductListResponse> getCategoryProducts(
            @PathVariable("slug") String categorySlug,
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "sort", required = false) String sort,
            HttpSession session) {
        return ResponseEntity.ok(buildList(categorySlug, query, sort, session));
    }

    /**
     * GET /products/{slug} - 상품 상세
     */
    @GetMapping("/products/{slug}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("slug") String slug) {
        return ResponseEntity.ok(ProductResponse.from(catalogService.getProductBySlug(slug)));
    }

    private ProductListResponse buildList(String categorySlug, String query, String sort, HttpSession session) {
        ProductSort productSort = ProductSort.from(sort);
        ProductSearchCondition condition = ProductSearchCondition.builder()
                .categorySlug(categorySlug)
                .searchText(query)
                .sort(productSort)
                .build();

        var products = catalogService.listProducts(condition).stream()
                .map(ProductResponse::from)
                .toList();

        return ProductListResponse.builder()
                .category(categorySlug == null ? null : CategoryResponse.from(catalogService.getCategory(categorySlug)))
                .categories(catalogService.listCategories().stream().map(CategoryResponse::from).toList())
                .products(products)
                .query(query == null ? "" : query)
                .sort(productSort.getParameter())
                .cartCount(sessionCartStore.get(session).count())
                .build();
    }
}
