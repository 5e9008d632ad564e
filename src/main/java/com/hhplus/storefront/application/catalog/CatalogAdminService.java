package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.domain.catalog.Category;
import com.hhplus.storefront.domain.catalog.CategoryNotFoundException;
import com.hhplus.storefront.domain.catalog.CategoryRepository;
import com.hhplus.storefront.domain.catalog.DuplicateSlugException;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductInUseException;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * CatalogAdminService - 카탈로그 관리 (Application 계층)
 *
 * 책임:
 * - 카테고리/상품 등록
 * - 가격 변경, 판매 상태 변경, 재고 입고
 * - 삭제 규칙 적용
 *   - 주문 항목이 참조 중인 상품은 삭제 불가 (ProductInUseException)
 *   - 카테고리 삭제 시 소속 상품도 삭제되며, 그중 하나라도 주문 이력이 있으면 전체 거부
 */
@Service
public class CatalogAdminService {

    private static final Logger log = LoggerFactory.getLogger(CatalogAdminService.class);

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;

    public CatalogAdminService(CategoryRepository categoryRepository,
                               ProductRepository productRepository,
                               OrderRepository orderRepository) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
    }

    @Transactional(rollbackFor = Exception.class)
    public Category createCategory(String name, String slug) {
        Category category = Category.create(name, slug);
        if (categoryRepository.existsBySlug(category.getSlug())) {
            throw new DuplicateSlugException(category.getSlug());
        }
        Category saved = categoryRepository.save(category);
        log.info("[CatalogAdminService] 카테고리 등록 - categoryId={}, slug={}", saved.getCategoryId(), saved.getSlug());
        return saved;
    }

    /**
     * 상품 등록
     *
     * @throws CategoryNotFoundException 카테고리 슬러그가 존재하지 않음
     * @throws DuplicateSlugException 상품 슬러그 중복
     */
    @Transactional(rollbackFor = Exception.class)
    public Product createProduct(CreateProductCommand command) {
        Category category = categoryRepository.findBySlug(command.getCategorySlug())
                .orElseThrow(() -> new CategoryNotFoundException(command.getCategorySlug()));

        Product product = Product.create(category, command.getName(), command.getSlug(),
                command.getDescription(), command.getPrice(), command.getStock());
        if (productRepository.existsBySlug(product.getSlug())) {
            throw new DuplicateSlugException(product.getSlug());
        }

        Product saved = productRepository.save(product);
        log.info("[CatalogAdminService] 상품 등록 - productId={}, slug={}, price={}, stock={}",
                saved.getProductId(), saved.getSlug(), saved.getPrice(), saved.getStock());
        return saved;
    }

    @Transactional(rollbackFor = Exception.class)
    public Product changePrice(Long productId, BigDecimal newPrice) {
        Product product = getProduct(productId);
        BigDecimal before = product.getPrice();
        product.changePrice(newPrice);
        log.info("[CatalogAdminService] 가격 변경 - productId={}, {} -> {}", productId, before, newPrice);
        return productRepository.save(product);
    }

    @Transactional(rollbackFor = Exception.class)
    public Product deactivate(Long productId) {
        Product product = getProduct(productId);
        product.deactivate();
        log.info("[CatalogAdminService] 판매 중지 - productId={}", productId);
        return productRepository.save(product);
    }

    @Transactional(rollbackFor = Exception.class)
    public Product activate(Long productId) {
        Product product = getProduct(productId);
        product.activate();
        log.info("[CatalogAdminService] 판매 재개 - productId={}", productId);
        return productRepository.save(product);
    }

    @Transactional(rollbackFor = Exception.class)
    public Product restock(Long productId, int quantity) {
        Product product = getProduct(productId);
        product.restock(quantity);
        log.info("[CatalogAdminService] 재고 입고 - productId={}, quantity={}, stock={}",
                productId, quantity, product.getStock());
        return productRepository.save(product);
    }

    /**
     * 상품 삭제
     *
     * @throws ProductInUseException 주문 항목이 참조 중
     */
    @Transactional(rollbackFor = Exception.class)
    public void deleteProduct(Long productId) {
        Product product = getProduct(productId);
        if (orderRepository.existsItemByProductId(productId)) {
            throw new ProductInUseException(productId);
        }
        productRepository.delete(product);
        log.info("[CatalogAdminService] 상품 삭제 - productId={}", productId);
    }

    /**
     * 카테고리 삭제 (소속 상품 포함)
     *
     * @throws ProductInUseException 소속 상품 중 하나라도 주문 항목이 참조 중
     */
    @Transactional(rollbackFor = Exception.class)
    public void deleteCategory(String slug) {
        Category category = categoryRepository.findBySlug(slug)
                .orElseThrow(() -> new CategoryNotFoundException(slug));

        List<Product> products = productRepository.findByCategoryId(category.getCategoryId());
        for (Product product : products) {
            if (orderRepository.existsItemByProductId(product.getProductId())) {
                throw new ProductInUseException(product.getProductId());
            }
        }

        products.forEach(productRepository::delete);
        categoryRepository.delete(category);
        log.info("[CatalogAdminService] 카테고리 삭제 - slug={}, 삭제된 상품 수={}", slug, products.size());
    }

    private Product getProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
