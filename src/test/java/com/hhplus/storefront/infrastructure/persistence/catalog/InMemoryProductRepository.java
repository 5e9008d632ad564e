package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.catalog.ProductSort;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.StreamSupport;

/**
 * InMemory Product Repository (테스트용)
 * ConcurrentHashMap 기반, 잠금 조회는 일반 조회와 동일하게 동작한다.
 */
public class InMemoryProductRepository implements ProductRepository {

    private final Map<Long, Product> products = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(1000);
    private final List<Long> lockedIds = new ArrayList<>();

    @Override
    public List<Product> searchActive(Long categoryId, String searchText, ProductSort sort) {
        String text = searchText == null ? null : searchText.toLowerCase(Locale.ROOT);
        return products.values().stream()
                .filter(Product::isAvailable)
                .filter(p -> categoryId == null || categoryId.equals(p.getCategory().getCategoryId()))
                .filter(p -> text == null
                        || p.getName().toLowerCase(Locale.ROOT).contains(text)
                        || p.getDescription().toLowerCase(Locale.ROOT).contains(text))
                .sorted(comparator(sort))
                .toList();
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public List<Product> findAllById(Iterable<Long> productIds) {
        return StreamSupport.stream(productIds.spliterator(), false)
                .map(products::get)
                .filter(p -> p != null)
                .toList();
    }

    @Override
    public Optional<Product> findByIdForUpdate(Long productId) {
        synchronized (lockedIds) {
            lockedIds.add(productId);
        }
        return findById(productId);
    }

    @Override
    public Optional<Product> findBySlug(String slug) {
        return products.values().stream().filter(p -> p.getSlug().equals(slug)).findFirst();
    }

    @Override
    public boolean existsBySlug(String slug) {
        return findBySlug(slug).isPresent();
    }

    @Override
    public List<Product> findByCategoryId(Long categoryId) {
        return products.values().stream()
                .filter(p -> categoryId.equals(p.getCategory().getCategoryId()))
                .toList();
    }

    @Override
    public Product save(Product product) {
        if (product.getProductId() == null) {
            ReflectionTestUtils.setField(product, "productId", sequence.incrementAndGet());
        }
        products.put(product.getProductId(), product);
        return product;
    }

    @Override
    public void delete(Product product) {
        products.remove(product.getProductId());
    }

    /**
     * findByIdForUpdate 호출 순서 (잠금 순서 검증용)
     */
    public List<Long> getLockedIds() {
        synchronized (lockedIds) {
            return List.copyOf(lockedIds);
        }
    }

    private static Comparator<Product> comparator(ProductSort sort) {
        Comparator<Product> byId = Comparator.comparing(Product::getProductId);
        return switch (sort == null ? ProductSort.DEFAULT : sort) {
            case PRICE_ASC -> Comparator.comparing(Product::getPrice).thenComparing(byId);
            case PRICE_DESC -> Comparator.comparing(Product::getPrice).reversed().thenComparing(byId);
            case NEW -> Comparator.comparing(Product::getCreatedAt).reversed().thenComparing(byId.reversed());
            case DEFAULT -> byId;
        };
    }
}
