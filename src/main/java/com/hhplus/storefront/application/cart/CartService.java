package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CartService - Application 계층
 *
 * 세션 장바구니(Cart)에 대한 변경/조회 유스케이스.
 * Cart는 불변 값이므로 변경 메서드는 새 Cart를 반환하고, 저장은 호출하는 쪽(세션)이 담당한다.
 *
 * 아키텍처:
 * - Domain 계층의 ProductRepository 인터페이스에만 의존 (Port)
 */
@Service
@Transactional(readOnly = true)
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final ProductRepository productRepository;

    public CartService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * 상품 1개 담기
     *
     * @throws ProductNotFoundException 상품이 없거나 판매 중이 아님
     */
    public Cart add(Cart cart, Long productId) {
        Product product = productRepository.findById(productId)
                .filter(Product::isAvailable)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        Cart updated = cart.add(product.getProductId());
        log.info("[CartService] 장바구니 담기 - productId={}, quantity={}", productId, updated.quantityOf(productId));
        return updated;
    }

    /**
     * 수량 지정 (0 이하이면 항목 제거)
     */
    public Cart setQuantity(Cart cart, Long productId, int quantity) {
        return cart.setQuantity(productId, quantity);
    }

    /**
     * 항목 제거 (담겨 있지 않아도 오류 없음)
     */
    public Cart remove(Cart cart, Long productId) {
        return cart.remove(productId);
    }

    /**
     * 장바구니 항목 조회
     *
     * 담은 순서대로 현재 상품 정보와 소계를 계산한다.
     * 삭제되었거나 판매 중지된 상품 항목은 결과에서 제외된다.
     */
    public List<CartLine> items(Cart cart) {
        if (cart.isEmpty()) {
            return List.of();
        }

        Map<Long, Product> products = productRepository.findAllById(cart.asMap().keySet()).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        List<CartLine> lines = new ArrayList<>();
        cart.asMap().forEach((productId, quantity) -> {
            Product product = products.get(productId);
            if (product == null || !product.isAvailable()) {
                log.warn("[CartService] 구매할 수 없는 상품을 장바구니에서 제외 - productId={}, quantity={}",
                        productId, quantity);
                return;
            }
            lines.add(new CartLine(product, quantity));
        });
        return lines;
    }

    public CartView view(Cart cart) {
        return new CartView(items(cart));
    }

    public long totalQuantity(Cart cart) {
        return view(cart).getTotalQuantity();
    }

    public BigDecimal totalAmount(Cart cart) {
        return view(cart).getTotalAmount();
    }
}
