package com.hhplus.storefront.domain.cart;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cart 값 객체 (세션 저장용)
 *
 * 방문자 세션 하나에 속하는 상품 ID → 수량 매핑.
 * 변경 연산은 항상 새로운 Cart를 반환한다.
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 항상 1 이상 (0 이하가 되면 항목 제거)
 * - 수량은 CartConstants.MAX_CART_QUANTITY를 넘을 수 없음
 * - 항목 순서는 처음 담은 순서를 유지
 * - 상품 존재 여부는 여기서 확인하지 않음 (CartService 책임)
 */
public final class Cart implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Cart EMPTY = new Cart(new LinkedHashMap<>());

    private final LinkedHashMap<Long, Integer> quantities;

    private Cart(LinkedHashMap<Long, Integer> quantities) {
        this.quantities = quantities;
    }

    public static Cart empty() {
        return EMPTY;
    }

    /**
     * 상품 1개 추가 (이미 담긴 상품이면 수량 +1)
     *
     * @throws InvalidQuantityException 최대 수량을 넘게 됨
     */
    public Cart add(Long productId) {
        requireProductId(productId);
        long quantity = (long) quantityOf(productId) + 1;
        if (quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        LinkedHashMap<Long, Integer> next = copy();
        next.put(productId, (int) quantity);
        return new Cart(next);
    }

    /**
     * 수량 지정
     * qty <= 0이면 항목을 제거하고, 그 외에는 정확히 qty로 설정한다.
     *
     * @throws InvalidQuantityException qty가 최대 수량을 넘음
     */
    public Cart setQuantity(Long productId, int quantity) {
        requireProductId(productId);
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            return remove(productId);
        }
        if (quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        LinkedHashMap<Long, Integer> next = copy();
        next.put(productId, quantity);
        return new Cart(next);
    }

    /**
     * 항목 제거 (없는 상품이면 그대로 반환)
     */
    public Cart remove(Long productId) {
        if (productId == null || !quantities.containsKey(productId)) {
            return this;
        }
        LinkedHashMap<Long, Integer> next = copy();
        next.remove(productId);
        return new Cart(next);
    }

    public int quantityOf(Long productId) {
        return quantities.getOrDefault(productId, 0);
    }

    public boolean contains(Long productId) {
        return quantities.containsKey(productId);
    }

    public boolean isEmpty() {
        return quantities.isEmpty();
    }

    /**
     * 담긴 수량의 합 (상품 존재 여부와 무관한 원시 합계)
     */
    public long count() {
        return quantities.values().stream().mapToLong(Integer::longValue).sum();
    }

    /**
     * 담은 순서대로의 읽기 전용 뷰
     */
    public Map<Long, Integer> asMap() {
        return Collections.unmodifiableMap(quantities);
    }

    private LinkedHashMap<Long, Integer> copy() {
        return new LinkedHashMap<>(quantities);
    }

    private static void requireProductId(Long productId) {
        if (productId == null) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cart other)) return false;
        return quantities.equals(other.quantities);
    }

    @Override
    public int hashCode() {
        return quantities.hashCode();
    }

    @Override
    public String toString() {
        return "Cart" + quantities;
    }
}
