package com.hhplus.storefront.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 사용 예:
 * - if (quantity > CartConstants.MAX_CART_QUANTITY) throw new InvalidQuantityException(quantity);
 */
public class CartConstants {

    /** 장바구니 항목 최소 수량 (이보다 작으면 항목 제거) */
    public static final int MIN_CART_QUANTITY = 1;

    /** 장바구니 항목 최대 수량 */
    public static final int MAX_CART_QUANTITY = 1000;

    public static final String MSG_INVALID_QUANTITY_RANGE =
            String.format("수량은 %d 이상 %d 이하여야 합니다", MIN_CART_QUANTITY, MAX_CART_QUANTITY);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
