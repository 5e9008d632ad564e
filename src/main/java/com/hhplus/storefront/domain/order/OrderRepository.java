package com.hhplus.storefront.domain.order;

import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 */
public interface OrderRepository {

    /**
     * 주문 저장 (항목은 함께 저장됨)
     */
    Order save(Order order);

    /**
     * 항목까지 함께 조회
     */
    Optional<Order> findById(Long orderId);

    /**
     * 해당 상품을 참조하는 주문 항목이 하나라도 있는지 여부
     */
    boolean existsItemByProductId(Long productId);
}
