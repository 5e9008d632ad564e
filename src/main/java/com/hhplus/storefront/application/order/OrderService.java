package com.hhplus.storefront.application.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * OrderService - 주문 조회 (Application 계층)
 */
@Service
@Transactional(readOnly = true)
public class OrderService {

    private final OrderRepository orderRepository;

    public OrderService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * 주문 완료 화면용 조회
     *
     * @throws OrderNotFoundException 주문이 없거나 본인 주문이 아님
     */
    public Order getOrder(Long userId, Long orderId) {
        return orderRepository.findById(orderId)
                .filter(order -> order.isOwnedBy(userId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
