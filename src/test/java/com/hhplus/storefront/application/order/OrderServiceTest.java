package com.hhplus.storefront.application.order;

import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderService 단위 테스트")
class OrderServiceTest {

    private InMemoryOrderRepository orderRepository;
    private OrderService orderService;
    private Order order;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        orderService = new OrderService(orderRepository);
        order = orderRepository.save(Order.place(1L, TestDataFactory.createContact()));
    }

    @Test
    @DisplayName("본인 주문 조회 성공")
    void testGetOrder_Owner() {
        assertSame(order, orderService.getOrder(1L, order.getOrderId()));
    }

    @Test
    @DisplayName("다른 사용자의 주문은 OrderNotFoundException")
    void testGetOrder_OtherUser() {
        assertThrows(OrderNotFoundException.class, () -> orderService.getOrder(2L, order.getOrderId()));
    }

    @Test
    @DisplayName("존재하지 않는 주문은 OrderNotFoundException")
    void testGetOrder_NotFound() {
        assertThrows(OrderNotFoundException.class, () -> orderService.getOrder(1L, 999L));
    }
}
