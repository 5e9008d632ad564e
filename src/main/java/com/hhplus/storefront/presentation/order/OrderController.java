package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.presentation.common.session.LoginSession;
import com.hhplus.storefront.presentation.order.response.OrderResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - Presentation 계층
 * 주문 완료 화면 조회 (본인 주문만)
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final LoginSession loginSession;

    public OrderController(OrderService orderService, LoginSession loginSession) {
        this.orderService = orderService;
        this.loginSession = loginSession;
    }

    /**
     * GET /orders/{orderId} - 주문 상세
     */
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("orderId") Long orderId, HttpSession session) {
        Long userId = loginSession.requireUserId(session);
        return ResponseEntity.ok(OrderResponse.from(orderService.getOrder(userId, orderId)));
    }
}
