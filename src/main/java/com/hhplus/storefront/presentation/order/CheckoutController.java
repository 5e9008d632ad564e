package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.CheckoutService;
import com.hhplus.storefront.presentation.common.session.LoginSession;
import com.hhplus.storefront.presentation.common.session.SessionCartStore;
import com.hhplus.storefront.presentation.order.mapper.CheckoutMapper;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.response.CheckoutFormResponse;
import com.hhplus.storefront.presentation.order.response.CreateOrderResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.WebUtils;

/**
 * CheckoutController - Presentation 계층
 * 결제 API (로그인 필요)
 */
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CheckoutMapper checkoutMapper;
    private final SessionCartStore sessionCartStore;
    private final LoginSession loginSession;

    public CheckoutController(CheckoutService checkoutService,
                              CheckoutMapper checkoutMapper,
                              SessionCartStore sessionCartStore,
                              LoginSession loginSession) {
        this.checkoutService = checkoutService;
        this.checkoutMapper = checkoutMapper;
        this.sessionCartStore = sessionCartStore;
        this.loginSession = loginSession;
    }

    /**
     * GET /checkout - 결제 화면 초기값
     */
    @GetMapping
    public ResponseEntity<CheckoutFormResponse> getCheckoutForm(HttpSession session) {
        Long userId = loginSession.requireUserId(session);
        return ResponseEntity.ok(checkoutMapper.toCheckoutFormResponse(
                checkoutService.prepareCheckout(userId, sessionCartStore.get(session))));
    }

    /**
     * POST /checkout - 결제 실행
     * 성공 시 세션 장바구니를 비우고 201 Created로 주문 ID를 응답한다.
     */
    @PostMapping
    public ResponseEntity<CreateOrderResponse> checkout(
            @RequestBody(required = false) CheckoutRequest request,
            HttpSession session) {
        Long userId = loginSession.requireUserId(session);

        Long orderId;
        synchronized (WebUtils.getSessionMutex(session)) {
            orderId = checkoutService.checkout(userId, checkoutMapper.toContactInfo(request), sessionCartStore.get(session));
            sessionCartStore.clear(session);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreateOrderResponse.builder().orderId(orderId).build());
    }
}
