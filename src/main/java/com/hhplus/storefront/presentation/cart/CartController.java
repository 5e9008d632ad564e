package com.hhplus.storefront.presentation.cart;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.presentation.cart.request.UpdateCartRequest;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import com.hhplus.storefront.presentation.common.session.SessionCartStore;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 세션 장바구니 API 요청 처리
 *
 * 변경 요청은 모두 갱신된 장바구니를 응답한다.
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final SessionCartStore sessionCartStore;

    public CartController(CartService cartService, SessionCartStore sessionCartStore) {
        this.cartService = cartService;
        this.sessionCartStore = sessionCartStore;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(HttpSession session) {
        return ResponseEntity.ok(render(sessionCartStore.get(session)));
    }

    /**
     * POST /cart/add/{productId} - 상품 1개 담기
     */
    @PostMapping("/add/{productId}")
    public ResponseEntity<CartResponse> add(@PathVariable("productId") Long productId, HttpSession session) {
        Cart cart = sessionCartStore.update(session, current -> cartService.add(current, productId));
        return ResponseEntity.ok(render(cart));
    }

    /**
     * POST /cart/update/{productId} - 수량 지정 (0 이하이면 제거)
     */
    @PostMapping("/update/{productId}")
    public ResponseEntity<CartResponse> update(
            @PathVariable("productId") Long productId,
            @RequestBody(required = false) UpdateCartRequest request,
            HttpSession session) {
        int qty = request == null ? 1 : request.qtyOrDefault();
        Cart cart = sessionCartStore.update(session, current -> cartService.setQuantity(current, productId, qty));
        return ResponseEntity.ok(render(cart));
    }

    /**
     * POST /cart/remove/{productId} - 항목 제거
     */
    @PostMapping("/remove/{productId}")
    public ResponseEntity<CartResponse> remove(@PathVariable("productId") Long productId, HttpSession session) {
        Cart cart = sessionCartStore.update(session, current -> cartService.remove(current, productId));
        return ResponseEntity.ok(render(cart));
    }

    private CartResponse render(Cart cart) {
        return CartResponse.from(cartService.view(cart));
    }
}
