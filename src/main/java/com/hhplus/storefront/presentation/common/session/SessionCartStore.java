package com.hhplus.storefront.presentation.common.session;

import com.hhplus.storefront.domain.cart.Cart;
import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import java.util.function.UnaryOperator;

/**
 * HttpSession 기반 장바구니 저장소
 *
 * 세션 속성 "cart"에 불변 Cart 값을 보관한다.
 * 읽기-변경-쓰기는 세션 뮤텍스로 직렬화되어 같은 세션의 동시 요청이 서로의 변경을 덮어쓰지 않는다.
 */
@Component
public class SessionCartStore {

    public static final String CART_ATTRIBUTE = "cart";

    public Cart get(HttpSession session) {
        Object value = session.getAttribute(CART_ATTRIBUTE);
        return value instanceof Cart cart ? cart : Cart.empty();
    }

    /**
     * 장바구니 변경
     * 변경 함수가 예외를 던지면 세션은 그대로 유지된다.
     */
    public Cart update(HttpSession session, UnaryOperator<Cart> mutation) {
        synchronized (WebUtils.getSessionMutex(session)) {
            Cart updated = mutation.apply(get(session));
            session.setAttribute(CART_ATTRIBUTE, updated);
            return updated;
        }
    }

    public void clear(HttpSession session) {
        synchronized (WebUtils.getSessionMutex(session)) {
            session.setAttribute(CART_ATTRIBUTE, Cart.empty());
        }
    }
}
