package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.CartView;
import com.hhplus.storefront.application.order.dto.CheckoutForm;
import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.order.ContactInfo;
import com.hhplus.storefront.domain.order.EmptyCartException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.user.LoginRequiredException;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

/**
 * CheckoutService - 결제 유스케이스 (Application 계층)
 *
 * 처리 흐름:
 * 1단계: 검증 (빈 장바구니, 연락처 필수값) - 쓰기 없음
 * 2단계: OrderTransactionService에서 주문 생성과 재고 차감을 하나의 트랜잭션으로 처리
 * 3단계: 주문 ID 반환 (호출한 쪽에서 세션 장바구니를 비움)
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CheckoutValidator checkoutValidator;
    private final OrderTransactionService orderTransactionService;
    private final CartService cartService;
    private final UserRepository userRepository;

    public CheckoutService(CheckoutValidator checkoutValidator,
                           OrderTransactionService orderTransactionService,
                           CartService cartService,
                           UserRepository userRepository) {
        this.checkoutValidator = checkoutValidator;
        this.orderTransactionService = orderTransactionService;
        this.cartService = cartService;
        this.userRepository = userRepository;
    }

    /**
     * 결제 화면 초기값 조회
     *
     * @throws EmptyCartException 장바구니가 비어 있음
     * @throws LoginRequiredException 로그인 사용자를 찾을 수 없음
     */
    public CheckoutForm prepareCheckout(Long userId, Cart cart) {
        checkoutValidator.validateCart(cart);
        User user = userRepository.findById(userId)
                .orElseThrow(LoginRequiredException::new);

        CartView view = cartService.view(cart);
        return CheckoutForm.builder()
                .fullName(user.getUsername())
                .email(user.getEmail())
                .cartCount(cart.count())
                .totalAmount(view.getTotalAmount())
                .build();
    }

    /**
     * 결제 실행
     *
     * @param userId 주문자 ID
     * @param contact 연락처/배송지
     * @param cart 세션 장바구니
     * @return 생성된 주문 ID
     * @throws EmptyCartException 장바구니가 비어 있음
     * @throws com.hhplus.storefront.common.exception.ValidationException 연락처 필수값 누락
     * @throws com.hhplus.storefront.domain.catalog.ProductNotFoundException 상품이 없거나 판매 중지 (주문 생성되지 않음)
     * @throws ApplicationException 재시도 후에도 상품 행 잠금 획득 실패
     */
    public Long checkout(Long userId, ContactInfo contact, Cart cart) {
        checkoutValidator.validateCart(cart);
        checkoutValidator.validateContact(contact);

        log.info("[CheckoutService] 결제 시작 - userId={}, cart={}", userId, cart.asMap());
        try {
            Order order = orderTransactionService.placeOrder(userId, contact.trimmed(), cart.asMap());
            log.info("[CheckoutService] 결제 완료 - userId={}, orderId={}", userId, order.getOrderId());
            return order.getOrderId();
        } catch (PessimisticLockingFailureException e) {
            log.error("[CheckoutService] 상품 잠금 재시도 초과 - userId={}", userId, e);
            throw new ApplicationException(ErrorCode.CHECKOUT_LOCK_FAILED, e);
        }
    }
}
