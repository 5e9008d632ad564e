package com.hhplus.storefront.application.order;

import com.hhplus.storefront.common.exception.ValidationException;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.order.ContactInfo;
import com.hhplus.storefront.domain.order.EmptyCartException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * CheckoutValidator - 결제 전 검증 전담
 *
 * 설계 원칙:
 * - 유효성 검증만 담당 (부수 효과 없음)
 * - 예외 발생으로 검증 실패 표현
 * - 트랜잭션 시작 전에 호출됨
 */
@Component
public class CheckoutValidator {

    /**
     * @throws EmptyCartException 장바구니가 비어 있음
     */
    public void validateCart(Cart cart) {
        if (cart == null || cart.isEmpty()) {
            throw new EmptyCartException();
        }
    }

    /**
     * @throws ValidationException 누락되거나 형식이 잘못된 연락처 항목 목록 포함
     */
    public void validateContact(ContactInfo contact) {
        if (contact == null) {
            throw new ValidationException("contact: 필수 입력값입니다");
        }
        List<String> errors = contact.validate();
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
