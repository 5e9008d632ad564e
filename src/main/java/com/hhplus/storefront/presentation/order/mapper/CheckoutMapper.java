package com.hhplus.storefront.presentation.order.mapper;

import com.hhplus.storefront.application.order.dto.CheckoutForm;
import com.hhplus.storefront.domain.order.ContactInfo;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.response.CheckoutFormResponse;
import org.springframework.stereotype.Component;

/**
 * CheckoutMapper - Presentation DTO와 Application/Domain 값 간 변환
 */
@Component
public class CheckoutMapper {

    /**
     * CheckoutRequest → ContactInfo (본문이 없으면 모든 항목 null)
     */
    public ContactInfo toContactInfo(CheckoutRequest request) {
        if (request == null) {
            return ContactInfo.builder().build();
        }
        return ContactInfo.builder()
                .fullName(request.getFullName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .address(request.getAddress())
                .city(request.getCity())
                .state(request.getState())
                .pincode(request.getPincode())
                .build();
    }

    public CheckoutFormResponse toCheckoutFormResponse(CheckoutForm form) {
        return CheckoutFormResponse.builder()
                .fullName(form.getFullName())
                .email(form.getEmail())
                .cartCount(form.getCartCount())
                .totalAmount(form.getTotalAmount())
                .build();
    }
}
