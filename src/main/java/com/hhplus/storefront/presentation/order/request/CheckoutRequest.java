package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 요청 DTO (연락처/배송지)
 *
 * 필수값 검증은 장바구니 확인 이후 CheckoutValidator에서 수행한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    @JsonProperty("full_name")
    private String fullName;

    private String email;

    private String phone;

    private String address;

    private String city;

    private String state;

    private String pincode;
}
