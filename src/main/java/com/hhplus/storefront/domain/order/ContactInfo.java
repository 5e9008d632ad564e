package com.hhplus.storefront.domain.order;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 주문자 연락처/배송지 정보
 *
 * 일곱 개 항목 모두 필수이며, 이메일은 주소 형식이어야 한다.
 * 최대 길이는 orders 테이블 컬럼 길이와 같다.
 */
@Getter
@Builder
public class ContactInfo {

    public static final int MAX_FULL_NAME_LENGTH = 120;
    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_PHONE_LENGTH = 20;
    public static final int MAX_ADDRESS_LENGTH = 500;
    public static final int MAX_CITY_LENGTH = 80;
    public static final int MAX_STATE_LENGTH = 80;
    public static final int MAX_PINCODE_LENGTH = 12;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final String fullName;
    private final String email;
    private final String phone;
    private final String address;
    private final String city;
    private final String state;
    private final String pincode;

    /**
     * 검증 오류 목록 (비어 있으면 유효)
     * 오류는 필드 선언 순서대로 반환된다.
     */
    public List<String> validate() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("full_name", fullName);
        fields.put("email", email);
        fields.put("phone", phone);
        fields.put("address", address);
        fields.put("city", city);
        fields.put("state", state);
        fields.put("pincode", pincode);

        Map<String, Integer> maxLengths = Map.of(
                "full_name", MAX_FULL_NAME_LENGTH,
                "email", MAX_EMAIL_LENGTH,
                "phone", MAX_PHONE_LENGTH,
                "address", MAX_ADDRESS_LENGTH,
                "city", MAX_CITY_LENGTH,
                "state", MAX_STATE_LENGTH,
                "pincode", MAX_PINCODE_LENGTH);

        List<String> errors = new ArrayList<>();
        fields.forEach((field, value) -> {
            if (value == null || value.isBlank()) {
                errors.add(field + ": 필수 입력값입니다");
            } else if (value.trim().length() > maxLengths.get(field)) {
                errors.add(field + ": " + maxLengths.get(field) + "자 이하로 입력해주세요");
            }
        });
        if (email != null && !email.isBlank() && !EMAIL_PATTERN.matcher(email.trim()).matches()) {
            errors.add("email: 올바른 이메일 형식이 아닙니다");
        }
        return errors;
    }

    /**
     * 앞뒤 공백을 제거한 사본
     */
    public ContactInfo trimmed() {
        return ContactInfo.builder()
                .fullName(trim(fullName))
                .email(trim(email))
                .phone(trim(phone))
                .address(trim(address))
                .city(trim(city))
                .state(trim(state))
                .pincode(trim(pincode))
                .build();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
