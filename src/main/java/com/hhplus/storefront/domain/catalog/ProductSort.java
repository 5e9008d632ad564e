package com.hhplus.storefront.domain.catalog;

import java.util.Arrays;

/**
 * 상품 목록 정렬 기준
 *
 * - price_asc / price_desc: 가격순
 * - new: 최신 등록순
 * - 그 외(미지정 포함): 등록 순서(ID 오름차순)
 */
public enum ProductSort {
    DEFAULT(""),
    PRICE_ASC("price_asc"),
    PRICE_DESC("price_desc"),
    NEW("new");

    private final String parameter;

    ProductSort(String parameter) {
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    /**
     * 쿼리 파라미터 값을 정렬 기준으로 변환한다. 알 수 없는 값은 DEFAULT.
     */
    public static ProductSort from(String parameter) {
        if (parameter == null || parameter.isBlank()) {
            return DEFAULT;
        }
        return Arrays.stream(values())
                .filter(sort -> sort.parameter.equals(parameter.trim()))
                .findFirst()
                .orElse(DEFAULT);
    }
}
