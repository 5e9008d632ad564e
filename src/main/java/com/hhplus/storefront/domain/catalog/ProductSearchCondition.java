package com.hhplus.storefront.domain.catalog;

import lombok.Builder;
import lombok.Getter;

import java.util.Optional;

/**
 * 상품 목록 조회 조건
 * 카테고리 슬러그, 검색어, 정렬 기준은 모두 선택값이다.
 * 검색어는 공백을 포함해 입력 그대로 부분 일치에 사용한다.
 */
@Getter
@Builder
public class ProductSearchCondition {
    private final String categorySlug;
    private final String searchText;
    private final ProductSort sort;

    public Optional<String> categorySlug() {
        return blankToEmpty(categorySlug);
    }

    public Optional<String> searchText() {
        return searchText == null || searchText.isEmpty() ? Optional.empty() : Optional.of(searchText);
    }

    public ProductSort sortOrDefault() {
        return sort == null ? ProductSort.DEFAULT : sort;
    }

    private static Optional<String> blankToEmpty(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
