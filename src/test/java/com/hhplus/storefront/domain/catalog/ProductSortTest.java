package com.hhplus.storefront.domain.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ProductSort 파라미터 변환 테스트")
class ProductSortTest {

    @Test
    @DisplayName("알려진 파라미터는 해당 정렬로 변환")
    void testFrom_Known() {
        assertEquals(ProductSort.PRICE_ASC, ProductSort.from("price_asc"));
        assertEquals(ProductSort.PRICE_DESC, ProductSort.from("price_desc"));
        assertEquals(ProductSort.NEW, ProductSort.from(" new "));
    }

    @Test
    @DisplayName("없거나 알 수 없는 값은 DEFAULT")
    void testFrom_Unknown() {
        assertEquals(ProductSort.DEFAULT, ProductSort.from(null));
        assertEquals(ProductSort.DEFAULT, ProductSort.from(""));
        assertEquals(ProductSort.DEFAULT, ProductSort.from("cheapest"));
        assertEquals(ProductSort.DEFAULT, ProductSort.from("PRICE_ASC"));
    }
}
