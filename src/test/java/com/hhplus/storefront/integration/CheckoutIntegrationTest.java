package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.catalog.CatalogAdminService;
import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.application.order.CheckoutService;
import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.common.exception.ValidationException;
import com.hhplus.storefront.config.AbstractIntegrationTest;
import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.order.ContactInfo;
import com.hhplus.storefront.domain.order.EmptyCartException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.infrastructure.persistence.order.OrderJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 결제 통합 테스트
 *
 * 검증 항목:
 * - 장바구니 → 주문 생성 → 재고 차감 흐름
 * - 판매 중지 상품 포함 시 전체 롤백
 * - 주문 항목 가격 스냅샷
 * - 빈 장바구니/연락처 누락 시 쓰기 없음
 */
@DisplayName("결제 통합 테스트")
class CheckoutIntegrationTest extends AbstractIntegrationTest {

    private static final Long USER_ID = 1001L;

    @Autowired
    private CatalogAdminService catalogAdminService;

    @Autowired
    private CartService cartService;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderJpaRepository orderJpaRepository;

    private String testId;

    @BeforeEach
    void setUp() {
        testId = UUID.randomUUID().toString().substring(0, 8);
        catalogAdminService.createCategory("Category " + testId, "cat-" + testId);
    }

    private Product createProduct(String name, String price, int stock) {
        return catalogAdminService.createProduct(CreateProductCommand.builder()
                .categorySlug("cat-" + testId)
                .name(name)
                .slug(name.toLowerCase().replace(' ', '-') + "-" + testId)
                .description(name + " description")
                .price(new BigDecimal(price))
                .stock(stock)
                .build());
    }

    private int stockOf(Long productId) {
        return productRepository.findById(productId).orElseThrow().getStock();
    }

    // ========== 정상 결제 ==========

    @Test
    @DisplayName("가격 10.00 재고 5 상품 2개 담고 결제 - 주문 항목(2, 10.00), 재고 3")
    void testCheckout_AddTwiceAndCheckout() {
        // Given
        Product product = createProduct("Notebook", "10.00", 5);
        Cart cart = cartService.add(Cart.empty(), product.getProductId());
        cart = cartService.add(cart, product.getProductId());

        // When
        Long orderId = checkoutService.checkout(USER_ID, TestDataFactory.createContact(), cart);

        // Then
        Order order = orderService.getOrder(USER_ID, orderId);
        assertTrue(order.isPaid());
        assertEquals(1, order.getOrderItems().size());
        OrderItem item = order.getOrderItems().get(0);
        assertEquals(2, item.getQuantity());
        assertEquals(0, new BigDecimal("10.00").compareTo(item.getPrice()));
        assertEquals(0, new BigDecimal("20.00").compareTo(order.getTotalAmount()));
        assertEquals(3, stockOf(product.getProductId()));
    }

    @Test
    @DisplayName("여러 상품 결제 - 담은 순서대로 주문 항목 생성, 각 재고 차감")
    void testCheckout_MultipleProducts() {
        // Given
        Product pen = createProduct("Pen", "1.50", 10);
        Product ink = createProduct("Ink", "4.25", 2);
        Cart cart = Cart.empty()
                .add(ink.getProductId())
                .add(pen.getProductId())
                .setQuantity(pen.getProductId(), 4);

        // When
        Long orderId = checkoutService.checkout(USER_ID, TestDataFactory.createContact(), cart);

        // Then
        Order order = orderService.getOrder(USER_ID, orderId);
        assertEquals(List.of(ink.getProductId(), pen.getProductId()),
                order.getOrderItems().stream().map(i -> i.getProduct().getProductId()).toList());
        assertEquals(0, new BigDecimal("10.25").compareTo(order.getTotalAmount()));
        assertEquals(1, stockOf(ink.getProductId()));
        assertEquals(6, stockOf(pen.getProductId()));
    }

    @Test
    @DisplayName("재고보다 많이 주문 - 재고는 0에서 멈춤")
    void testCheckout_StockFloorsAtZero() {
        Product product = createProduct("Mug", "7.00", 2);
        Cart cart = Cart.empty().setQuantity(product.getProductId(), 5);

        checkoutService.checkout(USER_ID, TestDataFactory.createContact(), cart);

        assertEquals(0, stockOf(product.getProductId()));
    }

    @Test
    @DisplayName("주문 후 가격 변경 - 주문 항목 가격은 그대로")
    void testCheckout_PriceSnapshot() {
        // Given
        Product product = createProduct("Lamp", "30.00", 5);
        Long orderId = checkoutService.checkout(USER_ID, TestDataFactory.createContact(),
                Cart.empty().add(product.getProductId()));

        // When
        catalogAdminService.changePrice(product.getProductId(), new BigDecimal("45.00"));

        // Then
        Order order = orderService.getOrder(USER_ID, orderId);
        assertEquals(0, new BigDecimal("30.00").compareTo(order.getOrderItems().get(0).getPrice()));
        List<CartLine> lines = cartService.items(Cart.empty().add(product.getProductId()));
        assertEquals(0, new BigDecimal("45.00").compareTo(lines.get(0).getSubtotal()));
    }

    // ========== 실패 시 쓰기 없음 ==========

    @Test
    @DisplayName("결제 전 판매 중지된 상품 - 404, 주문 저장 안 됨, 다른 상품 재고 유지")
    void testCheckout_DeactivatedProduct() {
        // Given
        Product kept = createProduct("Chair", "50.00", 5);
        Product removed = createProduct("Table", "80.00", 5);
        Cart cart = Cart.empty().add(kept.getProductId()).add(removed.getProductId());
        catalogAdminService.deactivate(removed.getProductId());
        long ordersBefore = orderJpaRepository.count();

        // When & Then
        assertThrows(ProductNotFoundException.class,
                () -> checkoutService.checkout(USER_ID, TestDataFactory.createContact(), cart));
        assertEquals(ordersBefore, orderJpaRepository.count());
        assertEquals(5, stockOf(kept.getProductId()));
        assertEquals(5, stockOf(removed.getProductId()));
    }

    @Test
    @DisplayName("빈 장바구니 결제 - EmptyCartException, 쓰기 없음")
    void testCheckout_EmptyCart() {
        long ordersBefore = orderJpaRepository.count();

        assertThrows(EmptyCartException.class,
                () -> checkoutService.checkout(USER_ID, TestDataFactory.createContact(), Cart.empty()));
        assertEquals(ordersBefore, orderJpaRepository.count());
    }

    @Test
    @DisplayName("연락처 누락 - ValidationException, 재고 유지")
    void testCheckout_MissingContact() {
        // Given
        Product product = createProduct("Desk", "120.00", 3);
        long ordersBefore = orderJpaRepository.count();

        // When
        ValidationException e = assertThrows(ValidationException.class,
                () -> checkoutService.checkout(USER_ID,
                        ContactInfo.builder()
                                .fullName("Kim Minsu")
                                .email("minsu@example.com")
                                .phone("010-1234-5678")
                                .address("1 Main St")
                                .city(" ")
                                .state("Seoul")
                                .pincode("04524")
                                .build(),
                        Cart.empty().add(product.getProductId())));

        // Then
        assertTrue(e.getErrors().contains("city: 필수 입력값입니다"));
        assertEquals(ordersBefore, orderJpaRepository.count());
        assertEquals(3, stockOf(product.getProductId()));
    }

    @Test
    @DisplayName("전화번호가 컬럼 길이를 넘으면 ValidationException, 주문 저장 안 됨")
    void testCheckout_PhoneTooLong() {
        // Given
        Product product = createProduct("Stool", "25.00", 4);
        long ordersBefore = orderJpaRepository.count();
        ContactInfo contact = ContactInfo.builder()
                .fullName("Kim Minsu")
                .email("minsu@example.com")
                .phone("+91 98765 43210 ext 12345")
                .address("1 Main St")
                .city("Seoul")
                .state("Seoul")
                .pincode("04524")
                .build();

        // When
        ValidationException e = assertThrows(ValidationException.class,
                () -> checkoutService.checkout(USER_ID, contact, Cart.empty().add(product.getProductId())));

        // Then
        assertEquals(List.of("phone: 20자 이하로 입력해주세요"), e.getErrors());
        assertEquals(ordersBefore, orderJpaRepository.count());
        assertEquals(4, stockOf(product.getProductId()));
    }

    // ========== 주문 조회 ==========

    @Test
    @DisplayName("다른 사용자의 주문 조회 - OrderNotFoundException")
    void testGetOrder_OtherUser() {
        Product product = createProduct("Cup", "3.00", 5);
        Long orderId = checkoutService.checkout(USER_ID, TestDataFactory.createContact(),
                Cart.empty().add(product.getProductId()));

        assertThrows(OrderNotFoundException.class, () -> orderService.getOrder(2002L, orderId));
    }
}
