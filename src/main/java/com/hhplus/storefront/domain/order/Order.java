package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.catalog.Product;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문자 연락처/배송지 보관
 * - 주문 항목 관리 및 총액 계산
 *
 * 핵심 비즈니스 규칙:
 * - 주문은 항상 결제 완료(paid=true) 상태로 생성 (결제 대행 연동 없음)
 * - 총액은 저장하지 않고 항목(수량 × 스냅샷 가격)의 합으로 매번 계산
 * - 항목은 추가한 순서를 유지
 */
@Entity
@Table(name = "orders", indexes = @Index(name = "idx_orders_user", columnList = "user_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "full_name", nullable = false, length = ContactInfo.MAX_FULL_NAME_LENGTH)
    private String fullName;

    @Column(name = "email", nullable = false, length = ContactInfo.MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "phone", nullable = false, length = ContactInfo.MAX_PHONE_LENGTH)
    private String phone;

    @Column(name = "address", nullable = false, length = ContactInfo.MAX_ADDRESS_LENGTH)
    private String address;

    @Column(name = "city", nullable = false, length = ContactInfo.MAX_CITY_LENGTH)
    private String city;

    @Column(name = "state", nullable = false, length = ContactInfo.MAX_STATE_LENGTH)
    private String state;

    @Column(name = "pincode", nullable = false, length = ContactInfo.MAX_PINCODE_LENGTH)
    private String pincode;

    @Column(name = "paid", nullable = false)
    private boolean paid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 주문 항목 관계
     * 주문 저장 시 항목도 함께 저장된다.
     */
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * @param userId 주문한 사용자 ID (비회원 주문이면 null)
     * @param contact 검증이 끝난 연락처 정보
     */
    public static Order place(Long userId, ContactInfo contact) {
        Objects.requireNonNull(contact, "contact");
        return Order.builder()
                .userId(userId)
                .fullName(contact.getFullName())
                .email(contact.getEmail())
                .phone(contact.getPhone())
                .address(contact.getAddress())
                .city(contact.getCity())
                .state(contact.getState())
                .pincode(contact.getPincode())
                .paid(true)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 주문 항목 추가
     * 상품의 현재 가격을 스냅샷으로 기록한다.
     */
    public OrderItem addItem(Product product, int quantity) {
        OrderItem item = OrderItem.create(this, product, quantity);
        this.orderItems.add(item);
        return item;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    /**
     * 총 결제 금액 = Σ 수량 × 스냅샷 가격
     */
    public BigDecimal getTotalAmount() {
        return orderItems.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public long getTotalQuantity() {
        return orderItems.stream()
                .mapToLong(OrderItem::getQuantity)
                .sum();
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId != null && this.userId.equals(userId);
    }

    public ContactInfo getContact() {
        return ContactInfo.builder()
                .fullName(fullName)
                .email(email)
                .phone(phone)
                .address(address)
                .city(city)
                .state(state)
                .pincode(pincode)
                .build();
    }
}
