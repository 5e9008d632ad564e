package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.catalog.Product;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * OrderItem 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 1 이상
 * - price는 주문 시점 상품 가격의 스냅샷 (이후 상품 가격 변경과 무관)
 * - 참조 중인 상품은 삭제할 수 없음 (FK restrict)
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false,
        foreignKey = @ForeignKey(name = "fk_order_items_order"))
    private Order order;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false,
        foreignKey = @ForeignKey(name = "fk_order_items_product"))
    private Product product;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    static OrderItem create(Order order, Product product, int quantity) {
        if (product == null) {
            throw new IllegalArgumentException("상품은 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        return OrderItem.builder()
                .order(order)
                .product(product)
                .quantity(quantity)
                .price(product.getPrice())
                .build();
    }

    /**
     * 소계 = 수량 × 스냅샷 가격
     */
    public BigDecimal getSubtotal() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
