package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * OrderItem JPA Repository
 */
public interface OrderItemJpaRepository extends JpaRepository<OrderItem, Long> {

    boolean existsByProduct_ProductId(Long productId);
}
