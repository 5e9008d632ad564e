package com.hhplus.storefront.application.order;

import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.order.ContactInfo;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * OrderTransactionService - 주문 생성의 원자적 처리 (Application 계층)
 *
 * 역할:
 * - CheckoutService와 분리된 독립적인 서비스 (프록시를 통한 @Transactional/@Retryable 적용)
 * - 상품 재확인, 주문/주문 항목 저장, 재고 차감을 하나의 트랜잭션으로 처리
 *
 * 아키텍처:
 * CheckoutService (검증, 장바구니 비우기)
 *     ↓
 * OrderTransactionService (DB 트랜잭션)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    public OrderTransactionService(OrderRepository orderRepository,
                                   ProductRepository productRepository) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
    }

    /**
     * 주문 생성 (@Transactional + @Retryable)
     *
     * 처리 순서:
     * 1. 모든 상품을 ID 오름차순으로 비관적 락(SELECT ... FOR UPDATE) 조회
     *    - 하나라도 없거나 판매 중지면 ProductNotFoundException → 전체 롤백
     * 2. 주문 생성 (paid=true), 항목별 현재 가격 스냅샷 기록
     * 3. 재고 차감 (0 미만으로 내려가지 않음)
     *
     * 동시성 제어:
     * - 락 획득 순서를 ID 오름차순으로 고정하여 교착 상태 방지
     * - 락 획득 실패(PessimisticLockingFailureException) 시 최대 3회 시도
     * - backoff: delay=50ms, multiplier=2, maxDelay=1000ms, random=true
     * - 재시도 초과 시 마지막 예외가 그대로 전파됨
     *
     * @param userId 주문자 ID (nullable)
     * @param contact 검증이 끝난 연락처
     * @param quantities 상품 ID → 수량 (담은 순서)
     * @return 저장된 주문
     * @throws ProductNotFoundException 상품이 없거나 판매 중지
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class
    )
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public Order placeOrder(Long userId, ContactInfo contact, Map<Long, Integer> quantities) {
        Map<Long, Product> locked = new HashMap<>();
        for (Long productId : new TreeSet<>(quantities.keySet())) {
            Product product = productRepository.findByIdForUpdate(productId)
                    .filter(Product::isAvailable)
                    .orElseThrow(() -> new ProductNotFoundException(productId));
            locked.put(productId, product);
        }

        Order order = Order.place(userId, contact);
        quantities.forEach((productId, quantity) -> order.addItem(locked.get(productId), quantity));
        Order saved = orderRepository.save(order);

        quantities.forEach((productId, quantity) -> {
            Product product = locked.get(productId);
            int before = product.getStock();
            product.decreaseStock(quantity);
            productRepository.save(product);
            if (before < quantity) {
                log.warn("[OrderTransactionService] 재고 부족 상태로 판매 - productId={}, stock={}, quantity={}",
                        productId, before, quantity);
            }
        });

        log.info("[OrderTransactionService] 주문 저장 완료 - orderId={}, userId={}, items={}, totalAmount={}",
                saved.getOrderId(), userId, saved.getOrderItems().size(), saved.getTotalAmount());
        return saved;
    }
}
