package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.catalog.CatalogAdminService;
import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.application.order.CheckoutService;
import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.infrastructure.persistence.order.OrderItemJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 동시 결제 테스트 - TestContainers MySQL
 *
 * 같은 상품을 여러 세션이 동시에 결제할 때 SELECT ... FOR UPDATE로 직렬화되어
 * 재고 차감이 유실되지 않는지 검증한다. Docker가 없으면 건너뛴다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("동시 결제 테스트 (MySQL)")
class ConcurrentCheckoutMySqlTest {

    @Container
    private static final MySQLContainer<?> MYSQL = new MySQLContainer<>(DockerImageName.parse("mysql:8.0.35"))
            .withDatabaseName("storefront_test")
            .withUsername("storefront")
            .withPassword("storefront");

    @DynamicPropertySource
    static void mysqlProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", MYSQL::getJdbcUrl);
        registry.add("spring.datasource.username", MYSQL::getUsername);
        registry.add("spring.datasource.password", MYSQL::getPassword);
        registry.add("spring.datasource.driver-class-name", MYSQL::getDriverClassName);
    }

    @Autowired
    private CatalogAdminService catalogAdminService;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderItemJpaRepository orderItemJpaRepository;

    private String testId;

    @BeforeEach
    void setUp() {
        testId = UUID.randomUUID().toString().substring(0, 8);
        catalogAdminService.createCategory("Concurrency " + testId, "con-" + testId);
    }

    private Product createProduct(String name, int stock) {
        return catalogAdminService.createProduct(CreateProductCommand.builder()
                .categorySlug("con-" + testId)
                .name(name)
                .slug(name.toLowerCase() + "-" + testId)
                .description(name)
                .price(new BigDecimal("10.00"))
                .stock(stock)
                .build());
    }

    private List<Throwable> runConcurrently(int threads, Cart cart) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        List<Throwable> failures = new ArrayList<>();
        AtomicInteger userSeq = new AtomicInteger(1);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    checkoutService.checkout((long) userSeq.getAndIncrement(), TestDataFactory.createContact(), cart);
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();
        return failures;
    }

    @Test
    @DisplayName("재고 20 + 동시 결제 10건(각 1개) - 재고 정확히 10")
    void testConcurrentCheckout_NoLostUpdate() throws InterruptedException {
        // Given
        Product product = createProduct("Ticket", 20);

        // When
        List<Throwable> failures = runConcurrently(10, Cart.empty().add(product.getProductId()));

        // Then
        assertTrue(failures.isEmpty(), () -> "failures: " + failures);
        assertEquals(10, productRepository.findById(product.getProductId()).orElseThrow().getStock());
        assertTrue(orderItemJpaRepository.existsByProduct_ProductId(product.getProductId()));
    }

    @Test
    @DisplayName("재고 5 + 동시 결제 10건 - 모두 주문 생성, 재고는 0에서 멈춤")
    void testConcurrentCheckout_StockFloorsAtZero() throws InterruptedException {
        Product product = createProduct("Badge", 5);

        List<Throwable> failures = runConcurrently(10, Cart.empty().add(product.getProductId()));

        assertTrue(failures.isEmpty(), () -> "failures: " + failures);
        assertEquals(0, productRepository.findById(product.getProductId()).orElseThrow().getStock());
    }

    @Test
    @DisplayName("두 상품을 서로 다른 순서로 담은 동시 결제 - 교착 없이 모두 반영")
    void testConcurrentCheckout_LockOrdering() throws InterruptedException {
        // Given
        Product a = createProduct("Alpha", 50);
        Product b = createProduct("Beta", 50);
        Cart ab = Cart.empty().add(a.getProductId()).add(b.getProductId());
        Cart ba = Cart.empty().add(b.getProductId()).add(a.getProductId());

        // When
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Throwable> failures = new ArrayList<>();
        List<Cart> carts = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            carts.add(i % 2 == 0 ? ab : ba);
        }
        CountDownLatch doneLatch = new CountDownLatch(carts.size());
        for (Cart cart : carts) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    checkoutService.checkout(1L, TestDataFactory.createContact(), cart);
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertTrue(failures.isEmpty(), () -> "failures: " + failures);
        assertEquals(40, productRepository.findById(a.getProductId()).orElseThrow().getStock());
        assertEquals(40, productRepository.findById(b.getProductId()).orElseThrow().getStock());
    }
}
