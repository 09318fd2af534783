package org.checkout;

import lombok.extern.slf4j.Slf4j;
import org.checkout.business.CheckoutResult;
import org.checkout.business.CheckoutService;
import org.checkout.domain.CartLine;
import org.checkout.domain.Order;
import org.checkout.domain.OrderStatus;
import org.checkout.service.ICartService;
import org.checkout.service.IOrderService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 基于真实 PostgreSQL 的结算集成测试（Redis/RabbitMQ 关闭）
 */
@Slf4j
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(properties = {
        "spring.autoconfigure.exclude="
                + "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration,"
                + "org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration,"
                + "org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration",
        "checkout.reconcile.initial-delay-ms=3600000"
})
class CheckoutPersistenceIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private ICartService cartService;

    @Autowired
    private IOrderService orderService;

    @Autowired
    private CheckoutService checkoutService;

    private static String newUser() {
        return "it-" + UUID.randomUUID();
    }

    @Test
    void checkoutPersistsOrderAndClearsCart() {
        String userId = newUser();
        cartService.putLine(userId, "p1", 2);
        cartService.putLine(userId, "p2", 1);

        CheckoutResult result = checkoutService.checkout(userId, "tok-1");

        assertThat(result.getTotal()).isEqualByComparingTo("25.00");
        assertThat(cartService.getLines(userId)).isEmpty();

        Order order = orderService.findOrder(result.getOrderId()).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getTotal().toPlainString()).isEqualTo("25.00");
        assertThat(order.getLineItems()).hasSize(2);

        CheckoutResult replay = checkoutService.checkout(userId, "tok-1");
        assertThat(replay.getOrderId()).isEqualTo(result.getOrderId());
        assertThat(replay.isReplayed()).isTrue();
    }

    @Test
    void droppedProductsAreStoredOnOrderAndClearedFromCart() {
        String userId = newUser();
        cartService.putLine(userId, "p1", 1);
        cartService.putLine(userId, "retired-product", 2);

        CheckoutResult result = checkoutService.checkout(userId, "tok-dropped");

        Order order = orderService.findOrder(result.getOrderId()).orElseThrow();
        assertThat(order.getTotal()).isEqualByComparingTo("10.00");
        assertThat(order.getDroppedProductIds()).containsExactly("retired-product");
        assertThat(cartService.getLines(userId)).isEmpty();
    }

    @Test
    void putLineUpsertsSingleRow() {
        String userId = newUser();
        cartService.putLine(userId, "p3", 1);
        CartLine updated = cartService.putLine(userId, "p3", 4);

        assertThat(updated.getQuantity()).isEqualTo(4);
        assertThat(cartService.getLines(userId)).singleElement()
                .extracting(CartLine::getQuantity).isEqualTo(4);
    }

    @Test
    void conditionalDeleteKeepsLinesEditedAfterCutoff() {
        String userId = newUser();
        CartLine line = cartService.putLine(userId, "p1", 1);

        boolean deleted = cartService.deleteLineIfNotModifiedAfter(userId, "p1",
                line.getUpdateTime().minusSeconds(1));

        assertThat(deleted).isFalse();
        assertThat(cartService.getLines(userId)).hasSize(1);
        assertThat(cartService.deleteLineIfNotModifiedAfter(userId, "p1", LocalDateTime.now().plusDays(1))).isTrue();
    }

    @Test
    void concurrentRetriesWithSameTokenCreateOneOrder() throws Exception {
        String userId = newUser();
        cartService.putLine(userId, "p4", 1);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<CheckoutResult>> calls = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                calls.add(() -> checkoutService.checkout(userId, "same-token"));
            }
            List<String> orderIds = new ArrayList<>();
            for (Future<CheckoutResult> future : executor.invokeAll(calls)) {
                orderIds.add(future.get().getOrderId());
            }
            log.info("并发结算 orderIds={}", orderIds);
            assertThat(orderIds).containsOnly(orderIds.get(0));
            assertThat(orderService.findOrder(orderIds.get(0)).orElseThrow().getStatus())
                    .isEqualTo(OrderStatus.COMPLETED);
        } finally {
            executor.shutdownNow();
        }
    }
}
