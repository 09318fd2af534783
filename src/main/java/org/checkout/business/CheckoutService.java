package org.checkout.business;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.CartLine;
import org.checkout.domain.IdempotencyRecord;
import org.checkout.domain.Order;
import org.checkout.domain.OrderLineItem;
import org.checkout.domain.OrderStatus;
import org.checkout.exception.EmptyCartException;
import org.checkout.exception.IdempotencyConflictException;
import org.checkout.exception.TransientStoreException;
import org.checkout.exception.ValidationException;
import org.checkout.mq.OrderEventPublisher;
import org.checkout.service.ICartService;
import org.checkout.service.IIdempotencyRecordService;
import org.checkout.service.IOrderService;
import org.checkout.util.IdempotentUtil;
import org.checkout.util.TimeUtil;
import org.checkout.util.TraceIdUtil;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 结算编排服务
 * <p>
 * 购物车、订单、幂等记录分属不同存储，之间没有跨表事务。
 * 依靠"先写订单、再清购物车"的顺序和幂等键单写者占有来保证：
 * 1. 同一 (userId, token) 最多产生一个已完成订单
 * 2. 订单一旦完成，不会因为后续清理失败而丢失
 * 3. 清理失败留下的购物车行由对账任务补偿
 */
@Slf4j
@Service
public class CheckoutService {

    public static final String CHECKOUT_OPERATION = "CHECKOUT";
    public static final int MAX_TOKEN_LENGTH = 128;

    private static final String ORDER_ID_PREFIX = "ORD";
    private static final String AUTO_KEY_PREFIX = "auto:";

    private final ICartService cartService;
    private final IOrderService orderService;
    private final IIdempotencyRecordService idempotencyRecordService;
    private final OrderPricer orderPricer;
    private final IdempotentUtil idempotentUtil;
    private final OrderEventPublisher orderEventPublisher;
    private final Clock clock;

    public CheckoutService(ICartService cartService,
                           IOrderService orderService,
                           IIdempotencyRecordService idempotencyRecordService,
                           OrderPricer orderPricer,
                           IdempotentUtil idempotentUtil,
                           OrderEventPublisher orderEventPublisher,
                           Clock clock) {
        this.cartService = cartService;
        this.orderService = orderService;
        this.idempotencyRecordService = idempotencyRecordService;
        this.orderPricer = orderPricer;
        this.idempotentUtil = idempotentUtil;
        this.orderEventPublisher = orderEventPublisher;
        this.clock = clock;
    }

    /**
     * 结算
     * <p>
     * 业务流程：
     * 1. 幂等检查：token 已对应已完成订单则直接返回；对应 PENDING 订单则从写幂等记录处续完
     * 2. 快照读取购物车（空购物车直接失败，无任何副作用）
     * 3. 计价（商品不存在的行剔除）
     * 4. 写入 PENDING 订单
     * 5. 占有幂等记录
     * 6. 订单状态 PENDING → COMPLETED
     * 7. 逐行清理购物车（按读取到的行版本条件删除），单行失败不影响其他行，也不回滚订单
     *
     * @param userId           用户ID
     * @param idempotencyToken 幂等token，可为空
     * @return 订单ID与总额
     */
    public CheckoutResult checkout(String userId, String idempotencyToken) {
        if (!StringUtils.hasText(userId)) {
            throw new ValidationException("userId不能为空");
        }
        String token = normalizeToken(idempotencyToken);
        String traceId = TraceIdUtil.getTraceId();

        log.info("[结算开始] userId={}, token={}, traceId={}", userId, token, traceId);

        try {
            // ==================== 第1步：幂等检查 ====================
            if (token != null) {
                Optional<CheckoutResult> previous = resumeExisting(userId, token);
                if (previous.isPresent()) {
                    return previous.get();
                }
            }
            return placeOrder(userId, token, traceId);

        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            log.error("[结算存储异常] userId={}, token={}, error={}, traceId={}",
                    userId, token, e.getMessage(), traceId, e);
            throw new TransientStoreException("存储暂时不可用，请使用相同的幂等token重试", e);
        }
    }

    private Optional<CheckoutResult> resumeExisting(String userId, String token) {
        String recordKey = buildRecordKey(userId, token);

        String orderId = idempotentUtil.getOperatedValue(recordKey, CHECKOUT_OPERATION);
        if (orderId == null) {
            // 幂等记录可能尚未写入（崩溃发生在订单写入之后），此时按token重新推导orderId
            orderId = idempotencyRecordService.findRecord(recordKey)
                    .map(IdempotencyRecord::getOrderId)
                    .orElseGet(() -> deriveOrderId(userId, token));
        }

        Optional<Order> existing = orderService.findOrder(orderId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(continueExisting(existing.get(), recordKey));
    }

    private CheckoutResult continueExisting(Order order, String recordKey) {
        switch (order.getStatus()) {
            case COMPLETED:
                log.info("[幂等命中] 返回已完成订单, orderId={}, userId={}, total={}",
                        order.getOrderId(), order.getUserId(), order.getTotal());
                idempotentUtil.markAsOperated(recordKey, CHECKOUT_OPERATION, order.getOrderId());
                return toResult(order, true);
            case PENDING:
                log.warn("[续完未完成订单] orderId={}, userId={}", order.getOrderId(), order.getUserId());
                return completeOrder(order, recordKey, consumedLinesOf(order), true);
            default:
                log.warn("[幂等冲突] token对应的订单已失败, orderId={}, status={}",
                        order.getOrderId(), order.getStatus());
                throw new IdempotencyConflictException("幂等token对应的订单已失败, orderId=" + order.getOrderId());
        }
    }

    private CheckoutResult placeOrder(String userId, String token, String traceId) {
        // ==================== 第2步：快照读取购物车 ====================
        // snapshotAt 是订单创建时间的下限
        LocalDateTime snapshotAt = TimeUtil.now(clock);
        List<CartLine> lines = cartService.getLines(userId);
        if (lines.isEmpty() && token != null) {
            // 同一token的并发请求可能刚好完成并清空了购物车
            Optional<Order> concurrent = orderService.findOrder(deriveOrderId(userId, token));
            if (concurrent.isPresent()) {
                return continueExisting(concurrent.get(), buildRecordKey(userId, token));
            }
        }
        if (lines.isEmpty()) {
            log.warn("[结算失败] 购物车为空, userId={}", userId);
            throw new EmptyCartException("购物车为空");
        }

        // ==================== 第3步：计价 ====================
        PricedOrder priced = orderPricer.price(userId, lines);
        if (priced.isEmpty()) {
            log.warn("[结算失败] 购物车中的商品均已不存在, userId={}, dropped={}",
                    userId, priced.getDroppedProductIds());
            throw new EmptyCartException("购物车中没有可购买的商品");
        }

        // ==================== 第4步：写入 PENDING 订单 ====================
        // 时钟偏差或并发加购可能让读到的行晚于 snapshotAt，订单创建时间取二者较大值
        LocalDateTime createTime = latestUpdateTime(lines, snapshotAt);
        String orderId = token != null ? deriveOrderId(userId, token) : generateOrderId();
        String idempotencyKey = token != null ? token : AUTO_KEY_PREFIX + orderId;
        String recordKey = buildRecordKey(userId, idempotencyKey);

        Order order = Order.builder()
                .orderId(orderId)
                .userId(userId)
                .total(priced.getTotal())
                .status(OrderStatus.PENDING)
                .idempotencyKey(idempotencyKey)
                .traceId(traceId)
                .createTime(createTime)
                .updateTime(createTime)
                .droppedProductIds(priced.getDroppedProductIds())
                .lineItems(priced.getLineItems())
                .build();

        try {
            orderService.createPendingOrder(order);
        } catch (DuplicateKeyException e) {
            // 同一token的并发请求已先写入订单
            log.warn("[订单已被并发请求写入] orderId={}, userId={}", orderId, userId);
            Order winner = orderService.findOrder(orderId)
                    .orElseThrow(() -> new TransientStoreException("订单写入冲突但无法读取, orderId=" + orderId, e));
            return continueExisting(winner, recordKey);
        }

        // 每行以读到的修改时间为版本，之后被修改的行不会被清理
        Map<String, LocalDateTime> consumedLines = new LinkedHashMap<>();
        for (CartLine line : lines) {
            consumedLines.put(line.getProductId(), versionOf(line, createTime));
        }
        return completeOrder(order, recordKey, consumedLines, false);
    }

    /**
     * @param consumedLines 本单消耗的购物车行：productId -> 允许删除的最晚修改时间
     */
    private CheckoutResult completeOrder(Order order, String recordKey, Map<String, LocalDateTime> consumedLines,
                                         boolean replayed) {
        String orderId = order.getOrderId();

        // ==================== 第5步：占有幂等记录 ====================
        claimRecord(order, recordKey);

        // ==================== 第6步：PENDING → COMPLETED ====================
        if (!orderService.compareAndSetStatus(orderId, OrderStatus.PENDING, OrderStatus.COMPLETED)) {
            OrderStatus current = orderService.findOrder(orderId)
                    .map(Order::getStatus)
                    .orElse(null);
            if (current != OrderStatus.COMPLETED) {
                log.warn("[订单无法完成] orderId={}, currentStatus={}", orderId, current);
                throw new IdempotencyConflictException("订单状态[" + current + "]不允许完成, orderId=" + orderId);
            }
            log.info("[订单已由并发请求完成] orderId={}", orderId);
        }
        order.setStatus(OrderStatus.COMPLETED);
        log.info("[订单已完成] orderId={}, userId={}, total={}", orderId, order.getUserId(), order.getTotal());

        idempotentUtil.markAsOperated(recordKey, CHECKOUT_OPERATION, orderId);

        // ==================== 第7步：清理购物车 ====================
        clearConsumedLines(order.getUserId(), consumedLines);

        orderEventPublisher.publishOrderCompletedEvent(order, new ArrayList<>(consumedLines.keySet()));

        return toResult(order, replayed);
    }

    private void claimRecord(Order order, String recordKey) {
        IdempotencyRecord record = IdempotencyRecord.builder()
                .recordKey(recordKey)
                .userId(order.getUserId())
                .idempotencyKey(order.getIdempotencyKey())
                .orderId(order.getOrderId())
                .createTime(TimeUtil.now(clock))
                .build();

        if (idempotencyRecordService.claim(record)) {
            log.info("[幂等记录已写入] recordKey={}, orderId={}", recordKey, order.getOrderId());
            return;
        }

        String boundOrderId = idempotencyRecordService.findRecord(recordKey)
                .map(IdempotencyRecord::getOrderId)
                .orElse(null);
        if (!order.getOrderId().equals(boundOrderId)) {
            log.error("[幂等键已绑定其他订单] recordKey={}, orderId={}, boundOrderId={}",
                    recordKey, order.getOrderId(), boundOrderId);
            throw new IdempotencyConflictException("幂等token已绑定其他订单: " + boundOrderId);
        }
    }

    /**
     * 逐行清理，只删除读取之后没有被修改过的行
     */
    private void clearConsumedLines(String userId, Map<String, LocalDateTime> consumedLines) {
        int cleared = 0;
        int failed = 0;
        for (Map.Entry<String, LocalDateTime> entry : consumedLines.entrySet()) {
            String productId = entry.getKey();
            try {
                if (cartService.deleteLineIfNotModifiedAfter(userId, productId, entry.getValue())) {
                    cleared++;
                } else {
                    log.info("[购物车行已变更或不存在，保留] userId={}, productId={}", userId, productId);
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("[购物车行清理失败] 留给对账任务处理, userId={}, productId={}, error={}",
                        userId, productId, e.getMessage(), e);
            }
        }
        log.info("[购物车清理完成] userId={}, cleared={}, failed={}", userId, cleared, failed);
    }

    /**
     * 续完订单时已无法得知当初读到的行版本，以订单创建时间为统一截止时间
     */
    private static Map<String, LocalDateTime> consumedLinesOf(Order order) {
        Map<String, LocalDateTime> consumedLines = new LinkedHashMap<>();
        for (OrderLineItem item : order.getLineItems()) {
            consumedLines.put(item.getProductId(), order.getCreateTime());
        }
        if (order.getDroppedProductIds() != null) {
            for (String productId : order.getDroppedProductIds()) {
                consumedLines.put(productId, order.getCreateTime());
            }
        }
        return consumedLines;
    }

    private static LocalDateTime latestUpdateTime(List<CartLine> lines, LocalDateTime floor) {
        LocalDateTime latest = floor;
        for (CartLine line : lines) {
            LocalDateTime version = versionOf(line, floor);
            if (version.isAfter(latest)) {
                latest = version;
            }
        }
        return latest;
    }

    private static LocalDateTime versionOf(CartLine line, LocalDateTime fallback) {
        return line.getUpdateTime() != null ? line.getUpdateTime() : fallback;
    }

    private CheckoutResult toResult(Order order, boolean replayed) {
        return CheckoutResult.builder()
                .orderId(order.getOrderId())
                .total(order.getTotal())
                .replayed(replayed)
                .build();
    }

    private String normalizeToken(String idempotencyToken) {
        if (!StringUtils.hasText(idempotencyToken)) {
            return null;
        }
        String token = idempotencyToken.trim();
        if (token.length() > MAX_TOKEN_LENGTH) {
            throw new ValidationException("幂等token长度不能超过" + MAX_TOKEN_LENGTH);
        }
        return token;
    }

    static String buildRecordKey(String userId, String idempotencyKey) {
        return userId + ":" + idempotencyKey;
    }

    /**
     * 由 (userId, token) 推导订单ID，重试时可以得到同一个ID
     */
    static String deriveOrderId(String userId, String token) {
        UUID uuid = UUID.nameUUIDFromBytes(("checkout:" + userId + ":" + token).getBytes(StandardCharsets.UTF_8));
        return ORDER_ID_PREFIX + uuid.toString().replace("-", "");
    }

    static String generateOrderId() {
        return ORDER_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
