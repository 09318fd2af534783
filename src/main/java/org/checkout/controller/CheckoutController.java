package org.checkout.controller;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.checkout.business.CheckoutResult;
import org.checkout.business.CheckoutService;
import org.checkout.util.ResponseUtil;
import org.checkout.util.TraceIdUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 结算控制器
 *
 * 职责：
 * 1. 解析当前用户与幂等token
 * 2. 调用结算编排服务
 * 3. 返回订单ID与总额
 *
 * 不负责的事情：
 * - orderId生成、计价、购物车清理（由 CheckoutService 负责）
 * - 异常到HTTP状态码的映射（由 GlobalExceptionHandler 负责）
 *
 * API：
 * - POST /checkout - 结算当前购物车
 */
@Slf4j
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    public static final String IDEMPOTENCY_TOKEN_HEADER = "Idempotency-Token";

    private final CheckoutService checkoutService;
    private final String defaultUserId;

    public CheckoutController(CheckoutService checkoutService,
                              @Value("${checkout.default-user-id:demo-user}") String defaultUserId) {
        this.checkoutService = checkoutService;
        this.defaultUserId = defaultUserId;
    }

    /**
     * 结算
     *
     * 业务流程：
     * 1. 解析用户：X-User-Id 请求头，缺省为配置的默认用户
     * 2. 解析幂等token：Idempotency-Token 请求头优先，其次为请求体 idempotencyToken
     * 3. 调用业务层结算
     * 4. 返回订单信息（重放时 replayed=true）
     *
     * 请求体（可选）：
     * {
     *     "idempotencyToken": "c0ffee-01"
     * }
     *
     * 响应：
     * {
     *     "code": "SUCCESS",
     *     "message": "下单成功",
     *     "data": {
     *         "orderId": "ORD3f0c...",
     *         "total": "25.00",
     *         "replayed": false
     *     },
     *     "traceId": "abc123..."
     * }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> checkout(
            @RequestHeader(value = UserContext.USER_ID_HEADER, required = false) String userHeader,
            @RequestHeader(value = IDEMPOTENCY_TOKEN_HEADER, required = false) String tokenHeader,
            @RequestBody(required = false) CheckoutRequest request) {

        // ==================== 1. 解析用户与幂等token ====================
        String userId = UserContext.resolve(userHeader, defaultUserId);
        String token = StringUtils.hasText(tokenHeader)
                ? tokenHeader
                : (request != null ? request.getIdempotencyToken() : null);

        log.info("[结算请求] userId={}, hasToken={}, traceId={}",
                userId, StringUtils.hasText(token), TraceIdUtil.getTraceId());

        // ==================== 2. 调用业务层 ====================
        CheckoutResult result = checkoutService.checkout(userId, token);

        // ==================== 3. 返回结果 ====================
        return ResponseEntity.ok(ResponseUtil.success(result.isReplayed() ? "订单已存在" : "下单成功", result));
    }

    @Data
    public static class CheckoutRequest {
        private String idempotencyToken;
    }
}
