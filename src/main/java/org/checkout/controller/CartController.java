package org.checkout.controller;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.CartLine;
import org.checkout.exception.InvalidQuantityException;
import org.checkout.exception.ValidationException;
import org.checkout.service.ICartService;
import org.checkout.util.ResponseUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 购物车控制器
 *
 * 购物车没有独立实体，就是当前用户的全部购物车行
 *
 * API：
 * - GET /cart - 查询购物车
 * - POST /cart - 加购/修改数量
 * - DELETE /cart/{productId} - 删除一行（行不存在也返回成功）
 */
@Slf4j
@RestController
@RequestMapping("/cart")
public class CartController {

    private final ICartService cartService;
    private final String defaultUserId;

    public CartController(ICartService cartService,
                          @Value("${checkout.default-user-id:demo-user}") String defaultUserId) {
        this.cartService = cartService;
        this.defaultUserId = defaultUserId;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getCart(
            @RequestHeader(value = UserContext.USER_ID_HEADER, required = false) String userHeader) {
        String userId = UserContext.resolve(userHeader, defaultUserId);
        List<CartLine> lines = cartService.getLines(userId);
        return ResponseEntity.ok(ResponseUtil.success("查询成功", lines));
    }

    /**
     * 加购/修改数量
     *
     * 业务流程：
     * 1. 参数验证：productId 非空，quantity 为 >= 1 的整数
     * 2. 按 (userId, productId) 写入或覆盖
     *
     * 请求体：
     * {
     *     "productId": "p1",
     *     "quantity": 2
     * }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> putLine(
            @RequestHeader(value = UserContext.USER_ID_HEADER, required = false) String userHeader,
            @RequestBody(required = false) PutLineRequest request) {

        // ==================== 1. 参数验证 ====================
        if (request == null || !StringUtils.hasText(request.getProductId())) {
            throw new ValidationException("productId不能为空");
        }
        if (request.getQuantity() == null || request.getQuantity() < 1) {
            throw new InvalidQuantityException(request.getQuantity());
        }

        // ==================== 2. 写入购物车 ====================
        String userId = UserContext.resolve(userHeader, defaultUserId);
        CartLine line = cartService.putLine(userId, request.getProductId().trim(), request.getQuantity());
        return ResponseEntity.ok(ResponseUtil.success("已加入购物车", line));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Map<String, Object>> deleteLine(
            @RequestHeader(value = UserContext.USER_ID_HEADER, required = false) String userHeader,
            @PathVariable String productId) {
        String userId = UserContext.resolve(userHeader, defaultUserId);
        cartService.deleteLine(userId, productId);
        return ResponseEntity.ok(ResponseUtil.success("已删除", null));
    }

    @Data
    public static class PutLineRequest {
        private String productId;
        private Integer quantity;
    }
}
