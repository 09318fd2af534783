package org.checkout.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * 订单完成事件
 * - 订单翻转为 COMPLETED 后发布
 * - 消费方据此清理对应的购物车行（结算清理失败时的异步补救）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderCompletedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 消息ID（消费幂等）
     */
    private String messageId;

    private String orderId;

    private String userId;

    /**
     * 订单总额，字符串形式避免浮点
     */
    private String total;

    /**
     * 本次结算消耗的商品ID
     */
    private List<String> productIds;

    /**
     * 订单创建时间（ISO-8601 本地时间），作为购物车清理的截止时间
     */
    private String orderCreateTime;

    private String traceId;

    private Long timestamp;
}
