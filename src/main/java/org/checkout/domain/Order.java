package org.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 订单实体类
 * <p>
 * 订单头与订单行在订单存储内一次写入；
 * 状态为 COMPLETED 后即为只追加的审计记录，不再修改。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName(value = "customer_order", autoResultMap = true)
public class Order {

    /**
     * 订单ID（业务唯一标识）
     */
    @TableId(value = "order_id", type = IdType.INPUT)
    private String orderId;

    private String userId;

    /**
     * 订单总额 = Σ(unitPrice × quantity)，定点计算
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal total;

    private OrderStatus status;

    /**
     * 产生该订单的幂等键（userId:token 或 userId:auto:orderId）
     */
    private String idempotencyKey;

    /**
     * 追踪ID（用于分布式链路追踪）
     */
    private String traceId;

    /**
     * 创建时间，不早于本单消耗的任一购物车行的最后修改时间
     * 对账任务和订单事件都以它作为购物车清理的截止时间
     */
    private LocalDateTime createTime;

    private LocalDateTime updateTime;

    /**
     * 因商品已下架而未计价的商品ID，这些购物车行同样视为已消耗
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> droppedProductIds;

    /**
     * 订单行快照，单独存储在 order_line_item 表
     */
    @TableField(exist = false)
    private List<OrderLineItem> lineItems;
}
