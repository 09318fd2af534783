package org.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 订单行（价格快照）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("order_line_item")
public class OrderLineItem {

    @JsonIgnore
    @TableId(type = IdType.AUTO)
    private Long id;

    @JsonIgnore
    private String orderId;

    /**
     * 行号，保持购物车读取顺序
     */
    private Integer lineNo;

    private String productId;

    private String productName;

    private Integer quantity;

    /**
     * 结算时刻的单价快照
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal unitPrice;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal subtotal;
}
