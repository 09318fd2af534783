package org.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 商品（目录快照）
 * 结算时只读，价格在读取时刻被快照到订单行中
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("product")
public class Product {

    @TableId(value = "product_id", type = IdType.INPUT)
    private String productId;

    private String name;

    /**
     * 单价（定点小数，>= 0）
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal price;

    private String description;

    private String imageUrl;
}
