package org.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 购物车行
 * - (userId, productId) 唯一
 * - 购物车本身没有独立实体，就是某个用户当前所有的行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("cart_line")
public class CartLine {

    @JsonIgnore
    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    private String productId;

    /**
     * 数量，始终 >= 1
     */
    private Integer quantity;

    private LocalDateTime createTime;

    /**
     * 最后修改时间，结算清理和对账都以它为准
     */
    private LocalDateTime updateTime;
}
