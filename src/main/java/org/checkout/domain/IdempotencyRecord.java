package org.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 幂等记录：幂等键 -> orderId
 * 首个写入者占有该键，之后的写入者只能读取已有记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("idempotency_record")
public class IdempotencyRecord {

    /**
     * userId + ":" + token
     */
    @TableId(value = "record_key", type = IdType.INPUT)
    private String recordKey;

    private String userId;

    /**
     * 客户端传入的token，或派生键 auto:{orderId}
     */
    private String idempotencyKey;

    private String orderId;

    private LocalDateTime createTime;
}
