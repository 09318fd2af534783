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
 * 消息投递记录表（事务发件箱）
 * - 先落库再投递，MQ不可用时消息不丢失
 * - 支持消息追踪、重试
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("message_delivery")
public class MessageDelivery {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 消息ID（唯一标识，防重复投递）
     */
    private String messageId;

    /**
     * 消息类型：ORDER_COMPLETED
     */
    private String messageType;

    /**
     * 消息内容（JSON格式）
     */
    private String messageContent;

    /**
     * 投递状态：PENDING(待投递)、SENT(已发送)、CONFIRMED(已确认)、FAILED(失败)
     */
    private String status;

    private Integer deliveryCount;

    private Integer maxRetries;

    /**
     * 下一次重试时间
     */
    private LocalDateTime nextRetryTime;

    private String targetQueue;

    private String traceId;

    private String errorMessage;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
