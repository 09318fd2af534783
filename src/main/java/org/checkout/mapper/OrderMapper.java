package org.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;
import org.checkout.domain.Order;
import org.checkout.domain.OrderStatus;

import java.time.LocalDateTime;

@Mapper
public interface OrderMapper extends BaseMapper<Order> {

    /**
     * 订单状态条件更新（CAS）
     * 只有当前状态等于expected时才会更新，保证翻转只发生一次
     *
     * @return 更新行数（0表示状态已被其他请求修改）
     */
    @Update("""
            UPDATE customer_order
            SET status = #{target},
                update_time = #{updateTime}
            WHERE order_id = #{orderId}
              AND status = #{expected}
            """)
    int compareAndSetStatus(@Param("orderId") String orderId,
                            @Param("expected") OrderStatus expected,
                            @Param("target") OrderStatus target,
                            @Param("updateTime") LocalDateTime updateTime);
}
