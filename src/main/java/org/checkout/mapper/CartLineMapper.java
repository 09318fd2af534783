package org.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.checkout.domain.CartLine;

import java.time.LocalDateTime;

@Mapper
public interface CartLineMapper extends BaseMapper<CartLine> {

    /**
     * 写入或覆盖一行（依赖 (user_id, product_id) 唯一约束）
     *
     * @return 影响行数
     */
    @Insert("""
            INSERT INTO cart_line (user_id, product_id, quantity, create_time, update_time)
            VALUES (#{userId}, #{productId}, #{quantity}, #{now}, #{now})
            ON CONFLICT (user_id, product_id)
            DO UPDATE SET quantity = EXCLUDED.quantity,
                          update_time = EXCLUDED.update_time
            """)
    int upsertLine(@Param("userId") String userId,
                   @Param("productId") String productId,
                   @Param("quantity") Integer quantity,
                   @Param("now") LocalDateTime now);

    /**
     * 条件删除单行：只删除最后修改时间不晚于cutoff的行
     *
     * @return 0表示行不存在或在cutoff之后被修改过
     */
    @Delete("""
            DELETE FROM cart_line
            WHERE user_id = #{userId}
              AND product_id = #{productId}
              AND update_time <= #{cutoff}
            """)
    int deleteLineNotModifiedAfter(@Param("userId") String userId,
                                   @Param("productId") String productId,
                                   @Param("cutoff") LocalDateTime cutoff);

    @Delete("""
            DELETE FROM cart_line
            WHERE user_id = #{userId}
              AND update_time <= #{cutoff}
            """)
    int deleteLinesNotModifiedAfter(@Param("userId") String userId,
                                    @Param("cutoff") LocalDateTime cutoff);
}
