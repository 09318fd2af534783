package org.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.checkout.domain.OrderLineItem;

@Mapper
public interface OrderLineItemMapper extends BaseMapper<OrderLineItem> {
}
