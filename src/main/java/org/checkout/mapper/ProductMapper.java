package org.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.checkout.domain.Product;

@Mapper
public interface ProductMapper extends BaseMapper<Product> {
}
