package org.checkout.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.checkout.domain.Product;
import org.checkout.mapper.ProductMapper;
import org.checkout.service.ICatalogService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class CatalogServiceImpl extends ServiceImpl<ProductMapper, Product> implements ICatalogService {

    @Override
    public List<Product> listProducts() {
        return this.lambdaQuery()
                .orderByAsc(Product::getProductId)
                .list();
    }

    @Override
    public Optional<Product> findProduct(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(baseMapper.selectById(productId));
    }
}
