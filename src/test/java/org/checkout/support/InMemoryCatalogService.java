package org.checkout.support;

import org.checkout.domain.Product;
import org.checkout.service.ICatalogService;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCatalogService implements ICatalogService {

    private final Map<String, Product> products = new ConcurrentHashMap<>();

    public InMemoryCatalogService add(String productId, String price) {
        products.put(productId, Product.builder()
                .productId(productId)
                .name("Product " + productId)
                .price(new BigDecimal(price))
                .build());
        return this;
    }

    public void remove(String productId) {
        products.remove(productId);
    }

    @Override
    public List<Product> listProducts() {
        return new ArrayList<>(products.values());
    }

    @Override
    public Optional<Product> findProduct(String productId) {
        return Optional.ofNullable(products.get(productId));
    }
}
