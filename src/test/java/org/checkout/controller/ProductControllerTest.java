package org.checkout.controller;

import org.checkout.domain.Product;
import org.checkout.exception.NotFoundException;
import org.checkout.service.ICatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProductController.class)
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ICatalogService catalogService;

    @Test
    void listsProductsWithStringPrices() throws Exception {
        when(catalogService.listProducts()).thenReturn(List.of(
                Product.builder().productId("p1").name("Widget").price(new BigDecimal("10.00")).build()));

        mockMvc.perform(get("/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].productId").value("p1"))
                .andExpect(jsonPath("$.data[0].price").value("10.00"));
    }

    @Test
    void unknownProductIsNotFound() throws Exception {
        when(catalogService.getProduct("nope")).thenCallRealMethod();
        when(catalogService.findProduct("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/products/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(NotFoundException.CODE));
    }
}
