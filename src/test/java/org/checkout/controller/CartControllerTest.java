package org.checkout.controller;

import org.checkout.domain.CartLine;
import org.checkout.exception.InvalidQuantityException;
import org.checkout.exception.ValidationException;
import org.checkout.service.ICartService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CartController.class)
class CartControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ICartService cartService;

    @Test
    void listsLinesOfTheRequestingUser() throws Exception {
        when(cartService.getLines("u1")).thenReturn(List.of(
                CartLine.builder().id(7L).userId("u1").productId("p1").quantity(2).build()));

        mockMvc.perform(get("/cart").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].productId").value("p1"))
                .andExpect(jsonPath("$.data[0].quantity").value(2))
                .andExpect(jsonPath("$.data[0].id").doesNotExist());
    }

    @Test
    void fallsBackToDefaultUser() throws Exception {
        when(cartService.getLines("demo-user")).thenReturn(List.of());

        mockMvc.perform(get("/cart"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void putsLine() throws Exception {
        when(cartService.putLine("u1", "p1", 3)).thenReturn(
                CartLine.builder().userId("u1").productId("p1").quantity(3).build());

        mockMvc.perform(post("/cart")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"p1\",\"quantity\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("SUCCESS"))
                .andExpect(jsonPath("$.data.quantity").value(3));
    }

    @Test
    void rejectsZeroQuantity() throws Exception {
        mockMvc.perform(post("/cart")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"p1\",\"quantity\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(InvalidQuantityException.CODE));

        verify(cartService, never()).putLine(anyString(), anyString(), any());
    }

    @Test
    void rejectsFractionalQuantity() throws Exception {
        mockMvc.perform(post("/cart")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"p1\",\"quantity\":1.9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ValidationException.CODE));

        verify(cartService, never()).putLine(anyString(), anyString(), any());
    }

    @Test
    void rejectsMissingProductId() throws Exception {
        mockMvc.perform(post("/cart")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ValidationException.CODE));
    }

    @Test
    void rejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/cart")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ValidationException.CODE));
    }

    @Test
    void deletesLine() throws Exception {
        mockMvc.perform(delete("/cart/p1").header("X-User-Id", "u1"))
                .andExpect(status().isOk());

        verify(cartService).deleteLine("u1", "p1");
    }
}
