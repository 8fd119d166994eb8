package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.service.SaleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SaleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SaleService saleService;

    @Test
    void getSales_ShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/sales"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void deleteSale_ShouldMapPreconditionFailureToConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(saleService.deleteSale(id)).thenReturn(OperationResult.failure(ErrorType.PRECONDITION_FAILED,
                "Returns cannot be deleted directly. Delete the original sale instead."));

        mockMvc.perform(delete("/api/sales/{id}", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("PRECONDITION_FAILED"));
    }

    @Test
    @WithMockUser(roles = "CASHIER")
    void deleteSale_ShouldBeForbiddenForCashiers() throws Exception {
        mockMvc.perform(delete("/api/sales/{id}", UUID.randomUUID()))
                .andExpect(status().isForbidden());

        verify(saleService, never()).deleteSale(any());
    }

    @Test
    @WithMockUser(roles = "CASHIER")
    void processSale_ShouldRejectEmptyBasket() throws Exception {
        mockMvc.perform(post("/api/sales")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [], \"total\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(saleService);
    }
}
