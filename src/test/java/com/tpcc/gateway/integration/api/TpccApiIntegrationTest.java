package com.tpcc.gateway.integration.api;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.tpcc.gateway.integration.BaseIntegrationTest;

/**
 * HTTP-level tests: request validation, status mapping and snake_case JSON.
 */
@AutoConfigureMockMvc
class TpccApiIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void payment_ShouldReturnNewBalance() throws Exception {
        mockMvc.perform(post("/api/tpcc/payment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouse_id\": 1, \"district_id\": 1, \"customer_id\": 5, \"amount\": 150}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.new_balance").value(350.0))
            .andExpect(jsonPath("$.phase").value("WRITES_COMPLETE"))
            .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    void payment_UnknownCustomer_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(post("/api/tpcc/payment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouse_id\": 1, \"district_id\": 1, \"customer_id\": 99, \"amount\": 10}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error_kind").value("NOT_FOUND"));
    }

    @Test
    void payment_NegativeAmount_ShouldFailBeanValidation() throws Exception {
        mockMvc.perform(post("/api/tpcc/payment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouse_id\": 1, \"district_id\": 1, \"customer_id\": 5, \"amount\": -1}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void orderStatus_ShouldReturnLatestOrder() throws Exception {
        mockMvc.perform(get("/api/tpcc/order-status")
                .param("warehouse_id", "1")
                .param("district_id", "1")
                .param("customer_id", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.order_id").value(4))
            .andExpect(jsonPath("$.order_lines.length()").value(2));
    }

    @Test
    void stockLevel_DefaultThreshold_ShouldCountLowItems() throws Exception {
        mockMvc.perform(get("/api/tpcc/stock-level")
                .param("warehouse_id", "1")
                .param("district_id", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.threshold").value(10))
            .andExpect(jsonPath("$.low_stock_count").value(3));
    }

    @Test
    void delivery_CarrierOutOfRange_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/tpcc/delivery")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouse_id\": 1, \"carrier_id\": 12}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void newOrder_DefaultSupplyWarehouse_ShouldCreateOrder() throws Exception {
        mockMvc.perform(post("/api/tpcc/new-order")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"warehouse_id\": 1, \"district_id\": 1, \"customer_id\": 5, "
                    + "\"items\": [{\"item_id\": 7, \"quantity\": 5}, {\"item_id\": 2, \"quantity\": 3}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.order_id").value(6))
            .andExpect(jsonPath("$.total_amount").value(109.25));
    }

    @Test
    void orders_UnknownStatus_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(get("/api/orders").param("status", "shipped"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("shipped")));
    }

    @Test
    void orderDetails_Unknown_ShouldBeNotFound() throws Exception {
        mockMvc.perform(get("/api/orders/1/1/42"))
            .andExpect(status().isNotFound());
    }

    @Test
    void dashboard_ShouldExposeMetrics() throws Exception {
        mockMvc.perform(get("/api/dashboard"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics.total_customers").value(10));
    }

    @Test
    void acidRun_UnknownProperty_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/acid/run/speed"))
            .andExpect(status().isBadRequest());
    }
}
