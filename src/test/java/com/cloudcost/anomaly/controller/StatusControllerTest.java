package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.service.CostDataService;
import com.cloudcost.anomaly.service.CostEventService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StatusController.class)
class StatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CostDataService costDataService;

    @MockBean
    private CostEventService eventService;

    @Test
    void getStatus_mockMode() throws Exception {
        when(costDataService.getMode()).thenReturn(DataSourceMode.MOCK);
        when(eventService.eventCount()).thenReturn(0L);

        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.mode").value("mock"))
                .andExpect(jsonPath("$.liveConfigured").value(false))
                .andExpect(jsonPath("$.eventCount").value(0));
    }

    @Test
    void getStatus_liveMode_reportsEventCount() throws Exception {
        when(costDataService.getMode()).thenReturn(DataSourceMode.LIVE);
        when(eventService.eventCount()).thenReturn(12L);

        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.liveConfigured").value(true))
                .andExpect(jsonPath("$.eventCount").value(12));
    }
}
