package com.govmatrix.extract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ExtractionApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void extractionsEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/extractions"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void latestIsEmptyBeforeAnyRun() throws Exception {
        mockMvc.perform(get("/api/extractions/latest"))
            .andExpect(status().isNoContent());
    }

    @Test
    void clientStatsStartAtZero() throws Exception {
        mockMvc.perform(get("/api/client/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRequests").value(0));
    }
}
