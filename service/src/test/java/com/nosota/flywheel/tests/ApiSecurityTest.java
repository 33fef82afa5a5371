package com.nosota.flywheel.tests;

import com.nosota.flywheel.TestBase;
import com.nosota.flywheel.config.CorrelationIdFilter;
import org.junit.jupiter.api.Test;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ApiSecurityTest extends TestBase {

    @Test
    public void apiDocs_OutsideDevProfile_ShouldBeDenied() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().is4xxClientError());
    }

    @Test
    public void apiCall_ShouldEchoCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/network/holders/{holder}/assets/{asset}/balance", newAddress(), TOKEN)
                        .header(CorrelationIdFilter.HEADER, "test-correlation-1"))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdFilter.HEADER, "test-correlation-1"));
    }
}
