package com.nosota.flywheel.tests;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.flywheel.TestBase;
import com.nosota.flywheel.api.FlywheelApi;
import com.nosota.flywheel.network.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the manager-directed rewards policy through the REST API with MockMvc.
 */
public class SimpleRewardsTest extends TestBase {

    private static final String BASE = "/api/v1/flywheel/campaigns";

    @Value("${flywheel.hooks.simple-rewards.address}")
    private String simpleRewards;

    private String owner;
    private String manager;
    private String campaign;

    @BeforeEach
    public void createCampaign() throws Exception {
        owner = newAddress();
        manager = newAddress();

        String createData = hex(Map.of("owner", owner, "manager", manager, "uri", "ipfs://campaign-v1"));
        MvcResult result = mockMvc.perform(post(BASE)
                        .header(FlywheelApi.SENDER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "hooks", simpleRewards,
                                "nonce", newNonce(),
                                "hookData", createData))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("INACTIVE"))
                .andReturn();
        campaign = objectMapper.readTree(result.getResponse().getContentAsString()).get("campaign").asText();
    }

    @Test
    @DisplayName("SRW-001: Manager funds, allocates and distributes a reward")
    public void rewardLifecycle_ShouldPayRecipient() throws Exception {
        String recipient = newAddress();
        activate();
        fund(1000);

        ledgerCall("allocate", manager, payouts(recipient, 400))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation").value("ALLOCATE"))
                .andExpect(jsonPath("$.events[0].type").value("PAYOUT_ALLOCATED"))
                .andExpect(jsonPath("$.events[0].recipientKey").value(keyOf(recipient)));

        mockMvc.perform(get(BASE + "/{campaign}/assets/{asset}/totals", campaign, NATIVE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAllocatedPayouts").value(400))
                .andExpect(jsonPath("$.totalAllocatedFees").value(0));
        mockMvc.perform(get(BASE + "/{campaign}/assets/{asset}/payouts/{key}", campaign, NATIVE, keyOf(recipient)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(400));

        ledgerCall("distribute", manager, payouts(recipient, 400))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].type").value("PAYOUTS_DISTRIBUTED"))
                .andExpect(jsonPath("$.events[0].recipient").value(recipient));

        mockMvc.perform(get(BASE + "/{campaign}/assets/{asset}/balance", campaign, NATIVE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(600));
        mockMvc.perform(get("/api/v1/network/holders/{holder}/assets/{asset}/balance", recipient, NATIVE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(400));
        mockMvc.perform(get(BASE + "/{campaign}/assets/{asset}/totals", campaign, NATIVE))
                .andExpect(jsonPath("$.totalAllocatedPayouts").value(0));
    }

    @Test
    @DisplayName("SRW-002: Only the manager may direct payouts")
    public void allocate_WhenSenderIsNotManager_ShouldReturn403() throws Exception {
        activate();
        fund(100);

        ledgerCall("allocate", owner, payouts(newAddress(), 10))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(post(BASE + "/{campaign}/status", campaign)
                        .header(FlywheelApi.SENDER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"FINALIZED\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("SRW-003: Allocation over the funded amount returns 409")
    public void allocate_WhenUnderfunded_ShouldReturn409() throws Exception {
        activate();
        fund(100);

        ledgerCall("allocate", manager, payouts(newAddress(), 101))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_CAMPAIGN_FUNDS"));
    }

    @Test
    @DisplayName("SRW-004: Send pays immediately and is logged")
    public void send_ShouldPayAndAppearInEventLog() throws Exception {
        String recipient = newAddress();
        activate();
        fund(300);

        ledgerCall("send", manager, payouts(recipient, 120))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].type").value("PAYOUT_SENT"));

        MvcResult result = mockMvc.perform(get(BASE + "/{campaign}/events", campaign)
                        .param("page", "0")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode page = objectMapper.readTree(result.getResponse().getContentAsString());
        List<String> types = page.get("content").findValuesAsText("type");
        assertThat(types).containsExactly("CAMPAIGN_CREATED", "CAMPAIGN_STATUS_UPDATED", "PAYOUT_SENT");
        assertThat(page.get("totalElements").asLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("SRW-005: Owner withdraws after finalization; manager may not")
    public void withdraw_ShouldBeOwnerOnly() throws Exception {
        activate();
        fund(80);
        updateStatus("FINALIZED");

        String withdrawal = hex(Map.of("recipient", owner, "amount", 80));
        ledgerCall("withdraw", manager, withdrawal)
                .andExpect(status().isForbidden());
        ledgerCall("withdraw", owner, withdrawal)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].type").value("FUNDS_WITHDRAWN"))
                .andExpect(jsonPath("$.events[0].amount").value(80));

        mockMvc.perform(get("/api/v1/network/holders/{holder}/assets/{asset}/balance", owner, NATIVE))
                .andExpect(jsonPath("$.balance").value(80));
    }

    @Test
    @DisplayName("SRW-006: Metadata update by the owner changes the URI")
    public void updateMetadata_ByOwner_ShouldChangeUri() throws Exception {
        mockMvc.perform(get(BASE + "/{campaign}/uri", campaign))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uri").value("ipfs://campaign-v1"));

        mockMvc.perform(post(BASE + "/{campaign}/metadata", campaign)
                        .header(FlywheelApi.SENDER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("hookData", hex(Map.of("uri", "ipfs://campaign-v2"))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uri").value("ipfs://campaign-v2"));

        mockMvc.perform(post(BASE + "/{campaign}/metadata", campaign)
                        .header(FlywheelApi.SENDER_HEADER, newAddress())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("SRW-007: Prediction and lookup of campaigns")
    public void predictAndLookup_ShouldReportExistence() throws Exception {
        mockMvc.perform(get(BASE + "/{campaign}", campaign))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hooks").value(simpleRewards))
                .andExpect(jsonPath("$.status").value("INACTIVE"));

        mockMvc.perform(get(BASE + "/predict")
                        .param("hooks", simpleRewards)
                        .param("nonce", newNonce().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(false));

        mockMvc.perform(get(BASE + "/{campaign}", newAddress()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CAMPAIGN_DOES_NOT_EXIST"));
    }

    @Test
    @DisplayName("SRW-008: Malformed requests are rejected with 400")
    public void malformedRequests_ShouldReturn400() throws Exception {
        activate();

        ledgerCall("allocate", manager, "0xzz")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_HOOK_DATA"));

        mockMvc.perform(post(BASE + "/{campaign}/assets/{asset}/allocate", campaign, "not-an-address")
                        .header(FlywheelApi.SENDER_HEADER, manager)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ADDRESS"));

        mockMvc.perform(post(BASE + "/{campaign}/assets/{asset}/allocate", campaign, NATIVE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/network/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "holder", campaign, "asset", NATIVE, "amount", 0))))
                .andExpect(status().isBadRequest());
    }

    private void activate() throws Exception {
        updateStatus("ACTIVE");
    }

    private void updateStatus(String status) throws Exception {
        mockMvc.perform(post(BASE + "/{campaign}/status", campaign)
                        .header(FlywheelApi.SENDER_HEADER, manager)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"" + status + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(status));
    }

    private void fund(long amount) throws Exception {
        mockMvc.perform(post("/api/v1/network/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "holder", campaign, "asset", NATIVE, "amount", amount))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.balance").value(amount));
    }

    private ResultActions ledgerCall(String operation, String sender, String hookData) throws Exception {
        return mockMvc.perform(post(BASE + "/{campaign}/assets/{asset}/" + operation, campaign, NATIVE)
                .header(FlywheelApi.SENDER_HEADER, sender)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("hookData", hookData))));
    }

    private String payouts(String recipient, long amount) throws Exception {
        return hex(Map.of("payouts", List.of(Map.of("recipient", recipient, "amount", amount))));
    }

    private String hex(Object payload) throws Exception {
        return Hex.encode(objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8));
    }
}
