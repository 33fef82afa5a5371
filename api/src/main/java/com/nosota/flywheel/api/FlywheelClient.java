package com.nosota.flywheel.api;

import com.nosota.flywheel.api.dto.FlywheelEventDTO;
import com.nosota.flywheel.api.dto.PagedResponse;
import com.nosota.flywheel.api.request.CreateCampaignRequest;
import com.nosota.flywheel.api.request.HookDataRequest;
import com.nosota.flywheel.api.request.UpdateStatusRequest;
import com.nosota.flywheel.api.response.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;

/**
 * WebClient-based implementation of FlywheelApi for consuming the flywheel service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class FlywheelClientConfig {
 *     @Bean
 *     public WebClient flywheelWebClient(WebClient.Builder builder,
 *                                        @Value("${services.flywheel.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public FlywheelClient flywheelClient(WebClient flywheelWebClient) {
 *         return new FlywheelClient(flywheelWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class FlywheelClient implements FlywheelApi {

    private static final String BASE = "/api/v1/flywheel";

    private final WebClient webClient;

    @Override
    public ResponseEntity<CampaignResponse> createCampaign(String sender, CreateCampaignRequest request) {
        log.debug("Calling createCampaign: sender={}, hooks={}, nonce={}", sender, request.hooks(), request.nonce());

        return webClient.post()
                .uri(BASE + "/campaigns")
                .header(SENDER_HEADER, sender)
                .bodyValue(request)
                .retrieve()
                .toEntity(CampaignResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CampaignAddressResponse> predictCampaignAddress(String hooks, BigInteger nonce, String hookData) {
        log.debug("Calling predictCampaignAddress: hooks={}, nonce={}", hooks, nonce);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/campaigns/predict")
                        .queryParam("hooks", hooks)
                        .queryParam("nonce", nonce)
                        .queryParam("hookData", hookData == null ? "0x" : hookData)
                        .build())
                .retrieve()
                .toEntity(CampaignAddressResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CampaignResponse> getCampaign(String campaign) {
        log.debug("Calling getCampaign: campaign={}", campaign);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}", campaign)
                .retrieve()
                .toEntity(CampaignResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CampaignResponse> updateStatus(String campaign, String sender, UpdateStatusRequest request) {
        log.debug("Calling updateStatus: campaign={}, sender={}, status={}", campaign, sender, request.status());

        return webClient.post()
                .uri(BASE + "/campaigns/{campaign}/status", campaign)
                .header(SENDER_HEADER, sender)
                .bodyValue(request)
                .retrieve()
                .toEntity(CampaignResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CampaignUriResponse> updateMetadata(String campaign, String sender, HookDataRequest request) {
        log.debug("Calling updateMetadata: campaign={}, sender={}", campaign, sender);

        return webClient.post()
                .uri(BASE + "/campaigns/{campaign}/metadata", campaign)
                .header(SENDER_HEADER, sender)
                .bodyValue(request)
                .retrieve()
                .toEntity(CampaignUriResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CampaignUriResponse> getCampaignUri(String campaign) {
        log.debug("Calling getCampaignUri: campaign={}", campaign);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}/uri", campaign)
                .retrieve()
                .toEntity(CampaignUriResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OperationResponse> allocate(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("allocate", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<OperationResponse> deallocate(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("deallocate", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<OperationResponse> distribute(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("distribute", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<OperationResponse> send(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("send", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<OperationResponse> distributeFees(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("distribute-fees", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<OperationResponse> withdrawFunds(String campaign, String asset, String sender, HookDataRequest request) {
        return ledgerOperation("withdraw", campaign, asset, sender, request);
    }

    @Override
    public ResponseEntity<AllocationTotalsResponse> getAllocationTotals(String campaign, String asset) {
        log.debug("Calling getAllocationTotals: campaign={}, asset={}", campaign, asset);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}/assets/{asset}/totals", campaign, asset)
                .retrieve()
                .toEntity(AllocationTotalsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AllocationResponse> getAllocatedPayout(String campaign, String asset, String key) {
        log.debug("Calling getAllocatedPayout: campaign={}, asset={}, key={}", campaign, asset, key);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}/assets/{asset}/payouts/{key}", campaign, asset, key)
                .retrieve()
                .toEntity(AllocationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AllocationResponse> getAllocatedFee(String campaign, String asset, String key) {
        log.debug("Calling getAllocatedFee: campaign={}, asset={}, key={}", campaign, asset, key);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}/assets/{asset}/fees/{key}", campaign, asset, key)
                .retrieve()
                .toEntity(AllocationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getVaultBalance(String campaign, String asset) {
        log.debug("Calling getVaultBalance: campaign={}, asset={}", campaign, asset);

        return webClient.get()
                .uri(BASE + "/campaigns/{campaign}/assets/{asset}/balance", campaign, asset)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<FlywheelEventDTO>> getEvents(String campaign, int page, int size) {
        log.debug("Calling getEvents: campaign={}, page={}, size={}", campaign, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/campaigns/{campaign}/events")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(campaign))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<FlywheelEventDTO>>() {})
                .block();
    }

    private ResponseEntity<OperationResponse> ledgerOperation(String operation, String campaign, String asset,
                                                              String sender, HookDataRequest request) {
        log.debug("Calling {}: campaign={}, asset={}, sender={}", operation, campaign, asset, sender);

        return webClient.post()
                .uri(BASE + "/campaigns/{campaign}/assets/{asset}/" + operation, campaign, asset)
                .header(SENDER_HEADER, sender)
                .bodyValue(request)
                .retrieve()
                .toEntity(OperationResponse.class)
                .block();
    }
}
