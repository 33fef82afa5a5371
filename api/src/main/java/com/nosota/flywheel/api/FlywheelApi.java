package com.nosota.flywheel.api;

import com.nosota.flywheel.api.dto.FlywheelEventDTO;
import com.nosota.flywheel.api.dto.PagedResponse;
import com.nosota.flywheel.api.request.CreateCampaignRequest;
import com.nosota.flywheel.api.request.HookDataRequest;
import com.nosota.flywheel.api.request.UpdateStatusRequest;
import com.nosota.flywheel.api.response.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Flywheel API: campaign registry and ledger operations.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Campaign lifecycle (create, status, metadata)</li>
 *   <li>Payout bookkeeping (allocate, deallocate)</li>
 *   <li>Value movement (distribute, send, distribute fees, withdraw)</li>
 *   <li>Accessors (totals, allocations, vault balance, event log)</li>
 * </ul>
 *
 * <p>Every mutating call carries the acting address in the {@value #SENDER_HEADER}
 * header; the campaign hooks authorize the call against it. Hook payloads are
 * hex encoded ({@code 0x...}) and opaque to the registry.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>CampaignController - in service module (server-side implementation)</li>
 *   <li>FlywheelClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/flywheel")
public interface FlywheelApi {

    String SENDER_HEADER = "Flywheel-Sender";

    // ==================== Campaign Lifecycle ====================

    /**
     * Creates a campaign, or returns the existing one for the same derivation inputs.
     *
     * @param sender  Acting address
     * @param request Hooks, nonce and creation payload
     * @return Campaign identity and status
     */
    @PostMapping("/campaigns")
    ResponseEntity<CampaignResponse> createCampaign(
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody @Valid CreateCampaignRequest request) throws Exception;

    /**
     * Predicts the address a campaign would get for the given derivation inputs.
     *
     * @param hooks    Hooks address
     * @param nonce    Caller-chosen nonce
     * @param hookData Hex encoded creation payload
     * @return Predicted address and whether a campaign already lives there
     */
    @GetMapping("/campaigns/predict")
    ResponseEntity<CampaignAddressResponse> predictCampaignAddress(
            @RequestParam("hooks") @NotBlank String hooks,
            @RequestParam("nonce") @PositiveOrZero BigInteger nonce,
            @RequestParam(value = "hookData", required = false) String hookData) throws Exception;

    /**
     * Gets a campaign's hooks and status.
     *
     * @param campaign Campaign address
     * @return Campaign identity and status
     */
    @GetMapping("/campaigns/{campaign}")
    ResponseEntity<CampaignResponse> getCampaign(
            @PathVariable("campaign") String campaign) throws Exception;

    /**
     * Moves a campaign to a new status.
     *
     * @param campaign Campaign address
     * @param sender   Acting address
     * @param request  Target status and hook payload
     * @return Campaign with its new status
     */
    @PostMapping("/campaigns/{campaign}/status")
    ResponseEntity<CampaignResponse> updateStatus(
            @PathVariable("campaign") String campaign,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody @Valid UpdateStatusRequest request) throws Exception;

    /**
     * Updates campaign metadata through the hooks.
     *
     * @param campaign Campaign address
     * @param sender   Acting address
     * @param request  Hook payload
     * @return The campaign URI after the update
     */
    @PostMapping("/campaigns/{campaign}/metadata")
    ResponseEntity<CampaignUriResponse> updateMetadata(
            @PathVariable("campaign") String campaign,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    /**
     * Gets the content URI reported by a campaign's hooks.
     *
     * @param campaign Campaign address
     * @return Campaign URI
     */
    @GetMapping("/campaigns/{campaign}/uri")
    ResponseEntity<CampaignUriResponse> getCampaignUri(
            @PathVariable("campaign") String campaign) throws Exception;

    // ==================== Ledger Operations ====================

    @PostMapping("/campaigns/{campaign}/assets/{asset}/allocate")
    ResponseEntity<OperationResponse> allocate(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    @PostMapping("/campaigns/{campaign}/assets/{asset}/deallocate")
    ResponseEntity<OperationResponse> deallocate(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    @PostMapping("/campaigns/{campaign}/assets/{asset}/distribute")
    ResponseEntity<OperationResponse> distribute(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    @PostMapping("/campaigns/{campaign}/assets/{asset}/send")
    ResponseEntity<OperationResponse> send(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    @PostMapping("/campaigns/{campaign}/assets/{asset}/distribute-fees")
    ResponseEntity<OperationResponse> distributeFees(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    @PostMapping("/campaigns/{campaign}/assets/{asset}/withdraw")
    ResponseEntity<OperationResponse> withdrawFunds(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @RequestHeader(SENDER_HEADER) @NotBlank String sender,
            @RequestBody HookDataRequest request) throws Exception;

    // ==================== Query Operations ====================

    @GetMapping("/campaigns/{campaign}/assets/{asset}/totals")
    ResponseEntity<AllocationTotalsResponse> getAllocationTotals(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset) throws Exception;

    @GetMapping("/campaigns/{campaign}/assets/{asset}/payouts/{key}")
    ResponseEntity<AllocationResponse> getAllocatedPayout(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @PathVariable("key") String key) throws Exception;

    @GetMapping("/campaigns/{campaign}/assets/{asset}/fees/{key}")
    ResponseEntity<AllocationResponse> getAllocatedFee(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset,
            @PathVariable("key") String key) throws Exception;

    @GetMapping("/campaigns/{campaign}/assets/{asset}/balance")
    ResponseEntity<BalanceResponse> getVaultBalance(
            @PathVariable("campaign") String campaign,
            @PathVariable("asset") String asset) throws Exception;

    /**
     * Gets the campaign's event log, oldest first.
     *
     * @param campaign Campaign address
     * @param page     Zero-based page number
     * @param size     Page size
     * @return Page of events
     */
    @GetMapping("/campaigns/{campaign}/events")
    ResponseEntity<PagedResponse<FlywheelEventDTO>> getEvents(
            @PathVariable("campaign") String campaign,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) throws Exception;
}
