package com.nosota.flywheel.controller;

import com.nosota.flywheel.api.FlywheelApi;
import com.nosota.flywheel.api.dto.FlywheelEventDTO;
import com.nosota.flywheel.api.dto.PagedResponse;
import com.nosota.flywheel.api.request.CreateCampaignRequest;
import com.nosota.flywheel.api.request.HookDataRequest;
import com.nosota.flywheel.api.request.UpdateStatusRequest;
import com.nosota.flywheel.api.response.*;
import com.nosota.flywheel.error.FlywheelException;
import com.nosota.flywheel.mapper.FlywheelEventMapper;
import com.nosota.flywheel.model.Campaign;
import com.nosota.flywheel.model.FlywheelEvent;
import com.nosota.flywheel.model.LedgerTotals;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.network.Hex;
import com.nosota.flywheel.service.FlywheelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class CampaignController implements FlywheelApi {

    private final FlywheelService flywheelService;

    @Override
    public ResponseEntity<CampaignResponse> createCampaign(String sender, CreateCampaignRequest request)
            throws Exception {
        Campaign campaign = flywheelService.createCampaign(
                Addresses.normalize(sender), request.hooks(), request.nonce(), Hex.decode(request.hookData()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(campaign));
    }

    @Override
    public ResponseEntity<CampaignAddressResponse> predictCampaignAddress(String hooks, BigInteger nonce,
                                                                          String hookData) throws Exception {
        String address = flywheelService.predictCampaignAddress(hooks, nonce, Hex.decode(hookData));
        return ResponseEntity.ok(new CampaignAddressResponse(address, flywheelService.campaignExists(address)));
    }

    @Override
    public ResponseEntity<CampaignResponse> getCampaign(String campaign) throws Exception {
        return ResponseEntity.ok(toResponse(flywheelService.getCampaign(campaign)));
    }

    @Override
    public ResponseEntity<CampaignResponse> updateStatus(String campaign, String sender, UpdateStatusRequest request)
            throws Exception {
        Campaign updated = flywheelService.updateStatus(
                Addresses.normalize(sender), campaign, request.status(), Hex.decode(request.hookData()));
        return ResponseEntity.ok(toResponse(updated));
    }

    @Override
    public ResponseEntity<CampaignUriResponse> updateMetadata(String campaign, String sender, HookDataRequest request)
            throws Exception {
        String uri = flywheelService.updateMetadata(Addresses.normalize(sender), campaign, hookData(request));
        return ResponseEntity.ok(new CampaignUriResponse(Addresses.normalize(campaign), uri));
    }

    @Override
    public ResponseEntity<CampaignUriResponse> getCampaignUri(String campaign) throws Exception {
        String uri = flywheelService.campaignURI(campaign);
        return ResponseEntity.ok(new CampaignUriResponse(Addresses.normalize(campaign), uri));
    }

    @Override
    public ResponseEntity<OperationResponse> allocate(String campaign, String asset, String sender,
                                                      HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.allocate(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "ALLOCATE", events);
    }

    @Override
    public ResponseEntity<OperationResponse> deallocate(String campaign, String asset, String sender,
                                                        HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.deallocate(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "DEALLOCATE", events);
    }

    @Override
    public ResponseEntity<OperationResponse> distribute(String campaign, String asset, String sender,
                                                        HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.distribute(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "DISTRIBUTE", events);
    }

    @Override
    public ResponseEntity<OperationResponse> send(String campaign, String asset, String sender,
                                                  HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.send(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "SEND", events);
    }

    @Override
    public ResponseEntity<OperationResponse> distributeFees(String campaign, String asset, String sender,
                                                            HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.distributeFees(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "DISTRIBUTE_FEES", events);
    }

    @Override
    public ResponseEntity<OperationResponse> withdrawFunds(String campaign, String asset, String sender,
                                                           HookDataRequest request) throws Exception {
        List<FlywheelEvent> events = flywheelService.withdrawFunds(
                Addresses.normalize(sender), campaign, asset, hookData(request));
        return operation(campaign, asset, "WITHDRAW", events);
    }

    @Override
    public ResponseEntity<AllocationTotalsResponse> getAllocationTotals(String campaign, String asset)
            throws Exception {
        LedgerTotals totals = flywheelService.getTotals(campaign, asset);
        return ResponseEntity.ok(new AllocationTotalsResponse(
                totals.getCampaign(), totals.getAsset(),
                totals.getTotalAllocatedPayouts(), totals.getTotalAllocatedFees()));
    }

    @Override
    public ResponseEntity<AllocationResponse> getAllocatedPayout(String campaign, String asset, String key)
            throws Exception {
        BigInteger amount = flywheelService.getAllocatedPayout(campaign, asset, key);
        return ResponseEntity.ok(new AllocationResponse(
                Addresses.normalize(campaign), Addresses.normalize(asset), Addresses.normalizeKey(key), amount));
    }

    @Override
    public ResponseEntity<AllocationResponse> getAllocatedFee(String campaign, String asset, String key)
            throws Exception {
        BigInteger amount = flywheelService.getAllocatedFee(campaign, asset, key);
        return ResponseEntity.ok(new AllocationResponse(
                Addresses.normalize(campaign), Addresses.normalize(asset), Addresses.normalizeKey(key), amount));
    }

    @Override
    public ResponseEntity<BalanceResponse> getVaultBalance(String campaign, String asset) throws Exception {
        BigInteger balance = flywheelService.getVaultBalance(campaign, asset);
        return ResponseEntity.ok(new BalanceResponse(
                Addresses.normalize(campaign), Addresses.normalize(asset), balance));
    }

    @Override
    public ResponseEntity<PagedResponse<FlywheelEventDTO>> getEvents(String campaign, int page, int size)
            throws Exception {
        Page<FlywheelEvent> events = flywheelService.getEvents(campaign, page, size);
        return ResponseEntity.ok(new PagedResponse<>(
                FlywheelEventMapper.INSTANCE.toDTOList(events.getContent()),
                events.getNumber(),
                events.getSize(),
                events.getTotalElements()));
    }

    private ResponseEntity<OperationResponse> operation(String campaign, String asset, String operation,
                                                        List<FlywheelEvent> events) throws FlywheelException {
        return ResponseEntity.ok(new OperationResponse(
                Addresses.normalize(campaign),
                Addresses.normalize(asset),
                operation,
                FlywheelEventMapper.INSTANCE.toDTOList(events)));
    }

    private static byte[] hookData(HookDataRequest request) throws FlywheelException {
        return Hex.decode(request == null ? null : request.hookData());
    }

    private static CampaignResponse toResponse(Campaign campaign) {
        return new CampaignResponse(campaign.getAddress(), campaign.getHooks(), campaign.getStatus());
    }
}
