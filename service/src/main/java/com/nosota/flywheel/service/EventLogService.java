package com.nosota.flywheel.service;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.api.model.FlywheelEventType;
import com.nosota.flywheel.model.FlywheelEvent;
import com.nosota.flywheel.repository.FlywheelEventRepository;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Append-only campaign event log.
 *
 * <p>Each {@code record*} method appends exactly one row inside the caller's
 * transaction, so a rolled back operation leaves no events behind.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class EventLogService {

    private final FlywheelEventRepository eventRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordCampaignCreated(String campaign, String hooks, String sender) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(FlywheelEventType.CAMPAIGN_CREATED)
                .hooks(hooks)
                .sender(sender)
                .newStatus(CampaignStatus.INACTIVE));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordStatusUpdated(String campaign, String sender,
                                             CampaignStatus oldStatus, CampaignStatus newStatus) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(FlywheelEventType.CAMPAIGN_STATUS_UPDATED)
                .sender(sender)
                .oldStatus(oldStatus)
                .newStatus(newStatus));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordMetadataUpdated(String campaign, String sender) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(FlywheelEventType.CAMPAIGN_METADATA_UPDATED)
                .sender(sender));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordContentUriUpdated(String campaign, String uri) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(FlywheelEventType.CONTENT_URI_UPDATED)
                .uri(uri));
    }

    /**
     * Appends a keyed ledger event: allocations, deallocations and fee allocations.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordKeyed(FlywheelEventType type, String campaign, String asset,
                                     String key, BigInteger amount, String extraData) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(type)
                .asset(asset)
                .recipientKey(key)
                .amount(amount)
                .extraData(extraData));
    }

    /**
     * Appends a transfer event: payouts sent, distributed, fees sent or failed, withdrawals.
     *
     * @param key Recipient key, or {@code null} for transfers not tied to an allocation
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FlywheelEvent recordTransfer(FlywheelEventType type, String campaign, String asset,
                                        String recipient, String key, BigInteger amount, String extraData) {
        return append(FlywheelEvent.builder()
                .campaign(campaign)
                .type(type)
                .asset(asset)
                .recipient(recipient)
                .recipientKey(key)
                .amount(amount)
                .extraData(extraData));
    }

    /**
     * Events of a campaign, oldest first.
     */
    public Page<FlywheelEvent> getEvents(@NotNull String campaign,
                                         @Min(0) int page,
                                         @Min(1) @Max(500) int size) {
        return eventRepository.findByCampaignOrderByIdAsc(campaign, PageRequest.of(page, size));
    }

    private FlywheelEvent append(FlywheelEvent.FlywheelEventBuilder builder) {
        FlywheelEvent event = eventRepository.save(builder.createdAt(LocalDateTime.now()).build());
        log.debug("Event recorded: campaign={}, type={}, asset={}, recipient={}, key={}, amount={}",
                event.getCampaign(), event.getType(), event.getAsset(), event.getRecipient(),
                event.getRecipientKey(), event.getAmount());
        return event;
    }
}
