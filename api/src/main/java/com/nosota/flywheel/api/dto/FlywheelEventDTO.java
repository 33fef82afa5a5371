package com.nosota.flywheel.api.dto;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.api.model.FlywheelEventType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class FlywheelEventDTO {
    private Long id;
    private String campaign;
    private FlywheelEventType type;
    private String hooks;
    private String asset;
    private String recipient;
    private String recipientKey;
    private BigInteger amount;
    private String extraData;
    private String sender;
    private CampaignStatus oldStatus;
    private CampaignStatus newStatus;
    private String uri;
    private LocalDateTime createdAt;
}
