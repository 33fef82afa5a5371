package com.nosota.flywheel.api.response;

import com.nosota.flywheel.api.dto.FlywheelEventDTO;

import java.util.List;

/**
 * Result of a ledger operation: the events it appended to the campaign log.
 *
 * <p>An empty event list means every instruction returned by the hooks had a zero amount.
 */
public record OperationResponse(
        String campaign,
        String asset,
        String operation,
        List<FlywheelEventDTO> events
) {}
