package com.nosota.flywheel.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Locale;

/**
 * Flywheel settings.
 *
 * <pre>
 * flywheel:
 *   address: "0x..."   # identity of the registry; vaults and hooks accept calls only from it
 * </pre>
 *
 * @param address Registry address (20-byte hex)
 */
@ConfigurationProperties(prefix = "flywheel")
@Validated
public record FlywheelProperties(
        @NotBlank String address
) {
    public FlywheelProperties {
        address = address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }
}
