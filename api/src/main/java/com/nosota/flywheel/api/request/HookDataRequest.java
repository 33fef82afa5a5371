package com.nosota.flywheel.api.request;

/**
 * Opaque instruction payload forwarded to the campaign hooks.
 *
 * @param hookData Hex encoded ({@code 0x...}) payload, interpreted only by the hooks
 */
public record HookDataRequest(
        String hookData
) {
}
