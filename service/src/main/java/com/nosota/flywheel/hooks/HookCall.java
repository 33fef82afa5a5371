package com.nosota.flywheel.hooks;

/**
 * Arguments common to every hook callback.
 *
 * @param sender   Address that called the registry
 * @param campaign Campaign address
 * @param asset    Asset address; {@code null} for lifecycle callbacks
 * @param hookData Opaque payload, decoded only by the hooks
 */
public record HookCall(
        String sender,
        String campaign,
        String asset,
        byte[] hookData
) {}
