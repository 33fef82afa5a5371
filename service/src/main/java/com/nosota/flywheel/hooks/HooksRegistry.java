package com.nosota.flywheel.hooks;

import com.nosota.flywheel.error.UnknownHooksException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves hooks addresses to the policy modules deployed in this service.
 */
@Component
@Slf4j
public class HooksRegistry {

    private final Map<String, CampaignHooks> hooksByAddress = new HashMap<>();

    public HooksRegistry(List<CampaignHooks> hooks) {
        for (CampaignHooks campaignHooks : hooks) {
            String address = campaignHooks.getAddress().toLowerCase(Locale.ROOT);
            CampaignHooks previous = hooksByAddress.put(address, campaignHooks);
            if (previous != null) {
                throw new IllegalStateException(String.format("Hooks address %s registered twice: %s and %s",
                        address, previous.getClass().getName(), campaignHooks.getClass().getName()));
            }
            log.info("Registered campaign hooks: address={}, type={}", address, campaignHooks.getClass().getSimpleName());
        }
    }

    /**
     * @param address Normalized hooks address
     * @return The policy module registered under that address
     * @throws UnknownHooksException if no module is registered there
     */
    public CampaignHooks resolve(String address) throws UnknownHooksException {
        CampaignHooks hooks = hooksByAddress.get(address);
        if (hooks == null) {
            throw new UnknownHooksException("No campaign hooks registered at " + address);
        }
        return hooks;
    }
}
