package com.nosota.flywheel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.config.FlywheelProperties;
import com.nosota.flywheel.hooks.ScriptedCampaignHooks;
import com.nosota.flywheel.hooks.ScriptedHooksConfig;
import com.nosota.flywheel.model.Campaign;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.network.AssetNetwork;
import com.nosota.flywheel.repository.FlywheelEventRepository;
import com.nosota.flywheel.service.DepositService;
import com.nosota.flywheel.service.FlywheelService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of the integration tests.
 *
 * <p>Runs the full application against in-memory H2 (PostgreSQL mode) with the Flyway
 * schema. Tests are not transactional: every registry call commits or rolls back on its
 * own, exactly as in production, so each test works on fresh campaigns and addresses.
 *
 * <p>The asset network is a Mockito spy, letting tests make chosen recipients reject transfers.
 */
@SpringBootTest(classes = FlywheelApplication.class)
@AutoConfigureMockMvc
@Import(ScriptedHooksConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {

    protected static final String NATIVE = Addresses.NATIVE_TOKEN;
    protected static final String TOKEN = "0x7070707070707070707070707070707070707070";

    private static final AtomicLong addressCounter = new AtomicLong(0x100000);
    private static final AtomicLong nonceCounter = new AtomicLong(1);

    @Autowired
    protected FlywheelService flywheelService;

    @Autowired
    protected DepositService depositService;

    @Autowired
    protected FlywheelEventRepository eventRepository;

    @Autowired
    protected ScriptedCampaignHooks scriptedHooks;

    @Autowired
    protected FlywheelProperties flywheelProperties;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @SpyBean
    protected AssetNetwork assetNetwork;

    @BeforeEach
    public void resetScriptedHooks() {
        scriptedHooks.reset();
    }

    /**
     * A fresh address no other test uses.
     */
    protected static String newAddress() {
        return String.format("0x%040x", addressCounter.getAndIncrement());
    }

    protected static BigInteger newNonce() {
        return BigInteger.valueOf(nonceCounter.getAndIncrement());
    }

    protected static String keyOf(String address) throws Exception {
        return Addresses.keyOf(address);
    }

    protected static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    /**
     * Creates an INACTIVE campaign governed by the scripted hooks.
     */
    protected Campaign createScriptedCampaign() throws Exception {
        return flywheelService.createCampaign(newAddress(), ScriptedCampaignHooks.ADDRESS, newNonce(), new byte[0]);
    }

    /**
     * Creates a scripted campaign, activates it and funds its vault.
     */
    protected String createActiveCampaign(String asset, long funding) throws Exception {
        Campaign campaign = createScriptedCampaign();
        flywheelService.updateStatus(newAddress(), campaign.getAddress(), CampaignStatus.ACTIVE, new byte[0]);
        if (funding > 0) {
            depositService.deposit(campaign.getAddress(), asset, amount(funding));
        }
        return campaign.getAddress();
    }

    protected BigInteger balanceOf(String holder, String asset) throws Exception {
        return depositService.getBalance(holder, asset);
    }
}
