package com.nosota.flywheel.tests;

import com.nosota.flywheel.TestBase;
import com.nosota.flywheel.api.model.FlywheelEventType;
import com.nosota.flywheel.hooks.Payout;
import com.nosota.flywheel.hooks.PayoutInstructions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Balances stay consistent while deposits and payouts hit the same holdings concurrently.
 */
public class ConcurrentBalanceTest extends TestBase {

    private static final int ROUNDS = 40;

    @Test
    @DisplayName("CON-001: Concurrent deposits and sends neither create nor lose funds")
    public void concurrentDepositsAndSends_ShouldConserveBalances() throws Exception {
        String campaign = createActiveCampaign(TOKEN, 10000);
        String recipient = newAddress();
        depositService.deposit(recipient, TOKEN, amount(1));
        scriptedHooks.scriptSends(PayoutInstructions.withoutFees(List.of(new Payout(recipient, amount(1), null))));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < ROUNDS; i++) {
                futures.add(CompletableFuture.runAsync(
                        task(() -> depositService.deposit(campaign, TOKEN, amount(1))), executor));
                futures.add(CompletableFuture.runAsync(
                        task(() -> flywheelService.send(newAddress(), campaign, TOKEN, new byte[0])), executor));
                futures.add(CompletableFuture.runAsync(
                        task(() -> depositService.deposit(recipient, TOKEN, amount(1))), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(120, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
        }

        assertThat(flywheelService.getVaultBalance(campaign, TOKEN)).isEqualTo(amount(10000));
        assertThat(balanceOf(recipient, TOKEN)).isEqualTo(amount(1 + 2 * ROUNDS));
        assertThat(eventRepository.findByCampaignAndTypeOrderByIdAsc(campaign, FlywheelEventType.PAYOUT_SENT))
                .hasSize(ROUNDS);
    }

    private interface ThrowingTask {
        void run() throws Exception;
    }

    private static Runnable task(ThrowingTask task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        };
    }
}
