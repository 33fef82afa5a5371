package com.nosota.flywheel.api;

import com.nosota.flywheel.api.request.DepositRequest;
import com.nosota.flywheel.api.response.BalanceResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Asset network API: external deposits and holder balances.
 *
 * <p>Campaign vaults hold their funds on the network under the campaign address,
 * so a deposit to a campaign address funds that campaign.
 */
@RequestMapping("/api/v1/network")
public interface NetworkApi {

    /**
     * Deposits funds entering from outside the network.
     *
     * @param request Holder, asset and amount
     * @return Holder balance after the deposit
     */
    @PostMapping("/deposits")
    ResponseEntity<BalanceResponse> deposit(@RequestBody @Valid DepositRequest request) throws Exception;

    /**
     * Gets the balance of a holder for one asset.
     *
     * @param holder Holder address
     * @param asset  Asset address, or the native currency sentinel
     * @return Balance response
     */
    @GetMapping("/holders/{holder}/assets/{asset}/balance")
    ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("holder") String holder,
            @PathVariable("asset") String asset) throws Exception;
}
