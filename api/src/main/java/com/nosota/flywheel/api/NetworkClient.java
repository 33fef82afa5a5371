package com.nosota.flywheel.api;

import com.nosota.flywheel.api.request.DepositRequest;
import com.nosota.flywheel.api.response.BalanceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of NetworkApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link FlywheelClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class NetworkClient implements NetworkApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<BalanceResponse> deposit(DepositRequest request) {
        log.debug("Calling deposit: holder={}, asset={}, amount={}", request.holder(), request.asset(), request.amount());

        return webClient.post()
                .uri("/api/v1/network/deposits")
                .bodyValue(request)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String holder, String asset) {
        log.debug("Calling getBalance: holder={}, asset={}", holder, asset);

        return webClient.get()
                .uri("/api/v1/network/holders/{holder}/assets/{asset}/balance", holder, asset)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }
}
