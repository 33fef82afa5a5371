package com.nosota.flywheel.controller;

import com.nosota.flywheel.api.NetworkApi;
import com.nosota.flywheel.api.request.DepositRequest;
import com.nosota.flywheel.api.response.BalanceResponse;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.service.DepositService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class NetworkController implements NetworkApi {

    private final DepositService depositService;

    @Override
    public ResponseEntity<BalanceResponse> deposit(DepositRequest request) throws Exception {
        BigInteger balance = depositService.deposit(request.holder(), request.asset(), request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new BalanceResponse(
                Addresses.normalize(request.holder()), Addresses.normalize(request.asset()), balance));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String holder, String asset) throws Exception {
        BigInteger balance = depositService.getBalance(holder, asset);
        return ResponseEntity.ok(new BalanceResponse(
                Addresses.normalize(holder), Addresses.normalize(asset), balance));
    }
}
