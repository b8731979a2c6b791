/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link EntitlementContract} reached through {@code eth_call} on a JSON-RPC node.
 * Every call is bounded by the configured timeout.
 */
@Slf4j
public class Web3EntitlementContract implements EntitlementContract {

    private static final List<String> MISSING_ENTITLEMENT_MARKERS = List.of(
            "nonexistent",
            "invalid token",
            // selector of ERC721NonexistentToken(uint256)
            "0x7e273289");

    private final Web3j web3j;
    private final String contractAddress;
    private final Duration timeout;

    public Web3EntitlementContract(Web3j web3j, String contractAddress, Duration timeout) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
        this.timeout = timeout;
    }

    @Override
    public String ownerOf(BigInteger entitlementId) {
        var function = new Function(
                "ownerOf",
                List.of(new Uint256(entitlementId)),
                List.of(new TypeReference<Address>() {
                }));
        return ((Address) call(function)).getValue();
    }

    @Override
    public boolean isUsed(BigInteger entitlementId) {
        var function = new Function(
                "isTicketUsed",
                List.of(new Uint256(entitlementId)),
                List.of(new TypeReference<Bool>() {
                }));
        return ((Bool) call(function)).getValue();
    }

    @Override
    public BigInteger latestBlockNumber() {
        return await(web3j.ethBlockNumber().sendAsync(), "eth_blockNumber").getBlockNumber();
    }

    @SuppressWarnings("rawtypes")
    private Type call(Function function) {
        var transaction = Transaction.createEthCallTransaction(null, contractAddress, FunctionEncoder.encode(function));
        EthCall response = await(web3j.ethCall(transaction, DefaultBlockParameterName.LATEST).sendAsync(), function.getName());

        if (response.hasError() || response.isReverted()) {
            var reason = revertReason(response);
            throw new LedgerCallException(
                    String.format("Call of %s on %s failed: %s", function.getName(), contractAddress, reason),
                    isMissingEntitlement(reason));
        }

        List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (decoded.isEmpty()) {
            throw new LedgerCallException(
                    String.format("Call of %s returned no value, is %s the entitlement contract?", function.getName(), contractAddress),
                    false);
        }
        return decoded.get(0);
    }

    private <T extends Response<?>> T await(CompletableFuture<T> future, String callName) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LedgerCallException(String.format("%s did not answer within %s", callName, timeout), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerCallException(String.format("%s was interrupted", callName), e);
        } catch (ExecutionException e) {
            throw new LedgerCallException(String.format("%s could not be sent: %s", callName, e.getCause().getMessage()), e.getCause());
        }
    }

    private static String revertReason(EthCall response) {
        if (response.hasError()) {
            var error = response.getError();
            return error.getData() == null ? error.getMessage() : error.getMessage() + " " + error.getData();
        }
        return response.getRevertReason();
    }

    static boolean isMissingEntitlement(String reason) {
        if (reason == null) {
            return false;
        }
        var normalized = reason.toLowerCase(Locale.ROOT);
        return MISSING_ENTITLEMENT_MARKERS.stream().anyMatch(normalized::contains);
    }
}
