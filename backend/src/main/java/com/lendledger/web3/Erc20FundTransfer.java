package com.lendledger.web3;

import com.lendledger.transfer.FundTransfer;
import com.lendledger.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * ERC-20 {@code transfer(address,uint256)} signed with the platform key.
 *
 * The call is simulated first with eth_call; a revert or a {@code false} return value is reported
 * as {@code false} without sending. The real transaction is sent once (never retried) and
 * succeeds only when its receipt status is OK.
 */
@Slf4j
public class Erc20FundTransfer implements FundTransfer {

    private static final long RECEIPT_POLL_MS = 1_000L;

    private final Web3ClientFactory factory;
    private final String network;
    private final long chainId;
    private final Credentials credentials;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;
    private final int receiptAttempts;

    public Erc20FundTransfer(Web3ClientFactory factory, String network, long chainId, String privateKey,
                             BigInteger gasPrice, BigInteger gasLimit, long receiptTimeoutSeconds) {
        this.factory = factory;
        this.network = network;
        this.chainId = chainId;
        this.credentials = Credentials.create(privateKey);
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
        this.receiptAttempts = (int) Math.max(1, receiptTimeoutSeconds * 1000 / RECEIPT_POLL_MS);
    }

    @Override
    public boolean transfer(String token, String to, BigInteger amount) {
        Function fn = new Function("transfer",
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {}));
        String data = FunctionEncoder.encode(fn);

        if (!simulate(token, data, fn)) {
            log.error("[erc20] simulation of transfer {} {} -> {} failed", amount, token, to);
            return false;
        }

        return factory.executeOnce(network, web3 -> {
            try {
                RawTransactionManager tm = new RawTransactionManager(web3, credentials, chainId);
                EthSendTransaction sent = tm.sendTransaction(gasPrice, gasLimit, token, data, BigInteger.ZERO);
                if (sent.hasError()) {
                    log.error("[erc20] send failed token={} to={}: {}", token, to, sent.getError().getMessage());
                    return false;
                }
                TransactionReceipt receipt = new PollingTransactionReceiptProcessor(web3, RECEIPT_POLL_MS, receiptAttempts)
                        .waitForTransactionReceipt(sent.getTransactionHash());
                log.info("[erc20] tx={} token={} to={} amount={} status={}",
                        receipt.getTransactionHash(), token, to, amount, receipt.getStatus());
                return receipt.isStatusOK();
            } catch (IOException | TransactionException e) {
                throw new IllegalStateException("erc20 transfer " + amount + " " + token + " -> " + to
                        + " did not complete: " + e.getMessage(), e);
            }
        });
    }

    private boolean simulate(String token, String data, Function fn) {
        return factory.executeWithFailover(network, web3 -> {
            EthCall call;
            try {
                call = web3.ethCall(
                        Transaction.createEthCallTransaction(credentials.getAddress(), token, data),
                        DefaultBlockParameterName.LATEST).send();
            } catch (IOException e) {
                throw new IllegalStateException("connection error on transfer simulation: " + e.getMessage(), e);
            }
            if (call.hasError() && Web3ClientFactory.isRateLimited(call.getError().getMessage())) {
                throw new RetryableRpcException("rate-limited on transfer simulation: " + call.getError().getMessage());
            }
            if (call.isReverted() || call.hasError()) return false;
            List<Type> out = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
            // tokens that return nothing are treated as successful
            return out.isEmpty() || Boolean.TRUE.equals(out.get(0).getValue());
        });
    }
}
