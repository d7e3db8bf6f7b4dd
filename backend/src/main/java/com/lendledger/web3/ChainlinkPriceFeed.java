package com.lendledger.web3;

import com.lendledger.valuation.PriceFeed;
import com.lendledger.valuation.PriceQuote;
import com.lendledger.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads a Chainlink-style aggregator: {@code latestRoundData()} and {@code decimals()}.
 * Both calls run against one endpoint inside {@link Web3ClientFactory#executeWithFailover}.
 *
 * A round whose {@code answeredInRound} lags {@code roundId} is reported as unhealthy.
 */
@Slf4j
public class ChainlinkPriceFeed implements PriceFeed {

    private static final Function LATEST_ROUND_DATA = new Function("latestRoundData", Collections.emptyList(),
            Arrays.asList(new TypeReference<Uint80>() {}, new TypeReference<Int256>() {},
                    new TypeReference<Uint256>() {}, new TypeReference<Uint256>() {},
                    new TypeReference<Uint80>() {}));
    private static final Function DECIMALS = new Function("decimals", Collections.emptyList(),
            Collections.singletonList(new TypeReference<Uint8>() {}));

    private final Web3ClientFactory factory;
    private final String network;
    private final String aggregator;

    public ChainlinkPriceFeed(Web3ClientFactory factory, String network, String aggregator) {
        this.factory = factory;
        this.network = network;
        this.aggregator = aggregator;
    }

    @Override
    public PriceQuote latestQuote(String asset) {
        return factory.executeWithFailover(network, web3 -> {
            List<Type> round = call(web3, LATEST_ROUND_DATA);
            List<Type> dec = call(web3, DECIMALS);
            if (round.size() < 5 || dec.isEmpty()) {
                throw new IllegalStateException("malformed aggregator answer from " + aggregator);
            }

            BigInteger roundId = (BigInteger) round.get(0).getValue();
            BigInteger answer = (BigInteger) round.get(1).getValue();
            BigInteger updatedAt = (BigInteger) round.get(3).getValue();
            BigInteger answeredInRound = (BigInteger) round.get(4).getValue();
            int decimals = ((BigInteger) dec.get(0).getValue()).intValueExact();

            log.debug("[chainlink] asset={} aggregator={} answer={} decimals={} updatedAt={}",
                    asset, aggregator, answer, decimals, updatedAt);
            return PriceQuote.builder()
                    .price(answer)
                    .decimals(decimals)
                    .timestamp(updatedAt.longValue())
                    .sourceHealthy(answeredInRound.compareTo(roundId) >= 0 && updatedAt.signum() > 0)
                    .build();
        });
    }

    @Override
    public String name() {
        return "chainlink:" + network;
    }

    private List<Type> call(Web3j web3, Function fn) {
        EthCall call;
        try {
            call = web3.ethCall(
                    Transaction.createEthCallTransaction(null, aggregator, FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new UncheckedIOException("connection error on " + fn.getName() + ": " + e.getMessage(), e);
        }
        if (call.hasError() && Web3ClientFactory.isRateLimited(call.getError().getMessage())) {
            throw new RetryableRpcException("rate-limited on " + fn.getName() + ": " + call.getError().getMessage());
        }
        if (call.isReverted() || call.hasError()) {
            throw new IllegalStateException(fn.getName() + " reverted on " + aggregator
                    + (call.hasError() ? ": " + call.getError().getMessage() : ""));
        }
        List<Type> out = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
        if (out == null || out.isEmpty()) {
            throw new IllegalStateException("empty " + fn.getName() + " answer from " + aggregator);
        }
        return out;
    }
}
