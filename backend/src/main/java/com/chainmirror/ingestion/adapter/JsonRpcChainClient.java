package com.chainmirror.ingestion.adapter;

import com.chainmirror.common.HexQuantity;
import com.chainmirror.ingestion.config.ChainRpcProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChainClient} over EVM JSON-RPC: eth_getBlockByNumber / eth_getBlockByHash (full transactions) and
 * eth_getTransactionReceipt. One attempt per call with a short timeout; the local rate limiter caps request rate.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonRpcChainClient implements ChainClient {

    private final EvmRpcClient rpcClient;
    @Qualifier("chainRpcEndpointRotator")
    private final RpcEndpointRotator rotator;
    @Qualifier("chainRpcRateLimiter")
    private final RateLimiter chainRpcRateLimiter;
    private final ChainRpcProperties chainRpcProperties;
    private final ObjectMapper objectMapper;

    @Override
    public ChainBlock getLatestBlock() {
        return parseBlock(call("eth_getBlockByNumber", List.of("latest", true)), "latest");
    }

    @Override
    public ChainBlock getBlockByNumber(long number) {
        return parseBlock(call("eth_getBlockByNumber", List.of(HexQuantity.encode(number), true)), String.valueOf(number));
    }

    @Override
    public ChainBlock getBlockByHash(String hash) {
        return parseBlock(call("eth_getBlockByHash", List.of(hash, true)), hash);
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        JsonNode result = call("eth_getTransactionReceipt", List.of(txHash));
        if (result.isNull() || result.isMissingNode()) {
            throw new RpcException("eth_getTransactionReceipt no receipt for " + txHash);
        }
        try {
            List<ReceiptLog> logs = new ArrayList<>();
            for (JsonNode log : result.path("logs")) {
                List<String> topics = new ArrayList<>();
                log.path("topics").forEach(t -> topics.add(t.asText()));
                logs.add(new ReceiptLog(
                        log.path("address").asText(null),
                        topics,
                        log.path("data").asText(null),
                        hexInt(log.path("logIndex").asText(null))));
            }
            return new TransactionReceipt(
                    result.path("transactionHash").asText(txHash),
                    result.path("blockHash").asText(null),
                    HexQuantity.decode(result.path("blockNumber").asText(null)),
                    hexInt(result.path("transactionIndex").asText(null)),
                    result.path("from").asText(null),
                    textOrNull(result.path("to")),
                    "0x1".equals(result.path("status").asText(null)),
                    logs);
        } catch (RuntimeException e) {
            throw new RpcException("Failed to parse eth_getTransactionReceipt for " + txHash, e);
        }
    }

    private ChainBlock parseBlock(JsonNode result, String requested) {
        if (result.isNull() || result.isMissingNode()) {
            throw new RpcException("Block not found: " + requested);
        }
        try {
            List<ChainTransaction> transactions = new ArrayList<>();
            for (JsonNode tx : result.path("transactions")) {
                if (!tx.isObject()) {
                    throw new RpcException("Block " + requested + " returned without full transaction objects");
                }
                transactions.add(new ChainTransaction(
                        tx.path("hash").asText(null),
                        tx.path("from").asText(null),
                        textOrNull(tx.path("to")),
                        hexInt(tx.path("transactionIndex").asText(null))));
            }
            return new ChainBlock(
                    result.path("hash").asText(null),
                    result.path("parentHash").asText(null),
                    HexQuantity.decode(result.path("number").asText(null)),
                    Instant.ofEpochSecond(HexQuantity.decode(result.path("timestamp").asText("0x0"))),
                    transactions);
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException("Failed to parse block " + requested, e);
        }
    }

    private JsonNode call(String method, Object params) {
        String endpoint = rotator.getNextEndpoint();
        long acquireStart = System.nanoTime();
        boolean permitted = chainRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, chainRpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local chain RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params)
                    .timeout(Duration.ofMillis(chainRpcProperties.getRequestTimeoutMs()))
                    .block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed on " + endpoint + ": " + messageOf(e), e);
        }
        if (json == null) {
            throw new RpcException(method + " returned null on " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private static int hexInt(String hex) {
        Long value = HexQuantity.decode(hex);
        return value == null ? 0 : value.intValue();
    }

    private static String textOrNull(JsonNode node) {
        return node.isNull() || node.isMissingNode() ? null : node.asText();
    }

    private static String messageOf(Exception e) {
        if (e.getMessage() == null || e.getMessage().isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getMessage();
    }
}
