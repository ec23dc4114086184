package com.chainexplorer.ingestion.adapter;

import com.chainexplorer.common.ExactAmounts;
import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.TxType;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.NodeNotFoundException;
import com.chainexplorer.ingestion.error.NodeUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the node's block JSON ({"header": {...}, "txs": [...]}) to domain documents.
 * Numbers are read as BigInteger/BigDecimal so amounts stay exact.
 */
public class NodeBlockParser {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader exactReader;
    private final BlockHashing hashing;

    public NodeBlockParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.exactReader = objectMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.hashing = new BlockHashing(objectMapper);
    }

    /**
     * @param json           response body
     * @param expectedHeight height that was requested, or null for latest/by-hash lookups
     */
    public NodeBlock parse(String json, Long expectedHeight) {
        JsonNode root = readTree(json);
        if (root == null || root.isNull() || root.isMissingNode() || (root.isObject() && root.isEmpty())) {
            throw new NodeNotFoundException("Empty block payload for height " + expectedHeight);
        }
        JsonNode header = root.path("header");
        if (!header.isObject() || !header.path("height").canConvertToLong()) {
            throw new DataIntegrityFaultException("Block payload without header height", expectedHeight);
        }
        long height = header.path("height").asLong();
        if (expectedHeight != null && height != expectedHeight) {
            throw new DataIntegrityFaultException(
                    "Node returned height " + height + " for requested height " + expectedHeight, expectedHeight);
        }

        ChainBlock block = new ChainBlock();
        block.setHeight(height);
        block.setHash(firstText(root.path("hash"), header.path("hash")));
        if (block.getHash() == null) {
            block.setHash(hashing.blockHash(header));
        }
        block.setPrevHash(header.path("prev_hash").asText(""));
        block.setTimestamp(header.path("timestamp").asLong(0));
        block.setChainId(header.path("chain_id").asText(""));
        block.setProposerAddress(header.path("proposer_address").asText(""));
        block.setTxRoot(header.path("tx_root").asText(""));
        block.setStateRoot(header.path("state_root").asText(""));
        block.setComputeRoot(textOrNull(header.path("compute_root")));
        block.setGasUsed(header.path("gas_used").asLong(0));
        block.setGasLimit(header.path("gas_limit").asLong(0));
        block.setZkStateProofHash(textOrNull(header.path("zk_state_proof_hash")));
        block.setZkComputeProofHash(textOrNull(header.path("zk_compute_proof_hash")));
        block.setPqSignature(textOrNull(root.path("pq_signature")));
        block.setPqSigSchemeId(intOrNull(root.path("pq_sig_scheme_id")));

        List<ChainTransaction> transactions = new ArrayList<>();
        JsonNode txs = root.path("txs");
        if (txs.isArray()) {
            for (int i = 0; i < txs.size(); i++) {
                transactions.add(parseTransaction(txs.get(i), height, i));
            }
        }
        block.setTxCount(transactions.size());
        return new NodeBlock(block, transactions);
    }

    private ChainTransaction parseTransaction(JsonNode node, long height, int index) {
        ChainTransaction tx = new ChainTransaction();
        try {
            tx.setTxType(TxType.fromWire(textOrNull(node.path("tx_type"))));
            tx.setAmount(amount(node.path("amount")));
            tx.setFee(amount(node.path("fee")));
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityFaultException(
                    "Invalid transaction " + index + " in block " + height + ": " + e.getMessage(), height, e);
        }
        String hash = textOrNull(node.path("hash"));
        tx.setHash(hash != null ? hash : hashing.transactionHash(node));
        tx.setBlockHeight(height);
        tx.setTxIndex(index);
        tx.setFromAddress(node.path("from_address").asText(""));
        tx.setToAddress(textOrNull(node.path("to_address")));
        tx.setNonce(node.path("nonce").asLong(0));
        tx.setGasPrice(longOrNull(node.path("gas_price")));
        tx.setGasLimit(longOrNull(node.path("gas_limit")));
        tx.setGasUsed(longOrNull(node.path("gas_used")));
        tx.setSignature(node.path("signature").asText(""));
        tx.setPubKey(node.path("pub_key").asText(""));
        JsonNode payload = node.path("payload");
        if (payload.isObject() && !payload.isEmpty()) {
            tx.setPayload(objectMapper.convertValue(payload, PAYLOAD_TYPE));
        }
        return tx;
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return exactReader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new NodeUnavailableException("Unparsable block payload", e);
        }
    }

    private static BigInteger amount(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return BigInteger.ZERO;
        }
        if (node.isBigInteger() || node.isIntegralNumber()) {
            BigInteger value = node.bigIntegerValue();
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Negative amount: " + value);
            }
            return value;
        }
        return ExactAmounts.parseNonNegative(node.asText());
    }

    private static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String text = textOrNull(node);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static Long longOrNull(JsonNode node) {
        return node.canConvertToLong() ? node.asLong() : null;
    }

    private static Integer intOrNull(JsonNode node) {
        return node.isIntegralNumber() && node.canConvertToInt() ? node.asInt() : null;
    }
}
