package com.lpradar.chain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One entry of an {@code eth_getLogs} result.
 */
public record LogRecord(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        long logIndex,
        String transactionHash,
        boolean removed
) {

    public String topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }

    static LogRecord fromJson(JsonNode node) {
        List<String> topics = new ArrayList<>();
        for (JsonNode t : node.path("topics")) {
            topics.add(t.asText().toLowerCase(Locale.ROOT));
        }
        return new LogRecord(
                node.path("address").asText("").toLowerCase(Locale.ROOT),
                List.copyOf(topics),
                node.path("data").asText("0x"),
                AbiCodec.hexToLong(node.path("blockNumber").asText("0x0")),
                AbiCodec.hexToLong(node.path("logIndex").asText("0x0")),
                node.path("transactionHash").asText(null),
                node.path("removed").asBoolean(false)
        );
    }
}
