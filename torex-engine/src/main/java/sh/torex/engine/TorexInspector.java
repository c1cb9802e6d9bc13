// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.torex.core.types.Address;

/**
 * Renders {@link Torex#debugCurrentDetails()} as JSON for operators.
 */
public final class TorexInspector {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TorexInspector() {
    }

    public static String toJson(final Torex torex) {
        final TorexDetails details = torex.debugCurrentDetails();
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("address", details.address().value());
        root.put("inToken", details.inToken().value());
        root.put("outToken", details.outToken().value());
        root.put("timestamp", details.timestamp());
        root.put("lastLiquidityMovedTime", details.lastLiquidityMovedTime());
        root.put("controllerInternalErrorCounter", details.controllerInternalErrorCounter());
        root.put("availableInTokens", details.availableInTokens().toString());
        root.put("outTokenDistributionPoolTotalUnits", details.outTokenDistributionPoolTotalUnits().toString());

        final ObjectNode fee = root.putObject("feeDistribution");
        fee.put("requestedFlowRate", details.feeDistributionState().requestedFlowRate().toString());
        fee.put("actualFlowRate", details.feeDistributionState().actualFlowRate().toString());
        fee.put("buffer", details.feeDistributionState().buffer().toString());

        final ObjectNode traders = root.putObject("traders");
        final Map<String, TraderState> sorted = new TreeMap<>();
        for (Map.Entry<Address, TraderState> e : details.traders().entrySet()) {
            sorted.put(e.getKey().value(), e.getValue());
        }
        sorted.forEach((trader, state) -> {
            final ObjectNode node = traders.putObject(trader);
            node.put("contribFlowRate", state.contribFlowRate().toString());
            node.put("feeFlowRate", state.feeFlowRate().toString());
        });

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render Torex details", e);
        }
    }
}
