package io.doncoin.indexer.eth;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.web3j.crypto.Hash;

public class AbiEventResolver {

    public AbiEventDefinition resolve(JsonNode abiArray, String eventName) {
        if (abiArray == null || !abiArray.isArray()) {
            throw new IllegalArgumentException("ABI root must contain an array");
        }

        JsonNode eventNode = null;
        for (JsonNode node : abiArray) {
            if (!"event".equals(node.path("type").asText())) {
                continue;
            }
            if (!eventName.equals(node.path("name").asText())) {
                continue;
            }
            if (eventNode != null) {
                throw new IllegalArgumentException("Overloaded event not supported: " + eventName);
            }
            eventNode = node;
        }

        if (eventNode == null) {
            throw new IllegalArgumentException("Missing event in ABI: " + eventName);
        }
        // anonymous events carry no topic0, so eth_getLogs cannot select them by signature
        if (eventNode.path("anonymous").asBoolean(false)) {
            throw new IllegalArgumentException("Anonymous event cannot be watched: " + eventName);
        }

        JsonNode inputs = eventNode.path("inputs");
        if (!inputs.isArray()) {
            throw new IllegalArgumentException("Event inputs must be an array for: " + eventName);
        }

        List<AbiEventInput> eventInputs = new ArrayList<>();
        List<String> paramTypes = new ArrayList<>();
        int position = 0;
        for (JsonNode input : inputs) {
            String canonical = canonicalType(input);
            String name = input.path("name").asText("");
            if (name.isBlank()) {
                name = "arg" + position;
            }
            eventInputs.add(new AbiEventInput(name, canonical, input.path("indexed").asBoolean(false)));
            paramTypes.add(canonical);
            position++;
        }

        String signature = eventName + "(" + String.join(",", paramTypes) + ")";
        return new AbiEventDefinition(eventName, eventInputs, signature, Hash.sha3String(signature));
    }

    private String canonicalType(JsonNode inputNode) {
        String type = inputNode.path("type").asText();
        if (!type.startsWith("tuple")) {
            return type;
        }
        JsonNode components = inputNode.path("components");
        if (!components.isArray()) {
            throw new IllegalArgumentException("Tuple type requires components");
        }
        List<String> children = new ArrayList<>();
        for (JsonNode component : components) {
            children.add(canonicalType(component));
        }
        String suffix = type.substring("tuple".length());
        return "(" + String.join(",", children) + ")" + suffix;
    }
}
