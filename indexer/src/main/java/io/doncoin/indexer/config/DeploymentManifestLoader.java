package io.doncoin.indexer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.doncoin.indexer.eth.AbiEventDefinition;
import io.doncoin.indexer.eth.AbiEventResolver;
import io.doncoin.indexer.event.EventType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class DeploymentManifestLoader {

    private static final String DEFAULT_ANCHOR_CONTRACT = "GrantRegistry";
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");

    private final ObjectMapper objectMapper;
    private final AbiEventResolver abiEventResolver;

    public DeploymentManifestLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.abiEventResolver = new AbiEventResolver();
    }

    public DeploymentManifest load(Path manifestPath) {
        try {
            JsonNode root = readJson(manifestPath);
            Path baseDir = manifestPath.toAbsolutePath().getParent();

            String network = root.path("network").asText("unknown");
            String anchorContract = root.path("anchorContract").asText(DEFAULT_ANCHOR_CONTRACT).trim();

            JsonNode contractsNode = root.path("contracts");
            if (!contractsNode.isObject() || contractsNode.isEmpty()) {
                throw new IllegalStateException("Invalid deployment manifest: contracts object is missing");
            }

            Map<String, WatchedContract> contracts = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = contractsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                contracts.put(field.getKey(), loadContract(baseDir, field.getKey(), field.getValue()));
            }

            if (!contracts.containsKey(anchorContract)) {
                throw new IllegalStateException("Anchor contract missing from manifest: " + anchorContract);
            }
            boolean watchesAnything = contracts.values().stream().anyMatch(WatchedContract::isWatched);
            if (!watchesAnything) {
                throw new IllegalStateException("Deployment manifest watches no events");
            }

            return new DeploymentManifest(network, anchorContract, contracts);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load deployment manifest: " + manifestPath, e);
        }
    }

    private WatchedContract loadContract(Path baseDir, String name, JsonNode node) throws IOException {
        String address;
        String abiPath;
        List<String> eventNames;

        if (node.isTextual()) {
            address = node.asText();
            abiPath = "abi/" + name + ".json";
            eventNames = EventType.eventNamesFor(name);
        } else if (node.isObject()) {
            address = node.path("address").asText("");
            abiPath = node.path("abi").asText("abi/" + name + ".json");
            eventNames = node.has("events") ? readStringList(node.path("events"), name) : EventType.eventNamesFor(name);
        } else {
            throw new IllegalStateException("Invalid manifest entry for contract: " + name);
        }

        String normalizedAddress = normalizeAddress(address);
        if (!ADDRESS_PATTERN.matcher(normalizedAddress).matches()) {
            throw new IllegalStateException("Invalid address for contract " + name + ": " + address);
        }

        if (eventNames.isEmpty()) {
            return new WatchedContract(name, normalizedAddress, List.of());
        }

        JsonNode abi = readAbi(baseDir.resolve(abiPath));
        List<AbiEventDefinition> events = new ArrayList<>();
        for (String eventName : eventNames) {
            try {
                events.add(abiEventResolver.resolve(abi, eventName));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid ABI for contract " + name + ": " + e.getMessage(), e);
            }
        }
        return new WatchedContract(name, normalizedAddress, events);
    }

    private JsonNode readAbi(Path path) throws IOException {
        JsonNode root = readJson(path);
        if (root.isArray()) {
            return root;
        }
        // Hardhat artifacts wrap the ABI array
        JsonNode abi = root.path("abi");
        if (!abi.isArray()) {
            throw new IllegalStateException("ABI file has no abi array: " + path);
        }
        return abi;
    }

    private List<String> readStringList(JsonNode node, String contractName) {
        if (!node.isArray()) {
            throw new IllegalStateException("events must be an array for contract: " + contractName);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String value = item.asText("").trim();
            if (value.isEmpty()) {
                throw new IllegalStateException("Blank event name for contract: " + contractName);
            }
            if (!values.contains(value)) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    private JsonNode readJson(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Missing required file: " + path);
        }
        return objectMapper.readTree(Files.readString(path));
    }

    private String normalizeAddress(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }
}
