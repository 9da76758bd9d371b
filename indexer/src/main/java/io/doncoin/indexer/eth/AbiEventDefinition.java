package io.doncoin.indexer.eth;

import java.util.List;
import java.util.Locale;

public record AbiEventDefinition(
    String eventName,
    List<AbiEventInput> inputs,
    String signature,
    String topic0
) {
    public AbiEventDefinition {
        inputs = List.copyOf(inputs);
        topic0 = topic0.toLowerCase(Locale.ROOT);
    }

    public List<AbiEventInput> indexedInputs() {
        return inputs.stream().filter(AbiEventInput::indexed).toList();
    }

    public List<AbiEventInput> nonIndexedInputs() {
        return inputs.stream().filter(input -> !input.indexed()).toList();
    }
}
