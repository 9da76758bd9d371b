package io.doncoin.indexer.eth;

public record AbiEventInput(String name, String type, boolean indexed) {

    public boolean isDynamic() {
        return type.equals("string")
            || type.equals("bytes")
            || type.endsWith("[]")
            || type.startsWith("(");
    }
}
