package io.doncoin.indexer.session;

public record SessionResolution(ChainSession session, boolean created) {
}
