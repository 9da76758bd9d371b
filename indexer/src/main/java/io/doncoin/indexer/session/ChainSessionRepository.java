package io.doncoin.indexer.session;

public interface ChainSessionRepository {

    /**
     * Inserts {@code candidate} unless a session with the same address and deployment block hash
     * exists, and returns the stored row either way.
     */
    SessionResolution getOrCreate(ChainSession candidate);
}
