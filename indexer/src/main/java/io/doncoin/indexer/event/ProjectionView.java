package io.doncoin.indexer.event;

import java.util.Optional;
import java.util.UUID;

public interface ProjectionView {

    /**
     * The earliest-started round with status {@code active}.
     */
    Optional<UUID> findActiveRound();

    Optional<ProposalRef> findProposal(long onChainId, UUID sessionId);

    record ProposalRef(UUID proposalId, UUID roundId) {
    }
}
