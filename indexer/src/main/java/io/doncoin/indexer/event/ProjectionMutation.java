package io.doncoin.indexer.event;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

public interface ProjectionMutation {

    /**
     * Creates a zero-funded matching pool and an active round backed by it.
     */
    record OpenRound(UUID roundId, UUID matchingPoolId, Instant startDate, Instant endDate) implements ProjectionMutation {
    }

    record UpsertProposal(
        UUID proposalId,
        UUID sessionId,
        long onChainId,
        String title,
        String description,
        String proposerAddress,
        UUID roundId,
        BigDecimal fundingGoal,
        Instant timestamp
    ) implements ProjectionMutation {
    }

    record RecordDonation(
        UUID donationId,
        UUID sessionId,
        UUID proposalId,
        String donorAddress,
        String tokenAddress,
        BigInteger onChainRoundId,
        BigDecimal amount,
        String txHash,
        long logIndex,
        String description,
        Instant donatedAt
    ) implements ProjectionMutation {
    }

    record IncrementDonationTotal(UUID proposalId, BigDecimal amount) implements ProjectionMutation {
    }
}
