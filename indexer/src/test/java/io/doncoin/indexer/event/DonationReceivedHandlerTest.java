package io.doncoin.indexer.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.doncoin.indexer.event.ProjectionMutation.IncrementDonationTotal;
import io.doncoin.indexer.event.ProjectionMutation.RecordDonation;
import io.doncoin.indexer.event.ProjectionView.ProposalRef;
import io.doncoin.indexer.support.TestLogs;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DonationReceivedHandlerTest {

    private final DonationReceivedHandler handler = new DonationReceivedHandler();
    private final EventContext context = new EventContext(
        UUID.randomUUID(),
        TestLogs.txHash(9),
        4L,
        12L,
        Instant.parse("2025-03-01T00:02:24Z")
    );

    @Mock
    private ProjectionView view;

    @Test
    void handle_recordsDonationAndIncrementsTotal() {
        UUID proposalId = UUID.randomUUID();
        UUID roundId = UUID.randomUUID();
        when(view.findProposal(7L, context.sessionId())).thenReturn(Optional.of(new ProposalRef(proposalId, roundId)));

        HandlerResult result = handler.handle(donation(TestLogs.ether("2.5")), context, view);

        assertThat(result.inconsistent()).isFalse();
        assertThat(result.roundId()).isEqualTo(roundId);
        RecordDonation donation = (RecordDonation) result.mutations().get(0);
        assertThat(donation.amount()).isEqualByComparingTo("2.5");
        assertThat(donation.description()).isEqualTo("On-chain donation to Grant 7");
        assertThat(donation.logIndex()).isEqualTo(4L);
        assertThat(donation.donatedAt()).isEqualTo(context.blockTimestamp());
        IncrementDonationTotal increment = (IncrementDonationTotal) result.mutations().get(1);
        assertThat(increment.proposalId()).isEqualTo(proposalId);
        assertThat(increment.amount()).isEqualByComparingTo("2.5");
    }

    @Test
    void handle_flagsUnknownProposal() {
        when(view.findProposal(7L, context.sessionId())).thenReturn(Optional.empty());

        HandlerResult result = handler.handle(donation(BigInteger.ONE), context, view);

        assertThat(result.inconsistent()).isTrue();
        assertThat(result.warning()).isEqualTo("Donation for unknown proposal grantId=7");
        assertThat(result.mutations()).isEmpty();
    }

    @Test
    void toEther_keepsWeiPrecision() {
        assertThat(DonationReceivedHandler.toEther(donation(BigInteger.ONE)))
            .isEqualByComparingTo("0.000000000000000001");
    }

    @Test
    void toEther_fitsLargestUint256InAmountColumn() {
        BigInteger maxUint256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

        BigDecimal amount = DonationReceivedHandler.toEther(donation(maxUint256));

        assertThat(amount.scale()).isEqualTo(18);
        assertThat(amount.precision() - amount.scale()).isLessThanOrEqualTo(60);
    }

    private DonationReceivedEvent donation(BigInteger amountWei) {
        return new DonationReceivedEvent(TestLogs.DONOR, TestLogs.TOKEN, amountWei, BigInteger.ONE, 7L);
    }
}
