package io.doncoin.indexer.event;

import io.doncoin.indexer.event.ProjectionMutation.IncrementDonationTotal;
import io.doncoin.indexer.event.ProjectionMutation.RecordDonation;
import io.doncoin.indexer.event.ProjectionView.ProposalRef;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class DonationReceivedHandler implements EventHandler<DonationReceivedEvent> {

    private static final int WEI_DECIMALS = 18;

    @Override
    public HandlerResult handle(DonationReceivedEvent event, EventContext context, ProjectionView view) {
        Optional<ProposalRef> proposal = view.findProposal(event.grantId(), context.sessionId());
        if (proposal.isEmpty()) {
            return HandlerResult.inconsistent("Donation for unknown proposal grantId=" + event.grantId());
        }

        ProposalRef target = proposal.get();
        BigDecimal amount = toEther(event);
        RecordDonation donation = new RecordDonation(
            UUID.randomUUID(),
            context.sessionId(),
            target.proposalId(),
            event.donor(),
            event.token(),
            event.roundId(),
            amount,
            context.txHash(),
            context.logIndex(),
            "On-chain donation to Grant " + event.grantId(),
            context.blockTimestamp()
        );
        return new HandlerResult(
            List.of(donation, new IncrementDonationTotal(target.proposalId(), amount)),
            target.proposalId(),
            target.roundId(),
            null
        );
    }

    static BigDecimal toEther(DonationReceivedEvent event) {
        return new BigDecimal(event.amountWei()).movePointLeft(WEI_DECIMALS);
    }
}
