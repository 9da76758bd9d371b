package io.doncoin.indexer.event;

import java.math.BigInteger;
import java.util.Locale;

public record DonationReceivedEvent(
    String donor,
    String token,
    BigInteger amountWei,
    BigInteger roundId,
    long grantId
) implements ChainEvent {

    public DonationReceivedEvent {
        donor = donor.toLowerCase(Locale.ROOT);
        token = token.toLowerCase(Locale.ROOT);
        if (amountWei.signum() < 0) {
            throw new IllegalArgumentException("amountWei must be >= 0");
        }
    }

    @Override
    public EventType type() {
        return EventType.DONATION_RECEIVED;
    }
}
