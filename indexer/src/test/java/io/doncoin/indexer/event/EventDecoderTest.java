package io.doncoin.indexer.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.doncoin.indexer.eth.EventLog;
import io.doncoin.indexer.support.TestLogs;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventDecoderTest {

    private final EventDecoder decoder = new EventDecoder();

    @Test
    void decode_grantCreated() {
        EventLog eventLog = TestLogs.grantCreated(TestLogs.txHash(1), 0L, 10L, 7L, "{\"title\":\"Water\"}");

        ChainEvent event = decoder.decode(EventType.GRANT_CREATED, eventLog);

        assertThat(event).isEqualTo(new GrantCreatedEvent(7L, TestLogs.OWNER, "{\"title\":\"Water\"}"));
        assertThat(event.type()).isEqualTo(EventType.GRANT_CREATED);
    }

    @Test
    void decode_donationReceived() {
        EventLog eventLog = TestLogs.donation(TestLogs.txHash(2), 3L, 11L, 7L, TestLogs.ether("2.5"));

        DonationReceivedEvent event = (DonationReceivedEvent) decoder.decode(EventType.DONATION_RECEIVED, eventLog);

        assertThat(event.donor()).isEqualTo(TestLogs.DONOR);
        assertThat(event.amountWei()).isEqualTo(new BigInteger("2500000000000000000"));
        assertThat(event.roundId()).isEqualTo(BigInteger.ONE);
        assertThat(event.grantId()).isEqualTo(7L);
    }

    @Test
    void decode_rejectsMissingArgument() {
        Map<String, Object> args = new HashMap<>(TestLogs.donation(TestLogs.txHash(2), 0L, 1L, 7L, BigInteger.TEN).decodedArgs());
        args.remove("amount");
        EventLog eventLog = TestLogs.log("DonationVault", "DonationReceived", TestLogs.DONATION_VAULT, TestLogs.txHash(2), 0L, 1L, args);

        assertThatThrownBy(() -> decoder.decode(EventType.DONATION_RECEIVED, eventLog))
            .isInstanceOf(EventDecodeException.class)
            .hasMessageContaining("amount");
    }

    @Test
    void decode_rejectsGrantIdOverflow() {
        Map<String, Object> args = new HashMap<>(TestLogs.grantCreated(TestLogs.txHash(3), 0L, 1L, 1L, "{}").decodedArgs());
        args.put("id", BigInteger.TWO.pow(70));
        EventLog eventLog = TestLogs.log("GrantRegistry", "GrantCreated", TestLogs.GRANT_REGISTRY, TestLogs.txHash(3), 0L, 1L, args);

        assertThatThrownBy(() -> decoder.decode(EventType.GRANT_CREATED, eventLog))
            .isInstanceOf(EventDecodeException.class)
            .hasMessageContaining("does not fit BIGINT");
    }

    @Test
    void decode_rejectsUndecodedPayload() {
        EventLog eventLog = new EventLog(
            "GrantRegistry",
            "GrantCreated",
            TestLogs.GRANT_REGISTRY,
            TestLogs.txHash(4),
            0L,
            1L,
            "0x01",
            null,
            Map.of(),
            "Invalid data"
        );

        assertThatThrownBy(() -> decoder.decode(EventType.GRANT_CREATED, eventLog))
            .isInstanceOf(EventDecodeException.class)
            .hasMessageContaining("Invalid data");
    }
}
