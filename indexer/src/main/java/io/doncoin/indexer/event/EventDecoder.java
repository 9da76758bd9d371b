package io.doncoin.indexer.event;

import io.doncoin.indexer.eth.EventLog;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class EventDecoder {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");

    public ChainEvent decode(EventType type, EventLog eventLog) {
        if (!eventLog.decoded()) {
            throw new EventDecodeException(type.qualifiedName() + " payload not decodable: " + eventLog.decodeError());
        }
        Map<String, Object> args = eventLog.decodedArgs();
        return switch (type) {
            case GRANT_CREATED -> new GrantCreatedEvent(
                uintAsLong(args, "id"),
                address(args, "owner"),
                string(args, "metadata")
            );
            case DONATION_RECEIVED -> new DonationReceivedEvent(
                address(args, "donor"),
                address(args, "token"),
                uint(args, "amount"),
                uint(args, "roundId"),
                uintAsLong(args, "grantId")
            );
        };
    }

    private BigInteger uint(Map<String, Object> args, String name) {
        Object value = require(args, name);
        if (!(value instanceof BigInteger number)) {
            throw new EventDecodeException(name + " must be an integer, got " + value.getClass().getSimpleName());
        }
        if (number.signum() < 0) {
            throw new EventDecodeException(name + " must be unsigned: " + number);
        }
        return number;
    }

    private long uintAsLong(Map<String, Object> args, String name) {
        BigInteger value = uint(args, name);
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new EventDecodeException(name + " does not fit BIGINT: " + value, e);
        }
    }

    private String address(Map<String, Object> args, String name) {
        Object value = require(args, name);
        String address = value.toString().trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS_PATTERN.matcher(address).matches()) {
            throw new EventDecodeException(name + " is not an address: " + value);
        }
        return address;
    }

    private String string(Map<String, Object> args, String name) {
        Object value = require(args, name);
        if (!(value instanceof String text)) {
            throw new EventDecodeException(name + " must be a string");
        }
        return text;
    }

    private Object require(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            throw new EventDecodeException("Missing argument: " + name);
        }
        return value;
    }
}
