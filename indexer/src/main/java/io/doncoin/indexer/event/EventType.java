package io.doncoin.indexer.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * On-chain events that drive a domain projection. Adding a constant here forces a decoder and a
 * handler branch for it, since both switch exhaustively over this type.
 */
public enum EventType {
    GRANT_CREATED("GrantRegistry", "GrantCreated"),
    DONATION_RECEIVED("DonationVault", "DonationReceived");

    private final String contractName;
    private final String eventName;

    EventType(String contractName, String eventName) {
        this.contractName = contractName;
        this.eventName = eventName;
    }

    public String contractName() {
        return contractName;
    }

    public String eventName() {
        return eventName;
    }

    public String qualifiedName() {
        return qualifiedName(contractName, eventName);
    }

    public static String qualifiedName(String contractName, String eventName) {
        return contractName + "." + eventName;
    }

    public static Optional<EventType> resolve(String contractName, String eventName) {
        for (EventType type : values()) {
            if (type.contractName.equals(contractName) && type.eventName.equals(eventName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static List<String> eventNamesFor(String contractName) {
        List<String> names = new ArrayList<>();
        for (EventType type : values()) {
            if (type.contractName.equals(contractName)) {
                names.add(type.eventName);
            }
        }
        return List.copyOf(names);
    }
}
