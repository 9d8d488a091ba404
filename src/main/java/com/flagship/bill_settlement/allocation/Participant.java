package com.flagship.bill_settlement.allocation;

import lombok.Value;

/**
 * Someone who owes part of the receipt.
 */
@Value
public class Participant {
    String id;
    String displayName;

    public static Participant of(String id, String displayName) {
        return new Participant(id, displayName);
    }

    public static Participant of(String id) {
        return new Participant(id, id);
    }
}
