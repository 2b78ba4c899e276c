package com.therian.chatbackend.chat;

import com.therian.chatbackend.shared.ValidationException;

/**
 * Two participant identity ids joined by {@value #SEPARATOR}, lower id first.
 * Client and server derive the same name for the same pair.
 */
public record DirectChannelName(String first, String second) {

    public static final String SEPARATOR = "_";

    public DirectChannelName {
        if (first.compareTo(second) > 0) {
            String tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static DirectChannelName of(String identityA, String identityB) {
        if (isBlank(identityA) || isBlank(identityB) || identityA.equals(identityB)) {
            throw new ValidationException("A direct channel needs two distinct identities");
        }
        return new DirectChannelName(identityA, identityB);
    }

    /**
     * @throws ValidationException unless the value splits into exactly two distinct, non-empty ids
     */
    public static DirectChannelName parse(String raw) {
        if (raw == null) {
            throw new ValidationException("Malformed direct channel id");
        }
        String[] parts = raw.split(SEPARATOR, -1);
        if (parts.length != 2) {
            throw new ValidationException("Malformed direct channel id: " + raw);
        }
        return of(parts[0], parts[1]);
    }

    public boolean includes(String identityId) {
        return first.equals(identityId) || second.equals(identityId);
    }

    public String value() {
        return first + SEPARATOR + second;
    }

    @Override
    public String toString() {
        return value();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
