package com.odin.call_signaling_service.enums;

/**
 * Which ordered candidate sequence of a revision subtree a candidate belongs to.
 */
public enum CandidateRole {
    OFFERER("offerer"),
    ANSWERER("answerer");

    private final String key;

    CandidateRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public CandidateRole opposite() {
        return this == OFFERER ? ANSWERER : OFFERER;
    }
}
