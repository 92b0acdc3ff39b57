package com.odin.call_signaling_service.enums;

public enum DescriptionKind {
    OFFER("offer"),
    ANSWER("answer");

    private final String type;

    DescriptionKind(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }
}
