package com.alertrouter.model.enums;

public enum DestinationType {
    CHAT("chat"),
    EMAIL("email");

    private final String label;

    DestinationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
