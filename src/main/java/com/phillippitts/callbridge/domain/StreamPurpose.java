package com.phillippitts.callbridge.domain;

/** What a realtime stream connection is opened for. */
public enum StreamPurpose {
    GREETING("greeting"),
    FUNCTION("function");

    private final String label;

    StreamPurpose(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
