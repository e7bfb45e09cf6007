package com.vigil.client.transport;

/** Backend operations reachable through the bridge, with their wire message types. */
public enum RequestKind {
    EVENTS("frigate/events/get"),
    EVENT_SUMMARY("frigate/events/summary"),
    EVENT_RETAIN("frigate/event/retain"),
    RECORDINGS_SUMMARY("frigate/recordings/summary"),
    RECORDING_SEGMENTS("frigate/recordings/get");

    private final String wireType;

    RequestKind(String wireType) {
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }
}
