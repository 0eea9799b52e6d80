package org.orchestration.migrator.odx.models;

public enum PortDirection {
    NONE,
    RECEIVE,
    SEND,
    RECEIVE_SEND,
    SEND_RECEIVE;

    /**
     * Derives the communication direction from the two raw port flags.
     * An implemented port is receive-side, a used port is send-side; the signal flag
     * marks the one-way form on the receive side and the request-response form on the send side.
     *
     * @param portModifier Implements or Uses
     * @param signal       the Signal property value
     * @return the derived direction
     */
    public static PortDirection fromDesignerFlags(String portModifier, String signal) {
        boolean isSignal = "True".equalsIgnoreCase(signal);
        if ("Implements".equalsIgnoreCase(portModifier)) {
            return isSignal ? RECEIVE : RECEIVE_SEND;
        }
        if ("Uses".equalsIgnoreCase(portModifier)) {
            return isSignal ? SEND_RECEIVE : SEND;
        }
        return NONE;
    }

    public boolean isTwoWay() {
        return this == RECEIVE_SEND || this == SEND_RECEIVE;
    }
}
