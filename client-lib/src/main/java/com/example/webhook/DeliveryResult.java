package com.example.webhook;

/**
 * Outcome of a single delivery attempt.
 */
public class DeliveryResult {
    private final boolean delivered;
    private final int statusCode;
    private final String error;

    public DeliveryResult(boolean delivered, int statusCode, String error) {
        this.delivered = delivered;
        this.statusCode = statusCode;
        this.error = error;
    }

    public static DeliveryResult delivered(int statusCode) {
        return new DeliveryResult(true, statusCode, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, -1, error);
    }

    public boolean isDelivered() {
        return delivered;
    }

    /** HTTP status of the response, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "DeliveryResult{delivered=" + delivered + ", statusCode=" + statusCode + ", error=" + error + "}";
    }
}
