package com.switchboard.core.outreach;

/**
 * Provider answer to a send request.
 */
public record DeliveryReceipt(boolean accepted, String providerMessageId, String error) {

    public static DeliveryReceipt accepted(String providerMessageId) {
        return new DeliveryReceipt(true, providerMessageId, null);
    }

    public static DeliveryReceipt rejected(String error) {
        return new DeliveryReceipt(false, null, error);
    }
}
