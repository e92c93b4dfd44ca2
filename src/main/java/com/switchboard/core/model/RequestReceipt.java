package com.switchboard.core.model;

/**
 * Result of sending a {@link CrossSupervisorRequest}.
 *
 * @param sent      true once the durable mirror has been written
 * @param id        store key of the mirrored request
 * @param delivered whether the transport also delivered it directly
 * @param error     failure description when not sent
 */
public record RequestReceipt(boolean sent, String id, boolean delivered, String error) {

    public static RequestReceipt failed(String error) {
        return new RequestReceipt(false, null, false, error);
    }
}
