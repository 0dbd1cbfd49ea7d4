package org.codelibs.rcmd.model;

import java.util.Objects;

/**
 * A raw interaction row: a user (or an order) touched an item. Ids a path
 * does not need may be null.
 */
public final class InteractionEvent {

    private final Long userID;

    private final Long itemID;

    private final Long orderID;

    public InteractionEvent(final Long userID, final Long itemID,
            final Long orderID) {
        this.userID = userID;
        this.itemID = itemID;
        this.orderID = orderID;
    }

    public static InteractionEvent ofUser(final long userID, final long itemID) {
        return new InteractionEvent(userID, itemID, null);
    }

    public static InteractionEvent ofOrder(final long orderID,
            final long itemID) {
        return new InteractionEvent(null, itemID, orderID);
    }

    public Long getUserID() {
        return userID;
    }

    public Long getItemID() {
        return itemID;
    }

    public Long getOrderID() {
        return orderID;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof InteractionEvent)) {
            return false;
        }
        final InteractionEvent other = (InteractionEvent) obj;
        return Objects.equals(userID, other.userID)
                && Objects.equals(itemID, other.itemID)
                && Objects.equals(orderID, other.orderID);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userID, itemID, orderID);
    }

    @Override
    public String toString() {
        return "InteractionEvent[userID:" + userID + ",itemID:" + itemID
                + ",orderID:" + orderID + ']';
    }
}
