package com.ivamare.ordersession.command;

/**
 * A request to change an order session. Commands carry caller intent only;
 * validation happens when the aggregate decides on them.
 */
public sealed interface SessionCommand permits
        InitiateSession,
        AddItem,
        RemoveItem,
        ModifyItem,
        EnterCustomerInfo,
        ApplyDiscount,
        RecordPayment,
        CloseSession,
        VoidSession {

    /**
     * Short name used in logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
