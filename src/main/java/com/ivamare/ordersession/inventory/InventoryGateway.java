package com.ivamare.ordersession.inventory;

import com.ivamare.ordersession.event.ItemAdded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionVoided;

/**
 * Inventory system notified of session activity. Calls are fire-and-forget:
 * a failure never affects the session, only the delivery retry path.
 */
public interface InventoryGateway {

    void itemAdded(String sessionId, ItemAdded event);

    void sessionClosed(String sessionId, SessionClosed event);

    void sessionVoided(String sessionId, SessionVoided event);
}
