package com.ivamare.ordersession.inventory;

import com.ivamare.ordersession.event.ItemAdded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.projection.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards inventory-relevant events to the {@link InventoryGateway}.
 *
 * <p>Not a projection: a rebuild never replays it, so nothing is deducted twice.
 */
public class InventorySubscriber implements EventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(InventorySubscriber.class);

    public static final String NAME = "inventory";

    private final InventoryGateway gateway;

    public InventorySubscriber(InventoryGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StoredEvent stored) {
        if (stored.event() instanceof ItemAdded added) {
            log.debug("Notifying inventory of item {} x{} on {}", added.itemId(), added.quantity(), stored.streamId());
            gateway.itemAdded(stored.streamId(), added);
        } else if (stored.event() instanceof SessionClosed closed) {
            gateway.sessionClosed(stored.streamId(), closed);
        } else if (stored.event() instanceof SessionVoided voided) {
            gateway.sessionVoided(stored.streamId(), voided);
        }
    }
}
