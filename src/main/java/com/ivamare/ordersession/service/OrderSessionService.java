package com.ivamare.ordersession.service;

import com.ivamare.ordersession.command.AddItem;
import com.ivamare.ordersession.command.ApplyDiscount;
import com.ivamare.ordersession.command.CloseSession;
import com.ivamare.ordersession.command.EnterCustomerInfo;
import com.ivamare.ordersession.command.InitiateSession;
import com.ivamare.ordersession.command.ModifyItem;
import com.ivamare.ordersession.command.RecordPayment;
import com.ivamare.ordersession.command.RemoveItem;
import com.ivamare.ordersession.command.SessionCommand;
import com.ivamare.ordersession.command.VoidSession;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.OrderSessionState;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for changing and reading order sessions.
 *
 * <p>Every command is loaded, decided and appended with the loaded version as the
 * expected version. Version conflicts are retried with a fresh load; validation
 * failures are not.
 *
 * <p>Errors:
 * <ul>
 *   <li>{@link com.ivamare.ordersession.exception.SessionValidationException} - command rejected, log unchanged</li>
 *   <li>{@link com.ivamare.ordersession.exception.ConcurrencyConflictException} - retries exhausted</li>
 *   <li>{@link com.ivamare.ordersession.exception.StorageFailureException} - storage failed or timed out</li>
 * </ul>
 */
public interface OrderSessionService {

    /**
     * Create a new builder for OrderSessionService.
     *
     * @return new builder instance
     */
    static OrderSessionServiceBuilder builder() {
        return new OrderSessionServiceBuilder();
    }

    /**
     * Open a new session, generating its id when the command has none.
     */
    CommandResult initiate(InitiateSession command);

    CommandResult addItem(UUID sessionId, AddItem command);

    CommandResult removeItem(UUID sessionId, RemoveItem command);

    CommandResult modifyItem(UUID sessionId, ModifyItem command);

    CommandResult enterCustomerInfo(UUID sessionId, EnterCustomerInfo command);

    CommandResult applyDiscount(UUID sessionId, ApplyDiscount command);

    CommandResult recordPayment(UUID sessionId, RecordPayment command);

    CommandResult close(UUID sessionId, CloseSession command);

    CommandResult voidSession(UUID sessionId, VoidSession command);

    /**
     * Handle any command against a session.
     *
     * @param sessionId The session
     * @param command The command
     * @return the appended events and new version
     */
    CommandResult execute(UUID sessionId, SessionCommand command);

    /**
     * Current state of a session.
     *
     * @param sessionId The session
     * @return the state, empty (version 0) if the session does not exist
     */
    OrderSessionState load(UUID sessionId);

    /**
     * All events of a session, in order.
     */
    List<StoredEvent> history(UUID sessionId);
}
