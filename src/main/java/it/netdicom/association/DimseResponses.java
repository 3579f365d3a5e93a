package it.netdicom.association;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.dimse.DimseMessage;
import it.netdicom.dimse.StatusCategory;

/**
 * Responses to a C-FIND, C-GET or C-MOVE request, read lazily. The last element carries the final status.
 * The association accepts no other request until the final response has been read or the iteration is closed.
 */
public class DimseResponses implements Iterator<DimseMessage>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DimseResponses.class);

    private final Association association;
    private final int contextId;
    private final int messageId;
    private boolean finished;
    private boolean cancelSent;

    DimseResponses(Association association, int contextId, int messageId) {
        this.association = association;
        this.contextId = contextId;
        this.messageId = messageId;
    }

    public int messageId() {
        return messageId;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public DimseMessage next() {
        if (finished) {
            throw new NoSuchElementException("Final response already received for message " + messageId);
        }
        DimseMessage response;
        try {
            response = association.awaitResponse(messageId);
        } catch (RuntimeException e) {
            finish();
            throw e;
        }
        if (StatusCategory.of(response.command().status()).isFinal()) {
            finish();
        }
        return response;
    }

    /** Sends a C-CANCEL; the peer answers with a final status that is still delivered by {@link #next()}. */
    public void cancel() {
        if (finished || cancelSent) {
            return;
        }
        cancelSent = true;
        association.sendCancel(contextId, messageId);
    }

    /** Cancels an unfinished operation and discards its remaining responses. */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        cancel();
        while (!finished) {
            DimseMessage discarded = next();
            logger.debug("Discarding response {} to cancelled message {}", discarded, messageId);
        }
    }

    private void finish() {
        if (!finished) {
            finished = true;
            association.endOperation();
        }
    }
}
