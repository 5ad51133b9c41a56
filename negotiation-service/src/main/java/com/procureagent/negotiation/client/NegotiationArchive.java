package com.procureagent.negotiation.client;

import com.procureagent.common.negotiation.NegotiationSessionView;

/**
 * Hands finished sessions to the persistence store.
 * Implementations MUST be non-blocking and MUST NOT throw: the session manager calls
 * this while holding a session lock.
 */
public interface NegotiationArchive {

    void archive(NegotiationSessionView session);
}
