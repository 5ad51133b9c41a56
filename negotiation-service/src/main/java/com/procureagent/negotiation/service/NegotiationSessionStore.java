package com.procureagent.negotiation.service;

import com.procureagent.common.exception.DuplicateSessionException;
import com.procureagent.common.exception.SessionNotFoundException;
import com.procureagent.negotiation.model.NegotiationSession;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Registry of negotiation sessions by id, plus the single index of which session is
 * currently open for each (item, vendor) pair.
 *
 * <p>The index is guarded by its own lock. Code holding a session lock may call
 * {@link #release}; the store never acquires a session lock while holding the index lock.
 */
public class NegotiationSessionStore {

    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> activeIndex = new HashMap<>();
    private final ReentrantLock indexLock = new ReentrantLock();

    /**
     * Registers a new session and claims its (item, vendor) slot.
     *
     * @param stillOpen decides whether a session already holding the slot blocks the new one;
     *                  must only read volatile state
     * @return the session that held the slot but no longer counted as open, if any
     * @throws DuplicateSessionException when the slot is held by an open session
     */
    public Optional<NegotiationSession> register(NegotiationSession session,
                                                 Predicate<NegotiationSession> stillOpen) {
        String key = session.indexKey();
        indexLock.lock();
        try {
            NegotiationSession holder = Optional.ofNullable(activeIndex.get(key))
                .map(sessions::get)
                .orElse(null);
            if (holder != null && stillOpen.test(holder)) {
                throw new DuplicateSessionException(String.format(
                    "Session %s is already open for item=%s vendor=%s",
                    holder.getId(), session.getItemSku(), session.getVendor().vendorId()));
            }
            sessions.put(session.getId(), session);
            activeIndex.put(key, session.getId());
            return Optional.ofNullable(holder);
        } finally {
            indexLock.unlock();
        }
    }

    /** Frees the (item, vendor) slot if this session still holds it. */
    public void release(NegotiationSession session) {
        indexLock.lock();
        try {
            activeIndex.remove(session.indexKey(), session.getId());
        } finally {
            indexLock.unlock();
        }
    }

    public Optional<NegotiationSession> find(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    public NegotiationSession get(String sessionId) {
        return find(sessionId)
            .orElseThrow(() -> new SessionNotFoundException("No negotiation session with id " + sessionId));
    }

    public Collection<NegotiationSession> all() {
        return List.copyOf(sessions.values());
    }

    boolean holdsSlot(NegotiationSession session) {
        indexLock.lock();
        try {
            return session.getId().equals(activeIndex.get(session.indexKey()));
        } finally {
            indexLock.unlock();
        }
    }
}
