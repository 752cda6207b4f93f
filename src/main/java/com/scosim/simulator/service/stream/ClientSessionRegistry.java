package com.scosim.simulator.service.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every {@link ClientSession}, in connection order.
 *
 * <p>Once more than {@code maxSessions} are tracked, the oldest half is discarded on the next connect
 * (never the session being created).</p>
 */
public class ClientSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClientSessionRegistry.class);

    private final int maxSessions;
    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final Map<String, ClientSession> sessions = new LinkedHashMap<>();

    public ClientSessionRegistry(int maxSessions, Clock clock) {
        this.maxSessions = maxSessions;
        this.clock = clock;
    }

    public synchronized ClientSession open(String remoteAddress) {
        ClientSession session = new ClientSession("session-" + ids.incrementAndGet(), remoteAddress, clock.instant());
        sessions.put(session.getId(), session);
        if (sessions.size() > maxSessions) {
            evictOldest(session.getId());
        }
        return session;
    }

    private void evictOldest(String keep) {
        int toEvict = sessions.size() / 2;
        List<String> evicted = new ArrayList<>();
        Iterator<String> it = sessions.keySet().iterator();
        while (it.hasNext() && evicted.size() < toEvict) {
            String id = it.next();
            if (!id.equals(keep)) {
                it.remove();
                evicted.add(id);
            }
        }
        logger.warn("Session count above {}, discarded {} oldest sessions", maxSessions, evicted.size());
    }

    public synchronized ClientSession get(String id) {
        return sessions.get(id);
    }

    /**
     * @return the removed session, or null if it was unknown
     */
    public synchronized ClientSession close(String id) {
        return sessions.remove(id);
    }

    public synchronized int size() {
        return sessions.size();
    }
}
