package org.abstractica.sockjs;

/**
 * Lifecycle state of a session.
 *
 * <p>States only move forward, with one exception: a {@link #RUNNING}
 * session may detach from its transport and reattach any number of times.
 * {@link #INTERRUPTED} and {@link #CLOSED} are terminal.</p>
 */
public enum SessionState
{
    /**
     * Session exists but no transport has attached yet.
     */
    NEW,

    /**
     * Session is open. A transport may or may not be attached.
     */
    RUNNING,

    /**
     * The transport dropped abnormally. The session cannot be resumed.
     */
    INTERRUPTED,

    /**
     * The session was closed by the application or the peer.
     */
    CLOSED;

    /**
     * Returns whether this state is final.
     *
     * @return true for {@link #INTERRUPTED} and {@link #CLOSED}
     */
    public boolean isTerminal()
    {
        return this == INTERRUPTED || this == CLOSED;
    }
}
