package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.CloseCode;
import org.abstractica.sockjs.Session;
import org.abstractica.sockjs.SessionState;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the Session interface.
 *
 * <p>A thin handle: every operation is posted to the registry, which applies
 * it on the session's shard.</p>
 */
public class DefaultSession implements Session
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSession.class);

    private final SessionRecord record;
    private final DefaultSessionRegistry registry;
    private volatile Object attachment;

    DefaultSession(SessionRecord record, DefaultSessionRegistry registry)
    {
        this.record = Objects.requireNonNull(record, "record");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public String getId()
    {
        return record.getSessionId();
    }

    @Override
    public SessionState getState()
    {
        return record.getState();
    }

    @Override
    public void send(String message)
    {
        if (!trySend(message))
        {
            throw new IllegalStateException("Session " + getId() + " is " + getState());
        }
    }

    @Override
    public boolean trySend(String message)
    {
        Objects.requireNonNull(message, "message");

        if (record.getState().isTerminal())
        {
            LOG.debug("Cannot send on terminated session: {}", getId());
            return false;
        }
        registry.send(getId(), new Frame.Message(message));
        return true;
    }

    @Override
    public void close()
    {
        close(CloseCode.GO_AWAY);
    }

    @Override
    public void close(CloseCode code)
    {
        Objects.requireNonNull(code, "code");
        registry.close(getId(), code);
    }

    @Override
    public Optional<Object> getAttachment()
    {
        return Optional.ofNullable(attachment);
    }

    @Override
    public void setAttachment(Object attachment)
    {
        this.attachment = attachment;
    }

    @Override
    public String toString()
    {
        return "Session[" + getId() + ", " + getState() + "]";
    }
}
