package org.abstractica.sockjs.impl.transport;

/**
 * Outcome of writing one frame to a transport.
 */
public enum SendResult
{
    /**
     * The frame was written; keep sending.
     */
    CONTINUE,

    /**
     * The transport cannot carry more frames and must be released.
     */
    STOP
}
