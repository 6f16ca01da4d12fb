package org.abstractica.sockjs;

/**
 * Reason sent to the peer when a session or connection is closed.
 *
 * <p>Numbers follow the SockJS protocol and RFC 6455 close codes.</p>
 */
public enum CloseCode
{
    /**
     * The transport dropped abnormally while the session was running.
     */
    INTERRUPTED(1002, "Connection interrupted"),

    /**
     * The session was closed by the application or the peer.
     */
    GO_AWAY(3000, "Go away!"),

    /**
     * Another connection is still attached to the session.
     */
    ALREADY_OPEN(2010, "Another connection still open"),

    /**
     * The broker failed while serving the connection.
     */
    INTERNAL_ERROR(1011, "Internal error"),

    /**
     * Inbound text could not be decoded.
     */
    INVALID_PAYLOAD(1007, "Broken JSON encoding");

    private final int code;
    private final String reason;

    CloseCode(int code, String reason)
    {
        this.code = code;
        this.reason = reason;
    }

    /**
     * Returns the numeric close code.
     *
     * @return the code sent on the wire
     */
    public int getCode()
    {
        return code;
    }

    /**
     * Returns the human readable reason.
     *
     * @return the reason sent on the wire
     */
    public String getReason()
    {
        return reason;
    }

    /**
     * Looks up a close code by its number.
     *
     * @param code the numeric code
     * @return the close code
     * @throws IllegalArgumentException if the number is unknown
     */
    public static CloseCode fromCode(int code)
    {
        for (CloseCode cc : values())
        {
            if (cc.code == code)
            {
                return cc;
            }
        }
        throw new IllegalArgumentException("Unknown close code: " + code);
    }
}
