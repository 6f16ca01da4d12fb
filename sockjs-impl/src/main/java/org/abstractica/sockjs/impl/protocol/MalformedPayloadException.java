package org.abstractica.sockjs.impl.protocol;

/**
 * Thrown when inbound client text cannot be decoded into message payloads.
 */
public class MalformedPayloadException extends IllegalArgumentException
{
    public MalformedPayloadException(String message)
    {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
