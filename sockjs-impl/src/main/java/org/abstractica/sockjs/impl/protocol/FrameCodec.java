package org.abstractica.sockjs.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes frames to, and decodes client messages from, SockJS WebSocket text.
 *
 * <p>Server to client:</p>
 * <pre>
 * h                 heartbeat
 * o                 open
 * a["msg"]          single message
 * a["m1","m2"]      message batch
 * c[3000,"Go away!"] close
 * </pre>
 *
 * <p>Client to server text is a JSON array of strings. A bare JSON string
 * is accepted as a single message.</p>
 */
public final class FrameCodec
{
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private FrameCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes a frame as WebSocket text.
     *
     * @param frame the frame to encode
     * @return encoded text
     * @throws IllegalArgumentException for {@link Frame.MessageBlob}, which has no text form
     */
    public static String encode(Frame frame)
    {
        if (frame instanceof Frame.Heartbeat)
        {
            return "h";
        }
        if (frame instanceof Frame.Open)
        {
            return "o";
        }
        if (frame instanceof Frame.Message message)
        {
            return "a[" + quote(message.payload()) + "]";
        }
        if (frame instanceof Frame.MessageBatch batch)
        {
            return "a" + write(batch.payloads());
        }
        if (frame instanceof Frame.Close close)
        {
            return "c[" + close.code().getCode() + "," + quote(close.code().getReason()) + "]";
        }
        throw new IllegalArgumentException("Frame has no text encoding: " + frame.getClass().getSimpleName());
    }

    // ========== Decoding ==========

    /**
     * Decodes inbound client text into message payloads.
     *
     * <p>Empty text, and a bracketed text of two characters or fewer, yield
     * no payloads.</p>
     *
     * @param text the received text
     * @return payloads in order, possibly empty
     * @throws MalformedPayloadException if the text is not a JSON string or array of strings
     */
    public static List<String> decode(String text)
    {
        if (text.isEmpty())
        {
            return List.of();
        }
        if (text.charAt(0) == '[' && text.length() <= 2)
        {
            return List.of();
        }

        JsonNode node;
        try
        {
            node = MAPPER.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new MalformedPayloadException("Broken JSON encoding", e);
        }

        if (node == null || node.isMissingNode())
        {
            throw new MalformedPayloadException("No JSON content");
        }
        if (node.isTextual())
        {
            return List.of(node.textValue());
        }
        if (!node.isArray())
        {
            throw new MalformedPayloadException("Expected a JSON array of strings, got " + node.getNodeType());
        }

        List<String> payloads = new ArrayList<>(node.size());
        for (JsonNode element : node)
        {
            if (!element.isTextual())
            {
                throw new MalformedPayloadException("Expected a string element, got " + element.getNodeType());
            }
            payloads.add(element.textValue());
        }
        return payloads;
    }

    private static String quote(String value)
    {
        return write(value);
    }

    private static String write(Object value)
    {
        try
        {
            return MAPPER.writeValueAsString(value);
        }
        catch (JsonProcessingException e)
        {
            throw new UncheckedIOException(e);
        }
    }
}
