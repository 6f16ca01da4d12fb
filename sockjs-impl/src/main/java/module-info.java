/**
 * SockJS session broker implementation module.
 *
 * <p>Provides the session registry, the frame protocol and the WebSocket
 * transport adapter.</p>
 */
module sockjs.impl
{
    requires sockjs.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;

    exports org.abstractica.sockjs.impl.concurrent;
    exports org.abstractica.sockjs.impl.protocol;
    exports org.abstractica.sockjs.impl.session;
    exports org.abstractica.sockjs.impl.transport;
}
