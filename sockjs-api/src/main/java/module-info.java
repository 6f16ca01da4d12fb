/**
 * SockJS session broker API module.
 *
 * <p>Provides the application-facing interfaces for sessions that survive
 * across physical connections, and the seam the HTTP layer uses to hand
 * WebSocket connections to the broker.</p>
 */
module sockjs.api
{
    exports org.abstractica.sockjs;
    exports org.abstractica.sockjs.handlers;
}
