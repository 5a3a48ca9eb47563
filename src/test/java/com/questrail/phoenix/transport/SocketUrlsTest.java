package com.questrail.phoenix.transport;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SocketUrlsTest {

    private static final URI ENDPOINT = URI.create("ws://localhost:4000/socket/websocket");

    @Test
    void noParamsLeavesEndpointUntouched() {
        assertSame(ENDPOINT, SocketUrls.withParams(ENDPOINT, Map.of()));
    }

    @Test
    void paramsAreAppendedInMapOrder() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("token", "abc");
        params.put("vsn", "2.0.0");

        URI url = SocketUrls.withParams(ENDPOINT, params);

        assertEquals("ws://localhost:4000/socket/websocket?token=abc&vsn=2.0.0", url.toString());
    }

    @Test
    void valuesAreFormEncoded() {
        URI url = SocketUrls.withParams(ENDPOINT, Map.of("user name", "a&b=c d"));

        assertEquals("ws://localhost:4000/socket/websocket?user+name=a%26b%3Dc+d", url.toString());
    }

    @Test
    void existingQueryIsKept() {
        URI endpoint = URI.create("wss://example.com/socket/websocket?vsn=1.0.0");

        URI url = SocketUrls.withParams(endpoint, Map.of("token", "t"));

        assertEquals("wss://example.com/socket/websocket?vsn=1.0.0&token=t", url.toString());
    }

    @Test
    void fragmentStaysLast() {
        URI endpoint = URI.create("ws://localhost:4000/socket/websocket#frag");

        URI url = SocketUrls.withParams(endpoint, Map.of("token", "t"));

        assertEquals("ws://localhost:4000/socket/websocket?token=t#frag", url.toString());
    }

    @Test
    void nullValueEncodesAsEmpty() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("flag", null);

        URI url = SocketUrls.withParams(ENDPOINT, params);

        assertEquals("ws://localhost:4000/socket/websocket?flag=", url.toString());
    }
}
