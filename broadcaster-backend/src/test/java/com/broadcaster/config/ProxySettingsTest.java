package com.broadcaster.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetSocketAddress;
import java.net.Proxy;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProxySettings Tests")
class ProxySettingsTest {

    @Nested
    @DisplayName("Colon-separated format")
    class ColonFormat {

        @Test
        @DisplayName("Should parse IP:PORT:USER:PASS")
        void parsesFourParts() {
            var proxy = ProxySettings.parse("10.0.0.5:8080:alice:s3cret").orElseThrow();

            assertEquals("10.0.0.5", proxy.host());
            assertEquals(8080, proxy.port());
            assertEquals("alice", proxy.username());
            assertEquals("s3cret", proxy.password());
            assertTrue(proxy.hasCredentials());
        }

        @Test
        @DisplayName("Should parse IP:PORT without credentials")
        void parsesTwoParts() {
            var proxy = ProxySettings.parse("10.0.0.5:3128").orElseThrow();

            assertEquals(3128, proxy.port());
            assertFalse(proxy.hasCredentials());
        }

        @Test
        @DisplayName("Should reject a non-numeric port")
        void rejectsNonNumericPort() {
            var e = assertThrows(IllegalArgumentException.class,
                () -> ProxySettings.parse("10.0.0.5:80x0:alice:s3cret"));

            assertTrue(e.getMessage().contains("80x0"));
        }

        @Test
        @DisplayName("Should reject three parts")
        void rejectsThreeParts() {
            assertThrows(IllegalArgumentException.class, () -> ProxySettings.parse("10.0.0.5:3128:alice"));
        }
    }

    @Nested
    @DisplayName("URL format")
    class UrlFormat {

        @Test
        @DisplayName("Should parse credentials from URL user info")
        void parsesUrl() {
            var proxy = ProxySettings.parse("http://bob:pw@proxy.example.com:9000").orElseThrow();

            assertEquals("proxy.example.com", proxy.host());
            assertEquals(9000, proxy.port());
            assertEquals("bob", proxy.username());
            assertEquals("pw", proxy.password());
        }

        @Test
        @DisplayName("Should require an explicit port")
        void requiresPort() {
            assertThrows(IllegalArgumentException.class, () -> ProxySettings.parse("http://proxy.example.com"));
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("Should treat blank values as no proxy")
    void blankIsEmpty(String raw) {
        assertTrue(ProxySettings.parse(raw).isEmpty());
    }

    @Test
    @DisplayName("Should build an HTTP proxy and keep the password out of describe()")
    void toProxyAndDescribe() {
        var proxy = ProxySettings.parse("1.2.3.4:8080:user:hunter2").orElseThrow();

        Proxy javaProxy = proxy.toProxy();
        assertEquals(Proxy.Type.HTTP, javaProxy.type());
        assertEquals(8080, ((InetSocketAddress) javaProxy.address()).getPort());
        assertFalse(proxy.describe().contains("hunter2"));
        assertFalse(proxy.toString().contains("hunter2"));
    }
}
