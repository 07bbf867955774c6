package com.sqlshell.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HostAddressTest - 主机地址解析测试
 */
@DisplayName("主机地址解析测试")
class HostAddressTest {

    private static final String PREFIX = "172.17.0.";

    @Test
    @DisplayName("ip:port")
    void testIpAndPort() {
        HostAddress address = HostAddress.parse("10.1.2.3:50001", PREFIX, "50000");

        assertEquals("10.1.2.3", address.getHost());
        assertEquals("50001", address.getPort());
    }

    @Test
    @DisplayName("#x 展开为容器地址")
    void testContainerShorthand() {
        HostAddress address = HostAddress.parse("#2:50000", PREFIX, "50000");

        assertEquals("172.17.0.2", address.getHost());
        assertEquals("50000", address.getPort());
    }

    @Test
    @DisplayName("省略端口时使用默认端口")
    void testDefaultPort() {
        assertEquals("50000", HostAddress.parse("dbhost", PREFIX, "50000").getPort());
        assertEquals("50000", HostAddress.parse("dbhost:", PREFIX, "50000").getPort());
        assertEquals("172.17.0.7", HostAddress.parse(" #7 ", PREFIX, "50000").getHost());
    }
}
