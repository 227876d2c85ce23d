/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.sshconsole.server;

import java.util.Collections;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sshconsole.common.keys.HostKey;
import org.sshconsole.server.auth.ConsolePasswordAuthenticator;
import org.sshconsole.util.test.BaseConsoleTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
public class ConsoleServerConfigTest extends BaseConsoleTestSupport {
    private static final ConsolePasswordAuthenticator ACCEPT_ALL = (u, p, c) -> c.complete(true);

    public ConsoleServerConfigTest() {
        super();
    }

    @Test
    void defaults() {
        ConsoleServerConfig config = ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY)
                .passwordAuthenticator(ACCEPT_ALL)
                .build();
        assertEquals(ConsoleServerConfig.DEFAULT_HOST, config.getHost());
        assertEquals(ConsoleServerConfig.DEFAULT_PORT, config.getPort());
        assertEquals(Collections.singletonList(TEST_HOST_KEY), config.getHostKeys());
        assertSame(TEST_HOST_KEY.toKeyPair(), config.getKeyPairs().get(0));
        assertNull(config.getPublicKeyAuthenticator());
        assertNull(config.getAuthExecutor());
    }

    @Test
    void hostKeysKeepOrder() {
        HostKey second = HostKey.generate();
        ConsoleServerConfig config = ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY)
                .hostKey(second)
                .passwordAuthenticator(ACCEPT_ALL)
                .build();
        assertEquals(TEST_HOST_KEY, config.getHostKeys().get(0));
        assertEquals(second, config.getHostKeys().get(1));
        assertThrows(UnsupportedOperationException.class, () -> config.getHostKeys().clear());
    }

    @Test
    void properties() {
        ConsoleServerConfig config = ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY)
                .passwordAuthenticator(ACCEPT_ALL)
                .property("a", "1")
                .property("b", 2)
                .property("a", null)
                .build();
        assertEquals(Collections.singletonMap("b", 2), config.getProperties());
    }

    @Test
    void missingHostKey() {
        assertThrows(IllegalArgumentException.class,
                () -> ConsoleServerConfig.builder().passwordAuthenticator(ACCEPT_ALL).build());
    }

    @Test
    void missingAuthenticator() {
        assertThrows(IllegalArgumentException.class,
                () -> ConsoleServerConfig.builder().hostKey(TEST_HOST_KEY).build());
    }

    @Test
    void invalidPort() {
        assertThrows(IllegalArgumentException.class, () -> ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY).passwordAuthenticator(ACCEPT_ALL).port(65536).build());
        assertThrows(IllegalArgumentException.class, () -> ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY).passwordAuthenticator(ACCEPT_ALL).port(-1).build());
    }

    @Test
    void emptyHost() {
        assertThrows(IllegalArgumentException.class, () -> ConsoleServerConfig.builder()
                .hostKey(TEST_HOST_KEY).passwordAuthenticator(ACCEPT_ALL).host("").build());
    }
}
