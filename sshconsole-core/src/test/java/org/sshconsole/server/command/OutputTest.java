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
package org.sshconsole.server.command;

import java.io.EOFException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sshconsole.util.test.BaseConsoleTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class OutputTest extends BaseConsoleTestSupport {
    private RecordingCommandChannel channel;
    private AtomicInteger releases;
    private Output output;

    public OutputTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        channel = new RecordingCommandChannel();
        releases = new AtomicInteger();
        output = new Output(channel, StandardCharsets.UTF_8, releases::incrementAndGet);
    }

    @Test
    void writesBothStreams() throws Exception {
        output.write("hello\r\n");
        output.writeError("oops\r\n");
        output.write("café\r\n");
        assertEquals("hello\r\ncafé\r\n", channel.getOut());
        assertEquals("oops\r\n", channel.getErr());
    }

    @Test
    void singleReferenceReleasedOnce() throws Exception {
        assertFalse(output.isClosed(), "Closed before release");
        output.close();
        assertTrue(output.isClosed(), "Not closed after release");
        assertEquals(1, releases.get(), "Mismatched release count");

        output.close();
        output.close();
        assertEquals(1, releases.get(), "Extra release not ignored");
    }

    @Test
    void retainedOutputOutlivesFirstRelease() throws Exception {
        assertSame(output, output.retain());
        output.close();
        assertFalse(output.isClosed(), "Closed while retained");
        output.write("late\r\n");

        output.close();
        assertTrue(output.isClosed(), "Not closed after last release");
        assertEquals(1, releases.get());
        assertEquals("late\r\n", channel.getOut());
    }

    @Test
    void writeAfterReleaseFails() {
        output.close();
        assertThrows(EOFException.class, () -> output.write("too late"));
        assertThrows(EOFException.class, () -> output.writeError("too late"));
        assertEquals(Collections.emptyList(), channel.getEvents());
    }

    @Test
    void retainAfterReleaseFails() {
        output.close();
        assertThrows(IllegalStateException.class, output::retain);
    }

    @Test
    void invalidatedOutputSkipsReleaseCallback() {
        output.invalidate();
        assertTrue(output.isClosed());
        output.close();
        assertEquals(0, releases.get(), "Release callback invoked for invalidated output");
    }
}
