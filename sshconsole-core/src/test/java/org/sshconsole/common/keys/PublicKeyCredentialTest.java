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
package org.sshconsole.common.keys;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;
import org.sshconsole.util.test.BaseConsoleTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class PublicKeyCredentialTest extends BaseConsoleTestSupport {
    private HostKey userKey;
    private HostKey otherKey;
    private PublicKeyCredential credential;

    public PublicKeyCredentialTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        userKey = HostKey.generate();
        otherKey = HostKey.generate();
        credential = new PublicKeyCredential(userKey.getPublicKey());
    }

    @Test
    void keyType() {
        assertEquals("ssh-ed25519", credential.getKeyType());
    }

    @Test
    void matchesOwnEntry() {
        assertTrue(credential.matches(userKey.getPublicKeyEntry()));
        assertTrue(credential.matches(userKey.getPublicKeyEntry() + " user@host"), "Comment not allowed");
    }

    @Test
    void matchesEntryWithOptions() {
        assertTrue(credential.matches("no-pty,no-port-forwarding " + userKey.getPublicKeyEntry() + " user@host"));
    }

    @Test
    void rejectsOtherKey() {
        assertFalse(credential.matches(otherKey.getPublicKeyEntry()));
    }

    @Test
    void rejectsMalformedLines() {
        assertFalse(credential.matches(""), "Empty line");
        assertFalse(credential.matches("# " + userKey.getPublicKeyEntry()), "Comment line");
        assertFalse(credential.matches("ssh-ed25519 %%%%"), "Bad base64");
        assertFalse(credential.matches("ssh-rsa AAAAB3NzaC1yc2EAAAADAQABAAAAgQ"), "Other algorithm");
        assertFalse(credential.matches("complete garbage"), "Garbage");
        assertFalse(credential.matches(",,,, ssh-ed25519 AAAA"), "Empty options");
        assertFalse(credential.matches("no-pty,no-pty ssh-ed25519 AAAA"), "Repeated option");
    }

    @Test
    void malformedLineDoesNotHideLaterEntry() {
        String contents = "no-pty,no-pty ssh-ed25519 AAAA\n"
                          + ",,,, ssh-ed25519 AAAA\n"
                          + userKey.getPublicKeyEntry() + "\n";
        assertTrue(credential.isAuthorized(contents));
    }

    @Test
    void authorizedKeysContents() {
        String contents = otherKey.getPublicKeyEntry() + "\n"
                          + "\n"
                          + "   \n"
                          + "not a key\n"
                          + "  " + userKey.getPublicKeyEntry() + " me@there  \n";
        assertTrue(credential.isAuthorized(contents));
        assertFalse(new PublicKeyCredential(HostKey.generate().getPublicKey()).isAuthorized(contents));
        assertFalse(credential.isAuthorized(""), "Empty contents");
        assertFalse(credential.isAuthorized((String) null), "No contents");
    }

    @Test
    void authorizedKeysFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("authorized_keys");
        assertFalse(credential.isAuthorized(file), "Missing file");

        Files.write(file, (otherKey.getPublicKeyEntry() + "\n" + userKey.getPublicKeyEntry() + "\n")
                .getBytes(StandardCharsets.UTF_8));
        assertTrue(credential.isAuthorized(file));
    }
}
