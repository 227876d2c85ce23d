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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Objects;

import org.apache.sshd.common.config.keys.AuthorizedKeyEntry;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.config.keys.PublicKeyEntryResolver;
import org.apache.sshd.common.util.GenericUtils;

/**
 * The public key a client presented while authenticating, with helpers to check it against OpenSSH
 * {@code authorized_keys} lines.
 */
public class PublicKeyCredential {
    private final PublicKey key;

    public PublicKeyCredential(PublicKey key) {
        this.key = Objects.requireNonNull(key, "No public key");
    }

    public PublicKey getKey() {
        return key;
    }

    /**
     * @return The SSH key type - e.g., {@code ssh-ed25519}
     */
    public String getKeyType() {
        return KeyUtils.getKeyType(key);
    }

    /**
     * @param  line A single {@code authorized_keys} line - an options prefix and a trailing comment are allowed
     * @return      {@code true} if the line holds this key. Malformed lines, comments and keys of other types do not
     *              match
     */
    public boolean matches(String line) {
        AuthorizedKeyEntry entry;
        try {
            entry = AuthorizedKeyEntry.parseAuthorizedKeyEntry(line);
        } catch (RuntimeException e) {
            // sshd reports bad options as IllegalStateException
            return false;
        }

        if ((entry == null) || (!Objects.equals(getKeyType(), entry.getKeyType()))) {
            return false;
        }

        PublicKey candidate;
        try {
            candidate = entry.resolvePublicKey(null, PublicKeyEntryResolver.IGNORING);
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            return false;
        }

        return (candidate != null) && KeyUtils.compareKeys(key, candidate);
    }

    /**
     * @param  contents The {@code authorized_keys} file contents
     * @return          {@code true} if any non-blank line {@link #matches(String) matches}
     */
    public boolean isAuthorized(String contents) {
        if (GenericUtils.isEmpty(contents)) {
            return false;
        }

        for (String line : contents.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (matches(trimmed)) {
                return true;
            }
        }

        return false;
    }

    /**
     * @param  file        An {@code authorized_keys} file
     * @return             {@code false} if the file does not exist, otherwise whether it authorizes this key
     * @throws IOException If the file cannot be read
     */
    public boolean isAuthorized(Path file) throws IOException {
        if (!Files.exists(file)) {
            return false;
        }

        return isAuthorized(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return getKeyType() + "[" + KeyUtils.getFingerPrint(key) + "]";
    }
}
