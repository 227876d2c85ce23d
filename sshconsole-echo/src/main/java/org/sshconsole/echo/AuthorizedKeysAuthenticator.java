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
package org.sshconsole.echo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.sshconsole.common.keys.PublicKeyCredential;
import org.sshconsole.server.auth.AuthCompletion;
import org.sshconsole.server.auth.ConsolePublicKeyAuthenticator;

/**
 * Accepts the keys listed in the process owner's {@code authorized_keys} file. The user name is ignored. The file is
 * read on every attempt, so edits apply without a restart.
 */
public class AuthorizedKeysAuthenticator extends AbstractLoggingBean implements ConsolePublicKeyAuthenticator {
    public static final String AUTHORIZED_KEYS_FILENAME = "authorized_keys";

    private final Path file;

    public AuthorizedKeysAuthenticator() {
        this(getDefaultAuthorizedKeysFile());
    }

    public AuthorizedKeysAuthenticator(Path file) {
        this.file = Objects.requireNonNull(file, "No authorized keys file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void authenticate(String username, PublicKeyCredential credential, AuthCompletion completion) {
        boolean authorized;
        try {
            authorized = credential.isAuthorized(file);
        } catch (IOException e) {
            warn("authenticate({})[{}] failed ({}) to read {}: {}",
                    username, credential, e.getClass().getSimpleName(), file, e.getMessage(), e);
            completion.fail(e);
            return;
        }

        if (log.isDebugEnabled()) {
            log.debug("authenticate({})[{}] authorized={}", username, credential, authorized);
        }
        completion.complete(authorized);
    }

    /**
     * @return {@code ~/.ssh/authorized_keys}
     */
    public static Path getDefaultAuthorizedKeysFile() {
        return PublicKeyEntry.getDefaultKeysFolderPath().resolve(AUTHORIZED_KEYS_FILENAME);
    }
}
