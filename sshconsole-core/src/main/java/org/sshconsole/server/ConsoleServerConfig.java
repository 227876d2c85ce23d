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

import java.security.KeyPair;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.apache.sshd.common.util.ValidateUtils;
import org.sshconsole.common.keys.HostKey;
import org.sshconsole.server.auth.ConsolePasswordAuthenticator;
import org.sshconsole.server.auth.ConsolePublicKeyAuthenticator;
import org.sshconsole.server.command.CommandRunnerFactory;

/**
 * Immutable {@link ConsoleServer} settings - see {@link #builder()}
 */
public final class ConsoleServerConfig {
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 2222;

    private final String host;
    private final int port;
    private final List<HostKey> hostKeys;
    private final ConsolePasswordAuthenticator passwordAuthenticator;
    private final ConsolePublicKeyAuthenticator publicKeyAuthenticator;
    private final CommandRunnerFactory commandRunnerFactory;
    private final Executor authExecutor;
    private final Map<String, Object> properties;

    private ConsoleServerConfig(Builder builder) {
        host = builder.host;
        port = builder.port;
        hostKeys = Collections.unmodifiableList(new ArrayList<>(builder.hostKeys));
        passwordAuthenticator = builder.passwordAuthenticator;
        publicKeyAuthenticator = builder.publicKeyAuthenticator;
        commandRunnerFactory = builder.commandRunnerFactory;
        authExecutor = builder.authExecutor;
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public List<HostKey> getHostKeys() {
        return hostKeys;
    }

    public List<KeyPair> getKeyPairs() {
        List<KeyPair> pairs = new ArrayList<>(hostKeys.size());
        for (HostKey key : hostKeys) {
            pairs.add(key.toKeyPair());
        }
        return pairs;
    }

    public ConsolePasswordAuthenticator getPasswordAuthenticator() {
        return passwordAuthenticator;
    }

    public ConsolePublicKeyAuthenticator getPublicKeyAuthenticator() {
        return publicKeyAuthenticator;
    }

    /**
     * @return The default factory used by {@link ConsoleServer#listen()} - may be {@code null}
     */
    public CommandRunnerFactory getCommandRunnerFactory() {
        return commandRunnerFactory;
    }

    /**
     * @return The executor running the authenticators - {@code null} if the server should create its own
     */
    public Executor getAuthExecutor() {
        return authExecutor;
    }

    /**
     * @return Extra properties set on the SSH server - e.g., the
     *         {@link org.sshconsole.core.ConsoleModuleProperties console properties}
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + host + ":" + port
               + ", hostKeys=" + hostKeys.size()
               + ", password=" + (passwordAuthenticator != null)
               + ", publickey=" + (publicKeyAuthenticator != null)
               + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private final List<HostKey> hostKeys = new ArrayList<>();
        private ConsolePasswordAuthenticator passwordAuthenticator;
        private ConsolePublicKeyAuthenticator publicKeyAuthenticator;
        private CommandRunnerFactory commandRunnerFactory;
        private Executor authExecutor;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private Builder() {
            super();
        }

        public Builder host(String value) {
            host = value;
            return this;
        }

        public Builder port(int value) {
            port = value;
            return this;
        }

        public Builder hostKey(HostKey key) {
            hostKeys.add(Objects.requireNonNull(key, "No host key"));
            return this;
        }

        public Builder hostKeys(Collection<HostKey> keys) {
            for (HostKey key : keys) {
                hostKey(key);
            }
            return this;
        }

        public Builder passwordAuthenticator(ConsolePasswordAuthenticator authenticator) {
            passwordAuthenticator = authenticator;
            return this;
        }

        public Builder publicKeyAuthenticator(ConsolePublicKeyAuthenticator authenticator) {
            publicKeyAuthenticator = authenticator;
            return this;
        }

        public Builder commandRunnerFactory(CommandRunnerFactory factory) {
            commandRunnerFactory = factory;
            return this;
        }

        public Builder authExecutor(Executor executor) {
            authExecutor = executor;
            return this;
        }

        public Builder property(String name, Object value) {
            ValidateUtils.checkNotNullAndNotEmpty(name, "No property name");
            if (value == null) {
                properties.remove(name);
            } else {
                properties.put(name, value);
            }
            return this;
        }

        /**
         * @return                          The configuration
         * @throws IllegalArgumentException If the host is empty, the port out of range, no host key was given or no
         *                                  authenticator was set
         */
        public ConsoleServerConfig build() {
            ValidateUtils.checkNotNullAndNotEmpty(host, "No bind host");
            ValidateUtils.checkTrue((port >= 0) && (port <= 0xFFFF), "Invalid bind port: %d", port);
            ValidateUtils.checkTrue(!hostKeys.isEmpty(), "No host keys");
            ValidateUtils.checkTrue((passwordAuthenticator != null) || (publicKeyAuthenticator != null),
                    "No authenticator - every authentication attempt would fail");
            return new ConsoleServerConfig(this);
        }
    }
}
