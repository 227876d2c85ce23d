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

import java.io.IOException;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.apache.sshd.common.keyprovider.KeyPairProvider;
import org.apache.sshd.common.session.Session;
import org.apache.sshd.common.session.SessionListener;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.threads.CloseableExecutorService;
import org.apache.sshd.common.util.threads.ThreadUtils;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.auth.pubkey.CachingPublicKeyAuthenticator;
import org.apache.sshd.server.forward.RejectAllForwardingFilter;
import org.sshconsole.server.auth.AuthenticationDelegate;
import org.sshconsole.server.channel.ConsoleChannelSessionFactory;
import org.sshconsole.server.command.CommandRunnerFactory;

/**
 * An SSH server that only serves the console protocol. Life cycle: {@link State#CREATED} -
 * {@link #listen(CommandRunnerFactory)} - {@link State#LISTENING} - {@link #stop(boolean)} - {@link State#STOPPED}.
 */
public class ConsoleServer extends AbstractLoggingBean {
    public static final String AUTH_POOL_NAME = "sshconsole-auth";

    public enum State {
        CREATED,
        LISTENING,
        STOPPED;
    }

    private final ConsoleServerConfig config;
    private State state = State.CREATED;
    private SshServer sshd;
    private CloseableExecutorService ownedExecutor;

    public ConsoleServer(ConsoleServerConfig config) {
        this.config = Objects.requireNonNull(config, "No configuration");
    }

    public ConsoleServerConfig getConfig() {
        return config;
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Listens using the configured {@link ConsoleServerConfig#getCommandRunnerFactory() factory}
     *
     * @throws IOException If failed to bind
     */
    public void listen() throws IOException {
        CommandRunnerFactory factory = config.getCommandRunnerFactory();
        if (factory == null) {
            throw new IllegalStateException("No command runner factory configured");
        }
        listen(factory);
    }

    /**
     * Binds the server - returns once bound
     *
     * @param  factory               Creates the runner of each channel
     * @throws IOException           If failed to bind
     * @throws IllegalStateException If already listening or stopped
     */
    public synchronized void listen(CommandRunnerFactory factory) throws IOException {
        Objects.requireNonNull(factory, "No command runner factory");
        if (state != State.CREATED) {
            throw new IllegalStateException("Cannot listen - server is " + state);
        }

        Executor executor = config.getAuthExecutor();
        CloseableExecutorService owned = null;
        if (executor == null) {
            owned = ThreadUtils.newCachedThreadPool(AUTH_POOL_NAME);
            executor = owned;
        }

        SshServer server = createSshServer(factory, new AuthenticationDelegate(
                config.getPasswordAuthenticator(), config.getPublicKeyAuthenticator(), executor));
        try {
            server.start();
        } catch (IOException | RuntimeException e) {
            error("listen({}) failed ({}) to bind {}:{}: {}",
                    this, e.getClass().getSimpleName(), config.getHost(), config.getPort(), e.getMessage(), e);
            if (owned != null) {
                owned.shutdownNow();
            }
            throw e;
        }

        sshd = server;
        ownedExecutor = owned;
        state = State.LISTENING;
        log.info("listen({}) listening on {}:{}", this, config.getHost(), server.getPort());
    }

    protected SshServer createSshServer(CommandRunnerFactory factory, AuthenticationDelegate delegate) {
        SshServer server = SshServer.setUpDefaultServer();
        server.setHost(config.getHost());
        server.setPort(config.getPort());
        server.getProperties().putAll(config.getProperties());
        server.setKeyPairProvider(KeyPairProvider.wrap(config.getKeyPairs()));

        server.setUserAuthFactories(delegate.getUserAuthFactories());
        server.setPasswordAuthenticator((config.getPasswordAuthenticator() == null) ? null : delegate);
        server.setPublickeyAuthenticator((config.getPublicKeyAuthenticator() == null)
                ? null
                : new CachingPublicKeyAuthenticator(delegate));
        server.setKeyboardInteractiveAuthenticator(null);
        server.setGSSAuthenticator(null);
        server.setHostBasedAuthenticator(null);

        server.setChannelFactories(Collections.singletonList(new ConsoleChannelSessionFactory(factory)));
        server.setForwardingFilter(RejectAllForwardingFilter.INSTANCE);
        server.addSessionListener(new SessionFailureListener());
        return server;
    }

    /**
     * @return                       The bound port
     * @throws IllegalStateException If not listening
     */
    public synchronized int getPort() {
        if (state != State.LISTENING) {
            throw new IllegalStateException("Not listening - server is " + state);
        }
        return sshd.getPort();
    }

    /**
     * Stops gracefully
     *
     * @return             {@code false} if the server was not listening
     * @throws IOException If failed to stop
     */
    public boolean stop() throws IOException {
        return stop(false);
    }

    /**
     * Closes the listener and all sessions and waits for them to close
     *
     * @param  immediately Whether to abort pending writes
     * @return             {@code false} if the server was not listening
     * @throws IOException If failed to stop
     */
    public boolean stop(boolean immediately) throws IOException {
        SshServer server;
        CloseableExecutorService executor;
        synchronized (this) {
            if (state != State.LISTENING) {
                if (log.isDebugEnabled()) {
                    log.debug("stop({}) not listening - state={}", this, state);
                }
                return false;
            }
            state = State.STOPPED;
            server = sshd;
            executor = ownedExecutor;
            sshd = null;
            ownedExecutor = null;
        }

        log.info("stop({}) immediately={}", this, immediately);
        try {
            server.stop(immediately);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + config.getHost() + ":" + config.getPort() + "]";
    }

    /**
     * Closes any session whose pipeline raised an unhandled exception
     */
    protected class SessionFailureListener implements SessionListener {
        public SessionFailureListener() {
            super();
        }

        @Override
        public void sessionException(Session session, Throwable t) {
            warn("sessionException({}) {}: {}", session, t.getClass().getSimpleName(), t.getMessage(), t);
            session.close(true);
        }
    }
}
