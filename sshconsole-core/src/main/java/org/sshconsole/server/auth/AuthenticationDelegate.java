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
package org.sshconsole.server.auth;

import java.security.PublicKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.server.auth.AsyncAuthException;
import org.apache.sshd.server.auth.UserAuthFactory;
import org.apache.sshd.server.auth.password.PasswordAuthenticator;
import org.apache.sshd.server.auth.password.UserAuthPasswordFactory;
import org.apache.sshd.server.auth.pubkey.PublickeyAuthenticator;
import org.apache.sshd.server.auth.pubkey.UserAuthPublicKeyFactory;
import org.apache.sshd.server.session.ServerSession;
import org.sshconsole.common.keys.PublicKeyCredential;
import org.sshconsole.core.ConsoleModuleProperties;

/**
 * Routes the transport's authentication attempts to the configured {@link ConsolePasswordAuthenticator} and
 * {@link ConsolePublicKeyAuthenticator}. The delegates run on the given executor; methods without a delegate are
 * reported as {@link AuthOutcome#UNSUPPORTED} without any callback.
 *
 * <P>
 * Password attempts are answered asynchronously via {@link AsyncAuthException}. Public key attempts block the calling
 * transport thread until the delegate decides (or {@link ConsoleModuleProperties#AUTH_TIMEOUT} expires) since the
 * transport verifies the client's signature only on the synchronous path.
 * </P>
 *
 * <P>
 * <B>Known limitation:</B> while a public key decision is pending the session's I/O thread is held, so a slow
 * {@link ConsolePublicKeyAuthenticator} delays every other session served by that thread for up to
 * {@link ConsoleModuleProperties#AUTH_TIMEOUT}. Keep public key decisions fast or lower the timeout.
 * {@code CachingPublicKeyAuthenticator} limits the wait to once per key and session.
 * </P>
 */
public class AuthenticationDelegate
        extends AbstractLoggingBean
        implements PasswordAuthenticator, PublickeyAuthenticator {

    private final ConsolePasswordAuthenticator passwordAuthenticator;
    private final ConsolePublicKeyAuthenticator publicKeyAuthenticator;
    private final Executor executor;

    public AuthenticationDelegate(ConsolePasswordAuthenticator passwordAuthenticator,
                                  ConsolePublicKeyAuthenticator publicKeyAuthenticator,
                                  Executor executor) {
        this.passwordAuthenticator = passwordAuthenticator;
        this.publicKeyAuthenticator = publicKeyAuthenticator;
        this.executor = Objects.requireNonNull(executor, "No authentication executor");
    }

    public Set<AuthMethod> getSupportedMethods() {
        Set<AuthMethod> methods = EnumSet.noneOf(AuthMethod.class);
        if (passwordAuthenticator != null) {
            methods.add(AuthMethod.PASSWORD);
        }
        if (publicKeyAuthenticator != null) {
            methods.add(AuthMethod.PUBLICKEY);
        }
        return Collections.unmodifiableSet(methods);
    }

    /**
     * @return The transport factories of the {@link #getSupportedMethods() supported methods} - in preference order
     */
    public List<UserAuthFactory> getUserAuthFactories() {
        List<UserAuthFactory> factories = new ArrayList<>(2);
        if (publicKeyAuthenticator != null) {
            factories.add(UserAuthPublicKeyFactory.INSTANCE);
        }
        if (passwordAuthenticator != null) {
            factories.add(UserAuthPasswordFactory.INSTANCE);
        }
        return factories;
    }

    /**
     * @param  request The attempt
     * @return         A future completed with the outcome - never completed exceptionally
     */
    public CompletableFuture<AuthOutcome> requestReceived(AuthRequest request) {
        Objects.requireNonNull(request, "No request");
        switch (request.getMethod()) {
            case PASSWORD:
                if (passwordAuthenticator == null) {
                    return unsupported(request);
                }
                return dispatch(request, completion -> passwordAuthenticator.authenticate(
                        request.getUsername(), request.getPassword(), completion));
            case PUBLICKEY:
                if (publicKeyAuthenticator == null) {
                    return unsupported(request);
                }
                return dispatch(request, completion -> publicKeyAuthenticator.authenticate(
                        request.getUsername(), request.getCredential(), completion));
            default:
                return unsupported(request);
        }
    }

    @Override
    public boolean authenticate(String username, String password, ServerSession session)
            throws AsyncAuthException {
        CompletableFuture<AuthOutcome> outcome = requestReceived(AuthRequest.password(username, password));
        if (outcome.isDone()) {
            return outcome.join().isSuccess();
        }

        AsyncAuthException async = new AsyncAuthException();
        outcome.thenAccept(result -> async.setAuthed(result.isSuccess()));
        throw async;
    }

    @Override
    public boolean authenticate(String username, PublicKey key, ServerSession session) {
        Duration timeout = (session == null)
                ? ConsoleModuleProperties.AUTH_TIMEOUT.getRequiredDefault()
                : ConsoleModuleProperties.AUTH_TIMEOUT.getRequired(session);
        CompletableFuture<AuthOutcome> outcome
                = requestReceived(AuthRequest.publicKey(username, new PublicKeyCredential(key)));
        try {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS).isSuccess();
        } catch (TimeoutException e) {
            log.warn("authenticate({})[{}] no public key decision within {}", session, username, timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("authenticate({})[{}] interrupted while waiting for public key decision", session, username);
            return false;
        } catch (ExecutionException e) {
            // not expected since the outcome future is never completed exceptionally
            warn("authenticate({})[{}] public key decision failed: {}", session, username, e.getMessage(), e);
            return false;
        }
    }

    protected CompletableFuture<AuthOutcome> unsupported(AuthRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("requestReceived({}) no authenticator for method", request);
        }
        return CompletableFuture.completedFuture(AuthOutcome.UNSUPPORTED);
    }

    protected CompletableFuture<AuthOutcome> dispatch(AuthRequest request, Consumer<AuthCompletion> invoker) {
        AuthCompletion completion = new AuthCompletion();
        CompletableFuture<Boolean> result = completion.getResult();
        try {
            executor.execute(() -> {
                try {
                    invoker.accept(completion);
                } catch (RuntimeException | Error e) {
                    warn("requestReceived({}) authenticator failed ({}): {}",
                            request, e.getClass().getSimpleName(), e.getMessage(), e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("requestReceived({}) authenticator not invoked: {}", request, e.getMessage());
            result.completeExceptionally(e);
        }

        return result.handle((authenticated, failure) -> {
            if (failure != null) {
                if (log.isDebugEnabled()) {
                    log.debug("requestReceived({}) failed: {}", request, failure.toString());
                }
                return AuthOutcome.FAILURE;
            }

            AuthOutcome outcome = Boolean.TRUE.equals(authenticated) ? AuthOutcome.SUCCESS : AuthOutcome.FAILURE;
            if (log.isDebugEnabled()) {
                log.debug("requestReceived({}) outcome={}", request, outcome);
            }
            return outcome;
        });
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + getSupportedMethods();
    }
}
