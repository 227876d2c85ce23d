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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.apache.sshd.common.NamedResource;
import org.apache.sshd.server.auth.AsyncAuthException;
import org.apache.sshd.server.session.ServerSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.Mockito;
import org.sshconsole.common.keys.HostKey;
import org.sshconsole.common.keys.PublicKeyCredential;
import org.sshconsole.core.ConsoleModuleProperties;
import org.sshconsole.util.test.BaseConsoleTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

@TestMethodOrder(MethodName.class)
public class AuthenticationDelegateTest extends BaseConsoleTestSupport {
    private ExecutorService executor;

    public AuthenticationDelegateTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5L, TimeUnit.SECONDS), "Executor not terminated");
    }

    @Test
    void supportedMethods() {
        ConsolePasswordAuthenticator password = (u, p, c) -> c.complete(true);
        ConsolePublicKeyAuthenticator publicKey = (u, k, c) -> c.complete(true);

        AuthenticationDelegate both = new AuthenticationDelegate(password, publicKey, executor);
        assertEquals(EnumSet.of(AuthMethod.PASSWORD, AuthMethod.PUBLICKEY), both.getSupportedMethods());
        assertEquals(Arrays.asList("publickey", "password"), names(both));

        AuthenticationDelegate passwordOnly = new AuthenticationDelegate(password, null, executor);
        assertEquals(EnumSet.of(AuthMethod.PASSWORD), passwordOnly.getSupportedMethods());
        assertEquals(Collections.singletonList("password"), names(passwordOnly));

        AuthenticationDelegate none = new AuthenticationDelegate(null, null, executor);
        assertTrue(none.getSupportedMethods().isEmpty(), "Unexpected methods");
        assertTrue(none.getUserAuthFactories().isEmpty(), "Unexpected factories");
    }

    @Test
    void passwordOutcome() throws Exception {
        AuthenticationDelegate delegate = new AuthenticationDelegate(
                (u, p, c) -> c.complete("admin".equals(u) && "secret".equals(p)), null, executor);
        assertEquals(AuthOutcome.SUCCESS, outcome(delegate, AuthRequest.password("admin", "secret")));
        assertEquals(AuthOutcome.FAILURE, outcome(delegate, AuthRequest.password("admin", "wrong")));
    }

    @Test
    void unsupportedMethodNeverReachesDelegate() throws Exception {
        ConsolePasswordAuthenticator password = Mockito.mock(ConsolePasswordAuthenticator.class);
        ConsolePublicKeyAuthenticator publicKey = Mockito.mock(ConsolePublicKeyAuthenticator.class);
        AuthenticationDelegate delegate = new AuthenticationDelegate(password, null, executor);

        CompletableFuture<AuthOutcome> result = delegate.requestReceived(
                AuthRequest.publicKey("user", new PublicKeyCredential(HostKey.generate().getPublicKey())));
        assertTrue(result.isDone(), "Unsupported method not resolved immediately");
        assertEquals(AuthOutcome.UNSUPPORTED, result.get());

        assertEquals(AuthOutcome.UNSUPPORTED,
                outcome(delegate, AuthRequest.of("user", AuthMethod.KEYBOARD_INTERACTIVE)));
        assertEquals(AuthOutcome.UNSUPPORTED, outcome(delegate, AuthRequest.of("user", AuthMethod.NONE)));
        Mockito.verifyNoInteractions(password, publicKey);
    }

    @Test
    void throwingDelegateFails() throws Exception {
        AuthenticationDelegate delegate = new AuthenticationDelegate((u, p, c) -> {
            throw new IllegalStateException(getCurrentTestName());
        }, null, executor);
        assertEquals(AuthOutcome.FAILURE, outcome(delegate, AuthRequest.password("user", "pass")));
    }

    @Test
    void failedCompletion() throws Exception {
        AuthenticationDelegate delegate = new AuthenticationDelegate(
                (u, p, c) -> c.fail(new UnsupportedOperationException(getCurrentTestName())), null, executor);
        assertEquals(AuthOutcome.FAILURE, outcome(delegate, AuthRequest.password("user", "pass")));
    }

    @Test
    void throwAfterCompletionKeepsDecision() throws Exception {
        AuthenticationDelegate delegate = new AuthenticationDelegate((u, p, c) -> {
            c.complete(true);
            c.complete(false);
        }, null, executor);
        assertEquals(AuthOutcome.SUCCESS, outcome(delegate, AuthRequest.password("user", "pass")));
    }

    @Test
    void passwordAnsweredAsynchronously() throws Exception {
        AtomicReference<AuthCompletion> pending = new AtomicReference<>();
        AuthenticationDelegate delegate = new AuthenticationDelegate((u, p, c) -> pending.set(c), null, executor);

        AsyncAuthException async = assertThrows(AsyncAuthException.class,
                () -> delegate.authenticate("user", "pass", null));
        CompletableFuture<Boolean> authed = new CompletableFuture<>();
        async.addListener(authed::complete);

        waitForPending(pending).complete(true);
        assertEquals(Boolean.TRUE, authed.get(5L, TimeUnit.SECONDS));
    }

    @Test
    void passwordAnsweredSynchronouslyWhenAlreadyDecided() throws Exception {
        AuthenticationDelegate delegate = new AuthenticationDelegate((u, p, c) -> c.complete(true), null, Runnable::run);
        assertTrue(delegate.authenticate("user", "pass", null));
    }

    @Test
    void publicKeyWaitsForDecision() throws Exception {
        HostKey userKey = HostKey.generate();
        AuthenticationDelegate delegate = new AuthenticationDelegate(null,
                (u, k, c) -> c.complete(k.matches(userKey.getPublicKeyEntry())), executor);
        assertTrue(delegate.authenticate("user", userKey.getPublicKey(), null), "Own key rejected");
        assertFalse(delegate.authenticate("user", HostKey.generate().getPublicKey(), null), "Other key accepted");
    }

    @Test
    void publicKeyTimeout() throws Exception {
        ServerSession session = Mockito.mock(ServerSession.class);
        Map<String, Object> props = Collections.singletonMap(ConsoleModuleProperties.AUTH_TIMEOUT.getName(), 200L);
        Mockito.when(session.getProperties()).thenReturn(props);

        AuthenticationDelegate delegate = new AuthenticationDelegate(null, (u, k, c) -> {
            // never decides
        }, executor);
        long start = System.nanoTime();
        assertFalse(delegate.authenticate("user", HostKey.generate().getPublicKey(), session));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsed < TimeUnit.SECONDS.toMillis(10L), "Timeout not applied: " + elapsed);
    }

    private static AuthOutcome outcome(AuthenticationDelegate delegate, AuthRequest request) throws Exception {
        return delegate.requestReceived(request).get(5L, TimeUnit.SECONDS);
    }

    private static List<String> names(AuthenticationDelegate delegate) {
        return delegate.getUserAuthFactories().stream()
                .map(NamedResource::getName)
                .collect(Collectors.toList());
    }

    private static AuthCompletion waitForPending(AtomicReference<AuthCompletion> pending) throws InterruptedException {
        for (long remaining = TimeUnit.SECONDS.toMillis(5L); remaining > 0L; remaining -= 10L) {
            AuthCompletion completion = pending.get();
            if (completion != null) {
                return completion;
            }
            Thread.sleep(10L);
        }
        return fail("Delegate not invoked");
    }
}
