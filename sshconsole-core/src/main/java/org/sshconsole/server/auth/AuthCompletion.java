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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reports the decision of an authenticator. Exactly one of {@link #complete(boolean)} or {@link #fail(Throwable)} may
 * be invoked, from any thread - a second invocation throws {@link IllegalStateException}.
 */
public class AuthCompletion {
    private final CompletableFuture<Boolean> result = new CompletableFuture<>();

    public AuthCompletion() {
        super();
    }

    /**
     * @param  authenticated         Whether the client is accepted
     * @throws IllegalStateException If the attempt has already been resolved
     */
    public void complete(boolean authenticated) {
        if (!result.complete(authenticated)) {
            throw new IllegalStateException("Authentication attempt already resolved");
        }
    }

    /**
     * Resolves the attempt as a failure
     *
     * @param  reason                The failure cause
     * @throws IllegalStateException If the attempt has already been resolved
     */
    public void fail(Throwable reason) {
        if (!result.completeExceptionally(Objects.requireNonNull(reason, "No failure reason"))) {
            throw new IllegalStateException("Authentication attempt already resolved");
        }
    }

    public boolean isDone() {
        return result.isDone();
    }

    CompletableFuture<Boolean> getResult() {
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[done=" + isDone() + "]";
    }
}
