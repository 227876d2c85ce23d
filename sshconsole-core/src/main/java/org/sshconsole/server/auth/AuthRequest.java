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

import org.sshconsole.common.keys.PublicKeyCredential;

/**
 * A single authentication attempt as received from the transport
 */
public final class AuthRequest {
    private final String username;
    private final AuthMethod method;
    private final String password;
    private final PublicKeyCredential credential;

    private AuthRequest(String username, AuthMethod method, String password, PublicKeyCredential credential) {
        this.username = username;
        this.method = Objects.requireNonNull(method, "No method");
        this.password = password;
        this.credential = credential;
    }

    public String getUsername() {
        return username;
    }

    public AuthMethod getMethod() {
        return method;
    }

    public String getPassword() {
        return password;
    }

    public PublicKeyCredential getCredential() {
        return credential;
    }

    @Override
    public String toString() {
        // never include the password
        return getClass().getSimpleName() + "[" + username + "@" + method.getName() + "]";
    }

    public static AuthRequest password(String username, String password) {
        return new AuthRequest(username, AuthMethod.PASSWORD, Objects.requireNonNull(password, "No password"), null);
    }

    public static AuthRequest publicKey(String username, PublicKeyCredential credential) {
        return new AuthRequest(username, AuthMethod.PUBLICKEY, null, Objects.requireNonNull(credential, "No credential"));
    }

    public static AuthRequest of(String username, AuthMethod method) {
        return new AuthRequest(username, method, null, null);
    }
}
