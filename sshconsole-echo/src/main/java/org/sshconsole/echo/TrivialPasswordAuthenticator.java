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

import org.sshconsole.server.auth.AuthCompletion;
import org.sshconsole.server.auth.ConsolePasswordAuthenticator;

/**
 * Demonstration password policy: a single user named {@value #USERNAME} whose password is {@value #PASSWORD}. Not
 * something to deploy.
 */
public class TrivialPasswordAuthenticator implements ConsolePasswordAuthenticator {
    public static final String USERNAME = "password";
    public static final String PASSWORD = "admin";

    public static final TrivialPasswordAuthenticator INSTANCE = new TrivialPasswordAuthenticator();

    public TrivialPasswordAuthenticator() {
        super();
    }

    @Override
    public void authenticate(String username, String password, AuthCompletion completion) {
        completion.complete(USERNAME.equals(username) && PASSWORD.equals(password));
    }
}
