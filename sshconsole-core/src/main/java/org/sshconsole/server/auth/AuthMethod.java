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

import org.apache.sshd.common.NamedResource;

/**
 * The SSH user authentication methods (RFC 4252 and extensions) a client may request
 */
public enum AuthMethod implements NamedResource {
    PASSWORD("password"),
    PUBLICKEY("publickey"),
    KEYBOARD_INTERACTIVE("keyboard-interactive"),
    HOSTBASED("hostbased"),
    GSSAPI_WITH_MIC("gssapi-with-mic"),
    NONE("none");

    private final String name;

    AuthMethod(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }
}
