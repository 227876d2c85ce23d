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
package org.sshconsole.server.command;

import java.util.Objects;

import org.apache.sshd.common.SshException;

/**
 * Describes how a client broke the console protocol on a channel. Recorded by the {@link CommandHandler}, see
 * {@link CommandHandler#getProtocolFailure()}.
 */
public class ConsoleProtocolException extends SshException {
    private static final long serialVersionUID = -2618470365217063942L;

    public enum ProtocolViolation {
        /** The client sent data on the channel */
        INPUT_NOT_ACCEPTED,
        /** The client sent extended data */
        INVALID_DATA_TYPE,
        /** The client sent a request the console does not serve */
        UNSUPPORTED_REQUEST;
    }

    private final ProtocolViolation violation;

    public ConsoleProtocolException(ProtocolViolation violation, String message) {
        super(violation + ": " + message);
        this.violation = Objects.requireNonNull(violation, "No violation");
    }

    public ProtocolViolation getViolation() {
        return violation;
    }
}
