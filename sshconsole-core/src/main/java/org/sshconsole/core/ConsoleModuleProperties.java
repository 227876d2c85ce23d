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
package org.sshconsole.core;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.apache.sshd.common.Property;
import org.sshconsole.server.command.LateEnvironmentPolicy;

/**
 * Configurable properties for sshconsole-core. They are resolved through the usual channel, session and server
 * hierarchy, so setting them on the server properties is enough.
 */
public final class ConsoleModuleProperties {

    /**
     * How long a transport thread waits for a public key authenticator to reach a decision. An expired wait counts as a
     * failed attempt.
     */
    public static final Property<Duration> AUTH_TIMEOUT
            = Property.duration("sshconsole-auth-timeout", Duration.ofSeconds(30));

    /**
     * What to do with an {@code env} request that arrives once the command has been dispatched
     */
    public static final Property<LateEnvironmentPolicy> LATE_ENV_POLICY
            = Property.enum_("sshconsole-late-env-policy", LateEnvironmentPolicy.class, LateEnvironmentPolicy.IGNORE);

    /**
     * Charset used to encode the text written to the command output
     */
    public static final Property<Charset> OUTPUT_CHARSET
            = Property.charset("sshconsole-output-charset", StandardCharsets.UTF_8);

    private ConsoleModuleProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
