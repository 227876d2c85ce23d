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
package org.sshconsole.server.channel;

import java.io.IOException;
import java.util.Objects;

import org.apache.sshd.common.channel.Channel;
import org.apache.sshd.common.channel.ChannelFactory;
import org.apache.sshd.common.session.Session;
import org.sshconsole.server.command.CommandRunnerFactory;

/**
 * Creates {@link ConsoleChannelSession}s - each with a fresh runner from the given factory
 */
public class ConsoleChannelSessionFactory implements ChannelFactory {
    public static final String NAME = "session";

    private final CommandRunnerFactory runnerFactory;

    public ConsoleChannelSessionFactory(CommandRunnerFactory runnerFactory) {
        this.runnerFactory = Objects.requireNonNull(runnerFactory, "No command runner factory");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Channel createChannel(Session session) throws IOException {
        return new ConsoleChannelSession(Objects.requireNonNull(runnerFactory.create(), "No command runner created"));
    }
}
