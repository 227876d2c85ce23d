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

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.sshconsole.server.command.CommandRunner;
import org.sshconsole.server.command.Output;

/**
 * Echoes the trimmed command back - {@code exit} says goodbye and asks the application to shut down. The reply is
 * written on a worker thread so the output is retained until it is done.
 */
public class EchoCommandRunner extends AbstractLoggingBean implements CommandRunner {
    public static final String EXIT_COMMAND = "exit";

    private final Executor workers;
    private final Runnable shutdownTrigger;

    public EchoCommandRunner(Executor workers, Runnable shutdownTrigger) {
        this.workers = Objects.requireNonNull(workers, "No workers");
        this.shutdownTrigger = Objects.requireNonNull(shutdownTrigger, "No shutdown trigger");
    }

    @Override
    public void run(String command, Output output, String username, Map<String, String> environment)
            throws IOException {
        String trimmed = (command == null) ? "" : command.trim();
        Output held = output.retain();
        try {
            workers.execute(() -> {
                try {
                    reply(trimmed, held, username);
                } catch (IOException e) {
                    warn("run({})[{}] failed ({}) to reply: {}",
                            trimmed, username, e.getClass().getSimpleName(), e.getMessage(), e);
                } finally {
                    held.close();
                }
            });
        } catch (RejectedExecutionException e) {
            held.close();
            throw e;
        }
    }

    protected void reply(String command, Output output, String username) throws IOException {
        if (EXIT_COMMAND.equals(command)) {
            log.info("reply({}) exit requested", username);
            output.write("Goodbye\r\n");
            shutdownTrigger.run();
        } else {
            output.write("echo: " + command + "\r\n");
        }
    }
}
