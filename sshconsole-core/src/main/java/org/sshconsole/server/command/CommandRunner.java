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

import java.io.IOException;
import java.util.Map;

/**
 * Executes the single command of a channel. Called on a transport thread - long running work should be handed off
 * after {@link Output#retain() retaining} the output.
 */
@FunctionalInterface
public interface CommandRunner {
    /**
     * @param  command     The command line sent with the {@code exec} request
     * @param  output      The channel output. The caller releases its reference once this method returns, which closes
     *                     the channel unless the runner retained it
     * @param  username    The authenticated user name - {@code null} if not known
     * @param  environment Read-only snapshot of the variables sent before the command
     * @throws IOException If failed to write the output
     */
    void run(String command, Output output, String username, Map<String, String> environment) throws IOException;
}
