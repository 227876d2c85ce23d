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

/**
 * The channel operations a {@link CommandHandler} needs. Writes are queued and may complete after the call returns.
 */
public interface CommandChannel {
    /**
     * @param  data        Bytes to send on the standard output
     * @throws IOException If the channel can no longer accept data
     */
    void writeOutput(byte[] data) throws IOException;

    /**
     * @param  data        Bytes to send on the standard error (extended data type 1)
     * @throws IOException If the channel can no longer accept data
     */
    void writeError(byte[] data) throws IOException;

    /**
     * Sends all queued data, then the exit status, EOF and close
     *
     * @param exitStatus The exit status reported to the client
     */
    void closeGracefully(int exitStatus);
}
