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
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.sshconsole.core.ConsoleModuleProperties;
import org.sshconsole.server.command.ConsoleProtocolException.ProtocolViolation;

/**
 * Per channel state machine of the console protocol: any number of {@code env} requests, then exactly one
 * {@code exec}, no input at all. It is driven by the transport adapter and writes through a {@link CommandChannel}.
 */
public class CommandHandler extends AbstractLoggingBean {
    public static final String INPUT_REJECTED_MESSAGE = "Input Not Accepted\r\n";

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_INPUT_REJECTED = 1;

    public enum State {
        AWAITING_EXEC,
        DISPATCHED,
        CLOSED;
    }

    private final CommandRunner runner;
    private final CommandChannel channel;
    private final PropertyResolver resolver;
    private final Map<String, String> environment = new LinkedHashMap<>();
    private State state = State.AWAITING_EXEC;
    private Output output;
    private boolean closeRequested;
    private ConsoleProtocolException protocolFailure;

    public CommandHandler(CommandRunner runner, CommandChannel channel, PropertyResolver resolver) {
        this.runner = Objects.requireNonNull(runner, "No command runner");
        this.channel = Objects.requireNonNull(channel, "No command channel");
        this.resolver = Objects.requireNonNull(resolver, "No property resolver");
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * @return The first protocol violation committed by the client on this channel - {@code null} if none
     */
    public synchronized ConsoleProtocolException getProtocolFailure() {
        return protocolFailure;
    }

    /**
     * @return A copy of the environment gathered so far
     */
    public synchronized Map<String, String> getEnvironment() {
        return new LinkedHashMap<>(environment);
    }

    /**
     * @param  name  Variable name
     * @param  value Variable value
     * @return       {@code true} if the request should be acknowledged
     */
    public boolean handleEnvironment(String name, String value) {
        State current;
        synchronized (this) {
            current = state;
            if (current == State.AWAITING_EXEC) {
                environment.put(name, value);
                return true;
            }
        }

        if (current == State.CLOSED) {
            if (log.isDebugEnabled()) {
                log.debug("handleEnvironment({})[{}] channel closed", channel, name);
            }
            return false;
        }

        LateEnvironmentPolicy policy = ConsoleModuleProperties.LATE_ENV_POLICY.getRequired(resolver);
        if (policy == LateEnvironmentPolicy.REJECT) {
            signalViolation(ProtocolViolation.UNSUPPORTED_REQUEST, "environment " + name + " sent after command");
            return false;
        }

        if (log.isDebugEnabled()) {
            log.debug("handleEnvironment({})[{}] ignored - command already dispatched", channel, name);
        }
        return true;
    }

    /**
     * Runs the command if this is the first {@code exec} of the channel. The handler holds one {@link Output}
     * reference during the call and drops it when the runner returns or throws.
     *
     * @param  command  The command line
     * @param  username The authenticated user - may be {@code null}
     * @return          {@code true} if the command was dispatched
     */
    public boolean handleExec(String command, String username) {
        Map<String, String> snapshot;
        synchronized (this) {
            if (state != State.AWAITING_EXEC) {
                log.warn("handleExec({}) command rejected in state={}", channel, state);
                return false;
            }
            state = State.DISPATCHED;
            snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        }

        if (log.isDebugEnabled()) {
            log.debug("handleExec({})[{}] dispatching command={}", channel, username, command);
        }

        Output out = obtainOutput();
        try {
            runner.run(command, out, username, snapshot);
        } catch (IOException | RuntimeException e) {
            warn("handleExec({})[{}] command={} failed ({}): {}",
                    channel, username, command, e.getClass().getSimpleName(), e.getMessage(), e);
        } finally {
            out.close();
        }
        return true;
    }

    /**
     * Creates the channel's {@link Output}
     *
     * @return                       The output - holding a single reference
     * @throws IllegalStateException If the output was already created
     */
    public synchronized Output obtainOutput() {
        if (output != null) {
            throw new IllegalStateException("Output already obtained for " + channel);
        }

        Charset charset = ConsoleModuleProperties.OUTPUT_CHARSET.getRequired(resolver);
        output = new Output(channel, charset, () -> closeChannel(EXIT_SUCCESS));
        return output;
    }

    /**
     * Input is never accepted: reports the violation on the standard error and closes the channel
     *
     * @param length Number of received bytes
     */
    public void handleInboundData(int length) {
        Output current;
        synchronized (this) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            current = output;
        }

        signalViolation(ProtocolViolation.INPUT_NOT_ACCEPTED, "received " + length + " bytes");
        if (current != null) {
            current.invalidate();
        }

        try {
            channel.writeError(INPUT_REJECTED_MESSAGE.getBytes(ConsoleModuleProperties.OUTPUT_CHARSET.getRequired(resolver)));
        } catch (IOException e) {
            warn("handleInboundData({}) failed ({}) to report rejected input: {}",
                    channel, e.getClass().getSimpleName(), e.getMessage(), e);
        }

        closeChannel(EXIT_INPUT_REJECTED);
    }

    /**
     * Records a request the console does not serve. The channel stays usable.
     *
     * @param  requestType The refused request
     * @return             The recorded failure
     */
    public ConsoleProtocolException handleUnsupportedRequest(String requestType) {
        return signalViolation(ProtocolViolation.UNSUPPORTED_REQUEST, requestType);
    }

    /**
     * Extended data from the client fails the channel at once - no diagnostic, no exit status
     *
     * @param  length Number of received bytes
     * @return        The recorded failure
     */
    public ConsoleProtocolException handleExtendedData(long length) {
        ConsoleProtocolException failure =
                signalViolation(ProtocolViolation.INVALID_DATA_TYPE, "received " + length + " bytes of extended data");
        handleChannelClosed();
        return failure;
    }

    /**
     * The channel is gone - nothing may be written from now on
     */
    public void handleChannelClosed() {
        Output current;
        synchronized (this) {
            state = State.CLOSED;
            closeRequested = true;
            current = output;
        }

        if (current != null) {
            current.invalidate();
        }
    }

    protected ConsoleProtocolException signalViolation(ProtocolViolation violation, String message) {
        ConsoleProtocolException failure = new ConsoleProtocolException(violation, message);
        synchronized (this) {
            if (protocolFailure == null) {
                protocolFailure = failure;
            }
        }

        warn("signalViolation({}) {}: {}", channel, violation, message, failure);
        return failure;
    }

    protected void closeChannel(int exitStatus) {
        synchronized (this) {
            state = State.CLOSED;
            if (closeRequested) {
                return;
            }
            closeRequested = true;
        }

        if (log.isDebugEnabled()) {
            log.debug("closeChannel({}) exit-status={}", channel, exitStatus);
        }
        channel.closeGracefully(exitStatus);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + channel + "]";
    }
}
