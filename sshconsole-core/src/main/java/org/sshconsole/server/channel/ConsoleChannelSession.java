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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.sshd.common.Closeable;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.channel.BufferedIoOutputStream;
import org.apache.sshd.common.channel.Channel;
import org.apache.sshd.common.channel.ChannelAsyncOutputStream;
import org.apache.sshd.common.channel.RequestHandler;
import org.apache.sshd.common.io.IoInputStream;
import org.apache.sshd.common.io.IoOutputStream;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.buffer.Buffer;
import org.apache.sshd.common.util.buffer.ByteArrayBuffer;
import org.apache.sshd.server.Environment;
import org.apache.sshd.server.ExitCallback;
import org.apache.sshd.server.channel.ChannelDataReceiver;
import org.apache.sshd.server.channel.ChannelSession;
import org.apache.sshd.server.command.AsyncCommand;
import org.sshconsole.server.command.CommandChannel;
import org.sshconsole.server.command.CommandHandler;
import org.sshconsole.server.command.CommandRunner;

/**
 * A {@code session} channel serving the console protocol: environment variables and a single {@code exec} request
 * are handed to a {@link CommandHandler}, interactive requests are refused and any input fails the channel.
 */
public class ConsoleChannelSession extends ChannelSession implements CommandChannel {
    public static final String AGENT_FORWARDING_REQUEST = "auth-agent-req";
    public static final String OPENSSH_AGENT_FORWARDING_REQUEST = "auth-agent-req@openssh.com";
    public static final String PTY_REQUEST = "pty-req";
    public static final String X11_REQUEST = "x11-req";

    private final CommandHandler handler;
    private BufferedIoOutputStream stdout;
    private BufferedIoOutputStream stderr;

    public ConsoleChannelSession(CommandRunner runner) {
        handler = new CommandHandler(runner, this, this);
        // installed before any exec so that early data is rejected as well
        setDataReceiver(new InputRejectingReceiver());
    }

    public CommandHandler getCommandHandler() {
        return handler;
    }

    @Override
    public void handleWindowAdjust(Buffer buffer) throws IOException {
        super.handleWindowAdjust(buffer);
        if (asyncErr != null) {
            asyncErr.onWindowExpanded();
        }
    }

    @Override
    protected Closeable getInnerCloseable() {
        return builder()
                .parallel(stdout, stderr)
                .close(super.getInnerCloseable())
                .build();
    }

    @Override
    protected RequestHandler.Result handleInternalRequest(
            String requestType, boolean wantReply, Buffer buffer)
            throws IOException {
        switch (requestType) {
            case Channel.CHANNEL_SHELL:
            case Channel.CHANNEL_SUBSYSTEM:
            case PTY_REQUEST:
            case X11_REQUEST:
            case AGENT_FORWARDING_REQUEST:
            case OPENSSH_AGENT_FORWARDING_REQUEST:
                handler.handleUnsupportedRequest(requestType);
                return RequestHandler.Result.ReplyFailure;
            default:
                return super.handleInternalRequest(requestType, wantReply, buffer);
        }
    }

    @Override
    protected RequestHandler.Result handleEnvParsed(String name, String value) throws IOException {
        return handler.handleEnvironment(name, value)
                ? RequestHandler.Result.ReplySuccess
                : RequestHandler.Result.ReplyFailure;
    }

    @Override
    protected RequestHandler.Result handleExecParsed(String request, String commandLine) throws IOException {
        if (handler.getState() != CommandHandler.State.AWAITING_EXEC) {
            log.warn("handleExecParsed({}) command rejected in state={}", this, handler.getState());
            return RequestHandler.Result.ReplyFailure;
        }

        commandInstance = new ExecCommand(commandLine);
        return prepareChannelCommand(request, commandInstance);
    }

    @Override
    protected void doWriteExtendedData(byte[] data, int off, long len) throws IOException {
        if (isClosing()) {
            return;
        }

        // thrown from here the failure would take down the whole session
        handler.handleExtendedData(len);
        close(true);
    }

    @Override
    public void writeOutput(byte[] data) throws IOException {
        write(resolveStdout(), data);
    }

    @Override
    public void writeError(byte[] data) throws IOException {
        write(resolveStderr(), data);
    }

    @Override
    public void closeGracefully(int exitStatus) {
        Closeable streams;
        synchronized (this) {
            streams = builder().sequential(stdout, stderr).build();
        }

        streams.close(false).addListener(f -> {
            try {
                closeShell(exitStatus, false);
            } catch (IOException e) {
                warn("closeGracefully({}) failed ({}) to send exit-status={}: {}",
                        this, e.getClass().getSimpleName(), exitStatus, e.getMessage(), e);
                close(true);
            }
        });
    }

    protected void write(IoOutputStream stream, byte[] data) throws IOException {
        if ((data == null) || (data.length <= 0)) {
            return;
        }
        stream.writeBuffer(new ByteArrayBuffer(data));
    }

    protected synchronized IoOutputStream resolveStdout() throws IOException {
        if (stdout == null) {
            ensureOpen();
            if (asyncOut == null) {
                asyncOut = new ChannelAsyncOutputStream(this, SshConstants.SSH_MSG_CHANNEL_DATA);
            }
            stdout = new BufferedIoOutputStream("stdout", getChannelId(), asyncOut, this);
        }
        return stdout;
    }

    protected synchronized IoOutputStream resolveStderr() throws IOException {
        if (stderr == null) {
            ensureOpen();
            if (asyncErr == null) {
                asyncErr = new ChannelAsyncOutputStream(this, SshConstants.SSH_MSG_CHANNEL_EXTENDED_DATA);
            }
            stderr = new BufferedIoOutputStream("stderr", getChannelId(), asyncErr, this);
        }
        return stderr;
    }

    protected void ensureOpen() throws EOFException {
        if (isClosing()) {
            throw new EOFException("Channel closed/closing: " + this);
        }
    }

    protected String resolveUsername() {
        try {
            String username = getSession().getUsername();
            return GenericUtils.isEmpty(username) ? null : username;
        } catch (RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("resolveUsername({}) user not available: {}", this, e.toString());
            }
            return null;
        }
    }

    /**
     * Counts any received data as a protocol violation and acknowledges it so the window stays open until the channel
     * is closed
     */
    protected class InputRejectingReceiver implements ChannelDataReceiver {
        public InputRejectingReceiver() {
            super();
        }

        @Override
        public int data(ChannelSession channel, byte[] buf, int start, int len) throws IOException {
            handler.handleInboundData(len);
            return len;
        }

        @Override
        public void close() throws IOException {
            // nothing to release
        }
    }

    /**
     * Adapts the transport's command lifecycle to the {@link CommandHandler}. The streams are not used - output goes
     * through the channel's buffered streams and input is rejected by the data receiver.
     */
    protected class ExecCommand implements AsyncCommand {
        private final String commandLine;

        public ExecCommand(String commandLine) {
            this.commandLine = commandLine;
        }

        @Override
        public void start(ChannelSession channel, Environment env) throws IOException {
            handler.handleExec(commandLine, resolveUsername());
        }

        @Override
        public void destroy(ChannelSession channel) throws Exception {
            handler.handleChannelClosed();
        }

        @Override
        public void setIoInputStream(IoInputStream in) {
            // input is rejected by the data receiver
        }

        @Override
        public void setIoOutputStream(IoOutputStream out) {
            // ignored
        }

        @Override
        public void setIoErrorStream(IoOutputStream err) {
            // ignored
        }

        @Override
        public void setInputStream(InputStream in) {
            // ignored
        }

        @Override
        public void setOutputStream(OutputStream out) {
            // ignored
        }

        @Override
        public void setErrorStream(OutputStream err) {
            // ignored
        }

        @Override
        public void setExitCallback(ExitCallback callback) {
            // the channel is closed by the handler
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + commandLine + "]";
        }
    }
}
