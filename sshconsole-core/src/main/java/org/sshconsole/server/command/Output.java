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

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Text sink of a command channel. The sink is reference counted: it starts with a single reference, every
 * {@link #retain()} adds one and every {@link #close()} drops one. Dropping the last reference flushes what was written
 * and closes the channel. Lines should be terminated with {@code "\r\n"}.
 */
public class Output implements Closeable {
    private final CommandChannel channel;
    private final Charset charset;
    private final Runnable onRelease;
    private final AtomicInteger references = new AtomicInteger(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Output(CommandChannel channel, Charset charset, Runnable onRelease) {
        this.channel = Objects.requireNonNull(channel, "No channel");
        this.charset = Objects.requireNonNull(charset, "No charset");
        this.onRelease = Objects.requireNonNull(onRelease, "No release callback");
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * @param  text         Text for the standard output
     * @throws EOFException If the output has been released
     * @throws IOException  If the channel rejected the data
     */
    public void write(String text) throws IOException {
        channel.writeOutput(encode(text));
    }

    /**
     * @param  text         Text for the standard error
     * @throws EOFException If the output has been released
     * @throws IOException  If the channel rejected the data
     */
    public void writeError(String text) throws IOException {
        channel.writeError(encode(text));
    }

    /**
     * Adds a reference, typically before handing the output to another thread
     *
     * @return                       This instance
     * @throws IllegalStateException If the output has already been released
     */
    public Output retain() {
        for (int count = references.get(); !closed.get(); count = references.get()) {
            if (count <= 0) {
                break;
            }
            if (references.compareAndSet(count, count + 1)) {
                return this;
            }
        }
        throw new IllegalStateException("Output already released");
    }

    /**
     * Drops one reference. Dropping the last one closes the channel, extra calls have no effect.
     */
    @Override
    public void close() {
        for (int count = references.get(); count > 0; count = references.get()) {
            if (references.compareAndSet(count, count - 1)) {
                if ((count == 1) && closed.compareAndSet(false, true)) {
                    onRelease.run();
                }
                return;
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Marks the output closed without the release callback - used when the channel is closed by other means
     */
    void invalidate() {
        closed.set(true);
        references.set(0);
    }

    protected byte[] encode(String text) throws EOFException {
        if (isClosed()) {
            throw new EOFException("Output closed");
        }
        return (text == null) ? new byte[0] : text.getBytes(charset);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[refs=" + references.get() + ", closed=" + isClosed() + "]";
    }
}
