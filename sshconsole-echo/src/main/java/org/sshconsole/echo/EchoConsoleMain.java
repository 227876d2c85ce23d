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

import java.security.GeneralSecurityException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.threads.CloseableExecutorService;
import org.apache.sshd.common.util.threads.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sshconsole.common.keys.HostKey;
import org.sshconsole.server.ConsoleServer;
import org.sshconsole.server.ConsoleServerConfig;
import org.sshconsole.server.command.CommandRunnerFactory;

/**
 * Runs an echo console until a client sends {@code exit}. Try it with {@code ssh -p 2525 localhost hello}.
 * <P>
 * Settings (system properties):
 * </P>
 * <UL>
 * <LI>{@value #HOST_KEY_PROP} - the {@code "ed25519 <base64>"} host key. A new one is generated if missing</LI>
 * <LI>{@value #PORT_PROP} - the listen port, {@value #DEFAULT_PORT} by default</LI>
 * </UL>
 */
public final class EchoConsoleMain {
    public static final String HOST_KEY_PROP = "sshconsole.hostkey";
    public static final String PORT_PROP = "sshconsole.port";
    public static final int DEFAULT_PORT = 2525;

    private static final Logger LOG = LoggerFactory.getLogger(EchoConsoleMain.class);

    private EchoConsoleMain() {
        throw new UnsupportedOperationException("No instance");
    }

    public static HostKey resolveHostKey(String value) throws GeneralSecurityException {
        if (GenericUtils.isNotEmpty(value)) {
            return HostKey.parse(value);
        }

        HostKey key = HostKey.generate();
        LOG.warn("No host key set - generated {}, use -D{}=\"{}\" to keep it", key.getPublicKeyEntry(), HOST_KEY_PROP, key);
        return key;
    }

    public static ConsoleServerConfig createConfig(HostKey hostKey, int port, Executor workers, Runnable onExit) {
        return ConsoleServerConfig.builder()
                .port(port)
                .hostKey(hostKey)
                .passwordAuthenticator(TrivialPasswordAuthenticator.INSTANCE)
                .publicKeyAuthenticator(new AuthorizedKeysAuthenticator())
                .commandRunnerFactory(CommandRunnerFactory.of(new EchoCommandRunner(workers, onExit)))
                .build();
    }

    public static void main(String[] args) throws Exception {
        HostKey hostKey = resolveHostKey(System.getProperty(HOST_KEY_PROP));
        int port = Integer.getInteger(PORT_PROP, DEFAULT_PORT);

        CountDownLatch terminate = new CountDownLatch(1);
        CloseableExecutorService workers = ThreadUtils.newCachedThreadPool("echo-worker");
        try {
            ConsoleServer console = new ConsoleServer(createConfig(hostKey, port, workers, terminate::countDown));
            console.listen();
            terminate.await();
            console.stop();
        } finally {
            workers.shutdownNow();
        }

        LOG.info("Echo is done.");
    }
}
