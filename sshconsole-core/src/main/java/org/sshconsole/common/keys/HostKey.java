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
package org.sshconsole.common.keys;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import net.i2p.crypto.eddsa.EdDSAPrivateKey;
import net.i2p.crypto.eddsa.EdDSAPublicKey;
import net.i2p.crypto.eddsa.spec.EdDSANamedCurveTable;
import net.i2p.crypto.eddsa.spec.EdDSAParameterSpec;
import net.i2p.crypto.eddsa.spec.EdDSAPrivateKeySpec;
import net.i2p.crypto.eddsa.spec.EdDSAPublicKeySpec;
import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.apache.sshd.common.util.GenericUtils;

/**
 * A server identity key, kept as an algorithm tag and the raw private key bytes. The single line text form is
 * {@code "<algorithm> <base64-raw-private-key>"}, e.g. {@code "ed25519 IWK76Glc2Dh7BeaSJrErVAndP6QWHZ06Wk9U5aeoaEI="},
 * and is what {@link #parse(String)} accepts and {@link #toString()} produces.
 *
 * <B>Note:</B> the text form contains the private key - do not log it.
 */
public final class HostKey {
    /** The only algorithm tag currently recognized */
    public static final String ED25519 = "ed25519";
    /** Size (bytes) of an Ed25519 private key seed */
    public static final int ED25519_SEED_LENGTH = 32;

    private final String algorithm;
    private final byte[] keyBytes;
    private final KeyPair keyPair;

    private HostKey(String algorithm, byte[] keyBytes, KeyPair keyPair) {
        this.algorithm = algorithm;
        this.keyBytes = keyBytes;
        this.keyPair = keyPair;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * @return A copy of the raw private key bytes
     */
    public byte[] getKeyBytes() {
        return keyBytes.clone();
    }

    /**
     * @return The {@link KeyPair} handed to the SSH transport as host identity
     */
    public KeyPair toKeyPair() {
        return keyPair;
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    /**
     * @return The OpenSSH public key line of this identity - e.g., {@code "ssh-ed25519 AAAAC3Nz..."} - suitable for
     *         a client's {@code known_hosts} file
     */
    public String getPublicKeyEntry() {
        return PublicKeyEntry.toString(getPublicKey());
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(keyBytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof HostKey)) {
            return false;
        }

        HostKey other = (HostKey) obj;
        return Objects.equals(algorithm, other.algorithm)
                && Arrays.equals(keyBytes, other.keyBytes);
    }

    @Override
    public String toString() {
        return algorithm + " " + Base64.getEncoder().encodeToString(keyBytes);
    }

    /**
     * @return A new random {@link #ED25519} host key
     */
    public static HostKey generate() {
        byte[] seed = new byte[ED25519_SEED_LENGTH];
        new SecureRandom().nextBytes(seed);
        try {
            return fromRawKey(ED25519, seed);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed (" + e.getClass().getSimpleName() + ") to generate host key", e);
        }
    }

    /**
     * @param  text                     The {@code "<algorithm> <base64>"} line - surrounding whitespace is ignored as
     *                                  well as anything following the key data
     * @return                          The decoded key
     * @throws NoSuchAlgorithmException If the algorithm tag is not supported
     * @throws InvalidKeySpecException  If the line is malformed or the key data cannot be decoded
     */
    public static HostKey parse(String text) throws GeneralSecurityException {
        String line = GenericUtils.trimToEmpty(text);
        String[] parts = GenericUtils.isEmpty(line) ? GenericUtils.EMPTY_STRING_ARRAY : line.split("\\s+");
        if (parts.length < 2) {
            throw new InvalidKeySpecException("Host key must be formatted as '<algorithm> <base64>'");
        }

        byte[] data;
        try {
            data = Base64.getDecoder().decode(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Malformed base64 data for " + parts[0] + " host key", e);
        }

        return fromRawKey(parts[0], data);
    }

    public static HostKey fromRawKey(String algorithm, byte[] keyBytes) throws GeneralSecurityException {
        if (!ED25519.equals(algorithm)) {
            throw new NoSuchAlgorithmException("Unsupported host key algorithm: " + algorithm);
        }

        int len = (keyBytes == null) ? 0 : keyBytes.length;
        if (len != ED25519_SEED_LENGTH) {
            throw new InvalidKeySpecException(
                    "Bad " + algorithm + " key size: expected=" + ED25519_SEED_LENGTH + ", actual=" + len);
        }

        EdDSAParameterSpec params = EdDSANamedCurveTable.getByName(EdDSANamedCurveTable.ED_25519);
        EdDSAPrivateKey prvKey = new EdDSAPrivateKey(new EdDSAPrivateKeySpec(keyBytes, params));
        EdDSAPublicKey pubKey = new EdDSAPublicKey(new EdDSAPublicKeySpec(prvKey.getAbyte(), params));
        return new HostKey(algorithm, keyBytes.clone(), new KeyPair(pubKey, prvKey));
    }
}
