/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import io.nodesizing.common.InvalidConfigurationException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the key store of the webhook server from the PEM files mounted from the certificate Secret. The private key
 * can be a PKCS#1 key (as issued by cert-manager by default) or a PKCS#8 key.
 */
public class PemKeyStore {
    /**
     * Alias of the server key in the key store
     */
    public static final String ALIAS = "webhook";

    private PemKeyStore() { }

    /**
     * Loads the key store.
     *
     * @param certFile  PEM file with the certificate chain, server certificate first
     * @param keyFile   PEM file with the private key
     * @param password  Password protecting the key entry
     *
     * @return  PKCS12 key store with a single key entry
     *
     * @throws InvalidConfigurationException if the files cannot be read or do not contain the expected PEM objects
     */
    public static KeyStore load(Path certFile, Path keyFile, char[] password) {
        try {
            List<Certificate> chain = readCertificates(certFile);
            PrivateKey key = readPrivateKey(keyFile);

            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, password);
            keyStore.setKeyEntry(ALIAS, key, password, chain.toArray(new Certificate[0]));
            return keyStore;
        } catch (IOException | GeneralSecurityException e) {
            throw new InvalidConfigurationException("Failed to load the webhook certificate from " + certFile + " and " + keyFile, e);
        }
    }

    /* test */ static List<Certificate> readCertificates(Path certFile) throws IOException, GeneralSecurityException {
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
        List<Certificate> chain = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(certFile, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder holder) {
                    chain.add(converter.getCertificate(holder));
                }
            }
        }

        if (chain.isEmpty()) {
            throw new InvalidConfigurationException("No certificate found in " + certFile);
        }

        return chain;
    }

    /* test */ static PrivateKey readPrivateKey(Path keyFile) throws IOException {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();

        try (Reader reader = Files.newBufferedReader(keyFile, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object object = parser.readObject();

            if (object instanceof PEMKeyPair keyPair) {
                // PKCS#1 (BEGIN RSA PRIVATE KEY) or SEC1 (BEGIN EC PRIVATE KEY)
                return converter.getKeyPair(keyPair).getPrivate();
            } else if (object instanceof PrivateKeyInfo keyInfo) {
                // PKCS#8 (BEGIN PRIVATE KEY)
                return converter.getPrivateKey(keyInfo);
            } else {
                throw new InvalidConfigurationException("No unencrypted private key found in " + keyFile);
            }
        }
    }
}
