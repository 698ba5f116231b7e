package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.Signature;
import java.util.Optional;

/**
 * Signs serialized manifests with a PEM private key (PKCS#8, optionally
 * encrypted, or a traditional OpenSSL key). RSA keys sign with
 * {@code SHA256withRSA}, EC keys with {@code SHA256withECDSA}.
 */
public final class ManifestSigner {

    private static final Logger log = Logger.getLogger(ManifestSigner.class);

    private static final Provider BC = new BouncyCastleProvider();

    private final PrivateKey key;
    private final String algorithm;

    public ManifestSigner(PrivateKey key) {
        this.key = key;
        this.algorithm = switch (key.getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            default -> throw new RepositoryBuildException("Unsupported signing key algorithm: " + key.getAlgorithm());
        };
    }

    /** A signer for the provider's key, or empty when no key file is configured. */
    public static Optional<ManifestSigner> fromProvider(PrivateKeyProvider provider) {
        if (provider.privateKeyFile().isEmpty()) {
            return Optional.empty();
        }
        Path file = provider.privateKeyFile().get();
        log.debugf("loading signing key from %s", file);
        return Optional.of(new ManifestSigner(loadKey(file, provider.passphrase())));
    }

    public String algorithm() {
        return algorithm;
    }

    public byte[] sign(byte[] data) {
        try {
            Signature signature = Signature.getInstance(algorithm, BC);
            signature.initSign(key);
            signature.update(data);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new RepositoryBuildException("Failed to sign manifest", e);
        }
    }

    static PrivateKey loadKey(Path file, char[] passphrase) {
        Object pem;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            pem = parser.readObject();
        } catch (IOException e) {
            throw new RepositoryBuildException("Failed to read private key file " + file, e);
        }
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(BC);
        try {
            if (pem instanceof PKCS8EncryptedPrivateKeyInfo encrypted) {
                PrivateKeyInfo info = encrypted.decryptPrivateKeyInfo(
                        new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(BC).build(passphrase));
                return converter.getPrivateKey(info);
            }
            if (pem instanceof PEMEncryptedKeyPair encrypted) {
                PEMKeyPair pair = encrypted.decryptKeyPair(new JcePEMDecryptorProviderBuilder().setProvider(BC).build(passphrase));
                return converter.getKeyPair(pair).getPrivate();
            }
            if (pem instanceof PEMKeyPair pair) {
                return converter.getKeyPair(pair).getPrivate();
            }
            if (pem instanceof PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
        } catch (PEMException | PKCSException | OperatorCreationException e) {
            throw new RepositoryBuildException("Failed to decrypt private key file " + file, e);
        } catch (IOException e) {
            throw new RepositoryBuildException("Failed to decode private key file " + file, e);
        }
        throw new RepositoryBuildException("No private key found in " + file);
    }
}
