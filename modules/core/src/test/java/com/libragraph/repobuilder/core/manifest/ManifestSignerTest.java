package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8EncryptorBuilder;
import org.bouncycastle.operator.OutputEncryptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestSignerTest {

    @TempDir
    Path tmp;

    private KeyPair pair;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        pair = generator.generateKeyPair();
    }

    @Test
    void shouldLoadUnencryptedPkcs8Key() throws Exception {
        Path keyFile = tmp.resolve("key.pem");
        try (Writer w = Files.newBufferedWriter(keyFile); JcaPEMWriter pem = new JcaPEMWriter(w)) {
            pem.writeObject(new JcaPKCS8Generator(pair.getPrivate(), null));
        }

        PrivateKey key = ManifestSigner.loadKey(keyFile, new char[0]);

        assertThat(key.getEncoded()).isEqualTo(pair.getPrivate().getEncoded());
    }

    @Test
    void shouldLoadEncryptedKeyWithPassphraseFile() throws Exception {
        Path keyFile = tmp.resolve("key.pem");
        OutputEncryptor encryptor = new JceOpenSSLPKCS8EncryptorBuilder(JcaPKCS8Generator.AES_256_CBC)
                .setProvider(new BouncyCastleProvider())
                .setPassword("secret".toCharArray())
                .build();
        try (Writer w = Files.newBufferedWriter(keyFile); JcaPEMWriter pem = new JcaPEMWriter(w)) {
            pem.writeObject(new JcaPKCS8Generator(pair.getPrivate(), encryptor));
        }
        Path passphrase = tmp.resolve("passphrase");
        Files.writeString(passphrase, "secret\n");

        Optional<ManifestSigner> signer = ManifestSigner.fromProvider(
                new FilePrivateKeyProvider(Optional.of(keyFile), Optional.of(passphrase)));

        assertThat(signer).isPresent();
        Path ini = tmp.resolve("signed.ini");
        IniStore.parse("[a]\nx=1\n").write(ini, signer);
        assertThat(IniStore.verify(ini, pair.getPublic())).isTrue();
    }

    @Test
    void shouldBeEmptyWithoutKeyFile() {
        assertThat(ManifestSigner.fromProvider(FilePrivateKeyProvider.none())).isEmpty();
    }

    @Test
    void shouldFailOnFileWithoutKey() throws Exception {
        Path keyFile = tmp.resolve("empty.pem");
        Files.writeString(keyFile, "not a key\n");

        assertThatThrownBy(() -> ManifestSigner.loadKey(keyFile, new char[0]))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessageContaining("No private key found");
    }
}
