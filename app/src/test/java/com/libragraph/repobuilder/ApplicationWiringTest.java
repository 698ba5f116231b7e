package com.libragraph.repobuilder;

import com.libragraph.repobuilder.core.build.RepositoryBuilder;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.SeriesVersion;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.formats.api.Codec;
import com.libragraph.repobuilder.formats.embedded.EmbeddedArchiver;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * CDI integration test verifying that the builder and its collaborators are
 * wired from configuration via Quarkus/ArC.
 */
@QuarkusTest
class ApplicationWiringTest {

    @Inject
    Archiver archiver;

    @Inject
    Instance<Codec> codecs;

    @Inject
    BuildSession session;

    @Inject
    RepositoryBuilder builder;

    @Test
    void shouldUseConfiguredArchiver() {
        // the test profile selects the embedded backend
        assertThat(archiver).isInstanceOf(EmbeddedArchiver.class);
    }

    @Test
    void shouldDiscoverAllCodecs() {
        long count = StreamSupport.stream(codecs.spliterator(), false).count();

        // Bzip2, Lzma
        assertThat(count).isEqualTo(2);
    }

    @Test
    void shouldBuildSessionFromDefaults() {
        assertThat(session.series()).isEqualTo(SeriesVersion.SUPPORTED);
        assertThat(session.layout().prefix()).isEqualTo("texmf");
        assertThat(session.releaseState()).isEqualTo("stable");
        assertThat(session.signer()).isEmpty();
        assertThat(session.dbFilePrefix()).isEqualTo("miktex-zzdb");
    }

    @Test
    void shouldInjectBuilder() {
        assertThat(builder).isNotNull();
    }
}
