package com.libragraph.repobuilder.formats.registry;

import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.formats.api.Codec;
import com.libragraph.repobuilder.formats.embedded.EmbeddedArchiver;
import com.libragraph.repobuilder.formats.external.ExternalArchiver;
import com.libragraph.repobuilder.formats.process.SystemProcessExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the archive backend. {@code external} runs the command-line tools,
 * {@code embedded} uses the {@link Codec} beans discovered via CDI.
 */
@ApplicationScoped
public class ArchiverProducer {

    private static final Logger log = Logger.getLogger(ArchiverProducer.class);

    @ConfigProperty(name = "repobuilder.archiver", defaultValue = "external")
    String backend;

    @ConfigProperty(name = "repobuilder.tools.xz")
    Optional<String> xz;

    @Inject
    Instance<Codec> codecs;

    @Inject
    SystemProcessExecutor executor;

    @Produces
    @Singleton
    public Archiver archiver() {
        log.debugf("archive backend: %s", backend);
        switch (backend) {
            case "external":
                return new ExternalArchiver(executor, xz.map(Path::of), System.getenv());
            case "embedded":
                List<Codec> all = codecs.stream().collect(Collectors.toList());
                return new EmbeddedArchiver(all);
            default:
                throw new IllegalArgumentException("Unknown archive backend: " + backend);
        }
    }
}
