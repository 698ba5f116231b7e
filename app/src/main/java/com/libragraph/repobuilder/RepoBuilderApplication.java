package com.libragraph.repobuilder;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.build.RepositoryBuilder;
import com.libragraph.repobuilder.core.config.RunMode;
import com.libragraph.repobuilder.core.config.RunRequest;
import com.libragraph.repobuilder.formats.api.ArchiveException;
import com.libragraph.repobuilder.formats.api.ExternalToolException;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.inject.CreationException;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;

/**
 * Command-mode entry point. The run is configured entirely through
 * {@code repobuilder.*} properties, e.g.
 * {@code -Drepobuilder.mode=update-repository -Drepobuilder.repository=/srv/repo}.
 *
 * <p>Any failure ends the run with status 1 after printing
 * {@code repobuilder: <message>} to standard error.
 */
@QuarkusMain
public class RepoBuilderApplication implements QuarkusApplication {

    private static final Logger log = Logger.getLogger(RepoBuilderApplication.class);

    static final String PROGRAM_NAME = "repobuilder";

    // resolved inside run() so configuration errors are reported like any other failure
    @Inject
    Instance<RunRequest> request;

    @Inject
    Instance<RepositoryBuilder> builder;

    @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown")
    String version;

    @Override
    public int run(String... args) {
        try {
            RunRequest run = request.get();
            if (run.mode().filter(m -> m == RunMode.VERSION).isPresent()) {
                System.out.println(PROGRAM_NAME + " " + version);
                return 0;
            }
            builder.get().run(run);
            return 0;
        } catch (ExternalToolException e) {
            fail(e);
            System.err.println(e.command());
            if (!e.output().isEmpty()) {
                System.err.println(e.output());
            }
        } catch (RepositoryBuildException | ArchiveException | UncheckedIOException e) {
            fail(e);
        } catch (CreationException e) {
            // a producer rejected the configuration
            fail(e.getCause() instanceof RuntimeException cause ? cause : e);
        }
        return 1;
    }

    private static void fail(RuntimeException e) {
        log.debug("run failed", e);
        System.err.println(PROGRAM_NAME + ": " + e.getMessage());
    }
}
