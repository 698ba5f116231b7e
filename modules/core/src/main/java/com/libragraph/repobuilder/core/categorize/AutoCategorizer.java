package com.libragraph.repobuilder.core.categorize;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.model.TexmfLayout;
import com.libragraph.repobuilder.util.PathNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Groups packages nobody depends on under umbrella container packages.
 *
 * <p>First the incoming edges are derived from every package's required
 * packages; unknown ids are reported. Then each package without dependents
 * whose CTAN path lies in the contributed LaTeX macros is added to the LaTeX
 * container, and each font package shipping Type 1 or TrueType files is added
 * to the outline fonts container. Containers that are missing from the table
 * are skipped, and no edge is added that would close a cycle.
 */
@ApplicationScoped
public class AutoCategorizer {

    private static final Logger log = Logger.getLogger(AutoCategorizer.class);

    public static final String LATEX_CONTAINER = "_miktex-latex-packages";
    public static final String OUTLINE_FONTS_CONTAINER = "_miktex-fonts-type1";

    static final String LATEX_CTAN_PREFIX = "/macros/latex/contrib/";
    static final String FONTS_CTAN_PREFIX = "/fonts/";

    private final TexmfLayout layout;

    @Inject
    public AutoCategorizer(BuildSession session) {
        this.layout = session.layout();
    }

    public void categorize(Map<String, PackageInfo> table) {
        for (PackageInfo pkg : table.values()) {
            for (String req : pkg.requiredPackages()) {
                PackageInfo dependency = table.get(req);
                if (dependency == null) {
                    log.warnf("warning: dependency problem: %s is required by %s", req, pkg.id());
                } else if (!dependency.requiredBy().contains(pkg.id())) {
                    dependency.requiredBy().add(pkg.id());
                }
            }
        }

        PackageInfo latex = table.get(LATEX_CONTAINER);
        PackageInfo outlineFonts = table.get(OUTLINE_FONTS_CONTAINER);
        for (PackageInfo pkg : table.values()) {
            if (!pkg.requiredBy().isEmpty()) {
                continue;
            }
            String ctanPath = pkg.ctanPath();
            if (latex != null && ctanPath.startsWith(LATEX_CTAN_PREFIX)) {
                link(table, latex, pkg);
            } else if (outlineFonts != null && ctanPath.startsWith(FONTS_CTAN_PREFIX) && hasOutlineFonts(pkg)) {
                link(table, outlineFonts, pkg);
            }
        }
    }

    private boolean hasOutlineFonts(PackageInfo pkg) {
        String type1 = layout.prefix() + "/fonts/type1";
        String trueType = layout.prefix() + "/fonts/truetype";
        return pkg.runFiles().stream()
                .anyMatch(f -> PathNames.isUnder(type1, f) || PathNames.isUnder(trueType, f));
    }

    private void link(Map<String, PackageInfo> table, PackageInfo container, PackageInfo pkg) {
        if (container == pkg || requires(table, pkg, container.id())) {
            log.debugf("not adding %s to %s: it would create a cycle", pkg.id(), container.id());
            return;
        }
        log.debugf("adding %s to %s", pkg.id(), container.id());
        pkg.requiredBy().add(container.id());
        container.requiredPackages().add(pkg.id());
    }

    /** Whether {@code from} depends on {@code target}, directly or transitively. */
    private static boolean requires(Map<String, PackageInfo> table, PackageInfo from, String target) {
        Deque<PackageInfo> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            PackageInfo p = pending.pop();
            for (String req : p.requiredPackages()) {
                if (req.equals(target)) {
                    return true;
                }
                PackageInfo next = table.get(req);
                if (next != null && seen.add(req)) {
                    pending.push(next);
                }
            }
        }
        return false;
    }
}
