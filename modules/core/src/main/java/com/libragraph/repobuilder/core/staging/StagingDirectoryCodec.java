package com.libragraph.repobuilder.core.staging;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.manifest.IniStore;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.util.FileDigestTable;
import com.libragraph.repobuilder.util.Md5Digest;
import com.libragraph.repobuilder.util.PathNames;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the side-car files of a staging directory:
 * {@code package.ini}, {@code md5sums.txt} and {@code Description}. The payload
 * lives under {@code Files/}.
 */
@ApplicationScoped
public class StagingDirectoryCodec {

    public static final String PACKAGE_INI = "package.ini";
    public static final String MD5SUMS = "md5sums.txt";
    public static final String DESCRIPTION = "Description";
    public static final String FILES = "Files";

    public boolean isStagingDirectory(Path dir) {
        return Files.isRegularFile(dir.resolve(PACKAGE_INI));
    }

    public PackageInfo read(Path stagingDir) {
        IniStore ini = IniStore.readVerbatim(stagingDir.resolve(PACKAGE_INI));
        PackageInfo info = new PackageInfo();

        String id = ini.get("", "id")
                .or(() -> ini.get("", "externalname"))
                .orElseThrow(() -> new RepositoryBuildException("Invalid package information file (id): " + stagingDir));
        info.setId(id);
        info.setDisplayName(ini.get("", "name")
                .orElseThrow(() -> new RepositoryBuildException("Invalid package information file (name): " + stagingDir)));

        ini.get("", "creator").ifPresent(info::setCreator);
        ini.get("", "title").ifPresent(info::setTitle);
        ini.get("", "version").ifPresent(info::setVersion);
        ini.get("", "targetsystem").ifPresent(info::setTargetSystem);
        ini.get("", "min_target_system_version").ifPresent(info::setMinTargetSystemVersion);
        for (String value : ini.getList("", "requires")) {
            for (String token : value.split(";")) {
                if (!token.isBlank()) {
                    info.requiredPackages().add(token.strip());
                }
            }
        }
        ini.getDigest("", "md5", "package information file").ifPresent(info::setDigest);
        ini.get("", "ctan_path").ifPresent(info::setCtanPath);
        ini.get("", "copyright_owner").ifPresent(info::setCopyrightOwner);
        ini.get("", "copyright_year").ifPresent(info::setCopyrightYear);
        ini.get("", "license_type").ifPresent(info::setLicenseType);

        Path description = stagingDir.resolve(DESCRIPTION);
        if (Files.isRegularFile(description)) {
            try {
                info.setDescription(Files.readString(description, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + description, e);
            }
        }
        info.setPath(stagingDir);
        return info;
    }

    public void write(Path stagingDir, PackageInfo info, FileDigestTable digests, Md5Digest digest) {
        try {
            Files.createDirectories(stagingDir);
            try (Writer w = Files.newBufferedWriter(stagingDir.resolve(PACKAGE_INI), StandardCharsets.UTF_8)) {
                w.write("id=" + info.id() + "\n");
                w.write("name=" + info.displayName() + "\n");
                w.write("creator=" + info.creator() + "\n");
                w.write("title=" + info.title() + "\n");
                w.write("version=" + info.version() + "\n");
                w.write("targetsystem=" + info.targetSystem() + "\n");
                w.write("min_target_system_version=" + info.minTargetSystemVersion() + "\n");
                w.write("md5=" + digest.toHex() + "\n");
                w.write("ctan_path=" + info.ctanPath() + "\n");
                w.write("copyright_owner=" + info.copyrightOwner() + "\n");
                w.write("copyright_year=" + info.copyrightYear() + "\n");
                w.write("license_type=" + info.licenseType() + "\n");
                for (String required : info.requiredPackages()) {
                    w.write("requires;=" + required + "\n");
                }
            }
            try (Writer w = Files.newBufferedWriter(stagingDir.resolve(MD5SUMS), StandardCharsets.UTF_8)) {
                for (var e : digests.entries().entrySet()) {
                    w.write(e.getValue().toHex() + " " + PathNames.toUnix(e.getKey()) + "\n");
                }
            }
            if (!info.description().isEmpty()) {
                Files.writeString(stagingDir.resolve(DESCRIPTION), info.description(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write staging directory " + stagingDir, e);
        }
    }
}
