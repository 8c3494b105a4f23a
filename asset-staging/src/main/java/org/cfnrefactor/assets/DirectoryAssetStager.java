package org.cfnrefactor.assets;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.cfnrefactor.assets.s3.S3Location;
import org.cfnrefactor.assets.s3.S3ObjectDownloader;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Ref;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.graph.intrinsic.Sub;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * AssetStager that copies assets under {@code <projectDir>/<assetsSubdir>}.
 * <p>
 * Resource-scoped assets go to {@code <assetDir>/<logicalId>/}; shared local copies go to
 * {@code <assetDir>/<sourceName>} (suffixed {@code -2}, {@code -3}, ... on clashes).
 */
@Slf4j
public class DirectoryAssetStager implements AssetStager {

    public static final String DEFAULT_ASSETS_SUBDIR = "src";

    private final Path projectDir;
    private final Path assetDir;
    private final S3ObjectDownloader downloader;
    private final Supplier<Optional<AwsEnvironment>> environmentSupplier;
    private final Path relativeTo;

    private final List<StagedAsset> records = new ArrayList<>();
    private final Map<Path, Path> localCopies = new HashMap<>();
    private Optional<AwsEnvironment> environment;

    /**
     * @param projectDir directory the converted template is written to
     * @param downloader S3 access, may be null when no S3 assets are expected
     * @param environment fixed account/region/partition, or null to detect lazily via STS
     */
    public DirectoryAssetStager(Path projectDir, S3ObjectDownloader downloader, AwsEnvironment environment) {
        this(projectDir, DEFAULT_ASSETS_SUBDIR, downloader,
            environment != null ? () -> Optional.of(environment) : new AwsEnvironmentDetector()::detect,
            projectDir);
    }

    public DirectoryAssetStager(Path projectDir,
                                String assetsSubdir,
                                S3ObjectDownloader downloader,
                                Supplier<Optional<AwsEnvironment>> environmentSupplier,
                                Path relativeTo) {
        this.projectDir = projectDir;
        this.assetDir = projectDir.resolve(assetsSubdir);
        this.downloader = downloader;
        this.environmentSupplier = environmentSupplier;
        this.relativeTo = relativeTo;
        try {
            Files.createDirectories(assetDir);
        } catch (IOException e) {
            throw new AssetStagingException("Could not create asset directory " + assetDir, e);
        }
    }

    public Path getAssetDirectory() {
        return assetDir;
    }

    @Override
    public Path stageLocalPath(String logicalId, Path source) {
        Path resolved = source.toAbsolutePath().normalize();
        Path staged = localCopies.get(resolved);
        if (staged == null) {
            String name = resolved.getFileName() == null ? "asset" : resolved.getFileName().toString();
            staged = allocateDestination(name);
            copy(resolved, staged);
            localCopies.put(resolved, staged);
        } else {
            log.debug("Reusing staged copy {} for {}", staged, logicalId);
        }
        return record(logicalId, StagedAsset.Kind.LOCAL_PATH, resolved.toString(), staged);
    }

    @Override
    public Path stageS3Code(String logicalId, String bucket, String key, String version) {
        S3Location location = new S3Location(bucket, key, version);
        Path targetDir = allocateDirectory(logicalId);
        Path tempDir = null;
        try {
            tempDir = Files.createTempDirectory("cfn-sam-refactor-");
            Path artifact = tempDir.resolve("artifact.zip");
            requireDownloader(location).download(location, artifact);
            ZipArchives.extract(artifact, targetDir);
        } catch (IOException e) {
            throw new AssetStagingException("Could not stage S3 code " + location.toUri() + " for " + logicalId, e);
        } finally {
            deleteQuietly(tempDir);
        }
        return record(logicalId, StagedAsset.Kind.S3_ARCHIVE, location.toUri(), targetDir);
    }

    @Override
    public Path stageFileAsset(String logicalId, Path source, String fileName) {
        Path resolved = source.toAbsolutePath().normalize();
        Path targetDir = allocateDirectory(logicalId);
        String name = fileName != null ? fileName : resolved.getFileName().toString();
        Path target = targetDir.resolve(name);
        try {
            Files.copy(resolved, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new AssetStagingException("Could not copy " + resolved + " for " + logicalId, e);
        }
        return record(logicalId, StagedAsset.Kind.FILE, resolved.toString(), target);
    }

    @Override
    public Path stageInlineText(String logicalId, String contents, String fileName) {
        String payload = contents.endsWith("\n") ? contents : contents + "\n";
        Path targetDir = allocateDirectory(logicalId);
        Path target = targetDir.resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, payload);
        } catch (IOException e) {
            throw new AssetStagingException("Could not write inline code for " + logicalId, e);
        }
        return record(logicalId, StagedAsset.Kind.INLINE_TEXT, "<inline:" + logicalId + ">", target);
    }

    @Override
    public Path stageS3File(String logicalId, String bucket, String key, String version, String fileName) {
        S3Location location = new S3Location(bucket, key, version);
        String name = fileName != null ? fileName : location.fileName();
        Path targetDir = allocateDirectory(logicalId);
        Path target = targetDir.resolve(name);
        try {
            requireDownloader(location).download(location, target);
        } catch (IOException e) {
            throw new AssetStagingException("Could not stage S3 file " + location.toUri() + " for " + logicalId, e);
        }
        return record(logicalId, StagedAsset.Kind.S3_FILE, location.toUri(), target);
    }

    @Override
    public Optional<String> resolveString(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            return Optional.of(value.asText());
        }
        var intrinsic = Intrinsic.decode(value);
        if (intrinsic.isEmpty()) {
            return Optional.empty();
        }
        if (intrinsic.get() instanceof Ref) {
            return pseudoParameter(((Ref) intrinsic.get()).logicalId());
        }
        if (intrinsic.get() instanceof Sub) {
            return resolveSub((Sub) intrinsic.get());
        }
        return Optional.empty();
    }

    private Optional<String> resolveSub(Sub sub) {
        Map<String, String> literals = new LinkedHashMap<>();
        if (sub.variables() != null) {
            var fields = sub.variables().fields();
            while (fields.hasNext()) {
                var field = fields.next();
                var resolved = resolveString(field.getValue());
                if (resolved.isEmpty()) {
                    return Optional.empty();
                }
                literals.put(field.getKey(), resolved.get());
            }
        }
        String template = sub.template();
        if (template.contains("${AWS::")) {
            for (String pseudo : List.of("AWS::AccountId", "AWS::Region", "AWS::Partition", "AWS::URLSuffix")) {
                if (template.contains("${" + pseudo + "}")) {
                    var resolved = pseudoParameter(pseudo);
                    if (resolved.isEmpty()) {
                        return Optional.empty();
                    }
                    literals.put(pseudo, resolved.get());
                }
            }
        }
        String result = References.inlineSubTokens(template, literals);
        if (result.contains("${")) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    private Optional<String> pseudoParameter(String name) {
        var env = environment();
        if (env.isEmpty()) {
            return Optional.empty();
        }
        switch (name) {
            case "AWS::AccountId":
                return Optional.of(env.get().accountId());
            case "AWS::Region":
                return Optional.of(env.get().region());
            case "AWS::Partition":
                return Optional.of(env.get().partition());
            case "AWS::URLSuffix":
                return Optional.of(env.get().urlSuffix());
            default:
                return Optional.empty();
        }
    }

    private Optional<AwsEnvironment> environment() {
        if (environment == null) {
            environment = environmentSupplier.get();
        }
        return environment;
    }

    @Override
    public List<StagedAsset> getRecords() {
        return List.copyOf(records);
    }

    @Override
    public void applyRenameMap(Map<String, String> renameMap) {
        if (renameMap.isEmpty()) {
            return;
        }
        Map<String, Path> movedDirs = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            StagedAsset asset = records.get(i);
            String newId = renameMap.get(asset.logicalId());
            if (newId == null || newId.equals(asset.logicalId())) {
                continue;
            }
            Path stagedPath = asset.stagedPath();
            if (asset.isResourceScoped()) {
                Path oldDir = assetDir.resolve(asset.logicalId());
                Path newDir = movedDirs.computeIfAbsent(asset.logicalId(), id -> moveDirectory(oldDir, assetDir.resolve(newId)));
                stagedPath = newDir.resolve(oldDir.relativize(stagedPath));
            }
            log.debug("Retargeted staged asset {} -> {}", asset.logicalId(), newId);
            records.set(i, asset.toBuilder().logicalId(newId).stagedPath(stagedPath).build());
        }
    }

    @Override
    public String formatCodeUri(Path stagedPath) {
        return AssetLocator.formatPath(stagedPath, relativeTo);
    }

    public Path getProjectDir() {
        return projectDir;
    }

    private Path moveDirectory(Path from, Path to) {
        try {
            deleteRecursively(to);
            Files.move(from, to);
            return to;
        } catch (IOException e) {
            throw new AssetStagingException("Could not move staged assets from " + from + " to " + to, e);
        }
    }

    private Path record(String logicalId, StagedAsset.Kind kind, String source, Path staged) {
        records.add(StagedAsset.builder()
            .logicalId(logicalId)
            .kind(kind)
            .source(source)
            .stagedPath(staged)
            .build());
        log.debug("Staged {} asset for {} at {}", kind, logicalId, staged);
        return staged;
    }

    private S3ObjectDownloader requireDownloader(S3Location location) {
        if (downloader == null) {
            throw new AssetStagingException("No S3 downloader configured to fetch " + location.toUri());
        }
        return downloader;
    }

    private Path allocateDestination(String baseName) {
        Path candidate = assetDir.resolve(baseName);
        int counter = 2;
        while (Files.exists(candidate)) {
            candidate = assetDir.resolve(baseName + "-" + counter);
            counter++;
        }
        return candidate;
    }

    private Path allocateDirectory(String logicalId) {
        Path target = assetDir.resolve(logicalId);
        try {
            deleteRecursively(target);
            Files.createDirectories(target);
        } catch (IOException e) {
            throw new AssetStagingException("Could not prepare asset directory " + target, e);
        }
        return target;
    }

    private static void copy(Path source, Path destination) {
        try {
            if (Files.isDirectory(source)) {
                try (Stream<Path> paths = Files.walk(source)) {
                    paths.forEach(path -> copyEntry(path, destination.resolve(source.relativize(path).toString())));
                }
            } else {
                Files.createDirectories(destination.getParent());
                Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new AssetStagingException("Could not copy " + source + " to " + destination, e);
        }
    }

    private static void copyEntry(Path path, Path target) {
        try {
            if (Files.isDirectory(path)) {
                Files.createDirectories(target);
            } else {
                Files.copy(path, target, StandardCopyOption.COPY_ATTRIBUTES);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(path)) {
            for (Path entry : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(entry);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Failed to clean up temporary directory: {}", path, e);
        }
    }
}
