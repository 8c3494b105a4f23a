package org.cfnrefactor.assets;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Finds asset files referenced from a template (CDK {@code aws:asset:path} metadata, asset bundles in
 * {@code cdk.out}) below a fixed list of search roots.
 */
@Slf4j
public class AssetLocator {

    private final List<Path> searchRoots;

    public AssetLocator(List<Path> searchRoots) {
        List<Path> normalized = new ArrayList<>();
        for (Path root : searchRoots) {
            if (root != null) {
                normalized.add(root.toAbsolutePath().normalize());
            }
        }
        this.searchRoots = List.copyOf(normalized);
    }

    public static AssetLocator none() {
        return new AssetLocator(List.of());
    }

    public List<Path> getSearchRoots() {
        return searchRoots;
    }

    /**
     * A located asset; {@code exists} is false when no candidate was found and {@code path} is the
     * best guess of where the asset should have been.
     */
    public record LocatedAsset(Path path, boolean exists) {}

    /**
     * Resolve an asset path. Absolute paths are taken as is; relative ones are tried under each search
     * root, then against the working directory.
     */
    public LocatedAsset locate(String assetPath) {
        Path candidate = Path.of(assetPath);
        List<Path> candidates = new ArrayList<>();
        if (candidate.isAbsolute()) {
            candidates.add(candidate);
        } else {
            searchRoots.forEach(root -> candidates.add(root.resolve(candidate)));
            candidates.add(candidate);
        }
        for (Path entry : candidates) {
            if (Files.exists(entry)) {
                return new LocatedAsset(entry.toAbsolutePath().normalize(), true);
            }
        }
        log.debug("Asset {} not found below {}", assetPath, searchRoots);
        return new LocatedAsset(candidates.get(0).toAbsolutePath().normalize(), false);
    }

    /**
     * @return the first {@code <root>/<name>} that exists, trying every name under a root before moving on
     */
    public Optional<Path> findFirst(List<String> fileNames) {
        for (Path root : searchRoots) {
            for (String name : fileNames) {
                Path entry = root.resolve(name);
                if (Files.exists(entry)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Render a path for a template: relative to {@code relativeTo} when it lies below it, absolute
     * otherwise, always with forward slashes.
     */
    public static String formatPath(Path path, Path relativeTo) {
        Path absolute = path.toAbsolutePath().normalize();
        if (relativeTo != null) {
            Path base = relativeTo.toAbsolutePath().normalize();
            if (absolute.startsWith(base)) {
                return base.relativize(absolute).toString().replace('\\', '/');
            }
        }
        return absolute.toString().replace('\\', '/');
    }
}
