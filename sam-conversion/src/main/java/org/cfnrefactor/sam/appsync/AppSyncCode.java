package org.cfnrefactor.sam.appsync;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.cfnrefactor.assets.AssetStager;
import org.cfnrefactor.assets.s3.S3Location;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Sub;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.InlineCode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the code of AppSync functions and resolvers into an {@code InlineCode} or {@code CodeUri} entry.
 * <p>
 * CDK uploads resolver code as a hashed asset, so an {@code s3://} location is first looked up among the
 * local assets by file name before it is downloaded.
 */
@Slf4j
final class AppSyncCode {

    private static final Pattern ASSET_HASH = Pattern.compile("([0-9a-f]{32,64})");
    private static final String DEFAULT_EXTENSION = ".js";

    private AppSyncCode() {}

    /**
     * Put {@code InlineCode} or {@code CodeUri} on {@code entry}; nothing when the properties carry no code.
     * @param defaultName file name stem used when code is staged, e.g. {@code resolver}
     */
    static void resolve(ConversionContext context, String logicalId, ObjectNode properties, String defaultName,
                        ObjectNode entry) {
        String preferredName = preferredFileName(properties.get("CodeS3Location"), defaultName);
        JsonNode code = properties.get("Code");
        if (code != null && code.isTextual()) {
            String prepared = InlineCode.prepare(code.asText());
            var stager = context.stager();
            if (context.getOptions().isPreferExternalAssets() && stager.isPresent()) {
                Path staged = stager.get().stageInlineText(logicalId, prepared, preferredName);
                entry.put("CodeUri", context.codeUri(staged));
            } else {
                entry.put("InlineCode", prepared);
            }
            return;
        }

        JsonNode location = properties.get("CodeS3Location");
        if (location == null || location.isNull()) {
            return;
        }
        Optional<String> resolved = resolveLocation(context.stager(), location);
        var stager = context.stager();
        if (stager.isPresent() && resolved.isPresent()) {
            Optional<Path> local = findLocalAsset(context, resolved.get());
            if (local.isPresent()) {
                Path staged = stager.get().stageFileAsset(logicalId, local.get(),
                    fileName(local.get().getFileName().toString(), preferredName));
                entry.put("CodeUri", context.codeUri(staged));
                return;
            }
            Optional<S3Location> remote = literalS3Uri(resolved.get());
            if (remote.isPresent()) {
                Path staged = stager.get().stageS3File(logicalId, remote.get().bucket(), remote.get().key(),
                    remote.get().version(), fileName(remote.get().fileName(), preferredName));
                entry.put("CodeUri", context.codeUri(staged));
                return;
            }
        }
        if (resolved.isPresent() && !resolved.get().contains("${")) {
            entry.put("CodeUri", resolved.get());
        } else {
            entry.set("CodeUri", location);
        }
    }

    /**
     * @return the location text: literal, or resolved through the stager when it holds Sub tokens
     */
    static Optional<String> resolveLocation(Optional<AssetStager> stager, JsonNode location) {
        Optional<String> literal = locationText(location);
        if (literal.isPresent() && !literal.get().contains("${")) {
            return literal;
        }
        if (stager.isPresent()) {
            JsonNode sub = location.isTextual() ? Intrinsic.wrap(Intrinsic.SUB, location) : location;
            var resolved = stager.get().resolveString(sub);
            if (resolved.isPresent()) {
                return resolved;
            }
        }
        return literal;
    }

    static Optional<String> locationText(JsonNode location) {
        if (location == null) {
            return Optional.empty();
        }
        if (location.isTextual()) {
            return Optional.of(location.asText());
        }
        return Intrinsic.decode(location)
            .filter(Sub.class::isInstance)
            .map(sub -> ((Sub) sub).template());
    }

    static Optional<S3Location> literalS3Uri(String text) {
        if (!text.toLowerCase(Locale.ROOT).startsWith("s3://") || text.contains("${")) {
            return Optional.empty();
        }
        String remainder = text.substring(5);
        int slash = remainder.indexOf('/');
        if (slash <= 0 || slash == remainder.length() - 1) {
            return Optional.empty();
        }
        try {
            return Optional.of(S3Location.parse("s3://" + remainder));
        } catch (IllegalArgumentException e) {
            log.debug("Not a usable S3 location {}: {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Look for the asset under its key's file name, with an {@code asset.} prefix, or as
     * {@code asset.<hash><ext>}.
     */
    static Optional<Path> findLocalAsset(ConversionContext context, String location) {
        var uri = literalS3Uri(location);
        if (uri.isEmpty()) {
            return Optional.empty();
        }
        String baseName = uri.get().fileName();
        List<String> candidates = new ArrayList<>();
        candidates.add(baseName);
        if (!baseName.startsWith("asset.")) {
            candidates.add("asset." + baseName);
            Matcher hash = ASSET_HASH.matcher(baseName);
            if (hash.find()) {
                candidates.add("asset." + hash.group(1) + extension(baseName));
            }
        }
        var found = context.getLocator().findFirst(candidates);
        found.ifPresent(path -> log.debug("Using local asset {} for {}", path, location));
        return found;
    }

    static String preferredFileName(JsonNode location, String defaultName) {
        String extension = locationText(location).map(AppSyncCode::extension).orElse("");
        return defaultName + (extension.isEmpty() ? DEFAULT_EXTENSION : extension);
    }

    /**
     * Keep {@code preferredName} unless the source carries another extension.
     */
    static String fileName(String sourceName, String preferredName) {
        String extension = extension(sourceName);
        if (extension.isEmpty() || preferredName.endsWith(extension)) {
            return preferredName;
        }
        return preferredName + extension;
    }

    private static String extension(String name) {
        int slash = name.lastIndexOf('/');
        String last = slash >= 0 ? name.substring(slash + 1) : name;
        int dot = last.lastIndexOf('.');
        return dot > 0 ? last.substring(dot) : "";
    }
}
