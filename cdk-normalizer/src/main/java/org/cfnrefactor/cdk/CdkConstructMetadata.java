package org.cfnrefactor.cdk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import lombok.Builder;

/**
 * What a CDK app knows about one logical id: the construct that produced it.
 */
@Builder
public record CdkConstructMetadata(
    String constructName,
    boolean generated,
    String resourceType,
    String path
) {

    private static final List<Pattern> GENERATED_NAME_PATTERNS = List.of(
        Pattern.compile("ServiceRole[A-F0-9]{8}$"),
        Pattern.compile("DefaultPolicy[A-F0-9]{8}$"),
        Pattern.compile("LogGroup[A-F0-9]{8}$"),
        Pattern.compile("SecurityGroup[A-F0-9]{8}$")
    );

    /**
     * Derive metadata from a construct path such as {@code /Stack/Vpc/PublicSubnet1/Subnet}.
     */
    public static CdkConstructMetadata fromPath(String path, String resourceType) {
        String constructName = constructName(path);
        return new CdkConstructMetadata(constructName, isGenerated(path, constructName), resourceType, path);
    }

    /**
     * {@code /Stack/Vpc/Resource} gives {@code Vpc}, {@code /Stack/Vpc/PublicSubnet1/Subnet} gives
     * {@code PublicSubnet1Subnet}, {@code /Stack/Api/Default/items/GET} gives {@code itemsGET}.
     */
    static String constructName(String path) {
        String trimmed = path.replaceAll("^/+|/+$", "");
        List<String> parts = new ArrayList<>(Arrays.asList(trimmed.split("/")));
        if (trimmed.isEmpty()) {
            return "";
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        parts = parts.subList(1, parts.size());
        if ("Resource".equals(parts.get(parts.size() - 1))) {
            parts = parts.subList(0, parts.size() - 1);
        }
        if (parts.isEmpty()) {
            return "";
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        if (parts.size() == 2) {
            return String.join("", parts);
        }
        if (parts.size() == 3 && "Vpc".equals(parts.get(0))) {
            return String.join("", parts.subList(1, 3));
        }
        return String.join("", parts.subList(parts.size() - 2, parts.size()));
    }

    static boolean isGenerated(String path, String constructName) {
        if (path.endsWith("/Resource")) {
            return true;
        }
        for (Pattern pattern : GENERATED_NAME_PATTERNS) {
            if (pattern.matcher(constructName).find()) {
                return true;
            }
        }
        return path.replaceAll("^/+|/+$", "").split("/").length > 3;
    }
}
