package org.cfnrefactor.cdk;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.cfnrefactor.cdk.NormalizerOptions.CollisionStrategy;

import lombok.RequiredArgsConstructor;

/**
 * Turns derived base names into a collision-free rename target per logical id.
 * <p>
 * Within a group sharing a base name the lexicographically first id keeps the bare base, unless some
 * member is already named exactly that, in which case it keeps it. Members that already carry a
 * suffix of the configured shape keep their current id, so a second run over normalized output is a
 * no-op. Every generated suffix skips names claimed by parameters, other groups' bases and earlier
 * assignments.
 */
@RequiredArgsConstructor
class CollisionResolver {

    private static final Pattern NUMBERED_SUFFIX = Pattern.compile("[0-9]+");
    private static final Pattern HASH_SUFFIX = Pattern.compile("[0-9A-F]{4}");

    private final CollisionStrategy strategy;

    /**
     * @param baseNames logical id to derived base name, in template order
     * @param reserved  names that no resource may take, such as parameter names
     * @return logical id to final id for every input id
     */
    Map<String, String> resolve(Map<String, String> baseNames, Collection<String> reserved) {
        Map<String, List<String>> groups = new TreeMap<>();
        baseNames.forEach((id, base) -> groups.computeIfAbsent(base, key -> new ArrayList<>()).add(id));

        Set<String> claimed = new HashSet<>(reserved);
        claimed.addAll(groups.keySet());

        Map<String, String> assigned = new LinkedHashMap<>();
        for (var group : groups.entrySet()) {
            String base = group.getKey();
            List<String> members = new ArrayList<>(group.getValue());
            members.sort(null);

            List<String> pending = new ArrayList<>();
            String bareOwner = null;
            if (!reserved.contains(base)) {
                bareOwner = members.contains(base) ? base : members.get(0);
                assigned.put(bareOwner, base);
            }
            for (String member : members) {
                if (member.equals(bareOwner)) {
                    continue;
                }
                if (carriesSuffix(member, base) && !claimed.contains(member)) {
                    claimed.add(member);
                    assigned.put(member, member);
                } else {
                    pending.add(member);
                }
            }
            for (String member : pending) {
                String target = suffixed(base, member, claimed);
                claimed.add(target);
                assigned.put(member, target);
            }
        }

        Map<String, String> ordered = new LinkedHashMap<>();
        baseNames.keySet().forEach(id -> ordered.put(id, assigned.get(id)));
        return ordered;
    }

    private boolean carriesSuffix(String id, String base) {
        if (!id.startsWith(base) || id.length() == base.length()) {
            return false;
        }
        String suffix = id.substring(base.length());
        Pattern shape = strategy == CollisionStrategy.SHORT_HASH ? HASH_SUFFIX : NUMBERED_SUFFIX;
        return shape.matcher(suffix).matches();
    }

    private String suffixed(String base, String originalId, Set<String> claimed) {
        if (strategy == CollisionStrategy.SHORT_HASH) {
            String candidate = base + shortHash(originalId);
            if (!claimed.contains(candidate)) {
                return candidate;
            }
        }
        int index = 2;
        while (claimed.contains(base + index)) {
            index++;
        }
        return base + index;
    }

    /** First four upper-case hex digits of the MD5 of the original id. */
    static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            String hex = String.format("%032x", new BigInteger(1, digest));
            return hex.substring(0, 4).toUpperCase();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
