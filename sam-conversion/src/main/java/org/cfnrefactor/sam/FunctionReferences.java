package org.cfnrefactor.sam;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.cfnrefactor.graph.intrinsic.GetAtt;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Join;
import org.cfnrefactor.graph.intrinsic.Ref;
import org.cfnrefactor.graph.intrinsic.Sub;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Finds the function a property value points at ({@code FunctionName}, {@code TargetFunctionArn},
 * integration URIs, rule targets).
 */
public final class FunctionReferences {

    private static final Pattern SUB_ARN_TOKEN = Pattern.compile("\\$\\{([A-Za-z0-9]+)\\.Arn}");
    private static final Pattern SUB_REF_TOKEN = Pattern.compile("^\\$\\{([A-Za-z0-9]+)}$");
    private static final Pattern INVOCATIONS_PATH = Pattern.compile("functions/([A-Za-z0-9]+)/invocations");

    private FunctionReferences() {}

    /**
     * @return the logical id named by {@code value}: a {@code Ref}, a {@code GetAtt} of {@code Arn},
     *     a Sub or Join carrying {@code X.Arn}, or a plain id string
     */
    public static Optional<String> targetId(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            Matcher invocations = INVOCATIONS_PATH.matcher(value.asText());
            if (invocations.find()) {
                return Optional.of(invocations.group(1));
            }
            return Optional.of(value.asText());
        }
        var intrinsic = Intrinsic.decode(value);
        if (intrinsic.isEmpty()) {
            return Optional.empty();
        }
        if (intrinsic.get() instanceof Ref) {
            return Optional.of(((Ref) intrinsic.get()).logicalId());
        }
        if (intrinsic.get() instanceof GetAtt) {
            GetAtt getAtt = (GetAtt) intrinsic.get();
            return "Arn".equals(getAtt.attribute()) ? Optional.of(getAtt.logicalId()) : Optional.empty();
        }
        if (intrinsic.get() instanceof Sub) {
            String template = ((Sub) intrinsic.get()).template();
            Matcher arn = SUB_ARN_TOKEN.matcher(template);
            if (arn.find()) {
                return Optional.of(arn.group(1));
            }
            Matcher ref = SUB_REF_TOKEN.matcher(template);
            return ref.find() ? Optional.of(ref.group(1)) : Optional.empty();
        }
        if (intrinsic.get() instanceof Join) {
            for (JsonNode fragment : ((Join) intrinsic.get()).fragments()) {
                var getAtt = Intrinsic.decode(fragment).filter(GetAtt.class::isInstance).map(GetAtt.class::cast);
                if (getAtt.isPresent() && "Arn".equals(getAtt.get().attribute())) {
                    return Optional.of(getAtt.get().logicalId());
                }
            }
        }
        return Optional.empty();
    }
}
