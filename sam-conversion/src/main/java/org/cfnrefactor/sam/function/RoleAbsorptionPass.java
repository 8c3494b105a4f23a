package org.cfnrefactor.sam.function;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves IAM wiring of converted functions into the function itself.
 * <p>
 * A role that only trusts Lambda and only carries {@code AWSLambdaBasicExecutionRole} is dropped, since SAM
 * generates the same role. {@code AWS::IAM::Policy} resources attached only to that role become
 * {@code Policies} entries (SAM policy templates where a statement matches one). SAM ignores
 * {@code Policies} while {@code Role} is set, so policies are only absorbed together with their role.
 */
@Slf4j
public class RoleAbsorptionPass implements ConversionPass {

    static final String BASIC_EXECUTION_POLICY = "AWSLambdaBasicExecutionRole";

    @Override
    public String name() {
        return "role-absorption";
    }

    @Override
    public boolean apply(ConversionContext context) {
        boolean changed = false;
        Template template = context.getTemplate();
        for (Map.Entry<String, ObjectNode> entry : context.getConvertedFunctions().entrySet()) {
            if (template.hasResource(entry.getKey())) {
                changed |= absorb(template, entry.getKey(), entry.getValue());
            }
        }
        return changed;
    }

    boolean absorb(Template template, String functionId, ObjectNode function) {
        var roleId = roleId(function);
        if (roleId.isEmpty()) {
            return false;
        }
        var role = template.resource(roleId.get());
        if (role.isEmpty() || !isBasicLambdaRole(role.get())) {
            return false;
        }
        Map<String, ObjectNode> policies = attachedPolicies(template, roleId.get());
        List<String> ignored = new ArrayList<>(policies.keySet());
        ignored.add(functionId);
        if (ResourceGraph.isReferencedElsewhere(template, List.of(roleId.get()), ignored)
            || referencedOutsideRoleProperty(function, roleId.get())) {
            log.debug("Keeping role {}: referenced elsewhere", roleId.get());
            return false;
        }
        for (String policyId : policies.keySet()) {
            if (ResourceGraph.isReferencedElsewhere(template, List.of(policyId), List.of(functionId))) {
                log.debug("Keeping role {}: its policy {} is referenced elsewhere", roleId.get(), policyId);
                return false;
            }
        }

        if (!policies.isEmpty()) {
            ArrayNode target = policiesList(function);
            policies.values().forEach(policy -> {
                ObjectNode document = (ObjectNode) policy.get(ResourceNodes.PROPERTIES).get("PolicyDocument");
                PolicyTemplates.convert(document).forEach(target::add);
            });
        }
        ResourceNodes.propertiesOrCreate(function).remove("Role");
        List<String> removed = new ArrayList<>(policies.keySet());
        removed.add(roleId.get());
        ResourceGraph.removeResources(template, removed);
        log.debug("Absorbed {} into {}", removed, functionId);
        return true;
    }

    static boolean isBasicLambdaRole(JsonNode role) {
        if (!ResourceNodes.isType(role, SamTypes.IAM_ROLE)) {
            return false;
        }
        var properties = ResourceNodes.properties(role);
        if (properties.isEmpty()) {
            return false;
        }
        var names = properties.get().fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"AssumeRolePolicyDocument".equals(name) && !"ManagedPolicyArns".equals(name)) {
                return false;
            }
        }
        if (!assumeRoleAllowsLambda(properties.get().get("AssumeRolePolicyDocument"))) {
            return false;
        }
        JsonNode managed = properties.get().get("ManagedPolicyArns");
        return managed != null && managed.isArray() && managed.size() == 1
            && managed.get(0).toString().contains(BASIC_EXECUTION_POLICY);
    }

    static boolean assumeRoleAllowsLambda(JsonNode document) {
        JsonNode statements = document == null ? null : document.get("Statement");
        if (statements == null) {
            return false;
        }
        List<JsonNode> list = new ArrayList<>();
        if (statements.isArray()) {
            statements.forEach(list::add);
        } else {
            list.add(statements);
        }
        for (JsonNode statement : list) {
            if (!"Allow".equals(statement.path("Effect").asText())) {
                continue;
            }
            if (!containsText(statement.get("Action"), "sts:AssumeRole")) {
                continue;
            }
            if (containsText(statement.path("Principal").get("Service"), "lambda.amazonaws.com")) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsText(JsonNode value, String expected) {
        if (value == null) {
            return false;
        }
        if (value.isArray()) {
            for (JsonNode entry : value) {
                if (expected.equals(entry.asText())) {
                    return true;
                }
            }
            return false;
        }
        return value.isTextual() && expected.equals(value.asText());
    }

    /**
     * The function itself may mention its role outside {@code Role}, e.g. in an environment variable.
     */
    private static boolean referencedOutsideRoleProperty(ObjectNode function, String roleId) {
        var properties = ResourceNodes.properties(function);
        if (properties.isEmpty()) {
            return false;
        }
        var fields = properties.get().fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (!"Role".equals(field.getKey()) && References.referencesAny(field.getValue(), List.of(roleId))) {
                return true;
            }
        }
        JsonNode metadata = function.get(ResourceNodes.METADATA);
        return metadata != null && References.referencesAny(metadata, List.of(roleId));
    }

    private static Optional<String> roleId(ObjectNode function) {
        return ResourceNodes.properties(function)
            .map(p -> p.get("Role"))
            .flatMap(References::extractReferencedId);
    }

    /**
     * Policies whose only role is {@code roleId} and whose document is an object.
     */
    private static Map<String, ObjectNode> attachedPolicies(Template template, String roleId) {
        Map<String, ObjectNode> attached = new LinkedHashMap<>();
        ResourceGraph.resourcesOfType(template, SamTypes.IAM_POLICY).forEach((id, policy) -> {
            var properties = ResourceNodes.properties(policy);
            if (properties.isEmpty()) {
                return;
            }
            JsonNode roles = properties.get().get("Roles");
            JsonNode document = properties.get().get("PolicyDocument");
            if (roles == null || !roles.isArray() || roles.size() != 1 || document == null || !document.isObject()) {
                return;
            }
            if (References.extractLogicalId(roles.get(0)).map(roleId::equals).orElse(false)) {
                attached.put(id, policy);
            }
        });
        return attached;
    }

    private static ArrayNode policiesList(ObjectNode function) {
        ObjectNode properties = ResourceNodes.propertiesOrCreate(function);
        JsonNode existing = properties.get("Policies");
        if (existing instanceof ArrayNode) {
            return (ArrayNode) existing;
        }
        ArrayNode list = properties.arrayNode();
        if (existing != null && !existing.isNull()) {
            list.add(existing);
        }
        properties.set("Policies", list);
        return list;
    }
}
