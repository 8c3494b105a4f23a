package org.cfnrefactor.sam.function;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.cfnrefactor.graph.intrinsic.GetAtt;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Join;
import org.cfnrefactor.graph.intrinsic.Ref;
import org.cfnrefactor.graph.intrinsic.Sub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Rewrites an IAM policy document into SAM policy template entries.
 * <p>
 * Statements that grant S3 read or CRUD access on one bucket, SQS polling on one queue, or DynamoDB item
 * access on one table become {@code S3ReadPolicy}, {@code S3CrudPolicy}, {@code SQSPollerPolicy} and
 * {@code DynamoDBCrudPolicy}. Everything else stays in an inline copy of the document.
 */
final class PolicyTemplates {

    static final Set<String> S3_READ_ACTIONS = Set.of(
        "s3:GetObject", "s3:GetObjectVersion", "s3:ListBucket", "s3:ListBucketVersions");
    static final Set<String> S3_CRUD_ACTIONS = union(S3_READ_ACTIONS,
        Set.of("s3:PutObject", "s3:DeleteObject", "s3:AbortMultipartUpload"));
    static final Set<String> SQS_POLLER_ACTIONS = Set.of(
        "sqs:ReceiveMessage", "sqs:DeleteMessage", "sqs:GetQueueAttributes", "sqs:GetQueueUrl",
        "sqs:ChangeMessageVisibility");
    static final Set<String> DYNAMODB_CRUD_ACTIONS = Set.of(
        "dynamodb:BatchGetItem", "dynamodb:GetRecords", "dynamodb:GetShardIterator", "dynamodb:Query",
        "dynamodb:GetItem", "dynamodb:Scan", "dynamodb:ConditionCheckItem", "dynamodb:BatchWriteItem",
        "dynamodb:PutItem", "dynamodb:UpdateItem", "dynamodb:DeleteItem", "dynamodb:DescribeTable");

    private static final Pattern SUB_ARN = Pattern.compile("^\\$\\{([A-Za-z0-9]+)\\.Arn}(/.*)?$");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PolicyTemplates() {}

    /**
     * @return policy entries for a function's {@code Policies} list
     */
    static List<JsonNode> convert(ObjectNode policyDocument) {
        JsonNode statementNode = policyDocument.get("Statement");
        if (statementNode == null || statementNode.isNull()) {
            return List.of(policyDocument);
        }
        List<JsonNode> statements = new ArrayList<>();
        if (statementNode.isArray()) {
            statementNode.forEach(statements::add);
        } else {
            statements.add(statementNode);
        }

        List<JsonNode> results = new ArrayList<>();
        List<JsonNode> remaining = new ArrayList<>();
        for (JsonNode statement : statements) {
            var matched = matchS3(statement).or(() -> matchSqsPoller(statement));
            if (matched.isPresent()) {
                results.add(matched.get());
            } else {
                remaining.add(statement);
            }
        }

        List<JsonNode> dynamoStatements = new ArrayList<>();
        List<JsonNode> other = new ArrayList<>();
        for (JsonNode statement : remaining) {
            (isDynamoDbCrudStatement(statement) ? dynamoStatements : other).add(statement);
        }
        var table = singleTable(dynamoStatements);
        if (table.isPresent()) {
            ObjectNode entry = NODES.objectNode();
            entry.putObject("DynamoDBCrudPolicy").set("TableName", Ref.to(table.get()));
            results.add(entry);
        } else {
            other.addAll(dynamoStatements);
        }

        if (!other.isEmpty()) {
            ObjectNode inline = policyDocument.deepCopy();
            ArrayNode kept = inline.putArray("Statement");
            other.forEach(kept::add);
            results.add(inline);
        }
        return results.isEmpty() ? List.of(policyDocument) : results;
    }

    static Optional<JsonNode> matchS3(JsonNode statement) {
        var actions = allowedActions(statement);
        List<JsonNode> resources = resources(statement);
        if (actions.isEmpty() || resources.isEmpty()) {
            return Optional.empty();
        }
        var bucket = sameTarget(resources, PolicyTemplates::bucketName);
        if (bucket.isEmpty()) {
            return Optional.empty();
        }
        String template;
        if (S3_READ_ACTIONS.containsAll(actions.get())) {
            template = "S3ReadPolicy";
        } else if (S3_CRUD_ACTIONS.containsAll(actions.get())) {
            template = "S3CrudPolicy";
        } else {
            return Optional.empty();
        }
        ObjectNode entry = NODES.objectNode();
        entry.putObject(template).set("BucketName", bucket.get());
        return Optional.of(entry);
    }

    static Optional<JsonNode> matchSqsPoller(JsonNode statement) {
        var actions = allowedActions(statement);
        List<JsonNode> resources = resources(statement);
        if (actions.isEmpty() || resources.isEmpty() || !SQS_POLLER_ACTIONS.containsAll(actions.get())) {
            return Optional.empty();
        }
        var queue = sameTarget(resources, PolicyTemplates::queueName);
        if (queue.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode entry = NODES.objectNode();
        entry.putObject("SQSPollerPolicy").set("QueueName", queue.get());
        return Optional.of(entry);
    }

    static boolean isDynamoDbCrudStatement(JsonNode statement) {
        var actions = allowedActions(statement);
        if (actions.isEmpty() || !DYNAMODB_CRUD_ACTIONS.containsAll(actions.get())) {
            return false;
        }
        return resources(statement).stream().anyMatch(r -> tableId(r).isPresent());
    }

    /**
     * One table across every statement; entries may be the table ARN, an index ARN below it, or
     * {@code AWS::NoValue}. Any other resource disqualifies the group.
     */
    static Optional<String> singleTable(List<JsonNode> statements) {
        String table = null;
        for (JsonNode statement : statements) {
            for (JsonNode resource : resources(statement)) {
                if (isNoValue(resource)) {
                    continue;
                }
                var id = tableId(resource).or(() -> tableIndexId(resource));
                if (id.isEmpty() || (table != null && !table.equals(id.get()))) {
                    return Optional.empty();
                }
                table = id.get();
            }
        }
        return Optional.ofNullable(table);
    }

    private static Optional<Set<String>> allowedActions(JsonNode statement) {
        if (statement == null || !statement.isObject()) {
            return Optional.empty();
        }
        JsonNode effect = statement.get("Effect");
        if (effect == null || !"Allow".equals(effect.asText())) {
            return Optional.empty();
        }
        JsonNode action = statement.get("Action");
        Set<String> actions = new LinkedHashSet<>();
        if (action != null && action.isTextual()) {
            actions.add(action.asText());
        } else if (action != null && action.isArray()) {
            for (JsonNode entry : action) {
                if (!entry.isTextual()) {
                    return Optional.empty();
                }
                actions.add(entry.asText());
            }
        }
        return actions.isEmpty() ? Optional.empty() : Optional.of(actions);
    }

    private static List<JsonNode> resources(JsonNode statement) {
        List<JsonNode> resources = new ArrayList<>();
        JsonNode resource = statement == null ? null : statement.get("Resource");
        if (resource == null) {
            return resources;
        }
        if (resource.isArray()) {
            resource.forEach(resources::add);
        } else {
            resources.add(resource);
        }
        return resources;
    }

    private static Optional<JsonNode> sameTarget(List<JsonNode> resources,
                                                 Function<JsonNode, Optional<JsonNode>> extractor) {
        JsonNode target = null;
        for (JsonNode resource : resources) {
            var candidate = extractor.apply(resource);
            if (candidate.isEmpty() || (target != null && !target.equals(candidate.get()))) {
                return Optional.empty();
            }
            target = candidate.get();
        }
        return Optional.ofNullable(target);
    }

    /**
     * Bucket name of {@code Ref}, {@code GetAtt X.Arn}, {@code Sub "${X.Arn}/*"} or a literal ARN.
     */
    static Optional<JsonNode> bucketName(JsonNode resource) {
        var arnOwner = arnOwner(resource);
        if (arnOwner.isPresent()) {
            return Optional.of(Ref.to(arnOwner.get()));
        }
        return literalArnName(resource);
    }

    static Optional<JsonNode> queueName(JsonNode resource) {
        var intrinsic = Intrinsic.decode(resource);
        // Ref of a queue is its URL
        if (intrinsic.isPresent() && intrinsic.get() instanceof Ref) {
            return Optional.of(GetAtt.of(((Ref) intrinsic.get()).logicalId(), "QueueName").toNode());
        }
        if (intrinsic.isPresent() && intrinsic.get() instanceof GetAtt && "Arn".equals(((GetAtt) intrinsic.get()).attribute())) {
            return Optional.of(GetAtt.of(((GetAtt) intrinsic.get()).logicalId(), "QueueName").toNode());
        }
        return literalArnName(resource);
    }

    private static Optional<String> arnOwner(JsonNode resource) {
        var intrinsic = Intrinsic.decode(resource);
        if (intrinsic.isEmpty()) {
            return Optional.empty();
        }
        if (intrinsic.get() instanceof Ref && !((Ref) intrinsic.get()).isPseudoParameter()) {
            return Optional.of(((Ref) intrinsic.get()).logicalId());
        }
        if (intrinsic.get() instanceof GetAtt && "Arn".equals(((GetAtt) intrinsic.get()).attribute())) {
            return Optional.of(((GetAtt) intrinsic.get()).logicalId());
        }
        if (intrinsic.get() instanceof Sub) {
            Matcher matcher = SUB_ARN.matcher(((Sub) intrinsic.get()).template());
            if (matcher.matches()) {
                return Optional.of(matcher.group(1));
            }
        }
        if (intrinsic.get() instanceof Join) {
            Join join = (Join) intrinsic.get();
            if (join.delimiter().isEmpty() && join.fragments().size() == 2 && join.fragments().get(1).isTextual()
                && join.fragments().get(1).asText().startsWith("/")) {
                return Intrinsic.decode(join.fragments().get(0))
                    .filter(GetAtt.class::isInstance)
                    .map(GetAtt.class::cast)
                    .filter(g -> "Arn".equals(g.attribute()))
                    .map(GetAtt::logicalId);
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> literalArnName(JsonNode resource) {
        if (!resource.isTextual() || !resource.asText().startsWith("arn:")) {
            return Optional.empty();
        }
        String[] parts = resource.asText().split(":");
        if (parts.length < 6 || parts[5].isEmpty()) {
            return Optional.empty();
        }
        String name = parts[5].split("/", 2)[0];
        return name.isEmpty() || name.contains("*") ? Optional.empty() : Optional.of(NODES.textNode(name));
    }

    private static Optional<String> tableId(JsonNode resource) {
        return Intrinsic.decode(resource)
            .filter(GetAtt.class::isInstance)
            .map(GetAtt.class::cast)
            .filter(g -> "Arn".equals(g.attribute()))
            .map(GetAtt::logicalId);
    }

    private static Optional<String> tableIndexId(JsonNode resource) {
        var intrinsic = Intrinsic.decode(resource);
        if (intrinsic.isPresent() && (intrinsic.get() instanceof Sub || intrinsic.get() instanceof Join)) {
            return arnOwner(resource);
        }
        return Optional.empty();
    }

    private static boolean isNoValue(JsonNode resource) {
        return Intrinsic.decode(resource)
            .filter(Ref.class::isInstance)
            .map(r -> "AWS::NoValue".equals(((Ref) r).logicalId()))
            .orElse(false);
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new LinkedHashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
