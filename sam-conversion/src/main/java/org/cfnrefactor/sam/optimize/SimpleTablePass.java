package org.cfnrefactor.sam.optimize;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites provisioned {@code AWS::DynamoDB::Table} resources with a single hash key and nothing SAM
 * cannot express as {@code AWS::Serverless::SimpleTable}.
 */
@Slf4j
public class SimpleTablePass implements ConversionPass {

    static final String TABLE_TYPE = "AWS::DynamoDB::Table";

    private static final Set<String> ALLOWED = Set.of(
        "AttributeDefinitions", "KeySchema", "ProvisionedThroughput", "TableName", "Tags",
        "PointInTimeRecoverySpecification", "SSESpecification", "BillingMode");

    private static final Map<String, String> ATTRIBUTE_TYPES = Map.of("S", "String", "N", "Number", "B", "Binary");

    @Override
    public String name() {
        return "simple-tables";
    }

    @Override
    public boolean apply(ConversionContext context) {
        boolean changed = false;
        for (var entry : ResourceGraph.resourcesOfType(context.getTemplate(), TABLE_TYPE).entrySet()) {
            var converted = convert(entry.getValue());
            if (converted.isPresent()) {
                entry.getValue().put(ResourceNodes.TYPE, SamTypes.SIMPLE_TABLE);
                entry.getValue().set(ResourceNodes.PROPERTIES, converted.get());
                context.recordConversion(entry.getKey());
                log.debug("Converted table {} to a simple table", entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    static Optional<ObjectNode> convert(ObjectNode table) {
        var found = ResourceNodes.properties(table);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode properties = found.get();
        String billingMode = ResourceNodes.textProperty(properties, "BillingMode").orElse("");
        JsonNode throughput = properties.get("ProvisionedThroughput");
        if ("PAY_PER_REQUEST".equals(billingMode.toUpperCase(Locale.ROOT)) || throughput == null || throughput.isNull()) {
            return Optional.empty();
        }
        var names = properties.fieldNames();
        while (names.hasNext()) {
            if (!ALLOWED.contains(names.next())) {
                return Optional.empty();
            }
        }
        JsonNode keySchema = properties.get("KeySchema");
        if (keySchema == null || !keySchema.isArray() || keySchema.size() != 1
            || !"HASH".equals(keySchema.get(0).path("KeyType").asText())
            || !keySchema.get(0).path("AttributeName").isTextual()) {
            return Optional.empty();
        }
        String hashKey = keySchema.get(0).get("AttributeName").asText();
        String samType = null;
        for (JsonNode attribute : properties.path("AttributeDefinitions")) {
            if (hashKey.equals(attribute.path("AttributeName").asText(null))) {
                samType = ATTRIBUTE_TYPES.get(attribute.path("AttributeType").asText(""));
            }
        }
        if (samType == null) {
            return Optional.empty();
        }

        ObjectNode converted = table.objectNode();
        ObjectNode primaryKey = converted.putObject("PrimaryKey");
        primaryKey.put("Name", hashKey);
        primaryKey.put("Type", samType);
        if (throughput.has("ReadCapacityUnits") || throughput.has("WriteCapacityUnits")) {
            converted.set("ProvisionedThroughput", throughput);
        }
        for (String key : new String[] {"TableName", "Tags", "PointInTimeRecoverySpecification", "SSESpecification"}) {
            JsonNode value = properties.get(key);
            if (value != null && !value.isNull()) {
                converted.set(key, value);
            }
        }
        return Optional.of(converted);
    }
}
