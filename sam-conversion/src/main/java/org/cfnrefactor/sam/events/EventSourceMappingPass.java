package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.FunctionEvents;
import org.cfnrefactor.sam.SamTypes;
import org.cfnrefactor.sam.TemplateValidationException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds {@code AWS::Lambda::EventSourceMapping} resources into poll-based events ({@code SQS},
 * {@code Kinesis}, {@code DynamoDB}, {@code MSK}, {@code MQ}, {@code DocumentDB}, {@code SelfManagedKafka})
 * on the mapped function.
 */
@Slf4j
public class EventSourceMappingPass implements ConversionPass {

    static final String RESOURCE_KIND = "EventSourceMapping";

    private static final String EVENT_SOURCE_ARN = "EventSourceArn";
    private static final String BOOTSTRAP_SERVERS = "KafkaBootstrapServers";
    private static final String CONSUMER_GROUP_ID = "ConsumerGroupId";
    private static final String MSK_CONFIG = "AmazonManagedKafkaEventSourceConfig";
    private static final String DOCDB_CONFIG = "DocumentDBEventSourceConfig";
    private static final String SELF_MANAGED_SOURCE = "SelfManagedEventSource";

    static final List<String> COMMON_KEYS = List.of(
        "BatchSize", "Enabled", "StartingPosition", "StartingPositionTimestamp",
        "MaximumBatchingWindowInSeconds", "MaximumRetryAttempts", "BisectBatchOnFunctionError",
        "MaximumRecordAgeInSeconds", "ParallelizationFactor", "DestinationConfig", "FunctionResponseTypes",
        "FilterCriteria", "TumblingWindowInSeconds", "ScalingConfig", CONSUMER_GROUP_ID,
        "ProvisionedPollerConfig", "MetricsConfig");

    /** Mapping properties that only describe the source and have no counterpart on the event. */
    private static final Set<String> INPUT_ONLY_KEYS = Set.of(DOCDB_CONFIG, SELF_MANAGED_SOURCE, MSK_CONFIG);

    /**
     * @param eventType SAM event type
     * @param targetKey event property receiving the source
     * @param sourceKey mapping property holding the source
     * @param extraKeys mapping properties accepted on top of {@link #COMMON_KEYS}
     */
    record SourceKind(String eventType, String targetKey, String sourceKey, List<String> extraKeys) {
    }

    private static final List<String> KAFKA_EXTRAS = List.of(
        "Topics", CONSUMER_GROUP_ID, "SourceAccessConfigurations", "SchemaRegistryConfig",
        "ProvisionedPollerConfig", "MetricsConfig");

    static final SourceKind SQS = new SourceKind("SQS", "Queue", EVENT_SOURCE_ARN, List.of());
    static final SourceKind KINESIS = new SourceKind("Kinesis", "Stream", EVENT_SOURCE_ARN, List.of());
    static final SourceKind DYNAMODB = new SourceKind("DynamoDB", "Stream", EVENT_SOURCE_ARN, List.of());
    static final SourceKind MSK = new SourceKind("MSK", "Stream", EVENT_SOURCE_ARN, with(KAFKA_EXTRAS, MSK_CONFIG));
    static final SourceKind MQ = new SourceKind("MQ", "Broker", EVENT_SOURCE_ARN,
        List.of("Queues", "SourceAccessConfigurations"));
    static final SourceKind DOCUMENT_DB = new SourceKind("DocumentDB", "Cluster", EVENT_SOURCE_ARN,
        List.of(DOCDB_CONFIG, "SourceAccessConfigurations", "SecretsManagerKmsKeyId"));
    static final SourceKind SELF_MANAGED_KAFKA = new SourceKind("SelfManagedKafka", BOOTSTRAP_SERVERS,
        BOOTSTRAP_SERVERS, with(KAFKA_EXTRAS, SELF_MANAGED_SOURCE));

    @Override
    public String name() {
        return "event-source-mappings";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        List<String> removals = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, SamTypes.EVENT_SOURCE_MAPPING).forEach((mappingId, mapping) -> {
            var properties = ResourceNodes.properties(mapping);
            if (properties.isEmpty()) {
                return;
            }
            var functionId = context.convertedFunction(properties.get().get("FunctionName"));
            if (functionId.isEmpty()) {
                return;
            }
            var event = toEvent(template, mappingId, properties.get());
            if (event.isEmpty()) {
                log.debug("Skipping event source mapping {}: unsupported source or properties", mappingId);
                return;
            }
            if (!Satellites.isRemovable(template, mappingId, removals)) {
                log.debug("Skipping event source mapping {}: referenced elsewhere", mappingId);
                return;
            }
            ObjectNode function = template.resource(functionId.get()).orElseThrow();
            String eventName = FunctionEvents.add(function, mappingId, 1,
                event.get().kind().eventType(), event.get().properties());
            log.debug("Folded event source mapping {} into {} event {}", mappingId, functionId.get(), eventName);
            removals.add(mappingId);
        });
        ResourceGraph.removeResources(template, removals);
        return !removals.isEmpty();
    }

    record MappedEvent(SourceKind kind, ObjectNode properties) {
    }

    static Optional<MappedEvent> toEvent(Template template, String mappingId, ObjectNode properties) {
        var detected = detect(template, properties);
        if (detected.isEmpty()) {
            return Optional.empty();
        }
        SourceKind kind = detected.get();
        Set<String> allowed = new LinkedHashSet<>(COMMON_KEYS);
        allowed.addAll(kind.extraKeys());
        allowed.add(kind.sourceKey());
        allowed.add("FunctionName");
        var fields = properties.fieldNames();
        while (fields.hasNext()) {
            String key = fields.next();
            if (!allowed.contains(key)) {
                log.debug("Event source mapping {} carries {} which has no event equivalent", mappingId, key);
                return Optional.empty();
            }
        }

        JsonNode source = properties.get(kind.sourceKey());
        if (source == null && kind == SELF_MANAGED_KAFKA) {
            source = properties.path(SELF_MANAGED_SOURCE).path("Endpoints").get(BOOTSTRAP_SERVERS);
        }
        if (source == null || source.isNull()) {
            return Optional.empty();
        }
        ObjectNode event = properties.objectNode();
        event.set(kind.targetKey(), source);

        JsonNode mskConfig = properties.get(MSK_CONFIG);
        if (mskConfig != null && mskConfig.isObject() && mskConfig.has(CONSUMER_GROUP_ID)) {
            if (properties.has(CONSUMER_GROUP_ID)) {
                throw TemplateValidationException.invalidEvent(RESOURCE_KIND, CONSUMER_GROUP_ID, mappingId,
                    "Conflict: ConsumerGroupId specified both directly and via AmazonManagedKafkaEventSourceConfig.");
            }
            JsonNode consumerGroup = mskConfig.get(CONSUMER_GROUP_ID);
            if (!consumerGroup.isTextual() && !consumerGroup.isObject()) {
                throw TemplateValidationException.invalidEvent(RESOURCE_KIND, CONSUMER_GROUP_ID, mappingId,
                    "ConsumerGroupId from AmazonManagedKafkaEventSourceConfig must be a string or intrinsic function.");
            }
            event.set(CONSUMER_GROUP_ID, consumerGroup);
        }

        for (String key : COMMON_KEYS) {
            copy(properties, event, key);
        }
        for (String key : kind.extraKeys()) {
            if (!key.equals(kind.sourceKey()) && !INPUT_ONLY_KEYS.contains(key)) {
                copy(properties, event, key);
            }
        }

        if (kind == DOCUMENT_DB) {
            JsonNode config = properties.get(DOCDB_CONFIG);
            if (config != null && config.isObject()) {
                copy((ObjectNode) config, event, "DatabaseName");
                copy((ObjectNode) config, event, "CollectionName");
                copy((ObjectNode) config, event, "FullDocument");
            }
            if (!event.has("DatabaseName") || !event.has("SourceAccessConfigurations")
                || !event.has("StartingPosition")) {
                log.debug("Event source mapping {}: DocumentDB needs a database, credentials and a starting position",
                    mappingId);
                return Optional.empty();
            }
        }
        return Optional.of(new MappedEvent(kind, event));
    }

    /**
     * Work out the source from the type of the referenced resource, falling back to the ARN text.
     */
    static Optional<SourceKind> detect(Template template, ObjectNode properties) {
        if (properties.has(SELF_MANAGED_SOURCE)) {
            return Optional.of(SELF_MANAGED_KAFKA);
        }
        JsonNode arn = properties.get(EVENT_SOURCE_ARN);
        if (arn == null || arn.isNull() || (arn.isTextual() && arn.asText().isEmpty())) {
            return Optional.empty();
        }
        var referencedType = References.extractReferencedId(arn).flatMap(template::typeOf).orElse("");
        switch (referencedType) {
            case "AWS::SQS::Queue":
                return Optional.of(SQS);
            case "AWS::Kinesis::Stream":
                return Optional.of(KINESIS);
            case "AWS::DynamoDB::Table":
                return Optional.of(DYNAMODB);
            case "AWS::MSK::Cluster":
                return Optional.of(MSK);
            case "AWS::AmazonMQ::Broker":
                return Optional.of(MQ);
            case "AWS::DocDB::DBCluster":
                return Optional.of(DOCUMENT_DB);
            default:
                break;
        }

        String text = (arn.isTextual() ? arn.asText() : arn.toString()).toLowerCase(Locale.ROOT);
        if (text.contains("kafka") && text.contains("cluster")) {
            return Optional.of(MSK);
        }
        if (text.contains(":mq:")) {
            return Optional.of(MQ);
        }
        if (text.contains(":docdb:") || (text.contains(":rds:") && text.contains(":cluster:") && text.contains("docdb"))) {
            return Optional.of(DOCUMENT_DB);
        }
        if (text.contains(":dynamodb:")) {
            return Optional.of(DYNAMODB);
        }
        if (text.contains(":kinesis:")) {
            return Optional.of(KINESIS);
        }
        if (text.contains(":sqs:")) {
            return Optional.of(SQS);
        }
        return Optional.empty();
    }

    private static void copy(ObjectNode from, ObjectNode to, String key) {
        JsonNode value = from.get(key);
        if (value != null && !to.has(key)) {
            to.set(key, value);
        }
    }

    private static List<String> with(List<String> base, String extra) {
        List<String> keys = new ArrayList<>(base);
        keys.add(extra);
        return List.copyOf(keys);
    }
}
