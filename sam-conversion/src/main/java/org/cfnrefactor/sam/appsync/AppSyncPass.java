package org.cfnrefactor.sam.appsync;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.EmbeddedIdRewriter;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.InlineCode;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Collapses an {@code AWS::AppSync::GraphQLApi} with its schema, data sources, pipeline functions,
 * pipeline resolvers and API keys into one {@code AWS::Serverless::GraphQLApi}.
 * <p>
 * The API is left alone when any data source is neither DynamoDB nor Lambda, when a resolver is not a
 * pipeline resolver, or when one of the absorbed resources is referenced from outside the API.
 */
@Slf4j
public class AppSyncPass implements ConversionPass {

    static final String API_TYPE = "AWS::AppSync::GraphQLApi";
    static final String SCHEMA_TYPE = "AWS::AppSync::GraphQLSchema";
    static final String DATA_SOURCE_TYPE = "AWS::AppSync::DataSource";
    static final String FUNCTION_TYPE = "AWS::AppSync::FunctionConfiguration";
    static final String RESOLVER_TYPE = "AWS::AppSync::Resolver";
    static final String API_KEY_TYPE = "AWS::AppSync::ApiKey";

    static final String SCHEMA_FILE = "schema.graphql";

    private static final Map<String, String> AUTH_CONFIGS = authConfigs();

    private static final Set<String> API_PROPERTIES = Set.of(
        "Name", "AuthenticationType", "OpenIDConnectConfig", "UserPoolConfig", "LambdaAuthorizerConfig",
        "AdditionalAuthenticationProviders", "LogConfig", "XrayEnabled", "Tags", "Cache", "DomainName");

    @Override
    public String name() {
        return "appsync";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        boolean changed = false;
        for (Map.Entry<String, ObjectNode> entry : ResourceGraph.resourcesOfType(template, API_TYPE).entrySet()) {
            if (collapse(context, entry.getKey(), entry.getValue())) {
                context.recordConversion(entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    /** Function or resolver whose code is resolved once the API is known to collapse. */
    private record CodeTarget(String logicalId, ObjectNode properties, String defaultName, ObjectNode entry) {
    }

    /** Resources absorbed into one API, grouped by how they are written back. */
    private static final class Absorbed {
        final List<String> removed = new ArrayList<>();
        final Map<String, String> apiKeyIds = new LinkedHashMap<>();
        final List<CodeTarget> code = new ArrayList<>();
    }

    private boolean collapse(ConversionContext context, String apiId, ObjectNode api) {
        Template template = context.getTemplate();
        var properties = ResourceNodes.properties(api);
        if (properties.isEmpty()) {
            return false;
        }
        List<String> unsupported = new ArrayList<>();
        properties.get().fieldNames().forEachRemaining(key -> {
            if (!API_PROPERTIES.contains(key)) {
                unsupported.add(key);
            }
        });
        if (!unsupported.isEmpty()) {
            log.debug("Skipping GraphQL API {}: no SAM equivalent for {}", apiId, unsupported);
            return false;
        }
        Absorbed absorbed = new Absorbed();

        var schema = owned(template, SCHEMA_TYPE, apiId).entrySet().stream().findFirst();
        if (schema.isEmpty()) {
            log.debug("Skipping GraphQL API {}: no schema", apiId);
            return false;
        }
        ObjectNode schemaProperties = ResourceNodes.properties(schema.get().getValue()).orElseThrow();
        JsonNode definition = schemaProperties.get("Definition");
        JsonNode definitionUri = schemaProperties.get("DefinitionS3Location");
        if (definition == null && definitionUri == null) {
            log.debug("Skipping GraphQL API {}: schema has no definition", apiId);
            return false;
        }
        absorbed.removed.add(schema.get().getKey());

        Map<String, String> dataSourceNames = new HashMap<>();
        var dataSources = dataSources(template, apiId, dataSourceNames, absorbed);
        if (dataSources.isEmpty()) {
            log.debug("Skipping GraphQL API {}: data sources other than DynamoDB or Lambda", apiId);
            return false;
        }
        ObjectNode functions = functions(template, apiId, dataSourceNames, absorbed);
        if (functions.isEmpty()) {
            log.debug("Skipping GraphQL API {}: no pipeline functions", apiId);
            return false;
        }
        var resolvers = resolvers(template, apiId, absorbed);
        if (resolvers.isEmpty() || resolvers.get().isEmpty()) {
            log.debug("Skipping GraphQL API {}: resolvers are missing or not pipeline resolvers", apiId);
            return false;
        }
        var auth = auth(properties.get());
        if (auth.isEmpty()) {
            log.debug("Skipping GraphQL API {}: no authentication type", apiId);
            return false;
        }
        ObjectNode apiKeys = apiKeys(template, apiId, absorbed);

        List<String> ignored = new ArrayList<>(absorbed.removed);
        ignored.addAll(absorbed.apiKeyIds.keySet());
        ignored.add(apiId);
        if (!ResourceGraph.blockingReferences(template, absorbed.removed, ignored).isEmpty()
            || ResourceGraph.isReferencedOutsideResources(template, absorbed.removed)) {
            log.debug("Skipping GraphQL API {}: absorbed resources referenced elsewhere", apiId);
            return false;
        }
        for (CodeTarget target : absorbed.code) {
            AppSyncCode.resolve(context, target.logicalId(), target.properties(), target.defaultName(), target.entry());
        }

        ObjectNode converted = api.objectNode();
        converted.set("Auth", auth.get());
        copy(properties.get(), "Name", converted, "Name");
        schema(context, schema.get().getKey(), apiId, definition, definitionUri, converted);
        converted.set("DataSources", dataSources.get());
        converted.set("Functions", functions);
        converted.set("Resolvers", resolvers.get());
        if (!apiKeys.isEmpty()) {
            converted.set("ApiKeys", apiKeys);
        }
        copy(properties.get(), "LogConfig", converted, "Logging");
        for (String same : List.of("XrayEnabled", "Tags", "Cache", "DomainName")) {
            copy(properties.get(), same, converted, same);
        }

        api.put(ResourceNodes.TYPE, SamTypes.GRAPHQL_API);
        api.set(ResourceNodes.PROPERTIES, converted);
        List<String> removals = new ArrayList<>(absorbed.removed);
        removals.addAll(absorbed.apiKeyIds.keySet());
        ResourceGraph.removeResources(template, removals);
        redirectApiKeys(context, apiId, absorbed.apiKeyIds);
        log.debug("Collapsed GraphQL API {} with {} absorbed resources", apiId, removals.size());
        return true;
    }

    private static void schema(ConversionContext context, String schemaId, String apiId, JsonNode definition,
                               JsonNode definitionUri, ObjectNode converted) {
        if (definition == null) {
            converted.set("SchemaUri", definitionUri);
            return;
        }
        if (!definition.isTextual()) {
            converted.set("SchemaInline", definition);
            return;
        }
        String prepared = InlineCode.prepare(definition.asText());
        var stager = context.stager();
        if (context.getOptions().isPreferExternalAssets() && stager.isPresent()) {
            String stagedId = schemaId != null ? schemaId : apiId + "Schema";
            Path staged = stager.get().stageInlineText(stagedId, prepared, SCHEMA_FILE);
            converted.put("SchemaUri", context.codeUri(staged));
        } else {
            converted.put("SchemaInline", prepared);
        }
    }

    private static Optional<ObjectNode> dataSources(Template template, String apiId, Map<String, String> names,
                                                    Absorbed absorbed) {
        ObjectNode dynamoDb = template.getRoot().objectNode();
        ObjectNode lambda = template.getRoot().objectNode();
        for (Map.Entry<String, ObjectNode> entry : owned(template, DATA_SOURCE_TYPE, apiId).entrySet()) {
            String logicalId = entry.getKey();
            ObjectNode properties = ResourceNodes.properties(entry.getValue()).orElseThrow();
            Optional<String> friendly = ResourceNodes.textProperty(properties, "Name");
            String key = friendly.orElse(logicalId);
            String type = ResourceNodes.textProperty(properties, "Type").orElse("");
            ObjectNode source;
            if ("AMAZON_DYNAMODB".equals(type)) {
                source = dynamoDb.putObject(key);
                JsonNode config = properties.path("DynamoDBConfig");
                copy(config, "TableName", source, "TableName");
                copy(config, "AwsRegion", source, "Region");
                copy(config, "DeltaSyncConfig", source, "DeltaSync");
                copy(config, "UseCallerCredentials", source, "UseCallerCredentials");
                copy(config, "Versioned", source, "Versioned");
            } else if ("AWS_LAMBDA".equals(type)) {
                source = lambda.putObject(key);
                copy(properties.path("LambdaConfig"), "LambdaFunctionArn", source, "FunctionArn");
            } else {
                return Optional.empty();
            }
            copy(properties, "ServiceRoleArn", source, "ServiceRoleArn");
            copy(properties, "Description", source, "Description");
            copy(properties, "Name", source, "Name");
            friendly.ifPresent(name -> names.put(name, key));
            names.put(logicalId, key);
            absorbed.removed.add(logicalId);
        }
        ObjectNode block = template.getRoot().objectNode();
        if (!dynamoDb.isEmpty()) {
            block.set("DynamoDb", dynamoDb);
        }
        if (!lambda.isEmpty()) {
            block.set("Lambda", lambda);
        }
        return block.isEmpty() ? Optional.empty() : Optional.of(block);
    }

    private static ObjectNode functions(Template template, String apiId, Map<String, String> dataSourceNames,
                                        Absorbed absorbed) {
        ObjectNode functions = template.getRoot().objectNode();
        for (Map.Entry<String, ObjectNode> entry : owned(template, FUNCTION_TYPE, apiId).entrySet()) {
            String logicalId = entry.getKey();
            ObjectNode properties = ResourceNodes.properties(entry.getValue()).orElseThrow();
            ObjectNode function = functions.putObject(logicalId);
            runtime(properties.get("Runtime")).ifPresent(runtime -> function.set("Runtime", runtime));
            References.extractLogicalId(properties.get("DataSourceName"))
                .ifPresent(name -> function.put("DataSource", dataSourceNames.getOrDefault(name, name)));
            copy(properties, "Description", function, "Description");
            copy(properties, "Name", function, "Name");
            copy(properties, "MaxBatchSize", function, "MaxBatchSize");
            copy(properties, "SyncConfig", function, "Sync");
            absorbed.code.add(new CodeTarget(logicalId, properties, "function", function));
            absorbed.removed.add(logicalId);
        }
        return functions;
    }

    /**
     * @return resolvers grouped by type name; empty when a resolver cannot be expressed as a SAM pipeline
     */
    private static Optional<ObjectNode> resolvers(Template template, String apiId, Absorbed absorbed) {
        ObjectNode grouped = template.getRoot().objectNode();
        List<CodeTarget> consumed = new ArrayList<>();
        for (Map.Entry<String, ObjectNode> entry : owned(template, RESOLVER_TYPE, apiId).entrySet()) {
            String logicalId = entry.getKey();
            ObjectNode properties = ResourceNodes.properties(entry.getValue()).orElseThrow();
            String kind = ResourceNodes.textProperty(properties, "Kind").orElse("PIPELINE");
            String typeName = ResourceNodes.textProperty(properties, "TypeName").orElse("");
            String fieldName = ResourceNodes.textProperty(properties, "FieldName").orElse("");
            JsonNode pipelineFunctions = properties.path("PipelineConfig").path("Functions");
            if (!"PIPELINE".equals(kind) || typeName.isEmpty() || fieldName.isEmpty()
                || !pipelineFunctions.isArray() || pipelineFunctions.isEmpty()) {
                log.debug("Resolver {} is not a pipeline resolver", logicalId);
                return Optional.empty();
            }
            ArrayNode pipeline = grouped.arrayNode();
            for (JsonNode function : pipelineFunctions) {
                var functionId = References.extractLogicalId(function);
                if (functionId.isEmpty()) {
                    return Optional.empty();
                }
                pipeline.add(functionId.get());
            }
            ObjectNode group = grouped.has(typeName) ? (ObjectNode) grouped.get(typeName) : grouped.putObject(typeName);
            ObjectNode resolver = group.putObject(logicalId);
            resolver.put("FieldName", fieldName);
            resolver.set("Pipeline", pipeline);
            runtime(properties.get("Runtime")).ifPresent(runtime -> resolver.set("Runtime", runtime));
            copy(properties, "MaxBatchSize", resolver, "MaxBatchSize");
            copy(properties, "SyncConfig", resolver, "Sync");
            copy(properties, "CachingConfig", resolver, "Caching");
            consumed.add(new CodeTarget(logicalId, properties, "resolver", resolver));
        }
        consumed.forEach(target -> absorbed.removed.add(target.logicalId()));
        absorbed.code.addAll(consumed);
        return Optional.of(grouped);
    }

    private static ObjectNode apiKeys(Template template, String apiId, Absorbed absorbed) {
        ObjectNode keys = template.getRoot().objectNode();
        owned(template, API_KEY_TYPE, apiId).forEach((logicalId, resource) -> {
            ObjectNode properties = ResourceNodes.properties(resource).orElseThrow();
            ObjectNode key = keys.putObject(logicalId);
            copy(properties, "Description", key, "Description");
            copy(properties, "Expires", key, "ExpiresOn");
            JsonNode keyId = properties.get("ApiKeyId");
            if (keyId != null && !keyId.isNull()) {
                key.set("ApiKeyId", keyId);
            } else {
                key.put("ApiKeyId", logicalId);
            }
            // SAM names the generated key <ApiId><KeyId>
            absorbed.apiKeyIds.put(logicalId, apiId + logicalId);
        });
        return keys;
    }

    /**
     * Point references at the keys SAM generates. Structural references are rewritten exactly; ids
     * embedded in literal strings only on a best-effort basis, outside the API itself.
     */
    private static void redirectApiKeys(ConversionContext context, String apiId, Map<String, String> apiKeyIds) {
        if (apiKeyIds.isEmpty()) {
            return;
        }
        context.redirectReferences(apiKeyIds);
        Map<String, String> embedded = new LinkedHashMap<>(apiKeyIds);
        apiKeyIds.values().forEach(generated -> embedded.put(generated, generated));
        EmbeddedIdRewriter rewriter = new EmbeddedIdRewriter(embedded);
        Template template = context.getTemplate();
        template.resourceEntries().forEach((id, resource) -> {
            if (!id.equals(apiId)) {
                ResourceNodes.properties(resource).ifPresent(rewriter::rewrite);
            }
        });
        template.findSection(Template.OUTPUTS).ifPresent(rewriter::rewrite);
    }

    static Optional<ObjectNode> auth(ObjectNode properties) {
        var type = ResourceNodes.textProperty(properties, "AuthenticationType");
        if (type.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode auth = properties.objectNode();
        auth.put("Type", type.get());
        AUTH_CONFIGS.forEach((source, target) -> copy(properties, source, auth, target));
        JsonNode providers = properties.get("AdditionalAuthenticationProviders");
        if (providers != null && providers.isArray()) {
            ArrayNode additional = auth.arrayNode();
            for (JsonNode provider : providers) {
                var providerType = ResourceNodes.textProperty(provider, "AuthenticationType");
                if (providerType.isEmpty()) {
                    continue;
                }
                ObjectNode entry = additional.addObject();
                entry.put("Type", providerType.get());
                copy(provider, "LambdaAuthorizerConfig", entry, "LambdaAuthorizer");
                copy(provider, "OpenIDConnectConfig", entry, "OpenIDConnect");
                copy(provider, "UserPoolConfig", entry, "UserPool");
            }
            if (!additional.isEmpty()) {
                auth.set("Additional", additional);
            }
        }
        return Optional.of(auth);
    }

    /**
     * AppSync runtimes carry {@code RuntimeVersion}; SAM expects {@code Version}.
     */
    static Optional<ObjectNode> runtime(JsonNode value) {
        if (value == null || !value.isObject()) {
            return Optional.empty();
        }
        ObjectNode runtime = ((ObjectNode) value).objectNode();
        copy(value, "Name", runtime, "Name");
        JsonNode version = value.has("Version") ? value.get("Version") : value.get("RuntimeVersion");
        if (version != null && !version.isNull()) {
            runtime.set("Version", version);
        }
        return runtime.isEmpty() ? Optional.empty() : Optional.of(runtime);
    }

    private static Map<String, ObjectNode> owned(Template template, String type, String apiId) {
        Map<String, ObjectNode> owned = new LinkedHashMap<>();
        ResourceGraph.resourcesOfType(template, type).forEach((id, resource) -> {
            boolean matches = ResourceNodes.properties(resource)
                .flatMap(p -> References.extractLogicalId(p.get("ApiId")))
                .map(apiId::equals)
                .orElse(false);
            if (matches) {
                owned.put(id, resource);
            }
        });
        return owned;
    }

    private static void copy(JsonNode from, String sourceKey, ObjectNode to, String targetKey) {
        JsonNode value = from.get(sourceKey);
        if (value != null && !value.isNull()) {
            to.set(targetKey, value);
        }
    }

    private static Map<String, String> authConfigs() {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("OpenIDConnectConfig", "OpenIDConnect");
        names.put("UserPoolConfig", "UserPool");
        names.put("LambdaAuthorizerConfig", "LambdaAuthorizer");
        return names;
    }
}
