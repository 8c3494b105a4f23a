package org.cfnrefactor.sam;

/**
 * Resource type names used across passes.
 */
public final class SamTypes {

    public static final String FUNCTION = "AWS::Serverless::Function";
    public static final String API = "AWS::Serverless::Api";
    public static final String HTTP_API = "AWS::Serverless::HttpApi";
    public static final String STATE_MACHINE = "AWS::Serverless::StateMachine";
    public static final String GRAPHQL_API = "AWS::Serverless::GraphQLApi";
    public static final String SIMPLE_TABLE = "AWS::Serverless::SimpleTable";
    public static final String LAYER_VERSION = "AWS::Serverless::LayerVersion";

    public static final String SERVERLESS_PREFIX = "AWS::Serverless::";

    public static final String LAMBDA_FUNCTION = "AWS::Lambda::Function";
    public static final String LAMBDA_PERMISSION = "AWS::Lambda::Permission";
    public static final String LAMBDA_URL = "AWS::Lambda::Url";
    public static final String LAMBDA_LAYER = "AWS::Lambda::LayerVersion";
    public static final String EVENT_SOURCE_MAPPING = "AWS::Lambda::EventSourceMapping";
    public static final String IAM_ROLE = "AWS::IAM::Role";
    public static final String IAM_POLICY = "AWS::IAM::Policy";

    private SamTypes() {}
}
