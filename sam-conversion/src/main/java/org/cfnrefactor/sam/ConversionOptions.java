package org.cfnrefactor.sam;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Toggles for the SAM conversion engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionOptions {

    /** Stage inline code and AppSync schemas as files instead of keeping them inline. */
    private boolean preferExternalAssets;

    /** Directories searched for CDK asset paths, in order. */
    @Builder.Default
    private List<String> assetSearchPaths = new ArrayList<>();

    /** Directory that emitted {@code CodeUri} values are made relative to, or null for absolute paths. */
    private String relativeTo;

    /** Move properties shared by every function into {@code Globals.Function}. */
    @Builder.Default
    private boolean hoistGlobals = true;

    /** Turn eligible DynamoDB tables into {@code AWS::Serverless::SimpleTable}. */
    @Builder.Default
    private boolean convertSimpleTables = true;

    /** Remove {@code aws:cdk:path} and asset metadata once conversion is done. */
    @Builder.Default
    private boolean stripCdkMetadata = true;

    public static ConversionOptions defaults() {
        return ConversionOptions.builder().build();
    }
}
