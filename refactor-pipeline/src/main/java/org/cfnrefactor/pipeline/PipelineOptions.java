package org.cfnrefactor.pipeline;

import java.io.IOException;
import java.nio.file.Path;

import org.cfnrefactor.cdk.NormalizerOptions;
import org.cfnrefactor.sam.ConversionOptions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which stages of {@link TemplateRefactorPipeline} run, and with what settings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineOptions {

    /** Rename CDK logical ids and drop CDK scaffolding first. */
    @Builder.Default
    private boolean normalize = true;

    /** Convert to AWS SAM after normalizing. */
    @Builder.Default
    private boolean samify = true;

    @Builder.Default
    private NormalizerOptions normalizer = NormalizerOptions.readable();

    @Builder.Default
    private ConversionOptions conversion = ConversionOptions.defaults();

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }

    public static PipelineOptions read(Path path) throws IOException {
        return new ObjectMapper().readValue(path.toFile(), PipelineOptions.class);
    }
}
