package org.cfnrefactor.pipeline.sink;

import java.io.IOException;

import org.cfnrefactor.graph.Template;

/**
 * Receives the refactored template at the end of a pipeline run.
 */
public interface TemplateSink {

    void write(Template template) throws IOException;
}
