package org.cfnrefactor.pipeline.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.TemplateMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes the template as pretty-printed JSON, creating parent directories as needed.
 */
@Slf4j
public class FileTemplateSink implements TemplateSink {

    private final Path target;
    private final TemplateMapper mapper;

    public FileTemplateSink(Path target) {
        this(target, new TemplateMapper());
    }

    public FileTemplateSink(Path target, TemplateMapper mapper) {
        this.target = target;
        this.mapper = mapper;
    }

    @Override
    public void write(Template template) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.write(template, target);
        log.info("Wrote refactored template to {}", target);
    }
}
