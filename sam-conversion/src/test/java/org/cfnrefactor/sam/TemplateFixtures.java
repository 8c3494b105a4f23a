package org.cfnrefactor.sam;

import java.nio.file.Path;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.TemplateMapper;

public final class TemplateFixtures {

    private static final TemplateMapper MAPPER = new TemplateMapper();

    private TemplateFixtures() {}

    public static Template load(String name) throws Exception {
        return MAPPER.read(Path.of(TemplateFixtures.class.getResource("/templates/" + name).toURI()));
    }

    public static Template parse(String json) {
        return MAPPER.read(json);
    }

    public static ConversionContext context(Template template) {
        return new ConversionContext(template, ConversionOptions.defaults(), null);
    }

    /**
     * Run {@code passes} in order over a fresh context.
     */
    public static ConversionContext run(Template template, ConversionPass... passes) {
        ConversionContext context = context(template);
        for (ConversionPass pass : passes) {
            pass.apply(context);
        }
        return context;
    }
}
