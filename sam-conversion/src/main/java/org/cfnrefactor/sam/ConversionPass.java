package org.cfnrefactor.sam;

/**
 * One step of the conversion. Passes run in a fixed order and own the template exclusively while they run.
 */
public interface ConversionPass {

    String name();

    /**
     * Convert every candidate this pass recognises. Candidates with an unsupported shape are left alone.
     * @return true when the template changed
     * @throws TemplateValidationException when a candidate carries invalid input
     */
    boolean apply(ConversionContext context);
}
