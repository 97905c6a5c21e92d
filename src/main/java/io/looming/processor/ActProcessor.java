package io.looming.processor;

/**
 * Post-processing step an act opts into by name. Runs against the captured
 * response after it is persisted and cannot change it.
 */
public interface ActProcessor {
    String name();

    ProcessorOutcome process(ProcessorContext context);
}
