package io.looming.processor;

/**
 * Extracts structured rows from an act's response against the act's schema.
 */
public final class JsonExtractionProcessor implements ActProcessor {
    public static final String NAME = "json_extraction";

    private final ContentExtractor extractor;

    public JsonExtractionProcessor() {
        this(new ContentExtractor());
    }

    public JsonExtractionProcessor(ContentExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProcessorOutcome process(ProcessorContext context) {
        try {
            return ProcessorOutcome.ok(extractor.extract(context.capture().response(), context.act().schema()));
        } catch (ExtractionException e) {
            return ProcessorOutcome.failed(e.kind().name(), e.getMessage());
        }
    }

    public static boolean isExtraction(String processorName) {
        return NAME.equals(processorName);
    }
}
