package io.looming.backend;

/**
 * A text-generation provider. The core depends only on this contract.
 */
public interface GenerationBackend {
    String name();

    GenerationResponse generate(GenerationRequest request) throws BackendException;
}
