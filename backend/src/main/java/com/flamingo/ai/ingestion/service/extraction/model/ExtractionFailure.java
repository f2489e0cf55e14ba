package com.flamingo.ai.ingestion.service.extraction.model;

/**
 * A part or page that was dropped during extraction.
 *
 * @param sourceName file name, with the page when the failure is page-scoped
 * @param reason operator-facing reason
 * @param unsupported true when no extractor handles the media type
 */
public record ExtractionFailure(String sourceName, String reason, boolean unsupported) {}
