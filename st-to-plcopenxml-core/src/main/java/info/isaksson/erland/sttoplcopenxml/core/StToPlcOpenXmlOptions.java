package info.isaksson.erland.sttoplcopenxml.core;

import info.isaksson.erland.sttoplcopenxml.emitter.EmitterOptions;

import java.time.LocalDateTime;

/**
 * Core (embedding-friendly) options for one conversion.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class StToPlcOpenXmlOptions {
    public String author = "";
    public String companyName = "";
    public String productName = EmitterOptions.DEFAULT_PRODUCT_NAME;
    public String productVersion = EmitterOptions.DEFAULT_PRODUCT_VERSION;

    /** Document timestamp; null means the time of conversion. */
    public LocalDateTime timestamp;

    /**
     * Seed for object ids. When set, the same input and options reproduce the same document;
     * when null, ids are drawn from a secure random source.
     */
    public Long seed;
}
