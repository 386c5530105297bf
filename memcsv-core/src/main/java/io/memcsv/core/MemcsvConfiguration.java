package io.memcsv.core;

import io.memcsv.core.converter.ConversionPolicy;
import io.memcsv.core.converter.TypeConverterRegistry;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Immutable configuration for loading tables and converting their cells.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * MemcsvConfiguration config = MemcsvConfiguration.builder()
 *     .delimiter(';')
 *     .conversionPolicy(ConversionPolicy.LENIENT)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.memcsv.kernel.CsvTableLoader
 */
public final class MemcsvConfiguration {

    private static final MemcsvConfiguration DEFAULTS = builder().build();

    // Parsing
    private final char delimiter;
    private final Charset charset;
    private final boolean trimWhitespace;
    private final boolean skipBlankLines;

    // Conversion
    private final ConversionPolicy conversionPolicy;
    private final TypeConverterRegistry converterRegistry;

    private MemcsvConfiguration(Builder builder) {
        this.delimiter = builder.delimiter;
        this.charset = builder.charset;
        this.trimWhitespace = builder.trimWhitespace;
        this.skipBlankLines = builder.skipBlankLines;
        this.conversionPolicy = builder.conversionPolicy;
        this.converterRegistry = builder.converterRegistry != null
                ? builder.converterRegistry
                : TypeConverterRegistry.getInstance();
    }

    /**
     * Create a new builder for MemcsvConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default value.
     */
    public static MemcsvConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the field delimiter.
     *
     * @return the delimiter (default: ',')
     */
    public char delimiter() {
        return delimiter;
    }

    /**
     * Get the charset used to decode files.
     *
     * @return the charset (default: UTF-8)
     */
    public Charset charset() {
        return charset;
    }

    /**
     * Check if leading and trailing whitespace is stripped from every field.
     *
     * @return true if fields are trimmed (default: true)
     */
    public boolean trimWhitespace() {
        return trimWhitespace;
    }

    /**
     * Check if blank data lines are dropped instead of becoming all-empty rows.
     *
     * @return true if blank lines are skipped (default: false)
     */
    public boolean skipBlankLines() {
        return skipBlankLines;
    }

    public ConversionPolicy conversionPolicy() {
        return conversionPolicy;
    }

    public TypeConverterRegistry converterRegistry() {
        return converterRegistry;
    }

    /**
     * Builder for MemcsvConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private char delimiter = ',';
        private Charset charset = StandardCharsets.UTF_8;
        private boolean trimWhitespace = true;
        private boolean skipBlankLines = false;
        private ConversionPolicy conversionPolicy = ConversionPolicy.STRICT;
        private TypeConverterRegistry converterRegistry;

        private Builder() {
        }

        /**
         * Set the field delimiter.
         *
         * @param delimiter the delimiter character
         * @return this builder for method chaining
         */
        public Builder delimiter(char delimiter) {
            if (delimiter == '\n' || delimiter == '\r') {
                throw new IllegalArgumentException("delimiter must not be a line separator");
            }
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Set the charset used to decode files.
         *
         * @param charset the charset
         * @return this builder for method chaining
         */
        public Builder charset(Charset charset) {
            if (charset == null) {
                throw new IllegalArgumentException("charset required");
            }
            this.charset = charset;
            return this;
        }

        /**
         * Enable or disable whitespace trimming of fields.
         *
         * @param trimWhitespace true to trim fields (default: true)
         * @return this builder for method chaining
         */
        public Builder trimWhitespace(boolean trimWhitespace) {
            this.trimWhitespace = trimWhitespace;
            return this;
        }

        /**
         * Enable or disable skipping of blank data lines.
         *
         * @param skipBlankLines true to skip blank lines (default: false)
         * @return this builder for method chaining
         */
        public Builder skipBlankLines(boolean skipBlankLines) {
            this.skipBlankLines = skipBlankLines;
            return this;
        }

        /**
         * Set how non-empty cells that fail to parse are handled.
         *
         * @param conversionPolicy STRICT to fail, LENIENT to fall back to the empty value
         * @return this builder for method chaining
         */
        public Builder conversionPolicy(ConversionPolicy conversionPolicy) {
            if (conversionPolicy == null) {
                throw new IllegalArgumentException("conversionPolicy required");
            }
            this.conversionPolicy = conversionPolicy;
            return this;
        }

        public Builder converterRegistry(TypeConverterRegistry converterRegistry) {
            this.converterRegistry = converterRegistry;
            return this;
        }

        /**
         * Build the immutable MemcsvConfiguration.
         *
         * @return a new MemcsvConfiguration instance
         */
        public MemcsvConfiguration build() {
            return new MemcsvConfiguration(this);
        }
    }
}
