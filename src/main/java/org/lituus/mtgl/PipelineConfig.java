package org.lituus.mtgl;

import org.lituus.mtgl.catalog.SymbolCatalog;
import org.lituus.mtgl.grammar.Grammar;
import org.lituus.mtgl.grammar.GrammarParser;
import org.lituus.mtgl.grapher.CardClauses;
import org.lituus.mtgl.parser.ParserConfig;

import java.util.Objects;

/**
 * Immutable configuration of the whole pipeline. Replacing the catalog or the grammar means building a new
 * configuration and handing it to {@link OracleParser#updateConfig(PipelineConfig)}.
 *
 * @param parallelism number of worker threads used by {@link OracleParser#parseAll(java.util.List)}
 */
public record PipelineConfig(
    SymbolCatalog catalog,
    Grammar grammar,
    ParserConfig parserConfig,
    int parallelism
) {
    public PipelineConfig {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(parserConfig, "parserConfig");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
    }

    /**
     * Bundled catalog and grammar, default parser options, one worker per available processor.
     */
    public static PipelineConfig standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Version tag stamped on every tree built with this configuration.
     */
    public String version() {
        return CardClauses.versionTag(catalog.version(), grammar.version());
    }

    public static final class Builder {
        private SymbolCatalog catalog;
        private Grammar grammar;
        private ParserConfig parserConfig = ParserConfig.DEFAULT;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        private Builder() {}

        public Builder catalog(SymbolCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder grammar(Grammar grammar) {
            this.grammar = grammar;
            return this;
        }

        /**
         * Parse and validate clause grammar text.
         */
        public Builder grammarText(String grammarText) {
            this.grammar = GrammarParser.parse(grammarText)
                                        .validate();
            return this;
        }

        public Builder parserConfig(ParserConfig parserConfig) {
            this.parserConfig = parserConfig;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(catalog != null ? catalog : SymbolCatalog.standard(),
                                      grammar != null ? grammar : Grammar.standard(),
                                      parserConfig,
                                      parallelism);
        }
    }
}
