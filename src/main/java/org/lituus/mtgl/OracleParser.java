package org.lituus.mtgl;

import org.lituus.mtgl.error.Diagnostic;
import org.lituus.mtgl.error.MtglError;
import org.lituus.mtgl.error.MtglException;
import org.lituus.mtgl.grapher.CardClauses;
import org.lituus.mtgl.grapher.Grapher;
import org.lituus.mtgl.lexer.Lexer;
import org.lituus.mtgl.parser.Clause;
import org.lituus.mtgl.parser.ClauseEngine;
import org.lituus.mtgl.tagger.Tagger;
import org.lituus.mtgl.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point of the oracle text pipeline.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = OracleParser.standard();
 * var tree = parser.parse(Card.fromOracle("Dark Ritual", "Add {B}{B}{B}."));
 * System.out.println(tree);
 * }</pre>
 *
 * <p>The configuration is swapped atomically; a call observes one configuration from start to end.
 */
public final class OracleParser {
    private static final Logger log = LoggerFactory.getLogger(OracleParser.class);
    private static final int MAX_LINE_LENGTH = 10_000;

    private final AtomicReference<Stages> stages;

    private OracleParser(PipelineConfig config) {
        this.stages = new AtomicReference<>(Stages.of(config));
    }

    public static OracleParser create(PipelineConfig config) {
        return new OracleParser(config);
    }

    public static OracleParser standard() {
        return create(PipelineConfig.standard());
    }

    public PipelineConfig config() {
        return stages.get().config();
    }

    /**
     * Replace catalog, grammar or parser options. Runs already in progress finish with the previous configuration.
     */
    public void updateConfig(PipelineConfig config) {
        var previous = stages.getAndSet(Stages.of(config));
        log.info("Pipeline configuration changed from {} to {}", previous.config().version(), config.version());
    }

    /**
     * Run one ability line through tagger, lexer and parser and keep every intermediate result.
     *
     * @param cardName card name recognized as a self reference, may be null
     */
    public ParsedLine inspect(String line, String cardName) {
        return stages.get().line(1, line, cardName);
    }

    /**
     * Parse a single card into its tree.
     *
     * @throws MtglException with an {@link MtglError.InputError} for a card without name or text or with an
     *                       overlong line,
     *                       or a {@link MtglError.StructuralError} from tree construction
     */
    public Tree parse(Card card) {
        var snapshot = stages.get();
        validate(0, card).ifPresent(error -> {
            throw new MtglException(error);
        });
        return snapshot.card(card).tree();
    }

    /**
     * Parse a batch of cards in parallel. Outcomes keep input order; one card's failure never affects another.
     */
    public BatchReport parseAll(List<Card> cards) {
        var snapshot = stages.get();
        var version = snapshot.config().version();
        log.info("Parsing {} cards with {} ({} workers)", cards.size(), version, snapshot.config().parallelism());

        var executor = Executors.newFixedThreadPool(snapshot.config().parallelism());
        try {
            var futures = new ArrayList<Future<CardOutcome>>(cards.size());
            for (int i = 0; i < cards.size(); i++) {
                futures.add(executor.submit(task(i, cards.get(i), snapshot::card)));
            }
            var outcomes = new ArrayList<CardOutcome>(cards.size());
            for (var future : futures) {
                outcomes.add(future.get());
            }
            var report = BatchReport.of(version, outcomes);
            log.info("Batch finished: {}", report.summary());
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Card processing failed unexpectedly", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Work item of one batch card. Whatever goes wrong ends up in the outcome, never in the batch.
     */
    static Callable<CardOutcome> task(int position, Card card, Function<Card, ParsedCard> pipeline) {
        return () -> {
            var invalid = validate(position, card);
            if (invalid.isPresent()) {
                log.warn(invalid.get().message());
                return new CardOutcome.Rejected(position, invalid.get());
            }
            try {
                var parsed = pipeline.apply(card);
                return new CardOutcome.Parsed(position, card, parsed.tree(), parsed.lines());
            } catch (MtglException e) {
                logFailure(card, e.error());
                return new CardOutcome.Failed(position, card, e.error());
            } catch (RuntimeException e) {
                log.error("Unexpected failure on card '{}'", card.name(), e);
                return new CardOutcome.Failed(position, card, new MtglError.ProcessingError(card.name(), e.toString()));
            }
        };
    }

    private static void logFailure(Card card, MtglError error) {
        if (error instanceof MtglError.StructuralError structural) {
            var diagnostic = Diagnostic.error(structural.reason(), structural.span())
                                       .withLabel(structural.clauseKind() + " clause")
                                       .withHelp("check the clause grammar rules producing this clause");
            log.warn("Structural failure\n{}", diagnostic.format(card.lines(), card.name()));
        } else {
            log.warn("Structural failure: {}", error.message());
        }
    }

    private static Optional<MtglError.InputError> validate(int position, Card card) {
        if (card == null) {
            return Optional.of(new MtglError.InputError(position, null, "missing card record"));
        }
        if (card.name() == null || card.name().isBlank()) {
            return Optional.of(new MtglError.InputError(position, null, "missing name"));
        }
        if (card.lines() == null || card.lines().isEmpty()) {
            return Optional.of(new MtglError.InputError(position, card.name(), "missing oracle text"));
        }
        for (int i = 0; i < card.lines().size(); i++) {
            if (card.lines().get(i).length() > MAX_LINE_LENGTH) {
                return Optional.of(new MtglError.InputError(position, card.name(), "ability line " + (i + 1)
                                                            + " exceeds " + MAX_LINE_LENGTH + " characters"));
            }
        }
        return Optional.empty();
    }

    record ParsedCard(Tree tree, List<ParsedLine> lines) {}

    /**
     * Stage instances built from one configuration.
     */
    private record Stages(PipelineConfig config, Tagger tagger, Lexer lexer, ClauseEngine engine, Grapher grapher) {
        static Stages of(PipelineConfig config) {
            return new Stages(config,
                              Tagger.create(config.catalog()),
                              Lexer.create(),
                              ClauseEngine.create(config.grammar(), config.parserConfig()),
                              Grapher.create());
        }

        ParsedLine line(int index, String text, String cardName) {
            var tagged = tagger.tag(text, cardName);
            var tokens = lexer.tokenize(tagged, index);
            var clauses = engine.parse(tokens);
            if (log.isDebugEnabled()) {
                clauses.stream()
                       .filter(Clause::isUnparsed)
                       .forEach(c -> log.debug("Unparsed span {} in line {}: '{}'", c.span(), index,
                                               c.span().extract(text)));
            }
            return new ParsedLine(index, text, tagged, tokens, clauses);
        }

        ParsedCard card(Card card) {
            var lines = new ArrayList<ParsedLine>(card.lines().size());
            var clauseLines = new ArrayList<CardClauses.Line>(card.lines().size());
            for (int i = 0; i < card.lines().size(); i++) {
                var parsed = line(i + 1, card.lines().get(i), card.name());
                lines.add(parsed);
                clauseLines.add(new CardClauses.Line(parsed.index(), parsed.text(), parsed.clauses()));
            }
            var input = new CardClauses(card.name(), config.catalog().version(), config.grammar().version(),
                                        clauseLines, card.isSpell());
            return new ParsedCard(grapher.graph(input), lines);
        }
    }
}
