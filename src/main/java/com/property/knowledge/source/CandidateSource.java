package com.property.knowledge.source;

import com.property.knowledge.core.model.CandidateEntry;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.metrics.MetricsService;
import com.property.knowledge.normalize.NormalizationResult;
import com.property.knowledge.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A file-backed candidate sequence. Each pass re-reads the file, normalizes
 * every record and skips (and counts) the ones that fail. Undecodable bytes
 * are read as U+FFFD so they only affect the record they sit in.
 *
 * <p>The result of the most recent pass that reached the end of the file is
 * available from {@link #lastResult()}.</p>
 */
public class CandidateSource implements CandidateSequence {
    private static final Logger log = LoggerFactory.getLogger(CandidateSource.class);

    private final SourceTag tag;
    private final Path path;
    private final RecordReader recordReader;
    private final RecordNormalizer normalizer;
    private final MetricsService metricsService;
    private volatile LoadResult lastResult;

    CandidateSource(SourceTag tag, Path path, RecordReader recordReader,
                    RecordNormalizer normalizer, MetricsService metricsService) {
        this.tag = tag;
        this.path = path;
        this.recordReader = recordReader;
        this.normalizer = normalizer;
        this.metricsService = metricsService;
    }

    @Override
    public SourceTag tag() {
        return tag;
    }

    public Path path() {
        return path;
    }

    @Override
    public Stream<CandidateEntry> stream() {
        BufferedReader reader;
        try {
            reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), lenientDecoder()));
        } catch (IOException e) {
            log.error("load.unavailable source={} path={} error={}", tag, path, e.getMessage());
            throw new SourceUnavailableException(tag, "Cannot read source " + tag + " at " + path, e);
        }

        Tally tally = new Tally();
        Stream<RecordBlock> blocks = recordReader.read(reader, tag);
        return StreamSupport.stream(trackCompletion(blocks.iterator(), tally), false)
                .map(block -> accept(block, tally))
                .flatMap(Optional::stream)
                .onClose(() -> finish(blocks, reader, tally));
    }

    private static CharsetDecoder lenientDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    private static Spliterator<RecordBlock> trackCompletion(Iterator<RecordBlock> blocks, Tally tally) {
        Iterator<RecordBlock> tracking = new Iterator<>() {
            @Override
            public boolean hasNext() {
                boolean more = blocks.hasNext();
                if (!more) {
                    tally.completed = true;
                }
                return more;
            }

            @Override
            public RecordBlock next() {
                return blocks.next();
            }
        };
        return Spliterators.spliteratorUnknownSize(tracking, Spliterator.ORDERED | Spliterator.NONNULL);
    }

    /**
     * Reads the whole source into a list, closing the pass.
     */
    public List<CandidateEntry> entries() {
        try (Stream<CandidateEntry> candidates = stream()) {
            return candidates.collect(Collectors.toList());
        }
    }

    /**
     * The result of the last pass that read the whole file, if any.
     */
    public Optional<LoadResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    private Optional<CandidateEntry> accept(RecordBlock block, Tally tally) {
        tally.recordsRead++;
        if (!block.isReadable()) {
            drop(tally, block.ordinal(), block.errorMessage());
            return Optional.empty();
        }

        NormalizationResult result = normalizer.normalize(block.record());
        if (result.isFailure()) {
            drop(tally, block.ordinal(), result.errorMessage());
            return Optional.empty();
        }

        tally.candidatesProduced++;
        metricsService.incrementCandidatesLoaded(tag);
        return Optional.of(result.entry());
    }

    private void drop(Tally tally, long ordinal, String message) {
        String location = tag.name() + "#" + ordinal;
        tally.errors.add(new LoadResult.LoadError(ordinal, location, message));
        metricsService.incrementRecordsDropped(tag);
        log.warn("load.dropped location={} error={}", location, message);
    }

    private void finish(Stream<RecordBlock> blocks, BufferedReader reader, Tally tally) {
        blocks.close();
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("load.close-failed source={} error={}", tag, e.getMessage());
        }
        if (!tally.completed) {
            log.warn("load.incomplete source={} recordsRead={}", tag, tally.recordsRead);
            return;
        }
        LoadResult result = new LoadResult(tag, tally.recordsRead, tally.candidatesProduced, tally.errors);
        lastResult = result;
        log.info("load.completed result={}", result);
    }

    @Override
    public String toString() {
        return "CandidateSource{tag=" + tag + ", path=" + path + '}';
    }

    private static final class Tally {
        private long recordsRead;
        private long candidatesProduced;
        private boolean completed;
        private final List<LoadResult.LoadError> errors = new ArrayList<>();
    }
}
