package com.goormthonuniv.trialguard.corpus;

import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live {@link CorpusIndex}. The index is never modified in place: a reload builds a
 * complete new index first and then swaps the reference, so a concurrent reader sees either
 * the old corpus or the new one.
 */
@Slf4j
@Component
public class CorpusRegistry {

    private final CorpusLoader loader;
    private final String location;
    private final AtomicReference<CorpusIndex> current;

    public CorpusRegistry(CorpusLoader loader,
                          @Value("${trialguard.corpus.location:classpath:data/historical_trials.json}") String location) {
        this.loader = loader;
        this.location = location;
        this.current = new AtomicReference<>(loader.load(location).index());
    }

    public CorpusIndex current() {
        return current.get();
    }

    /** Re-reads the configured document. On failure the previous index stays live. */
    public CorpusIndex reload() {
        CorpusIndex next = loader.load(location).index();
        return swap(next);
    }

    public CorpusIndex replace(List<TrialRecord> trials) {
        return replace(trials, Map.of());
    }

    public CorpusIndex replace(List<TrialRecord> trials, Map<String, FailurePattern> failurePatterns) {
        return swap(CorpusIndex.build(trials, failurePatterns));
    }

    private CorpusIndex swap(CorpusIndex next) {
        CorpusIndex previous = current.getAndSet(next);
        log.info("[TrialGuard] corpus swapped generation={} -> {} trials={}",
                previous.generation(), next.generation(), next.size());
        return next;
    }
}
