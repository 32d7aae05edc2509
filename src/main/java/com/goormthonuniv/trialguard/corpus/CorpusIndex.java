package com.goormthonuniv.trialguard.corpus;

import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialOutcome;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.util.TextUtils;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-only lookup structures over the historical corpus.
 *
 * <p>Postings are corpus positions held in {@link BitSet}s, so set algebra is cheap and
 * iteration always follows corpus order. Nothing here is mutated after {@link #build}
 * returns; every accessor hands out copies. Instances can be shared between threads freely.</p>
 *
 * <p>When two records share an identifier the later one wins and the earlier one drops out of
 * the index entirely. A record missing a key field is just not posted under that dimension.</p>
 */
public final class CorpusIndex {

    private static final AtomicLong GENERATIONS = new AtomicLong();

    private final long generation;
    private final List<TrialRecord> trials;
    private final Map<String, TrialRecord> byId;
    private final Map<String, BitSet> drugClassPostings;
    private final Map<String, BitSet> areaPostings;
    private final Map<TrialPhase, BitSet> phasePostings;
    private final Map<TrialOutcome, BitSet> outcomePostings;
    private final Map<String, BitSet> tagPostings;
    private final Map<String, FailurePattern> failurePatterns;

    private CorpusIndex(List<TrialRecord> trials, Map<String, FailurePattern> failurePatterns) {
        this.generation = GENERATIONS.incrementAndGet();
        this.trials = List.copyOf(trials);

        Map<String, TrialRecord> ids = new HashMap<>();
        Map<String, BitSet> drug = new HashMap<>();
        Map<String, BitSet> area = new HashMap<>();
        Map<TrialPhase, BitSet> phase = new EnumMap<>(TrialPhase.class);
        Map<TrialOutcome, BitSet> outcome = new EnumMap<>(TrialOutcome.class);
        Map<String, BitSet> tags = new HashMap<>();

        for (int pos = 0; pos < this.trials.size(); pos++) {
            TrialRecord t = this.trials.get(pos);
            if (!TextUtils.isBlank(t.nctId())) ids.put(t.nctId(), t);
            post(drug, TextUtils.normalize(t.drugClass()), pos);
            post(area, TextUtils.normalize(t.therapeuticArea()), pos);
            if (t.phase() != null) phase.computeIfAbsent(t.phase(), k -> new BitSet()).set(pos);
            outcome.computeIfAbsent(t.outcome(), k -> new BitSet()).set(pos);
            for (String tag : t.tags()) {
                post(tags, TextUtils.normalize(tag), pos);
            }
        }

        this.byId = Collections.unmodifiableMap(ids);
        this.drugClassPostings = Collections.unmodifiableMap(drug);
        this.areaPostings = Collections.unmodifiableMap(area);
        this.phasePostings = Collections.unmodifiableMap(phase);
        this.outcomePostings = Collections.unmodifiableMap(outcome);
        this.tagPostings = Collections.unmodifiableMap(tags);
        this.failurePatterns = Map.copyOf(failurePatterns);
    }

    public static CorpusIndex build(List<TrialRecord> records) {
        return build(records, Map.of());
    }

    /** Never fails; an empty list gives an empty but usable index. */
    public static CorpusIndex build(List<TrialRecord> records, Map<String, FailurePattern> failurePatterns) {
        List<TrialRecord> input = records == null ? List.of() : records;

        // last write wins: keep each identified record only at its final occurrence
        Map<String, Integer> lastSeen = new HashMap<>();
        for (int i = 0; i < input.size(); i++) {
            TrialRecord t = input.get(i);
            if (t != null && !TextUtils.isBlank(t.nctId())) lastSeen.put(t.nctId(), i);
        }
        List<TrialRecord> kept = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            TrialRecord t = input.get(i);
            if (t == null) continue;
            if (TextUtils.isBlank(t.nctId()) || lastSeen.get(t.nctId()) == i) kept.add(t);
        }

        Map<String, FailurePattern> patterns = new LinkedHashMap<>();
        if (failurePatterns != null) {
            failurePatterns.forEach((k, v) -> {
                if (k != null && v != null) patterns.put(TextUtils.normalize(k), v);
            });
        }
        return new CorpusIndex(kept, patterns);
    }

    public static CorpusIndex empty() {
        return build(List.of());
    }

    // ===================== lookups =====================

    public long generation() {
        return generation;
    }

    public int size() {
        return trials.size();
    }

    public boolean isEmpty() {
        return trials.isEmpty();
    }

    /** All surviving records in corpus order. */
    public List<TrialRecord> trials() {
        return trials;
    }

    public TrialRecord trialAt(int position) {
        return trials.get(position);
    }

    public Optional<TrialRecord> findById(String nctId) {
        if (nctId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(nctId.strip()));
    }

    public Set<String> drugClasses() {
        return drugClassPostings.keySet();
    }

    public Set<String> therapeuticAreas() {
        return areaPostings.keySet();
    }

    public BitSet drugClassPositions(String drugClass) {
        return copy(drugClassPostings.get(TextUtils.normalize(drugClass)));
    }

    public BitSet therapeuticAreaPositions(String therapeuticArea) {
        return copy(areaPostings.get(TextUtils.normalize(therapeuticArea)));
    }

    public BitSet phasePositions(TrialPhase phase) {
        return phase == null ? new BitSet() : copy(phasePostings.get(phase));
    }

    public BitSet outcomePositions(TrialOutcome outcome) {
        return outcome == null ? new BitSet() : copy(outcomePostings.get(outcome));
    }

    public BitSet tagPositions(String tag) {
        return copy(tagPostings.get(TextUtils.normalize(tag)));
    }

    public List<TrialRecord> trialsAt(BitSet positions) {
        List<TrialRecord> out = new ArrayList<>(positions.cardinality());
        positions.stream().forEach(pos -> out.add(trials.get(pos)));
        return out;
    }

    public Optional<FailurePattern> failurePattern(String key) {
        return Optional.ofNullable(failurePatterns.get(TextUtils.normalize(key)));
    }

    // ===================== helpers =====================

    private static void post(Map<String, BitSet> postings, String key, int pos) {
        if (key.isEmpty()) return;
        postings.computeIfAbsent(key, k -> new BitSet()).set(pos);
    }

    private static BitSet copy(BitSet postings) {
        return postings == null ? new BitSet() : (BitSet) postings.clone();
    }
}
