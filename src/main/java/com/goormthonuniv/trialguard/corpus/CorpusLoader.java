package com.goormthonuniv.trialguard.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.trialguard.boundary.JsonFieldReader;
import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialOutcome;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.exception.CorpusLoadException;
import com.goormthonuniv.trialguard.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the historical corpus document:
 * <pre>
 * { "trials": [ { "nct_id": ..., "drug_class": ..., ... } ],
 *   "failure_patterns": { "psychiatry_ssri": { "failure_rate": 0.6, ... } } }
 * </pre>
 * A missing document is not an error (empty corpus). An unreadable document or a record with
 * wrong field types is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorpusLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public LoadedCorpus load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[TrialGuard] historical corpus not found at {}, starting with an empty corpus", location);
            return LoadedCorpus.empty();
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new CorpusLoadException("Error reading historical corpus from " + location, e);
        }
        LoadedCorpus corpus = parse(root, location);
        log.info("[TrialGuard] loaded {} historical trials, {} failure patterns from {}",
                corpus.trials().size(), corpus.failurePatterns().size(), location);
        return corpus;
    }

    public LoadedCorpus parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new CorpusLoadException("Historical corpus " + source + " is not a JSON object");
        }
        JsonFieldReader r = JsonFieldReader.root(root);

        List<TrialRecord> trials = new ArrayList<>();
        for (JsonFieldReader t : r.children("trials")) {
            if (!t.isObject()) {
                t.addError("expected a trial object");
                continue;
            }
            trials.add(trial(t));
        }

        Map<String, FailurePattern> patterns = new LinkedHashMap<>();
        JsonFieldReader fp = r.child("failure_patterns");
        Iterator<String> keys = fp.node().fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            JsonFieldReader p = fp.child(key);
            if (p.isObject()) {
                patterns.put(key, new FailurePattern(key,
                        p.decimal("failure_rate"),
                        p.textList("common_reasons"),
                        p.textList("mitigations")));
            }
        }

        try {
            r.throwIfInvalid("historical corpus " + source);
        } catch (InvalidInputException e) {
            throw new CorpusLoadException(e.getMessage(), e);
        }
        return new LoadedCorpus(trials, patterns);
    }

    private static TrialRecord trial(JsonFieldReader t) {
        return new TrialRecord(
                t.text("nct_id"),
                t.text("trial_name"),
                t.enumValue("phase", TrialPhase::fromLabel),
                t.text("drug_class"),
                t.text("therapeutic_area"),
                TrialOutcome.parse(t.text("outcome")),
                t.text("population_age"),
                t.integer("planned_enrollment"),
                t.integer("actual_enrollment"),
                t.flag("placebo_run_in", false),
                t.text("study_design"),
                t.textList("tags"),
                t.textList("key_learnings"),
                t.textList("failure_reasons"));
    }
}
