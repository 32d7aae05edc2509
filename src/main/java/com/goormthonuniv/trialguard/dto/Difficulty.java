package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY("easy", 100, "1-2 weeks"),
    MEDIUM("medium", 70, "1-2 months"),
    HARD("hard", 40, "3-6 months");

    private final String value;
    private final int feasibility;        // 0~100
    private final String implementationTime;

    Difficulty(String value, int feasibility, String implementationTime) {
        this.value = value;
        this.feasibility = feasibility;
        this.implementationTime = implementationTime;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int feasibility() {
        return feasibility;
    }

    public String implementationTime() {
        return implementationTime;
    }

    public static Optional<Difficulty> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.strip().toLowerCase(Locale.ROOT);
        for (Difficulty d : values()) {
            if (d.value.equals(s)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
