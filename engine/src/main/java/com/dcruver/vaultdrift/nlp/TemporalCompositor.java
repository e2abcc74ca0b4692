package com.dcruver.vaultdrift.nlp;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.InvalidNoteTimestampException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Appends session-relative temporal features to a semantic vector.
 *
 * Features: note age in years at the session date, season of creation and season of the session,
 * the latter two as {@code sin(2*pi*dayOfYear/365)}. Nothing here is cached; the features change with
 * every session date even when the content does not.
 */
@Component
public class TemporalCompositor {

    public static final int TEMPORAL_DIMENSION = 3;

    private final double semanticWeight;
    private final double temporalWeight;
    private final int clockSkewToleranceDays;

    @Autowired
    public TemporalCompositor(EngineProperties properties) {
        this(properties.getEmbedding().getSemanticWeight(),
            properties.getEmbedding().getTemporalWeight(),
            properties.getEmbedding().getClockSkewToleranceDays());
    }

    public TemporalCompositor(double semanticWeight, double temporalWeight, int clockSkewToleranceDays) {
        this.semanticWeight = semanticWeight;
        this.temporalWeight = temporalWeight;
        this.clockSkewToleranceDays = clockSkewToleranceDays;
    }

    /**
     * Build the session embedding from an L2-normalized semantic vector.
     */
    public Embedding compose(double[] semantic, LocalDateTime created, LocalDate sessionDate) {
        double[] temporal = temporalFeatures(created, sessionDate);
        double[] values = new double[semantic.length + TEMPORAL_DIMENSION];
        for (int i = 0; i < semantic.length; i++) {
            values[i] = semantic[i] * semanticWeight;
        }
        for (int i = 0; i < TEMPORAL_DIMENSION; i++) {
            values[semantic.length + i] = temporal[i] * temporalWeight;
        }
        return new Embedding(values, semantic.length);
    }

    /**
     * Unweighted features: age in years, creation season, session season.
     */
    public double[] temporalFeatures(LocalDateTime created, LocalDate sessionDate) {
        return new double[] {
            ageYears(created, sessionDate),
            season(created.toLocalDate()),
            season(sessionDate)
        };
    }

    public double ageYears(LocalDateTime created, LocalDate sessionDate) {
        long days = ChronoUnit.DAYS.between(created.toLocalDate(), sessionDate);
        if (days < 0) {
            if (-days > clockSkewToleranceDays) {
                throw new InvalidNoteTimestampException(created, sessionDate);
            }
            return 0.0;
        }
        return days / 365.0;
    }

    // StrictMath so the feature is identical on every JVM
    static double season(LocalDate date) {
        return StrictMath.sin(2.0 * StrictMath.PI * date.getDayOfYear() / 365.0);
    }
}
