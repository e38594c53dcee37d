package gr.imsi.athenarc.tsview.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a frequency inference: the dominant spacing, if one could be asserted, along
 * with the number of distinct consecutive deltas that were observed.
 */
public class FrequencyEstimate {

    private final Duration frequency;
    private final int distinctDeltas;

    public FrequencyEstimate(Duration frequency, int distinctDeltas) {
        this.frequency = frequency;
        this.distinctDeltas = distinctDeltas;
    }

    public static FrequencyEstimate undetermined(int distinctDeltas) {
        return new FrequencyEstimate(null, distinctDeltas);
    }

    public Optional<Duration> getFrequency() {
        return Optional.ofNullable(frequency);
    }

    public boolean isDetermined() {
        return frequency != null;
    }

    public int getDistinctDeltas() {
        return distinctDeltas;
    }

    @Override
    public String toString() {
        return "FrequencyEstimate{" + (frequency == null ? "undetermined" : frequency)
                + ", distinctDeltas=" + distinctDeltas + '}';
    }
}
