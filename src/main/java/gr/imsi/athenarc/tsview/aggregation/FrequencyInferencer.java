package gr.imsi.athenarc.tsview.aggregation;

import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.domain.Condition;
import gr.imsi.athenarc.tsview.domain.FrequencyEstimate;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.exception.FrequencyIndeterminateException;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;

/**
 * Estimates the sampling frequency of a timestamp sequence.
 *
 * <p>This is a heuristic rather than a statistical estimator. It asserts a frequency in two cases
 * only: strictly regular sampling (a single distinct spacing) and calendar-monthly reporting
 * (the most common spacing lies within 28 to 31 days, reported as 30 days). Anything else is
 * refused with a {@link FrequencyIndeterminateException}.</p>
 */
public class FrequencyInferencer {

    private static final Logger LOG = LoggerFactory.getLogger(FrequencyInferencer.class);

    public static final Duration MONTH_LOWER_BOUND = Duration.ofDays(28);
    public static final Duration MONTH_UPPER_BOUND = Duration.ofDays(31);
    public static final Duration MONTHLY = Duration.ofDays(30);

    static final int UNEVEN_DISTINCT_DELTAS = 10;
    static final long GAP_RATIO = 5;

    public Duration inferFrequency(TemporalColumn timestamps) {
        return inferFrequency(timestamps.nonNullValues());
    }

    /**
     * Infers the dominant spacing of the given timestamps.
     *
     * @param timestamps epoch milliseconds in any order
     * @return the frequency
     * @throws FrequencyIndeterminateException if no dominant spacing can be asserted
     */
    public Duration inferFrequency(long[] timestamps) {
        FrequencyEstimate estimate = estimate(timestamps);
        return estimate.getFrequency().orElseThrow(() -> new FrequencyIndeterminateException(
                "Unable to infer frequency from " + timestamps.length + " timestamps with "
                        + estimate.getDistinctDeltas() + " distinct spacings",
                estimate.getDistinctDeltas()));
    }

    /**
     * Same as {@link #inferFrequency(long[])} but reports an undetermined estimate instead of throwing.
     */
    public FrequencyEstimate estimate(long[] timestamps) {
        Multiset<Long> deltas = deltaCounts(timestamps);
        int distinct = deltas.elementSet().size();
        if (distinct == 0) {
            return FrequencyEstimate.undetermined(0);
        }
        if (distinct == 1) {
            return new FrequencyEstimate(Duration.ofMillis(deltas.iterator().next()), 1);
        }

        Duration mostCommon = Duration.ofMillis(mostCommonDelta(deltas));
        if (mostCommon.compareTo(MONTH_LOWER_BOUND) >= 0 && mostCommon.compareTo(MONTH_UPPER_BOUND) <= 0) {
            LOG.debug("Most common spacing {} is monthly, using {}", mostCommon, MONTHLY);
            return new FrequencyEstimate(MONTHLY, distinct);
        }
        LOG.debug("No dominant spacing among {} distinct deltas (most common {})", distinct, mostCommon);
        return FrequencyEstimate.undetermined(distinct);
    }

    /**
     * Diagnoses a timestamp column at ingestion time.
     *
     * @param timestamps epoch milliseconds in any order
     * @return the irregularities found, possibly none
     */
    public EnumSet<Condition> classifyIrregularities(long[] timestamps) {
        EnumSet<Condition> conditions = EnumSet.noneOf(Condition.class);
        TreeMultiset<Long> deltas = deltaCounts(timestamps);
        if (deltas.isEmpty()) {
            return conditions;
        }
        long smallest = deltas.firstEntry().getElement();
        long largest = deltas.lastEntry().getElement();

        boolean groupOrFilter = smallest <= 0;
        if (groupOrFilter) {
            conditions.add(Condition.GROUP_OR_FILTER);
        }
        if (deltas.elementSet().size() > UNEVEN_DISTINCT_DELTAS) {
            conditions.add(Condition.UNEVEN);
        }
        // grouping dominates, gaps are meaningless until the series is split
        if (!groupOrFilter && largest > GAP_RATIO * smallest) {
            conditions.add(Condition.GAPS);
        }
        return conditions;
    }

    public EnumSet<Condition> classifyIrregularities(TemporalColumn timestamps) {
        return classifyIrregularities(timestamps.nonNullValues());
    }

    /**
     * Sorts a copy of the timestamps and counts each consecutive delta.
     */
    static TreeMultiset<Long> deltaCounts(long[] timestamps) {
        long[] sorted = Arrays.stream(timestamps).filter(t -> t != TemporalColumn.NULL).sorted().toArray();
        TreeMultiset<Long> deltas = TreeMultiset.create();
        for (int i = 1; i < sorted.length; i++) {
            deltas.add(sorted[i] - sorted[i - 1]);
        }
        return deltas;
    }

    /**
     * Highest count wins, ties go to the smaller delta.
     */
    private static long mostCommonDelta(Multiset<Long> deltas) {
        long best = 0;
        int bestCount = -1;
        for (Multiset.Entry<Long> entry : deltas.entrySet()) {
            if (entry.getCount() > bestCount) {
                best = entry.getElement();
                bestCount = entry.getCount();
            }
        }
        return best;
    }
}
