package gr.imsi.athenarc.tsview.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Irregularities of a timestamp column reported when a dataset is registered.
 */
public enum Condition {
    /** Repeated timestamps: consumers must group by or filter on another column. */
    GROUP_OR_FILTER("GroupOrFilter"),
    /** More than ten distinct spacings between consecutive timestamps. */
    UNEVEN("Uneven"),
    /** The largest spacing is more than five times the smallest. */
    GAPS("Gaps");

    private final String label;

    Condition(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Condition fromLabel(String label) {
        for (Condition condition : values()) {
            if (condition.label.equals(label) || condition.name().equals(label)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown condition " + label);
    }
}
