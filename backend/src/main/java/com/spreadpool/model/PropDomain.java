package com.spreadpool.model;

import java.util.Optional;

/** The two outcome domains a proposition may be declared over. */
public enum PropDomain {
    OVER_UNDER(PropOutcome.OVER, PropOutcome.UNDER),
    YES_NO(PropOutcome.YES, PropOutcome.NO);

    private final PropOutcome optionA;
    private final PropOutcome optionB;

    PropDomain(PropOutcome optionA, PropOutcome optionB) {
        this.optionA = optionA;
        this.optionB = optionB;
    }

    public PropOutcome getOptionA() { return optionA; }
    public PropOutcome getOptionB() { return optionB; }

    public boolean contains(PropOutcome outcome) {
        return outcome == optionA || outcome == optionB;
    }

    public static Optional<PropDomain> of(PropOutcome a, PropOutcome b) {
        for (PropDomain d : values()) {
            if ((d.optionA == a && d.optionB == b) || (d.optionA == b && d.optionB == a)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
