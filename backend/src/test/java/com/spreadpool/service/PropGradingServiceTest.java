package com.spreadpool.service;

import com.spreadpool.model.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropGradingServiceTest {

    private final PropGradingService service = new PropGradingService();
    private final Week week = new Week(2025, 1, Instant.parse("2025-09-05T00:20:00Z"));

    private PropBet prop(long id, PropDomain domain) {
        PropBet b = new PropBet(week, "PIT@CLE", "Prop " + id, domain);
        b.setId(id);
        return b;
    }

    private PropPick pick(PropBet bet, PropOutcome selection) {
        return new PropPick(new Participant("u" + selection, "U"), bet, selection, Instant.EPOCH);
    }

    @Test
    void gradesAgainstDeclaredResult() {
        assertThat(service.grade(PropOutcome.OVER, PropOutcome.OVER)).isEqualTo(PropGrade.WIN);
        assertThat(service.grade(PropOutcome.OVER, PropOutcome.UNDER)).isEqualTo(PropGrade.LOSS);
        assertThat(service.grade(null, PropOutcome.YES)).isEqualTo(PropGrade.UNGRADED);
    }

    @Test
    void picksOfUnmappedPropsStayUngraded() {
        PropBet total = prop(1, PropDomain.OVER_UNDER);
        PropBet safety = prop(2, PropDomain.YES_NO);
        PropPick a = pick(total, PropOutcome.OVER);
        PropPick b = pick(total, PropOutcome.UNDER);
        PropPick c = pick(safety, PropOutcome.YES);

        Map<PropPick, PropGrade> grades = service.gradeAll(List.of(a, b, c), Map.of(1L, PropOutcome.UNDER));

        assertThat(grades).containsEntry(a, PropGrade.LOSS)
                .containsEntry(b, PropGrade.WIN)
                .containsEntry(c, PropGrade.UNGRADED);
    }

    @Test
    void resultIndependentOfMappingIterationOrder() {
        PropBet p1 = prop(1, PropDomain.OVER_UNDER);
        PropBet p2 = prop(2, PropDomain.YES_NO);
        PropBet p3 = prop(3, PropDomain.YES_NO);
        List<PropPick> picks = List.of(pick(p1, PropOutcome.OVER), pick(p2, PropOutcome.NO), pick(p3, PropOutcome.YES));

        Map<Long, PropOutcome> forward = new LinkedHashMap<>();
        forward.put(1L, PropOutcome.OVER);
        forward.put(2L, PropOutcome.YES);
        Map<Long, PropOutcome> backward = new LinkedHashMap<>();
        backward.put(2L, PropOutcome.YES);
        backward.put(1L, PropOutcome.OVER);

        assertThat(service.gradeAll(picks, forward)).isEqualTo(service.gradeAll(picks, backward));
        assertThat(new ArrayList<>(service.gradeAll(picks, forward).values()))
                .containsExactly(PropGrade.WIN, PropGrade.LOSS, PropGrade.UNGRADED);
    }

    @Test
    void resultOutsideThePropDomainIsRejected() {
        PropBet total = prop(1, PropDomain.OVER_UNDER);
        assertThatThrownBy(() -> service.gradeAll(List.of(pick(total, PropOutcome.OVER)), Map.of(1L, PropOutcome.YES)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
