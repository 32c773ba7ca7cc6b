package com.spreadpool.service;

import com.spreadpool.model.PropBet;
import com.spreadpool.model.PropGrade;
import com.spreadpool.model.PropOutcome;
import com.spreadpool.model.PropPick;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class PropGradingService {

    public PropGrade grade(PropOutcome declaredResult, PropOutcome selection) {
        if (declaredResult == null) return PropGrade.UNGRADED;
        return declaredResult == selection ? PropGrade.WIN : PropGrade.LOSS;
    }

    public PropGrade grade(PropPick pick) {
        return grade(pick.getPropBet().getResult(), pick.getSelection());
    }

    /**
     * Grades each pick against {@code results} keyed by prop bet id. Picks whose prop is not in the
     * mapping come back UNGRADED, whatever result the prop currently stores. Output keeps input order.
     */
    public Map<PropPick, PropGrade> gradeAll(List<PropPick> picks, Map<Long, PropOutcome> results) {
        Map<PropPick, PropGrade> out = new LinkedHashMap<>();
        for (PropPick pick : picks) {
            PropBet bet = pick.getPropBet();
            PropOutcome declared = results.get(bet.getId());
            if (declared != null && !bet.getDomain().contains(declared)) {
                throw new IllegalArgumentException("Result " + declared + " is outside " + bet.getDomain() + " for prop " + bet.getId());
            }
            out.put(pick, grade(declared, pick.getSelection()));
        }
        return out;
    }
}
