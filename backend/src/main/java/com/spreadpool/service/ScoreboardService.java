package com.spreadpool.service;

import com.spreadpool.dto.ScoreboardRow;
import com.spreadpool.dto.WeekResults;
import com.spreadpool.model.*;
import com.spreadpool.repository.PickRepository;
import com.spreadpool.repository.PropPickRepository;
import com.spreadpool.repository.WeekRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Standings computed from the stored games and picks on every call, so a corrected score shows
 * up before the grading job has run. Undecided picks count for nothing.
 */
@Service
@Transactional(readOnly = true)
public class ScoreboardService {
    private static final Logger log = LoggerFactory.getLogger(ScoreboardService.class);

    static final Comparator<ScoreboardRow> STANDINGS_ORDER = Comparator
            .comparingInt(ScoreboardRow::getWins).reversed()
            .thenComparingInt(ScoreboardRow::getLosses)
            .thenComparing(ScoreboardRow::getParticipantId);

    private final WeekRepository weekRepository;
    private final PickRepository pickRepository;
    private final PropPickRepository propPickRepository;
    private final AtsScoringService atsScoringService;
    private final PropGradingService propGradingService;

    public ScoreboardService(WeekRepository weekRepository,
                             PickRepository pickRepository,
                             PropPickRepository propPickRepository,
                             AtsScoringService atsScoringService,
                             PropGradingService propGradingService) {
        this.weekRepository = weekRepository;
        this.pickRepository = pickRepository;
        this.propPickRepository = propPickRepository;
        this.atsScoringService = atsScoringService;
        this.propGradingService = propGradingService;
    }

    /** Every participant with a pick in the season: wins desc, losses asc, then participant id. */
    public List<ScoreboardRow> getSeasonScoreboard(int seasonYear) {
        return tally(pickRepository.findBySeason(seasonYear), propPickRepository.findBySeason(seasonYear));
    }

    public WeekResults getWeekResults(int seasonYear, int weekNumber) {
        Week week = weekRepository.findBySeasonYearAndWeekNumber(seasonYear, weekNumber)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week " + seasonYear + "-W" + weekNumber));
        List<ScoreboardRow> rows = tally(pickRepository.findByWeekId(week.getId()), propPickRepository.findByWeekId(week.getId()));
        int best = rows.stream().mapToInt(ScoreboardRow::getWins).max().orElse(0);
        List<String> winners = best == 0 ? List.of() : rows.stream()
                .filter(r -> r.getWins() == best)
                .map(ScoreboardRow::getParticipantId)
                .collect(Collectors.toList());
        boolean complete = week.getPhase().ordinal() >= WeekPhase.COMPLETE.ordinal();
        return new WeekResults(seasonYear, weekNumber, week.label(), complete, rows, winners);
    }

    private List<ScoreboardRow> tally(List<Pick> picks, List<PropPick> propPicks) {
        Map<String, ScoreboardRow> rows = new HashMap<>();
        for (Pick pick : picks) {
            ScoreboardRow row = rowFor(rows, pick.getParticipant());
            AtsOutcome outcome;
            try {
                outcome = atsScoringService.score(pick.getGame(), pick.getSelectedTeam());
            } catch (DataIntegrityException e) {
                log.warn("Pick {} left out of standings: {}", pick.getId(), e.getMessage());
                continue;
            }
            switch (outcome) {
                case WIN: row.addWin(); break;
                case LOSS: row.addLoss(); break;
                case PUSH: row.addPush(); break;
                default: break;
            }
        }
        for (PropPick pp : propPicks) {
            ScoreboardRow row = rowFor(rows, pp.getParticipant());
            if (propGradingService.grade(pp) == PropGrade.WIN) row.addPropWin();
        }
        List<ScoreboardRow> out = new ArrayList<>(rows.values());
        out.sort(STANDINGS_ORDER);
        return out;
    }

    private static ScoreboardRow rowFor(Map<String, ScoreboardRow> rows, Participant p) {
        return rows.computeIfAbsent(p.getExternalId(), id -> new ScoreboardRow(id, p.getDisplayName()));
    }
}
