package com.spreadpool.service;

import com.spreadpool.dto.PickResult;
import com.spreadpool.dto.RejectReason;
import com.spreadpool.model.*;
import com.spreadpool.repository.*;
import com.spreadpool.util.DeadlineGate;
import com.spreadpool.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Pick and prop-pick submission plus participant registration.
 *
 * <p>Submission never checks and then writes: the deadline gate and the uniqueness check are
 * both part of one conditional insert, and the unique constraint catches whatever slips past it.
 * The result is then explained by re-evaluating the gate at the same instant.</p>
 */
@Service
public class PickService {
    private static final Logger log = LoggerFactory.getLogger(PickService.class);

    private final ParticipantRepository participantRepository;
    private final GameRepository gameRepository;
    private final PickRepository pickRepository;
    private final PropBetRepository propBetRepository;
    private final PropPickRepository propPickRepository;
    private final AtsScoringService atsScoringService;
    private final ClockService clockService;

    public PickService(ParticipantRepository participantRepository,
                       GameRepository gameRepository,
                       PickRepository pickRepository,
                       PropBetRepository propBetRepository,
                       PropPickRepository propPickRepository,
                       AtsScoringService atsScoringService,
                       ClockService clockService) {
        this.participantRepository = participantRepository;
        this.gameRepository = gameRepository;
        this.pickRepository = pickRepository;
        this.propBetRepository = propBetRepository;
        this.propPickRepository = propPickRepository;
        this.atsScoringService = atsScoringService;
        this.clockService = clockService;
    }

    public Participant registerParticipant(String externalId, String displayName) {
        if (externalId == null || externalId.isBlank()) throw new IllegalArgumentException("participant id is required");
        String id = externalId.trim();
        String name = (displayName == null || displayName.isBlank()) ? id : displayName.trim();
        Optional<Participant> existing = participantRepository.findByExternalId(id);
        if (existing.isPresent()) {
            Participant p = existing.get();
            if (!name.equals(p.getDisplayName())) {
                p.setDisplayName(name);
                return participantRepository.save(p);
            }
            return p;
        }
        try {
            return participantRepository.saveAndFlush(new Participant(id, name));
        } catch (DataIntegrityViolationException race) {
            // registered concurrently by another request
            return participantRepository.findByExternalId(id).orElseThrow(() -> race);
        }
    }

    public PickResult submitPick(String participantExternalId, Long gameId, String team) {
        Optional<Participant> participant = participantRepository.findByExternalId(trim(participantExternalId));
        if (participant.isEmpty()) return reject(RejectReason.UNKNOWN_PARTICIPANT, participantExternalId, gameId);
        Optional<Game> found = gameId == null ? Optional.empty() : gameRepository.findById(gameId);
        if (found.isEmpty()) return reject(RejectReason.UNKNOWN_GAME, participantExternalId, gameId);
        Game game = found.get();
        if (game.isUnresolvedTeam()) return reject(RejectReason.UNRESOLVED_TEAM, participantExternalId, gameId);
        Optional<String> selected = resolveSelection(game, team);
        if (selected.isEmpty()) return reject(RejectReason.INVALID_TEAM, participantExternalId, gameId);

        Instant now = clockService.nowUtc();
        Long participantId = participant.get().getId();
        int inserted;
        try {
            inserted = pickRepository.insertIfOpen(participantId, game.getId(), selected.get(), now);
        } catch (DataIntegrityViolationException dup) {
            return reject(RejectReason.DUPLICATE_PICK, participantExternalId, gameId);
        }
        if (inserted == 1) {
            log.info("Pick accepted: {} -> {} ({})", participantExternalId, selected.get(), game.matchup());
            return PickResult.accepted();
        }
        if (!DeadlineGate.acceptsPick(game.getKickoff(), now)) {
            return reject(RejectReason.DEADLINE_PASSED, participantExternalId, gameId);
        }
        return reject(RejectReason.DUPLICATE_PICK, participantExternalId, gameId);
    }

    public PickResult submitPropPick(String participantExternalId, Long propBetId, String selection) {
        Optional<Participant> participant = participantRepository.findByExternalId(trim(participantExternalId));
        if (participant.isEmpty()) return reject(RejectReason.UNKNOWN_PARTICIPANT, participantExternalId, propBetId);
        Optional<PropBet> found = propBetId == null ? Optional.empty() : propBetRepository.findWithWeekById(propBetId);
        if (found.isEmpty()) return reject(RejectReason.UNKNOWN_GAME, participantExternalId, propBetId);
        PropBet bet = found.get();
        Optional<PropOutcome> outcome = PropOutcome.parse(selection).filter(o -> bet.getDomain().contains(o));
        if (outcome.isEmpty()) return reject(RejectReason.INVALID_TEAM, participantExternalId, propBetId);

        Instant now = clockService.nowUtc();
        int inserted;
        try {
            inserted = propPickRepository.insertIfOpen(participant.get().getId(), bet.getId(), outcome.get().name(), now);
        } catch (DataIntegrityViolationException dup) {
            return reject(RejectReason.DUPLICATE_PICK, participantExternalId, propBetId);
        }
        if (inserted == 1) return PickResult.accepted();
        if (!DeadlineGate.acceptsPick(bet.getWeek().getPicksDeadline(), now)) {
            return reject(RejectReason.DEADLINE_PASSED, participantExternalId, propBetId);
        }
        return reject(RejectReason.DUPLICATE_PICK, participantExternalId, propBetId);
    }

    /**
     * Live ATS result of the participant's pick for a game; computed from the stored game, not the
     * persisted grade, so it reflects score corrections immediately.
     *
     * @throws DataIntegrityException when the stored line or pick does not fit the game
     */
    @Transactional(readOnly = true)
    public AtsOutcome getAtsResult(Long gameId, String participantExternalId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown game id: " + gameId));
        Participant participant = participantRepository.findByExternalId(trim(participantExternalId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown participant: " + participantExternalId));
        Pick pick = pickRepository.findByParticipant_IdAndGame_Id(participant.getId(), game.getId())
                .orElseThrow(() -> new IllegalArgumentException("No pick for " + participantExternalId + " in game " + gameId));
        return atsScoringService.score(game, pick.getSelectedTeam());
    }

    /** Maps user input (code, nickname, full name) to whichever side of the game it names. */
    static Optional<String> resolveSelection(Game game, String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String trimmed = raw.trim();
        if (trimmed.equalsIgnoreCase(game.getHomeTeam())) return Optional.of(game.getHomeTeam());
        if (trimmed.equalsIgnoreCase(game.getAwayTeam())) return Optional.of(game.getAwayTeam());
        return TeamNameNormalizer.toCode(trimmed)
                .flatMap(code -> code.equalsIgnoreCase(game.getHomeTeam()) ? Optional.of(game.getHomeTeam())
                        : code.equalsIgnoreCase(game.getAwayTeam()) ? Optional.of(game.getAwayTeam())
                        : Optional.empty());
    }

    private static PickResult reject(RejectReason reason, String participant, Long target) {
        log.debug("Pick rejected ({}): participant={} target={}", reason, participant, target);
        return PickResult.rejected(reason);
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }
}
