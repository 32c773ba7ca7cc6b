package com.spreadpool.service;

import com.spreadpool.model.*;
import com.spreadpool.repository.GameRepository;
import com.spreadpool.repository.ParticipantRepository;
import com.spreadpool.repository.PickRepository;
import com.spreadpool.repository.ReminderRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/** At-most-once bookkeeping for participant notifications. Delivery happens elsewhere. */
@Service
public class ReminderService {

    private final ReminderRepository reminderRepository;
    private final ParticipantRepository participantRepository;
    private final GameRepository gameRepository;
    private final PickRepository pickRepository;
    private final ClockService clockService;

    public ReminderService(ReminderRepository reminderRepository,
                           ParticipantRepository participantRepository,
                           GameRepository gameRepository,
                           PickRepository pickRepository,
                           ClockService clockService) {
        this.reminderRepository = reminderRepository;
        this.participantRepository = participantRepository;
        this.gameRepository = gameRepository;
        this.pickRepository = pickRepository;
        this.clockService = clockService;
    }

    /** True exactly once per (participant, kind, week); the caller sends only when it wins the claim. */
    public boolean claimWeekReminder(Long participantId, ReminderKind kind, Long weekId) {
        return claim(participantId, kind, Reminder.weekKey(weekId));
    }

    public boolean claimGameReminder(Long participantId, ReminderKind kind, Long gameId) {
        return claim(participantId, kind, Reminder.gameKey(gameId));
    }

    private boolean claim(Long participantId, ReminderKind kind, String targetKey) {
        try {
            return reminderRepository.insertIfAbsent(participantId, kind.name(), targetKey, clockService.nowUtc()) == 1;
        } catch (DataIntegrityViolationException raced) {
            return false;
        }
    }

    /** Participants still missing a pick on at least one game of the week that has not kicked off. */
    @Transactional(readOnly = true)
    public List<Participant> participantsMissingPicks(Long weekId) {
        List<Game> open = gameRepository.findByWeek_IdAndKickoffAfterOrderByKickoffAsc(weekId, clockService.nowUtc());
        if (open.isEmpty()) return List.of();
        Set<Long> openIds = open.stream().map(Game::getId).collect(Collectors.toSet());
        Map<Long, Long> openPicksByParticipant = pickRepository.findByWeekId(weekId).stream()
                .filter(p -> openIds.contains(p.getGame().getId()))
                .collect(Collectors.groupingBy(p -> p.getParticipant().getId(), Collectors.counting()));
        return participantRepository.findAllByOrderByExternalIdAsc().stream()
                .filter(p -> openPicksByParticipant.getOrDefault(p.getId(), 0L) < openIds.size())
                .collect(Collectors.toList());
    }
}
