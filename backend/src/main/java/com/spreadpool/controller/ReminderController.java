package com.spreadpool.controller;

import com.spreadpool.model.ReminderKind;
import com.spreadpool.service.ReminderService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.Map;

/** Lets notification senders claim a reminder before delivering it. */
@RestController
@RequestMapping("/api/reminders")
@CrossOrigin(origins = "*")
public class ReminderController {

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping("/claim")
    public Map<String, Object> claim(@RequestParam("participantId") Long participantId,
                                     @RequestParam("kind") String kind,
                                     @RequestParam(value = "weekId", required = false) Long weekId,
                                     @RequestParam(value = "gameId", required = false) Long gameId) {
        ReminderKind k;
        try {
            k = ReminderKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown reminder kind: " + kind);
        }
        if ((weekId == null) == (gameId == null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Exactly one of weekId or gameId is required");
        }
        boolean claimed = weekId != null
                ? reminderService.claimWeekReminder(participantId, k, weekId)
                : reminderService.claimGameReminder(participantId, k, gameId);
        return Map.of("claimed", claimed);
    }
}
