package com.spreadpool.controller;

import com.spreadpool.dto.PickRequest;
import com.spreadpool.dto.PickResult;
import com.spreadpool.dto.PropPickRequest;
import com.spreadpool.model.AtsOutcome;
import com.spreadpool.model.Participant;
import com.spreadpool.service.DataIntegrityException;
import com.spreadpool.service.PickService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class PickController {

    private final PickService pickService;

    public PickController(PickService pickService) {
        this.pickService = pickService;
    }

    @PostMapping("/participants")
    public Map<String, Object> register(@RequestParam("id") String externalId,
                                        @RequestParam(value = "name", required = false) String displayName) {
        try {
            Participant p = pickService.registerParticipant(externalId, displayName);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("participantId", p.getExternalId());
            resp.put("displayName", p.getDisplayName());
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    // Rejections come back as 200 with accepted=false; they are expected outcomes
    @PostMapping("/picks")
    public PickResult submit(@RequestBody PickRequest req) {
        return pickService.submitPick(req.getParticipantId(), req.getGameId(), req.getTeam());
    }

    @PostMapping("/picks/props")
    public PickResult submitProp(@RequestBody PropPickRequest req) {
        return pickService.submitPropPick(req.getParticipantId(), req.getPropBetId(), req.getSelection());
    }

    @GetMapping("/picks/ats")
    public Map<String, Object> atsResult(@RequestParam("gameId") Long gameId,
                                         @RequestParam("participantId") String participantId) {
        try {
            AtsOutcome outcome = pickService.getAtsResult(gameId, participantId);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("gameId", gameId);
            resp.put("participantId", participantId);
            resp.put("result", outcome);
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (DataIntegrityException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }
}
