package com.spreadpool.dto;

public class PickRequest {
    private String participantId;
    private Long gameId;
    private String team;

    public PickRequest() {}

    public PickRequest(String participantId, Long gameId, String team) {
        this.participantId = participantId;
        this.gameId = gameId;
        this.team = team;
    }

    public String getParticipantId() { return participantId; }
    public void setParticipantId(String participantId) { this.participantId = participantId; }

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }

    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
}
