package com.spreadpool.dto;

public class PropPickRequest {
    private String participantId;
    private Long propBetId;
    private String selection; // OVER/UNDER/YES/NO

    public PropPickRequest() {}

    public PropPickRequest(String participantId, Long propBetId, String selection) {
        this.participantId = participantId;
        this.propBetId = propBetId;
        this.selection = selection;
    }

    public String getParticipantId() { return participantId; }
    public void setParticipantId(String participantId) { this.participantId = participantId; }

    public Long getPropBetId() { return propBetId; }
    public void setPropBetId(Long propBetId) { this.propBetId = propBetId; }

    public String getSelection() { return selection; }
    public void setSelection(String selection) { this.selection = selection; }
}
