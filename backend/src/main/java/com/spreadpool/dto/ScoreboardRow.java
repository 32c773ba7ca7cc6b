package com.spreadpool.dto;

public class ScoreboardRow {
    private String participantId;
    private String displayName;
    private int wins;
    private int losses;
    private int pushes;
    private int propWins;

    public ScoreboardRow() {}

    public ScoreboardRow(String participantId, String displayName) {
        this.participantId = participantId;
        this.displayName = displayName;
    }

    public void addWin() { wins++; }
    public void addLoss() { losses++; }
    public void addPush() { pushes++; }
    public void addPropWin() { propWins++; }

    public String getParticipantId() { return participantId; }
    public String getDisplayName() { return displayName; }
    public int getWins() { return wins; }
    public int getLosses() { return losses; }
    public int getPushes() { return pushes; }
    public int getPropWins() { return propWins; }

    @Override
    public String toString() {
        return participantId + " " + wins + "-" + losses + "-" + pushes;
    }
}
