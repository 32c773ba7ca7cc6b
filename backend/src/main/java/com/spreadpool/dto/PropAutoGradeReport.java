package com.spreadpool.dto;

import java.util.ArrayList;
import java.util.List;

public class PropAutoGradeReport {
    private int season;
    private int week;
    private boolean committed;
    private int picksGraded;
    private List<Entry> entries = new ArrayList<>();

    public static PropAutoGradeReport of(int season, int week, boolean committed, int picksGraded, List<Entry> entries) {
        PropAutoGradeReport r = new PropAutoGradeReport();
        r.season = season;
        r.week = week;
        r.committed = committed;
        r.picksGraded = picksGraded;
        if (entries != null) r.entries = entries;
        return r;
    }

    public int getSeason() { return season; }
    public int getWeek() { return week; }
    public boolean isCommitted() { return committed; }
    public int getPicksGraded() { return picksGraded; }
    public List<Entry> getEntries() { return entries; }

    public long getDecided() {
        return entries.stream().filter(e -> e.getResult() != null).count();
    }

    /** One ungraded prop: the decided result, or a note saying why it stays open. */
    public static class Entry {
        private final Long propId;
        private final String description;
        private final String gameExternalId;
        private final String result;
        private final String note;

        public Entry(Long propId, String description, String gameExternalId, String result, String note) {
            this.propId = propId;
            this.description = description;
            this.gameExternalId = gameExternalId;
            this.result = result;
            this.note = note;
        }

        public Long getPropId() { return propId; }
        public String getDescription() { return description; }
        public String getGameExternalId() { return gameExternalId; }
        public String getResult() { return result; }
        public String getNote() { return note; }
    }
}
