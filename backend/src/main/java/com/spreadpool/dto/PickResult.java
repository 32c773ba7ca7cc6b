package com.spreadpool.dto;

/** Outcome of a pick or prop-pick submission. Rejections are ordinary results, not errors. */
public class PickResult {
    private boolean accepted;
    private RejectReason reason;

    public static PickResult accepted() {
        PickResult r = new PickResult();
        r.accepted = true;
        return r;
    }

    public static PickResult rejected(RejectReason reason) {
        PickResult r = new PickResult();
        r.accepted = false;
        r.reason = reason;
        return r;
    }

    public boolean isAccepted() { return accepted; }
    public RejectReason getReason() { return reason; }

    @Override
    public String toString() {
        return accepted ? "Accepted" : "Rejected(" + reason + ")";
    }
}
