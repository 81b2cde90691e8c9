package org.consultation.governance;

import java.math.BigDecimal;

/**
 * Binding ballot created by elevating a temperature check. Votes are a set of
 * option ids per account.
 */
public class Proposal extends Ballot {
    private long temperatureCheckId;

    Proposal(long id, TemperatureCheck origin, BigDecimal quorum, BigDecimal approvalThreshold,
             long start, long deadline) {
        super(id, origin.getTitle(), origin.getDescription(), origin.getVoteOptions(), origin.getAttachments(),
                origin.getRfcUrl(), origin.getMaxSelections(), quorum, approvalThreshold, start, deadline);
        this.temperatureCheckId = origin.getId();
    }

    public long getTemperatureCheckId() {
        return temperatureCheckId;
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "id=" + getId() +
                ", title='" + getTitle() + '\'' +
                ", start=" + getStart() +
                ", deadline=" + getDeadline() +
                ", temperatureCheckId=" + temperatureCheckId +
                '}';
    }
}
