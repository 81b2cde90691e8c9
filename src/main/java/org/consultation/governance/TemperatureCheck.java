package org.consultation.governance;

import java.math.BigDecimal;

/**
 * Non-binding straw poll. Votes are a plain For/Against per account.
 */
public class TemperatureCheck extends Ballot {
    private Long elevatedProposalId;

    TemperatureCheck(long id, TemperatureCheckDraft draft, BigDecimal quorum, BigDecimal approvalThreshold,
                     long start, long deadline) {
        super(id, draft.getTitle(), draft.getDescription(), draft.getVoteOptions(), draft.getAttachments(),
                draft.getRfcUrl(), draft.getMaxSelections(), quorum, approvalThreshold, start, deadline);
    }

    /**
     * @return id of the proposal this check was elevated to, or {@code null}
     */
    public Long getElevatedProposalId() {
        return elevatedProposalId;
    }

    public boolean isElevated() {
        return elevatedProposalId != null;
    }

    void markElevated(long proposalId) {
        if (elevatedProposalId != null) {
            throw new IllegalStateException("Temperature check " + getId() + " already elevated");
        }
        this.elevatedProposalId = proposalId;
    }

    @Override
    public String toString() {
        return "TemperatureCheck{" +
                "id=" + getId() +
                ", title='" + getTitle() + '\'' +
                ", start=" + getStart() +
                ", deadline=" + getDeadline() +
                ", elevatedProposalId=" + elevatedProposalId +
                '}';
    }
}
