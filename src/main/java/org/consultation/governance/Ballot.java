package org.consultation.governance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fields shared by temperature checks and proposals. Instances handed out by the
 * engine are detached snapshots of the stored record; their votes live in
 * separate store entries keyed by ballot id and account.
 */
public abstract class Ballot {
    private long id;
    private String title;
    private String description;
    private List<VoteOption> voteOptions;
    private List<FileReference> attachments;
    private String rfcUrl;
    private Integer maxSelections;
    private BigDecimal quorum;
    private BigDecimal approvalThreshold;
    private long start;
    private long deadline;

    protected Ballot(long id, String title, String description, List<VoteOption> voteOptions,
                     List<FileReference> attachments, String rfcUrl, Integer maxSelections,
                     BigDecimal quorum, BigDecimal approvalThreshold, long start, long deadline) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.voteOptions = new ArrayList<>(voteOptions);
        this.attachments = new ArrayList<>(attachments);
        this.rfcUrl = rfcUrl;
        this.maxSelections = maxSelections;
        this.quorum = quorum;
        this.approvalThreshold = approvalThreshold;
        this.start = start;
        this.deadline = deadline;
    }

    public long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<VoteOption> getVoteOptions() {
        return Collections.unmodifiableList(voteOptions);
    }

    public List<FileReference> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public String getRfcUrl() {
        return rfcUrl;
    }

    /**
     * @return {@code null} when exactly one option must be selected
     */
    public Integer getMaxSelections() {
        return maxSelections;
    }

    /**
     * Number of options a single vote may select: {@code maxSelections}, or 1 when absent.
     */
    public int selectionLimit() {
        return maxSelections == null ? 1 : maxSelections;
    }

    public boolean hasOption(long optionId) {
        for (VoteOption option : voteOptions) {
            if (option.getId() == optionId) return true;
        }
        return false;
    }

    public BigDecimal getQuorum() {
        return quorum;
    }

    public BigDecimal getApprovalThreshold() {
        return approvalThreshold;
    }

    public long getStart() {
        return start;
    }

    public long getDeadline() {
        return deadline;
    }
}
