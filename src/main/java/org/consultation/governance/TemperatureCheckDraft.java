package org.consultation.governance;

import java.util.List;

/**
 * Input for creating a temperature check. A {@code null} maxSelections means single
 * choice; otherwise it caps how many options one proposal vote may select.
 */
public class TemperatureCheckDraft {
    private final String title;
    private final String description;
    private final List<VoteOption> voteOptions;
    private final List<FileReference> attachments;
    private final String rfcUrl;
    private final Integer maxSelections;

    public TemperatureCheckDraft(String title, String description, List<VoteOption> voteOptions,
                                 List<FileReference> attachments, String rfcUrl, Integer maxSelections) {
        this.title = title;
        this.description = description;
        this.voteOptions = voteOptions;
        this.attachments = attachments;
        this.rfcUrl = rfcUrl;
        this.maxSelections = maxSelections;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<VoteOption> getVoteOptions() {
        return voteOptions;
    }

    public List<FileReference> getAttachments() {
        return attachments;
    }

    public String getRfcUrl() {
        return rfcUrl;
    }

    public Integer getMaxSelections() {
        return maxSelections;
    }
}
