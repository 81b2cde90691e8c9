package org.consultation.governance;

import java.util.Objects;

/**
 * A selectable ballot option, e.g. {@code 0:"For"}. Ids are assigned by the ballot author.
 */
public class VoteOption {
    private long id;
    private String label;

    public VoteOption(long id, String label) {
        this.id = id;
        this.label = label;
    }

    public long getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return id + ":" + label;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        VoteOption that = (VoteOption) o;
        return id == that.id && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }
}
