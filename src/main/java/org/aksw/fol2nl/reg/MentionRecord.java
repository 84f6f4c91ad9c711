package org.aksw.fol2nl.reg;

import org.aksw.fol2nl.syntax.ReferringForm;

/**
 * What is known about the mentions of one entity so far.
 */
public final class MentionRecord {

    private final ReferringForm lastForm;
    private final int lastPosition;
    private final int count;

    MentionRecord(ReferringForm lastForm, int lastPosition, int count) {
        this.lastForm = lastForm;
        this.lastPosition = lastPosition;
        this.count = count;
    }

    MentionRecord next(ReferringForm form, int position) {
        return new MentionRecord(form, position, count + 1);
    }

    /**
     * @return the form used for the most recent mention
     */
    public ReferringForm getLastForm() {
        return lastForm;
    }

    /**
     * @return the discourse position of the most recent mention
     */
    public int getLastPosition() {
        return lastPosition;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return lastForm + "@" + lastPosition + " (x" + count + ")";
    }
}
