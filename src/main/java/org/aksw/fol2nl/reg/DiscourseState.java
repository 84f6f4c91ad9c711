package org.aksw.fol2nl.reg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.aksw.fol2nl.GenerationWarning;
import org.aksw.fol2nl.semantics.Entity;
import org.aksw.fol2nl.syntax.ReferringForm;

/**
 * The discourse history of one generation request: which entities were
 * mentioned, in which order and how. Not thread-safe; create one per request.
 */
public class DiscourseState {

    private final Map<Entity, MentionRecord> records = new IdentityHashMap<Entity, MentionRecord>();
    private final List<Entity> history = new ArrayList<Entity>();
    private final List<GenerationWarning> warnings = new ArrayList<GenerationWarning>();
    private int position;

    public boolean isMentioned(Entity entity) {
        return records.containsKey(entity);
    }

    /**
     * @return the record of the entity, or <code>null</code> if it was not
     *         mentioned yet
     */
    public MentionRecord getRecord(Entity entity) {
        return records.get(entity);
    }

    void recordMention(Entity entity, ReferringForm form) {
        MentionRecord record = records.get(entity);
        records.put(entity, record == null ? new MentionRecord(form, position, 1) : record.next(form, position));
        history.add(entity);
        position++;
    }

    /**
     * @return the mentioned entities in discourse order, one element per mention
     */
    public List<Entity> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * @return the number of mentions so far
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the distinct entities mentioned so far
     */
    public List<Entity> getMentionedEntities() {
        Set<Entity> seen = Collections.newSetFromMap(new IdentityHashMap<Entity, Boolean>());
        List<Entity> entities = new ArrayList<Entity>();
        for (Entity entity : history) {
            if (seen.add(entity)) {
                entities.add(entity);
            }
        }
        return entities;
    }

    void addWarning(GenerationWarning warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public List<GenerationWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "DiscourseState" + records;
    }
}
