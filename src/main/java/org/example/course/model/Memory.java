package org.example.course.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class Memory {

    private Map<String, TopicMemory> topics = new LinkedHashMap<>();
    private Compaction compaction;

    public int lastCompactedIndex() {
        return compaction == null ? -1 : compaction.lastStepIndex();
    }

    public Map<String, TopicMemory> getTopics() { return topics; }
    public void setTopics(Map<String, TopicMemory> topics) {
        this.topics = topics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(topics);
    }

    public Compaction getCompaction() { return compaction; }
    public void setCompaction(Compaction compaction) { this.compaction = compaction; }
}
