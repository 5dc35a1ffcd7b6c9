package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.SearchRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Most recent searches, oldest evicted first.
 */
public class SearchHistory {

    private final int maxSize;
    private final Deque<SearchRecord> records = new ArrayDeque<>();

    public SearchHistory(int maxSize) {
        this.maxSize = maxSize;
    }

    public synchronized void record(SearchRecord searchRecord) {
        if (maxSize <= 0) {
            return;
        }
        records.addLast(searchRecord);
        while (records.size() > maxSize) {
            records.removeFirst();
        }
    }

    public synchronized List<SearchRecord> recent() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
    }
}
