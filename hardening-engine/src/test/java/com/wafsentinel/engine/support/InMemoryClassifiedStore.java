package com.wafsentinel.engine.support;

import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.store.ClassifiedPage;
import com.wafsentinel.engine.store.ClassifiedRecord;
import com.wafsentinel.engine.store.ClassifiedStore;
import com.wafsentinel.engine.store.WriteOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Classified store with create-if-absent semantics keyed by document id. */
public class InMemoryClassifiedStore implements ClassifiedStore {

    private final Map<TimeBucket, TreeMap<String, ClassifiedRecord>> buckets = new TreeMap<>();
    private final AtomicInteger creates = new AtomicInteger();

    @Override
    public synchronized WriteOutcome createIfAbsent(TimeBucket bucket, ClassifiedRecord document) {
        TreeMap<String, ClassifiedRecord> docs = buckets.computeIfAbsent(bucket, b -> new TreeMap<>());
        if (docs.containsKey(document.documentId())) {
            return WriteOutcome.ALREADY_PRESENT;
        }
        docs.put(document.documentId(), document);
        creates.incrementAndGet();
        return WriteOutcome.CREATED;
    }

    @Override
    public synchronized ClassifiedPage scan(TimeBucket bucket, String afterKey, int size) {
        TreeMap<String, ClassifiedRecord> docs = buckets.getOrDefault(bucket, new TreeMap<>());
        Map<String, ClassifiedRecord> tail = afterKey == null ? docs : docs.tailMap(afterKey, false);
        List<ClassifiedRecord> page = new ArrayList<>();
        String lastKey = null;
        for (Map.Entry<String, ClassifiedRecord> entry : tail.entrySet()) {
            if (page.size() == size) {
                break;
            }
            page.add(entry.getValue());
            lastKey = entry.getKey();
        }
        return new ClassifiedPage(page, lastKey, page.size());
    }

    public synchronized List<ClassifiedRecord> all() {
        List<ClassifiedRecord> all = new ArrayList<>();
        buckets.values().forEach(docs -> all.addAll(docs.values()));
        return all;
    }

    public int creates() {
        return creates.get();
    }
}
