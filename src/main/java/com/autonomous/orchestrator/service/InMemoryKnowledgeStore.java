package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.KnowledgeRecord;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local knowledge store ranking records by bag-of-words cosine similarity.
 * Stands in for an external vector store; only the put/query contract matters to callers.
 */
@Slf4j
@Service
public class InMemoryKnowledgeStore implements KnowledgeStore {

    private final Map<String, Entry> records = new ConcurrentHashMap<>();

    @Override
    public boolean put(KnowledgeRecord record) {
        if (record == null || record.getId() == null || record.getText() == null) {
            log.warn("Ignoring incomplete knowledge record. record={}", record);
            return false;
        }
        if (record.getEmbeddingRef() == null) {
            record.setEmbeddingRef("bow:" + record.getId());
        }
        records.put(record.getId(), new Entry(record, termFrequencies(record.getText())));
        return true;
    }

    @Override
    public List<KnowledgeRecord> query(String text, int k) {
        if (text == null || text.isBlank() || k <= 0) {
            return List.of();
        }
        Map<String, Integer> queryTerms = termFrequencies(text);
        List<Scored> scored = new ArrayList<>();
        for (Entry entry : records.values()) {
            double score = cosine(queryTerms, entry.getTerms());
            if (score > 0) {
                scored.add(new Scored(entry.getRecord(), score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::getScore).reversed()
            .thenComparing(s -> s.getRecord().getId()));
        List<KnowledgeRecord> result = new ArrayList<>();
        for (int i = 0; i < Math.min(k, scored.size()); i++) {
            result.add(scored.get(i).getRecord());
        }
        return result;
    }

    public int size() {
        return records.size();
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> terms = new HashMap<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1) {
                terms.merge(token, 1, Integer::sum);
            }
        }
        return terms;
    }

    private static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double dot = 0;
        for (Map.Entry<String, Integer> term : a.entrySet()) {
            Integer other = b.get(term.getKey());
            if (other != null) {
                dot += term.getValue() * other;
            }
        }
        return dot == 0 ? 0.0 : dot / (norm(a) * norm(b));
    }

    private static double norm(Map<String, Integer> terms) {
        double sum = 0;
        for (int count : terms.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }

    @Value
    private static class Entry {
        KnowledgeRecord record;
        Map<String, Integer> terms;
    }

    @Value
    private static class Scored {
        KnowledgeRecord record;
        double score;
    }
}
