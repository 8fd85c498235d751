package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.KnowledgeRecord;

import java.util.List;

/**
 * Shared, similarity-searchable store giving agents context from earlier tasks.
 */
public interface KnowledgeStore {

    /**
     * @return true when the record was stored
     */
    boolean put(KnowledgeRecord record);

    /**
     * @return up to {@code k} records, most similar first
     */
    List<KnowledgeRecord> query(String text, int k);
}
