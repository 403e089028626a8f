package com.trendrank.service;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.trendrank.engine.BenchmarkHistory;
import com.trendrank.engine.RankingOrchestrator;

/**
 * A named ranking engine instance. The orchestrator is not thread-safe, so every call goes through
 * {@link #execute(Function)} which holds the board's lock.
 */
public class RankingBoard {
    private final String boardId;
    private final Lock lock = new ReentrantLock();
    private final RankingOrchestrator orchestrator;

    public RankingBoard(String boardId, BenchmarkHistory history) {
        this.boardId = boardId;
        this.orchestrator = new RankingOrchestrator(history);
    }

    public <T> T execute(Function<RankingOrchestrator, T> action) {
        lock.lock();
        try {
            return action.apply(orchestrator);
        } finally {
            lock.unlock();
        }
    }

    public String getBoardId() {
        return boardId;
    }
}
