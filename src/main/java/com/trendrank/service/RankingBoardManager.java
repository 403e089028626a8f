package com.trendrank.service;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.trendrank.engine.BenchmarkHistory;

import jakarta.annotation.PostConstruct;

/**
 * Holds every ranking board of the application, keyed by board id, together with the benchmark
 * history the boards record into.
 */
@Component
public class RankingBoardManager {
    private final Logger logger = LoggerFactory.getLogger(RankingBoardManager.class);
    private final ConcurrentHashMap<String, RankingBoard> boards = new ConcurrentHashMap<>();
    private final Map<String, Lock> boardCreationLocks = new ConcurrentHashMap<>();

    @Value("${ranking.benchmark.capacity:1000}")
    private int benchmarkCapacity = BenchmarkHistory.DEFAULT_CAPACITY;

    private BenchmarkHistory benchmarkHistory;

    @PostConstruct
    public void initialize() {
        logger.info("Initializing RankingBoardManager with benchmark capacity {}", benchmarkCapacity);
        benchmarkHistory = new BenchmarkHistory(benchmarkCapacity);
    }

    public RankingBoard getOrCreateBoard(String boardId) {
        RankingBoard board = boards.get(boardId);
        if (board != null) {
            return board;
        }
        Lock lock = boardCreationLocks.computeIfAbsent(boardId, k -> new ReentrantLock());
        lock.lock();
        try {
            return boards.computeIfAbsent(boardId, id -> {
                logger.info("Creating ranking board {}", id);
                return new RankingBoard(id, benchmarkHistory);
            });
        } finally {
            lock.unlock();
        }
    }

    public RankingBoard getBoard(String boardId) {
        return boards.get(boardId);
    }

    public boolean removeBoard(String boardId) {
        boardCreationLocks.remove(boardId);
        RankingBoard removed = boards.remove(boardId);
        if (removed != null) {
            logger.info("Removed ranking board {}", boardId);
        }
        return removed != null;
    }

    public Set<String> getBoardIds() {
        return new TreeSet<>(boards.keySet());
    }

    public BenchmarkHistory benchmarkHistory() {
        return benchmarkHistory;
    }
}
