package com.trendrank.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trendrank.model.Item;
import com.trendrank.model.MultiMetricKey;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RefreshResult;
import com.trendrank.model.RefreshStats;

/**
 * Owns the ranked view of one item collection and the strategy maintaining it.
 * <p>
 * {@link #build(List, RankPolicy)} chooses a strategy and discards everything a previous build
 * left behind; {@link #refresh(List)} hands a new snapshot to the same strategy. The view and its
 * position index are rebuilt by the orchestrator after every build and refresh.
 * <p>
 * Not thread-safe and not reentrant: callers serialise access.
 */
public class RankingOrchestrator {
    private final Logger logger = LoggerFactory.getLogger(RankingOrchestrator.class);

    private final BenchmarkHistory history;
    private final RankedView view = new RankedView();

    private RankPolicy policy;
    private RankingStrategy strategy;
    private List<RankingKey> previousView = List.of();
    private List<MultiMetricKey> previousMultiView = List.of();
    private long buildNanos;
    private long refreshNanos;
    private int refreshCount;

    public RankingOrchestrator() {
        this(null);
    }

    /**
     * @param history collector for build/refresh timings, may be null
     */
    public RankingOrchestrator(BenchmarkHistory history) {
        this.history = history;
    }

    /**
     * Builds a fresh view of {@code min(K, n)} entries.
     *
     * @return the view, best first
     */
    public List<RankingKey> build(List<Item> items, RankPolicy policy) {
        this.policy = policy;
        this.strategy = RankingStrategies.create(policy);
        view.clear();
        previousView = List.of();
        previousMultiView = List.of();
        refreshNanos = 0;
        refreshCount = 0;

        long start = System.nanoTime();
        strategy.build(items, view);
        view.rebuildIndex();
        buildNanos = System.nanoTime() - start;

        if (history != null) {
            history.record(policy, items.size(), buildNanos, false);
        }
        logger.debug("Built {} view of {} from {} items in {} ns", policy.strategy(), view.size(), items.size(),
                buildNanos);
        return view.entries();
    }

    /**
     * Applies a new snapshot with the policy of the last build.
     *
     * @throws IllegalStateException when nothing has been built yet
     */
    public RefreshResult refresh(List<Item> items) {
        if (strategy == null) {
            throw new IllegalStateException("refresh called before build");
        }
        previousView = view.entries();
        previousMultiView = strategy.multiMetricView();

        long start = System.nanoTime();
        RefreshStats stats = strategy.refresh(items, view);
        view.rebuildIndex();
        refreshNanos = System.nanoTime() - start;
        refreshCount++;

        if (history != null) {
            history.record(policy, items.size(), refreshNanos, true);
        }
        logger.debug("Refreshed {} view to {} entries in {} ns: {}", policy.strategy(), view.size(), refreshNanos,
                stats);
        return new RefreshResult(view.entries(), refreshNanos, stats);
    }

    /**
     * The first {@code min(k, size)} entries; {@code k <= 0} gives an empty list.
     */
    public List<RankingKey> getTopK(int k) {
        return view.top(k);
    }

    /** The view as it was before the most recent refresh. */
    public List<RankingKey> getPreviousTopK(int k) {
        if (k <= 0) {
            return List.of();
        }
        return previousView.subList(0, Math.min(k, previousView.size()));
    }

    public List<MultiMetricKey> getMultiMetricTopK(int k) {
        if (strategy == null || k <= 0) {
            return List.of();
        }
        List<MultiMetricKey> multi = strategy.multiMetricView();
        return multi.subList(0, Math.min(k, multi.size()));
    }

    public List<MultiMetricKey> getPreviousMultiMetricTopK(int k) {
        if (k <= 0) {
            return List.of();
        }
        return previousMultiView.subList(0, Math.min(k, previousMultiView.size()));
    }

    /**
     * Changes the score of a ranked entry and moves it to its sorted position by neighbor exchange.
     * Only array-backed strategies support point updates.
     *
     * @return false when the id is not in the view or the active strategy is not array-backed
     */
    public boolean updateScore(String id, long newScore) {
        if (strategy == null || !strategy.type().isArrayBacked()) {
            return false;
        }
        return view.updateScore(id, newScore);
    }

    /**
     * Writes {@code id -> offset} straight into the position index. Nothing checks that the view
     * actually holds {@code id} at that offset.
     */
    public void mapping(String id, int offset) {
        view.mapping(id, offset);
    }

    /**
     * @return 1-based rank from the position index, empty when the id is not ranked
     */
    public OptionalInt rankOf(String id) {
        OptionalInt offset = view.positionOf(id);
        return offset.isPresent() ? OptionalInt.of(offset.getAsInt() + 1) : OptionalInt.empty();
    }

    public Optional<RankingKey> find(String id) {
        return view.find(id);
    }

    public Map<String, Integer> positionIndex() {
        return view.positionIndex();
    }

    public int size() {
        return view.size();
    }

    public boolean isBuilt() {
        return strategy != null;
    }

    public RankPolicy policy() {
        return policy;
    }

    public double buildTimeMillis() {
        return buildNanos / 1_000_000.0;
    }

    public double refreshTimeMillis() {
        return refreshNanos / 1_000_000.0;
    }

    public int refreshCount() {
        return refreshCount;
    }
}
