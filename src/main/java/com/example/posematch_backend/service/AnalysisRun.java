package com.example.posematch_backend.service;

import com.example.posematch_backend.dto.AnalysisRequest;
import com.example.posematch_backend.dto.SimilarityResult;
import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.util.RunState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Live handle of one analysis run. State changes happen on the coordinating thread; {@link #cancel()} may be
 * called from any thread.
 */
public class AnalysisRun {

    private final String runId;
    private final AnalysisRequest request;
    private final List<RunState> history = new ArrayList<>();
    private final List<String> cleanupIssues = new ArrayList<>();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    private RunState state = RunState.CREATED;
    private RunState failedIn;
    private AnalysisException failure;
    private SimilarityResult result;
    private volatile boolean cancelled;

    public AnalysisRun(String runId, AnalysisRequest request) {
        this.runId = runId;
        this.request = request;
        this.history.add(RunState.CREATED);
    }

    public synchronized void transitionTo(RunState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + ": illegal transition " + state + " -> " + next);
        }
        state = next;
        history.add(next);
    }

    /**
     * Records the first failure and moves to {@link RunState#FAILED}. Later failures are ignored.
     */
    public synchronized void fail(AnalysisException error) {
        if (failure != null || state == RunState.FAILED || state.isTerminal()) {
            return;
        }
        failedIn = state;
        failure = error;
        transitionTo(RunState.FAILED);
    }

    /**
     * Cancels in-flight work with interruption, which also kills running external processes.
     */
    public void cancel() {
        cancelled = true;
        for (Future<?> f : inFlight) {
            f.cancel(true);
        }
    }

    void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.remove(future);
    }

    public synchronized void succeed(SimilarityResult result) {
        this.result = result;
        transitionTo(RunState.SCORED);
    }

    synchronized void addCleanupIssue(String issue) {
        cleanupIssues.add(issue);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getRunId() {
        return runId;
    }

    public AnalysisRequest getRequest() {
        return request;
    }

    public synchronized RunState getState() {
        return state;
    }

    public synchronized List<RunState> getHistory() {
        return List.copyOf(history);
    }

    public synchronized RunState getFailedIn() {
        return failedIn;
    }

    public synchronized AnalysisException getFailure() {
        return failure;
    }

    public synchronized SimilarityResult getResult() {
        return result;
    }

    public synchronized List<String> getCleanupIssues() {
        return Collections.unmodifiableList(new ArrayList<>(cleanupIssues));
    }
}
