package com.evolver.reflection;

import com.evolver.exception.InvalidProposalException;
import com.evolver.patch.PatchProposal;
import com.evolver.rule.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Advisor-assisted reflection.
 *
 * <p>The failure context is handed to the {@link Advisor} on a separate thread and the
 * answer is awaited for at most {@code timeoutMillis}; no answer in time means no
 * proposals and the call is interrupted. Calls never queue behind an advisor that ignores
 * the interrupt. Every returned candidate goes through the {@link ProposalValidator} and is
 * dropped when invalid.
 */
public class ReflectionV2 implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReflectionV2.class);

    private final Advisor advisor;
    private final ProposalValidator validator;
    private final long timeoutMillis;
    private final ExecutorService executor;
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    public ReflectionV2(Advisor advisor, ProposalValidator validator, long timeoutMillis) {
        this.advisor = advisor;
        this.validator = validator;
        this.timeoutMillis = timeoutMillis;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "evolver-advisor-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<PatchProposal> reflect(FailureContext context, RuleSet rules) {
        if (context.isEmpty()) {
            return List.of();
        }
        List<PatchProposal> candidates = ask(context);
        List<PatchProposal> accepted = new ArrayList<>();
        for (PatchProposal candidate : candidates) {
            try {
                validator.validate(candidate, rules);
                accepted.add(candidate);
            } catch (InvalidProposalException e) {
                log.warn("Dropping advisor proposal: {}", e.getMessage());
            }
        }
        log.debug("Advisor proposed {} candidates, {} valid", candidates.size(), accepted.size());
        return accepted;
    }

    private List<PatchProposal> ask(FailureContext context) {
        Future<List<PatchProposal>> answer = executor.submit(() -> advisor.propose(context));
        try {
            List<PatchProposal> proposals = answer.get(timeoutMillis, TimeUnit.MILLISECONDS);
            return proposals == null ? List.of() : proposals;
        } catch (TimeoutException e) {
            answer.cancel(true);
            log.warn("Advisor did not answer within {}ms, continuing without it", timeoutMillis);
            return List.of();
        } catch (ExecutionException e) {
            log.warn("Advisor failed: {}", e.getCause() != null ? e.getCause().toString() : e.toString());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the advisor");
            return List.of();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
