package com.stereoselect.service.impl;

import com.stereoselect.aspect.Timed;
import com.stereoselect.exception.InvalidFootprintException;
import com.stereoselect.exception.SelectionException;
import com.stereoselect.model.Footprint;
import com.stereoselect.model.MultilookGroup;
import com.stereoselect.model.OverlapPair;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.model.result.SelectionResult;
import com.stereoselect.repository.FootprintRepository;
import com.stereoselect.selection.MultilookSelector;
import com.stereoselect.selection.ResultAssembler;
import com.stereoselect.selection.StereoPairSelector;
import com.stereoselect.service.SelectionService;

import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.TopologyException;
import org.springframework.stereotype.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * SelectionService that processes anchors independently on a shared worker
 * pool. Each anchor's output is collected only once its task completes, and
 * the results are reassembled in anchor-id order.
 */
@Service
@RequiredArgsConstructor
public class SelectionServiceImpl implements SelectionService {

    private static final Logger logger = LoggerFactory.getLogger(SelectionServiceImpl.class);

    private final FootprintRepository footprintRepository;
    private final StereoPairSelector stereoPairSelector;
    private final MultilookSelector multilookSelector;
    private final ResultAssembler resultAssembler;
    private final ExecutorService selectionExecutor;

    @Override
    @Timed(value = "stereo pair selection", logLevel = Timed.LogLevel.INFO)
    public SelectionResult<OverlapPair> selectStereoPairs(SelectionParams params) {
        params.validate();
        List<Footprint> anchors = footprintRepository.all();
        logger.info("Selecting stereo pairs for {} anchors (metric={}, min={}, strip={}, instrument={}, days={})",
                    anchors.size(), params.getMetricKind(), params.getMinMetric(),
                    params.isWithinStrip(), params.isWithinInstrument(), params.getDaysThreshold());

        List<AnchorOutcome<OverlapPair>> outcomes = runPerAnchor(anchors,
                anchor -> stereoPairSelector.selectForAnchor(anchor, footprintRepository, params));

        SelectionResult.SelectionResultBuilder<OverlapPair> result = collect(outcomes, anchors.size());
        List<OverlapPair> pairs = outcomes.stream()
                .flatMap(outcome -> outcome.records.stream())
                .collect(Collectors.toList());
        result.rows(resultAssembler.stereoRows(pairs, id -> footprintRepository.get(id).orElse(null)));

        logger.info("Found {} stereo pairs", pairs.size());
        return result.build();
    }

    @Override
    @Timed(value = "multilook selection", logLevel = Timed.LogLevel.INFO)
    public SelectionResult<MultilookGroup> selectMultilookGroups(SelectionParams params) {
        return selectMultilook(params, footprintRepository.all());
    }

    @Override
    @Timed(value = "multilook selection", logLevel = Timed.LogLevel.INFO)
    public SelectionResult<MultilookGroup> selectMultilookGroups(SelectionParams params, Collection<String> anchorIds) {
        Set<String> requested = new TreeSet<>(anchorIds);
        List<Footprint> anchors = requested.stream()
                .map(footprintRepository::get)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (anchors.size() < requested.size()) {
            logger.warn("{} of {} requested anchors are not in the repository",
                        requested.size() - anchors.size(), requested.size());
        }
        return selectMultilook(params, anchors);
    }

    private SelectionResult<MultilookGroup> selectMultilook(SelectionParams params, List<Footprint> anchors) {
        params.validate();
        logger.info("Selecting multilook groups for {} anchors (min pairs={}, min area={}, ranking={})",
                    anchors.size(), params.getMinPairs(), params.getMinArea(), params.getRanking());

        List<AnchorOutcome<MultilookGroup>> outcomes = runPerAnchor(anchors,
                anchor -> multilookSelector.selectForAnchor(anchor, footprintRepository, params));

        SelectionResult.SelectionResultBuilder<MultilookGroup> result = collect(outcomes, anchors.size());
        List<MultilookGroup> groups = outcomes.stream()
                .flatMap(outcome -> outcome.records.stream())
                .collect(Collectors.toList());
        result.rows(resultAssembler.multilookRows(groups));

        logger.info("Found {} multilook groups", groups.size());
        return result.build();
    }

    private <T> List<AnchorOutcome<T>> runPerAnchor(List<Footprint> anchors, Function<Footprint, List<T>> unit) {
        List<CompletableFuture<AnchorOutcome<T>>> futures = new ArrayList<>(anchors.size());
        for (Footprint anchor : anchors) {
            futures.add(CompletableFuture.supplyAsync(() -> processAnchor(anchor, unit), selectionExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new SelectionException("Selection interrupted, partial results discarded", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof SelectionException) {
                throw (SelectionException) cause;
            }
            throw new SelectionException("Selection failed: " + cause.getMessage(), cause);
        }

        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private <T> AnchorOutcome<T> processAnchor(Footprint anchor, Function<Footprint, List<T>> unit) {
        try {
            List<T> records = unit.apply(anchor);
            logger.debug("Anchor {}: {} records", anchor.getId(), records.size());
            return AnchorOutcome.of(records);
        } catch (InvalidFootprintException e) {
            logger.warn("Skipping anchor: {}", e.getMessage());
            return AnchorOutcome.skipped(e.getFootprintId());
        } catch (TopologyException e) {
            logger.warn("Skipping anchor {}: overlay failed: {}", anchor.getId(), e.getMessage());
            return AnchorOutcome.skipped(anchor.getId());
        }
    }

    private <T> SelectionResult.SelectionResultBuilder<T> collect(List<AnchorOutcome<T>> outcomes, int anchorCount) {
        SelectionResult.SelectionResultBuilder<T> result = SelectionResult.<T>builder()
                .anchorsProcessed(anchorCount);
        for (AnchorOutcome<T> outcome : outcomes) {
            if (outcome.skippedId != null) {
                result.skippedAnchorId(outcome.skippedId);
            }
            result.records(outcome.records);
        }
        if (outcomes.stream().anyMatch(outcome -> outcome.skippedId != null)) {
            logger.warn("{} anchors skipped as invalid footprints",
                        outcomes.stream().filter(outcome -> outcome.skippedId != null).count());
        }
        return result;
    }

    private static final class AnchorOutcome<T> {
        private final List<T> records;
        private final String skippedId;

        private AnchorOutcome(List<T> records, String skippedId) {
            this.records = records;
            this.skippedId = skippedId;
        }

        static <T> AnchorOutcome<T> of(List<T> records) {
            return new AnchorOutcome<>(records, null);
        }

        static <T> AnchorOutcome<T> skipped(String footprintId) {
            return new AnchorOutcome<>(Collections.emptyList(), footprintId);
        }
    }
}
