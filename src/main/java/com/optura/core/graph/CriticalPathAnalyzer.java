package com.optura.core.graph;

import com.optura.core.model.CriticalPathResult;
import com.optura.core.model.TaskRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Computes the critical path: the path of maximum summed duration between a
 * start node (no prerequisites) and an end node (no dependents).
 * <p>
 * Start and end nodes are enumerated in ascending task id order and the first
 * maximal path encountered is kept; later paths of equal duration do not
 * replace it. Isolated tasks are both a start and an end, so a graph without
 * edges yields its single longest task.
 * <p>
 * A cycle is not an error here: the result carries
 * {@link CriticalPathResult#CIRCULAR_DEPENDENCY} with an empty path and zero hours.
 */
@Service
public class CriticalPathAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CriticalPathAnalyzer.class);

    public CriticalPathResult analyze(DependencyGraph graph) {
        if (graph.isEmpty()) {
            return CriticalPathResult.empty(graph.projectId());
        }

        Optional<List<Integer>> topo = graph.topologicalOrder();
        if (topo.isEmpty()) {
            log.warn("Circular dependency detected in project {} ({} tasks, {} edges)",
                    graph.projectId(), graph.size(), graph.edgeCount());
            return CriticalPathResult.circular(graph.projectId());
        }
        List<Integer> order = topo.get();

        var starts = new ArrayList<Integer>();
        var ends = new ArrayList<Integer>();
        for (int i = 0; i < graph.size(); i++) {
            if (graph.inDegree(i) == 0) starts.add(i);
            if (graph.outDegree(i) == 0) ends.add(i);
        }

        double best = -1;
        List<Integer> bestPath = List.of();
        for (int start : starts) {
            LongestPaths paths = longestPathsFrom(graph, order, start);
            for (int end : ends) {
                if (!paths.reached[end]) continue;
                if (paths.distance[end] > best) {
                    best = paths.distance[end];
                    bestPath = paths.pathTo(end);
                }
            }
        }

        var path = new ArrayList<TaskRef>(bestPath.size());
        for (int index : bestPath) {
            var node = graph.node(index);
            path.add(new TaskRef(node.taskId(), node.name(), node.duration(), node.status()));
        }

        log.debug("Critical path for project {}: {} tasks, {}h ({} start nodes, {} end nodes)",
                graph.projectId(), path.size(), best, starts.size(), ends.size());
        return new CriticalPathResult(graph.projectId(), path, Math.max(best, 0.0), null);
    }

    /**
     * Single-source longest paths over a topological order. Distances include the
     * duration of both endpoints. On equal distances the first predecessor wins.
     */
    private LongestPaths longestPathsFrom(DependencyGraph graph, List<Integer> order, int source) {
        int n = graph.size();
        var result = new LongestPaths(n);
        result.reached[source] = true;
        result.distance[source] = graph.node(source).duration();

        for (int current : order) {
            if (!result.reached[current]) continue;
            for (int next : graph.successors(current)) {
                double candidate = result.distance[current] + graph.node(next).duration();
                if (!result.reached[next] || candidate > result.distance[next]) {
                    result.reached[next] = true;
                    result.distance[next] = candidate;
                    result.previous[next] = current;
                }
            }
        }
        return result;
    }

    private static final class LongestPaths {
        final boolean[] reached;
        final double[] distance;
        final int[] previous;

        LongestPaths(int size) {
            reached = new boolean[size];
            distance = new double[size];
            previous = new int[size];
            java.util.Arrays.fill(previous, -1);
        }

        List<Integer> pathTo(int end) {
            var path = new ArrayList<Integer>();
            for (int at = end; at != -1; at = previous[at]) {
                path.add(at);
            }
            Collections.reverse(path);
            return path;
        }
    }
}
