package com.governance.orchestration.workflow;

import com.governance.orchestration.exception.PlanConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * 依赖图（节点 → 其依赖的节点），步骤和工作流共用
 *
 * <p>节点按插入顺序保存，所有遍历结果稳定可复现。
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(Map<String, ? extends Collection<String>> source) {
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();
        source.forEach((node, deps) -> {
            dependencies.put(node, deps == null ? Set.of() : new LinkedHashSet<>(deps));
            dependents.putIfAbsent(node, new LinkedHashSet<>());
        });
        dependencies.forEach((node, deps) -> {
            for (String dep : deps) {
                if (dependents.containsKey(dep)) {
                    dependents.get(dep).add(node);
                }
            }
        });
    }

    public static DependencyGraph of(Map<String, ? extends Collection<String>> dependencies) {
        return new DependencyGraph(dependencies);
    }

    public static DependencyGraph ofSteps(List<WorkflowStep> steps) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (WorkflowStep step : steps) {
            if (map.put(step.stepId(), step.dependencies()) != null) {
                throw new PlanConfigurationException("Duplicate step id: " + step.stepId());
            }
        }
        return new DependencyGraph(map);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    public Set<String> dependenciesOf(String node) {
        return dependencies.getOrDefault(node, Set.of());
    }

    public Set<String> dependentsOf(String node) {
        return dependents.getOrDefault(node, Set.of());
    }

    /**
     * 引用了图中不存在节点的依赖，格式 "node -> dep"
     */
    public List<String> unknownDependencies() {
        List<String> unknown = new ArrayList<>();
        dependencies.forEach((node, deps) -> {
            for (String dep : deps) {
                if (!dependencies.containsKey(dep)) {
                    unknown.add(node + " -> " + dep);
                }
            }
        });
        return unknown;
    }

    /**
     * 查找一个环，返回环上的节点序列（首尾相同）
     */
    public Optional<List<String>> findCycle() {
        Map<String, Integer> color = new HashMap<>();
        for (String node : dependencies.keySet()) {
            if (color.getOrDefault(node, 0) == 0) {
                List<String> path = new ArrayList<>();
                List<String> cycle = visit(node, color, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    // 0 = 未访问, 1 = 访问中, 2 = 已完成
    private List<String> visit(String node, Map<String, Integer> color, List<String> path) {
        color.put(node, 1);
        path.add(node);
        for (String dep : dependenciesOf(node)) {
            if (!dependencies.containsKey(dep)) {
                continue;
            }
            int state = color.getOrDefault(dep, 0);
            if (state == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                return cycle;
            }
            if (state == 0) {
                List<String> cycle = visit(dep, color, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        color.put(node, 2);
        return null;
    }

    /**
     * 校验：无未知依赖、无环
     *
     * @param label 出错时用于定位的名称（工作流 ID 等）
     * @throws PlanConfigurationException 校验失败
     */
    public void validate(String label) {
        List<String> unknown = unknownDependencies();
        if (!unknown.isEmpty()) {
            throw new PlanConfigurationException(label + ": unknown dependency " + unknown);
        }
        Optional<List<String>> cycle = findCycle();
        if (cycle.isPresent()) {
            throw new PlanConfigurationException(label + ": dependency cycle " + String.join(" -> ", cycle.get()));
        }
    }

    /**
     * Kahn 拓扑排序，同一时刻可选的节点按 tieBreak 排序
     *
     * @throws PlanConfigurationException 存在环
     */
    public List<String> topologicalOrder(Comparator<String> tieBreak) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> insertion = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int count = 0;
            for (String dep : entry.getValue()) {
                if (dependencies.containsKey(dep)) {
                    count++;
                }
            }
            inDegree.put(entry.getKey(), count);
            insertion.put(entry.getKey(), index++);
        }

        Comparator<String> order = tieBreak.thenComparing(insertion::get);
        PriorityQueue<String> ready = new PriorityQueue<>(order);
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });

        List<String> result = new ArrayList<>(dependencies.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            result.add(current);
            for (String child : dependentsOf(current)) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(child);
                }
            }
        }

        if (result.size() != dependencies.size()) {
            throw new PlanConfigurationException("Circular dependency detected among "
                + (dependencies.size() - result.size()) + " node(s)");
        }
        return result;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder((a, b) -> 0);
    }

    /**
     * 分层：同一层内的节点互不依赖，可以并行
     */
    public List<List<String>> levels() {
        Map<String, Integer> level = new LinkedHashMap<>();
        for (String node : topologicalOrder()) {
            int depth = 0;
            for (String dep : dependenciesOf(node)) {
                Integer depLevel = level.get(dep);
                if (depLevel != null) {
                    depth = Math.max(depth, depLevel + 1);
                }
            }
            level.put(node, depth);
        }
        List<List<String>> levels = new ArrayList<>();
        level.forEach((node, depth) -> {
            while (levels.size() <= depth) {
                levels.add(new ArrayList<>());
            }
            levels.get(depth).add(node);
        });
        return levels;
    }

    /**
     * 按节点权重计算的最长路径（关键路径）
     */
    public List<String> criticalPath(ToDoubleFunction<String> weight) {
        Map<String, Double> finish = new HashMap<>();
        Map<String, String> predecessor = new HashMap<>();
        String last = null;
        double best = -1;
        for (String node : topologicalOrder()) {
            double start = 0;
            String from = null;
            for (String dep : dependenciesOf(node)) {
                Double depFinish = finish.get(dep);
                if (depFinish != null && depFinish > start) {
                    start = depFinish;
                    from = dep;
                }
            }
            double end = start + Math.max(0, weight.applyAsDouble(node));
            finish.put(node, end);
            if (from != null) {
                predecessor.put(node, from);
            }
            if (end > best) {
                best = end;
                last = node;
            }
        }
        List<String> path = new ArrayList<>();
        for (String node = last; node != null; node = predecessor.get(node)) {
            path.add(0, node);
        }
        return path;
    }

    /**
     * 关键路径的总权重
     */
    public double longestPathWeight(ToDoubleFunction<String> weight) {
        double total = 0;
        for (String node : criticalPath(weight)) {
            total += Math.max(0, weight.applyAsDouble(node));
        }
        return total;
    }
}
