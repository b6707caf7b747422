package com.afsun.schemagraph.graph;

import com.afsun.schemagraph.core.model.SchemaWarning;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.*;

/**
 * 去重后的有向多重图：表为节点，关系为边
 * 由 {@link SchemaGraphBuilder} 一次性构建完成，之后只读
 *
 * @author afsun
 */
@Getter
public class SchemaGraph {

    public static final int MAX_QUERY_DEPTH = 10;

    private final String database;
    private final List<TableNode> nodes;
    private final List<ReferenceEdge> edges;
    private final List<SchemaWarning> warnings;

    @Getter(AccessLevel.NONE)
    private final Map<String, TableNode> nodeIndex;
    @Getter(AccessLevel.NONE)
    private final Map<String, List<ReferenceEdge>> outgoing;
    @Getter(AccessLevel.NONE)
    private final Map<String, List<ReferenceEdge>> incoming;

    SchemaGraph(String database, List<TableNode> nodes, List<ReferenceEdge> edges, List<SchemaWarning> warnings) {
        this.database = database;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        Map<String, TableNode> index = new LinkedHashMap<>();
        for (TableNode n : nodes) {
            index.put(n.getId(), n);
        }
        this.nodeIndex = index;
        Map<String, List<ReferenceEdge>> out = new HashMap<>();
        Map<String, List<ReferenceEdge>> in = new HashMap<>();
        for (ReferenceEdge e : edges) {
            out.computeIfAbsent(e.getSource(), k -> new ArrayList<>()).add(e);
            in.computeIfAbsent(e.getTarget(), k -> new ArrayList<>()).add(e);
        }
        this.outgoing = out;
        this.incoming = in;
    }

    public Optional<TableNode> findNode(String table) {
        return Optional.ofNullable(nodeIndex.get(table));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * 该表引用其他表的边
     */
    public List<ReferenceEdge> outgoingEdges(String table) {
        return Collections.unmodifiableList(outgoing.getOrDefault(table, Collections.emptyList()));
    }

    /**
     * 其他表引用该表的边
     */
    public List<ReferenceEdge> incomingEdges(String table) {
        return Collections.unmodifiableList(incoming.getOrDefault(table, Collections.emptyList()));
    }

    /**
     * 查询该表（直接或间接）引用的表
     *
     * @param table 起始表
     * @param depth 查询深度（1表示直接引用，2表示引用的引用，以此类推）
     * @return 表名 -> 层级，按层级、表名顺序
     */
    public Map<String, Integer> referencedTables(String table, int depth) {
        return walk(table, depth, true);
    }

    /**
     * 查询（直接或间接）引用该表的表
     */
    public Map<String, Integer> referencingTables(String table, int depth) {
        return walk(table, depth, false);
    }

    /**
     * 沿引用方向查找两表间最短路径
     *
     * @return 途经表名（含首尾）；不可达时为空列表
     */
    public List<String> shortestPath(String from, String to) {
        if (!nodeIndex.containsKey(from) || !nodeIndex.containsKey(to)) {
            return Collections.emptyList();
        }
        if (from.equals(to)) {
            return Collections.singletonList(from);
        }
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        previous.put(from, null);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : sortedTargets(current)) {
                if (previous.containsKey(next)) {
                    continue;
                }
                previous.put(next, current);
                if (next.equals(to)) {
                    LinkedList<String> path = new LinkedList<>();
                    for (String step = to; step != null; step = previous.get(step)) {
                        path.addFirst(step);
                    }
                    return path;
                }
                queue.add(next);
            }
        }
        return Collections.emptyList();
    }

    /**
     * 是否存在有向环（自引用边计为环）
     */
    public boolean hasCycle() {
        Map<String, Integer> state = new HashMap<>();
        for (TableNode n : nodes) {
            if (!state.containsKey(n.getId()) && visitForCycle(n.getId(), state)) {
                return true;
            }
        }
        return false;
    }

    private boolean visitForCycle(String table, Map<String, Integer> state) {
        // 1: 访问中, 2: 已完成
        state.put(table, 1);
        for (ReferenceEdge e : outgoing.getOrDefault(table, Collections.emptyList())) {
            Integer s = state.get(e.getTarget());
            if (s != null && s == 1) {
                return true;
            }
            if (s == null && visitForCycle(e.getTarget(), state)) {
                return true;
            }
        }
        state.put(table, 2);
        return false;
    }

    private Map<String, Integer> walk(String table, int depth, boolean downstream) {
        if (depth < 1 || depth > MAX_QUERY_DEPTH) {
            throw new IllegalArgumentException("查询深度必须在1-" + MAX_QUERY_DEPTH + "之间");
        }
        Map<String, Integer> levels = new HashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(table);
        List<String> frontier = Collections.singletonList(table);
        for (int level = 1; level <= depth && !frontier.isEmpty(); level++) {
            List<String> next = new ArrayList<>();
            for (String current : frontier) {
                for (String neighbor : downstream ? sortedTargets(current) : sortedSources(current)) {
                    if (visited.add(neighbor)) {
                        levels.put(neighbor, level);
                        next.add(neighbor);
                    }
                }
            }
            frontier = next;
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(levels.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.<String, Integer>comparingByKey()));
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : entries) {
            ordered.put(e.getKey(), e.getValue());
        }
        return ordered;
    }

    private List<String> sortedTargets(String table) {
        Set<String> targets = new TreeSet<>();
        for (ReferenceEdge e : outgoing.getOrDefault(table, Collections.emptyList())) {
            targets.add(e.getTarget());
        }
        return new ArrayList<>(targets);
    }

    private List<String> sortedSources(String table) {
        Set<String> sources = new TreeSet<>();
        for (ReferenceEdge e : incoming.getOrDefault(table, Collections.emptyList())) {
            sources.add(e.getSource());
        }
        return new ArrayList<>(sources);
    }
}
