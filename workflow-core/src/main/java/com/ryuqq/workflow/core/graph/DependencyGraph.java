package com.ryuqq.workflow.core.graph;

import com.ryuqq.workflow.core.exception.ConstructionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 인덱스 기반 의존성 그래프.
 *
 * <p>빌드 시점에 핸들 객체로 연결된 그래프를 실행 직전에 {@code 노드 인덱스 → 의존 인덱스 집합}
 * 형태로 고정(freeze)한 뒤, 순환/참조 검증을 한 번만 수행합니다.
 * 생성에 성공한 인스턴스는 항상 유효한 DAG이며 불변입니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>범위를 벗어난 의존 인덱스 (등록되지 않은 컴포넌트 참조)</li>
 *   <li>자기 자신에 대한 의존</li>
 *   <li>순환 의존 (Kahn 알고리즘으로 위상 정렬 후 남은 노드)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DependencyGraph {

    private final List<String> names;
    private final List<Set<Integer>> dependencies;
    private final List<List<Integer>> dependents;

    private DependencyGraph(List<String> names, List<Set<Integer>> dependencies, List<List<Integer>> dependents) {
        this.names = names;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    /**
     * 그래프 생성 및 검증.
     *
     * @param names 노드 이름 (인덱스 순서, 진단용)
     * @param dependencies 노드별 의존 인덱스 집합 (names와 같은 크기)
     * @return 검증된 그래프
     * @throws ConstructionException 참조 오류 또는 순환이 있는 경우
     * @throws IllegalArgumentException 인자가 null이거나 크기가 다른 경우
     */
    public static DependencyGraph of(List<String> names, List<? extends Set<Integer>> dependencies)
        throws ConstructionException {
        if (names == null || dependencies == null) {
            throw new IllegalArgumentException("names and dependencies cannot be null");
        }
        if (names.size() != dependencies.size()) {
            throw new IllegalArgumentException(
                String.format("names and dependencies must have the same size (%d != %d)",
                    names.size(), dependencies.size()));
        }

        int size = names.size();
        List<Set<Integer>> frozenDependencies = new ArrayList<>(size);
        List<List<Integer>> reverse = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            reverse.add(new ArrayList<>());
        }

        for (int node = 0; node < size; node++) {
            Set<Integer> deps = dependencies.get(node) == null ? Set.of() : dependencies.get(node);
            for (Integer dep : deps) {
                if (dep == null || dep < 0 || dep >= size) {
                    throw new ConstructionException(String.format(
                        "Component %s depends on an unregistered component (index %s)", describe(names, node), dep));
                }
                if (dep == node) {
                    throw new ConstructionException(String.format(
                        "Component %s cannot depend on itself", describe(names, node)));
                }
                reverse.get(dep).add(node);
            }
            frozenDependencies.add(Collections.unmodifiableSet(new LinkedHashSet<>(deps)));
        }

        checkAcyclic(names, frozenDependencies, reverse);

        List<List<Integer>> frozenDependents = new ArrayList<>(size);
        for (List<Integer> list : reverse) {
            frozenDependents.add(List.copyOf(list));
        }
        return new DependencyGraph(List.copyOf(names), List.copyOf(frozenDependencies),
            List.copyOf(frozenDependents));
    }

    /**
     * Kahn 알고리즘으로 진입 차수를 소거해 순환 검출.
     *
     * @throws ConstructionException 순환이 있어 소거되지 않은 노드가 남은 경우
     */
    private static void checkAcyclic(List<String> names, List<Set<Integer>> dependencies,
                                                   List<List<Integer>> reverse) throws ConstructionException {
        int size = names.size();
        int[] inDegree = new int[size];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int node = 0; node < size; node++) {
            inDegree[node] = dependencies.get(node).size();
            if (inDegree[node] == 0) {
                queue.add(node);
            }
        }

        int resolved = 0;
        while (!queue.isEmpty()) {
            int current = queue.poll();
            resolved++;
            for (int dependent : reverse.get(current)) {
                if (--inDegree[dependent] == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (resolved != size) {
            List<String> remaining = new ArrayList<>();
            for (int node = 0; node < size; node++) {
                if (inDegree[node] > 0) {
                    remaining.add(describe(names, node));
                }
            }
            throw new ConstructionException("Circular dependency detected among components: " + remaining);
        }
    }

    private static String describe(List<String> names, int index) {
        return "'" + names.get(index) + "' (#" + index + ")";
    }

    /**
     * 노드 수 조회.
     *
     * @return 노드 수
     */
    public int size() {
        return names.size();
    }

    public String nameOf(int node) {
        return names.get(node);
    }

    /**
     * 직접 의존 노드 조회.
     *
     * @param node 노드 인덱스
     * @return 의존 인덱스 집합 (불변)
     */
    public Set<Integer> dependenciesOf(int node) {
        return dependencies.get(node);
    }

    /**
     * 직접 하위 노드 조회 (이 노드에 의존하는 노드).
     *
     * @param node 노드 인덱스
     * @return 하위 노드 인덱스 목록 (불변)
     */
    public List<Integer> dependentsOf(int node) {
        return dependents.get(node);
    }

    /**
     * 의존성이 없는 노드 조회.
     *
     * @return 루트 노드 인덱스 목록
     */
    public List<Integer> roots() {
        List<Integer> roots = new ArrayList<>();
        for (int node = 0; node < size(); node++) {
            if (dependencies.get(node).isEmpty()) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * 전이적 하위 노드 조회 (역방향 도달 가능성).
     *
     * @param node 시작 노드 인덱스
     * @return node에서 역방향 간선으로 도달 가능한 모든 노드 (node 자신 제외), BFS 순서
     */
    public List<Integer> descendantsOf(int node) {
        BitSet visited = new BitSet(size());
        Deque<Integer> queue = new ArrayDeque<>(dependents.get(node));
        List<Integer> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (visited.get(current)) {
                continue;
            }
            visited.set(current);
            result.add(current);
            queue.addAll(dependents.get(current));
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{names=" + names + ", dependencies=" + dependencies + "}";
    }
}
