package com.loanrecon.common;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Disjoint-set over string keys with path compression. The root of a merged set is always the
 * lexicographically smallest key, so results do not depend on union order.
 */
public final class UnionFind {

    private final Map<String, String> parent = new HashMap<>();

    public UnionFind(Iterable<String> keys) {
        for (String k : keys) {
            parent.put(k, k);
        }
    }

    public String find(String key) {
        String p = parent.get(key);
        if (p == null) {
            throw new IllegalArgumentException("Unknown key: " + key);
        }
        if (p.equals(key)) {
            return key;
        }
        String root = find(p);
        parent.put(key, root);
        return root;
    }

    /**
     * @return the new root, or the shared root when already connected
     */
    public String union(String a, String b) {
        String ra = find(a);
        String rb = find(b);
        if (ra.equals(rb)) {
            return ra;
        }
        if (ra.compareTo(rb) < 0) {
            parent.put(rb, ra);
            return ra;
        }
        parent.put(ra, rb);
        return rb;
    }

    public boolean connected(String a, String b) {
        return find(a).equals(find(b));
    }

    /** Sets keyed by root, members sorted ascending. */
    public Map<String, List<String>> sets() {
        TreeMap<String, List<String>> out = new TreeMap<>();
        List<String> keys = new ArrayList<>(parent.keySet());
        keys.sort(null);
        for (String k : keys) {
            out.computeIfAbsent(find(k), r -> new ArrayList<>()).add(k);
        }
        return out;
    }
}
