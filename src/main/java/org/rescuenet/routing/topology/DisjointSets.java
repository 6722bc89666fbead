package org.rescuenet.routing.topology;

/**
 * Union-find over dense indices with union by size and path halving.
 */
final class DisjointSets {
    private final int[] parent;
    private final int[] size;
    private int components;

    DisjointSets(int count) {
        parent = new int[count];
        size = new int[count];
        for (int i = 0; i < count; i++) {
            parent[i] = i;
            size[i] = 1;
        }
        components = count;
    }

    int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return;
        }
        if (size[ra] < size[rb]) {
            int tmp = ra;
            ra = rb;
            rb = tmp;
        }
        parent[rb] = ra;
        size[ra] += size[rb];
        components--;
    }

    int components() {
        return components;
    }

    int largest() {
        int best = 0;
        for (int i = 0; i < parent.length; i++) {
            if (parent[i] == i) {
                best = Math.max(best, size[i]);
            }
        }
        return best;
    }
}
