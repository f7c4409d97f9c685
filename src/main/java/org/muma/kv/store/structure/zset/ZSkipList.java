package org.muma.kv.store.structure.zset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * ZSkipList
 * Mirrors Redis zskiplist: O(logN) insert / delete / rank lookup, plus a level-0 backward link so reverse
 * walks cost O(1) per step.
 * <p>
 * Ordered by score ascending, ties broken by member in code point order. Members arrive one char per
 * byte, so that is the byte order of the raw member.
 * Members are unique: inserting a member that is already present with another score moves it.
 * Not thread-safe.
 */
public class ZSkipList {

    static final int ZSKIPLIST_MAXLEVEL = 32;
    static final double ZSKIPLIST_P = 0.25;

    private final Random random;
    // member -> its node, keeps members unique without a level-0 scan
    private final Map<String, ZSkipListNode> nodes = new HashMap<>();
    private final ZSkipListNode header;
    private ZSkipListNode tail;
    private long length;
    private int level;

    /**
     * @param random level source, pass a seeded instance for reproducible layouts
     */
    public ZSkipList(Random random) {
        this.random = random;
        this.level = 1;
        this.length = 0;
        this.header = new ZSkipListNode(ZSKIPLIST_MAXLEVEL, 0, null);
    }

    /**
     * Inserts member with score. A member already present with a different score is unlinked and
     * inserted again at its new position; one with the same score is left alone.
     *
     * @return true only when member was not in the list before
     */
    public boolean insert(double score, String member) {
        ZSkipListNode existing = nodes.get(member);
        if (existing != null) {
            if (existing.score == score) {
                return false;
            }
            delete(existing.score, member);
        }

        ZSkipListNode[] update = new ZSkipListNode[ZSKIPLIST_MAXLEVEL];
        long[] rank = new long[ZSKIPLIST_MAXLEVEL];

        // 1. walk down from the top level, remembering the last node before the new one and its rank
        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            rank[i] = (i == this.level - 1) ? 0 : rank[i + 1];
            while (x.level[i].forward != null && precedes(x.level[i].forward, score, member)) {
                rank[i] += x.level[i].span;
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        // 2. levels the list did not have yet start at the header
        int lvl = randomLevel();
        if (lvl > this.level) {
            for (int i = this.level; i < lvl; i++) {
                rank[i] = 0;
                update[i] = this.header;
                update[i].level[i].span = this.length;
            }
            this.level = lvl;
        }

        // 3. splice the node in, splitting each predecessor's span
        x = new ZSkipListNode(lvl, score, member);
        for (int i = 0; i < lvl; i++) {
            x.level[i].forward = update[i].level[i].forward;
            update[i].level[i].forward = x;

            x.level[i].span = update[i].level[i].span - (rank[0] - rank[i]);
            update[i].level[i].span = (rank[0] - rank[i]) + 1;
        }

        // levels above the new node now jump over one more node
        for (int i = lvl; i < this.level; i++) {
            update[i].level[i].span++;
        }

        // 4. backward link, tail
        x.backward = (update[0] == this.header) ? null : update[0];
        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x;
        } else {
            this.tail = x;
        }

        this.length++;
        nodes.put(member, x);
        return existing == null;
    }

    /**
     * @return false when no node matches (score, member)
     */
    public boolean delete(double score, String member) {
        ZSkipListNode[] update = new ZSkipListNode[ZSKIPLIST_MAXLEVEL];
        ZSkipListNode x = this.header;

        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && precedes(x.level[i].forward, score, member)) {
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        x = x.level[0].forward;
        if (x != null && score == x.score && x.member.equals(member)) {
            deleteNode(x, update);
            nodes.remove(member);
            return true;
        }
        return false;
    }

    private void deleteNode(ZSkipListNode x, ZSkipListNode[] update) {
        // predecessors that pointed at x take over its forward; the others just lose one from their span
        for (int i = 0; i < this.level; i++) {
            if (update[i].level[i].forward == x) {
                update[i].level[i].span += x.level[i].span - 1;
                update[i].level[i].forward = x.level[i].forward;
            } else {
                update[i].level[i].span -= 1;
            }
        }

        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x.backward;
        } else {
            this.tail = x.backward;
        }

        // drop levels that only the header still uses
        while (this.level > 1 && this.header.level[this.level - 1].forward == null) {
            this.level--;
        }
        this.length--;
    }

    /**
     * @param rank 1-based
     */
    public ZSkipListNode getNodeByRank(long rank) {
        ZSkipListNode x = this.header;
        long traversed = 0;

        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && (traversed + x.level[i].span) <= rank) {
                traversed += x.level[i].span;
                x = x.level[i].forward;
            }
            if (traversed == rank) {
                return x == this.header ? null : x;
            }
        }
        return null;
    }

    /**
     * Nodes with 0-based rank in [start, stop], ascending. Negative indexes count from the tail,
     * both ends are clamped to the list.
     */
    public List<ZSkipListNode> rangeByRank(long start, long stop) {
        long[] bounds = clampRank(start, stop);
        if (bounds == null) return Collections.emptyList();

        List<ZSkipListNode> result = new ArrayList<>();
        ZSkipListNode node = getNodeByRank(bounds[0] + 1);
        long count = bounds[1] - bounds[0] + 1;
        while (count > 0 && node != null) {
            result.add(node);
            node = node.level[0].forward;
            count--;
        }
        return result;
    }

    /**
     * Like {@link #rangeByRank} but ranks count from the highest element and nodes come back descending.
     */
    public List<ZSkipListNode> revRangeByRank(long start, long stop) {
        long[] bounds = clampRank(start, stop);
        if (bounds == null) return Collections.emptyList();

        List<ZSkipListNode> result = new ArrayList<>();
        ZSkipListNode node = getNodeByRank(this.length - bounds[0]);
        long count = bounds[1] - bounds[0] + 1;
        while (count > 0 && node != null) {
            result.add(node);
            node = node.backward;
            count--;
        }
        return result;
    }

    private long[] clampRank(long start, long stop) {
        long size = this.length;
        if (start < 0) start = size + start;
        if (stop < 0) stop = size + stop;
        if (start < 0) start = 0;
        if (stop >= size) stop = size - 1;
        if (start > stop || start >= size) return null;
        return new long[]{start, stop};
    }

    // --- score ranges ---

    public boolean isInRange(RangeSpec range) {
        if (range.isEmpty()) return false;
        if (this.tail == null || !range.gteMin(this.tail.score)) return false;
        ZSkipListNode first = this.header.level[0].forward;
        return first != null && range.lteMax(first.score);
    }

    public ZSkipListNode firstInRange(RangeSpec range) {
        if (!isInRange(range)) return null;

        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && !range.gteMin(x.level[i].forward.score)) {
                x = x.level[i].forward;
            }
        }
        x = x.level[0].forward;
        return (x != null && range.lteMax(x.score)) ? x : null;
    }

    public ZSkipListNode lastInRange(RangeSpec range) {
        if (!isInRange(range)) return null;

        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && range.lteMax(x.level[i].forward.score)) {
                x = x.level[i].forward;
            }
        }
        return (x != this.header && range.gteMin(x.score)) ? x : null;
    }

    // --- lex ranges, only meaningful when every node has the same score ---

    public boolean isInLexRange(LexRangeSpec range) {
        if (range.isEmpty()) return false;
        if (this.tail == null || !range.gteMin(this.tail.member)) return false;
        ZSkipListNode first = this.header.level[0].forward;
        return first != null && range.lteMax(first.member);
    }

    public ZSkipListNode firstInLexRange(LexRangeSpec range) {
        if (!isInLexRange(range)) return null;

        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && !range.gteMin(x.level[i].forward.member)) {
                x = x.level[i].forward;
            }
        }
        x = x.level[0].forward;
        return (x != null && range.lteMax(x.member)) ? x : null;
    }

    public ZSkipListNode lastInLexRange(LexRangeSpec range) {
        if (!isInLexRange(range)) return null;

        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && range.lteMax(x.level[i].forward.member)) {
                x = x.level[i].forward;
            }
        }
        return (x != this.header && range.gteMin(x.member)) ? x : null;
    }

    // --- helpers ---

    public ZSkipListNode first() {
        return this.header.level[0].forward;
    }

    public ZSkipListNode last() {
        return this.tail;
    }

    public long length() {
        return length;
    }

    private int randomLevel() {
        int lvl = 1;
        while (lvl < ZSKIPLIST_MAXLEVEL && random.nextDouble() < ZSKIPLIST_P) {
            lvl++;
        }
        return lvl;
    }

    private static boolean precedes(ZSkipListNode node, double score, String member) {
        return node.score < score || (node.score == score && compareMembers(node.member, member) < 0);
    }

    /**
     * Code point order, which is the byte order of the UTF-8 encodings. String.compareTo orders
     * UTF-16 units and disagrees with it around surrogate pairs.
     */
    public static int compareMembers(String a, String b) {
        int i = 0, j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
