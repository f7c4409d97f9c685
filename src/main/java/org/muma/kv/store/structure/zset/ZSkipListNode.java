package org.muma.kv.store.structure.zset;

/**
 * ZSkipListNode, same layout as Redis zskiplistNode.
 * A score change never mutates a node: the list deletes it and inserts a fresh one.
 */
public class ZSkipListNode {

    public final String member;
    public final double score;

    public ZSkipListNode backward;
    public final ZSkipListLevel[] level;

    public ZSkipListNode(int level, double score, String member) {
        this.score = score;
        this.member = member;
        this.level = new ZSkipListLevel[level];
        for (int i = 0; i < level; i++) {
            this.level[i] = new ZSkipListLevel();
        }
    }

    public static class ZSkipListLevel {
        public ZSkipListNode forward;
        // number of level-0 nodes jumped by following forward
        public long span;
    }

    @Override
    public String toString() {
        return "Node{score=" + score + ", member='" + member + "'}";
    }
}
