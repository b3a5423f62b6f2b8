package io.instiflow.core;

import java.util.Objects;

/**
 * Carries a payload together with its position in the source order.
 */
public final class Record<T> implements Comparable<Record<?>> {
    private final long seq; // dense, starts at 0 for each source
    private final int subSeq; // fan-out index within one transform call
    private final T payload;

    public Record(long seq, int subSeq, T payload) {
        this.seq = seq;
        this.subSeq = subSeq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public int subSeq() { return subSeq; }
    public T payload() { return payload; }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(this.seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(this.subSeq, o.subSeq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && subSeq == that.subSeq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, subSeq, payload);
    }

    @Override
    public String toString() {
        return "Record{seq=" + seq + ", subSeq=" + subSeq + ", payload=" + payload + '}';
    }
}
