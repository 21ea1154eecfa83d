package io.flowmodel.adapter.bytecode.fixtures;

public class Pair {

    private final Object first;
    private final Object second;

    public Pair(Object first, Object second) {
        this.first = first;
        this.second = second;
    }

    public Object first() {
        return first;
    }

    public Object second() {
        return second;
    }
}
