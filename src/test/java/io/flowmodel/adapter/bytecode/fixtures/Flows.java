package io.flowmodel.adapter.bytecode.fixtures;

import java.util.List;

/**
 * Small methods whose compiled form the loader tests rebuild.
 */
public final class Flows {

    private Flows() {
    }

    public static Object fieldFlow(Holder h, Object v) {
        h.f = v;
        return h.f;
    }

    public static Object chained(Holder a, Holder b, Object v) {
        a.f = b.f = v;
        return a.f;
    }

    public static Pair construct(Object a, Object b) {
        return new Pair(a, b);
    }

    public static void varargs(Object a, Object b) {
        sink(a, b);
    }

    public static void sink(Object... values) {
    }

    public static Object collections(List<Object> list, Object v) {
        list.add(v);
        return list.get(0);
    }

    public static Object arrays(Object v) {
        Object[] array = new Object[1];
        array[0] = v;
        return array[0];
    }

    public static Object[] initializer(Object v) {
        return new Object[]{v};
    }

    public static void publish(Object v) {
        Holder.g = v;
    }

    public static Object consume() {
        return Holder.g;
    }

    public static void flag() {
        boolean b = true;
        takeFlag(b);
        takeFlag(false);
    }

    public static void reusedLocal(Holder h, Pair p) {
        Object o = h;
        o = p;
        takePair((Pair) o);
    }

    static void takeFlag(boolean flag) {
    }

    static void takePair(Pair p) {
    }
}
